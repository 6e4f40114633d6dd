package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;

import java.util.List;

/**
 * 模块（顶层语句序列）
 */
public class Module extends Statement {
    private final List<Statement> body;

    public Module(SourceLocation location, List<Statement> body) {
        super(location);
        this.body = body;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitModule(this, context);
    }
}
