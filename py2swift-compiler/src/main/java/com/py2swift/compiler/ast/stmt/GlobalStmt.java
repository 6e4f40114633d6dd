package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;

import java.util.List;

/**
 * Global 声明
 */
public class GlobalStmt extends Statement {
    private final List<String> names;

    public GlobalStmt(SourceLocation location, List<String> names) {
        super(location);
        this.names = names;
    }

    public List<String> getNames() {
        return names;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitGlobal(this, context);
    }
}
