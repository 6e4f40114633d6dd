package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;

import java.util.List;

/**
 * With 语句
 */
public class WithStmt extends Statement {
    private final List<WithItem> items;
    private final List<Statement> body;
    private final boolean async;

    public WithStmt(SourceLocation location, List<WithItem> items, List<Statement> body, boolean async) {
        super(location);
        this.items = items;
        this.body = body;
        this.async = async;
    }

    public List<WithItem> getItems() {
        return items;
    }

    public List<Statement> getBody() {
        return body;
    }

    public boolean isAsync() {
        return async;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitWith(this, context);
    }
}
