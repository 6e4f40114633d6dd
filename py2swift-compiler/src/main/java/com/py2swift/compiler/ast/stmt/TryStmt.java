package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;

import java.util.List;

/**
 * Try 语句
 */
public class TryStmt extends Statement {
    private final List<Statement> body;
    private final List<ExceptHandler> handlers;
    private final List<Statement> orElse;
    private final List<Statement> finalBody;

    public TryStmt(SourceLocation location,
                   List<Statement> body, List<ExceptHandler> handlers, List<Statement> orElse,
                   List<Statement> finalBody) {
        super(location);
        this.body = body;
        this.handlers = handlers;
        this.orElse = orElse;
        this.finalBody = finalBody;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<ExceptHandler> getHandlers() {
        return handlers;
    }

    public List<Statement> getOrElse() {
        return orElse;
    }

    public List<Statement> getFinalBody() {
        return finalBody;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitTry(this, context);
    }
}
