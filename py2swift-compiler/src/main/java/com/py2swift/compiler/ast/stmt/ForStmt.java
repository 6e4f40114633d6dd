package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;
import com.py2swift.compiler.ast.expr.Expression;

import java.util.List;

/**
 * For 循环
 */
public class ForStmt extends Statement {
    private final Expression target;
    private final Expression iter;
    private final List<Statement> body;
    private final List<Statement> orElse;
    private final boolean async;

    public ForStmt(SourceLocation location,
                   Expression target, Expression iter, List<Statement> body, List<Statement> orElse,
                   boolean async) {
        super(location);
        this.target = target;
        this.iter = iter;
        this.body = body;
        this.orElse = orElse;
        this.async = async;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIter() {
        return iter;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getOrElse() {
        return orElse;
    }

    public boolean isAsync() {
        return async;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitFor(this, context);
    }
}
