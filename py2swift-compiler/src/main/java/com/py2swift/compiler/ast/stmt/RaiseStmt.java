package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;
import com.py2swift.compiler.ast.expr.Expression;

/**
 * Raise 语句
 */
public class RaiseStmt extends Statement {
    private final Expression exception;  // 可选
    private final Expression cause;  // 可选

    public RaiseStmt(SourceLocation location, Expression exception, Expression cause) {
        super(location);
        this.exception = exception;
        this.cause = cause;
    }

    public Expression getException() {
        return exception;
    }

    public Expression getCause() {
        return cause;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitRaise(this, context);
    }
}
