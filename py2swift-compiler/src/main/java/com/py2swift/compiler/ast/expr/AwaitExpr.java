package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

/**
 * await 表达式
 */
public class AwaitExpr extends Expression {
    private final Expression value;

    public AwaitExpr(SourceLocation location, Expression value) {
        super(location);
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitAwait(this, context);
    }
}
