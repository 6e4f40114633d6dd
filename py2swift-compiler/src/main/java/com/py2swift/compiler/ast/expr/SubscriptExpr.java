package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

/**
 * 下标访问
 */
public class SubscriptExpr extends Expression {
    private final Expression value;
    private final Expression index;  // 切片时为 SliceExpr，多维为 TupleExpr

    public SubscriptExpr(SourceLocation location, Expression value, Expression index) {
        super(location);
        this.value = value;
        this.index = index;
    }

    public Expression getValue() {
        return value;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitSubscript(this, context);
    }
}
