package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

/**
 * 切片 lower:upper:step
 */
public class SliceExpr extends Expression {
    private final Expression lower;  // 可选
    private final Expression upper;  // 可选
    private final Expression step;  // 可选

    public SliceExpr(SourceLocation location, Expression lower, Expression upper, Expression step) {
        super(location);
        this.lower = lower;
        this.upper = upper;
        this.step = step;
    }

    public Expression getLower() {
        return lower;
    }

    public Expression getUpper() {
        return upper;
    }

    public Expression getStep() {
        return step;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitSlice(this, context);
    }
}
