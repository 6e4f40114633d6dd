package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

/**
 * 海象赋值 target := value
 */
public class NamedExpr extends Expression {
    private final String target;
    private final Expression value;

    public NamedExpr(SourceLocation location, String target, Expression value) {
        super(location);
        this.target = target;
        this.value = value;
    }

    public String getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitNamed(this, context);
    }
}
