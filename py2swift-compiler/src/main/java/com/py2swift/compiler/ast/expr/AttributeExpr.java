package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

/**
 * 属性访问 value.attr
 */
public class AttributeExpr extends Expression {
    private final Expression value;
    private final String attr;

    public AttributeExpr(SourceLocation location, Expression value, String attr) {
        super(location);
        this.value = value;
        this.attr = attr;
    }

    public Expression getValue() {
        return value;
    }

    public String getAttr() {
        return attr;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitAttribute(this, context);
    }
}
