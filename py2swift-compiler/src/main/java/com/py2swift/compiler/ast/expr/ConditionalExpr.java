package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

/**
 * 条件表达式 body if test else orElse
 */
public class ConditionalExpr extends Expression {
    private final Expression test;
    private final Expression body;
    private final Expression orElse;

    public ConditionalExpr(SourceLocation location, Expression test, Expression body, Expression orElse) {
        super(location);
        this.test = test;
        this.body = body;
        this.orElse = orElse;
    }

    public Expression getTest() {
        return test;
    }

    public Expression getBody() {
        return body;
    }

    public Expression getOrElse() {
        return orElse;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitConditional(this, context);
    }
}
