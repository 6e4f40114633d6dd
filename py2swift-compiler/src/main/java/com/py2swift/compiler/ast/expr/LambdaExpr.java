package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.Parameter;
import com.py2swift.compiler.ast.SourceLocation;

import java.util.List;

/**
 * Lambda 表达式
 */
public class LambdaExpr extends Expression {
    private final List<Parameter> parameters;
    private final Expression body;

    public LambdaExpr(SourceLocation location, List<Parameter> parameters, Expression body) {
        super(location);
        this.parameters = parameters;
        this.body = body;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitLambda(this, context);
    }
}
