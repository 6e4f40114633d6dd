package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 生成器表达式
 */
public class GeneratorExpr extends Expression {
    private final Expression element;
    private final List<Comprehension> generators;

    public GeneratorExpr(SourceLocation location, Expression element, List<Comprehension> generators) {
        super(location);
        this.element = element;
        this.generators = generators;
    }

    public Expression getElement() {
        return element;
    }

    public List<Comprehension> getGenerators() {
        return generators;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitGenerator(this, context);
    }
}
