package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 字典推导式
 */
public class DictCompExpr extends Expression {
    private final Expression key;
    private final Expression value;
    private final List<Comprehension> generators;

    public DictCompExpr(SourceLocation location,
                        Expression key, Expression value, List<Comprehension> generators) {
        super(location);
        this.key = key;
        this.value = value;
        this.generators = generators;
    }

    public Expression getKey() {
        return key;
    }

    public Expression getValue() {
        return value;
    }

    public List<Comprehension> getGenerators() {
        return generators;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitDictComp(this, context);
    }
}
