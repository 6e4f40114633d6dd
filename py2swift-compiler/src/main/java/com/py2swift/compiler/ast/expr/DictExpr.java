package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 字典字面量，** 展开项的 key 为 null
 */
public class DictExpr extends Expression {
    private final List<Expression> keys;
    private final List<Expression> values;

    public DictExpr(SourceLocation location, List<Expression> keys, List<Expression> values) {
        super(location);
        this.keys = keys;
        this.values = values;
    }

    public List<Expression> getKeys() {
        return keys;
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitDict(this, context);
    }
}
