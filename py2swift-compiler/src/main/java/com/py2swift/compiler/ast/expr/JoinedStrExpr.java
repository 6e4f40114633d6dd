package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

import java.util.List;

/**
 * f-string，由字符串常量和插值片段组成
 */
public class JoinedStrExpr extends Expression {
    private final List<Expression> values;

    public JoinedStrExpr(SourceLocation location, List<Expression> values) {
        super(location);
        this.values = values;
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitJoinedStr(this, context);
    }
}
