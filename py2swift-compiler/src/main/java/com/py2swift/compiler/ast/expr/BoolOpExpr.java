package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 布尔运算 and / or（同一运算符的连续操作数被展平）
 */
public class BoolOpExpr extends Expression {
    private final Operator operator;
    private final List<Expression> values;

    public BoolOpExpr(SourceLocation location, Operator operator, List<Expression> values) {
        super(location);
        this.operator = operator;
        this.values = values;
    }

    public Operator getOperator() {
        return operator;
    }

    public List<Expression> getValues() {
        return values;
    }

    /**
     * 布尔运算符
     */
    public enum Operator {
        AND("&&"),
        OR("||");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitBoolOp(this, context);
    }
}
