package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 比较链 a < b <= c
 */
public class CompareExpr extends Expression {
    private final Expression left;
    private final List<Operator> operators;
    private final List<Expression> comparators;

    public CompareExpr(SourceLocation location,
                       Expression left, List<Operator> operators, List<Expression> comparators) {
        super(location);
        this.left = left;
        this.operators = operators;
        this.comparators = comparators;
    }

    public Expression getLeft() {
        return left;
    }

    public List<Operator> getOperators() {
        return operators;
    }

    public List<Expression> getComparators() {
        return comparators;
    }

    /**
     * 比较运算符
     */
    public enum Operator {
        EQ("=="),
        NOT_EQ("!="),
        LT("<"),
        LT_E("<="),
        GT(">"),
        GT_E(">="),
        IS("==="),
        IS_NOT("!=="),
        IN("in"),
        NOT_IN("not in");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        /** Swift 中对应的运算符；IN / NOT_IN 由生成器改写为 contains */
        public String getSymbol() {
            return symbol;
        }
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitCompare(this, context);
    }
}
