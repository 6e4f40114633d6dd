package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

/**
 * 一元表达式
 */
public class UnaryExpr extends Expression {
    private final Operator operator;
    private final Expression operand;

    public UnaryExpr(SourceLocation location, Operator operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    /**
     * 一元运算符
     */
    public enum Operator {
        NOT("!"),
        NEGATE("-"),
        PLUS("+"),
        INVERT("~");

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
        return visitor.visitUnary(this, context);
    }
}
