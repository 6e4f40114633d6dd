package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final Operator operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, Operator operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitBinary(this, context);
    }

    /**
     * 二元运算符
     */
    public enum Operator {
        // 算术
        ADD("+"),
        SUB("-"),
        MULT("*"),
        DIV("/"),
        FLOOR_DIV("//"),
        MOD("%"),
        POW("**"),
        MAT_MULT("@"),

        // 位运算
        LSHIFT("<<"),
        RSHIFT(">>"),
        BIT_OR("|"),
        BIT_XOR("^"),
        BIT_AND("&");

        private final String source;

        Operator(String source) {
            this.source = source;
        }

        /** 返回 Python 源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public boolean isArithmetic() {
            return ordinal() <= MAT_MULT.ordinal();
        }
    }
}
