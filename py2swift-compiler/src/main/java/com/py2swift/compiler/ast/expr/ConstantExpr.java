package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

import java.math.BigInteger;

/**
 * 字面量常量
 *
 * <p>数字常量同时保留源码文本，便于原样输出（十六进制、下划线分隔等）。</p>
 */
public class ConstantExpr extends Expression {
    private final Kind kind;
    private final Object value;
    private final String sourceText;

    public ConstantExpr(SourceLocation location, Kind kind, Object value, String sourceText) {
        super(location);
        this.kind = kind;
        this.value = value;
        this.sourceText = sourceText;
    }

    public static ConstantExpr ofString(SourceLocation location, String value) {
        return new ConstantExpr(location, Kind.STRING, value, null);
    }

    public static ConstantExpr ofInt(SourceLocation location, long value) {
        return new ConstantExpr(location, Kind.INT, BigInteger.valueOf(value), String.valueOf(value));
    }

    public Kind getKind() {
        return kind;
    }

    public Object getValue() {
        return value;
    }

    public String getSourceText() {
        return sourceText;
    }

    public boolean is(Kind kind) {
        return this.kind == kind;
    }

    /** 字符串常量的值 */
    public String getStringValue() {
        return (String) value;
    }

    public boolean isNumeric() {
        return kind == Kind.INT || kind == Kind.FLOAT;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitConstant(this, context);
    }

    /**
     * 常量种类
     */
    public enum Kind {
        INT,
        FLOAT,
        IMAGINARY,
        STRING,
        BOOL,
        NONE,
        ELLIPSIS
    }
}
