package com.py2swift.compiler.ast.expr;

/**
 * 调用中的关键字参数 name=value；**mapping 展开时 name 为 null
 */
public final class Keyword {
    private final String name;
    private final Expression value;

    public Keyword(String name, Expression value) {
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    public boolean isUnpacking() {
        return name == null;
    }
}
