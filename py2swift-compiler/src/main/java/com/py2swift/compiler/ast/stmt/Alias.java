package com.py2swift.compiler.ast.stmt;

/**
 * 导入名及其别名
 */
public final class Alias {
    private final String name;
    private final String asName;  // 可选

    public Alias(String name, String asName) {
        this.name = name;
        this.asName = asName;
    }

    public String getName() {
        return name;
    }

    public String getAsName() {
        return asName;
    }

    @Override
    public String toString() {
        return asName != null ? name + " as " + asName : name;
    }
}
