package com.py2swift.compiler.analysis.types;

/**
 * 原子类型：Int / Double / Bool / String / Void / Any
 */
public final class PrimitiveSwiftType extends SwiftType {
    private final String name;

    PrimitiveSwiftType(String name) {
        this.name = name;
    }

    public String getName() { return name; }

    @Override
    public String toSwiftString() {
        return name;
    }

    // 原子类型均为 SwiftTypes 中的单例，使用默认 identity equals
}
