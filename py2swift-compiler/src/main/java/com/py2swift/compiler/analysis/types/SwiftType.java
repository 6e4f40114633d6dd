package com.py2swift.compiler.analysis.types;

/**
 * 推断类型格的抽象基类
 *
 * <p>闭合集合：Int、Double、Bool、String、Void、Any、[T]、[K: V]。
 * {@link #toString()} 即 Swift 语法形式。</p>
 */
public abstract class SwiftType {

    /** Swift 源码中的类型写法 */
    public abstract String toSwiftString();

    public boolean isAny() { return this == SwiftTypes.ANY; }
    public boolean isVoid() { return this == SwiftTypes.VOID; }
    public boolean isInt() { return this == SwiftTypes.INT; }
    public boolean isDouble() { return this == SwiftTypes.DOUBLE; }
    public boolean isNumeric() { return isInt() || isDouble(); }
    public boolean isString() { return this == SwiftTypes.STRING; }
    public boolean isBool() { return this == SwiftTypes.BOOL; }

    /** 是否为容器（数组或字典） */
    public boolean isContainer() { return false; }

    @Override
    public final String toString() {
        return toSwiftString();
    }
}
