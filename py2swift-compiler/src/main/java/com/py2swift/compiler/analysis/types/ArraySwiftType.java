package com.py2swift.compiler.analysis.types;

import java.util.Objects;

/**
 * 数组类型 [T]
 */
public final class ArraySwiftType extends SwiftType {
    private final SwiftType elementType;

    public ArraySwiftType(SwiftType elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType");
    }

    public SwiftType getElementType() { return elementType; }

    @Override
    public boolean isContainer() { return true; }

    @Override
    public String toSwiftString() {
        return "[" + elementType.toSwiftString() + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArraySwiftType)) return false;
        return elementType.equals(((ArraySwiftType) o).elementType);
    }

    @Override
    public int hashCode() {
        return 31 + elementType.hashCode();
    }
}
