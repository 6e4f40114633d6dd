package com.py2swift.compiler.analysis.types;

import java.util.Objects;

/**
 * 字典类型 [K: V]
 */
public final class MapSwiftType extends SwiftType {
    private final SwiftType keyType;
    private final SwiftType valueType;

    public MapSwiftType(SwiftType keyType, SwiftType valueType) {
        this.keyType = Objects.requireNonNull(keyType, "keyType");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
    }

    public SwiftType getKeyType() { return keyType; }
    public SwiftType getValueType() { return valueType; }

    @Override
    public boolean isContainer() { return true; }

    @Override
    public String toSwiftString() {
        return "[" + keyType.toSwiftString() + ": " + valueType.toSwiftString() + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MapSwiftType)) return false;
        MapSwiftType that = (MapSwiftType) o;
        return keyType.equals(that.keyType) && valueType.equals(that.valueType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyType, valueType);
    }
}
