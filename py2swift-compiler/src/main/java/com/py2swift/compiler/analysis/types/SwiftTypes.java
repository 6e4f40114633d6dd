package com.py2swift.compiler.analysis.types;

import java.util.Collection;

/**
 * 类型常量与数值提升规则
 */
public final class SwiftTypes {

    private SwiftTypes() {}

    public static final PrimitiveSwiftType INT = new PrimitiveSwiftType("Int");
    public static final PrimitiveSwiftType DOUBLE = new PrimitiveSwiftType("Double");
    public static final PrimitiveSwiftType BOOL = new PrimitiveSwiftType("Bool");
    public static final PrimitiveSwiftType STRING = new PrimitiveSwiftType("String");
    public static final PrimitiveSwiftType VOID = new PrimitiveSwiftType("Void");
    public static final PrimitiveSwiftType ANY = new PrimitiveSwiftType("Any");

    /** 无法确定元素类型时的列表 / 字典 */
    public static final ArraySwiftType ANY_ARRAY = new ArraySwiftType(ANY);
    public static final MapSwiftType ANY_MAP = new MapSwiftType(STRING, ANY);

    public static ArraySwiftType arrayOf(SwiftType element) {
        return new ArraySwiftType(element);
    }

    public static MapSwiftType mapOf(SwiftType key, SwiftType value) {
        return new MapSwiftType(key, value);
    }

    /**
     * 数值提升：Int + Int = Int，任一为 Double 则为 Double，非数值返回 null
     */
    public static SwiftType promoteNumeric(SwiftType left, SwiftType right) {
        if (left == null || right == null || !left.isNumeric() || !right.isNumeric()) {
            return null;
        }
        return left.isDouble() || right.isDouble() ? DOUBLE : INT;
    }

    /**
     * 所有元素类型一致时返回该类型，否则返回 null（空集合也返回 null）
     */
    public static SwiftType unanimous(Collection<SwiftType> types) {
        SwiftType result = null;
        for (SwiftType type : types) {
            if (result == null) {
                result = type;
            } else if (!result.equals(type)) {
                return null;
            }
        }
        return result;
    }
}
