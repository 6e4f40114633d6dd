package com.py2swift.compiler.codegen;

/**
 * Swift 运算符优先级（数值越大结合越紧），用于决定是否加括号
 */
public final class SwiftPrecedence {
    public static final int LOWEST = 0;
    public static final int TERNARY = 1;
    public static final int DISJUNCTION = 2;
    public static final int CONJUNCTION = 3;
    public static final int COMPARISON = 4;
    public static final int NIL_COALESCING = 5;
    public static final int CASTING = 6;
    public static final int RANGE = 7;
    public static final int ADDITION = 8;
    public static final int MULTIPLICATION = 9;
    public static final int SHIFT = 10;
    public static final int PREFIX = 11;
    public static final int POSTFIX = 12;

    private SwiftPrecedence() {}
}
