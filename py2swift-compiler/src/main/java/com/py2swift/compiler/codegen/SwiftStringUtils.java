package com.py2swift.compiler.codegen;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Swift 字面量与标识符工具
 */
public final class SwiftStringUtils {

    /** Python 中合法、在 Swift 中为保留字的标识符 */
    private static final Set<String> SWIFT_KEYWORDS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "associatedtype", "case", "default", "defer", "deinit", "do", "enum", "extension", "fallthrough",
            "fileprivate", "func", "guard", "init", "inout", "internal", "let", "operator", "private",
            "protocol", "public", "repeat", "rethrows", "static", "struct", "subscript", "switch",
            "throw", "throws", "typealias", "var", "where", "super", "true", "false", "nil"
    )));

    private SwiftStringUtils() {}

    /**
     * 转义字符串值（解码后的值，只转义一次）
     */
    public static String escape(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\0': sb.append("\\0"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    /** 双引号字符串字面量 */
    public static String quote(String s) {
        return "\"" + escape(s) + "\"";
    }

    /**
     * 标识符：与 Swift 保留字冲突时加反引号
     */
    public static String identifier(String name) {
        return SWIFT_KEYWORDS.contains(name) ? "`" + name + "`" : name;
    }

    public static boolean isSwiftKeyword(String name) {
        return SWIFT_KEYWORDS.contains(name);
    }
}
