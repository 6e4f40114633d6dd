package com.py2swift.compiler.analysis;

import com.py2swift.compiler.analysis.types.SwiftType;
import com.py2swift.compiler.analysis.types.SwiftTypes;
import com.py2swift.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 函数签名：按声明顺序的参数类型与返回类型
 */
public final class FunctionSignature {
    private final String name;
    private final Map<String, SwiftType> paramTypes = new LinkedHashMap<String, SwiftType>();
    private SwiftType returnType;          // 未标注时在第二遍推断前为 null
    private final boolean returnAnnotated;
    private final Set<String> keywordOnly = new HashSet<String>();
    private final Map<String, Expression> defaults = new LinkedHashMap<String, Expression>();
    private String variadic;

    public FunctionSignature(String name, SwiftType returnType) {
        this.name = name;
        this.returnType = returnType;
        this.returnAnnotated = returnType != null;
    }

    public String getName() { return name; }
    public Map<String, SwiftType> getParamTypes() { return Collections.unmodifiableMap(paramTypes); }
    public boolean isReturnAnnotated() { return returnAnnotated; }
    public boolean isReturnResolved() { return returnType != null; }

    /** 参数类型，未知参数返回 null */
    public SwiftType getParamType(String param) {
        return paramTypes.get(param);
    }

    public boolean hasParam(String param) {
        return paramTypes.containsKey(param);
    }

    public void setParamType(String param, SwiftType type) {
        paramTypes.put(param, type);
    }

    /** 仅关键字参数（位于 * 之后），调用时需带标签 */
    public void markKeywordOnly(String param) {
        keywordOnly.add(param);
    }

    public boolean isKeywordOnly(String param) {
        return keywordOnly.contains(param);
    }

    public void setDefault(String param, Expression value) {
        defaults.put(param, value);
    }

    /** 参数默认值表达式，无默认值返回 null */
    public Expression getDefault(String param) {
        return defaults.get(param);
    }

    public void markVariadic(String param) {
        this.variadic = param;
    }

    /** *args 参数名，没有时为 null */
    public String getVariadic() {
        return variadic;
    }

    /** 尚未推断时视为 Any */
    public SwiftType getReturnType() {
        return returnType != null ? returnType : SwiftTypes.ANY;
    }

    public void setReturnType(SwiftType returnType) {
        this.returnType = returnType;
    }

    @Override
    public String toString() {
        return name + paramTypes + " -> " + getReturnType();
    }
}
