package com.py2swift.compiler.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 作用域帧：名称 → 符号的有序映射加作用域种类标签
 */
public final class Scope {

    public enum ScopeType {
        GLOBAL,     // 顶层
        FUNCTION,   // 函数体
        CLASS,      // 类体
        BLOCK       // 注释掉的代码块等临时帧
    }

    private final ScopeType type;
    private final String ownerName;  // 函数名 / 类名，GLOBAL 时为 null
    private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();

    public Scope(ScopeType type, String ownerName) {
        this.type = type;
        this.ownerName = ownerName;
    }

    public ScopeType getType() { return type; }
    public String getOwnerName() { return ownerName; }
    public Map<String, Symbol> getSymbols() { return Collections.unmodifiableMap(symbols); }

    /** 种类标签：global、func:&lt;name&gt;、class:&lt;name&gt;、block */
    public String getTag() {
        switch (type) {
            case FUNCTION: return "func:" + ownerName;
            case CLASS: return "class:" + ownerName;
            case BLOCK: return "block";
            default: return "global";
        }
    }

    /** 注册符号，同名时覆盖 */
    public void define(Symbol symbol) {
        symbols.put(symbol.getName(), symbol);
    }

    /** 仅查找当前作用域 */
    public Symbol resolveLocal(String name) {
        return symbols.get(name);
    }

    @Override
    public String toString() {
        return getTag() + symbols.keySet();
    }
}
