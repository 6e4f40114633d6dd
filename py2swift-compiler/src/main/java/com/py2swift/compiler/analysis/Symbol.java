package com.py2swift.compiler.analysis;

import com.py2swift.compiler.analysis.types.SwiftType;
import com.py2swift.compiler.analysis.types.SwiftTypes;

/**
 * 符号表中的符号
 */
public final class Symbol {
    private final String name;
    private final SwiftType inferredType;
    private final boolean mutable;   // true = var, false = let
    private final String scopeKind;  // 所属作用域标签

    public Symbol(String name, SwiftType inferredType, boolean mutable, String scopeKind) {
        this.name = name;
        this.inferredType = inferredType != null ? inferredType : SwiftTypes.ANY;
        this.mutable = mutable;
        this.scopeKind = scopeKind;
    }

    public String getName() { return name; }
    public SwiftType getInferredType() { return inferredType; }
    public boolean isMutable() { return mutable; }
    public String getScopeKind() { return scopeKind; }

    @Override
    public String toString() {
        return (mutable ? "var " : "let ") + name + ": " + inferredType + " @" + scopeKind;
    }
}
