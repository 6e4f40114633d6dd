package com.py2swift.compiler.ast;

import com.py2swift.compiler.ast.expr.Expression;

/**
 * 函数 / lambda 参数
 */
public class Parameter extends AstNode {
    private final String name;
    private final Expression annotation;    // 可选
    private final Expression defaultValue;  // 可选
    private final Kind kind;

    public Parameter(SourceLocation location, String name, Expression annotation,
                     Expression defaultValue, Kind kind) {
        super(location);
        this.name = name;
        this.annotation = annotation;
        this.defaultValue = defaultValue;
        this.kind = kind;
    }

    public String getName() {
        return name;
    }

    public Expression getAnnotation() {
        return annotation;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isVararg() {
        return kind == Kind.VARARG;
    }

    public boolean isKwarg() {
        return kind == Kind.KWARG;
    }

    /**
     * 参数种类
     */
    public enum Kind {
        POSITIONAL,
        KEYWORD_ONLY,
        /** *args */
        VARARG,
        /** **kwargs */
        KWARG
    }
}
