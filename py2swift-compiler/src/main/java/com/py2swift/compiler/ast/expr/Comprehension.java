package com.py2swift.compiler.ast.expr;

import java.util.List;

/**
 * 推导式中的一个 for 子句及其 if 过滤条件
 */
public final class Comprehension {
    private final Expression target;
    private final Expression iter;
    private final List<Expression> ifs;
    private final boolean async;

    public Comprehension(Expression target, Expression iter, List<Expression> ifs, boolean async) {
        this.target = target;
        this.iter = iter;
        this.ifs = ifs;
        this.async = async;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIter() {
        return iter;
    }

    public List<Expression> getIfs() {
        return ifs;
    }

    public boolean isAsync() {
        return async;
    }
}
