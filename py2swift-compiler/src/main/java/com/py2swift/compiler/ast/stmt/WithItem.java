package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.expr.Expression;

/**
 * with 子句中的单个上下文管理器
 */
public final class WithItem {
    private final Expression contextExpr;
    private final Expression optionalVars;  // as 目标，可选

    public WithItem(Expression contextExpr, Expression optionalVars) {
        this.contextExpr = contextExpr;
        this.optionalVars = optionalVars;
    }

    public Expression getContextExpr() {
        return contextExpr;
    }

    public Expression getOptionalVars() {
        return optionalVars;
    }
}
