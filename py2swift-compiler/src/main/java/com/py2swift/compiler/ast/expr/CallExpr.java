package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 函数调用
 */
public class CallExpr extends Expression {
    private final Expression function;
    private final List<Expression> args;
    private final List<Keyword> keywords;

    public CallExpr(SourceLocation location,
                    Expression function, List<Expression> args, List<Keyword> keywords) {
        super(location);
        this.function = function;
        this.args = args;
        this.keywords = keywords;
    }

    public Expression getFunction() {
        return function;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public List<Keyword> getKeywords() {
        return keywords;
    }

    /** 按名称查找关键字参数 */
    public Expression keyword(String name) {
        for (Keyword keyword : keywords) {
            if (name.equals(keyword.getName())) {
                return keyword.getValue();
            }
        }
        return null;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitCall(this, context);
    }
}
