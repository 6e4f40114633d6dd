package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.AstNode;
import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(ExprVisitor<R, C> visitor, C context);
}
