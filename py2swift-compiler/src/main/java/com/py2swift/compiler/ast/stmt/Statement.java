package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.AstNode;
import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(StmtVisitor<R, C> visitor, C context);
}
