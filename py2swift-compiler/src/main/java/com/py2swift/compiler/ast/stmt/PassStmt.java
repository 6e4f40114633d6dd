package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;

/**
 * Pass 语句
 */
public class PassStmt extends Statement {
    public PassStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitPass(this, context);
    }
}
