package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;

/**
 * Break 语句
 */
public class BreakStmt extends Statement {
    public BreakStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitBreak(this, context);
    }
}
