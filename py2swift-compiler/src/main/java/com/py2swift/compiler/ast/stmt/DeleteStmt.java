package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;
import com.py2swift.compiler.ast.expr.Expression;

import java.util.List;

/**
 * Del 语句
 */
public class DeleteStmt extends Statement {
    private final List<Expression> targets;

    public DeleteStmt(SourceLocation location, List<Expression> targets) {
        super(location);
        this.targets = targets;
    }

    public List<Expression> getTargets() {
        return targets;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitDelete(this, context);
    }
}
