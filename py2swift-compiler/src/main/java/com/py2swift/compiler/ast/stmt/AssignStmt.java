package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;
import com.py2swift.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 赋值语句，链式赋值 a = b = 1 有多个目标
 */
public class AssignStmt extends Statement {
    private final List<Expression> targets;
    private final Expression value;

    public AssignStmt(SourceLocation location, List<Expression> targets, Expression value) {
        super(location);
        this.targets = targets;
        this.value = value;
    }

    public List<Expression> getTargets() {
        return targets;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAssign(this, context);
    }
}
