package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;
import com.py2swift.compiler.ast.expr.BinaryExpr;
import com.py2swift.compiler.ast.expr.Expression;

/**
 * 增量赋值（+= 等）
 */
public class AugAssignStmt extends Statement {
    private final Expression target;
    private final BinaryExpr.Operator operator;
    private final Expression value;

    public AugAssignStmt(SourceLocation location,
                         Expression target, BinaryExpr.Operator operator, Expression value) {
        super(location);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public BinaryExpr.Operator getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAugAssign(this, context);
    }
}
