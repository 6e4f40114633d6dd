package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;
import com.py2swift.compiler.ast.expr.Expression;

/**
 * 带类型注解的赋值
 */
public class AnnAssignStmt extends Statement {
    private final Expression target;
    private final Expression annotation;
    private final Expression value;  // 可选

    public AnnAssignStmt(SourceLocation location,
                         Expression target, Expression annotation, Expression value) {
        super(location);
        this.target = target;
        this.annotation = annotation;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getAnnotation() {
        return annotation;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAnnAssign(this, context);
    }
}
