package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;
import com.py2swift.compiler.ast.expr.Expression;

/**
 * Assert 语句
 */
public class AssertStmt extends Statement {
    private final Expression test;
    private final Expression message;  // 可选

    public AssertStmt(SourceLocation location, Expression test, Expression message) {
        super(location);
        this.test = test;
        this.message = message;
    }

    public Expression getTest() {
        return test;
    }

    public Expression getMessage() {
        return message;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAssert(this, context);
    }
}
