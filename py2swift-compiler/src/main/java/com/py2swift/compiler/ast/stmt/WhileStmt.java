package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;
import com.py2swift.compiler.ast.expr.Expression;

import java.util.List;

/**
 * While 循环
 */
public class WhileStmt extends Statement {
    private final Expression test;
    private final List<Statement> body;
    private final List<Statement> orElse;

    public WhileStmt(SourceLocation location, Expression test, List<Statement> body, List<Statement> orElse) {
        super(location);
        this.test = test;
        this.body = body;
        this.orElse = orElse;
    }

    public Expression getTest() {
        return test;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getOrElse() {
        return orElse;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitWhile(this, context);
    }
}
