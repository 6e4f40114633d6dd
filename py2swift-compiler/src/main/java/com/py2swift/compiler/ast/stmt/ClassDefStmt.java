package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;
import com.py2swift.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 类定义
 */
public class ClassDefStmt extends Statement {
    private final String name;
    private final List<Expression> bases;
    private final List<Statement> body;
    private final List<Expression> decorators;

    public ClassDefStmt(SourceLocation location,
                        String name, List<Expression> bases, List<Statement> body,
                        List<Expression> decorators) {
        super(location);
        this.name = name;
        this.bases = bases;
        this.body = body;
        this.decorators = decorators;
    }

    public String getName() {
        return name;
    }

    public List<Expression> getBases() {
        return bases;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Expression> getDecorators() {
        return decorators;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitClassDef(this, context);
    }
}
