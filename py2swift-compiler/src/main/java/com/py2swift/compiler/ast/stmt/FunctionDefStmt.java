package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.Parameter;
import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;
import com.py2swift.compiler.ast.expr.Expression;
import com.py2swift.compiler.ast.expr.NameExpr;

import java.util.List;

/**
 * 函数定义（def / async def）
 */
public class FunctionDefStmt extends Statement {
    private final String name;
    private final List<Parameter> parameters;
    private final List<Statement> body;
    private final List<Expression> decorators;
    private final Expression returns;  // 可选
    private final boolean async;

    public FunctionDefStmt(SourceLocation location,
                           String name, List<Parameter> parameters, List<Statement> body,
                           List<Expression> decorators, Expression returns, boolean async) {
        super(location);
        this.name = name;
        this.parameters = parameters;
        this.body = body;
        this.decorators = decorators;
        this.returns = returns;
        this.async = async;
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Expression> getDecorators() {
        return decorators;
    }

    public Expression getReturns() {
        return returns;
    }

    public boolean isAsync() {
        return async;
    }

    public boolean hasDecorator(String name) {
        for (Expression decorator : decorators) {
            if (decorator instanceof NameExpr && ((NameExpr) decorator).getId().equals(name)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDef(this, context);
    }
}
