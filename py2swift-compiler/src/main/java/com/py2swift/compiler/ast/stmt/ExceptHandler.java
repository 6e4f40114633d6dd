package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.AstNode;
import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.expr.Expression;

import java.util.List;

/**
 * except 子句
 */
public class ExceptHandler extends AstNode {
    private final Expression type;  // 裸 except 时为 null
    private final String name;      // as 绑定名，可选
    private final List<Statement> body;

    public ExceptHandler(SourceLocation location, Expression type, String name, List<Statement> body) {
        super(location);
        this.type = type;
        this.name = name;
        this.body = body;
    }

    public Expression getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public List<Statement> getBody() {
        return body;
    }

    public boolean isCatchAll() {
        return type == null;
    }
}
