package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

/**
 * 名称引用
 */
public class NameExpr extends Expression {
    private final String id;

    public NameExpr(SourceLocation location, String id) {
        super(location);
        this.id = id;
    }

    public String getId() {
        return id;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitName(this, context);
    }
}
