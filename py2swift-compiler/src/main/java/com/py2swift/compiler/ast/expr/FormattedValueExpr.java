package com.py2swift.compiler.ast.expr;

import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.SourceLocation;

/**
 * f-string 中的插值片段 {value!conversion:spec}
 */
public class FormattedValueExpr extends Expression {
    private final Expression value;
    private final char conversion;  // 无转换时为 0
    private final JoinedStrExpr formatSpec;  // 可选

    public FormattedValueExpr(SourceLocation location,
                              Expression value, char conversion, JoinedStrExpr formatSpec) {
        super(location);
        this.value = value;
        this.conversion = conversion;
        this.formatSpec = formatSpec;
    }

    public Expression getValue() {
        return value;
    }

    public char getConversion() {
        return conversion;
    }

    public JoinedStrExpr getFormatSpec() {
        return formatSpec;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitFormattedValue(this, context);
    }
}
