package com.py2swift.compiler.analysis;

import com.py2swift.compiler.ast.AstScanner;
import com.py2swift.compiler.ast.expr.ConstantExpr;
import com.py2swift.compiler.ast.expr.Expression;
import com.py2swift.compiler.ast.expr.LambdaExpr;
import com.py2swift.compiler.ast.stmt.ClassDefStmt;
import com.py2swift.compiler.ast.stmt.FunctionDefStmt;
import com.py2swift.compiler.ast.stmt.ReturnStmt;

import java.util.ArrayList;
import java.util.List;

/**
 * 收集函数体内带值的 return，不进入嵌套定义；裸 return 与 return None 不计入
 */
public final class ReturnValues extends AstScanner<Void> {
    private final List<Expression> values = new ArrayList<Expression>();

    private ReturnValues() {}

    public static List<Expression> of(FunctionDefStmt function) {
        ReturnValues collector = new ReturnValues();
        collector.scanStatements(function.getBody(), null);
        return collector.values;
    }

    @Override
    public Void visitReturn(ReturnStmt node, Void ctx) {
        Expression value = node.getValue();
        if (value != null && !(value instanceof ConstantExpr && ((ConstantExpr) value).is(ConstantExpr.Kind.NONE))) {
            values.add(value);
        }
        return null;
    }

    @Override
    public Void visitFunctionDef(FunctionDefStmt node, Void ctx) {
        return null;
    }

    @Override
    public Void visitClassDef(ClassDefStmt node, Void ctx) {
        return null;
    }

    @Override
    public Void visitLambda(LambdaExpr node, Void ctx) {
        return null;
    }
}
