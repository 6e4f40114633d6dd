package com.py2swift.compiler.codegen;

import com.py2swift.compiler.ast.expr.Expression;
import com.py2swift.compiler.ast.expr.ListExpr;
import com.py2swift.compiler.ast.expr.NameExpr;
import com.py2swift.compiler.ast.expr.TupleExpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 元组 / 列表形式的赋值目标
 */
final class TupleTargets {

    private TupleTargets() {}

    static boolean isSequence(Expression expr) {
        return expr instanceof TupleExpr || expr instanceof ListExpr;
    }

    static List<Expression> elements(Expression expr) {
        if (expr instanceof TupleExpr) return ((TupleExpr) expr).getElements();
        if (expr instanceof ListExpr) return ((ListExpr) expr).getElements();
        return Collections.emptyList();
    }

    /**
     * 目标中的名称：单个名称或由名称组成的一层元组，其他形式返回 null
     */
    static List<String> names(Expression target) {
        List<String> names = new ArrayList<String>();
        if (target instanceof NameExpr) {
            names.add(((NameExpr) target).getId());
            return names;
        }
        if (!isSequence(target)) {
            return null;
        }
        for (Expression element : elements(target)) {
            if (!(element instanceof NameExpr)) {
                return null;
            }
            names.add(((NameExpr) element).getId());
        }
        return names;
    }

    /** 递归收集所有名称（嵌套元组也展开） */
    static void collectNames(Expression target, List<String> out) {
        if (target instanceof NameExpr) {
            out.add(((NameExpr) target).getId());
        } else if (isSequence(target)) {
            for (Expression element : elements(target)) {
                collectNames(element, out);
            }
        }
    }
}
