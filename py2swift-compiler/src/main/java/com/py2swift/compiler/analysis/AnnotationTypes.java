package com.py2swift.compiler.analysis;

import com.py2swift.compiler.analysis.types.SwiftType;
import com.py2swift.compiler.analysis.types.SwiftTypes;
import com.py2swift.compiler.ast.expr.ConstantExpr;
import com.py2swift.compiler.ast.expr.Expression;
import com.py2swift.compiler.ast.expr.NameExpr;
import com.py2swift.compiler.ast.expr.SubscriptExpr;
import com.py2swift.compiler.ast.expr.TupleExpr;

import java.util.List;

/**
 * Python 类型注解到类型格的映射
 */
public final class AnnotationTypes {

    private AnnotationTypes() {}

    public static SwiftType toSwiftType(Expression annotation) {
        if (annotation instanceof NameExpr) {
            switch (((NameExpr) annotation).getId()) {
                case "int": return SwiftTypes.INT;
                case "float": return SwiftTypes.DOUBLE;
                case "str": return SwiftTypes.STRING;
                case "bool": return SwiftTypes.BOOL;
                case "list":
                case "List":
                    return SwiftTypes.ANY_ARRAY;
                case "dict":
                case "Dict":
                    return SwiftTypes.ANY_MAP;
                default: return SwiftTypes.ANY;
            }
        }
        if (annotation instanceof SubscriptExpr) {
            SubscriptExpr generic = (SubscriptExpr) annotation;
            if (!(generic.getValue() instanceof NameExpr)) {
                return SwiftTypes.ANY;
            }
            String base = ((NameExpr) generic.getValue()).getId();
            if ("List".equals(base) || "list".equals(base)) {
                return SwiftTypes.arrayOf(toSwiftType(generic.getIndex()));
            }
            if (("Dict".equals(base) || "dict".equals(base)) && generic.getIndex() instanceof TupleExpr) {
                List<Expression> args = ((TupleExpr) generic.getIndex()).getElements();
                if (args.size() == 2) {
                    return SwiftTypes.mapOf(toSwiftType(args.get(0)), toSwiftType(args.get(1)));
                }
            }
        }
        return SwiftTypes.ANY;
    }

    /** 返回值注解：None 映射为 Void */
    public static SwiftType toReturnType(Expression annotation) {
        if (annotation instanceof ConstantExpr && ((ConstantExpr) annotation).is(ConstantExpr.Kind.NONE)) {
            return SwiftTypes.VOID;
        }
        return toSwiftType(annotation);
    }
}
