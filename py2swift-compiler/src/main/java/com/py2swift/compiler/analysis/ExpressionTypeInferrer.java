package com.py2swift.compiler.analysis;

import com.py2swift.compiler.analysis.types.ArraySwiftType;
import com.py2swift.compiler.analysis.types.MapSwiftType;
import com.py2swift.compiler.analysis.types.SwiftType;
import com.py2swift.compiler.analysis.types.SwiftTypes;
import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.expr.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 表达式类型推断（纯结构化，不做流分析）
 *
 * <p>结果永不为 null，无法确定时为 {@link SwiftTypes#ANY}。</p>
 */
public final class ExpressionTypeInferrer implements ExprVisitor<SwiftType, Void> {

    /** 返回类型固定的内置函数 */
    private static final Map<String, SwiftType> BUILTIN_RETURN_TYPES;

    /** 返回类型固定的方法 */
    private static final Map<String, SwiftType> METHOD_RETURN_TYPES;

    static {
        Map<String, SwiftType> builtins = new HashMap<String, SwiftType>();
        builtins.put("int", SwiftTypes.INT);
        builtins.put("len", SwiftTypes.INT);
        builtins.put("float", SwiftTypes.DOUBLE);
        builtins.put("str", SwiftTypes.STRING);
        builtins.put("input", SwiftTypes.STRING);
        builtins.put("bool", SwiftTypes.BOOL);
        builtins.put("any", SwiftTypes.BOOL);
        builtins.put("all", SwiftTypes.BOOL);
        builtins.put("isinstance", SwiftTypes.BOOL);
        builtins.put("print", SwiftTypes.VOID);
        builtins.put("dict", SwiftTypes.ANY_MAP);
        BUILTIN_RETURN_TYPES = Collections.unmodifiableMap(builtins);

        Map<String, SwiftType> methods = new HashMap<String, SwiftType>();
        methods.put("lower", SwiftTypes.STRING);
        methods.put("upper", SwiftTypes.STRING);
        methods.put("strip", SwiftTypes.STRING);
        methods.put("replace", SwiftTypes.STRING);
        methods.put("join", SwiftTypes.STRING);
        methods.put("split", SwiftTypes.arrayOf(SwiftTypes.STRING));
        methods.put("startswith", SwiftTypes.BOOL);
        methods.put("endswith", SwiftTypes.BOOL);
        METHOD_RETURN_TYPES = Collections.unmodifiableMap(methods);
    }

    private final Map<String, SwiftType> varTypes;
    private final Map<String, FunctionSignature> signatures;
    private final Deque<FunctionSignature> functionStack = new ArrayDeque<FunctionSignature>();
    private final Deque<Map<String, SwiftType>> localBindings = new ArrayDeque<Map<String, SwiftType>>();

    public ExpressionTypeInferrer(Map<String, SwiftType> varTypes, Map<String, FunctionSignature> signatures) {
        this.varTypes = varTypes;
        this.signatures = signatures;
    }

    /** 推断表达式类型 */
    public SwiftType infer(Expression expr) {
        if (expr == null) return SwiftTypes.ANY;
        SwiftType type = expr.accept(this, null);
        return type != null ? type : SwiftTypes.ANY;
    }

    // ============ 函数上下文 ============

    /** 进入函数体，参数名可按签名解析 */
    public void enterFunction(FunctionSignature signature) {
        functionStack.push(signature);
    }

    public void exitFunction() {
        if (!functionStack.isEmpty()) {
            functionStack.pop();
        }
    }

    /** 推导式循环变量的临时绑定 */
    public void pushBinding(String name, SwiftType type) {
        Map<String, SwiftType> frame = new HashMap<String, SwiftType>();
        frame.put(name, type);
        localBindings.push(frame);
    }

    public void popBinding() {
        if (!localBindings.isEmpty()) {
            localBindings.pop();
        }
    }

    /** 名称解析顺序：推导式绑定 → 变量表 → 外层函数参数 */
    public SwiftType resolveName(String name) {
        for (Map<String, SwiftType> frame : localBindings) {
            SwiftType bound = frame.get(name);
            if (bound != null) return bound;
        }
        SwiftType var = varTypes.get(name);
        if (var != null) return var;
        Iterator<FunctionSignature> it = functionStack.iterator();
        while (it.hasNext()) {
            SwiftType param = it.next().getParamType(name);
            if (param != null) return param;
        }
        return SwiftTypes.ANY;
    }

    /** 元素类型：[T] → T，字符串 → String，其他 → Any */
    public static SwiftType elementTypeOf(SwiftType iterable) {
        if (iterable instanceof ArraySwiftType) {
            return ((ArraySwiftType) iterable).getElementType();
        }
        if (iterable.isString()) {
            return SwiftTypes.STRING;
        }
        return SwiftTypes.ANY;
    }

    /**
     * 整数性检查：递归经过算术、绑定为 Int 的名称以及已知返回 Int 的函数调用
     */
    public boolean isIntExpression(Expression expr) {
        if (expr instanceof ConstantExpr) {
            return ((ConstantExpr) expr).is(ConstantExpr.Kind.INT);
        }
        if (expr instanceof NameExpr) {
            return resolveName(((NameExpr) expr).getId()).isInt();
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) expr;
            return unary.getOperator() != UnaryExpr.Operator.NOT && isIntExpression(unary.getOperand());
        }
        if (expr instanceof BinaryExpr) {
            BinaryExpr binary = (BinaryExpr) expr;
            switch (binary.getOperator()) {
                case DIV:
                case POW:
                case MAT_MULT:
                    return false;
                case FLOOR_DIV:
                    return true;
                default:
                    return isIntExpression(binary.getLeft()) && isIntExpression(binary.getRight());
            }
        }
        if (expr instanceof CallExpr && ((CallExpr) expr).getFunction() instanceof NameExpr) {
            String name = ((NameExpr) ((CallExpr) expr).getFunction()).getId();
            FunctionSignature signature = signatures.get(name);
            if (signature != null) {
                return signature.isReturnResolved() && signature.getReturnType().isInt();
            }
            return "int".equals(name) || "len".equals(name);
        }
        return false;
    }

    // ============ 基础 ============

    @Override
    public SwiftType visitName(NameExpr node, Void ctx) {
        return resolveName(node.getId());
    }

    @Override
    public SwiftType visitConstant(ConstantExpr node, Void ctx) {
        switch (node.getKind()) {
            case INT: return SwiftTypes.INT;
            case FLOAT: return SwiftTypes.DOUBLE;
            case STRING: return SwiftTypes.STRING;
            case BOOL: return SwiftTypes.BOOL;
            default: return SwiftTypes.ANY;
        }
    }

    @Override
    public SwiftType visitJoinedStr(JoinedStrExpr node, Void ctx) {
        return SwiftTypes.STRING;
    }

    @Override
    public SwiftType visitFormattedValue(FormattedValueExpr node, Void ctx) {
        return SwiftTypes.STRING;
    }

    @Override
    public SwiftType visitAttribute(AttributeExpr node, Void ctx) {
        return SwiftTypes.ANY;
    }

    @Override
    public SwiftType visitSubscript(SubscriptExpr node, Void ctx) {
        SwiftType container = infer(node.getValue());
        if (node.getIndex() instanceof SliceExpr) {
            return container instanceof ArraySwiftType || container.isString() ? container : SwiftTypes.ANY;
        }
        if (container instanceof ArraySwiftType) {
            return ((ArraySwiftType) container).getElementType();
        }
        // 单个字符也按 String 处理
        if (container.isString()) {
            return SwiftTypes.STRING;
        }
        if (container instanceof MapSwiftType) {
            return ((MapSwiftType) container).getValueType();
        }
        return SwiftTypes.ANY;
    }

    @Override
    public SwiftType visitSlice(SliceExpr node, Void ctx) {
        return SwiftTypes.ANY;
    }

    @Override
    public SwiftType visitCall(CallExpr node, Void ctx) {
        if (node.getFunction() instanceof NameExpr) {
            return inferFunctionCall(((NameExpr) node.getFunction()).getId(), node);
        }
        if (node.getFunction() instanceof AttributeExpr) {
            return inferMethodCall((AttributeExpr) node.getFunction(), node);
        }
        return SwiftTypes.ANY;
    }

    private SwiftType inferFunctionCall(String name, CallExpr call) {
        FunctionSignature signature = signatures.get(name);
        if (signature != null) {
            return signature.getReturnType();
        }
        SwiftType fixed = BUILTIN_RETURN_TYPES.get(name);
        if (fixed != null) {
            return fixed;
        }
        List<Expression> args = call.getArgs();
        SwiftType first = args.isEmpty() ? SwiftTypes.ANY : infer(args.get(0));
        switch (name) {
            case "sum": {
                // reduce 的初始值随元素类型变化
                SwiftType element = elementTypeOf(first);
                return element.isDouble() ? SwiftTypes.DOUBLE : SwiftTypes.INT;
            }
            case "abs":
                return first.isNumeric() ? first : SwiftTypes.DOUBLE;
            case "min":
            case "max":
                return args.size() == 1 ? numericOrAny(elementTypeOf(first)) : numericOrAny(promoteAll(args));
            case "range":
                return SwiftTypes.arrayOf(SwiftTypes.INT);
            case "sorted":
            case "reversed":
            case "list":
                return first instanceof ArraySwiftType ? first : SwiftTypes.ANY_ARRAY;
            default:
                return SwiftTypes.ANY;
        }
    }

    private SwiftType inferMethodCall(AttributeExpr method, CallExpr call) {
        SwiftType fixed = METHOD_RETURN_TYPES.get(method.getAttr());
        if (fixed != null) {
            return fixed;
        }
        SwiftType receiver = infer(method.getValue());
        switch (method.getAttr()) {
            case "pop":
                return elementTypeOf(receiver);
            case "get":
                return receiver instanceof MapSwiftType ? ((MapSwiftType) receiver).getValueType() : SwiftTypes.ANY;
            case "keys":
                return receiver instanceof MapSwiftType
                        ? SwiftTypes.arrayOf(((MapSwiftType) receiver).getKeyType()) : SwiftTypes.ANY_ARRAY;
            case "values":
                return receiver instanceof MapSwiftType
                        ? SwiftTypes.arrayOf(((MapSwiftType) receiver).getValueType()) : SwiftTypes.ANY_ARRAY;
            default:
                return SwiftTypes.ANY;
        }
    }

    private SwiftType promoteAll(List<Expression> args) {
        SwiftType result = null;
        for (Expression arg : args) {
            SwiftType type = infer(arg);
            result = result == null ? type : SwiftTypes.promoteNumeric(result, type);
            if (result == null) return SwiftTypes.ANY;
        }
        return result != null ? result : SwiftTypes.ANY;
    }

    private static SwiftType numericOrAny(SwiftType type) {
        return type.isNumeric() ? type : SwiftTypes.ANY;
    }

    // ============ 运算 ============

    @Override
    public SwiftType visitBinary(BinaryExpr node, Void ctx) {
        SwiftType left = infer(node.getLeft());
        SwiftType right = infer(node.getRight());
        switch (node.getOperator()) {
            case POW:
                return SwiftTypes.DOUBLE; // 生成为 pow(a, b)
            case FLOOR_DIV:
                return SwiftTypes.INT;    // 生成为 Int(Double(a) / Double(b))
            case DIV:
                if (left.isNumeric() && right.isNumeric()) {
                    return SwiftTypes.DOUBLE;
                }
                return fallback(left, right);
            case LSHIFT:
            case RSHIFT:
            case BIT_AND:
            case BIT_OR:
            case BIT_XOR:
                return left.isInt() && right.isInt() ? SwiftTypes.INT : SwiftTypes.ANY;
            default:
                SwiftType promoted = SwiftTypes.promoteNumeric(left, right);
                return promoted != null ? promoted : fallback(left, right);
        }
    }

    /** 类型相同取该类型，一侧未知取另一侧 */
    private static SwiftType fallback(SwiftType left, SwiftType right) {
        if (left.equals(right)) return left;
        if (left.isAny()) return right;
        if (right.isAny()) return left;
        return SwiftTypes.ANY;
    }

    @Override
    public SwiftType visitUnary(UnaryExpr node, Void ctx) {
        SwiftType operand = infer(node.getOperand());
        switch (node.getOperator()) {
            case NOT: return SwiftTypes.BOOL;
            case INVERT: return operand.isInt() ? SwiftTypes.INT : SwiftTypes.ANY;
            default: return operand;
        }
    }

    @Override
    public SwiftType visitBoolOp(BoolOpExpr node, Void ctx) {
        return SwiftTypes.BOOL;
    }

    @Override
    public SwiftType visitCompare(CompareExpr node, Void ctx) {
        return SwiftTypes.BOOL;
    }

    @Override
    public SwiftType visitConditional(ConditionalExpr node, Void ctx) {
        SwiftType body = infer(node.getBody());
        SwiftType orElse = infer(node.getOrElse());
        return body.equals(orElse) ? body : SwiftTypes.ANY;
    }

    @Override
    public SwiftType visitNamed(NamedExpr node, Void ctx) {
        return infer(node.getValue());
    }

    // ============ 容器 ============

    @Override
    public SwiftType visitList(ListExpr node, Void ctx) {
        return SwiftTypes.arrayOf(agreedType(node.getElements()));
    }

    @Override
    public SwiftType visitTuple(TupleExpr node, Void ctx) {
        return SwiftTypes.ANY;
    }

    @Override
    public SwiftType visitSet(SetExpr node, Void ctx) {
        return SwiftTypes.ANY;
    }

    @Override
    public SwiftType visitDict(DictExpr node, Void ctx) {
        if (node.getKeys().isEmpty() || node.getKeys().contains(null)) {
            return SwiftTypes.ANY_MAP;
        }
        SwiftType key = agreedType(node.getKeys());
        SwiftType value = agreedType(node.getValues());
        if (key.isAny() || value.isAny()) {
            return SwiftTypes.ANY_MAP;
        }
        return SwiftTypes.mapOf(key, value);
    }

    /** 所有元素类型一致时返回该类型，否则 Any */
    private SwiftType agreedType(List<Expression> elements) {
        List<SwiftType> types = new ArrayList<SwiftType>(elements.size());
        for (Expression element : elements) {
            if (element instanceof StarredExpr) return SwiftTypes.ANY;
            types.add(infer(element));
        }
        SwiftType agreed = SwiftTypes.unanimous(types);
        return agreed != null ? agreed : SwiftTypes.ANY;
    }

    @Override
    public SwiftType visitStarred(StarredExpr node, Void ctx) {
        return SwiftTypes.ANY;
    }

    // ============ 推导式 ============

    @Override
    public SwiftType visitListComp(ListCompExpr node, Void ctx) {
        return SwiftTypes.arrayOf(comprehensionElementType(node.getElement(), node.getGenerators()));
    }

    @Override
    public SwiftType visitGenerator(GeneratorExpr node, Void ctx) {
        return SwiftTypes.arrayOf(comprehensionElementType(node.getElement(), node.getGenerators()));
    }

    @Override
    public SwiftType visitSetComp(SetCompExpr node, Void ctx) {
        return SwiftTypes.ANY;
    }

    @Override
    public SwiftType visitDictComp(DictCompExpr node, Void ctx) {
        return SwiftTypes.ANY_MAP;
    }

    private SwiftType comprehensionElementType(Expression element, List<Comprehension> generators) {
        if (generators.size() != 1 || !(generators.get(0).getTarget() instanceof NameExpr)) {
            return SwiftTypes.ANY;
        }
        Comprehension gen = generators.get(0);
        pushBinding(((NameExpr) gen.getTarget()).getId(), elementTypeOf(infer(gen.getIter())));
        try {
            return infer(element);
        } finally {
            popBinding();
        }
    }

    // ============ 函数 / 协程 ============

    @Override
    public SwiftType visitLambda(LambdaExpr node, Void ctx) {
        return SwiftTypes.ANY;
    }

    @Override
    public SwiftType visitYield(YieldExpr node, Void ctx) {
        return SwiftTypes.ANY;
    }

    @Override
    public SwiftType visitYieldFrom(YieldFromExpr node, Void ctx) {
        return SwiftTypes.ANY;
    }

    @Override
    public SwiftType visitAwait(AwaitExpr node, Void ctx) {
        return SwiftTypes.ANY;
    }
}
