package com.py2swift.compiler.codegen;

import com.py2swift.compiler.analysis.ExpressionTypeInferrer;
import com.py2swift.compiler.analysis.InferenceResult;
import com.py2swift.compiler.analysis.types.MapSwiftType;
import com.py2swift.compiler.analysis.types.SwiftType;
import com.py2swift.compiler.analysis.types.SwiftTypes;
import com.py2swift.compiler.ast.AstScanner;
import com.py2swift.compiler.ast.ExprVisitor;
import com.py2swift.compiler.ast.Parameter;
import com.py2swift.compiler.ast.expr.*;
import com.py2swift.compiler.diagnostic.DiagnosticSink;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.py2swift.compiler.codegen.SwiftPrecedence.*;

/**
 * 表达式 → Swift 源码
 *
 * <p>按 Swift 运算符优先级决定括号；推导式循环变量通过名称替换表改写为闭包参数，
 * 只作用于语法树上的 Name 节点。</p>
 */
public class ExpressionEmitter implements ExprVisitor<String, Void> {

    private static final Pattern PLAIN_FLOAT = Pattern.compile("[0-9_]+\\.[0-9_]+([eE][+-]?[0-9_]+)?|[0-9_]+[eE][+-]?[0-9_]+");
    private static final Pattern FLOAT_SPEC = Pattern.compile("(\\d*)(\\.\\d+)?f");

    private static final Map<String, String> MODULE_CONSTANTS;

    static {
        Map<String, String> constants = new HashMap<String, String>();
        constants.put("math.pi", "Double.pi");
        constants.put("math.e", "M_E");
        constants.put("math.inf", "Double.infinity");
        constants.put("math.tau", "(2 * Double.pi)");
        MODULE_CONSTANTS = Collections.unmodifiableMap(constants);
    }

    private final InferenceResult types;
    private final DiagnosticSink diagnostics;
    private final CallTranslator calls;

    // 名称替换帧：推导式变量 → $0 / 闭包参数，lambda 参数遮蔽外层替换
    private final Deque<Map<String, String>> substitutions = new ArrayDeque<Map<String, String>>();

    private int lastPrecedence = POSTFIX;

    public ExpressionEmitter(InferenceResult types, DiagnosticSink diagnostics, Set<String> knownClasses) {
        this.types = types;
        this.diagnostics = diagnostics;
        this.calls = new CallTranslator(this, types, diagnostics, knownClasses);
    }

    // ============ 入口 ============

    public String emit(Expression expr) {
        return emit(expr, LOWEST);
    }

    /**
     * 输出表达式，优先级低于 minPrecedence 时加括号
     */
    public String emit(Expression expr, int minPrecedence) {
        String code = expr.accept(this, null);
        return wrap(code, lastPrecedence, minPrecedence);
    }

    /**
     * 在给定名称替换下输出表达式
     */
    public String emitWithSubstitution(Expression expr, Map<String, String> renames, int minPrecedence) {
        substitutions.push(renames);
        try {
            return emit(expr, minPrecedence);
        } finally {
            substitutions.pop();
        }
    }

    /**
     * 赋值目标：字典下标不加强制解包
     */
    public String emitTarget(Expression target) {
        if (target instanceof SubscriptExpr && !(((SubscriptExpr) target).getIndex() instanceof SliceExpr)) {
            SubscriptExpr subscript = (SubscriptExpr) target;
            return emit(subscript.getValue(), POSTFIX) + "[" + indexCode(subscript) + "]";
        }
        if (target instanceof TupleExpr || target instanceof ListExpr) {
            List<String> parts = new ArrayList<String>();
            for (Expression element : TupleTargets.elements(target)) {
                parts.add(emitTarget(element));
            }
            return "(" + String.join(", ", parts) + ")";
        }
        return emit(target);
    }

    /**
     * 条件表达式：集合 / 字符串按是否为空，数值按是否为 0
     */
    public String emitCondition(Expression test, int minPrecedence) {
        String code = conditionCode(test);
        return wrap(code, lastPrecedence, minPrecedence);
    }

    public String emitCondition(Expression test) {
        return emitCondition(test, LOWEST);
    }

    public SwiftType typeOf(Expression expr) {
        return types.typeOf(expr);
    }

    public CallTranslator getCallTranslator() {
        return calls;
    }

    /**
     * 迭代对象：range 翻译为区间并加括号，字典迭代键
     */
    public String emitIterable(Expression iter, boolean forReceiver) {
        if (isRangeCall(iter)) {
            CallTranslation range = calls.translate((CallExpr) iter);
            return forReceiver ? wrap(range.getCode(), range.getPrecedence(), POSTFIX) : range.getCode();
        }
        if (typeOf(iter) instanceof MapSwiftType) {
            return emit(iter, POSTFIX) + ".keys";
        }
        return forReceiver ? emit(iter, POSTFIX) : emit(iter);
    }

    static boolean isRangeCall(Expression expr) {
        return expr instanceof CallExpr && isName(((CallExpr) expr).getFunction(), "range")
                && !((CallExpr) expr).getArgs().isEmpty() && ((CallExpr) expr).getArgs().size() <= 3;
    }

    static boolean isName(Expression expr, String id) {
        return expr instanceof NameExpr && id.equals(((NameExpr) expr).getId());
    }

    static boolean isNone(Expression expr) {
        return expr instanceof ConstantExpr && ((ConstantExpr) expr).is(ConstantExpr.Kind.NONE);
    }

    /** 整数字面量的值，非整数字面量（含取负）返回 null */
    static BigInteger intLiteral(Expression expr) {
        if (expr instanceof ConstantExpr && ((ConstantExpr) expr).is(ConstantExpr.Kind.INT)) {
            return (BigInteger) ((ConstantExpr) expr).getValue();
        }
        if (expr instanceof UnaryExpr && ((UnaryExpr) expr).getOperator() == UnaryExpr.Operator.NEGATE) {
            BigInteger operand = intLiteral(((UnaryExpr) expr).getOperand());
            return operand != null ? operand.negate() : null;
        }
        return null;
    }

    /**
     * 记录不支持的表达式并返回占位符
     */
    String unsupported(Expression node) {
        diagnostics.report("Unsupported expression: " + kindName(node), node);
        return result("/* unsupported expression */", POSTFIX);
    }

    static String kindName(Object node) {
        String name = node.getClass().getSimpleName();
        return name.endsWith("Expr") ? name.substring(0, name.length() - 4) : name;
    }

    private String result(String code, int precedence) {
        lastPrecedence = precedence;
        return code;
    }

    private static String wrap(String code, int precedence, int minPrecedence) {
        return precedence < minPrecedence ? "(" + code + ")" : code;
    }

    // ============ 名称与常量 ============

    @Override
    public String visitName(NameExpr node, Void ctx) {
        for (Map<String, String> frame : substitutions) {
            String replacement = frame.get(node.getId());
            if (replacement != null) {
                return result(replacement, POSTFIX);
            }
        }
        return result(SwiftStringUtils.identifier(node.getId()), POSTFIX);
    }

    @Override
    public String visitConstant(ConstantExpr node, Void ctx) {
        switch (node.getKind()) {
            case INT:
                return result(node.getSourceText() != null ? node.getSourceText() : String.valueOf(node.getValue()), POSTFIX);
            case FLOAT:
                return result(floatLiteral(node), POSTFIX);
            case STRING:
                return result(SwiftStringUtils.quote(node.getStringValue()), POSTFIX);
            case BOOL:
                return result(Boolean.TRUE.equals(node.getValue()) ? "true" : "false", POSTFIX);
            case NONE:
                return result("nil", POSTFIX);
            default:
                return unsupported(node);
        }
    }

    private static String floatLiteral(ConstantExpr node) {
        String text = node.getSourceText();
        if (text != null && PLAIN_FLOAT.matcher(text).matches()) {
            return text;
        }
        return String.valueOf(node.getValue());
    }

    @Override
    public String visitJoinedStr(JoinedStrExpr node, Void ctx) {
        StringBuilder sb = new StringBuilder("\"");
        for (Expression part : node.getValues()) {
            if (part instanceof ConstantExpr && ((ConstantExpr) part).is(ConstantExpr.Kind.STRING)) {
                sb.append(SwiftStringUtils.escape(((ConstantExpr) part).getStringValue()));
            } else if (part instanceof FormattedValueExpr) {
                sb.append(interpolation((FormattedValueExpr) part));
            } else {
                sb.append("\\(").append(emit(part)).append(")");
            }
        }
        sb.append("\"");
        return result(sb.toString(), POSTFIX);
    }

    @Override
    public String visitFormattedValue(FormattedValueExpr node, Void ctx) {
        return result("\"" + interpolation(node) + "\"", POSTFIX);
    }

    private String interpolation(FormattedValueExpr node) {
        String value = emit(node.getValue());
        if (node.getConversion() == 'r') {
            value = "String(reflecting: " + value + ")";
        }
        String spec = formatSpecText(node);
        if (spec != null && !spec.isEmpty() && !"d".equals(spec) && !"s".equals(spec)) {
            Matcher m = FLOAT_SPEC.matcher(spec);
            if (m.matches()) {
                String precision = m.group(2) != null ? m.group(2) : "";
                value = "String(format: \"%" + m.group(1) + precision + "f\", " + value + ")";
            } else {
                diagnostics.report("f-string format spec ':" + spec + "' ignored", node);
            }
        } else if (spec == null && node.getFormatSpec() != null) {
            diagnostics.report("f-string nested format spec ignored", node);
        }
        return "\\(" + value + ")";
    }

    /** 纯文本格式说明，含嵌套插值时返回 null */
    private static String formatSpecText(FormattedValueExpr node) {
        JoinedStrExpr spec = node.getFormatSpec();
        if (spec == null) return "";
        StringBuilder sb = new StringBuilder();
        for (Expression part : spec.getValues()) {
            if (!(part instanceof ConstantExpr)) return null;
            sb.append(((ConstantExpr) part).getStringValue());
        }
        return sb.toString();
    }

    // ============ 访问与调用 ============

    @Override
    public String visitAttribute(AttributeExpr node, Void ctx) {
        if (node.getValue() instanceof NameExpr) {
            String constant = MODULE_CONSTANTS.get(((NameExpr) node.getValue()).getId() + "." + node.getAttr());
            if (constant != null) {
                return result(constant, POSTFIX);
            }
        }
        return result(emit(node.getValue(), POSTFIX) + "." + node.getAttr(), POSTFIX);
    }

    @Override
    public String visitSubscript(SubscriptExpr node, Void ctx) {
        if (node.getIndex() instanceof SliceExpr) {
            return slice(node, (SliceExpr) node.getIndex());
        }
        SwiftType containerType = typeOf(node.getValue());
        String index = indexCode(node);
        if (containerType.isString()) {
            return result("String(Array(" + emit(node.getValue()) + ")[" + index + "])", POSTFIX);
        }
        String code = emit(node.getValue(), POSTFIX) + "[" + index + "]";
        // Python 缺键时抛异常，强制解包语义一致
        if (containerType instanceof MapSwiftType) {
            code += "!";
        }
        return result(code, POSTFIX);
    }

    private String indexCode(SubscriptExpr node) {
        BigInteger literal = intLiteral(node.getIndex());
        if (literal != null && literal.signum() < 0 && countsFromEnd(node.getValue())) {
            return countMinus(node.getValue(), literal.negate());
        }
        if (node.getIndex() instanceof TupleExpr) {
            List<String> parts = new ArrayList<String>();
            for (Expression element : ((TupleExpr) node.getIndex()).getElements()) {
                parts.add(emit(element));
            }
            return String.join(", ", parts);
        }
        return emit(node.getIndex());
    }

    /** 负下标从末尾计数；字典的负数是普通的键 */
    private boolean countsFromEnd(Expression receiver) {
        return isStableReceiver(receiver) && !(typeOf(receiver) instanceof MapSwiftType);
    }

    /** 可重复求值的接收者：名称或名称上的属性链 */
    private static boolean isStableReceiver(Expression expr) {
        if (expr instanceof NameExpr) return true;
        return expr instanceof AttributeExpr && isStableReceiver(((AttributeExpr) expr).getValue());
    }

    private String countMinus(Expression receiver, BigInteger amount) {
        return emit(receiver, POSTFIX) + ".count - " + amount;
    }

    private String slice(SubscriptExpr node, SliceExpr slice) {
        Expression value = node.getValue();
        boolean stringValue = typeOf(value).isString();
        Expression step = slice.getStep();
        BigInteger stepValue = step != null ? intLiteral(step) : BigInteger.ONE;

        if (stepValue != null && stepValue.equals(BigInteger.ONE.negate())) {
            if (slice.getLower() != null || slice.getUpper() != null) {
                diagnostics.report("Slice with step -1 and bounds not fully supported", slice);
            }
            String reversed = emit(value, POSTFIX) + ".reversed()";
            return result(stringValue ? "String(" + reversed + ")" : "Array(" + reversed + ")", POSTFIX);
        }
        if (stepValue == null || !stepValue.equals(BigInteger.ONE)) {
            diagnostics.report("Slice with step other than -1 not supported. Use a manual `stride` loop.", slice);
            return result("/* unsupported slice step */", POSTFIX);
        }

        if (slice.getLower() == null && slice.getUpper() == null) {
            return result(emit(value), lastPrecedence);
        }
        String range;
        if (slice.getLower() == null) {
            range = "..<" + boundCode(value, slice.getUpper(), POSTFIX);
        } else if (slice.getUpper() == null) {
            range = boundCode(value, slice.getLower(), POSTFIX) + "...";
        } else {
            range = boundCode(value, slice.getLower(), RANGE + 1) + "..<" + boundCode(value, slice.getUpper(), RANGE + 1);
        }
        if (stringValue) {
            return result("String(Array(" + emit(value) + ")[" + range + "])", POSTFIX);
        }
        return result("Array(" + emit(value, POSTFIX) + "[" + range + "])", POSTFIX);
    }

    private String boundCode(Expression receiver, Expression bound, int minPrecedence) {
        BigInteger literal = intLiteral(bound);
        if (literal != null && literal.signum() < 0 && countsFromEnd(receiver)) {
            return wrap(countMinus(receiver, literal.negate()), ADDITION, minPrecedence);
        }
        return emit(bound, minPrecedence);
    }

    @Override
    public String visitSlice(SliceExpr node, Void ctx) {
        return unsupported(node);
    }

    @Override
    public String visitCall(CallExpr node, Void ctx) {
        CallTranslation translation = calls.translate(node);
        return result(translation.getCode(), translation.getPrecedence());
    }

    // ============ 运算 ============

    @Override
    public String visitBinary(BinaryExpr node, Void ctx) {
        Expression left = node.getLeft();
        Expression right = node.getRight();
        SwiftType leftType = typeOf(left);
        SwiftType rightType = typeOf(right);

        switch (node.getOperator()) {
            case FLOOR_DIV:
                return result("Int(Double(" + emit(left) + ") / Double(" + emit(right) + "))", POSTFIX);
            case POW:
                return result("pow(" + asDouble(left, LOWEST) + ", " + asDouble(right, LOWEST) + ")", POSTFIX);
            case MAT_MULT:
                return unsupported(node);
            case MOD:
                if (leftType.isDouble() || rightType.isDouble()) {
                    return result(asDouble(left, POSTFIX) + ".truncatingRemainder(dividingBy: "
                            + asDouble(right, LOWEST) + ")", POSTFIX);
                }
                break;
            case DIV:
                if (leftType.isInt() && rightType.isInt()) {
                    // 真除法：至少一侧转成 Double
                    String l = intLiteral(left) != null && intLiteral(right) != null
                            ? "Double(" + emit(left) + ")"
                            : asDouble(left, MULTIPLICATION);
                    return result(l + " / " + asDouble(right, MULTIPLICATION + 1), MULTIPLICATION);
                }
                break;
            case MULT:
                if (leftType.isString() && rightType.isInt()) {
                    return result("String(repeating: " + emit(left) + ", count: " + emit(right) + ")", POSTFIX);
                }
                if (left instanceof ListExpr && ((ListExpr) left).getElements().size() == 1 && rightType.isInt()) {
                    return result("Array(repeating: " + emit(((ListExpr) left).getElements().get(0))
                            + ", count: " + emit(right) + ")", POSTFIX);
                }
                break;
            default:
                break;
        }

        int precedence = precedenceOf(node.getOperator());
        String l;
        String r;
        if (node.getOperator().isArithmetic() && (leftType.isDouble() || rightType.isDouble())) {
            l = asDouble(left, precedence);
            r = asDouble(right, precedence + 1);
        } else {
            l = emit(left, precedence);
            r = emit(right, precedence + 1);
        }
        return result(l + " " + node.getOperator().toSourceString() + " " + r, precedence);
    }

    /** Int 类型的非字面量操作数包成 Double(...) */
    private String asDouble(Expression expr, int minPrecedence) {
        if (typeOf(expr).isInt() && intLiteral(expr) == null) {
            return "Double(" + emit(expr) + ")";
        }
        return emit(expr, minPrecedence);
    }

    static int precedenceOf(BinaryExpr.Operator op) {
        switch (op) {
            case MULT:
            case DIV:
            case MOD:
            case BIT_AND:
                return MULTIPLICATION;
            case LSHIFT:
            case RSHIFT:
                return SHIFT;
            default:
                return ADDITION;
        }
    }

    @Override
    public String visitUnary(UnaryExpr node, Void ctx) {
        switch (node.getOperator()) {
            case NOT:
                return result(negatedCondition(node.getOperand()), lastPrecedence);
            case PLUS:
                return result(emit(node.getOperand()), lastPrecedence);
            default:
                String operand = emit(node.getOperand(), PREFIX);
                if (operand.startsWith("-") || operand.startsWith("~")) {
                    operand = "(" + operand + ")";
                }
                return result(node.getOperator().getSymbol() + operand, PREFIX);
        }
    }

    private String conditionCode(Expression test) {
        if (test instanceof UnaryExpr && ((UnaryExpr) test).getOperator() == UnaryExpr.Operator.NOT) {
            return result(negatedCondition(((UnaryExpr) test).getOperand()), lastPrecedence);
        }
        SwiftType type = typeOf(test);
        if (type.isContainer() || type.isString()) {
            return result("!" + emit(test, POSTFIX) + ".isEmpty", PREFIX);
        }
        if (type.isNumeric()) {
            return result(emit(test, COMPARISON + 1) + " != 0", COMPARISON);
        }
        return result(emit(test), lastPrecedence);
    }

    private String negatedCondition(Expression operand) {
        SwiftType type = typeOf(operand);
        if (type.isContainer() || type.isString()) {
            return result(emit(operand, POSTFIX) + ".isEmpty", POSTFIX);
        }
        if (type.isNumeric()) {
            return result(emit(operand, COMPARISON + 1) + " == 0", COMPARISON);
        }
        return result("!" + emit(operand, PREFIX), PREFIX);
    }

    @Override
    public String visitBoolOp(BoolOpExpr node, Void ctx) {
        int precedence = node.getOperator() == BoolOpExpr.Operator.AND ? CONJUNCTION : DISJUNCTION;
        List<String> parts = new ArrayList<String>();
        for (Expression value : node.getValues()) {
            parts.add(emitCondition(value, precedence));
        }
        return result(String.join(" " + node.getOperator().getSymbol() + " ", parts), precedence);
    }

    @Override
    public String visitCompare(CompareExpr node, Void ctx) {
        List<String> parts = new ArrayList<String>();
        Expression left = node.getLeft();
        for (int i = 0; i < node.getOperators().size(); i++) {
            Expression right = node.getComparators().get(i);
            parts.add(comparison(left, node.getOperators().get(i), right));
            left = right;
        }
        if (parts.size() == 1) {
            return result(parts.get(0), lastPrecedence);
        }
        // 链式比较拆成 && 连接
        return result(String.join(" && ", parts), CONJUNCTION);
    }

    private String comparison(Expression left, CompareExpr.Operator op, Expression right) {
        switch (op) {
            case IN:
                return result(containment(left, right), POSTFIX);
            case NOT_IN:
                return result("!" + containment(left, right), PREFIX);
            case IS:
            case IS_NOT:
                String symbol;
                if (isNone(left) || isNone(right)) {
                    symbol = op == CompareExpr.Operator.IS ? "==" : "!=";
                } else {
                    symbol = op.getSymbol();
                }
                return result(emit(left, COMPARISON + 1) + " " + symbol + " " + emit(right, COMPARISON + 1), COMPARISON);
            default:
                return result(emit(left, COMPARISON + 1) + " " + op.getSymbol() + " " + emit(right, COMPARISON + 1), COMPARISON);
        }
    }

    private String containment(Expression element, Expression container) {
        String receiver = emit(container, POSTFIX);
        if (typeOf(container) instanceof MapSwiftType) {
            receiver += ".keys";
        }
        return receiver + ".contains(" + emit(element) + ")";
    }

    @Override
    public String visitConditional(ConditionalExpr node, Void ctx) {
        String test = emitCondition(node.getTest(), TERNARY + 1);
        String body = emit(node.getBody(), TERNARY + 1);
        String orElse = emit(node.getOrElse(), TERNARY);
        return result(test + " ? " + body + " : " + orElse, TERNARY);
    }

    @Override
    public String visitNamed(NamedExpr node, Void ctx) {
        diagnostics.report("Assignment expression ':=' not supported, binding of '" + node.getTarget() + "' dropped", node);
        return result(emit(node.getValue()), lastPrecedence);
    }

    // ============ 容器 ============

    @Override
    public String visitList(ListExpr node, Void ctx) {
        return result("[" + joinElements(node.getElements()) + "]", POSTFIX);
    }

    @Override
    public String visitTuple(TupleExpr node, Void ctx) {
        return result("(" + joinElements(node.getElements()) + ")", POSTFIX);
    }

    @Override
    public String visitSet(SetExpr node, Void ctx) {
        return result("Set([" + joinElements(node.getElements()) + "])", POSTFIX);
    }

    private String joinElements(List<Expression> elements) {
        List<String> parts = new ArrayList<String>();
        for (Expression element : elements) {
            parts.add(emit(element));
        }
        return String.join(", ", parts);
    }

    @Override
    public String visitDict(DictExpr node, Void ctx) {
        List<String> parts = new ArrayList<String>();
        for (int i = 0; i < node.getKeys().size(); i++) {
            Expression key = node.getKeys().get(i);
            if (key == null) {
                diagnostics.report("Dictionary unpacking '**' not supported", node.getValues().get(i));
                continue;
            }
            parts.add(emit(key) + ": " + emit(node.getValues().get(i)));
        }
        return result(parts.isEmpty() ? "[:]" : "[" + String.join(", ", parts) + "]", POSTFIX);
    }

    @Override
    public String visitStarred(StarredExpr node, Void ctx) {
        return unsupported(node);
    }

    // ============ 推导式 ============

    @Override
    public String visitListComp(ListCompExpr node, Void ctx) {
        return comprehension(node, node.getElement(), null, node.getGenerators(), "[]");
    }

    @Override
    public String visitGenerator(GeneratorExpr node, Void ctx) {
        return comprehension(node, node.getElement(), null, node.getGenerators(), "[]");
    }

    @Override
    public String visitSetComp(SetCompExpr node, Void ctx) {
        String chain = comprehension(node, node.getElement(), null, node.getGenerators(), "[]");
        return result("Set(" + chain + ")", POSTFIX);
    }

    @Override
    public String visitDictComp(DictCompExpr node, Void ctx) {
        if (node.getGenerators().size() != 1) {
            return comprehension(node, node.getKey(), node.getValue(), node.getGenerators(), "[:]");
        }
        String chain = comprehension(node, node.getKey(), node.getValue(), node.getGenerators(), "[]");
        // 重复键以后者为准
        return result("Dictionary(" + chain + ", uniquingKeysWith: { $1 })", POSTFIX);
    }

    /**
     * 单个 for 子句的推导式 → filter / map 链
     *
     * @param value 字典推导式的值表达式，其他推导式为 null
     */
    private String comprehension(Expression node, Expression element, Expression value,
                                 List<Comprehension> generators, String empty) {
        // 多个 for 子句或无法处理的目标时返回 empty 占位
        if (generators.size() != 1) {
            diagnostics.report("List comprehension with multiple for clauses not supported", node);
            return result(empty, POSTFIX);
        }
        Comprehension generator = generators.get(0);
        if (generator.isAsync()) {
            diagnostics.report("async comprehension not supported", node);
        }
        List<String> names = TupleTargets.names(generator.getTarget());
        if (names == null) {
            diagnostics.report("Unsupported comprehension target: " + kindName(generator.getTarget()), node);
            return result(empty, POSTFIX);
        }

        List<Expression> closureBodies = new ArrayList<Expression>(generator.getIfs());
        closureBodies.add(element);
        if (value != null) closureBodies.add(value);
        boolean implicitParameter = generator.getTarget() instanceof NameExpr && !ClosureFinder.anyContainsClosure(closureBodies);

        String iter = emitIterable(generator.getIter(), true);
        boolean identity = value == null && generator.getTarget() instanceof NameExpr
                && isName(element, ((NameExpr) generator.getTarget()).getId());
        if (identity && generator.getIfs().isEmpty()) {
            if (isRangeCall(generator.getIter()) || typeOf(generator.getIter()).isString()) {
                return result("Array(" + emitIterable(generator.getIter(), false) + ")", POSTFIX);
            }
            return result(emit(generator.getIter()), lastPrecedence);
        }

        Map<String, String> renames = new LinkedHashMap<String, String>();
        String parameter;
        if (implicitParameter) {
            renames.put(names.get(0), "$0");
            parameter = "";
        } else {
            List<String> swiftNames = new ArrayList<String>();
            for (String name : names) {
                renames.put(name, SwiftStringUtils.identifier(name));
                swiftNames.add(SwiftStringUtils.identifier(name));
            }
            parameter = (names.size() == 1 ? swiftNames.get(0) : "(" + String.join(", ", swiftNames) + ")") + " in ";
        }

        SwiftType elementType = ExpressionTypeInferrer.elementTypeOf(typeOf(generator.getIter()));
        ExpressionTypeInferrer typer = types.getTyper();
        for (String name : names) {
            typer.pushBinding(name, names.size() == 1 ? elementType : SwiftTypes.ANY);
        }
        substitutions.push(renames);
        try {
            StringBuilder chain = new StringBuilder(iter);
            if (!generator.getIfs().isEmpty()) {
                List<String> conditions = new ArrayList<String>();
                for (Expression condition : generator.getIfs()) {
                    conditions.add(emitCondition(condition, generator.getIfs().size() > 1 ? CONJUNCTION : LOWEST));
                }
                chain.append(".filter { ").append(parameter).append(String.join(" && ", conditions)).append(" }");
            }
            if (!identity) {
                String mapped = value == null
                        ? emit(element)
                        : "(" + emit(element) + ", " + emit(value) + ")";
                chain.append(".map { ").append(parameter).append(mapped).append(" }");
            }
            return result(chain.toString(), POSTFIX);
        } finally {
            substitutions.pop();
            for (int i = 0; i < names.size(); i++) {
                typer.popBinding();
            }
        }
    }

    @Override
    public String visitLambda(LambdaExpr node, Void ctx) {
        Map<String, String> shadow = new LinkedHashMap<String, String>();
        List<String> params = new ArrayList<String>();
        for (Parameter param : node.getParameters()) {
            String name = SwiftStringUtils.identifier(param.getName());
            shadow.put(param.getName(), name);
            params.add(name);
        }
        substitutions.push(shadow);
        try {
            String body = emit(node.getBody());
            if (params.isEmpty()) {
                return result("{ " + body + " }", POSTFIX);
            }
            return result("{ " + String.join(", ", params) + " in " + body + " }", POSTFIX);
        } finally {
            substitutions.pop();
        }
    }

    // 生成器与协程已在前端预扫描中记录

    @Override
    public String visitYield(YieldExpr node, Void ctx) {
        return unsupported(node);
    }

    @Override
    public String visitYieldFrom(YieldFromExpr node, Void ctx) {
        return unsupported(node);
    }

    @Override
    public String visitAwait(AwaitExpr node, Void ctx) {
        return result(emit(node.getValue()), lastPrecedence);
    }

    /**
     * 判断表达式中是否含有会生成闭包的结构，此时推导式改用具名闭包参数
     */
    private static final class ClosureFinder extends AstScanner<Void> {
        private boolean found;

        static boolean anyContainsClosure(List<Expression> exprs) {
            ClosureFinder finder = new ClosureFinder();
            for (Expression expr : exprs) {
                finder.scan(expr, null);
            }
            return finder.found;
        }

        @Override
        public Void visitLambda(LambdaExpr node, Void ctx) {
            found = true;
            return null;
        }

        @Override
        public Void visitListComp(ListCompExpr node, Void ctx) {
            found = true;
            return null;
        }

        @Override
        public Void visitSetComp(SetCompExpr node, Void ctx) {
            found = true;
            return null;
        }

        @Override
        public Void visitDictComp(DictCompExpr node, Void ctx) {
            found = true;
            return null;
        }

        @Override
        public Void visitGenerator(GeneratorExpr node, Void ctx) {
            found = true;
            return null;
        }

        @Override
        public Void visitCall(CallExpr node, Void ctx) {
            if (CallTranslator.producesClosure(node)) {
                found = true;
                return null;
            }
            return super.visitCall(node, ctx);
        }
    }
}
