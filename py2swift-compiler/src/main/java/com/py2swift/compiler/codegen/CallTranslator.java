package com.py2swift.compiler.codegen;

import com.py2swift.compiler.analysis.ExpressionTypeInferrer;
import com.py2swift.compiler.analysis.FunctionSignature;
import com.py2swift.compiler.analysis.InferenceResult;
import com.py2swift.compiler.analysis.types.MapSwiftType;
import com.py2swift.compiler.analysis.types.SwiftType;
import com.py2swift.compiler.ast.expr.*;
import com.py2swift.compiler.diagnostic.DiagnosticSink;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.py2swift.compiler.codegen.SwiftPrecedence.*;

/**
 * 调用翻译：内置函数表、方法表、模块函数表
 *
 * <p>查表命中的结果为 {@link CallTranslation.Kind#IDIOM}，
 * 未命中的内置函数或方法原样转写为 {@link CallTranslation.Kind#PASSTHROUGH}，不产生诊断。</p>
 */
public class CallTranslator {

    /** 翻译结果含 $0 闭包的内置函数 */
    private static final Set<String> CLOSURE_BUILTINS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "any", "all", "map", "filter", "sorted", "min", "max", "input")));

    /** 翻译结果含 $0 闭包的方法 */
    private static final Set<String> CLOSURE_METHODS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "count", "sort", "isdigit", "isalpha", "isspace", "update")));

    /** 能以 { f($0) } 形式传给 map / filter 的内置函数 */
    private static final Set<String> FUNCTION_VALUE_BUILTINS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "str", "int", "float", "len", "abs", "bool", "list", "sorted", "reversed", "sum", "min", "max")));

    private static final Map<String, String> MATH_FUNCTIONS;
    private static final Map<String, String> ISINSTANCE_TYPES;

    static {
        Map<String, String> math = new HashMap<String, String>();
        for (String name : Arrays.asList("sqrt", "floor", "ceil", "sin", "cos", "tan", "asin", "acos", "atan",
                "exp", "log2", "log10", "fabs", "hypot", "atan2")) {
            math.put(name, name);
        }
        math.put("pow", "pow");
        math.put("log", "log");
        MATH_FUNCTIONS = Collections.unmodifiableMap(math);

        Map<String, String> types = new HashMap<String, String>();
        types.put("int", "Int");
        types.put("float", "Double");
        types.put("str", "String");
        types.put("bool", "Bool");
        types.put("list", "[Any]");
        types.put("dict", "[String: Any]");
        ISINSTANCE_TYPES = Collections.unmodifiableMap(types);
    }

    private final ExpressionEmitter emitter;
    private final InferenceResult types;
    private final DiagnosticSink diagnostics;
    private final Set<String> knownClasses;

    public CallTranslator(ExpressionEmitter emitter, InferenceResult types,
                          DiagnosticSink diagnostics, Set<String> knownClasses) {
        this.emitter = emitter;
        this.types = types;
        this.diagnostics = diagnostics;
        this.knownClasses = knownClasses;
    }

    /**
     * 翻译结果中是否会引入 $0 闭包
     */
    static boolean producesClosure(CallExpr call) {
        Expression function = call.getFunction();
        if (function instanceof NameExpr) {
            return CLOSURE_BUILTINS.contains(((NameExpr) function).getId());
        }
        if (function instanceof AttributeExpr) {
            return CLOSURE_METHODS.contains(((AttributeExpr) function).getAttr());
        }
        return false;
    }

    public CallTranslation translate(CallExpr call) {
        Expression function = call.getFunction();
        if (function instanceof NameExpr) {
            String name = ((NameExpr) function).getId();
            FunctionSignature signature = types.getSignature(name);
            if (signature != null) {
                return userFunction(name, signature, call);
            }
            if (knownClasses.contains(name)) {
                return CallTranslation.idiom(SwiftStringUtils.identifier(name) + "(" + arguments(call) + ")");
            }
            CallTranslation builtin = builtin(name, call);
            if (builtin != null) {
                return builtin;
            }
            return CallTranslation.passthrough(SwiftStringUtils.identifier(name) + "(" + arguments(call) + ")");
        }
        if (function instanceof AttributeExpr) {
            AttributeExpr attribute = (AttributeExpr) function;
            Expression receiver = attribute.getValue();
            if (receiver instanceof CallExpr && ExpressionEmitter.isName(((CallExpr) receiver).getFunction(), "super")) {
                String method = "__init__".equals(attribute.getAttr()) ? "init" : attribute.getAttr();
                return CallTranslation.idiom("super." + method + "(" + arguments(call) + ")");
            }
            if (receiver instanceof NameExpr && !types.getVarTypes().containsKey(((NameExpr) receiver).getId())) {
                CallTranslation module = moduleFunction(((NameExpr) receiver).getId(), attribute.getAttr(), call);
                if (module != null) {
                    return module;
                }
            }
            // 接收者只生成一次，诊断不会重复
            String receiverCode = receiver(receiver);
            CallTranslation method = method(receiver, receiverCode, attribute.getAttr(), call);
            if (method != null) {
                return method;
            }
            return CallTranslation.passthrough(receiverCode + "." + attribute.getAttr()
                    + "(" + arguments(call) + ")");
        }
        return CallTranslation.passthrough(emitter.emit(function, POSTFIX) + "(" + arguments(call) + ")");
    }

    // ============ 参数 ============

    /**
     * 通用参数：位置参数后接 label: value 形式的关键字参数
     */
    String arguments(CallExpr call) {
        List<String> parts = positional(call);
        for (Keyword keyword : call.getKeywords()) {
            if (keyword.isUnpacking()) {
                diagnostics.report("Keyword argument unpacking '**' not supported", keyword.getValue());
                continue;
            }
            parts.add(keyword.getName() + ": " + emitter.emit(keyword.getValue()));
        }
        return String.join(", ", parts);
    }

    private List<String> positional(CallExpr call) {
        List<String> parts = new ArrayList<String>();
        for (Expression arg : call.getArgs()) {
            if (arg instanceof StarredExpr) {
                diagnostics.report("Argument unpacking '*' not supported", arg);
                parts.add(emitter.emit(((StarredExpr) arg).getValue()));
            } else {
                parts.add(emitter.emit(arg));
            }
        }
        return parts;
    }

    /**
     * 用户函数：参数统一以 _ 声明，关键字参数按声明顺序排到位置参数之后，仅关键字参数带标签
     *
     * <p>关键字参数跳过的带默认值参数按其默认值补齐，否则后面的值会错位到前一个参数上。</p>
     */
    private CallTranslation userFunction(String name, FunctionSignature signature, CallExpr call) {
        List<String> parts = positional(call);
        List<Keyword> remaining = new ArrayList<Keyword>(call.getKeywords());
        List<String> skipped = new ArrayList<String>();
        int positionalLeft = call.getArgs().size();
        for (String param : signature.getParamTypes().keySet()) {
            if (param.equals(signature.getVariadic())) {
                // *args 之后只剩仅关键字参数
                positionalLeft = 0;
                skipped.clear();
                continue;
            }
            Keyword keyword = findKeyword(remaining, param);
            if (keyword != null) {
                remaining.remove(keyword);
            }
            if (signature.isKeywordOnly(param)) {
                if (keyword != null) {
                    parts.add(param + ": " + emitter.emit(keyword.getValue()));
                }
                continue;
            }
            if (positionalLeft > 0) {
                positionalLeft--;
                if (keyword != null) {
                    diagnostics.report("Argument '" + param + "' given both by position and by keyword in call to "
                            + name, call);
                }
                continue;
            }
            if (keyword == null) {
                skipped.add(param);
                continue;
            }
            for (String gap : skipped) {
                Expression fallback = signature.getDefault(gap);
                if (fallback != null) {
                    parts.add(emitter.emit(fallback));
                } else {
                    diagnostics.report("Missing argument '" + gap + "' in call to " + name, call);
                    parts.add("/* missing " + gap + " */");
                }
            }
            skipped.clear();
            parts.add(emitter.emit(keyword.getValue()));
        }
        for (Keyword keyword : remaining) {
            if (keyword.isUnpacking()) {
                diagnostics.report("Keyword argument unpacking '**' not supported", keyword.getValue());
            } else {
                diagnostics.report("Unknown keyword argument '" + keyword.getName() + "' in call to " + name, call);
            }
        }
        return CallTranslation.idiom(SwiftStringUtils.identifier(name) + "(" + String.join(", ", parts) + ")");
    }

    private static Keyword findKeyword(List<Keyword> keywords, String name) {
        for (Keyword keyword : keywords) {
            if (!keyword.isUnpacking() && name.equals(keyword.getName())) {
                return keyword;
            }
        }
        return null;
    }

    private Expression arg(CallExpr call, int index) {
        return call.getArgs().get(index);
    }

    private String receiver(Expression expr) {
        return emitter.emit(expr, POSTFIX);
    }

    // ============ 内置函数 ============

    private CallTranslation builtin(String name, CallExpr call) {
        int argc = call.getArgs().size();
        switch (name) {
            case "print":
                return print(call);
            case "len":
                return argc == 1 ? CallTranslation.idiom(receiver(arg(call, 0)) + ".count") : null;
            case "sum":
                return sum(call);
            case "min":
            case "max":
                return minMax(name, call);
            case "abs":
                return argc == 1 ? CallTranslation.idiom("abs(" + emitter.emit(arg(call, 0)) + ")") : null;
            case "round":
                return round(call);
            case "sorted":
                return argc == 1 ? CallTranslation.idiom(receiver(arg(call, 0)) + "." + sortCall("sorted", call)) : null;
            case "reversed":
                return argc == 1 ? CallTranslation.idiom("Array(" + receiver(arg(call, 0)) + ".reversed())") : null;
            case "range":
                return range(call);
            case "str":
                return str(call);
            case "int":
                return toInt(call);
            case "float":
                return toDouble(call);
            case "bool":
                if (argc == 0) return CallTranslation.idiom("false");
                return argc == 1 ? CallTranslation.idiom(emitter.emitCondition(arg(call, 0), POSTFIX)) : null;
            case "list":
                if (argc == 0) return CallTranslation.idiom("[]");
                return argc == 1 ? CallTranslation.idiom("Array(" + emitter.emitIterable(arg(call, 0), false) + ")") : null;
            case "dict":
                return dict(call);
            case "set":
                if (argc == 0) return CallTranslation.idiom("Set<AnyHashable>()");
                return argc == 1 ? CallTranslation.idiom("Set(" + emitter.emit(arg(call, 0)) + ")") : null;
            case "enumerate":
                return enumerate(call);
            case "zip":
                if (argc == 2) {
                    return CallTranslation.idiom("zip(" + emitter.emit(arg(call, 0)) + ", " + emitter.emit(arg(call, 1)) + ")");
                }
                return null;
            case "map":
            case "filter":
                if (argc == 2 && !ExpressionEmitter.isNone(arg(call, 0))) {
                    return CallTranslation.idiom(withFunction(receiver(arg(call, 1)), name, arg(call, 0)));
                }
                return null;
            case "any":
                return anyAll(call, "contains(where: ");
            case "all":
                return anyAll(call, "allSatisfy(");
            case "input":
                return input(call);
            case "isinstance":
                return argc == 2 ? isinstance(arg(call, 0), arg(call, 1)) : null;
            case "type":
                return argc == 1 ? CallTranslation.idiom("type(of: " + emitter.emit(arg(call, 0)) + ")") : null;
            case "chr":
                return argc == 1
                        ? CallTranslation.idiom("String(UnicodeScalar(UInt8(" + emitter.emit(arg(call, 0)) + ")))")
                        : null;
            case "ord":
                return argc == 1
                        ? CallTranslation.idiom("Int(" + receiver(arg(call, 0)) + ".unicodeScalars.first!.value)")
                        : null;
            default:
                return null;
        }
    }

    private CallTranslation print(CallExpr call) {
        List<String> parts = positional(call);
        Expression separator = call.keyword("sep");
        Expression terminator = call.keyword("end");
        // Swift 要求 separator 在 terminator 之前
        if (separator != null) {
            parts.add("separator: " + emitter.emit(separator));
        }
        if (terminator != null) {
            parts.add("terminator: " + emitter.emit(terminator));
        }
        for (Keyword keyword : call.getKeywords()) {
            if (!"sep".equals(keyword.getName()) && !"end".equals(keyword.getName())) {
                diagnostics.report("print() argument '" + (keyword.isUnpacking() ? "**" : keyword.getName()) + "' ignored",
                        keyword.getValue());
            }
        }
        return CallTranslation.idiom("print(" + String.join(", ", parts) + ")");
    }

    private CallTranslation sum(CallExpr call) {
        int argc = call.getArgs().size();
        if (argc == 0 || argc > 2) return null;
        Expression iterable = arg(call, 0);
        String start;
        if (argc == 2) {
            start = emitter.emit(arg(call, 1));
        } else {
            SwiftType element = ExpressionTypeInferrer.elementTypeOf(emitter.typeOf(iterable));
            start = element.isDouble() ? "0.0" : "0";
        }
        return CallTranslation.idiom(receiver(iterable) + ".reduce(" + start + ", +)");
    }

    private CallTranslation minMax(String name, CallExpr call) {
        int argc = call.getArgs().size();
        Expression key = call.keyword("key");
        Expression fallback = call.keyword("default");
        if (argc == 1) {
            String receiver = receiver(arg(call, 0));
            String selection = key != null
                    ? receiver + "." + name + "(by: " + comparator(key, "<") + ")"
                    : receiver + "." + name + "()";
            // 空序列在 Python 中抛 ValueError，强制解包与之一致
            if (fallback != null) {
                return CallTranslation.idiom(selection + " ?? " + emitter.emit(fallback, NIL_COALESCING), NIL_COALESCING);
            }
            return CallTranslation.idiom(selection + "!");
        }
        if (argc >= 2 && key == null) {
            return CallTranslation.idiom(name + "(" + String.join(", ", positional(call)) + ")");
        }
        return null;
    }

    private CallTranslation round(CallExpr call) {
        int argc = call.getArgs().size();
        if (argc == 1) {
            Expression value = arg(call, 0);
            if (emitter.typeOf(value).isInt()) {
                return CallTranslation.idiom(emitter.emit(value), LOWEST);
            }
            return CallTranslation.idiom("Int(" + receiver(value) + ".rounded())");
        }
        if (argc == 2) {
            BigInteger digits = ExpressionEmitter.intLiteral(arg(call, 1));
            if (digits != null && digits.signum() >= 0 && digits.intValue() < 16) {
                String factor = BigInteger.TEN.pow(digits.intValue()) + ".0";
                return CallTranslation.idiom("(" + emitter.emit(arg(call, 0), MULTIPLICATION) + " * " + factor
                        + ").rounded() / " + factor, MULTIPLICATION);
            }
        }
        return null;
    }

    /**
     * sort / sorted 调用，处理 key 与 reverse 关键字
     */
    private String sortCall(String method, CallExpr call) {
        Expression key = call.keyword("key");
        Expression reverse = call.keyword("reverse");
        boolean descending = reverse instanceof ConstantExpr && Boolean.TRUE.equals(((ConstantExpr) reverse).getValue());
        if (reverse != null && !(reverse instanceof ConstantExpr)) {
            diagnostics.report("Non-constant reverse= argument ignored", reverse);
        }
        String op = descending ? ">" : "<";
        if (key != null && !ExpressionEmitter.isNone(key)) {
            return method + "(by: " + comparator(key, op) + ")";
        }
        return descending ? method + "(by: >)" : method + "()";
    }

    /** { key($0) op key($1) } */
    private String comparator(Expression key, String op) {
        return "{ " + applyFunction(key, "$0", COMPARISON + 1) + " " + op + " "
                + applyFunction(key, "$1", COMPARISON + 1) + " }";
    }

    /**
     * 把函数值应用到闭包参数上：lambda 直接替换参数，内置函数按表翻译
     */
    private String applyFunction(Expression function, String parameter, int minPrecedence) {
        if (function instanceof LambdaExpr && ((LambdaExpr) function).getParameters().size() == 1) {
            LambdaExpr lambda = (LambdaExpr) function;
            Map<String, String> renames = new HashMap<String, String>();
            renames.put(lambda.getParameters().get(0).getName(), parameter);
            return emitter.emitWithSubstitution(lambda.getBody(), renames, minPrecedence);
        }
        List<Expression> args = new ArrayList<Expression>();
        args.add(new NameExpr(function.getLocation(), parameter));
        CallExpr synthetic = new CallExpr(function.getLocation(), function, args, Collections.<Keyword>emptyList());
        return emitter.emit(synthetic, minPrecedence);
    }

    /**
     * receiver.map { ... } / receiver.map(f)
     */
    private String withFunction(String receiver, String method, Expression function) {
        if (function instanceof LambdaExpr && ((LambdaExpr) function).getParameters().size() == 1) {
            return receiver + "." + method + " { " + applyFunction(function, "$0", LOWEST) + " }";
        }
        if (function instanceof NameExpr && FUNCTION_VALUE_BUILTINS.contains(((NameExpr) function).getId())
                && types.getSignature(((NameExpr) function).getId()) == null) {
            return receiver + "." + method + " { " + applyFunction(function, "$0", LOWEST) + " }";
        }
        return receiver + "." + method + "(" + emitter.emit(function) + ")";
    }

    private CallTranslation range(CallExpr call) {
        List<Expression> args = call.getArgs();
        switch (args.size()) {
            case 1:
                return CallTranslation.idiom("0..<" + emitter.emit(args.get(0), RANGE + 1), RANGE);
            case 2:
                return CallTranslation.idiom(emitter.emit(args.get(0), RANGE + 1) + "..<"
                        + emitter.emit(args.get(1), RANGE + 1), RANGE);
            case 3:
                return CallTranslation.idiom("stride(from: " + emitter.emit(args.get(0)) + ", to: "
                        + emitter.emit(args.get(1)) + ", by: " + emitter.emit(args.get(2)) + ")");
            default:
                return null;
        }
    }

    private CallTranslation str(CallExpr call) {
        int argc = call.getArgs().size();
        if (argc == 0) return CallTranslation.idiom("\"\"");
        if (argc != 1) return null;
        Expression value = arg(call, 0);
        SwiftType type = emitter.typeOf(value);
        if (type.isNumeric() || type.isBool() || type.isString()) {
            return CallTranslation.idiom("String(" + emitter.emit(value) + ")");
        }
        return CallTranslation.idiom("String(describing: " + emitter.emit(value) + ")");
    }

    private CallTranslation toInt(CallExpr call) {
        int argc = call.getArgs().size();
        if (argc == 0) return CallTranslation.idiom("0");
        Expression value = arg(call, 0);
        SwiftType type = emitter.typeOf(value);
        Expression base = argc == 2 ? arg(call, 1) : call.keyword("base");
        if (base != null) {
            return CallTranslation.idiom("Int(" + emitter.emit(value) + ", radix: " + emitter.emit(base) + ") ?? 0",
                    NIL_COALESCING);
        }
        if (type.isNumeric()) {
            return CallTranslation.idiom("Int(" + emitter.emit(value) + ")");
        }
        if (type.isBool()) {
            return CallTranslation.idiom(emitter.emit(value, TERNARY + 1) + " ? 1 : 0", TERNARY);
        }
        return CallTranslation.idiom("Int(" + emitter.emit(value) + ") ?? 0", NIL_COALESCING);
    }

    private CallTranslation toDouble(CallExpr call) {
        int argc = call.getArgs().size();
        if (argc == 0) return CallTranslation.idiom("0.0");
        if (argc != 1) return null;
        Expression value = arg(call, 0);
        if (emitter.typeOf(value).isNumeric()) {
            return CallTranslation.idiom("Double(" + emitter.emit(value) + ")");
        }
        return CallTranslation.idiom("Double(" + emitter.emit(value) + ") ?? 0.0", NIL_COALESCING);
    }

    private CallTranslation dict(CallExpr call) {
        int argc = call.getArgs().size();
        if (argc == 0) {
            List<String> pairs = new ArrayList<String>();
            for (Keyword keyword : call.getKeywords()) {
                if (keyword.isUnpacking()) {
                    diagnostics.report("Keyword argument unpacking '**' not supported", keyword.getValue());
                    continue;
                }
                pairs.add(SwiftStringUtils.quote(keyword.getName()) + ": " + emitter.emit(keyword.getValue()));
            }
            return CallTranslation.idiom(pairs.isEmpty() ? "[:]" : "[" + String.join(", ", pairs) + "]");
        }
        if (argc == 1 && call.getKeywords().isEmpty()) {
            return CallTranslation.idiom("Dictionary(" + emitter.emit(arg(call, 0)) + ", uniquingKeysWith: { $1 })");
        }
        return null;
    }

    private CallTranslation enumerate(CallExpr call) {
        int argc = call.getArgs().size();
        if (argc < 1 || argc > 2) return null;
        Expression start = argc == 2 ? arg(call, 1) : call.keyword("start");
        if (start != null) {
            return CallTranslation.idiom("zip(" + emitter.emit(start, POSTFIX) + "..., " + emitter.emit(arg(call, 0)) + ")");
        }
        return CallTranslation.idiom(receiver(arg(call, 0)) + ".enumerated()");
    }

    /**
     * any / all：生成器参数直接转为谓词
     */
    private CallTranslation anyAll(CallExpr call, String method) {
        if (call.getArgs().size() != 1) return null;
        Expression argument = arg(call, 0);
        if (argument instanceof GeneratorExpr || argument instanceof ListCompExpr) {
            Expression element = argument instanceof GeneratorExpr
                    ? ((GeneratorExpr) argument).getElement() : ((ListCompExpr) argument).getElement();
            List<Comprehension> generators = argument instanceof GeneratorExpr
                    ? ((GeneratorExpr) argument).getGenerators() : ((ListCompExpr) argument).getGenerators();
            if (generators.size() == 1 && generators.get(0).getIfs().isEmpty()
                    && generators.get(0).getTarget() instanceof NameExpr) {
                Comprehension generator = generators.get(0);
                Map<String, String> renames = new HashMap<String, String>();
                renames.put(((NameExpr) generator.getTarget()).getId(), "$0");
                String predicate = emitter.emitWithSubstitution(element, renames, LOWEST);
                return CallTranslation.idiom(emitter.emitIterable(generator.getIter(), true) + "." + method
                        + "{ " + predicate + " })");
            }
        }
        return CallTranslation.idiom(receiver(argument) + "." + method + "{ $0 })");
    }

    private CallTranslation input(CallExpr call) {
        if (call.getArgs().isEmpty()) {
            return CallTranslation.idiom("readLine() ?? \"\"", NIL_COALESCING);
        }
        return CallTranslation.idiom("{ print(" + emitter.emit(arg(call, 0)) + ", terminator: \"\"); return readLine() ?? \"\" }()");
    }

    private CallTranslation isinstance(Expression value, Expression typeExpr) {
        if (typeExpr instanceof TupleExpr) {
            List<String> checks = new ArrayList<String>();
            for (Expression element : ((TupleExpr) typeExpr).getElements()) {
                checks.add(typeCheck(value, element));
            }
            return CallTranslation.idiom(String.join(" || ", checks), DISJUNCTION);
        }
        return CallTranslation.idiom(typeCheck(value, typeExpr), CASTING);
    }

    private String typeCheck(Expression value, Expression typeExpr) {
        String typeName;
        if (typeExpr instanceof NameExpr && ISINSTANCE_TYPES.containsKey(((NameExpr) typeExpr).getId())) {
            typeName = ISINSTANCE_TYPES.get(((NameExpr) typeExpr).getId());
        } else {
            typeName = emitter.emit(typeExpr, POSTFIX);
        }
        return emitter.emit(value, CASTING + 1) + " is " + typeName;
    }

    // ============ 模块函数 ============

    private CallTranslation moduleFunction(String module, String function, CallExpr call) {
        int argc = call.getArgs().size();
        if ("math".equals(module)) {
            if ("log".equals(function) && argc == 2) {
                return CallTranslation.idiom("log(" + doubleArg(arg(call, 0)) + ") / log(" + doubleArg(arg(call, 1)) + ")",
                        MULTIPLICATION);
            }
            String swift = MATH_FUNCTIONS.get(function);
            if (swift == null || argc == 0) return null;
            List<String> args = new ArrayList<String>();
            for (Expression argument : call.getArgs()) {
                args.add(doubleArg(argument));
            }
            return CallTranslation.idiom(swift + "(" + String.join(", ", args) + ")");
        }
        if ("random".equals(module)) {
            switch (function) {
                case "random":
                    return argc == 0 ? CallTranslation.idiom("Double.random(in: 0..<1)") : null;
                case "randint":
                    return argc == 2 ? CallTranslation.idiom("Int.random(in: " + emitter.emit(arg(call, 0), RANGE + 1)
                            + "..." + emitter.emit(arg(call, 1), RANGE + 1) + ")") : null;
                case "uniform":
                    return argc == 2 ? CallTranslation.idiom("Double.random(in: " + emitter.emit(arg(call, 0), RANGE + 1)
                            + "..." + emitter.emit(arg(call, 1), RANGE + 1) + ")") : null;
                case "choice":
                    return argc == 1 ? CallTranslation.idiom(receiver(arg(call, 0)) + ".randomElement()!") : null;
                case "shuffle":
                    return argc == 1 ? CallTranslation.idiom(receiver(arg(call, 0)) + ".shuffle()") : null;
                default:
                    return null;
            }
        }
        if ("time".equals(module) && "time".equals(function) && argc == 0) {
            return CallTranslation.idiom("Date().timeIntervalSince1970");
        }
        return null;
    }

    private String doubleArg(Expression expr) {
        if (emitter.typeOf(expr).isInt() && ExpressionEmitter.intLiteral(expr) == null) {
            return "Double(" + emitter.emit(expr) + ")";
        }
        return emitter.emit(expr);
    }

    // ============ 方法 ============

    private CallTranslation method(Expression receiverExpr, String o, String name, CallExpr call) {
        int argc = call.getArgs().size();
        SwiftType receiverType = emitter.typeOf(receiverExpr);
        switch (name) {
            case "lower":
                return argc == 0 ? CallTranslation.idiom(o + ".lowercased()") : null;
            case "upper":
                return argc == 0 ? CallTranslation.idiom(o + ".uppercased()") : null;
            case "strip":
                if (argc == 0) return CallTranslation.idiom(o + ".trimmingCharacters(in: .whitespacesAndNewlines)");
                return argc == 1 ? CallTranslation.idiom(o + ".trimmingCharacters(in: CharacterSet(charactersIn: "
                        + emitter.emit(arg(call, 0)) + "))") : null;
            case "replace":
                return argc == 2 ? CallTranslation.idiom(o + ".replacingOccurrences(of: " + emitter.emit(arg(call, 0))
                        + ", with: " + emitter.emit(arg(call, 1)) + ")") : null;
            case "split":
                if (argc == 0) return CallTranslation.idiom(o + ".split(separator: \" \").map(String.init)");
                return argc == 1 ? CallTranslation.idiom(o + ".components(separatedBy: " + emitter.emit(arg(call, 0)) + ")") : null;
            case "join":
                return argc == 1 ? CallTranslation.idiom(receiver(arg(call, 0)) + ".joined(separator: "
                        + o + ")") : null;
            case "startswith":
                return argc == 1 ? CallTranslation.idiom(o + ".hasPrefix(" + emitter.emit(arg(call, 0)) + ")") : null;
            case "endswith":
                return argc == 1 ? CallTranslation.idiom(o + ".hasSuffix(" + emitter.emit(arg(call, 0)) + ")") : null;
            case "capitalize":
            case "title":
                return argc == 0 ? CallTranslation.idiom(o + ".capitalized") : null;
            case "isdigit":
                return argc == 0 ? CallTranslation.idiom(o + ".allSatisfy { $0.isNumber }") : null;
            case "isalpha":
                return argc == 0 ? CallTranslation.idiom(o + ".allSatisfy { $0.isLetter }") : null;
            case "isspace":
                return argc == 0 ? CallTranslation.idiom(o + ".allSatisfy { $0.isWhitespace }") : null;
            case "append":
                return argc == 1 ? CallTranslation.idiom(o + ".append(" + emitter.emit(arg(call, 0)) + ")") : null;
            case "extend":
                return argc == 1 ? CallTranslation.idiom(o + ".append(contentsOf: " + emitter.emit(arg(call, 0)) + ")") : null;
            case "insert":
                return argc == 2 ? CallTranslation.idiom(o + ".insert(" + emitter.emit(arg(call, 1)) + ", at: "
                        + emitter.emit(arg(call, 0)) + ")") : null;
            case "remove":
                // Python 只删除第一个匹配项
                return argc == 1 ? CallTranslation.idiom(o + ".remove(at: " + o + ".firstIndex(of: "
                        + emitter.emit(arg(call, 0)) + ")!)") : null;
            case "pop":
                return pop(o, receiverType, call);
            case "get":
                if (argc == 1) return CallTranslation.idiom(o + "[" + emitter.emit(arg(call, 0)) + "]");
                return argc == 2 ? CallTranslation.idiom(o + "[" + emitter.emit(arg(call, 0)) + "] ?? "
                        + emitter.emit(arg(call, 1), NIL_COALESCING), NIL_COALESCING) : null;
            case "keys":
                return argc == 0 ? CallTranslation.idiom("Array(" + o + ".keys)") : null;
            case "values":
                return argc == 0 ? CallTranslation.idiom("Array(" + o + ".values)") : null;
            case "items":
                return argc == 0 ? CallTranslation.idiom("Array(" + o + ")") : null;
            case "sort":
                return argc == 0 ? CallTranslation.idiom(o + "." + sortCall("sort", call)) : null;
            case "count":
                if (argc != 1) return null;
                if (receiverType.isString()) {
                    return CallTranslation.idiom(o + ".components(separatedBy: " + emitter.emit(arg(call, 0)) + ").count - 1",
                            ADDITION);
                }
                return CallTranslation.idiom(o + ".filter { $0 == " + emitter.emit(arg(call, 0), COMPARISON + 1) + " }.count");
            case "index":
                return argc == 1 ? CallTranslation.idiom(o + ".firstIndex(of: " + emitter.emit(arg(call, 0)) + ")!") : null;
            case "clear":
                return argc == 0 ? CallTranslation.idiom(o + ".removeAll()") : null;
            case "copy":
                // 值语义，直接复用
                return argc == 0 ? CallTranslation.idiom(o) : null;
            case "update":
                return argc == 1 ? CallTranslation.idiom(o + ".merge(" + emitter.emit(arg(call, 0)) + ") { $1 }") : null;
            case "add":
                return argc == 1 ? CallTranslation.idiom(o + ".insert(" + emitter.emit(arg(call, 0)) + ")") : null;
            default:
                return null;
        }
    }

    private CallTranslation pop(String o, SwiftType receiverType, CallExpr call) {
        int argc = call.getArgs().size();
        if (receiverType instanceof MapSwiftType) {
            if (argc == 1) return CallTranslation.idiom(o + ".removeValue(forKey: " + emitter.emit(arg(call, 0)) + ")!");
            return argc == 2 ? CallTranslation.idiom(o + ".removeValue(forKey: " + emitter.emit(arg(call, 0)) + ") ?? "
                    + emitter.emit(arg(call, 1), NIL_COALESCING), NIL_COALESCING) : null;
        }
        if (argc == 0) return CallTranslation.idiom(o + ".removeLast()");
        if (argc != 1) return null;
        BigInteger index = ExpressionEmitter.intLiteral(arg(call, 0));
        if (index != null && index.signum() == 0) return CallTranslation.idiom(o + ".removeFirst()");
        if (index != null && index.equals(BigInteger.ONE.negate())) return CallTranslation.idiom(o + ".removeLast()");
        return CallTranslation.idiom(o + ".remove(at: " + emitter.emit(arg(call, 0)) + ")");
    }
}
