package com.py2swift.compiler.analysis;

import com.py2swift.compiler.analysis.types.SwiftType;
import com.py2swift.compiler.analysis.types.SwiftTypes;
import com.py2swift.compiler.ast.AstScanner;
import com.py2swift.compiler.ast.Parameter;
import com.py2swift.compiler.ast.expr.*;
import com.py2swift.compiler.ast.stmt.*;
import com.py2swift.compiler.ast.stmt.Module;
import com.py2swift.compiler.diagnostic.DiagnosticSink;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 两遍类型推断
 *
 * <ol>
 *   <li>签名收集：按注解建立每个函数的参数 / 返回类型，未注解的参数为 Any</li>
 *   <li>类型传播：按源码顺序记录首次赋值的变量类型，细化 Any 参数并推断返回类型</li>
 * </ol>
 *
 * <p>不迭代到不动点：调用尚未访问到的函数时，其返回类型按 Any 处理。</p>
 */
public class TwoPassTypeInference implements TypeInference {
    private static final Logger LOG = Logger.getLogger(TwoPassTypeInference.class.getName());

    @Override
    public InferenceResult infer(Module module, DiagnosticSink diagnostics) {
        Map<String, FunctionSignature> signatures = new LinkedHashMap<String, FunctionSignature>();
        Map<FunctionDefStmt, FunctionSignature> byNode = new IdentityHashMap<FunctionDefStmt, FunctionSignature>();
        Map<String, SwiftType> varTypes = new LinkedHashMap<String, SwiftType>();
        Map<String, Map<String, SwiftType>> attributes = new LinkedHashMap<String, Map<String, SwiftType>>();
        ExpressionTypeInferrer typer = new ExpressionTypeInferrer(varTypes, signatures);

        new SignatureCollector(signatures, byNode, diagnostics).scan(module, null);
        new TypePropagator(typer, byNode, varTypes, attributes).scan(module, null);

        return new InferenceResult(signatures, byNode, varTypes, attributes, typer);
    }

    // ============ 第一遍：签名收集 ============

    private static final class SignatureCollector extends AstScanner<Void> {
        private final Map<String, FunctionSignature> signatures;
        private final Map<FunctionDefStmt, FunctionSignature> byNode;
        private final DiagnosticSink diagnostics;

        SignatureCollector(Map<String, FunctionSignature> signatures,
                           Map<FunctionDefStmt, FunctionSignature> byNode,
                           DiagnosticSink diagnostics) {
            this.signatures = signatures;
            this.byNode = byNode;
            this.diagnostics = diagnostics;
        }

        @Override
        public Void visitFunctionDef(FunctionDefStmt node, Void ctx) {
            SwiftType returnType = null;
            if (node.getReturns() != null) {
                returnType = AnnotationTypes.toReturnType(node.getReturns());
                checkAnnotation(node.getReturns(), returnType);
            }
            FunctionSignature signature = new FunctionSignature(node.getName(), returnType);

            boolean classMethod = node.hasDecorator("classmethod");
            for (Parameter param : node.getParameters()) {
                if (param.isKwarg() || isReceiver(param.getName(), classMethod)) {
                    continue;
                }
                SwiftType type = SwiftTypes.ANY;
                if (param.getAnnotation() != null) {
                    type = AnnotationTypes.toSwiftType(param.getAnnotation());
                    checkAnnotation(param.getAnnotation(), type);
                }
                // *args 在函数体内是数组
                signature.setParamType(param.getName(), param.isVararg() ? SwiftTypes.arrayOf(type) : type);
                if (param.getKind() == Parameter.Kind.KEYWORD_ONLY) {
                    signature.markKeywordOnly(param.getName());
                }
                if (param.isVararg()) {
                    signature.markVariadic(param.getName());
                }
                if (param.getDefaultValue() != null) {
                    signature.setDefault(param.getName(), param.getDefaultValue());
                }
            }

            signatures.put(node.getName(), signature);
            byNode.put(node, signature);
            return super.visitFunctionDef(node, ctx);
        }

        private void checkAnnotation(Expression annotation, SwiftType mapped) {
            if (!mapped.isAny()) return;
            if (annotation instanceof NameExpr) {
                String name = ((NameExpr) annotation).getId();
                if ("Any".equals(name) || "object".equals(name)) return;
                diagnostics.report("Type annotation '" + name + "' has no Swift mapping, using Any", annotation);
            } else if (annotation instanceof SubscriptExpr
                    && ((SubscriptExpr) annotation).getValue() instanceof NameExpr) {
                String name = ((NameExpr) ((SubscriptExpr) annotation).getValue()).getId();
                diagnostics.report("Type annotation '" + name + "[...]' has no Swift mapping, using Any", annotation);
            }
        }
    }

    static boolean isReceiver(String paramName, boolean classMethod) {
        return "self".equals(paramName) || (classMethod && "cls".equals(paramName));
    }

    // ============ 第二遍：类型传播 ============

    private static final class TypePropagator extends AstScanner<Void> {
        private final ExpressionTypeInferrer typer;
        private final Map<FunctionDefStmt, FunctionSignature> byNode;
        private final Map<String, SwiftType> varTypes;
        private final Map<String, Map<String, SwiftType>> attributes;

        // 外层定义：class:<name> / func:<name>
        private final Deque<String> owners = new ArrayDeque<String>();
        // 当前 __init__ 所属类的属性表
        private Map<String, SwiftType> initAttributes;

        TypePropagator(ExpressionTypeInferrer typer,
                       Map<FunctionDefStmt, FunctionSignature> byNode,
                       Map<String, SwiftType> varTypes,
                       Map<String, Map<String, SwiftType>> attributes) {
            this.typer = typer;
            this.byNode = byNode;
            this.varTypes = varTypes;
            this.attributes = attributes;
        }

        @Override
        public Void visitClassDef(ClassDefStmt node, Void ctx) {
            if (!attributes.containsKey(node.getName())) {
                attributes.put(node.getName(), new LinkedHashMap<String, SwiftType>());
            }
            owners.push("class:" + node.getName());
            scanStatements(node.getBody(), ctx);
            owners.pop();
            return null;
        }

        @Override
        public Void visitFunctionDef(FunctionDefStmt node, Void ctx) {
            FunctionSignature signature = byNode.get(node);
            refineParameters(node, signature);

            String owner = owners.peek();
            Map<String, SwiftType> savedAttributes = initAttributes;
            initAttributes = "__init__".equals(node.getName()) && owner != null && owner.startsWith("class:")
                    ? attributes.get(owner.substring("class:".length()))
                    : null;

            owners.push("func:" + node.getName());
            typer.enterFunction(signature);
            try {
                scanStatements(node.getBody(), ctx);
                if (!signature.isReturnAnnotated()) {
                    signature.setReturnType(inferReturnType(node));
                }
            } finally {
                typer.exitFunction();
                owners.pop();
                initAttributes = savedAttributes;
            }
            LOG.fine(() -> "signature " + signature);
            return null;
        }

        @Override
        public Void visitAssign(AssignStmt node, Void ctx) {
            SwiftType valueType = typer.infer(node.getValue());
            for (Expression target : node.getTargets()) {
                bind(target, node.getValue(), valueType);
            }
            return null;
        }

        @Override
        public Void visitAnnAssign(AnnAssignStmt node, Void ctx) {
            SwiftType declared = AnnotationTypes.toSwiftType(node.getAnnotation());
            bind(node.getTarget(), node.getValue(), declared.isAny() && node.getValue() != null
                    ? typer.infer(node.getValue()) : declared);
            return null;
        }

        @Override
        public Void visitFor(ForStmt node, Void ctx) {
            if (node.getTarget() instanceof NameExpr) {
                SwiftType element = ExpressionTypeInferrer.elementTypeOf(typer.infer(node.getIter()));
                putIfAbsent(((NameExpr) node.getTarget()).getId(), element);
            }
            scanStatements(node.getBody(), ctx);
            scanStatements(node.getOrElse(), ctx);
            return null;
        }

        private void bind(Expression target, Expression value, SwiftType valueType) {
            if (target instanceof NameExpr) {
                putIfAbsent(((NameExpr) target).getId(), valueType);
            } else if (target instanceof AttributeExpr) {
                AttributeExpr attr = (AttributeExpr) target;
                if (initAttributes != null && isSelf(attr.getValue()) && !initAttributes.containsKey(attr.getAttr())) {
                    initAttributes.put(attr.getAttr(), valueType);
                }
            } else if (target instanceof TupleExpr || target instanceof ListExpr) {
                List<Expression> targets = elementsOf(target);
                List<Expression> values = value instanceof TupleExpr || value instanceof ListExpr
                        ? elementsOf(value) : null;
                for (int i = 0; i < targets.size(); i++) {
                    if (values != null && values.size() == targets.size()) {
                        bind(targets.get(i), values.get(i), typer.infer(values.get(i)));
                    } else {
                        bind(targets.get(i), null, SwiftTypes.ANY);
                    }
                }
            }
        }

        private void putIfAbsent(String name, SwiftType type) {
            if (!varTypes.containsKey(name)) {
                varTypes.put(name, type);
            }
        }

        // ---- 参数细化 ----

        private void refineParameters(FunctionDefStmt node, FunctionSignature signature) {
            typer.enterFunction(signature);
            try {
                for (Parameter param : node.getParameters()) {
                    if (param.isVararg() || !signature.hasParam(param.getName())
                            || !signature.getParamType(param.getName()).isAny()) {
                        continue;
                    }
                    ParamUsageScanner scanner = new ParamUsageScanner(param.getName(), typer);
                    scanner.scanStatements(node.getBody(), null);
                    SwiftType refined = scanner.result();
                    if (refined != null) {
                        signature.setParamType(param.getName(), refined);
                        LOG.fine(() -> "parameter " + node.getName() + "." + param.getName() + " refined to " + refined);
                    }
                }
            } finally {
                typer.exitFunction();
            }
        }

        // ---- 返回类型 ----

        private SwiftType inferReturnType(FunctionDefStmt node) {
            List<Expression> values = ReturnValues.of(node);
            if (values.isEmpty()) {
                return SwiftTypes.VOID;
            }

            Set<SwiftType> observed = new LinkedHashSet<SwiftType>();
            for (Expression value : values) {
                observed.add(typer.infer(value));
            }
            if (observed.size() == 1) {
                return observed.iterator().next();
            }
            if (observed.size() == 2 && observed.contains(SwiftTypes.INT) && observed.contains(SwiftTypes.DOUBLE)) {
                LOG.fine(() -> "return type of " + node.getName() + " promoted to Double");
                return SwiftTypes.DOUBLE;
            }
            for (Expression value : values) {
                if (!typer.isIntExpression(value)) {
                    return SwiftTypes.ANY;
                }
            }
            LOG.fine(() -> "return type of " + node.getName() + " forced to Int");
            return SwiftTypes.INT;
        }
    }

    static boolean isSelf(Expression expr) {
        return expr instanceof NameExpr && "self".equals(((NameExpr) expr).getId());
    }

    static List<Expression> elementsOf(Expression expr) {
        if (expr instanceof TupleExpr) return ((TupleExpr) expr).getElements();
        if (expr instanceof ListExpr) return ((ListExpr) expr).getElements();
        return new ArrayList<Expression>();
    }

    /**
     * 扫描参数在函数体中的用法：算术操作数推断为 Int（与 Double 同现时为 Double），
     * 与数值比较时取该数值类型；同时出现时优先 Int
     */
    private static final class ParamUsageScanner extends AstScanner<Void> {
        private final String param;
        private final ExpressionTypeInferrer typer;
        private boolean sawInt;
        private boolean sawDouble;

        ParamUsageScanner(String param, ExpressionTypeInferrer typer) {
            this.param = param;
            this.typer = typer;
        }

        SwiftType result() {
            if (sawInt) return SwiftTypes.INT;
            if (sawDouble) return SwiftTypes.DOUBLE;
            return null;
        }

        private boolean isParam(Expression expr) {
            return expr instanceof NameExpr && param.equals(((NameExpr) expr).getId());
        }

        private void observeArithmetic(Expression other) {
            SwiftType type = typer.infer(other);
            if (type.isDouble()) {
                sawDouble = true;
            } else if (type.isInt() || type.isAny()) {
                sawInt = true;
            }
            // 字符串拼接、数组运算等不参与推断
        }

        private void observeComparison(Expression other) {
            SwiftType type = typer.infer(other);
            if (type.isInt()) {
                sawInt = true;
            } else if (type.isDouble()) {
                sawDouble = true;
            }
        }

        @Override
        public Void visitBinary(BinaryExpr node, Void ctx) {
            if (isNumericOperator(node.getOperator())) {
                if (isParam(node.getLeft())) observeArithmetic(node.getRight());
                if (isParam(node.getRight())) observeArithmetic(node.getLeft());
            }
            return super.visitBinary(node, ctx);
        }

        @Override
        public Void visitAugAssign(AugAssignStmt node, Void ctx) {
            if (isParam(node.getTarget()) && isNumericOperator(node.getOperator())) {
                observeArithmetic(node.getValue());
            }
            return super.visitAugAssign(node, ctx);
        }

        @Override
        public Void visitCompare(CompareExpr node, Void ctx) {
            Expression left = node.getLeft();
            for (int i = 0; i < node.getOperators().size(); i++) {
                Expression right = node.getComparators().get(i);
                switch (node.getOperators().get(i)) {
                    case EQ:
                    case NOT_EQ:
                    case LT:
                    case LT_E:
                    case GT:
                    case GT_E:
                        if (isParam(left)) observeComparison(right);
                        if (isParam(right)) observeComparison(left);
                        break;
                    default:
                        break;
                }
                left = right;
            }
            return super.visitCompare(node, ctx);
        }

        // 嵌套定义可能遮蔽参数名
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

        private static boolean isNumericOperator(BinaryExpr.Operator op) {
            switch (op) {
                case ADD:
                case SUB:
                case MULT:
                case DIV:
                case FLOOR_DIV:
                case MOD:
                case POW:
                    return true;
                default:
                    return false;
            }
        }
    }
}
