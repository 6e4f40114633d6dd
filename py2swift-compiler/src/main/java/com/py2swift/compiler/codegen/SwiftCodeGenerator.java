package com.py2swift.compiler.codegen;

import com.py2swift.compiler.analysis.AnnotationTypes;
import com.py2swift.compiler.analysis.ExpressionTypeInferrer;
import com.py2swift.compiler.analysis.FunctionSignature;
import com.py2swift.compiler.analysis.InferenceResult;
import com.py2swift.compiler.analysis.ReturnValues;
import com.py2swift.compiler.analysis.Scope;
import com.py2swift.compiler.analysis.ScopeManager;
import com.py2swift.compiler.analysis.types.MapSwiftType;
import com.py2swift.compiler.analysis.types.SwiftType;
import com.py2swift.compiler.analysis.types.SwiftTypes;
import com.py2swift.compiler.ast.AstScanner;
import com.py2swift.compiler.ast.Parameter;
import com.py2swift.compiler.ast.StmtVisitor;
import com.py2swift.compiler.ast.expr.*;
import com.py2swift.compiler.ast.stmt.*;
import com.py2swift.compiler.ast.stmt.Module;
import com.py2swift.compiler.diagnostic.Diagnostic;
import com.py2swift.compiler.diagnostic.DiagnosticSink;
import com.py2swift.compiler.transpiler.TranspilerConfig;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import static com.py2swift.compiler.codegen.SwiftStringUtils.identifier;

/**
 * Swift 代码生成器
 *
 * <p>按语句逐条输出 Swift 源码。表达式交给 {@link ExpressionEmitter}，
 * 变量是否已声明由 {@link ScopeManager} 判定：首次绑定输出 let / var 声明，
 * 之后的绑定输出普通赋值。</p>
 *
 * <p>无法翻译的构造不会中断生成，而是记录诊断并尽量输出可读的替代代码。</p>
 */
public class SwiftCodeGenerator implements StmtVisitor<Void, Void> {
    private static final Logger LOG = Logger.getLogger(SwiftCodeGenerator.class.getName());

    /** 这些模块的功能由 Foundation 提供 */
    private static final Set<String> FOUNDATION_MODULES = new HashSet<String>(
            Arrays.asList("math", "random", "datetime", "json", "time", "os", "sys"));

    private static final Set<String> KNOWN_DECORATORS = new HashSet<String>(
            Arrays.asList("staticmethod", "classmethod", "property"));

    private final TranspilerConfig config;
    private final InferenceResult types;
    private final DiagnosticSink diagnostics;
    private final ScopeManager scopes;
    private final CodeWriter out;
    private final Set<String> emittedImports = new LinkedHashSet<String>();
    private final Deque<Set<String>> reboundNames = new ArrayDeque<Set<String>>();

    private ExpressionEmitter expr;
    private boolean inInit;

    public SwiftCodeGenerator(InferenceResult types, DiagnosticSink diagnostics, TranspilerConfig config) {
        this(types, diagnostics, config, new ScopeManager());
    }

    public SwiftCodeGenerator(InferenceResult types, DiagnosticSink diagnostics,
                              TranspilerConfig config, ScopeManager scopes) {
        this.types = types;
        this.diagnostics = diagnostics;
        this.config = config;
        this.scopes = scopes;
        this.out = new CodeWriter(config.getIndentString());
    }

    public String generate(Module module) {
        expr = new ExpressionEmitter(types, diagnostics, collectClassNames(module));

        if (config.isEmitHeader()) {
            out.line("import Foundation");
            emittedImports.add("Foundation");
            out.blankLine();
            out.line("// Transpiled from Python to Swift");
            out.line("// Generated automatically - may require manual adjustments");
            out.blankLine();
        }

        module.accept(this, null);

        if (config.isEmitDiagnosticsBlock() && !diagnostics.isEmpty()) {
            out.blankLine();
            out.line("// TRANSPILATION WARNINGS:");
            for (Diagnostic d : diagnostics.getDiagnostics()) {
                out.line("// " + d.render());
            }
        }
        LOG.fine(() -> "generated " + out.size() + " lines, " + diagnostics.size() + " diagnostics");
        return out.render();
    }

    public ScopeManager getScopes() {
        return scopes;
    }

    // ============ 模块 ============

    @Override
    public Void visitModule(Module node, Void ctx) {
        reboundNames.push(RebindingScanner.reboundIn(node));
        for (Statement stmt : node.getBody()) {
            if (config.isInlineMainGuard() && stmt instanceof IfStmt && isMainGuard(((IfStmt) stmt).getTest())) {
                LOG.fine("inlining __main__ guard");
                emitStatements(((IfStmt) stmt).getBody());
                continue;
            }
            stmt.accept(this, ctx);
        }
        reboundNames.pop();
        return null;
    }

    private static boolean isMainGuard(Expression test) {
        if (!(test instanceof CompareExpr)) {
            return false;
        }
        CompareExpr compare = (CompareExpr) test;
        return ExpressionEmitter.isName(compare.getLeft(), "__name__")
                && compare.getOperators().size() == 1
                && compare.getOperators().get(0) == CompareExpr.Operator.EQ;
    }

    // ============ 定义 ============

    @Override
    public Void visitFunctionDef(FunctionDefStmt node, Void ctx) {
        boolean inClass = scopes.inClassBody();
        boolean isStatic = node.hasDecorator("staticmethod");
        boolean isClassMethod = node.hasDecorator("classmethod");
        boolean isProperty = inClass && node.hasDecorator("property");
        boolean isInit = inClass && "__init__".equals(node.getName());
        for (Expression decorator : node.getDecorators()) {
            String name = decoratorName(decorator);
            if (!KNOWN_DECORATORS.contains(name)) {
                diagnostics.report("Decorator '@" + name + "' ignored", decorator);
            }
        }

        FunctionSignature signature = types.getSignature(node);
        if (signature == null) {
            signature = new FunctionSignature(node.getName(), SwiftTypes.ANY);
        }

        // 默认值在外层作用域求值
        List<String> params = new ArrayList<String>();
        List<Parameter> parameters = node.getParameters();
        for (int i = 0; i < parameters.size(); i++) {
            Parameter param = parameters.get(i);
            if (i == 0 && inClass && !isStatic && param.getKind() == Parameter.Kind.POSITIONAL) {
                continue;
            }
            String code = parameterCode(param, signature);
            if (code != null) {
                params.add(code);
            }
        }

        ExpressionTypeInferrer typer = types.getTyper();
        typer.enterFunction(signature);
        try {
            SwiftType returnType = returnTypeOf(node, signature);

            String header;
            if (isInit) {
                header = "init(" + String.join(", ", params) + ") {";
            } else if (isProperty) {
                header = "var " + identifier(node.getName()) + ": " + returnType.toSwiftString() + " {";
            } else {
                String prefix = isClassMethod ? "class func " : isStatic ? "static func " : "func ";
                header = prefix + identifier(node.getName()) + "(" + String.join(", ", params) + ")"
                        + (returnType.isVoid() ? "" : " -> " + returnType.toSwiftString()) + " {";
            }

            boolean spaced = inClass || scopes.depth() == 1;
            if (spaced) {
                out.separator();
            }
            out.line(header);
            out.indent();
            scopes.pushScope(Scope.ScopeType.FUNCTION, node.getName());
            reboundNames.push(RebindingScanner.reboundIn(node.getBody()));
            boolean savedInit = inInit;
            inInit = isInit;
            try {
                shadowReboundParameters(node, signature, inClass && !isStatic);
                emitBody(node.getBody());
            } finally {
                inInit = savedInit;
                reboundNames.pop();
                scopes.popScope();
                out.dedent();
            }
            out.line("}");
            if (spaced && !inClass) {
                out.blankLine();
            }
        } finally {
            typer.exitFunction();
        }
        return null;
    }

    /** 函数体内被重新绑定的参数先复制为同名 var */
    private void shadowReboundParameters(FunctionDefStmt node, FunctionSignature signature, boolean hasReceiver) {
        Set<String> bound = RebindingScanner.boundIn(node.getBody());
        List<Parameter> parameters = node.getParameters();
        for (int i = hasReceiver ? 1 : 0; i < parameters.size(); i++) {
            Parameter param = parameters.get(i);
            if (param.isKwarg() || !bound.contains(param.getName())) {
                continue;
            }
            String id = identifier(param.getName());
            out.line("var " + id + " = " + id);
            SwiftType type = signature.hasParam(param.getName()) ? signature.getParamType(param.getName()) : SwiftTypes.ANY;
            scopes.declare(param.getName(), type, true);
        }
    }

    private String parameterCode(Parameter param, FunctionSignature signature) {
        String name = identifier(param.getName());
        SwiftType type = signature.hasParam(param.getName()) ? signature.getParamType(param.getName()) : SwiftTypes.ANY;
        switch (param.getKind()) {
            case KWARG:
                diagnostics.report("**kwargs parameter '" + param.getName() + "' not supported, dropped", param);
                return null;
            case VARARG:
                return "_ " + name + ": " + ExpressionTypeInferrer.elementTypeOf(type).toSwiftString() + "...";
            default:
                break;
        }
        String label = param.getKind() == Parameter.Kind.KEYWORD_ONLY ? name : "_ " + name;
        Expression defaultValue = param.getDefaultValue();
        if (defaultValue == null) {
            return label + ": " + type.toSwiftString();
        }
        if (ExpressionEmitter.isNone(defaultValue)) {
            return label + ": " + type.toSwiftString() + "? = nil";
        }
        return label + ": " + type.toSwiftString() + " = " + expr.emit(defaultValue);
    }

    /** 推断为 Any / Double 但所有 return 都是整数表达式时收紧为 Int */
    private SwiftType returnTypeOf(FunctionDefStmt node, FunctionSignature signature) {
        SwiftType declared = signature.getReturnType();
        if (declared == null) {
            return SwiftTypes.ANY;
        }
        if (!signature.isReturnAnnotated() && (declared.isAny() || declared.isDouble())) {
            List<Expression> values = ReturnValues.of(node);
            if (values.isEmpty()) {
                return declared;
            }
            for (Expression value : values) {
                if (!types.getTyper().isIntExpression(value)) {
                    return declared;
                }
            }
            LOG.fine(() -> "return type of " + node.getName() + " narrowed to Int");
            return SwiftTypes.INT;
        }
        return declared;
    }

    private static String decoratorName(Expression decorator) {
        if (decorator instanceof CallExpr) {
            return decoratorName(((CallExpr) decorator).getFunction());
        }
        if (decorator instanceof NameExpr) {
            return ((NameExpr) decorator).getId();
        }
        if (decorator instanceof AttributeExpr) {
            AttributeExpr attr = (AttributeExpr) decorator;
            return decoratorName(attr.getValue()) + "." + attr.getAttr();
        }
        return ExpressionEmitter.kindName(decorator);
    }

    @Override
    public Void visitClassDef(ClassDefStmt node, Void ctx) {
        List<String> bases = new ArrayList<String>();
        for (Expression base : node.getBases()) {
            if (!ExpressionEmitter.isName(base, "object")) {
                bases.add(expr.emit(base));
            }
        }
        for (Expression decorator : node.getDecorators()) {
            diagnostics.report("Decorator '@" + decoratorName(decorator) + "' ignored", decorator);
        }

        out.separator();
        out.line("class " + identifier(node.getName())
                + (bases.isEmpty() ? "" : ": " + String.join(", ", bases)) + " {");
        out.indent();
        scopes.pushScope(Scope.ScopeType.CLASS, node.getName());
        reboundNames.push(Collections.<String>emptySet());

        List<Statement> body = node.getBody();
        int start = emitDocstring(body);

        Set<String> classLevel = new HashSet<String>();
        for (Statement stmt : body) {
            if (stmt instanceof AssignStmt) {
                for (Expression target : ((AssignStmt) stmt).getTargets()) {
                    if (target instanceof NameExpr) {
                        classLevel.add(((NameExpr) target).getId());
                    }
                }
            } else if (stmt instanceof AnnAssignStmt && ((AnnAssignStmt) stmt).getTarget() instanceof NameExpr) {
                classLevel.add(((NameExpr) ((AnnAssignStmt) stmt).getTarget()).getId());
            }
        }

        boolean declaredAttributes = false;
        for (Map.Entry<String, SwiftType> attr : types.getInstanceAttributes(node.getName()).entrySet()) {
            if (classLevel.contains(attr.getKey())) {
                continue;
            }
            out.line("var " + identifier(attr.getKey()) + ": " + attr.getValue().toSwiftString());
            declaredAttributes = true;
        }
        if (declaredAttributes) {
            out.blankLine();
        }

        try {
            for (int i = start; i < body.size(); i++) {
                Statement stmt = body.get(i);
                if (stmt instanceof AssignStmt) {
                    emitStaticAssign((AssignStmt) stmt);
                } else if (stmt instanceof AnnAssignStmt && ((AnnAssignStmt) stmt).getTarget() instanceof NameExpr) {
                    emitClassAnnAssign((AnnAssignStmt) stmt);
                } else {
                    stmt.accept(this, null);
                }
            }
        } finally {
            reboundNames.pop();
            scopes.popScope();
            out.dedent();
        }
        out.line("}");
        out.blankLine();
        return null;
    }

    private void emitStaticAssign(AssignStmt stmt) {
        for (Expression target : stmt.getTargets()) {
            if (!(target instanceof NameExpr)) {
                diagnostics.report("Class attribute target not supported: " + ExpressionEmitter.kindName(target), stmt);
                continue;
            }
            String name = ((NameExpr) target).getId();
            SwiftType type = expr.typeOf(stmt.getValue());
            out.line("static var " + identifier(name) + typeSuffix(type) + " = " + expr.emit(stmt.getValue()));
            scopes.declare(name, type, true);
        }
    }

    private void emitClassAnnAssign(AnnAssignStmt stmt) {
        String name = ((NameExpr) stmt.getTarget()).getId();
        SwiftType type = AnnotationTypes.toSwiftType(stmt.getAnnotation());
        if (stmt.getValue() == null) {
            out.line("var " + identifier(name) + ": " + type.toSwiftString());
        } else {
            out.line("static var " + identifier(name) + ": " + type.toSwiftString() + " = " + expr.emit(stmt.getValue()));
        }
        scopes.declare(name, type, true);
    }

    // ============ 赋值 ============

    @Override
    public Void visitAssign(AssignStmt node, Void ctx) {
        List<Expression> targets = node.getTargets();
        Expression value = node.getValue();
        assignTo(targets.get(0), value, node);
        for (int i = 1; i < targets.size(); i++) {
            // a = b = v：后续目标从第一个名称取值，常量直接复用
            Expression source = value instanceof ConstantExpr || !(targets.get(0) instanceof NameExpr)
                    ? value : targets.get(0);
            assignTo(targets.get(i), source, node);
        }
        return null;
    }

    private void assignTo(Expression target, Expression value, Statement node) {
        if (target instanceof NameExpr) {
            declareOrAssign(((NameExpr) target).getId(), value, null);
        } else if (target instanceof SubscriptExpr && ((SubscriptExpr) target).getIndex() instanceof SliceExpr) {
            diagnostics.report("Slice assignment not supported", node);
        } else if (target instanceof AttributeExpr || target instanceof SubscriptExpr) {
            out.line(expr.emitTarget(target) + " = " + expr.emit(value));
        } else if (TupleTargets.isSequence(target)) {
            assignTuple(target, value, node);
        } else {
            diagnostics.report("Unsupported assignment target: " + ExpressionEmitter.kindName(target), node);
        }
    }

    /**
     * 名称绑定：当前帧已声明则赋值，否则声明。
     * 字面量初值且在本函数体内不再绑定时用 let，其余用 var
     */
    private void declareOrAssign(String name, Expression value, SwiftType declaredType) {
        String id = identifier(name);
        String valueCode = expr.emit(value);
        if (scopes.isDeclaredInCurrentScope(name) || isVisibleFromBlock(name)) {
            out.line(id + " = " + valueCode);
            return;
        }

        SwiftType type = declaredType != null ? declaredType : expr.typeOf(value);
        if (ExpressionEmitter.isNone(value)) {
            out.line("var " + id + ": " + type.toSwiftString() + "? = nil");
            scopes.declare(name, type, true);
            return;
        }
        boolean constant = value instanceof ConstantExpr && !reboundNames.isEmpty() && !reboundNames.peek().contains(name);
        String annotation = declaredType != null && !declaredType.isAny() ? ": " + declaredType.toSwiftString() : typeSuffix(type);
        out.line((constant ? "let " : "var ") + id + annotation + " = " + valueCode);
        scopes.declare(name, type, !constant);
    }

    /** catch / with 等块内绑定外层已声明的名称时输出赋值 */
    private boolean isVisibleFromBlock(String name) {
        return scopes.currentScope().getType() == Scope.ScopeType.BLOCK && scopes.lookup(name) != null;
    }

    private static String typeSuffix(SwiftType type) {
        return type.isAny() || type.isVoid() ? "" : ": " + type.toSwiftString();
    }

    private void assignTuple(Expression target, Expression value, Statement node) {
        List<Expression> targets = TupleTargets.elements(target);
        for (Expression t : targets) {
            if (t instanceof StarredExpr) {
                diagnostics.report("Starred assignment target not supported", node);
                return;
            }
        }

        if (TupleTargets.isSequence(value) && TupleTargets.elements(value).size() == targets.size()) {
            List<Expression> values = TupleTargets.elements(value);
            String swap = swapCode(targets, values);
            if (swap != null) {
                out.line(swap);
                return;
            }
            List<String> names = TupleTargets.names(target);
            if (names == null || !readsAny(values, names)) {
                for (int i = 0; i < targets.size(); i++) {
                    assignTo(targets.get(i), values.get(i), node);
                }
                return;
            }
            // 右侧读取了左侧名称，需要一次性赋值
            List<String> valueCodes = new ArrayList<String>();
            for (Expression v : values) {
                valueCodes.add(expr.emit(v));
            }
            emitDestructuring(names, "(" + String.join(", ", valueCodes) + ")", values);
            return;
        }

        diagnostics.report("Tuple unpacking from a non-tuple value may not work", node);
        List<String> names = TupleTargets.names(target);
        if (names == null) {
            out.line(expr.emitTarget(target) + " = " + expr.emit(value));
            return;
        }
        emitDestructuring(names, expr.emit(value), null);
    }

    private void emitDestructuring(List<String> names, String valueCode, List<Expression> values) {
        List<String> ids = new ArrayList<String>();
        boolean allDeclared = true;
        for (String name : names) {
            ids.add(identifier(name));
            allDeclared &= scopes.isDeclaredInCurrentScope(name);
        }
        String pattern = "(" + String.join(", ", ids) + ")";
        if (allDeclared) {
            out.line(pattern + " = " + valueCode);
            return;
        }
        out.line("var " + pattern + " = " + valueCode);
        for (int i = 0; i < names.size(); i++) {
            SwiftType type = values != null ? expr.typeOf(values.get(i)) : SwiftTypes.ANY;
            scopes.declare(names.get(i), type, true);
        }
    }

    /**
     * 交换模式 {@code a[i], a[j] = a[j], a[i]}：四个下标的容器是同一名称，
     * 下标文本交叉相等时输出 swapAt
     */
    private String swapCode(List<Expression> targets, List<Expression> values) {
        if (targets.size() != 2) {
            return null;
        }
        List<SubscriptExpr> parts = new ArrayList<SubscriptExpr>();
        for (Expression e : Arrays.asList(targets.get(0), targets.get(1), values.get(0), values.get(1))) {
            if (!(e instanceof SubscriptExpr) || ((SubscriptExpr) e).getIndex() instanceof SliceExpr
                    || !(((SubscriptExpr) e).getValue() instanceof NameExpr)) {
                return null;
            }
            parts.add((SubscriptExpr) e);
        }
        String container = ((NameExpr) parts.get(0).getValue()).getId();
        for (SubscriptExpr part : parts) {
            if (!container.equals(((NameExpr) part.getValue()).getId())) {
                return null;
            }
        }
        String i0 = expr.emit(parts.get(0).getIndex());
        String i1 = expr.emit(parts.get(1).getIndex());
        if (!i0.equals(expr.emit(parts.get(3).getIndex())) || !i1.equals(expr.emit(parts.get(2).getIndex()))) {
            return null;
        }
        LOG.fine(() -> "swap pattern on " + container);
        return identifier(container) + ".swapAt(" + i0 + ", " + i1 + ")";
    }

    private static boolean readsAny(List<Expression> values, List<String> names) {
        NameReads reads = new NameReads();
        reads.scanExpressions(values, null);
        for (String name : names) {
            if (reads.names.contains(name)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Void visitAugAssign(AugAssignStmt node, Void ctx) {
        Expression target = node.getTarget();
        BinaryExpr.Operator op = node.getOperator();
        if (op == BinaryExpr.Operator.MAT_MULT) {
            diagnostics.report("Unsupported operator: @=", node);
            return null;
        }
        String targetCode = expr.emitTarget(target);
        if (target instanceof SubscriptExpr && expr.typeOf(((SubscriptExpr) target).getValue()) instanceof MapSwiftType) {
            targetCode += "!";
        }

        SwiftType targetType = expr.typeOf(target);
        SwiftType valueType = expr.typeOf(node.getValue());
        boolean rewrite = op == BinaryExpr.Operator.FLOOR_DIV || op == BinaryExpr.Operator.POW
                || (op == BinaryExpr.Operator.MOD && (targetType.isDouble() || valueType.isDouble()));
        if (rewrite) {
            BinaryExpr expanded = new BinaryExpr(node.getLocation(), target, op, node.getValue());
            out.line(targetCode + " = " + expr.emit(expanded));
            return null;
        }

        String valueCode = expr.emit(node.getValue());
        if (targetType.isDouble() && valueType.isInt() && !(node.getValue() instanceof ConstantExpr)) {
            valueCode = "Double(" + valueCode + ")";
        }
        out.line(targetCode + " " + op.toSourceString() + "= " + valueCode);
        return null;
    }

    @Override
    public Void visitAnnAssign(AnnAssignStmt node, Void ctx) {
        Expression target = node.getTarget();
        SwiftType declared = AnnotationTypes.toSwiftType(node.getAnnotation());
        if (target instanceof NameExpr) {
            String name = ((NameExpr) target).getId();
            if (node.getValue() == null) {
                if (!scopes.isDeclaredInCurrentScope(name)) {
                    out.line("var " + identifier(name) + ": " + declared.toSwiftString());
                    scopes.declare(name, declared, true);
                }
                return null;
            }
            declareOrAssign(name, node.getValue(), declared.isAny() ? null : declared);
        } else if (node.getValue() != null) {
            assignTo(target, node.getValue(), node);
        }
        return null;
    }

    // ============ 控制流 ============

    @Override
    public Void visitIf(IfStmt node, Void ctx) {
        out.line("if " + expr.emitCondition(node.getTest()) + " {");
        emitBlock(node.getBody());
        List<Statement> orElse = node.getOrElse();
        while (orElse.size() == 1 && orElse.get(0) instanceof IfStmt) {
            IfStmt elif = (IfStmt) orElse.get(0);
            out.line("} else if " + expr.emitCondition(elif.getTest()) + " {");
            emitBlock(elif.getBody());
            orElse = elif.getOrElse();
        }
        if (!orElse.isEmpty()) {
            out.line("} else {");
            emitBlock(orElse);
        }
        out.line("}");
        return null;
    }

    @Override
    public Void visitFor(ForStmt node, Void ctx) {
        Expression target = node.getTarget();
        String targetCode = target instanceof NameExpr
                ? identifier(((NameExpr) target).getId())
                : expr.emitTarget(target);
        Expression iter = node.getIter();
        String iterCode = iter instanceof ListExpr ? expr.emit(iter) : expr.emitIterable(iter, false);

        out.line("for " + targetCode + " in " + iterCode + " {");
        emitBlock(node.getBody());
        out.line("}");
        if (!node.getOrElse().isEmpty()) {
            diagnostics.report("for-else has no direct equivalent in Swift", node);
        }
        return null;
    }

    @Override
    public Void visitWhile(WhileStmt node, Void ctx) {
        out.line("while " + expr.emitCondition(node.getTest()) + " {");
        emitBlock(node.getBody());
        out.line("}");
        if (!node.getOrElse().isEmpty()) {
            diagnostics.report("while-else has no direct equivalent in Swift", node);
            out.line("// while-else original:");
            int start = out.size();
            scopes.pushScope(Scope.ScopeType.BLOCK, null);
            out.indent();
            try {
                emitStatements(node.getOrElse());
            } finally {
                out.dedent();
                scopes.popScope();
            }
            out.commentOutFrom(start);
        }
        return null;
    }

    @Override
    public Void visitBreak(BreakStmt node, Void ctx) {
        out.line("break");
        return null;
    }

    @Override
    public Void visitContinue(ContinueStmt node, Void ctx) {
        out.line("continue");
        return null;
    }

    @Override
    public Void visitPass(PassStmt node, Void ctx) {
        out.line("// pass");
        return null;
    }

    @Override
    public Void visitReturn(ReturnStmt node, Void ctx) {
        Expression value = node.getValue();
        if (value == null || ExpressionEmitter.isNone(value) || inInit) {
            out.line("return");
        } else {
            out.line("return " + expr.emit(value));
        }
        return null;
    }

    @Override
    public Void visitTry(TryStmt node, Void ctx) {
        int idiom = findInputIdiom(node.getBody());
        if (idiom >= 0) {
            emitInputIdiom(node, idiom);
            return null;
        }

        if (node.getHandlers().isEmpty()) {
            diagnostics.report("try without except handlers", node);
            out.line("do {");
            emitBlock(node.getBody());
            out.line("}");
        } else {
            out.line("do {");
            List<Statement> body = new ArrayList<Statement>(node.getBody());
            body.addAll(node.getOrElse());
            emitBlock(body);
            for (ExceptHandler handler : node.getHandlers()) {
                emitCatch(handler);
            }
            out.line("}");
        }
        emitStatements(node.getFinalBody());
        return null;
    }

    private void emitCatch(ExceptHandler handler) {
        Expression type = handler.getType();
        String name = handler.getName();
        boolean bindsError = false;
        if (type instanceof NameExpr && !isGenericException((NameExpr) type)) {
            out.line("} catch let " + (name != null ? identifier(name) : "error")
                    + " as " + identifier(((NameExpr) type).getId()) + " {");
        } else {
            out.line("} catch {");
            bindsError = name != null && !"error".equals(name);
        }
        scopes.pushScope(Scope.ScopeType.BLOCK, null);
        out.indent();
        try {
            if (bindsError) {
                out.line("let " + identifier(name) + " = error");
            }
            if (name != null) {
                scopes.declare(name, SwiftTypes.ANY, false);
            }
            emitStatements(handler.getBody());
        } finally {
            out.dedent();
            scopes.popScope();
        }
    }

    private static boolean isGenericException(NameExpr type) {
        return "Exception".equals(type.getId()) || "BaseException".equals(type.getId());
    }

    /** try 体中 {@code x = int(input(...))} 的位置，没有则为 -1 */
    private static int findInputIdiom(List<Statement> body) {
        for (int i = 0; i < body.size(); i++) {
            Statement stmt = body.get(i);
            if (!(stmt instanceof AssignStmt)) {
                continue;
            }
            AssignStmt assign = (AssignStmt) stmt;
            if (assign.getTargets().size() == 1 && assign.getTargets().get(0) instanceof NameExpr
                    && inputCallOf(assign.getValue()) != null) {
                return i;
            }
        }
        return -1;
    }

    private static CallExpr inputCallOf(Expression value) {
        if (!(value instanceof CallExpr)) {
            return null;
        }
        CallExpr outer = (CallExpr) value;
        if (!ExpressionEmitter.isName(outer.getFunction(), "int") || outer.getArgs().size() != 1) {
            return null;
        }
        Expression inner = outer.getArgs().get(0);
        if (inner instanceof CallExpr && ExpressionEmitter.isName(((CallExpr) inner).getFunction(), "input")) {
            return (CallExpr) inner;
        }
        return null;
    }

    private void emitInputIdiom(TryStmt node, int index) {
        AssignStmt assign = (AssignStmt) node.getBody().get(index);
        String name = ((NameExpr) assign.getTargets().get(0)).getId();
        CallExpr input = inputCallOf(assign.getValue());
        String prompt = input.getArgs().isEmpty() ? "\"\"" : expr.emit(input.getArgs().get(0));
        LOG.fine(() -> "input idiom for " + name);

        out.line("print(" + prompt + ", terminator: \"\")");
        out.line("if let line = readLine(), let " + identifier(name) + " = Int(line) {");
        List<Statement> rest = new ArrayList<Statement>();
        for (int i = 0; i < node.getBody().size(); i++) {
            if (i != index) {
                rest.add(node.getBody().get(i));
            }
        }
        rest.addAll(node.getOrElse());
        scopes.pushScope(Scope.ScopeType.BLOCK, null);
        out.indent();
        try {
            scopes.declare(name, SwiftTypes.INT, false);
            emitStatements(rest);
        } finally {
            out.dedent();
            scopes.popScope();
        }
        if (!node.getHandlers().isEmpty()) {
            out.line("} else {");
            List<Statement> handlers = new ArrayList<Statement>();
            for (ExceptHandler handler : node.getHandlers()) {
                handlers.addAll(handler.getBody());
            }
            emitBlock(handlers);
        }
        out.line("}");
        emitStatements(node.getFinalBody());
    }

    @Override
    public Void visitRaise(RaiseStmt node, Void ctx) {
        diagnostics.report("raise not supported, statement commented out", node);
        out.line(node.getException() == null ? "// raise" : "// raise " + expr.emit(node.getException()));
        return null;
    }

    @Override
    public Void visitWith(WithStmt node, Void ctx) {
        diagnostics.report("with statement not supported, context manager dropped", node);
        out.line("do {");
        scopes.pushScope(Scope.ScopeType.BLOCK, null);
        out.indent();
        try {
            for (WithItem item : node.getItems()) {
                Expression vars = item.getOptionalVars();
                String value = expr.emit(item.getContextExpr());
                if (vars instanceof NameExpr) {
                    String name = ((NameExpr) vars).getId();
                    out.line("let " + identifier(name) + " = " + value);
                    scopes.declare(name, expr.typeOf(item.getContextExpr()), false);
                } else {
                    out.line("_ = " + value);
                }
            }
            emitStatements(node.getBody());
        } finally {
            out.dedent();
            scopes.popScope();
        }
        out.line("}");
        return null;
    }

    // ============ 其他 ============

    @Override
    public Void visitExpression(ExpressionStmt node, Void ctx) {
        Expression value = node.getValue();
        if (value instanceof ConstantExpr && ((ConstantExpr) value).is(ConstantExpr.Kind.STRING)) {
            emitComment(((ConstantExpr) value).getStringValue());
        } else if (value instanceof ConstantExpr && ((ConstantExpr) value).is(ConstantExpr.Kind.ELLIPSIS)) {
            out.line("// ...");
        } else {
            out.line(expr.emit(value));
        }
        return null;
    }

    @Override
    public Void visitImport(ImportStmt node, Void ctx) {
        for (Alias alias : node.getNames()) {
            String root = rootModule(alias.getName());
            if (FOUNDATION_MODULES.contains(root)) {
                importFoundation();
            } else if ("re".equals(root)) {
                importFoundation();
                out.line("// re: use NSRegularExpression from Foundation");
            } else {
                out.line("// import " + alias.getName() + "  // manual mapping required");
            }
        }
        return null;
    }

    @Override
    public Void visitImportFrom(ImportFromStmt node, Void ctx) {
        String module = node.getModule() != null ? node.getModule() : "";
        if (FOUNDATION_MODULES.contains(rootModule(module))) {
            importFoundation();
        }
        List<String> names = new ArrayList<String>();
        for (Alias alias : node.getNames()) {
            names.add(alias.getName());
        }
        String dots = new String(new char[node.getLevel()]).replace('\0', '.');
        out.line("// from " + dots + module + " import " + String.join(", ", names) + "  // map manually");
        return null;
    }

    private void importFoundation() {
        if (emittedImports.add("Foundation")) {
            out.line("import Foundation");
        }
    }

    private static String rootModule(String module) {
        int dot = module.indexOf('.');
        return dot < 0 ? module : module.substring(0, dot);
    }

    @Override
    public Void visitAssert(AssertStmt node, Void ctx) {
        String test = expr.emitCondition(node.getTest());
        if (node.getMessage() == null) {
            out.line("assert(" + test + ")");
        } else {
            out.line("assert(" + test + ", " + expr.emit(node.getMessage()) + ")");
        }
        return null;
    }

    @Override
    public Void visitDelete(DeleteStmt node, Void ctx) {
        for (Expression target : node.getTargets()) {
            if (target instanceof SubscriptExpr && !(((SubscriptExpr) target).getIndex() instanceof SliceExpr)) {
                SubscriptExpr subscript = (SubscriptExpr) target;
                String container = expr.emit(subscript.getValue(), SwiftPrecedence.POSTFIX);
                String index = expr.emit(subscript.getIndex());
                if (expr.typeOf(subscript.getValue()) instanceof MapSwiftType) {
                    out.line(container + ".removeValue(forKey: " + index + ")");
                } else {
                    out.line(container + ".remove(at: " + index + ")");
                }
            } else {
                diagnostics.report("del statement not supported for " + ExpressionEmitter.kindName(target), node);
            }
        }
        return null;
    }

    @Override
    public Void visitGlobal(GlobalStmt node, Void ctx) {
        declareOuter(node.getNames());
        return null;
    }

    @Override
    public Void visitNonlocal(NonlocalStmt node, Void ctx) {
        declareOuter(node.getNames());
        return null;
    }

    /** 外层变量在当前帧登记为已声明，后续绑定输出普通赋值 */
    private void declareOuter(List<String> names) {
        for (String name : names) {
            scopes.declare(name, types.getVarType(name), true);
        }
    }

    // ============ 辅助 ============

    private void emitStatements(List<Statement> stmts) {
        for (Statement stmt : stmts) {
            stmt.accept(this, null);
        }
    }

    /** 缩进一级输出语句块；Python 的块不引入新作用域，这里不压帧 */
    private void emitBlock(List<Statement> stmts) {
        out.indent();
        try {
            emitStatements(stmts);
        } finally {
            out.dedent();
        }
    }

    /** 函数体：首个字符串常量作为注释输出 */
    private void emitBody(List<Statement> body) {
        int start = emitDocstring(body);
        emitStatements(body.subList(start, body.size()));
    }

    private int emitDocstring(List<Statement> body) {
        if (!body.isEmpty() && body.get(0) instanceof ExpressionStmt) {
            Expression value = ((ExpressionStmt) body.get(0)).getValue();
            if (value instanceof ConstantExpr && ((ConstantExpr) value).is(ConstantExpr.Kind.STRING)) {
                emitComment(((ConstantExpr) value).getStringValue());
                return 1;
            }
        }
        return 0;
    }

    private void emitComment(String text) {
        String[] lines = text.trim().split("\n");
        for (String line : lines) {
            String trimmed = line.trim();
            out.line(trimmed.isEmpty() ? "//" : "// " + trimmed);
        }
    }

    private static Set<String> collectClassNames(Module module) {
        final Set<String> names = new HashSet<String>();
        new AstScanner<Void>() {
            @Override
            public Void visitClassDef(ClassDefStmt node, Void ctx) {
                names.add(node.getName());
                return super.visitClassDef(node, ctx);
            }
        }.scan(module, null);
        return names;
    }

    /** 表达式中读取到的名称 */
    private static final class NameReads extends AstScanner<Void> {
        final Set<String> names = new HashSet<String>();

        @Override
        public Void visitName(NameExpr node, Void ctx) {
            names.add(node.getId());
            return null;
        }
    }
}
