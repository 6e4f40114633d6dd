package com.py2swift.compiler.codegen;

import com.py2swift.compiler.ast.AstScanner;
import com.py2swift.compiler.ast.expr.*;
import com.py2swift.compiler.ast.stmt.*;
import com.py2swift.compiler.ast.stmt.Module;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 统计一个函数体（或模块体）内的名称绑定次数，用于 let / var 的选择
 *
 * <p>不进入嵌套的函数、类、lambda 与推导式；嵌套函数中的 nonlocal 名称
 * 以及整个模块中的 global 名称一律视为被重新绑定。</p>
 */
final class RebindingScanner extends AstScanner<Void> {
    private final Map<String, Integer> bindings = new HashMap<String, Integer>();
    private final Set<String> forced = new HashSet<String>();

    private RebindingScanner() {}

    /** 函数体内绑定超过一次的名称 */
    static Set<String> reboundIn(List<Statement> body) {
        RebindingScanner scanner = new RebindingScanner();
        scanner.scanStatements(body, null);
        return scanner.result();
    }

    /** 函数体内绑定过至少一次的名称 */
    static Set<String> boundIn(List<Statement> body) {
        RebindingScanner scanner = new RebindingScanner();
        scanner.scanStatements(body, null);
        Set<String> bound = new HashSet<String>(scanner.bindings.keySet());
        bound.addAll(scanner.forced);
        return bound;
    }

    /** 模块体：额外包括任意深度 global 声明过的名称 */
    static Set<String> reboundIn(Module module) {
        RebindingScanner scanner = new RebindingScanner();
        scanner.scanStatements(module.getBody(), null);
        GlobalCollector globals = new GlobalCollector();
        globals.scan(module, null);
        scanner.forced.addAll(globals.names);
        return scanner.result();
    }

    private Set<String> result() {
        Set<String> rebound = new HashSet<String>(forced);
        for (Map.Entry<String, Integer> e : bindings.entrySet()) {
            if (e.getValue() > 1) {
                rebound.add(e.getKey());
            }
        }
        return rebound;
    }

    private void bind(Expression target) {
        List<String> names = new ArrayList<String>();
        TupleTargets.collectNames(target, names);
        for (String name : names) {
            Integer count = bindings.get(name);
            bindings.put(name, count == null ? 1 : count + 1);
        }
    }

    @Override
    public Void visitAssign(AssignStmt node, Void ctx) {
        for (Expression target : node.getTargets()) {
            bind(target);
        }
        return null;
    }

    @Override
    public Void visitAugAssign(AugAssignStmt node, Void ctx) {
        if (node.getTarget() instanceof NameExpr) {
            forced.add(((NameExpr) node.getTarget()).getId());
        }
        return null;
    }

    @Override
    public Void visitAnnAssign(AnnAssignStmt node, Void ctx) {
        if (node.getValue() != null) {
            bind(node.getTarget());
        }
        return null;
    }

    @Override
    public Void visitFor(ForStmt node, Void ctx) {
        bind(node.getTarget());
        scanStatements(node.getBody(), ctx);
        scanStatements(node.getOrElse(), ctx);
        return null;
    }

    @Override
    public Void visitWith(WithStmt node, Void ctx) {
        for (WithItem item : node.getItems()) {
            if (item.getOptionalVars() != null) {
                bind(item.getOptionalVars());
            }
        }
        scanStatements(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitFunctionDef(FunctionDefStmt node, Void ctx) {
        NonlocalCollector nonlocals = new NonlocalCollector();
        nonlocals.scanStatements(node.getBody(), null);
        forced.addAll(nonlocals.names);
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

    @Override
    public Void visitListComp(ListCompExpr node, Void ctx) {
        return null;
    }

    @Override
    public Void visitGenerator(GeneratorExpr node, Void ctx) {
        return null;
    }

    @Override
    public Void visitSetComp(SetCompExpr node, Void ctx) {
        return null;
    }

    @Override
    public Void visitDictComp(DictCompExpr node, Void ctx) {
        return null;
    }

    private static final class GlobalCollector extends AstScanner<Void> {
        final Set<String> names = new HashSet<String>();

        @Override
        public Void visitGlobal(GlobalStmt node, Void ctx) {
            names.addAll(node.getNames());
            return null;
        }
    }

    private static final class NonlocalCollector extends AstScanner<Void> {
        final Set<String> names = new HashSet<String>();

        @Override
        public Void visitNonlocal(NonlocalStmt node, Void ctx) {
            names.addAll(node.getNames());
            return null;
        }
    }
}
