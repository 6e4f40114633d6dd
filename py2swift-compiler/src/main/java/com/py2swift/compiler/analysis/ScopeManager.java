package com.py2swift.compiler.analysis;

import com.py2swift.compiler.analysis.types.SwiftType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.logging.Logger;

/**
 * 作用域栈
 *
 * <p>栈底始终保留 global 帧，{@link #popScope()} 在只剩 global 时不做任何事。
 * 所有操作都不会失败，查找不到时返回 null。</p>
 */
public final class ScopeManager {
    private static final Logger LOG = Logger.getLogger(ScopeManager.class.getName());

    private final Deque<Scope> frames = new ArrayDeque<Scope>();

    public ScopeManager() {
        frames.push(new Scope(Scope.ScopeType.GLOBAL, null));
    }

    public Scope pushScope(Scope.ScopeType type, String ownerName) {
        Scope scope = new Scope(type, ownerName);
        frames.push(scope);
        return scope;
    }

    public void popScope() {
        if (frames.size() <= 1) {
            LOG.fine("popScope ignored: only the global scope remains");
            return;
        }
        frames.pop();
    }

    /** 在最内层帧声明符号 */
    public void declare(String name, Symbol symbol) {
        if (!name.equals(symbol.getName())) {
            symbol = new Symbol(name, symbol.getInferredType(), symbol.isMutable(), symbol.getScopeKind());
        }
        frames.peek().define(symbol);
    }

    /** 以当前帧的标签声明符号 */
    public Symbol declare(String name, SwiftType type, boolean mutable) {
        Symbol symbol = new Symbol(name, type, mutable, currentScope().getTag());
        frames.peek().define(symbol);
        return symbol;
    }

    /** 从内向外查找 */
    public Symbol lookup(String name) {
        Iterator<Scope> it = frames.iterator();
        while (it.hasNext()) {
            Symbol symbol = it.next().resolveLocal(name);
            if (symbol != null) return symbol;
        }
        return null;
    }

    public boolean isDeclaredInCurrentScope(String name) {
        return frames.peek().resolveLocal(name) != null;
    }

    public Scope currentScope() {
        return frames.peek();
    }

    /** 当前帧数（含 global） */
    public int depth() {
        return frames.size();
    }

    /** 最内层是否为类体 */
    public boolean inClassBody() {
        return currentScope().getType() == Scope.ScopeType.CLASS;
    }
}
