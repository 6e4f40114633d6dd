package com.py2swift.compiler.diagnostic;

import com.py2swift.compiler.ast.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 诊断收集器
 *
 * <p>只追加、按发现顺序保存。每次转换创建一个实例并显式传递给各阶段。</p>
 */
public final class DiagnosticSink {
    private static final Logger LOG = Logger.getLogger(DiagnosticSink.class.getName());

    private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

    public void report(String message) {
        add(new Diagnostic(message, null));
    }

    /** 记录诊断，行号取自节点（未知行号时省略） */
    public void report(String message, AstNode node) {
        int line = node != null ? node.getLine() : 0;
        add(new Diagnostic(message, line > 0 ? line : null));
    }

    public void add(Diagnostic diagnostic) {
        LOG.fine(() -> "diagnostic: " + diagnostic.render());
        diagnostics.add(diagnostic);
    }

    /** 只读视图 */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean isEmpty() { return diagnostics.isEmpty(); }
    public int size() { return diagnostics.size(); }

    /** 是否存在包含指定片段的诊断 */
    public boolean contains(String fragment) {
        for (Diagnostic d : diagnostics) {
            if (d.getMessage().contains(fragment)) return true;
        }
        return false;
    }
}
