package com.py2swift.compiler.transpiler;

import com.py2swift.compiler.diagnostic.Diagnostic;

import java.util.Collections;
import java.util.List;

/**
 * 一次转换的结果：Swift 源码与诊断列表
 */
public final class TranspileResult {
    private final String output;
    private final List<Diagnostic> diagnostics;

    public TranspileResult(String output, List<Diagnostic> diagnostics) {
        this.output = output;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public String getOutput() { return output; }
    public List<Diagnostic> getDiagnostics() { return diagnostics; }
    public boolean hasDiagnostics() { return !diagnostics.isEmpty(); }
}
