package com.py2swift.compiler.analysis;

import com.py2swift.compiler.ast.stmt.Module;
import com.py2swift.compiler.diagnostic.DiagnosticSink;

/**
 * 类型推断引擎
 *
 * <p>代码生成器只依赖此接口与 {@link InferenceResult}。</p>
 */
public interface TypeInference {

    InferenceResult infer(Module module, DiagnosticSink diagnostics);
}
