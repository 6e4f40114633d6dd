package com.py2swift.compiler.transpiler;

import com.py2swift.compiler.analysis.InferenceResult;
import com.py2swift.compiler.analysis.TwoPassTypeInference;
import com.py2swift.compiler.analysis.TypeInference;
import com.py2swift.compiler.ast.stmt.Module;
import com.py2swift.compiler.codegen.SwiftCodeGenerator;
import com.py2swift.compiler.diagnostic.DiagnosticSink;
import com.py2swift.compiler.frontend.SourceFrontEnd;
import com.py2swift.compiler.parser.ParseException;

import java.util.ArrayList;
import java.util.logging.Logger;

/**
 * Python → Swift 转换入口
 *
 * <p>解析 → 类型推断 → 代码生成。每次调用使用独立的诊断收集器与作用域栈，
 * 实例本身可以重复使用。</p>
 */
public class Py2SwiftTranspiler {
    private static final Logger LOG = Logger.getLogger(Py2SwiftTranspiler.class.getName());

    private final TranspilerConfig config;
    private final TypeInference inference;

    public Py2SwiftTranspiler() {
        this(new TranspilerConfig());
    }

    public Py2SwiftTranspiler(TranspilerConfig config) {
        this(config, new TwoPassTypeInference());
    }

    public Py2SwiftTranspiler(TranspilerConfig config, TypeInference inference) {
        this.config = config;
        this.inference = inference;
    }

    /** 使用默认配置转换，只返回 Swift 源码 */
    public static String transpile(String source) {
        return new Py2SwiftTranspiler().generate(source).getOutput();
    }

    public TranspileResult generate(String source) {
        return generate(source, "<input>");
    }

    /**
     * @throws ParseException 源码不是合法的 Python 语法
     */
    public TranspileResult generate(String source, String fileName) {
        DiagnosticSink diagnostics = new DiagnosticSink();
        Module module = new SourceFrontEnd(fileName).parse(source, diagnostics);
        InferenceResult types = inference.infer(module, diagnostics);
        String output = new SwiftCodeGenerator(types, diagnostics, config).generate(module);
        LOG.fine(() -> "transpiled " + fileName + " with " + diagnostics.size() + " diagnostics");
        return new TranspileResult(output, new ArrayList<>(diagnostics.getDiagnostics()));
    }

    public TranspilerConfig getConfig() {
        return config;
    }
}
