package com.py2swift.compiler.frontend;

import com.py2swift.compiler.ast.stmt.Module;
import com.py2swift.compiler.diagnostic.DiagnosticSink;
import com.py2swift.compiler.lexer.Lexer;
import com.py2swift.compiler.parser.ParseException;
import com.py2swift.compiler.parser.Parser;

import java.util.logging.Logger;

/**
 * 源码前端：词法 + 语法分析，随后执行不支持结构的检测
 */
public final class SourceFrontEnd {
    private static final Logger LOG = Logger.getLogger(SourceFrontEnd.class.getName());

    private final String fileName;

    public SourceFrontEnd(String fileName) {
        this.fileName = fileName;
    }

    public SourceFrontEnd() {
        this("<input>");
    }

    /**
     * 解析源码
     *
     * @throws ParseException 源码不是合法的 Python 语法
     */
    public Module parse(String source, DiagnosticSink diagnostics) {
        Module module = new Parser(new Lexer(source, fileName), fileName).parse();
        int before = diagnostics.size();
        new UnsupportedConstructDetector().scan(module, diagnostics);
        LOG.fine(() -> "parsed " + fileName + ": " + module.getBody().size() + " top-level statements, "
                + (diagnostics.size() - before) + " unsupported constructs");
        return module;
    }

    public String getFileName() { return fileName; }
}
