package com.py2swift.compiler.frontend;

import com.py2swift.compiler.ast.stmt.Module;
import com.py2swift.compiler.diagnostic.Diagnostic;
import com.py2swift.compiler.diagnostic.DiagnosticSink;
import com.py2swift.compiler.parser.ParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("源码前端")
class SourceFrontEndTest {

    private final DiagnosticSink diagnostics = new DiagnosticSink();

    @Test
    @DisplayName("解析顶层语句")
    void testParse() {
        Module module = new SourceFrontEnd().parse("x = 1\nprint(x)\n", diagnostics);
        assertThat(module.getBody()).hasSize(2);
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("记录生成器与协程结构")
    void testUnsupportedConstructs() {
        new SourceFrontEnd().parse(
                "def g():\n    yield 1\n    yield from h()\nasync def a():\n    await b()\n", diagnostics);

        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::getMessage)
                .contains("yield not supported", "yield from not supported", "await not supported");
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::getLine)
                .contains(2, 3, 5);
    }

    @Test
    @DisplayName("语法错误不产生诊断而是抛出")
    void testSyntaxError() {
        assertThatThrownBy(() -> new SourceFrontEnd("bad.py").parse("if x\n    pass\n", diagnostics))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("line 1");
        assertThat(diagnostics.isEmpty()).isTrue();
    }
}
