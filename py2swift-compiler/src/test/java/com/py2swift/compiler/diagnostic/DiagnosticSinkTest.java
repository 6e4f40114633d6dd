package com.py2swift.compiler.diagnostic;

import com.py2swift.compiler.ast.stmt.PassStmt;
import com.py2swift.compiler.ast.stmt.Statement;
import com.py2swift.compiler.lexer.Lexer;
import com.py2swift.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("诊断收集")
class DiagnosticSinkTest {

    @Test
    @DisplayName("按发现顺序保存")
    void testOrder() {
        DiagnosticSink sink = new DiagnosticSink();
        sink.report("first");
        sink.add(new Diagnostic("second", 3));

        assertThat(sink.size()).isEqualTo(2);
        assertThat(sink.getDiagnostics()).extracting(Diagnostic::render)
                .containsExactly("first", "Line 3: second");
    }

    @Test
    @DisplayName("行号取自节点")
    void testLineFromNode() {
        Statement stmt = new Parser(new Lexer("\n\npass\n", "<test>"), "<test>").parse().getBody().get(0);
        assertThat(stmt).isInstanceOf(PassStmt.class);

        DiagnosticSink sink = new DiagnosticSink();
        sink.report("noted", stmt);
        sink.report("no node", null);

        assertThat(sink.getDiagnostics().get(0).getLine()).isEqualTo(3);
        assertThat(sink.getDiagnostics().get(1).hasLine()).isFalse();
    }

    @Test
    @DisplayName("片段匹配")
    void testContains() {
        DiagnosticSink sink = new DiagnosticSink();
        assertThat(sink.isEmpty()).isTrue();
        sink.report("yield not supported");

        assertThat(sink.contains("yield")).isTrue();
        assertThat(sink.contains("await")).isFalse();
    }

    @Test
    @DisplayName("外部视图只读")
    void testReadOnlyView() {
        DiagnosticSink sink = new DiagnosticSink();
        sink.report("x");
        assertThatThrownBy(() -> sink.getDiagnostics().add(new Diagnostic("y", null)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("值相等")
    void testEquality() {
        assertThat(new Diagnostic("m", 1)).isEqualTo(new Diagnostic("m", 1));
        assertThat(new Diagnostic("m", 1)).isNotEqualTo(new Diagnostic("m", null));
        assertThat(new Diagnostic("m", null).toString()).isEqualTo("m");
    }
}
