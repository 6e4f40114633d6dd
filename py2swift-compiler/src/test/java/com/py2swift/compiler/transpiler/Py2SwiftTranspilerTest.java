package com.py2swift.compiler.transpiler;

import com.py2swift.compiler.diagnostic.Diagnostic;
import com.py2swift.compiler.parser.ParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 转换器端到端测试
 */
class Py2SwiftTranspilerTest {

    private static final String HEADER = "import Foundation\n"
            + "\n"
            + "// Transpiled from Python to Swift\n"
            + "// Generated automatically - may require manual adjustments\n"
            + "\n";

    @Nested
    @DisplayName("输出框架")
    class FramingTests {

        @Test
        @DisplayName("默认输出文件头")
        void testHeader() {
            assertThat(Py2SwiftTranspiler.transpile("x = 1\n")).isEqualTo(HEADER + "let x: Int = 1\n");
        }

        @Test
        @DisplayName("空源码只有文件头")
        void testEmptySource() {
            assertThat(Py2SwiftTranspiler.transpile("")).isEqualTo(HEADER);
        }

        @Test
        @DisplayName("输出总以换行结尾")
        void testTrailingNewline() {
            assertThat(Py2SwiftTranspiler.transpile("print(1)")).endsWith("print(1)\n");
        }

        @Test
        @DisplayName("Foundation 只导入一次")
        void testSingleFoundationImport() {
            String out = Py2SwiftTranspiler.transpile("import math\nimport random\nprint(math.sqrt(2))\n");
            assertThat(out.split("import Foundation", -1)).hasSize(2);
            assertThat(out).contains("print(sqrt(2))");
        }

        @Test
        @DisplayName("诊断以注释形式附在末尾")
        void testWarningsBlock() {
            String out = Py2SwiftTranspiler.transpile("def gen():\n    yield 1\n");
            assertThat(out).contains("\n// TRANSPILATION WARNINGS:\n");
            assertThat(out).contains("// Line 2: yield not supported\n");
            assertThat(out).endsWith("\n");
        }

        @Test
        @DisplayName("无诊断时不输出警告块")
        void testNoWarningsBlock() {
            assertThat(Py2SwiftTranspiler.transpile("x = 1\n")).doesNotContain("TRANSPILATION WARNINGS");
        }
    }

    @Nested
    @DisplayName("配置")
    class ConfigTests {

        @Test
        @DisplayName("Tab 缩进")
        void testTabs() {
            TranspilerConfig config = new TranspilerConfig();
            config.setUseSpaces(false);
            config.setEmitHeader(false);
            String out = new Py2SwiftTranspiler(config).generate("for i in range(3):\n    print(i)\n").getOutput();
            assertThat(out).isEqualTo("for i in 0..<3 {\n\tprint(i)\n}\n");
        }

        @Test
        @DisplayName("缩进宽度")
        void testIndentSize() {
            TranspilerConfig config = new TranspilerConfig();
            config.setIndentSize(2);
            config.setEmitHeader(false);
            String out = new Py2SwiftTranspiler(config).generate("while True:\n    break\n").getOutput();
            assertThat(out).isEqualTo("while true {\n  break\n}\n");
        }

        @Test
        @DisplayName("关闭 __main__ 内联时保留条件")
        void testMainGuardKept() {
            TranspilerConfig config = new TranspilerConfig();
            config.setEmitHeader(false);
            config.setInlineMainGuard(false);
            String out = new Py2SwiftTranspiler(config).generate("if __name__ == '__main__':\n    pass\n").getOutput();
            assertThat(out).contains("if __name__ == \"__main__\" {");
        }

        @Test
        @DisplayName("关闭警告块后诊断仍在结果中")
        void testDiagnosticsWithoutBlock() {
            TranspilerConfig config = new TranspilerConfig();
            config.setEmitDiagnosticsBlock(false);
            TranspileResult result = new Py2SwiftTranspiler(config).generate("raise ValueError()\n");
            assertThat(result.getOutput()).doesNotContain("TRANSPILATION WARNINGS");
            assertThat(result.hasDiagnostics()).isTrue();
            assertThat(result.getDiagnostics()).extracting(Diagnostic::getMessage)
                    .containsExactly("raise not supported, statement commented out");
        }
    }

    @Nested
    @DisplayName("结果与错误")
    class ResultTests {

        @Test
        @DisplayName("诊断带行号")
        void testDiagnosticLines() {
            TranspileResult result = new Py2SwiftTranspiler().generate("x = 1\nwith open('f') as fh:\n    pass\n");
            assertThat(result.getDiagnostics()).hasSize(1);
            Diagnostic diagnostic = result.getDiagnostics().get(0);
            assertThat(diagnostic.getLine()).isEqualTo(2);
            assertThat(diagnostic.render()).isEqualTo("Line 2: with statement not supported, context manager dropped");
        }

        @Test
        @DisplayName("每次转换使用独立的诊断集合")
        void testIndependentRuns() {
            Py2SwiftTranspiler transpiler = new Py2SwiftTranspiler();
            TranspileResult first = transpiler.generate("raise X()\n");
            TranspileResult second = transpiler.generate("x = 1\n");
            assertThat(first.hasDiagnostics()).isTrue();
            assertThat(second.hasDiagnostics()).isFalse();
        }

        @Test
        @DisplayName("诊断列表不可修改")
        void testUnmodifiableDiagnostics() {
            TranspileResult result = new Py2SwiftTranspiler().generate("raise X()\n");
            assertThatThrownBy(() -> result.getDiagnostics().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("语法错误抛出 ParseException")
        void testSyntaxError() {
            assertThatThrownBy(() -> Py2SwiftTranspiler.transpile("def f(:\n    pass\n"))
                    .isInstanceOf(ParseException.class);
        }

        @Test
        @DisplayName("完整程序")
        void testProgram() {
            String source = "def square(x):\n"
                    + "    return x * x\n"
                    + "\n"
                    + "for i in range(10):\n"
                    + "    print(square(i))\n";
            String out = Py2SwiftTranspiler.transpile(source);
            assertThat(out).contains("func square(_ x: Int) -> Int {\n"
                    + "    return x * x\n"
                    + "}\n");
            assertThat(out).contains("for i in 0..<10 {\n    print(square(i))\n}\n");
        }
    }
}
