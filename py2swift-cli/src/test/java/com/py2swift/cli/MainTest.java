package com.py2swift.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 命令行测试
 */
class MainTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        return new CommandLine(new Main())
                .setOut(new PrintWriter(out, true))
                .setErr(new PrintWriter(err, true))
                .execute(args);
    }

    private Path writeSource(String name, String source) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, source.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("写出文件")
    class FileOutputTests {

        @Test
        @DisplayName("默认输出到同名 .swift 文件")
        void testDefaultOutput() throws IOException {
            Path input = writeSource("hello.py", "print('hi')\n");

            int exit = run(input.toString());

            Path swift = tempDir.resolve("hello.swift");
            assertThat(exit).isEqualTo(0);
            assertThat(swift).exists();
            assertThat(read(swift)).contains("print(\"hi\")");
            assertThat(out.toString()).contains("Wrote: ");
        }

        @Test
        @DisplayName("显式输出路径")
        void testExplicitOutput() throws IOException {
            Path input = writeSource("a.py", "x = 1\n");
            Path target = tempDir.resolve("out.swift");

            assertThat(run(input.toString(), target.toString())).isEqualTo(0);
            assertThat(read(target)).contains("let x: Int = 1");
        }

        @Test
        @DisplayName("--no-header 省略文件头")
        void testNoHeader() throws IOException {
            Path input = writeSource("a.py", "x = 1\n");

            run("--no-header", input.toString());

            assertThat(read(tempDir.resolve("a.swift"))).isEqualTo("let x: Int = 1\n");
        }

        @Test
        @DisplayName("--use-tabs 使用 Tab 缩进")
        void testUseTabs() throws IOException {
            Path input = writeSource("a.py", "while True:\n    break\n");

            run("--use-tabs", "--no-header", input.toString());

            assertThat(read(tempDir.resolve("a.swift"))).isEqualTo("while true {\n\tbreak\n}\n");
        }

        @Test
        @DisplayName("--emit-runtime 写出运行时辅助文件")
        void testEmitRuntime() throws IOException {
            Path input = writeSource("a.py", "x = 1\n");

            assertThat(run("--emit-runtime", input.toString())).isEqualTo(0);

            assertThat(tempDir.resolve("PyRuntime.swift")).exists();
            assertThat(out.toString()).contains("Wrote runtime helpers: ");
        }
    }

    @Nested
    @DisplayName("错误退出码")
    class ExitCodeTests {

        @Test
        @DisplayName("输入文件不存在返回 2")
        void testMissingInput() {
            int exit = run(tempDir.resolve("missing.py").toString());

            assertThat(exit).isEqualTo(2);
            assertThat(err.toString()).contains("Input file not found: ");
        }

        @Test
        @DisplayName("语法错误返回 1 且不写文件")
        void testSyntaxError() throws IOException {
            Path input = writeSource("bad.py", "def f(:\n    pass\n");

            int exit = run(input.toString());

            assertThat(exit).isEqualTo(1);
            assertThat(err.toString()).contains("Syntax error: ");
            assertThat(tempDir.resolve("bad.swift")).doesNotExist();
        }

        @Test
        @DisplayName("缺少参数返回 1")
        void testUsageError() {
            assertThat(run()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("JSON 输出")
    class JsonTests {

        @Test
        @DisplayName("成功时包含输出与诊断")
        void testJsonSuccess() throws IOException {
            Path input = writeSource("a.py", "raise ValueError()\n");

            int exit = run("--json", input.toString());

            String json = out.toString();
            assertThat(exit).isEqualTo(0);
            assertThat(json).contains("\"success\":true");
            assertThat(json).contains("\"output\":");
            assertThat(json).contains("\"message\":\"raise not supported, statement commented out\"");
            assertThat(json).contains("\"line\":1");
            assertThat(tempDir.resolve("a.swift")).doesNotExist();
        }

        @Test
        @DisplayName("语法错误时 success 为 false")
        void testJsonFailure() throws IOException {
            Path input = writeSource("bad.py", "def f(:\n    pass\n");

            int exit = run("--json", input.toString());

            assertThat(exit).isEqualTo(1);
            assertThat(out.toString()).contains("\"success\":false").contains("\"error\":");
        }
    }

    @Test
    @DisplayName("默认输出路径替换扩展名")
    void testDefaultOutputPath() {
        assertThat(TranspileRunner.defaultOutput(Paths.get("dir", "prog.py")))
                .isEqualTo(Paths.get("dir", "prog.swift"));
        assertThat(TranspileRunner.defaultOutput(Paths.get("script")))
                .isEqualTo(Paths.get("script.swift"));
    }
}
