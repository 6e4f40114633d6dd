package com.py2swift.cli;

import com.py2swift.compiler.transpiler.TranspilerConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * py2swift CLI 入口点（picocli）
 *
 * <p>退出码：0 成功，1 语法错误或参数错误，2 输入文件不存在。</p>
 */
@Command(name = "py2swift", version = "py2swift 0.1.0",
         mixinStandardHelpOptions = true,
         exitCodeOnInvalidInput = 1,
         description = "将 Python 源码转换为 Swift 源码")
public class Main implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<input.py>", description = "Python 源文件")
    String input;

    @Parameters(index = "1", arity = "0..1", paramLabel = "<output.swift>",
                description = "输出路径（默认与输入同名，扩展名 .swift）")
    String output;

    @Option(names = "--emit-runtime", description = "在输出旁写入 PyRuntime.swift 辅助函数")
    boolean emitRuntime;

    @Option(names = "--json", description = "以 JSON 形式打印结果，不写文件")
    boolean json;

    @Option(names = "--indent-size", defaultValue = "4", description = "缩进空格数（默认 4）")
    int indentSize;

    @Option(names = "--use-tabs", description = "使用 Tab 缩进")
    boolean useTabs;

    @Option(names = "--no-header", description = "不输出文件头注释")
    boolean noHeader;

    @Option(names = "--no-warnings-block", description = "不在文件末尾输出诊断注释")
    boolean noWarningsBlock;

    @Override
    public Integer call() {
        TranspileRunner runner = new TranspileRunner(buildConfig(),
                spec.commandLine().getOut(), spec.commandLine().getErr());
        if (json) {
            return runner.printJson(input);
        }
        return runner.transpileFile(input, output, emitRuntime);
    }

    TranspilerConfig buildConfig() {
        TranspilerConfig config = new TranspilerConfig();
        config.setIndentSize(indentSize);
        config.setUseSpaces(!useTabs);
        config.setEmitHeader(!noHeader);
        config.setEmitDiagnosticsBlock(!noWarningsBlock);
        return config;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
