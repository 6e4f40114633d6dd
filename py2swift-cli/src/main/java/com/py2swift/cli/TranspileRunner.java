package com.py2swift.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.py2swift.compiler.diagnostic.Diagnostic;
import com.py2swift.compiler.parser.ParseException;
import com.py2swift.compiler.transpiler.Py2SwiftTranspiler;
import com.py2swift.compiler.transpiler.TranspileResult;
import com.py2swift.compiler.transpiler.TranspilerConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 转换执行器：读源文件、调用转换器、写出结果
 */
public class TranspileRunner {

    static final int EXIT_OK = 0;
    static final int EXIT_PARSE_ERROR = 1;
    static final int EXIT_INPUT_MISSING = 2;

    static final String RUNTIME_RESOURCE = "/templates/PyRuntime.swift";
    static final String RUNTIME_FILE_NAME = "PyRuntime.swift";

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private final Py2SwiftTranspiler transpiler;
    private final PrintWriter out;
    private final PrintWriter err;

    public TranspileRunner(TranspilerConfig config, PrintWriter out, PrintWriter err) {
        this.transpiler = new Py2SwiftTranspiler(config);
        this.out = out;
        this.err = err;
    }

    /**
     * 转换文件并写出 .swift
     */
    public int transpileFile(String inputPath, String outputPath, boolean emitRuntime) {
        Path input = Paths.get(inputPath);
        if (!Files.exists(input)) {
            err.println("Input file not found: " + inputPath);
            return EXIT_INPUT_MISSING;
        }
        Path output = outputPath != null ? Paths.get(outputPath) : defaultOutput(input);

        try {
            String source = new String(Files.readAllBytes(input), StandardCharsets.UTF_8);
            TranspileResult result = transpiler.generate(source, input.getFileName().toString());
            Files.write(output, result.getOutput().getBytes(StandardCharsets.UTF_8));
            out.println("Wrote: " + output);

            if (emitRuntime) {
                writeRuntime(output);
            }
            return EXIT_OK;
        } catch (ParseException e) {
            err.println("Syntax error: " + e.getMessage());
            return EXIT_PARSE_ERROR;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return EXIT_PARSE_ERROR;
        }
    }

    /**
     * 转换结果以 JSON 打印到标准输出
     */
    public int printJson(String inputPath) {
        Path input = Paths.get(inputPath);
        if (!Files.exists(input)) {
            err.println("Input file not found: " + inputPath);
            return EXIT_INPUT_MISSING;
        }

        JsonObject response = new JsonObject();
        int exitCode = EXIT_OK;
        try {
            String source = new String(Files.readAllBytes(input), StandardCharsets.UTF_8);
            TranspileResult result = transpiler.generate(source, input.getFileName().toString());
            response.addProperty("success", true);
            response.addProperty("output", result.getOutput());
            JsonArray diagnostics = new JsonArray();
            for (Diagnostic d : result.getDiagnostics()) {
                JsonObject diag = new JsonObject();
                diag.addProperty("message", d.getMessage());
                diag.addProperty("line", d.getLine());
                diagnostics.add(diag);
            }
            response.add("diagnostics", diagnostics);
        } catch (ParseException | IOException e) {
            response.addProperty("success", false);
            response.addProperty("error", e.getMessage());
            exitCode = EXIT_PARSE_ERROR;
        }
        out.println(GSON.toJson(response));
        return exitCode;
    }

    private void writeRuntime(Path output) throws IOException {
        Path target = output.resolveSibling(RUNTIME_FILE_NAME);
        try (InputStream in = TranspileRunner.class.getResourceAsStream(RUNTIME_RESOURCE)) {
            if (in == null) {
                err.println("Runtime template not found: " + RUNTIME_RESOURCE);
                return;
            }
            Files.write(target, in.readAllBytes());
        }
        out.println("Wrote runtime helpers: " + target);
    }

    static Path defaultOutput(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return input.resolveSibling(base + ".swift");
    }
}
