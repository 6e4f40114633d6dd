package com.py2swift.compiler.diagnostic;

import java.util.Objects;

/**
 * 转换诊断条目（非致命警告）
 */
public final class Diagnostic {
    private final String message;
    private final Integer line;  // 可选

    public Diagnostic(String message, Integer line) {
        this.message = Objects.requireNonNull(message, "message");
        this.line = line;
    }

    public String getMessage() { return message; }
    public Integer getLine() { return line; }
    public boolean hasLine() { return line != null; }

    /** 渲染为 "Line N: message"，无行号时只有 message */
    public String render() {
        return line != null ? "Line " + line + ": " + message : message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return message.equals(that.message) && Objects.equals(line, that.line);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, line);
    }

    @Override
    public String toString() {
        return render();
    }
}
