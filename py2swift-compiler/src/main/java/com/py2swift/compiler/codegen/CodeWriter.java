package com.py2swift.compiler.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 输出缓冲：按行收集生成代码并跟踪缩进层级
 */
public class CodeWriter {
    private final List<String> lines = new ArrayList<String>();
    private final String indentUnit;
    private int indentLevel = 0;

    public CodeWriter(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    /**
     * 以当前缩进追加一行，空文本追加空行
     */
    public void line(String text) {
        if (text == null || text.isEmpty()) {
            lines.add("");
        } else {
            lines.add(indentString(indentLevel) + text);
        }
    }

    public void blankLine() {
        lines.add("");
    }

    /** 顶层声明之间的空行，避免连续空行 */
    public void separator() {
        if (!lines.isEmpty() && !lines.get(lines.size() - 1).isEmpty()) {
            lines.add("");
        }
    }

    /** 当前行数，配合 {@link #commentOutFrom(int)} 使用 */
    public int size() {
        return lines.size();
    }

    /**
     * 把 from 之后写入的行改成注释，保留相对缩进
     */
    public void commentOutFrom(int from) {
        String prefix = indentString(indentLevel);
        for (int i = from; i < lines.size(); i++) {
            String text = lines.get(i);
            String rest = text.startsWith(prefix) ? text.substring(prefix.length()) : text.trim();
            lines.set(i, rest.isEmpty() ? prefix + "//" : prefix + "// " + rest);
        }
    }

    public List<String> getLines() {
        return Collections.unmodifiableList(lines);
    }

    /**
     * 拼接为最终文本，总以换行结尾
     */
    public String render() {
        return String.join("\n", lines) + "\n";
    }

    private String indentString(int level) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < level; i++) {
            sb.append(indentUnit);
        }
        return sb.toString();
    }
}
