package com.py2swift.compiler.transpiler;

/**
 * 转换配置
 */
public class TranspilerConfig {
    private int indentSize = 4;
    private boolean useSpaces = true;
    private boolean emitHeader = true;
    private boolean emitDiagnosticsBlock = true;
    private boolean inlineMainGuard = true;

    public TranspilerConfig() {
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        if (indentSize < 1) {
            throw new IllegalArgumentException("Indent size must be positive: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    /** 是否输出 import Foundation 与说明注释 */
    public boolean isEmitHeader() {
        return emitHeader;
    }

    public void setEmitHeader(boolean emitHeader) {
        this.emitHeader = emitHeader;
    }

    /** 是否在末尾追加诊断注释块 */
    public boolean isEmitDiagnosticsBlock() {
        return emitDiagnosticsBlock;
    }

    public void setEmitDiagnosticsBlock(boolean emitDiagnosticsBlock) {
        this.emitDiagnosticsBlock = emitDiagnosticsBlock;
    }

    /** 是否把 if __name__ == "__main__" 的主体展开到顶层 */
    public boolean isInlineMainGuard() {
        return inlineMainGuard;
    }

    public void setInlineMainGuard(boolean inlineMainGuard) {
        this.inlineMainGuard = inlineMainGuard;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (useSpaces) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < indentSize; i++) {
                sb.append(' ');
            }
            return sb.toString();
        } else {
            return "\t";
        }
    }
}
