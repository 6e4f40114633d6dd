package com.py2swift.compiler.ast;

/**
 * AST 节点基类
 *
 * <p>语法树由前端一次性构建，之后各阶段只读。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 源码行号，未知时为 0 */
    public int getLine() {
        return location != null ? location.getLine() : 0;
    }
}
