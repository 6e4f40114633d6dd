package com.py2swift.compiler.frontend;

import com.py2swift.compiler.ast.AstScanner;
import com.py2swift.compiler.ast.expr.AwaitExpr;
import com.py2swift.compiler.ast.expr.YieldExpr;
import com.py2swift.compiler.ast.expr.YieldFromExpr;
import com.py2swift.compiler.ast.stmt.ForStmt;
import com.py2swift.compiler.ast.stmt.FunctionDefStmt;
import com.py2swift.compiler.ast.stmt.WithStmt;
import com.py2swift.compiler.diagnostic.DiagnosticSink;

/**
 * 预扫描：记录生成器无法表示的结构（异步、生成器）
 *
 * <p>只追加诊断，不修改语法树。</p>
 */
public class UnsupportedConstructDetector extends AstScanner<DiagnosticSink> {

    @Override
    public Void visitFunctionDef(FunctionDefStmt node, DiagnosticSink sink) {
        if (node.isAsync()) {
            sink.report("async def not supported", node);
        }
        return super.visitFunctionDef(node, sink);
    }

    @Override
    public Void visitFor(ForStmt node, DiagnosticSink sink) {
        if (node.isAsync()) {
            sink.report("async for not supported", node);
        }
        return super.visitFor(node, sink);
    }

    @Override
    public Void visitWith(WithStmt node, DiagnosticSink sink) {
        if (node.isAsync()) {
            sink.report("async with not supported", node);
        }
        return super.visitWith(node, sink);
    }

    @Override
    public Void visitYield(YieldExpr node, DiagnosticSink sink) {
        sink.report("yield not supported", node);
        return super.visitYield(node, sink);
    }

    @Override
    public Void visitYieldFrom(YieldFromExpr node, DiagnosticSink sink) {
        sink.report("yield from not supported", node);
        return super.visitYieldFrom(node, sink);
    }

    @Override
    public Void visitAwait(AwaitExpr node, DiagnosticSink sink) {
        sink.report("await not supported", node);
        return super.visitAwait(node, sink);
    }
}
