package com.py2swift.compiler.ast;

import com.py2swift.compiler.ast.stmt.*;
import com.py2swift.compiler.ast.stmt.Module;

/**
 * 语句访问者接口
 *
 * <p>不提供默认实现：新增语句种类时，所有实现类都会在编译期报错。</p>
 */
public interface StmtVisitor<R, C> {

    R visitModule(Module node, C ctx);

    // ============ 定义 ============

    R visitFunctionDef(FunctionDefStmt node, C ctx);

    R visitClassDef(ClassDefStmt node, C ctx);

    // ============ 赋值 ============

    R visitAssign(AssignStmt node, C ctx);

    R visitAugAssign(AugAssignStmt node, C ctx);

    R visitAnnAssign(AnnAssignStmt node, C ctx);

    // ============ 控制流 ============

    R visitIf(IfStmt node, C ctx);

    R visitFor(ForStmt node, C ctx);

    R visitWhile(WhileStmt node, C ctx);

    R visitBreak(BreakStmt node, C ctx);

    R visitContinue(ContinueStmt node, C ctx);

    R visitPass(PassStmt node, C ctx);

    R visitReturn(ReturnStmt node, C ctx);

    R visitTry(TryStmt node, C ctx);

    R visitRaise(RaiseStmt node, C ctx);

    R visitWith(WithStmt node, C ctx);

    // ============ 其他 ============

    R visitExpression(ExpressionStmt node, C ctx);

    R visitImport(ImportStmt node, C ctx);

    R visitImportFrom(ImportFromStmt node, C ctx);

    R visitAssert(AssertStmt node, C ctx);

    R visitDelete(DeleteStmt node, C ctx);

    R visitGlobal(GlobalStmt node, C ctx);

    R visitNonlocal(NonlocalStmt node, C ctx);
}
