package com.py2swift.compiler.ast;

import com.py2swift.compiler.ast.expr.*;

/**
 * 表达式访问者接口
 *
 * <p>与 {@link StmtVisitor} 相同，不提供默认实现。</p>
 */
public interface ExprVisitor<R, C> {

    // ============ 基础 ============

    R visitName(NameExpr node, C ctx);

    R visitConstant(ConstantExpr node, C ctx);

    R visitJoinedStr(JoinedStrExpr node, C ctx);

    R visitFormattedValue(FormattedValueExpr node, C ctx);

    R visitAttribute(AttributeExpr node, C ctx);

    R visitSubscript(SubscriptExpr node, C ctx);

    R visitSlice(SliceExpr node, C ctx);

    R visitCall(CallExpr node, C ctx);

    // ============ 运算 ============

    R visitBinary(BinaryExpr node, C ctx);

    R visitUnary(UnaryExpr node, C ctx);

    R visitBoolOp(BoolOpExpr node, C ctx);

    R visitCompare(CompareExpr node, C ctx);

    R visitConditional(ConditionalExpr node, C ctx);

    R visitNamed(NamedExpr node, C ctx);

    // ============ 容器 ============

    R visitList(ListExpr node, C ctx);

    R visitTuple(TupleExpr node, C ctx);

    R visitSet(SetExpr node, C ctx);

    R visitDict(DictExpr node, C ctx);

    R visitStarred(StarredExpr node, C ctx);

    // ============ 推导式 ============

    R visitListComp(ListCompExpr node, C ctx);

    R visitSetComp(SetCompExpr node, C ctx);

    R visitDictComp(DictCompExpr node, C ctx);

    R visitGenerator(GeneratorExpr node, C ctx);

    // ============ 函数 / 协程 ============

    R visitLambda(LambdaExpr node, C ctx);

    R visitYield(YieldExpr node, C ctx);

    R visitYieldFrom(YieldFromExpr node, C ctx);

    R visitAwait(AwaitExpr node, C ctx);
}
