package com.py2swift.compiler.ast;

import com.py2swift.compiler.ast.expr.*;
import com.py2swift.compiler.ast.stmt.*;
import com.py2swift.compiler.ast.stmt.Module;

import java.util.List;

/**
 * 深度优先遍历整棵语法树的访问者基类
 *
 * <p>子类覆盖感兴趣的节点，需要继续向下遍历时调用 {@code super}。</p>
 */
public abstract class AstScanner<C> implements StmtVisitor<Void, C>, ExprVisitor<Void, C> {

    public void scan(Statement stmt, C ctx) {
        if (stmt != null) {
            stmt.accept(this, ctx);
        }
    }

    public void scan(Expression expr, C ctx) {
        if (expr != null) {
            expr.accept(this, ctx);
        }
    }

    public void scanStatements(List<? extends Statement> stmts, C ctx) {
        for (Statement stmt : stmts) {
            scan(stmt, ctx);
        }
    }

    public void scanExpressions(List<? extends Expression> exprs, C ctx) {
        for (Expression expr : exprs) {
            scan(expr, ctx);
        }
    }

    protected void scanParameters(List<Parameter> parameters, C ctx) {
        for (Parameter p : parameters) {
            scan(p.getAnnotation(), ctx);
            scan(p.getDefaultValue(), ctx);
        }
    }

    protected void scanGenerators(List<Comprehension> generators, C ctx) {
        for (Comprehension gen : generators) {
            scan(gen.getTarget(), ctx);
            scan(gen.getIter(), ctx);
            scanExpressions(gen.getIfs(), ctx);
        }
    }

    // ============ 语句 ============

    @Override
    public Void visitModule(Module node, C ctx) {
        scanStatements(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitFunctionDef(FunctionDefStmt node, C ctx) {
        scanExpressions(node.getDecorators(), ctx);
        scanParameters(node.getParameters(), ctx);
        scan(node.getReturns(), ctx);
        scanStatements(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitClassDef(ClassDefStmt node, C ctx) {
        scanExpressions(node.getDecorators(), ctx);
        scanExpressions(node.getBases(), ctx);
        scanStatements(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitAssign(AssignStmt node, C ctx) {
        scanExpressions(node.getTargets(), ctx);
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitAugAssign(AugAssignStmt node, C ctx) {
        scan(node.getTarget(), ctx);
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitAnnAssign(AnnAssignStmt node, C ctx) {
        scan(node.getTarget(), ctx);
        scan(node.getAnnotation(), ctx);
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitIf(IfStmt node, C ctx) {
        scan(node.getTest(), ctx);
        scanStatements(node.getBody(), ctx);
        scanStatements(node.getOrElse(), ctx);
        return null;
    }

    @Override
    public Void visitFor(ForStmt node, C ctx) {
        scan(node.getTarget(), ctx);
        scan(node.getIter(), ctx);
        scanStatements(node.getBody(), ctx);
        scanStatements(node.getOrElse(), ctx);
        return null;
    }

    @Override
    public Void visitWhile(WhileStmt node, C ctx) {
        scan(node.getTest(), ctx);
        scanStatements(node.getBody(), ctx);
        scanStatements(node.getOrElse(), ctx);
        return null;
    }

    @Override
    public Void visitBreak(BreakStmt node, C ctx) {
        return null;
    }

    @Override
    public Void visitContinue(ContinueStmt node, C ctx) {
        return null;
    }

    @Override
    public Void visitPass(PassStmt node, C ctx) {
        return null;
    }

    @Override
    public Void visitReturn(ReturnStmt node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitTry(TryStmt node, C ctx) {
        scanStatements(node.getBody(), ctx);
        for (ExceptHandler handler : node.getHandlers()) {
            scan(handler.getType(), ctx);
            scanStatements(handler.getBody(), ctx);
        }
        scanStatements(node.getOrElse(), ctx);
        scanStatements(node.getFinalBody(), ctx);
        return null;
    }

    @Override
    public Void visitRaise(RaiseStmt node, C ctx) {
        scan(node.getException(), ctx);
        scan(node.getCause(), ctx);
        return null;
    }

    @Override
    public Void visitWith(WithStmt node, C ctx) {
        for (WithItem item : node.getItems()) {
            scan(item.getContextExpr(), ctx);
            scan(item.getOptionalVars(), ctx);
        }
        scanStatements(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitExpression(ExpressionStmt node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitImport(ImportStmt node, C ctx) {
        return null;
    }

    @Override
    public Void visitImportFrom(ImportFromStmt node, C ctx) {
        return null;
    }

    @Override
    public Void visitAssert(AssertStmt node, C ctx) {
        scan(node.getTest(), ctx);
        scan(node.getMessage(), ctx);
        return null;
    }

    @Override
    public Void visitDelete(DeleteStmt node, C ctx) {
        scanExpressions(node.getTargets(), ctx);
        return null;
    }

    @Override
    public Void visitGlobal(GlobalStmt node, C ctx) {
        return null;
    }

    @Override
    public Void visitNonlocal(NonlocalStmt node, C ctx) {
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitName(NameExpr node, C ctx) {
        return null;
    }

    @Override
    public Void visitConstant(ConstantExpr node, C ctx) {
        return null;
    }

    @Override
    public Void visitJoinedStr(JoinedStrExpr node, C ctx) {
        scanExpressions(node.getValues(), ctx);
        return null;
    }

    @Override
    public Void visitFormattedValue(FormattedValueExpr node, C ctx) {
        scan(node.getValue(), ctx);
        scan(node.getFormatSpec(), ctx);
        return null;
    }

    @Override
    public Void visitAttribute(AttributeExpr node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitSubscript(SubscriptExpr node, C ctx) {
        scan(node.getValue(), ctx);
        scan(node.getIndex(), ctx);
        return null;
    }

    @Override
    public Void visitSlice(SliceExpr node, C ctx) {
        scan(node.getLower(), ctx);
        scan(node.getUpper(), ctx);
        scan(node.getStep(), ctx);
        return null;
    }

    @Override
    public Void visitCall(CallExpr node, C ctx) {
        scan(node.getFunction(), ctx);
        scanExpressions(node.getArgs(), ctx);
        for (Keyword keyword : node.getKeywords()) {
            scan(keyword.getValue(), ctx);
        }
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpr node, C ctx) {
        scan(node.getLeft(), ctx);
        scan(node.getRight(), ctx);
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpr node, C ctx) {
        scan(node.getOperand(), ctx);
        return null;
    }

    @Override
    public Void visitBoolOp(BoolOpExpr node, C ctx) {
        scanExpressions(node.getValues(), ctx);
        return null;
    }

    @Override
    public Void visitCompare(CompareExpr node, C ctx) {
        scan(node.getLeft(), ctx);
        scanExpressions(node.getComparators(), ctx);
        return null;
    }

    @Override
    public Void visitConditional(ConditionalExpr node, C ctx) {
        scan(node.getTest(), ctx);
        scan(node.getBody(), ctx);
        scan(node.getOrElse(), ctx);
        return null;
    }

    @Override
    public Void visitNamed(NamedExpr node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitList(ListExpr node, C ctx) {
        scanExpressions(node.getElements(), ctx);
        return null;
    }

    @Override
    public Void visitTuple(TupleExpr node, C ctx) {
        scanExpressions(node.getElements(), ctx);
        return null;
    }

    @Override
    public Void visitSet(SetExpr node, C ctx) {
        scanExpressions(node.getElements(), ctx);
        return null;
    }

    @Override
    public Void visitDict(DictExpr node, C ctx) {
        for (Expression key : node.getKeys()) {
            scan(key, ctx);
        }
        scanExpressions(node.getValues(), ctx);
        return null;
    }

    @Override
    public Void visitStarred(StarredExpr node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitListComp(ListCompExpr node, C ctx) {
        scanGenerators(node.getGenerators(), ctx);
        scan(node.getElement(), ctx);
        return null;
    }

    @Override
    public Void visitSetComp(SetCompExpr node, C ctx) {
        scanGenerators(node.getGenerators(), ctx);
        scan(node.getElement(), ctx);
        return null;
    }

    @Override
    public Void visitDictComp(DictCompExpr node, C ctx) {
        scanGenerators(node.getGenerators(), ctx);
        scan(node.getKey(), ctx);
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitGenerator(GeneratorExpr node, C ctx) {
        scanGenerators(node.getGenerators(), ctx);
        scan(node.getElement(), ctx);
        return null;
    }

    @Override
    public Void visitLambda(LambdaExpr node, C ctx) {
        scanParameters(node.getParameters(), ctx);
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitYield(YieldExpr node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitYieldFrom(YieldFromExpr node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitAwait(AwaitExpr node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }
}
