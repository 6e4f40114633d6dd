package com.py2swift.compiler.parser;

import com.py2swift.compiler.ast.Parameter;
import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.expr.*;
import com.py2swift.compiler.ast.stmt.*;
import com.py2swift.compiler.lexer.Token;
import com.py2swift.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.py2swift.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析一条语句；一行中以分号分隔的多个简单语句一并返回
     */
    List<Statement> parseStatement() {
        switch (parser.current.getType()) {
            case KW_IF:
                return Collections.singletonList(parseIfStmt());
            case KW_WHILE:
                return Collections.singletonList(parseWhileStmt());
            case KW_FOR:
                return Collections.singletonList(parseForStmt(parser.location(), false));
            case KW_TRY:
                return Collections.singletonList(parseTryStmt());
            case KW_WITH:
                return Collections.singletonList(parseWithStmt(parser.location(), false));
            case KW_DEF:
                return Collections.singletonList(
                        parseFunctionDef(parser.location(), Collections.<Expression>emptyList(), false));
            case KW_CLASS:
                return Collections.singletonList(parseClassDef(Collections.<Expression>emptyList()));
            case KW_ASYNC:
                return Collections.singletonList(parseAsync(Collections.<Expression>emptyList()));
            case AT:
                return Collections.singletonList(parseDecorated());
            default:
                return parseSimpleStatements();
        }
    }

    /**
     * 冒号之后的代码块：缩进块或同一行的简单语句
     */
    List<Statement> parseBlock() {
        parser.expect(COLON, "Expected ':'");
        if (!parser.match(NEWLINE)) {
            return parseSimpleStatements();
        }
        parser.expect(INDENT, "Expected an indented block");
        List<Statement> body = new ArrayList<>();
        while (!parser.check(DEDENT) && !parser.isAtEnd()) {
            if (parser.match(NEWLINE)) continue;
            body.addAll(parseStatement());
        }
        parser.expect(DEDENT, "Expected dedent");
        return body;
    }

    private List<Statement> parseSimpleStatements() {
        List<Statement> stmts = new ArrayList<>();
        stmts.add(parseSmallStatement());
        while (parser.match(SEMICOLON)) {
            if (parser.checkAny(NEWLINE, EOF)) break;
            stmts.add(parseSmallStatement());
        }
        if (!parser.match(NEWLINE) && !parser.isAtEnd()) {
            throw parser.error("Expected end of statement");
        }
        return stmts;
    }

    // ============ 复合语句 ============

    private Statement parseIfStmt() {
        SourceLocation loc = parser.location();
        parser.advance(); // if / elif
        Expression test = parser.exprParser.parseNamed();
        List<Statement> body = parseBlock();
        List<Statement> orElse;
        if (parser.check(KW_ELIF)) {
            orElse = Collections.singletonList(parseIfStmt());
        } else if (parser.match(KW_ELSE)) {
            orElse = parseBlock();
        } else {
            orElse = Collections.emptyList();
        }
        return new IfStmt(loc, test, body, orElse);
    }

    private Statement parseWhileStmt() {
        SourceLocation loc = parser.location();
        parser.advance(); // while
        Expression test = parser.exprParser.parseNamed();
        List<Statement> body = parseBlock();
        List<Statement> orElse = parser.match(KW_ELSE) ? parseBlock() : Collections.<Statement>emptyList();
        return new WhileStmt(loc, test, body, orElse);
    }

    private Statement parseForStmt(SourceLocation loc, boolean async) {
        parser.expect(KW_FOR, "Expected 'for'");
        Token start = parser.current;
        Expression target = parser.exprParser.parseTargetList();
        validateTarget(target, start);
        parser.expect(KW_IN, "Expected 'in' after for-loop target");
        Expression iter = parser.exprParser.parseExpressionList(true);
        List<Statement> body = parseBlock();
        List<Statement> orElse = parser.match(KW_ELSE) ? parseBlock() : Collections.<Statement>emptyList();
        return new ForStmt(loc, target, iter, body, orElse, async);
    }

    private Statement parseTryStmt() {
        Token tryToken = parser.current;
        SourceLocation loc = parser.location();
        parser.advance(); // try
        List<Statement> body = parseBlock();

        List<ExceptHandler> handlers = new ArrayList<>();
        while (parser.check(KW_EXCEPT)) {
            SourceLocation handlerLoc = parser.location();
            parser.advance();
            Expression type = null;
            String name = null;
            if (!parser.check(COLON)) {
                type = parser.exprParser.parseTest();
                if (parser.match(KW_AS)) {
                    name = parser.expectIdentifier("Expected name after 'as'");
                }
            }
            handlers.add(new ExceptHandler(handlerLoc, type, name, parseBlock()));
        }

        List<Statement> orElse = Collections.emptyList();
        if (!handlers.isEmpty() && parser.match(KW_ELSE)) {
            orElse = parseBlock();
        }
        List<Statement> finalBody = Collections.emptyList();
        if (parser.match(KW_FINALLY)) {
            finalBody = parseBlock();
        }
        if (handlers.isEmpty() && finalBody.isEmpty()) {
            throw new ParseException("Expected 'except' or 'finally' block", tryToken);
        }
        return new TryStmt(loc, body, handlers, orElse, finalBody);
    }

    private Statement parseWithStmt(SourceLocation loc, boolean async) {
        parser.expect(KW_WITH, "Expected 'with'");
        List<WithItem> items = new ArrayList<>();
        do {
            Expression context = parser.exprParser.parseTest();
            Expression vars = null;
            if (parser.match(KW_AS)) {
                vars = parser.exprParser.parseTargetList();
            }
            items.add(new WithItem(context, vars));
        } while (parser.match(COMMA));
        return new WithStmt(loc, items, parseBlock(), async);
    }

    private Statement parseFunctionDef(SourceLocation loc, List<Expression> decorators, boolean async) {
        parser.expect(KW_DEF, "Expected 'def'");
        String name = parser.expectIdentifier("Expected function name");
        parser.expect(LPAREN, "Expected '(' after function name");
        List<Parameter> params = parser.exprParser.parseParameters(RPAREN, true);
        parser.expect(RPAREN, "Expected ')' after parameters");
        Expression returns = null;
        if (parser.match(ARROW)) {
            returns = parser.exprParser.parseTest();
        }
        List<Statement> body = parseBlock();
        return new FunctionDefStmt(loc, name, params, body, decorators, returns, async);
    }

    private Statement parseClassDef(List<Expression> decorators) {
        SourceLocation loc = parser.location();
        parser.expect(KW_CLASS, "Expected 'class'");
        String name = parser.expectIdentifier("Expected class name");
        List<Expression> bases = new ArrayList<>();
        if (parser.match(LPAREN)) {
            while (!parser.check(RPAREN)) {
                if (parser.check(IDENTIFIER) && parser.peek(1).is(ASSIGN)) {
                    // metaclass= 等关键字参数不参与转换
                    parser.advance();
                    parser.advance();
                    parser.exprParser.parseTest();
                } else if (parser.match(DOUBLE_STAR) || parser.match(STAR)) {
                    parser.exprParser.parseTest();
                } else {
                    bases.add(parser.exprParser.parseTest());
                }
                if (!parser.match(COMMA)) break;
            }
            parser.expect(RPAREN, "Expected ')' after base classes");
        }
        return new ClassDefStmt(loc, name, bases, parseBlock(), decorators);
    }

    private Statement parseAsync(List<Expression> decorators) {
        SourceLocation loc = parser.location();
        parser.advance(); // async
        if (parser.check(KW_DEF)) {
            return parseFunctionDef(loc, decorators, true);
        }
        if (decorators.isEmpty()) {
            if (parser.check(KW_FOR)) return parseForStmt(loc, true);
            if (parser.check(KW_WITH)) return parseWithStmt(loc, true);
        }
        throw parser.error("Expected 'def', 'for' or 'with' after 'async'");
    }

    private Statement parseDecorated() {
        List<Expression> decorators = new ArrayList<>();
        while (parser.match(AT)) {
            decorators.add(parser.exprParser.parseNamed());
            parser.expect(NEWLINE, "Expected newline after decorator");
        }
        if (parser.check(KW_DEF)) {
            return parseFunctionDef(parser.location(), decorators, false);
        }
        if (parser.check(KW_CLASS)) {
            return parseClassDef(decorators);
        }
        if (parser.check(KW_ASYNC)) {
            return parseAsync(decorators);
        }
        throw parser.error("Expected function or class definition after decorator");
    }

    // ============ 简单语句 ============

    private Statement parseSmallStatement() {
        SourceLocation loc = parser.location();
        switch (parser.current.getType()) {
            case KW_PASS:
                parser.advance();
                return new PassStmt(loc);
            case KW_BREAK:
                parser.advance();
                return new BreakStmt(loc);
            case KW_CONTINUE:
                parser.advance();
                return new ContinueStmt(loc);
            case KW_RETURN: {
                parser.advance();
                Expression value = parser.exprParser.isExpressionStart()
                        ? parser.exprParser.parseExpressionList(true) : null;
                return new ReturnStmt(loc, value);
            }
            case KW_RAISE: {
                parser.advance();
                Expression exception = null;
                Expression cause = null;
                if (parser.exprParser.isExpressionStart()) {
                    exception = parser.exprParser.parseTest();
                    if (parser.match(KW_FROM)) {
                        cause = parser.exprParser.parseTest();
                    }
                }
                return new RaiseStmt(loc, exception, cause);
            }
            case KW_GLOBAL:
                parser.advance();
                return new GlobalStmt(loc, parseNameList());
            case KW_NONLOCAL:
                parser.advance();
                return new NonlocalStmt(loc, parseNameList());
            case KW_DEL: {
                Token start = parser.advance();
                Expression target = parser.exprParser.parseTargetList();
                validateTarget(target, start);
                List<Expression> targets = target instanceof TupleExpr
                        ? ((TupleExpr) target).getElements()
                        : Collections.singletonList(target);
                return new DeleteStmt(loc, targets);
            }
            case KW_ASSERT: {
                parser.advance();
                Expression test = parser.exprParser.parseTest();
                Expression message = parser.match(COMMA) ? parser.exprParser.parseTest() : null;
                return new AssertStmt(loc, test, message);
            }
            case KW_IMPORT:
                return parseImport();
            case KW_FROM:
                return parseImportFrom();
            default:
                return parseExpressionStatement();
        }
    }

    private List<String> parseNameList() {
        List<String> names = new ArrayList<>();
        do {
            names.add(parser.expectIdentifier("Expected name"));
        } while (parser.match(COMMA));
        return names;
    }

    private String parseDottedName() {
        StringBuilder sb = new StringBuilder(parser.expectIdentifier("Expected module name"));
        while (parser.match(DOT)) {
            sb.append('.').append(parser.expectIdentifier("Expected name after '.'"));
        }
        return sb.toString();
    }

    private Statement parseImport() {
        SourceLocation loc = parser.location();
        parser.advance(); // import
        List<Alias> names = new ArrayList<>();
        do {
            String name = parseDottedName();
            String asName = parser.match(KW_AS) ? parser.expectIdentifier("Expected name after 'as'") : null;
            names.add(new Alias(name, asName));
        } while (parser.match(COMMA));
        return new ImportStmt(loc, names);
    }

    private Statement parseImportFrom() {
        SourceLocation loc = parser.location();
        parser.advance(); // from
        int level = 0;
        while (parser.check(DOT) || parser.check(ELLIPSIS)) {
            level += parser.advance().is(ELLIPSIS) ? 3 : 1;
        }
        String module = parser.check(IDENTIFIER) ? parseDottedName() : null;
        if (module == null && level == 0) {
            throw parser.error("Expected module name after 'from'");
        }
        parser.expect(KW_IMPORT, "Expected 'import'");

        List<Alias> names = new ArrayList<>();
        if (parser.match(STAR)) {
            names.add(new Alias("*", null));
        } else {
            boolean parenthesized = parser.match(LPAREN);
            do {
                if (parenthesized && parser.check(RPAREN)) break;
                String name = parser.expectIdentifier("Expected name to import");
                String asName = parser.match(KW_AS) ? parser.expectIdentifier("Expected name after 'as'") : null;
                names.add(new Alias(name, asName));
            } while (parser.match(COMMA));
            if (parenthesized) {
                parser.expect(RPAREN, "Expected ')' after import list");
            }
        }
        return new ImportFromStmt(loc, module, names, level);
    }

    /**
     * 表达式语句、赋值、增量赋值与注解赋值
     */
    private Statement parseExpressionStatement() {
        SourceLocation loc = parser.location();
        Token start = parser.current;
        ExprParser exprs = parser.exprParser;
        Expression first = parser.check(KW_YIELD) ? exprs.parseYield() : exprs.parseExpressionList(true);

        if (parser.match(COLON)) {
            validateSingleTarget(first, start);
            Expression annotation = exprs.parseTest();
            Expression value = parser.match(ASSIGN) ? parseAssignValue() : null;
            return new AnnAssignStmt(loc, first, annotation, value);
        }

        if (parser.current.getType().isAugmentedAssign()) {
            validateSingleTarget(first, start);
            BinaryExpr.Operator op = augmentedOperator(parser.advance().getType());
            return new AugAssignStmt(loc, first, op, parseAssignValue());
        }

        if (parser.check(ASSIGN)) {
            List<Expression> targets = new ArrayList<>();
            targets.add(first);
            Expression value = null;
            while (parser.match(ASSIGN)) {
                value = parseAssignValue();
                targets.add(value);
            }
            targets.remove(targets.size() - 1);
            for (Expression target : targets) {
                validateTarget(target, start);
            }
            return new AssignStmt(loc, targets, value);
        }

        return new ExpressionStmt(loc, first);
    }

    private Expression parseAssignValue() {
        if (parser.check(KW_YIELD)) {
            return parser.exprParser.parseYield();
        }
        return parser.exprParser.parseExpressionList(true);
    }

    private void validateSingleTarget(Expression target, Token start) {
        if (target instanceof NameExpr || target instanceof AttributeExpr || target instanceof SubscriptExpr) {
            return;
        }
        throw new ParseException("Illegal target for annotation or augmented assignment", start);
    }

    private void validateTarget(Expression target, Token start) {
        if (target instanceof NameExpr || target instanceof AttributeExpr || target instanceof SubscriptExpr) {
            return;
        }
        if (target instanceof StarredExpr) {
            validateTarget(((StarredExpr) target).getValue(), start);
            return;
        }
        List<Expression> elements = null;
        if (target instanceof TupleExpr) {
            elements = ((TupleExpr) target).getElements();
        } else if (target instanceof ListExpr) {
            elements = ((ListExpr) target).getElements();
        }
        if (elements == null) {
            throw new ParseException("Cannot assign to expression", start);
        }
        for (Expression element : elements) {
            validateTarget(element, start);
        }
    }

    private static BinaryExpr.Operator augmentedOperator(TokenType type) {
        switch (type) {
            case PLUS_ASSIGN: return BinaryExpr.Operator.ADD;
            case MINUS_ASSIGN: return BinaryExpr.Operator.SUB;
            case STAR_ASSIGN: return BinaryExpr.Operator.MULT;
            case SLASH_ASSIGN: return BinaryExpr.Operator.DIV;
            case DOUBLE_SLASH_ASSIGN: return BinaryExpr.Operator.FLOOR_DIV;
            case PERCENT_ASSIGN: return BinaryExpr.Operator.MOD;
            case AT_ASSIGN: return BinaryExpr.Operator.MAT_MULT;
            case AMPER_ASSIGN: return BinaryExpr.Operator.BIT_AND;
            case VBAR_ASSIGN: return BinaryExpr.Operator.BIT_OR;
            case CIRCUMFLEX_ASSIGN: return BinaryExpr.Operator.BIT_XOR;
            case LSHIFT_ASSIGN: return BinaryExpr.Operator.LSHIFT;
            case RSHIFT_ASSIGN: return BinaryExpr.Operator.RSHIFT;
            case DOUBLE_STAR_ASSIGN: return BinaryExpr.Operator.POW;
            default:
                throw new IllegalArgumentException("Not an augmented assignment: " + type);
        }
    }
}
