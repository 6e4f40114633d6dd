package com.py2swift.compiler.parser;

import com.py2swift.compiler.ast.Parameter;
import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.expr.*;
import com.py2swift.compiler.lexer.Token;
import com.py2swift.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.py2swift.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>优先级从低到高：lambda / 条件表达式 → or → and → not → 比较 → | → ^ → &amp;
 * → 移位 → 加减 → 乘除 → 一元 → ** → await → 后缀（属性 / 调用 / 下标） → 原子。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 当前 token 能否作为表达式开头
     */
    boolean isExpressionStart() {
        switch (parser.current.getType()) {
            case IDENTIFIER:
            case INT_LITERAL:
            case FLOAT_LITERAL:
            case IMAGINARY_LITERAL:
            case STRING_LITERAL:
            case FSTRING_LITERAL:
            case KW_TRUE:
            case KW_FALSE:
            case KW_NONE:
            case ELLIPSIS:
            case LPAREN:
            case LBRACKET:
            case LBRACE:
            case MINUS:
            case PLUS:
            case TILDE:
            case STAR:
            case KW_NOT:
            case KW_LAMBDA:
            case KW_AWAIT:
                return true;
            default:
                return false;
        }
    }

    // ============ 表达式列表 ============

    /**
     * 逗号分隔的表达式列表，多于一项（或带尾随逗号）时构成元组
     */
    Expression parseExpressionList(boolean allowStar) {
        SourceLocation loc = parser.location();
        Expression first = parseStarOrNamed(allowStar);
        if (!parser.check(COMMA)) {
            return first;
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (!isExpressionStart()) break;
            elements.add(parseStarOrNamed(allowStar));
        }
        return new TupleExpr(loc, elements);
    }

    /**
     * 赋值目标列表（for 目标、推导式目标、del），不解析比较运算，避免吞掉 in
     */
    Expression parseTargetList() {
        SourceLocation loc = parser.location();
        Expression first = parseTargetItem();
        if (!parser.check(COMMA)) {
            return first;
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (!isExpressionStart()) break;
            elements.add(parseTargetItem());
        }
        return new TupleExpr(loc, elements);
    }

    private Expression parseTargetItem() {
        SourceLocation loc = parser.location();
        if (parser.match(STAR)) {
            return new StarredExpr(loc, parseBitOr());
        }
        return parseBitOr();
    }

    Expression parseStarOrNamed(boolean allowStar) {
        SourceLocation loc = parser.location();
        if (allowStar && parser.match(STAR)) {
            return new StarredExpr(loc, parseBitOr());
        }
        return parseNamed();
    }

    /**
     * name := value 或普通表达式
     */
    Expression parseNamed() {
        if (parser.check(IDENTIFIER) && parser.peek(1).is(WALRUS)) {
            SourceLocation loc = parser.location();
            String name = parser.advance().getLexeme();
            parser.advance(); // :=
            return new NamedExpr(loc, name, parseTest());
        }
        return parseTest();
    }

    // ============ 条件 / lambda ============

    Expression parseTest() {
        if (parser.check(KW_LAMBDA)) {
            return parseLambda();
        }
        SourceLocation loc = parser.location();
        Expression body = parseOr();
        if (parser.match(KW_IF)) {
            Expression test = parseOr();
            parser.expect(KW_ELSE, "Expected 'else' in conditional expression");
            Expression orElse = parseTest();
            return new ConditionalExpr(loc, test, body, orElse);
        }
        return body;
    }

    private Expression parseLambda() {
        SourceLocation loc = parser.location();
        parser.advance(); // lambda
        List<Parameter> params = parseParameters(COLON, false);
        parser.expect(COLON, "Expected ':' after lambda parameters");
        return new LambdaExpr(loc, params, parseTest());
    }

    /**
     * 形参列表，直到 closing（不消费 closing）
     */
    List<Parameter> parseParameters(TokenType closing, boolean allowAnnotations) {
        List<Parameter> params = new ArrayList<>();
        boolean keywordOnly = false;
        while (!parser.check(closing)) {
            SourceLocation loc = parser.location();
            if (parser.match(STAR)) {
                if (parser.check(IDENTIFIER)) {
                    String name = parser.advance().getLexeme();
                    params.add(new Parameter(loc, name, parseAnnotation(allowAnnotations), null,
                            Parameter.Kind.VARARG));
                }
                keywordOnly = true;
            } else if (parser.match(DOUBLE_STAR)) {
                String name = parser.expectIdentifier("Expected parameter name after '**'");
                params.add(new Parameter(loc, name, parseAnnotation(allowAnnotations), null,
                        Parameter.Kind.KWARG));
            } else if (parser.match(SLASH)) {
                // 仅位置参数分隔符，无需记录
            } else {
                String name = parser.expectIdentifier("Expected parameter name");
                Expression annotation = parseAnnotation(allowAnnotations);
                Expression defaultValue = parser.match(ASSIGN) ? parseTest() : null;
                params.add(new Parameter(loc, name, annotation, defaultValue,
                        keywordOnly ? Parameter.Kind.KEYWORD_ONLY : Parameter.Kind.POSITIONAL));
            }
            if (!parser.match(COMMA)) break;
        }
        return params;
    }

    private Expression parseAnnotation(boolean allowed) {
        if (allowed && parser.match(COLON)) {
            return parseTest();
        }
        return null;
    }

    // ============ 布尔运算 ============

    Expression parseOr() {
        SourceLocation loc = parser.location();
        Expression left = parseAnd();
        if (!parser.check(KW_OR)) {
            return left;
        }
        List<Expression> values = new ArrayList<>();
        values.add(left);
        while (parser.match(KW_OR)) {
            values.add(parseAnd());
        }
        return new BoolOpExpr(loc, BoolOpExpr.Operator.OR, values);
    }

    private Expression parseAnd() {
        SourceLocation loc = parser.location();
        Expression left = parseNot();
        if (!parser.check(KW_AND)) {
            return left;
        }
        List<Expression> values = new ArrayList<>();
        values.add(left);
        while (parser.match(KW_AND)) {
            values.add(parseNot());
        }
        return new BoolOpExpr(loc, BoolOpExpr.Operator.AND, values);
    }

    private Expression parseNot() {
        if (parser.check(KW_NOT)) {
            SourceLocation loc = parser.location();
            parser.advance();
            return new UnaryExpr(loc, UnaryExpr.Operator.NOT, parseNot());
        }
        return parseComparison();
    }

    // ============ 比较 ============

    private Expression parseComparison() {
        SourceLocation loc = parser.location();
        Expression left = parseBitOr();
        List<CompareExpr.Operator> operators = new ArrayList<>();
        List<Expression> comparators = new ArrayList<>();
        CompareExpr.Operator op;
        while ((op = matchComparisonOperator()) != null) {
            operators.add(op);
            comparators.add(parseBitOr());
        }
        if (operators.isEmpty()) {
            return left;
        }
        return new CompareExpr(loc, left, operators, comparators);
    }

    private CompareExpr.Operator matchComparisonOperator() {
        switch (parser.current.getType()) {
            case EQ: parser.advance(); return CompareExpr.Operator.EQ;
            case NE: parser.advance(); return CompareExpr.Operator.NOT_EQ;
            case LT: parser.advance(); return CompareExpr.Operator.LT;
            case LE: parser.advance(); return CompareExpr.Operator.LT_E;
            case GT: parser.advance(); return CompareExpr.Operator.GT;
            case GE: parser.advance(); return CompareExpr.Operator.GT_E;
            case KW_IN:
                parser.advance();
                return CompareExpr.Operator.IN;
            case KW_NOT:
                if (parser.peek(1).is(KW_IN)) {
                    parser.advance();
                    parser.advance();
                    return CompareExpr.Operator.NOT_IN;
                }
                return null;
            case KW_IS:
                parser.advance();
                return parser.match(KW_NOT) ? CompareExpr.Operator.IS_NOT : CompareExpr.Operator.IS;
            default:
                return null;
        }
    }

    // ============ 二元运算 ============

    Expression parseBitOr() {
        SourceLocation loc = parser.location();
        Expression left = parseBitXor();
        while (parser.match(VBAR)) {
            left = new BinaryExpr(loc, left, BinaryExpr.Operator.BIT_OR, parseBitXor());
        }
        return left;
    }

    private Expression parseBitXor() {
        SourceLocation loc = parser.location();
        Expression left = parseBitAnd();
        while (parser.match(CIRCUMFLEX)) {
            left = new BinaryExpr(loc, left, BinaryExpr.Operator.BIT_XOR, parseBitAnd());
        }
        return left;
    }

    private Expression parseBitAnd() {
        SourceLocation loc = parser.location();
        Expression left = parseShift();
        while (parser.match(AMPER)) {
            left = new BinaryExpr(loc, left, BinaryExpr.Operator.BIT_AND, parseShift());
        }
        return left;
    }

    private Expression parseShift() {
        SourceLocation loc = parser.location();
        Expression left = parseArith();
        while (parser.checkAny(LSHIFT, RSHIFT)) {
            BinaryExpr.Operator op = parser.advance().is(LSHIFT)
                    ? BinaryExpr.Operator.LSHIFT : BinaryExpr.Operator.RSHIFT;
            left = new BinaryExpr(loc, left, op, parseArith());
        }
        return left;
    }

    private Expression parseArith() {
        SourceLocation loc = parser.location();
        Expression left = parseTerm();
        while (parser.checkAny(PLUS, MINUS)) {
            BinaryExpr.Operator op = parser.advance().is(PLUS)
                    ? BinaryExpr.Operator.ADD : BinaryExpr.Operator.SUB;
            left = new BinaryExpr(loc, left, op, parseTerm());
        }
        return left;
    }

    private Expression parseTerm() {
        SourceLocation loc = parser.location();
        Expression left = parseFactor();
        while (true) {
            BinaryExpr.Operator op;
            switch (parser.current.getType()) {
                case STAR: op = BinaryExpr.Operator.MULT; break;
                case SLASH: op = BinaryExpr.Operator.DIV; break;
                case DOUBLE_SLASH: op = BinaryExpr.Operator.FLOOR_DIV; break;
                case PERCENT: op = BinaryExpr.Operator.MOD; break;
                case AT: op = BinaryExpr.Operator.MAT_MULT; break;
                default: return left;
            }
            parser.advance();
            left = new BinaryExpr(loc, left, op, parseFactor());
        }
    }

    private Expression parseFactor() {
        SourceLocation loc = parser.location();
        UnaryExpr.Operator op;
        switch (parser.current.getType()) {
            case MINUS: op = UnaryExpr.Operator.NEGATE; break;
            case PLUS: op = UnaryExpr.Operator.PLUS; break;
            case TILDE: op = UnaryExpr.Operator.INVERT; break;
            default: return parsePower();
        }
        parser.advance();
        return new UnaryExpr(loc, op, parseFactor());
    }

    /**
     * ** 右结合，且右侧可以是一元表达式（2 ** -1）
     */
    private Expression parsePower() {
        SourceLocation loc = parser.location();
        Expression base = parseAwait();
        if (parser.match(DOUBLE_STAR)) {
            return new BinaryExpr(loc, base, BinaryExpr.Operator.POW, parseFactor());
        }
        return base;
    }

    private Expression parseAwait() {
        if (parser.check(KW_AWAIT)) {
            SourceLocation loc = parser.location();
            parser.advance();
            return new AwaitExpr(loc, parsePrimary());
        }
        return parsePrimary();
    }

    // ============ 后缀 ============

    private Expression parsePrimary() {
        Expression expr = parseAtom();
        while (true) {
            if (parser.match(DOT)) {
                String name = parser.expectIdentifier("Expected attribute name after '.'");
                expr = new AttributeExpr(expr.getLocation(), expr, name);
            } else if (parser.check(LPAREN)) {
                expr = parseCall(expr);
            } else if (parser.match(LBRACKET)) {
                Expression index = parseSubscriptList();
                parser.expect(RBRACKET, "Expected ']' after subscript");
                expr = new SubscriptExpr(expr.getLocation(), expr, index);
            } else {
                return expr;
            }
        }
    }

    private Expression parseCall(Expression function) {
        parser.advance(); // (
        List<Expression> args = new ArrayList<>();
        List<Keyword> keywords = new ArrayList<>();
        while (!parser.check(RPAREN)) {
            SourceLocation loc = parser.location();
            if (parser.match(STAR)) {
                args.add(new StarredExpr(loc, parseTest()));
            } else if (parser.match(DOUBLE_STAR)) {
                keywords.add(new Keyword(null, parseTest()));
            } else if (parser.check(IDENTIFIER) && parser.peek(1).is(ASSIGN)) {
                String name = parser.advance().getLexeme();
                parser.advance(); // =
                keywords.add(new Keyword(name, parseTest()));
            } else {
                Expression arg = parseNamed();
                if (isComprehensionStart()) {
                    arg = new GeneratorExpr(loc, arg, parseComprehensionClauses());
                }
                args.add(arg);
            }
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RPAREN, "Expected ')' after arguments");
        return new CallExpr(function.getLocation(), function, args, keywords);
    }

    private Expression parseSubscriptList() {
        SourceLocation loc = parser.location();
        Expression first = parseSubscriptItem();
        if (!parser.check(COMMA)) {
            return first;
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RBRACKET)) break;
            elements.add(parseSubscriptItem());
        }
        return new TupleExpr(loc, elements);
    }

    private Expression parseSubscriptItem() {
        SourceLocation loc = parser.location();
        Expression lower = null;
        if (!parser.check(COLON)) {
            lower = parseStarOrNamed(true);
            if (!parser.check(COLON)) {
                return lower;
            }
        }
        parser.advance(); // :
        Expression upper = parser.checkAny(COLON, RBRACKET, COMMA) ? null : parseTest();
        Expression step = null;
        if (parser.match(COLON)) {
            step = parser.checkAny(RBRACKET, COMMA) ? null : parseTest();
        }
        return new SliceExpr(loc, lower, upper, step);
    }

    // ============ 原子 ============

    private Expression parseAtom() {
        Token token = parser.current;
        SourceLocation loc = parser.location();
        switch (token.getType()) {
            case IDENTIFIER:
                parser.advance();
                return new NameExpr(loc, token.getLexeme());
            case INT_LITERAL:
                parser.advance();
                return new ConstantExpr(loc, ConstantExpr.Kind.INT, token.getLiteral(), token.getLexeme());
            case FLOAT_LITERAL:
                parser.advance();
                return new ConstantExpr(loc, ConstantExpr.Kind.FLOAT, token.getLiteral(), token.getLexeme());
            case IMAGINARY_LITERAL:
                parser.advance();
                return new ConstantExpr(loc, ConstantExpr.Kind.IMAGINARY, token.getLexeme(), token.getLexeme());
            case STRING_LITERAL:
            case FSTRING_LITERAL:
                return parseStrings();
            case KW_TRUE:
                parser.advance();
                return new ConstantExpr(loc, ConstantExpr.Kind.BOOL, Boolean.TRUE, "True");
            case KW_FALSE:
                parser.advance();
                return new ConstantExpr(loc, ConstantExpr.Kind.BOOL, Boolean.FALSE, "False");
            case KW_NONE:
                parser.advance();
                return new ConstantExpr(loc, ConstantExpr.Kind.NONE, null, "None");
            case ELLIPSIS:
                parser.advance();
                return new ConstantExpr(loc, ConstantExpr.Kind.ELLIPSIS, null, "...");
            case LPAREN:
                return parseParenthesized();
            case LBRACKET:
                return parseListDisplay();
            case LBRACE:
                return parseBraceDisplay();
            default:
                throw new ParseException("Expected expression", token);
        }
    }

    /**
     * 相邻字符串字面量隐式拼接；含 f-string 时结果为 JoinedStrExpr
     */
    private Expression parseStrings() {
        SourceLocation loc = parser.location();
        List<Token> parts = new ArrayList<>();
        boolean formatted = false;
        while (parser.checkAny(STRING_LITERAL, FSTRING_LITERAL)) {
            Token part = parser.advance();
            formatted |= part.is(FSTRING_LITERAL);
            parts.add(part);
        }

        if (!formatted) {
            StringBuilder sb = new StringBuilder();
            for (Token part : parts) {
                sb.append((String) part.getLiteral());
            }
            return ConstantExpr.ofString(loc, sb.toString());
        }

        List<Expression> values = new ArrayList<>();
        for (Token part : parts) {
            if (part.is(STRING_LITERAL)) {
                appendLiteral(values, loc, (String) part.getLiteral());
                continue;
            }
            for (Expression piece : parser.fStringParser.parse(part)) {
                if (piece instanceof ConstantExpr) {
                    appendLiteral(values, loc, ((ConstantExpr) piece).getStringValue());
                } else {
                    values.add(piece);
                }
            }
        }
        return new JoinedStrExpr(loc, values);
    }

    /** 与前一个字符串常量合并 */
    static void appendLiteral(List<Expression> values, SourceLocation loc, String text) {
        if (text.isEmpty()) return;
        int last = values.size() - 1;
        if (last >= 0 && values.get(last) instanceof ConstantExpr) {
            ConstantExpr previous = (ConstantExpr) values.get(last);
            values.set(last, ConstantExpr.ofString(previous.getLocation(), previous.getStringValue() + text));
        } else {
            values.add(ConstantExpr.ofString(loc, text));
        }
    }

    private Expression parseParenthesized() {
        SourceLocation loc = parser.location();
        parser.advance(); // (
        if (parser.match(RPAREN)) {
            return new TupleExpr(loc, Collections.<Expression>emptyList());
        }
        if (parser.check(KW_YIELD)) {
            Expression yield = parseYield();
            parser.expect(RPAREN, "Expected ')'");
            return yield;
        }
        Expression first = parseStarOrNamed(true);
        if (isComprehensionStart()) {
            Expression gen = new GeneratorExpr(loc, first, parseComprehensionClauses());
            parser.expect(RPAREN, "Expected ')' after generator expression");
            return gen;
        }
        if (parser.check(COMMA)) {
            List<Expression> elements = new ArrayList<>();
            elements.add(first);
            while (parser.match(COMMA)) {
                if (parser.check(RPAREN)) break;
                elements.add(parseStarOrNamed(true));
            }
            parser.expect(RPAREN, "Expected ')' after tuple");
            return new TupleExpr(loc, elements);
        }
        parser.expect(RPAREN, "Expected ')'");
        return first;
    }

    private Expression parseListDisplay() {
        SourceLocation loc = parser.location();
        parser.advance(); // [
        List<Expression> elements = new ArrayList<>();
        if (parser.match(RBRACKET)) {
            return new ListExpr(loc, elements);
        }
        Expression first = parseStarOrNamed(true);
        if (isComprehensionStart()) {
            Expression comp = new ListCompExpr(loc, first, parseComprehensionClauses());
            parser.expect(RBRACKET, "Expected ']' after list comprehension");
            return comp;
        }
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RBRACKET)) break;
            elements.add(parseStarOrNamed(true));
        }
        parser.expect(RBRACKET, "Expected ']' after list elements");
        return new ListExpr(loc, elements);
    }

    private Expression parseBraceDisplay() {
        SourceLocation loc = parser.location();
        parser.advance(); // {
        List<Expression> keys = new ArrayList<>();
        List<Expression> values = new ArrayList<>();
        if (parser.match(RBRACE)) {
            return new DictExpr(loc, keys, values);
        }

        if (parser.match(DOUBLE_STAR)) {
            keys.add(null);
            values.add(parseBitOr());
            return parseDictRest(loc, keys, values);
        }

        Expression first = parseStarOrNamed(true);
        if (parser.match(COLON)) {
            Expression value = parseTest();
            if (isComprehensionStart()) {
                Expression comp = new DictCompExpr(loc, first, value, parseComprehensionClauses());
                parser.expect(RBRACE, "Expected '}' after dict comprehension");
                return comp;
            }
            keys.add(first);
            values.add(value);
            return parseDictRest(loc, keys, values);
        }

        if (isComprehensionStart()) {
            Expression comp = new SetCompExpr(loc, first, parseComprehensionClauses());
            parser.expect(RBRACE, "Expected '}' after set comprehension");
            return comp;
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RBRACE)) break;
            elements.add(parseStarOrNamed(true));
        }
        parser.expect(RBRACE, "Expected '}' after set elements");
        return new SetExpr(loc, elements);
    }

    private Expression parseDictRest(SourceLocation loc, List<Expression> keys, List<Expression> values) {
        while (parser.match(COMMA)) {
            if (parser.check(RBRACE)) break;
            if (parser.match(DOUBLE_STAR)) {
                keys.add(null);
                values.add(parseBitOr());
            } else {
                keys.add(parseTest());
                parser.expect(COLON, "Expected ':' in dict display");
                values.add(parseTest());
            }
        }
        parser.expect(RBRACE, "Expected '}' after dict entries");
        return new DictExpr(loc, keys, values);
    }

    // ============ 推导式 / yield ============

    private boolean isComprehensionStart() {
        return parser.check(KW_FOR) || (parser.check(KW_ASYNC) && parser.peek(1).is(KW_FOR));
    }

    private List<Comprehension> parseComprehensionClauses() {
        List<Comprehension> generators = new ArrayList<>();
        while (isComprehensionStart()) {
            boolean async = parser.match(KW_ASYNC);
            parser.expect(KW_FOR, "Expected 'for'");
            Expression target = parseTargetList();
            parser.expect(KW_IN, "Expected 'in' in comprehension");
            Expression iter = parseOr();
            List<Expression> ifs = new ArrayList<>();
            while (parser.match(KW_IF)) {
                ifs.add(parseOr());
            }
            generators.add(new Comprehension(target, iter, ifs, async));
        }
        return generators;
    }

    Expression parseYield() {
        SourceLocation loc = parser.location();
        parser.expect(KW_YIELD, "Expected 'yield'");
        if (parser.match(KW_FROM)) {
            return new YieldFromExpr(loc, parseTest());
        }
        if (!isExpressionStart()) {
            return new YieldExpr(loc, null);
        }
        return new YieldExpr(loc, parseExpressionList(true));
    }
}
