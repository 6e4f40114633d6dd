package com.py2swift.compiler.parser;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.expr.Expression;
import com.py2swift.compiler.ast.stmt.Module;
import com.py2swift.compiler.ast.stmt.Statement;
import com.py2swift.compiler.lexer.Lexer;
import com.py2swift.compiler.lexer.Token;
import com.py2swift.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.py2swift.compiler.lexer.TokenType.*;

/**
 * Python 语法分析器（递归下降）
 *
 * <p>语句和表达式分别委托给 {@link StmtParser} 与 {@link ExprParser}。
 * 任何不符合语法的输入都会抛出 {@link ParseException}。</p>
 */
public class Parser {

    final String fileName;
    private final List<Token> tokens;
    private int position;
    Token current;
    Token previous;

    // === Helper 实例 ===
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);
    final FStringParser fStringParser = new FStringParser(this);

    public Parser(Lexer lexer, String fileName) {
        this.fileName = fileName;
        this.tokens = lexer.scanTokens();
        this.position = 0;
        this.current = tokens.get(0);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        if (position < tokens.size() - 1) {
            position++;
        }
        current = tokens.get(position);
        return previous;
    }

    /**
     * 向前查看第 n 个 token（n = 1 为当前 token 的下一个）
     */
    Token peek(int n) {
        int index = Math.min(position + n, tokens.size() - 1);
        return tokens.get(index);
    }

    /**
     * 标记当前位置，用于回溯
     */
    int mark() {
        return position;
    }

    /**
     * 回溯到标记的位置
     */
    void reset(int mark) {
        position = mark;
        current = tokens.get(position);
        previous = position > 0 ? tokens.get(position - 1) : null;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    String expectIdentifier(String message) {
        return expect(IDENTIFIER, message).getLexeme();
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return location(current);
    }

    SourceLocation location(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn());
    }

    /**
     * 是否到达文件末尾
     */
    boolean isAtEnd() {
        return check(EOF);
    }

    ParseException error(String message) {
        return new ParseException(message, current);
    }

    // ============ 入口 ============

    /**
     * 解析整个模块
     */
    public Module parse() {
        checkLexicalErrors();
        SourceLocation loc = location();
        List<Statement> body = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(NEWLINE)) continue;
            if (check(INDENT)) {
                throw error("Unexpected indent");
            }
            body.addAll(stmtParser.parseStatement());
        }
        return new Module(loc, body);
    }

    /**
     * 解析单个独立表达式（f-string 插值片段使用）
     */
    public Expression parseStandaloneExpression() {
        checkLexicalErrors();
        if (checkAny(NEWLINE, EOF)) {
            throw error("f-string: empty expression not allowed");
        }
        Expression expr = check(KW_YIELD)
                ? exprParser.parseYield()
                : exprParser.parseExpressionList(true);
        while (match(NEWLINE)) {
            // 跳过
        }
        if (!isAtEnd()) {
            throw error("Unexpected token after expression");
        }
        return expr;
    }

    /**
     * 词法错误在解析开始前统一报告
     */
    private void checkLexicalErrors() {
        for (Token token : tokens) {
            if (token.getType() == ERROR) {
                throw new ParseException(String.valueOf(token.getLiteral()), token);
            }
        }
    }
}
