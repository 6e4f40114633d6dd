package com.py2swift.compiler.parser;

import com.py2swift.compiler.lexer.Token;
import com.py2swift.compiler.lexer.TokenType;

/**
 * 解析异常：输入不是合法的 Python 源码
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token) {
        super(message);
        this.token = token;
        this.expected = null;
    }

    public ParseException(String message, Token token, String expected) {
        super(message);
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    /** 出错行号，未知时为 0 */
    public int getLine() {
        return token != null ? token.getLine() : 0;
    }

    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            if (token.getType() == TokenType.EOF) {
                sb.append(" (found end of input)");
            } else if (!token.getLexeme().isEmpty()) {
                sb.append(" (found '").append(token.getLexeme()).append("')");
            } else {
                sb.append(" (found ").append(token.getType()).append(")");
            }
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
