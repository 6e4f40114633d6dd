package com.py2swift.compiler.lexer;

/**
 * 词法单元
 *
 * <p>字符串 token 的 literal 为解码后的值；f-string 的 literal 为原始内容，
 * 由解析器拆分插值片段；数字 token 的 literal 为数值（{@link java.math.BigInteger} 或 {@link Double}）。</p>
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;
    private final boolean rawString;

    public Token(TokenType type, String lexeme, Object literal, int line, int column) {
        this(type, lexeme, literal, line, column, false);
    }

    public Token(TokenType type, String lexeme, Object literal, int line, int column, boolean rawString) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.rawString = rawString;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** r 前缀字符串（f-string 拆分时不解码反斜杠） */
    public boolean isRawString() {
        return rawString;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    @Override
    public String toString() {
        if (literal != null) {
            return String.format("%s(%s, %s) at %d:%d", type, lexeme, literal, line, column);
        }
        return String.format("%s(%s) at %d:%d", type, lexeme, line, column);
    }
}
