package com.py2swift.compiler.lexer;

/**
 * Python 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,
    FLOAT_LITERAL,
    IMAGINARY_LITERAL,      // 1j
    STRING_LITERAL,         // 已解码的字符串（含 r/b/u 前缀）
    FSTRING_LITERAL,        // f"..."，literal 为未解码的原始内容

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 ===
    KW_FALSE, KW_NONE, KW_TRUE,
    KW_AND, KW_AS, KW_ASSERT, KW_ASYNC, KW_AWAIT,
    KW_BREAK, KW_CLASS, KW_CONTINUE, KW_DEF, KW_DEL,
    KW_ELIF, KW_ELSE, KW_EXCEPT, KW_FINALLY, KW_FOR,
    KW_FROM, KW_GLOBAL, KW_IF, KW_IMPORT, KW_IN, KW_IS,
    KW_LAMBDA, KW_NONLOCAL, KW_NOT, KW_OR, KW_PASS,
    KW_RAISE, KW_RETURN, KW_TRY, KW_WHILE, KW_WITH, KW_YIELD,

    // === 运算符 ===
    PLUS, MINUS, STAR, DOUBLE_STAR, SLASH, DOUBLE_SLASH, PERCENT, AT,
    LSHIFT, RSHIFT, AMPER, VBAR, CIRCUMFLEX, TILDE, WALRUS,
    LT, GT, LE, GE, EQ, NE,

    // === 赋值 ===
    ASSIGN,
    PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, DOUBLE_SLASH_ASSIGN,
    PERCENT_ASSIGN, AT_ASSIGN, AMPER_ASSIGN, VBAR_ASSIGN, CIRCUMFLEX_ASSIGN,
    LSHIFT_ASSIGN, RSHIFT_ASSIGN, DOUBLE_STAR_ASSIGN,

    // === 分隔符 ===
    LPAREN, RPAREN, LBRACKET, RBRACKET, LBRACE, RBRACE,
    COMMA, COLON, DOT, SEMICOLON, ARROW, ELLIPSIS,

    // === 布局 ===
    NEWLINE,
    INDENT,
    DEDENT,

    // === 特殊 ===
    EOF,
    ERROR;

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否为增强赋值操作符（+= 等）
     */
    public boolean isAugmentedAssign() {
        switch (this) {
            case PLUS_ASSIGN:
            case MINUS_ASSIGN:
            case STAR_ASSIGN:
            case SLASH_ASSIGN:
            case DOUBLE_SLASH_ASSIGN:
            case PERCENT_ASSIGN:
            case AT_ASSIGN:
            case AMPER_ASSIGN:
            case VBAR_ASSIGN:
            case CIRCUMFLEX_ASSIGN:
            case LSHIFT_ASSIGN:
            case RSHIFT_ASSIGN:
            case DOUBLE_STAR_ASSIGN:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为比较操作符（不含 in / is 这类关键词形式）
     */
    public boolean isComparisonOp() {
        switch (this) {
            case LT:
            case GT:
            case LE:
            case GE:
            case EQ:
            case NE:
                return true;
            default:
                return false;
        }
    }
}
