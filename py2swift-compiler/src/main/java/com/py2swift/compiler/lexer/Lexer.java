package com.py2swift.compiler.lexer;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Python 词法分析器
 *
 * <p>缩进敏感：在逻辑行首比较缩进宽度并生成 INDENT / DEDENT；
 * 括号内的换行不产生 NEWLINE（隐式续行），反斜杠换行为显式续行。</p>
 */
public class Lexer {
    private static final Logger LOG = Logger.getLogger(Lexer.class.getName());

    private static final int TAB_SIZE = 8;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("False", TokenType.KW_FALSE);
        map.put("None", TokenType.KW_NONE);
        map.put("True", TokenType.KW_TRUE);
        map.put("and", TokenType.KW_AND);
        map.put("as", TokenType.KW_AS);
        map.put("assert", TokenType.KW_ASSERT);
        map.put("async", TokenType.KW_ASYNC);
        map.put("await", TokenType.KW_AWAIT);
        map.put("break", TokenType.KW_BREAK);
        map.put("class", TokenType.KW_CLASS);
        map.put("continue", TokenType.KW_CONTINUE);
        map.put("def", TokenType.KW_DEF);
        map.put("del", TokenType.KW_DEL);
        map.put("elif", TokenType.KW_ELIF);
        map.put("else", TokenType.KW_ELSE);
        map.put("except", TokenType.KW_EXCEPT);
        map.put("finally", TokenType.KW_FINALLY);
        map.put("for", TokenType.KW_FOR);
        map.put("from", TokenType.KW_FROM);
        map.put("global", TokenType.KW_GLOBAL);
        map.put("if", TokenType.KW_IF);
        map.put("import", TokenType.KW_IMPORT);
        map.put("in", TokenType.KW_IN);
        map.put("is", TokenType.KW_IS);
        map.put("lambda", TokenType.KW_LAMBDA);
        map.put("nonlocal", TokenType.KW_NONLOCAL);
        map.put("not", TokenType.KW_NOT);
        map.put("or", TokenType.KW_OR);
        map.put("pass", TokenType.KW_PASS);
        map.put("raise", TokenType.KW_RAISE);
        map.put("return", TokenType.KW_RETURN);
        map.put("try", TokenType.KW_TRY);
        map.put("while", TokenType.KW_WHILE);
        map.put("with", TokenType.KW_WITH);
        map.put("yield", TokenType.KW_YIELD);
        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 合法的字符串前缀（小写形式） */
    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "f", "br", "rb", "fr", "rf");

    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indentStack = new ArrayDeque<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 当前 token 的起始位置
    private int tokenLine = 1;
    private int tokenColumn = 1;

    private int bracketDepth = 0;
    private boolean atLineStart = true;

    public Lexer(String source, String fileName) {
        this(source, fileName, 1);
    }

    /**
     * @param firstLine 源码首行的行号（f-string 内嵌表达式从所在行开始计数）
     */
    public Lexer(String source, String fileName, int firstLine) {
        this.source = source.replace("\r\n", "\n").replace('\r', '\n');
        this.fileName = fileName;
        this.line = firstLine;
        this.tokenLine = firstLine;
        this.indentStack.push(0);
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            if (atLineStart && bracketDepth == 0) {
                handleIndentation();
                if (atLineStart) {
                    continue; // 空行或纯注释行
                }
            }
            if (isAtEnd()) break;
            markTokenStart();
            scanToken();
        }

        markTokenStart();
        if (!tokens.isEmpty() && !lastIs(TokenType.NEWLINE) && !lastIs(TokenType.DEDENT)) {
            addSynthetic(TokenType.NEWLINE);
        }
        while (indentStack.peek() > 0) {
            indentStack.pop();
            addSynthetic(TokenType.DEDENT);
        }
        addSynthetic(TokenType.EOF);
        return tokens;
    }

    // === 缩进 ===

    private void handleIndentation() {
        int width = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            advance();
        }
        if (isAtEnd()) return;

        char c = peek();
        if (c == '\n') {
            advance();
            newLine();
            return;
        }
        if (c == '#') {
            skipComment();
            if (!isAtEnd()) {
                advance();
                newLine();
            }
            return;
        }

        atLineStart = false;
        markTokenStart();
        int top = indentStack.peek();
        if (width > top) {
            indentStack.push(width);
            addSynthetic(TokenType.INDENT);
        } else if (width < top) {
            while (indentStack.peek() > width) {
                indentStack.pop();
                addSynthetic(TokenType.DEDENT);
            }
            if (indentStack.peek() != width) {
                error("Unindent does not match any outer indentation level");
            }
        }
    }

    // === Token 扫描 ===

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': bracketDepth++; addToken(TokenType.LPAREN); break;
            case '[': bracketDepth++; addToken(TokenType.LBRACKET); break;
            case '{': bracketDepth++; addToken(TokenType.LBRACE); break;
            case ')': closeBracket(); addToken(TokenType.RPAREN); break;
            case ']': closeBracket(); addToken(TokenType.RBRACKET); break;
            case '}': closeBracket(); addToken(TokenType.RBRACE); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '~': addToken(TokenType.TILDE); break;

            case ':':
                addToken(match('=') ? TokenType.WALRUS : TokenType.COLON);
                break;

            case '.':
                if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    addToken(TokenType.ELLIPSIS);
                } else if (isDigit(peek())) {
                    number();
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case '+':
                addToken(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS);
                break;

            case '-':
                if (match('=')) addToken(TokenType.MINUS_ASSIGN);
                else if (match('>')) addToken(TokenType.ARROW);
                else addToken(TokenType.MINUS);
                break;

            case '*':
                if (match('*')) {
                    addToken(match('=') ? TokenType.DOUBLE_STAR_ASSIGN : TokenType.DOUBLE_STAR);
                } else {
                    addToken(match('=') ? TokenType.STAR_ASSIGN : TokenType.STAR);
                }
                break;

            case '/':
                if (match('/')) {
                    addToken(match('=') ? TokenType.DOUBLE_SLASH_ASSIGN : TokenType.DOUBLE_SLASH);
                } else {
                    addToken(match('=') ? TokenType.SLASH_ASSIGN : TokenType.SLASH);
                }
                break;

            case '%': addToken(match('=') ? TokenType.PERCENT_ASSIGN : TokenType.PERCENT); break;
            case '@': addToken(match('=') ? TokenType.AT_ASSIGN : TokenType.AT); break;
            case '&': addToken(match('=') ? TokenType.AMPER_ASSIGN : TokenType.AMPER); break;
            case '|': addToken(match('=') ? TokenType.VBAR_ASSIGN : TokenType.VBAR); break;
            case '^': addToken(match('=') ? TokenType.CIRCUMFLEX_ASSIGN : TokenType.CIRCUMFLEX); break;

            case '<':
                if (match('<')) {
                    addToken(match('=') ? TokenType.LSHIFT_ASSIGN : TokenType.LSHIFT);
                } else {
                    addToken(match('=') ? TokenType.LE : TokenType.LT);
                }
                break;

            case '>':
                if (match('>')) {
                    addToken(match('=') ? TokenType.RSHIFT_ASSIGN : TokenType.RSHIFT);
                } else {
                    addToken(match('=') ? TokenType.GE : TokenType.GT);
                }
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                if (match('=')) {
                    addToken(TokenType.NE);
                } else {
                    error("Unexpected character '!'. Did you mean '!='?");
                }
                break;

            case '#':
                skipComment();
                break;

            // 空白字符
            case ' ':
            case '\t':
            case '\f':
                break;

            case '\\':
                if (peek() == '\n') {
                    advance();
                    newLine();
                } else {
                    error("Unexpected character after line continuation character");
                }
                break;

            case '\n':
                if (bracketDepth == 0) {
                    addSynthetic(TokenType.NEWLINE);
                    atLineStart = true;
                }
                newLine();
                break;

            case '"':
            case '\'':
                string(c, "");
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    private void closeBracket() {
        if (bracketDepth > 0) {
            bracketDepth--;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int distance) {
        int index = current + distance;
        if (index >= source.length()) return '\0';
        return source.charAt(index);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private void markTokenStart() {
        start = current;
        tokenLine = line;
        tokenColumn = column;
    }

    private boolean lastIs(TokenType type) {
        return !tokens.isEmpty() && tokens.get(tokens.size() - 1).getType() == type;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private void skipComment() {
        while (peek() != '\n' && !isAtEnd()) advance();
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null, false);
    }

    private void addToken(TokenType type, Object literal, boolean raw) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, tokenLine, tokenColumn, raw));
    }

    /** 布局类 token 不占源码文本 */
    private void addSynthetic(TokenType type) {
        tokens.add(new Token(type, "", null, tokenLine, tokenColumn));
    }

    // === 复杂 Token 扫描 ===

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        if ((peek() == '"' || peek() == '\'')
                && STRING_PREFIXES.contains(text.toLowerCase(Locale.ROOT))) {
            char quote = advance();
            string(quote, text);
            return;
        }

        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private void string(char quote, String prefix) {
        String lowerPrefix = prefix.toLowerCase(Locale.ROOT);
        boolean raw = lowerPrefix.indexOf('r') >= 0;
        boolean formatted = lowerPrefix.indexOf('f') >= 0;

        boolean triple = peek() == quote && peekNext() == quote;
        if (triple) {
            advance();
            advance();
        }

        StringBuilder body = new StringBuilder();
        while (true) {
            if (isAtEnd()) {
                error(triple ? "Unterminated triple-quoted string" : "Unterminated string");
                return;
            }
            char c = peek();
            if (c == quote) {
                if (!triple) {
                    advance();
                    break;
                }
                if (peekAt(1) == quote && peekAt(2) == quote) {
                    advance();
                    advance();
                    advance();
                    break;
                }
                body.append(advance());
                continue;
            }
            if (c == '\n') {
                if (!triple) {
                    error("Unterminated string");
                    return;
                }
                body.append(advance());
                newLine();
                continue;
            }
            if (c == '\\') {
                body.append(advance());
                if (!isAtEnd()) {
                    char escaped = advance();
                    body.append(escaped);
                    if (escaped == '\n') newLine();
                }
                continue;
            }
            body.append(advance());
        }

        String text = body.toString();
        if (formatted) {
            addToken(TokenType.FSTRING_LITERAL, text, raw);
        } else {
            addToken(TokenType.STRING_LITERAL, raw ? text : PyStringUtils.unescape(text), raw);
        }
    }

    /** 消耗数字字符和下划线分隔符 */
    private void advanceDigits() {
        while (isDigit(peek()) || peek() == '_') advance();
    }

    private void number() {
        char first = source.charAt(start);
        if (first == '0') {
            char radixChar = Character.toLowerCase(peek());
            if (radixChar == 'x') {
                radixNumber(16);
                return;
            } else if (radixChar == 'o') {
                radixNumber(8);
                return;
            } else if (radixChar == 'b') {
                radixNumber(2);
                return;
            }
        }

        boolean isFloat = first == '.';
        advanceDigits();

        if (!isFloat && peek() == '.' && peekNext() != '.') {
            isFloat = true;
            advance(); // 消费 .
            advanceDigits();
        }

        // 指数部分
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext())
                    || ((peekNext() == '+' || peekNext() == '-') && isDigit(peekAt(2))))) {
            isFloat = true;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            advanceDigits();
        }

        if (peek() == 'j' || peek() == 'J') {
            advance();
            addToken(TokenType.IMAGINARY_LITERAL, source.substring(start, current), false);
            return;
        }

        String text = source.substring(start, current).replace("_", "");
        try {
            if (isFloat) {
                addToken(TokenType.FLOAT_LITERAL, Double.parseDouble(text), false);
            } else {
                addToken(TokenType.INT_LITERAL, new BigInteger(text), false);
            }
        } catch (NumberFormatException e) {
            error("Invalid number literal: " + source.substring(start, current));
        }
    }

    private void radixNumber(int radix) {
        advance(); // 消费 x / o / b
        while (isHexDigit(peek()) || peek() == '_') advance();

        String digits = source.substring(start + 2, current).replace("_", "");
        try {
            addToken(TokenType.INT_LITERAL, new BigInteger(digits, radix), false);
        } catch (NumberFormatException e) {
            error("Invalid integer literal: " + source.substring(start, current));
        }
    }

    private void error(String message) {
        LOG.fine(() -> String.format("[%s:%d:%d] Lexer error: %s", fileName, tokenLine, tokenColumn, message));
        tokens.add(new Token(TokenType.ERROR, source.substring(start, Math.min(current, source.length())),
                message, tokenLine, tokenColumn));
    }
}
