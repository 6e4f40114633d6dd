package com.py2swift.compiler.parser;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.expr.Expression;
import com.py2swift.compiler.ast.expr.FormattedValueExpr;
import com.py2swift.compiler.ast.expr.JoinedStrExpr;
import com.py2swift.compiler.lexer.Lexer;
import com.py2swift.compiler.lexer.PyStringUtils;
import com.py2swift.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * f-string 拆分：把原始内容切分为字符串常量和 {expr!conv:spec} 插值片段
 */
class FStringParser {

    private final Parser parser;

    FStringParser(Parser parser) {
        this.parser = parser;
    }

    List<Expression> parse(Token token) {
        List<Expression> parts = new ArrayList<>();
        parseInto((String) token.getLiteral(), token, parts);
        return parts;
    }

    private void parseInto(String body, Token token, List<Expression> parts) {
        SourceLocation loc = parser.location(token);
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '{') {
                if (i + 1 < body.length() && body.charAt(i + 1) == '{') {
                    literal.append('{');
                    i += 2;
                    continue;
                }
                flushLiteral(literal, token, loc, parts);
                i = parseReplacement(body, i + 1, token, parts);
                continue;
            }
            if (c == '}') {
                if (i + 1 < body.length() && body.charAt(i + 1) == '}') {
                    literal.append('}');
                    i += 2;
                    continue;
                }
                throw new ParseException("f-string: single '}' is not allowed", token);
            }
            literal.append(c);
            i++;
        }
        flushLiteral(literal, token, loc, parts);
    }

    private void flushLiteral(StringBuilder literal, Token token, SourceLocation loc, List<Expression> parts) {
        if (literal.length() == 0) return;
        String text = token.isRawString() ? literal.toString() : PyStringUtils.unescape(literal.toString());
        ExprParser.appendLiteral(parts, loc, text);
        literal.setLength(0);
    }

    /**
     * 解析一个插值片段，返回 '}' 之后的下标
     */
    private int parseReplacement(String body, int start, Token token, List<Expression> parts) {
        SourceLocation loc = parser.location(token);
        int depth = 0;
        char quote = 0;
        int i = start;
        int exprEnd = -1;
        boolean selfDocumenting = false;

        for (; i < body.length(); i++) {
            char c = body.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if ((c == ')' || c == ']') && depth > 0) {
                depth--;
            } else if (c == '}') {
                if (depth == 0) {
                    exprEnd = i;
                    break;
                }
                depth--;
            } else if (depth == 0 && c == '!' && peekChar(body, i + 1) != '=') {
                exprEnd = i;
                break;
            } else if (depth == 0 && c == ':') {
                exprEnd = i;
                break;
            } else if (depth == 0 && c == '=' && peekChar(body, i + 1) != '='
                    && "=!<>".indexOf(peekChar(body, i - 1)) < 0) {
                selfDocumenting = true;
                exprEnd = i;
                i++;
                break;
            }
        }
        if (exprEnd < 0) {
            throw new ParseException("f-string: expecting '}'", token);
        }
        while (selfDocumenting && peekChar(body, i) == ' ') {
            i++;
        }

        String exprText = body.substring(start, exprEnd);
        if (exprText.trim().isEmpty()) {
            throw new ParseException("f-string: empty expression not allowed", token);
        }
        Expression value = parseExpression(exprText, token);
        if (selfDocumenting) {
            ExprParser.appendLiteral(parts, loc, body.substring(start, i));
        }

        char conversion = 0;
        if (peekChar(body, i) == '!') {
            conversion = peekChar(body, i + 1);
            if (conversion != 's' && conversion != 'r' && conversion != 'a') {
                throw new ParseException("f-string: invalid conversion character", token);
            }
            i += 2;
        }

        JoinedStrExpr formatSpec = null;
        if (peekChar(body, i) == ':') {
            int specStart = i + 1;
            int nested = 0;
            i = specStart;
            while (i < body.length() && !(body.charAt(i) == '}' && nested == 0)) {
                if (body.charAt(i) == '{') nested++;
                if (body.charAt(i) == '}') nested--;
                i++;
            }
            List<Expression> specParts = new ArrayList<>();
            parseInto(body.substring(specStart, Math.min(i, body.length())), token, specParts);
            formatSpec = new JoinedStrExpr(loc, specParts);
        }

        if (peekChar(body, i) != '}') {
            throw new ParseException("f-string: expecting '}'", token);
        }
        if (selfDocumenting && conversion == 0 && formatSpec == null) {
            conversion = 'r';
        }
        parts.add(new FormattedValueExpr(loc, value, conversion, formatSpec));
        return i + 1;
    }

    private Expression parseExpression(String text, Token token) {
        // 加括号后解析，允许内部换行
        Lexer lexer = new Lexer("(" + text + ")", parser.fileName, token.getLine());
        return new Parser(lexer, parser.fileName).parseStandaloneExpression();
    }

    private static char peekChar(String s, int index) {
        if (index < 0 || index >= s.length()) return '\0';
        return s.charAt(index);
    }
}
