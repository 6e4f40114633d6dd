package com.py2swift.compiler.lexer;

/**
 * Python 字符串字面量反转义工具
 */
public final class PyStringUtils {

    private PyStringUtils() {}

    /**
     * 解码 Python 转义序列。
     * <p>未识别的转义（如 {@code \d}）按 Python 语义保留反斜杠。</p>
     */
    public static String unescape(String body) {
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            i += 2;
            switch (next) {
                case '\n': break; // 行继续
                case '\\': sb.append('\\'); break;
                case '\'': sb.append('\''); break;
                case '"':  sb.append('"'); break;
                case 'a':  sb.append('\u0007'); break;
                case 'b':  sb.append('\b'); break;
                case 'f':  sb.append('\f'); break;
                case 'n':  sb.append('\n'); break;
                case 'r':  sb.append('\r'); break;
                case 't':  sb.append('\t'); break;
                case 'v':  sb.append('\u000B'); break;
                case 'x':
                    i = appendCodePoint(sb, body, i, 2, "\\x");
                    break;
                case 'u':
                    i = appendCodePoint(sb, body, i, 4, "\\u");
                    break;
                case 'U':
                    i = appendCodePoint(sb, body, i, 8, "\\U");
                    break;
                default:
                    if (next >= '0' && next <= '7') {
                        int end = i - 1;
                        while (end < body.length() && end < i + 2 && isOctal(body.charAt(end))) {
                            end++;
                        }
                        sb.append((char) Integer.parseInt(body.substring(i - 1, end), 8));
                        i = end;
                    } else {
                        sb.append('\\').append(next);
                    }
                    break;
            }
        }
        return sb.toString();
    }

    private static int appendCodePoint(StringBuilder sb, String body, int from, int digits, String prefix) {
        int end = from + digits;
        if (end > body.length()) {
            sb.append(prefix).append(body, from, body.length());
            return body.length();
        }
        String hex = body.substring(from, end);
        try {
            sb.appendCodePoint(Integer.parseInt(hex, 16));
        } catch (IllegalArgumentException e) {
            // 非法序列保留原文
            sb.append(prefix).append(hex);
        }
        return end;
    }

    private static boolean isOctal(char c) {
        return c >= '0' && c <= '7';
    }
}
