package com.py2swift.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回所有 token（含 EOF） */
    private List<Token> scan(String source) {
        return new Lexer(source, "<test>").scanTokens();
    }

    /** 扫描源码，返回非布局 token 列表 */
    private List<Token> tokens(String source) {
        return scan(source).stream()
                .filter(t -> t.getType() != TokenType.EOF
                        && t.getType() != TokenType.NEWLINE
                        && t.getType() != TokenType.INDENT
                        && t.getType() != TokenType.DEDENT)
                .collect(Collectors.toList());
    }

    private List<TokenType> types(String source) {
        return scan(source).stream().map(Token::getType).collect(Collectors.toList());
    }

    private void assertSingleToken(String source, TokenType expected) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expected, toks.get(0).getType());
    }

    private void assertSingleToken(String source, TokenType expectedType, Object expectedLiteral) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expectedType, toks.get(0).getType());
        assertEquals(expectedLiteral, toks.get(0).getLiteral());
    }

    // ================================================================
    // 运算符
    // ================================================================

    @Nested
    @DisplayName("运算符")
    class OperatorTests {

        @Test
        @DisplayName("多字符运算符取最长匹配")
        void testLongestMatch() {
            assertSingleToken("**", TokenType.DOUBLE_STAR);
            assertSingleToken("//", TokenType.DOUBLE_SLASH);
            assertSingleToken("//=", TokenType.DOUBLE_SLASH_ASSIGN);
            assertSingleToken("**=", TokenType.DOUBLE_STAR_ASSIGN);
            assertSingleToken("->", TokenType.ARROW);
            assertSingleToken(":=", TokenType.WALRUS);
            assertSingleToken("!=", TokenType.NE);
            assertSingleToken("<<=", TokenType.LSHIFT_ASSIGN);
            assertSingleToken("...", TokenType.ELLIPSIS);
        }

        @Test
        @DisplayName("增强赋值分类")
        void testAugmentedAssign() {
            assertTrue(TokenType.PLUS_ASSIGN.isAugmentedAssign());
            assertTrue(TokenType.AT_ASSIGN.isAugmentedAssign());
            assertFalse(TokenType.ASSIGN.isAugmentedAssign());
            assertFalse(TokenType.EQ.isAugmentedAssign());
        }
    }

    // ================================================================
    // 字面量
    // ================================================================

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        @Test
        @DisplayName("整数字面量为 BigInteger")
        void testIntegers() {
            assertSingleToken("42", TokenType.INT_LITERAL, BigInteger.valueOf(42));
            assertSingleToken("1_000", TokenType.INT_LITERAL, BigInteger.valueOf(1000));
            assertSingleToken("0xff", TokenType.INT_LITERAL, BigInteger.valueOf(255));
            assertSingleToken("0b101", TokenType.INT_LITERAL, BigInteger.valueOf(5));
            assertSingleToken("123456789012345678901234567890", TokenType.INT_LITERAL,
                    new BigInteger("123456789012345678901234567890"));
        }

        @Test
        @DisplayName("浮点与虚数字面量")
        void testFloats() {
            assertSingleToken("3.14", TokenType.FLOAT_LITERAL, 3.14);
            assertSingleToken("1e3", TokenType.FLOAT_LITERAL, 1000.0);
            assertSingleToken("2j", TokenType.IMAGINARY_LITERAL);
        }

        @Test
        @DisplayName("字符串转义被解码")
        void testStringEscapes() {
            assertSingleToken("'a\\nb'", TokenType.STRING_LITERAL, "a\nb");
            assertSingleToken("\"say \\\"hi\\\"\"", TokenType.STRING_LITERAL, "say \"hi\"");
            assertSingleToken("'tab\\there'", TokenType.STRING_LITERAL, "tab\there");
        }

        @Test
        @DisplayName("原始字符串保留反斜杠")
        void testRawString() {
            assertSingleToken("r'\\d+'", TokenType.STRING_LITERAL, "\\d+");
        }

        @Test
        @DisplayName("三引号字符串可跨行")
        void testTripleQuoted() {
            assertSingleToken("\"\"\"line1\nline2\"\"\"", TokenType.STRING_LITERAL, "line1\nline2");
        }

        @Test
        @DisplayName("f-string 保留原始内容")
        void testFString() {
            List<Token> toks = tokens("f'x={x}'");
            assertEquals(1, toks.size());
            assertEquals(TokenType.FSTRING_LITERAL, toks.get(0).getType());
            assertEquals("x={x}", toks.get(0).getLiteral());
        }
    }

    // ================================================================
    // 关键词与标识符
    // ================================================================

    @Nested
    @DisplayName("关键词与标识符")
    class KeywordTests {

        @Test
        @DisplayName("关键词识别")
        void testKeywords() {
            assertSingleToken("def", TokenType.KW_DEF);
            assertSingleToken("None", TokenType.KW_NONE);
            assertSingleToken("lambda", TokenType.KW_LAMBDA);
            assertSingleToken("nonlocal", TokenType.KW_NONLOCAL);
            assertTrue(TokenType.KW_YIELD.isKeyword());
        }

        @Test
        @DisplayName("大小写敏感")
        void testCaseSensitive() {
            assertSingleToken("none", TokenType.IDENTIFIER);
            assertSingleToken("true", TokenType.IDENTIFIER);
        }
    }

    // ================================================================
    // 缩进与换行
    // ================================================================

    @Nested
    @DisplayName("缩进与换行")
    class LayoutTests {

        @Test
        @DisplayName("缩进块生成 INDENT / DEDENT")
        void testIndentDedent() {
            List<TokenType> t = types("if x:\n    y\nz\n");
            assertEquals(List.of(
                    TokenType.KW_IF, TokenType.IDENTIFIER, TokenType.COLON, TokenType.NEWLINE,
                    TokenType.INDENT, TokenType.IDENTIFIER, TokenType.NEWLINE,
                    TokenType.DEDENT, TokenType.IDENTIFIER, TokenType.NEWLINE,
                    TokenType.EOF), t);
        }

        @Test
        @DisplayName("文件末尾补齐 DEDENT")
        void testTrailingDedents() {
            List<TokenType> t = types("def f():\n    if x:\n        return 1");
            long dedents = t.stream().filter(tt -> tt == TokenType.DEDENT).count();
            assertEquals(2, dedents);
            assertEquals(TokenType.EOF, t.get(t.size() - 1));
        }

        @Test
        @DisplayName("括号内换行不产生 NEWLINE")
        void testImplicitJoin() {
            List<TokenType> t = types("x = (1,\n     2)\n");
            assertEquals(1, t.stream().filter(tt -> tt == TokenType.NEWLINE).count());
            assertFalse(t.contains(TokenType.INDENT));
        }

        @Test
        @DisplayName("空行与注释行被跳过")
        void testBlankAndCommentLines() {
            List<TokenType> t = types("x = 1\n\n# comment\n    # indented comment\ny = 2\n");
            assertFalse(t.contains(TokenType.INDENT));
            assertEquals(2, t.stream().filter(tt -> tt == TokenType.NEWLINE).count());
        }

        @Test
        @DisplayName("合成 token 的 lexeme 为空")
        void testSyntheticLexeme() {
            List<Token> all = scan("if x:\n    y\n");
            for (Token token : all) {
                if (token.getType() == TokenType.INDENT || token.getType() == TokenType.DEDENT
                        || token.getType() == TokenType.EOF) {
                    assertEquals("", token.getLexeme());
                }
            }
        }
    }

    // ================================================================
    // 错误
    // ================================================================

    @Nested
    @DisplayName("错误 token")
    class ErrorTests {

        @Test
        @DisplayName("未闭合字符串")
        void testUnterminatedString() {
            List<Token> toks = tokens("'abc");
            assertEquals(TokenType.ERROR, toks.get(0).getType());
            assertEquals("Unterminated string", toks.get(0).getLiteral());
        }

        @Test
        @DisplayName("非法字符")
        void testUnexpectedCharacter() {
            List<Token> toks = tokens("x = $");
            Token error = toks.get(toks.size() - 1);
            assertEquals(TokenType.ERROR, error.getType());
            assertEquals("Unexpected character: $", error.getLiteral());
        }

        @Test
        @DisplayName("位置信息")
        void testPosition() {
            List<Token> toks = tokens("a\nbb = 1");
            Token bb = toks.get(1);
            assertEquals("bb", bb.getLexeme());
            assertEquals(2, bb.getLine());
            assertEquals(1, bb.getColumn());
        }
    }
}
