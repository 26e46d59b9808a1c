package com.scadlang.cst.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回非 EOF 的 token 列表 */
    private List<Token> tokens(String source) {
        return new Lexer(source).scanTokens().stream()
                .filter(t -> t.getType() != TokenType.EOF)
                .collect(Collectors.toList());
    }

    private List<TokenType> types(String source) {
        return tokens(source).stream().map(Token::getType).collect(Collectors.toList());
    }

    private void assertSingleToken(String source, TokenType expected) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expected, toks.get(0).getType());
    }

    @Nested
    @DisplayName("基本记号")
    class BasicTokenTests {

        @Test
        @DisplayName("分隔符与运算符")
        void testPunctuation() {
            assertEquals(List.of(TokenType.LPAREN, TokenType.RPAREN, TokenType.LBRACKET, TokenType.RBRACKET,
                    TokenType.LBRACE, TokenType.RBRACE, TokenType.COMMA, TokenType.SEMICOLON),
                    types("()[]{},;"));
            assertEquals(List.of(TokenType.EQ, TokenType.NE, TokenType.LE, TokenType.GE, TokenType.AND,
                    TokenType.OR, TokenType.ASSIGN, TokenType.NOT, TokenType.LT, TokenType.GT),
                    types("== != <= >= && || = ! < >"));
        }

        @Test
        @DisplayName("关键词与标识符")
        void testKeywords() {
            assertSingleToken("module", TokenType.KW_MODULE);
            assertSingleToken("function", TokenType.KW_FUNCTION);
            assertSingleToken("undef", TokenType.KW_UNDEF);
            assertSingleToken("cube", TokenType.IDENTIFIER);
            assertSingleToken("modules", TokenType.IDENTIFIER);
            assertTrue(Lexer.getKeywords().contains("each"));
        }

        @Test
        @DisplayName("特殊变量")
        void testSpecialVariable() {
            List<Token> toks = tokens("$fn = 32;");
            assertEquals(TokenType.SPECIAL_VARIABLE, toks.get(0).getType());
            assertEquals("$fn", toks.get(0).getLexeme());
        }

        @Test
        @DisplayName("数字字面量的各种形式")
        void testNumbers() {
            assertSingleToken("42", TokenType.NUMBER);
            assertSingleToken("1.5", TokenType.NUMBER);
            assertSingleToken(".5", TokenType.NUMBER);
            assertSingleToken("1e3", TokenType.NUMBER);
            assertSingleToken("2.5E-2", TokenType.NUMBER);
            assertEquals("2.5E-2", tokens("2.5E-2").get(0).getLexeme());
        }

        @Test
        @DisplayName("字符串保留引号与转义原文")
        void testStrings() {
            List<Token> toks = tokens("\"a\\\"b\"");
            assertEquals(1, toks.size());
            assertEquals(TokenType.STRING, toks.get(0).getType());
            assertEquals("\"a\\\"b\"", toks.get(0).getLexeme());
        }

        @Test
        @DisplayName("注释被跳过")
        void testComments() {
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER),
                    types("a // line\n/* block\n comment */ b"));
        }
    }

    @Nested
    @DisplayName("include / use 路径")
    class IncludePathTests {

        @Test
        @DisplayName("尖括号路径是一个记号")
        void testIncludePath() {
            List<Token> toks = tokens("include <lib/gears.scad>");
            assertEquals(2, toks.size());
            assertEquals(TokenType.KW_INCLUDE, toks.get(0).getType());
            assertEquals(TokenType.INCLUDE_PATH, toks.get(1).getType());
            assertEquals("<lib/gears.scad>", toks.get(1).getLexeme());
        }

        @Test
        @DisplayName("未闭合路径产生错误记号")
        void testUnterminatedPath() {
            List<Token> toks = tokens("use <lib.scad\n");
            assertEquals(TokenType.KW_USE, toks.get(0).getType());
            assertEquals(TokenType.ERROR, toks.get(1).getType());
            assertTrue(toks.get(1).getLexeme().startsWith("<"));
        }

        @Test
        @DisplayName("use 之后不是尖括号时正常扫描")
        void testUseWithoutPath() {
            assertEquals(List.of(TokenType.KW_USE, TokenType.SEMICOLON), types("use ;"));
        }
    }

    @Nested
    @DisplayName("错误记号")
    class ErrorTokenTests {

        @Test
        @DisplayName("未闭合字符串")
        void testUnterminatedString() {
            List<Token> toks = tokens("x = \"abc");
            Token last = toks.get(toks.size() - 1);
            assertEquals(TokenType.ERROR, last.getType());
            assertEquals("\"abc", last.getLexeme());
            assertEquals("Unterminated string", last.getMessage());
        }

        @Test
        @DisplayName("未闭合块注释")
        void testUnterminatedComment() {
            List<Token> toks = tokens("a /* never closed");
            assertEquals(2, toks.size());
            assertEquals(TokenType.ERROR, toks.get(1).getType());
            assertTrue(toks.get(1).getLexeme().startsWith("/*"));
        }

        @Test
        @DisplayName("单个 & 与非法字符")
        void testBadCharacters() {
            assertSingleToken("&", TokenType.ERROR);
            assertSingleToken("@", TokenType.ERROR);
            assertTrue(tokens("&").get(0).getMessage().contains("&&"));
        }
    }

    @Nested
    @DisplayName("位置信息")
    class PositionTests {

        @Test
        @DisplayName("行列从 0 开始，offset 为字符偏移")
        void testPositions() {
            List<Token> toks = tokens("a\n  bc");
            Token b = toks.get(1);
            assertEquals(1, b.getLine());
            assertEquals(2, b.getColumn());
            assertEquals(4, b.getOffset());
            assertEquals(1, b.getEndLine());
            assertEquals(4, b.getEndColumn());
            assertEquals(6, b.getEndOffset());
        }

        @Test
        @DisplayName("EOF 位于源码末尾")
        void testEof() {
            List<Token> all = new Lexer("x;\n").scanTokens();
            Token eof = all.get(all.size() - 1);
            assertEquals(TokenType.EOF, eof.getType());
            assertEquals(3, eof.getOffset());
            assertEquals(1, eof.getLine());
        }
    }
}
