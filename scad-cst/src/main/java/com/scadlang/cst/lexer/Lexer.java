package com.scadlang.cst.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * OpenSCAD 词法分析器
 *
 * <p>注释与空白作为 extras 跳过；无法识别的字符、未闭合的字符串/块注释产生 {@link TokenType#ERROR} 记号，
 * 由语法分析器包装为 ERROR 节点。</p>
 */
public class Lexer {
    private static final Logger LOG = Logger.getLogger(Lexer.class.getName());

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 0;
    private int column = 0;

    private int startLine = 0;
    private int startColumn = 0;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 定义
        map.put("module", TokenType.KW_MODULE);
        map.put("function", TokenType.KW_FUNCTION);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("for", TokenType.KW_FOR);
        map.put("let", TokenType.KW_LET);
        map.put("each", TokenType.KW_EACH);
        map.put("assign", TokenType.KW_ASSIGN);
        map.put("echo", TokenType.KW_ECHO);
        map.put("assert", TokenType.KW_ASSERT);

        // 文件引用
        map.put("include", TokenType.KW_INCLUDE);
        map.put("use", TokenType.KW_USE);

        // 常量
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("undef", TokenType.KW_UNDEF);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合（供 IDE 补全使用） */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source) {
        this.source = source;
    }

    /**
     * 执行词法分析，返回以 EOF 结尾的 Token 列表
     */
    public List<Token> scanTokens() {
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) break;
            markStart();
            scanToken();
        }
        markStart();
        tokens.add(new Token(TokenType.EOF, "", null, line, column, current, line, column, current));
        return tokens;
    }

    private void markStart() {
        start = current;
        startLine = line;
        startColumn = column;
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t' || c == '\n' || c == '\f') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                // 单行注释
                while (!isAtEnd() && peek() != '\n') advance();
            } else if (c == '/' && peekNext() == '*') {
                markStart();
                advance();
                advance();
                if (!blockComment()) {
                    error("Unterminated block comment");
                }
            } else {
                break;
            }
        }
    }

    /** 跳过块注释，返回是否正常闭合 */
    private boolean blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return true;
            }
            advance();
        }
        return false;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '/': addToken(TokenType.SLASH); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '^': addToken(TokenType.CARET); break;
            case '?': addToken(TokenType.QUESTION); break;
            case ':': addToken(TokenType.COLON); break;
            case '#': addToken(TokenType.HASH); break;

            // 可能是多字符的 Token
            case '.':
                if (isDigit(peek())) {
                    number();
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.NOT);
                break;

            case '<':
                addToken(match('=') ? TokenType.LE : TokenType.LT);
                break;

            case '>':
                addToken(match('=') ? TokenType.GE : TokenType.GT);
                break;

            case '&':
                if (match('&')) {
                    addToken(TokenType.AND);
                } else {
                    error("Unexpected character '&'. Did you mean '&&'?");
                }
                break;

            case '|':
                if (match('|')) {
                    addToken(TokenType.OR);
                } else {
                    error("Unexpected character '|'. Did you mean '||'?");
                }
                break;

            case '$':
                if (isAlphaNumeric(peek())) {
                    while (isAlphaNumeric(peek())) advance();
                    addToken(TokenType.SPECIAL_VARIABLE);
                } else {
                    error("Expected identifier after '$'");
                }
                break;

            // 字符串（OpenSCAD 原生只有双引号，单引号按同样规则容错接受）
            case '"':
            case '\'':
                string(c);
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

    private void string(char quote) {
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\\' && current + 1 < source.length()) {
                advance(); // 转义符本身，转义内容在 AST 构建时解析
            }
            advance();
        }
        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }
        advance(); // 闭合引号
        addToken(TokenType.STRING);
    }

    /**
     * 数字：整数、小数、科学计数法。
     * 指数部分缺少数字时保留原文（如 {@code 1e}），由 AST 构建阶段报告非法字面量。
     */
    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        } else if (peek() == '.' && !isAlpha(peekNext()) && peekNext() != '.') {
            advance(); // 1. 形式
        }
        if (peek() == 'e' || peek() == 'E') {
            char after = peekNext();
            if (isDigit(after) || after == '+' || after == '-' || !isAlpha(after)) {
                advance();
                if (peek() == '+' || peek() == '-') advance();
                while (isDigit(peek())) advance();
            }
        }
        addToken(TokenType.NUMBER);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) {
            addToken(TokenType.IDENTIFIER);
            return;
        }
        addToken(type);
        if (type == TokenType.KW_INCLUDE || type == TokenType.KW_USE) {
            includePath();
        }
    }

    /** include / use 之后的 {@code <path>} */
    private void includePath() {
        int save = current;
        int saveLine = line;
        int saveColumn = column;
        while (peek() == ' ' || peek() == '\t') advance();
        if (peek() != '<') {
            current = save;
            line = saveLine;
            column = saveColumn;
            return;
        }
        markStart();
        advance();
        while (!isAtEnd() && peek() != '>' && peek() != '\n') advance();
        if (peek() != '>') {
            error("Unterminated include path");
            return;
        }
        advance();
        addToken(TokenType.INCLUDE_PATH);
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 0;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, String message) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, message, startLine, startColumn, start, line, column, current));
    }

    private void error(String message) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("Lexer error at %d:%d: %s", startLine, startColumn, message));
        }
        addToken(TokenType.ERROR, message);
    }
}
