package com.scadlang.cst.lexer;

/**
 * OpenSCAD 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    NUMBER,
    STRING,
    INCLUDE_PATH,           // <path/to/file.scad>

    // === 标识符 ===
    IDENTIFIER,
    SPECIAL_VARIABLE,       // $fn / $children

    // === 关键词 ===
    KW_MODULE, KW_FUNCTION,
    KW_IF, KW_ELSE, KW_FOR, KW_LET, KW_EACH, KW_ASSIGN,
    KW_ECHO, KW_ASSERT,
    KW_INCLUDE, KW_USE,
    KW_TRUE, KW_FALSE, KW_UNDEF,

    // === 操作符 ===
    PLUS,           // +
    MINUS,          // -
    STAR,           // *
    SLASH,          // /
    PERCENT,        // %
    CARET,          // ^
    NOT,            // !
    EQ,             // ==
    NE,             // !=
    LT,             // <
    LE,             // <=
    GT,             // >
    GE,             // >=
    AND,            // &&
    OR,             // ||
    ASSIGN,         // =
    QUESTION,       // ?
    COLON,          // :
    DOT,            // .
    HASH,           // #（调试修饰符）

    // === 分隔符 ===
    LPAREN, RPAREN,
    LBRACKET, RBRACKET,
    LBRACE, RBRACE,
    COMMA,
    SEMICOLON,

    // === 特殊 ===
    ERROR,
    EOF;

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否为二元运算符
     */
    public boolean isBinaryOperator() {
        switch (this) {
            case PLUS:
            case MINUS:
            case STAR:
            case SLASH:
            case PERCENT:
            case CARET:
            case EQ:
            case NE:
            case LT:
            case LE:
            case GT:
            case GE:
            case AND:
            case OR:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为模块实例化前的修饰符（# ! % *）
     */
    public boolean isModifier() {
        return this == HASH || this == NOT || this == PERCENT || this == STAR;
    }

    /**
     * 是否为开分隔符
     */
    public boolean isOpener() {
        return this == LPAREN || this == LBRACKET || this == LBRACE;
    }

    /**
     * 是否为闭分隔符
     */
    public boolean isCloser() {
        return this == RPAREN || this == RBRACKET || this == RBRACE;
    }
}
