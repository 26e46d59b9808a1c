package com.scadlang.cst.lexer;

/**
 * 词法单元
 *
 * <p>行列从 0 开始；{@code endOffset} 不含。</p>
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final String message;
    private final int line;
    private final int column;
    private final int offset;
    private final int endLine;
    private final int endColumn;
    private final int endOffset;

    public Token(TokenType type, String lexeme, String message,
                 int line, int column, int offset,
                 int endLine, int endColumn, int endOffset) {
        this.type = type;
        this.lexeme = lexeme;
        this.message = message;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.endLine = endLine;
        this.endColumn = endColumn;
        this.endOffset = endOffset;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    /** ERROR 记号的错误描述，其余记号为 null */
    public String getMessage() {
        return message;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format("%s(%s) at %d:%d", type, lexeme, line, column);
    }
}
