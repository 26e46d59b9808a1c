package com.scadlang.cst.parser;

import com.scadlang.cst.lexer.Token;

/**
 * CST 解析异常
 *
 * <p>只在解析器内部传播：语句 / 列表层捕获后转换为 ERROR 节点并重新同步。</p>
 */
public class CstParseException extends RuntimeException {
    private final Token token;

    public CstParseException(String message, Token token) {
        super(message);
        this.token = token;
    }

    public Token getToken() {
        return token;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine() + 1);
            sb.append(", column ").append(token.getColumn() + 1);
            sb.append(" (found '").append(token.getLexeme()).append("')");
        }
        return sb.toString();
    }
}
