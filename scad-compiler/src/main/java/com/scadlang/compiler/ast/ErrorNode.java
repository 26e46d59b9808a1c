package com.scadlang.compiler.ast;

import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.diagnostic.ErrorCode;

/**
 * 错误节点
 *
 * <p>无法转换的 CST 子树以该节点保留在 AST 中，既可出现在语句位置，也可出现在表达式位置。</p>
 */
public final class ErrorNode extends Expression {
    private final String message;
    private final ErrorCode code;
    private final String originalNodeType;
    private final String cstText;

    public ErrorNode(Location location, String message, ErrorCode code, String originalNodeType, String cstText) {
        super(location);
        this.message = message;
        this.code = code;
        this.originalNodeType = originalNodeType;
        this.cstText = cstText;
    }

    public String getMessage() {
        return message;
    }

    public ErrorCode getCode() {
        return code;
    }

    /** 产生该错误的 CST 节点类型 */
    public String getOriginalNodeType() {
        return originalNodeType;
    }

    /** 产生该错误的 CST 原文 */
    public String getCstText() {
        return cstText;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ERROR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitErrorNode(this, context);
    }

    @Override
    public String toString() {
        return "ErrorNode(" + code + ": " + message + ")";
    }
}
