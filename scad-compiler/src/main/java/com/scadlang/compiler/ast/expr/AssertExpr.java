package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;

/**
 * 表达式位置的 assert：{@code assert(cond, "msg") expr}
 */
public class AssertExpr extends Expression {
    private final Expression condition;
    private final Expression message;
    private final Expression body;

    public AssertExpr(Location location, Expression condition, Expression message, Expression body) {
        super(location);
        this.condition = condition;
        this.message = message;
        this.body = body;
    }

    public Expression getCondition() {
        return condition;
    }

    /** 可为 null */
    public Expression getMessage() {
        return message;
    }

    /** 可为 null */
    public Expression getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ASSERT_EXPRESSION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssertExpr(this, context);
    }
}
