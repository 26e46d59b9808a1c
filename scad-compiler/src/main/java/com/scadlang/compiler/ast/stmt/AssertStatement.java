package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * assert 语句 {@code assert(condition, message)}
 */
public class AssertStatement extends AstNode {
    private final Expression condition;
    private final Expression message;
    private final List<AstNode> children;

    public AssertStatement(Location location, Expression condition, Expression message, List<AstNode> children) {
        super(location);
        this.condition = condition;
        this.message = message;
        this.children = Collections.unmodifiableList(children);
    }

    public Expression getCondition() {
        return condition;
    }

    /** 可为 null */
    public Expression getMessage() {
        return message;
    }

    public List<AstNode> getChildren() {
        return children;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ASSERT_STATEMENT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssertStatement(this, context);
    }
}
