package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;

/**
 * 成员访问 {@code v.x}
 */
public class MemberExpr extends Expression {
    private final Expression object;
    private final String property;

    public MemberExpr(Location location, Expression object, String property) {
        super(location);
        this.object = object;
        this.property = property;
    }

    public Expression getObject() {
        return object;
    }

    public String getProperty() {
        return property;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MEMBER;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMemberExpr(this, context);
    }

    @Override
    public String toString() {
        return object + "." + property;
    }
}
