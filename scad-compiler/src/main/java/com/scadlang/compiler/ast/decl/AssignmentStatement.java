package com.scadlang.compiler.ast.decl;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.expr.Expression;

/**
 * 变量赋值语句 {@code name = value;}
 */
public class AssignmentStatement extends AstNode {
    private final String name;
    private final Location nameLocation;
    private final Expression value;

    public AssignmentStatement(Location location, String name, Location nameLocation, Expression value) {
        super(location);
        this.name = name;
        this.nameLocation = nameLocation;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Location getNameLocation() {
        return nameLocation;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ASSIGNMENT_STATEMENT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignmentStatement(this, context);
    }
}
