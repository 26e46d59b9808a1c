package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;

import java.util.Collections;
import java.util.List;

/**
 * 已废弃的 {@code assign(a = 1, ...) body} 语句
 */
public class Assign extends AstNode {
    private final List<Assignment> assignments;
    private final List<AstNode> body;

    public Assign(Location location, List<Assignment> assignments, List<AstNode> body) {
        super(location);
        this.assignments = Collections.unmodifiableList(assignments);
        this.body = Collections.unmodifiableList(body);
    }

    public List<Assignment> getAssignments() {
        return assignments;
    }

    public List<AstNode> getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ASSIGN;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssign(this, context);
    }
}
