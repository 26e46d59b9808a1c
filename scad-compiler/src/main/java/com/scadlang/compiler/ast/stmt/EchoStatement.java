package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;

import java.util.Collections;
import java.util.List;

/**
 * echo 语句
 */
public class EchoStatement extends AstNode {
    private final List<Parameter> args;
    private final List<AstNode> children;

    public EchoStatement(Location location, List<Parameter> args, List<AstNode> children) {
        super(location);
        this.args = Collections.unmodifiableList(args);
        this.children = Collections.unmodifiableList(children);
    }

    public List<Parameter> getArgs() {
        return args;
    }

    public List<AstNode> getChildren() {
        return children;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ECHO_STATEMENT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEchoStatement(this, context);
    }
}
