package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;

import java.util.Collections;
import java.util.List;

/**
 * for 循环；多个迭代子句共享同一个主体，等价于嵌套循环
 */
public class ForLoop extends AstNode {
    private final List<ForLoopVariable> variables;
    private final List<AstNode> body;

    public ForLoop(Location location, List<ForLoopVariable> variables, List<AstNode> body) {
        super(location);
        this.variables = Collections.unmodifiableList(variables);
        this.body = Collections.unmodifiableList(body);
    }

    public List<ForLoopVariable> getVariables() {
        return variables;
    }

    public List<AstNode> getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FOR_LOOP;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForLoop(this, context);
    }
}
