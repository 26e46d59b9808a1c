package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * if / else 语句；{@code else if} 表示为 elseBranch 中唯一的嵌套 IfNode
 */
public class IfNode extends AstNode {
    private final Expression condition;
    private final List<AstNode> thenBranch;
    private final List<AstNode> elseBranch;

    public IfNode(Location location, Expression condition, List<AstNode> thenBranch, List<AstNode> elseBranch) {
        super(location);
        this.condition = condition;
        this.thenBranch = Collections.unmodifiableList(thenBranch);
        this.elseBranch = elseBranch == null ? null : Collections.unmodifiableList(elseBranch);
    }

    public Expression getCondition() {
        return condition;
    }

    public List<AstNode> getThenBranch() {
        return thenBranch;
    }

    /** 没有 else 时为 null */
    public List<AstNode> getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IF;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIf(this, context);
    }
}
