package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.stmt.ForLoopVariable;

import java.util.Collections;
import java.util.List;

/**
 * 列表推导
 *
 * <p>{@code [for (i = r) if (c) e]} 与旧式 {@code [e for (i = r) if (c)]} 归一为同一结构。</p>
 */
public class ListComprehension extends Expression {
    private final Expression element;
    private final List<ForLoopVariable> forClauses;
    private final Expression ifClause;

    public ListComprehension(Location location, Expression element, List<ForLoopVariable> forClauses,
                             Expression ifClause) {
        super(location);
        this.element = element;
        this.forClauses = Collections.unmodifiableList(forClauses);
        this.ifClause = ifClause;
    }

    public Expression getElement() {
        return element;
    }

    public List<ForLoopVariable> getForClauses() {
        return forClauses;
    }

    /** 过滤条件，可为 null */
    public Expression getIfClause() {
        return ifClause;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LIST_COMPREHENSION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitListComprehension(this, context);
    }
}
