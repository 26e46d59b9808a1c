package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;

/**
 * 特殊变量引用（{@code $fn}、{@code $children} 等）
 */
public class Variable extends Expression {
    private final String name;

    public Variable(Location location, String name) {
        super(location);
        this.name = name;
    }

    /** 含 {@code $} 前缀的变量名 */
    public String getName() {
        return name;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.VARIABLE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVariable(this, context);
    }

    @Override
    public String toString() {
        return name;
    }
}
