package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;

/**
 * 下标访问 {@code a[i]}
 */
public class IndexExpr extends Expression {
    private final Expression array;
    private final Expression index;

    public IndexExpr(Location location, Expression array, Expression index) {
        super(location);
        this.array = array;
        this.index = index;
    }

    public Expression getArray() {
        return array;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.INDEX;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndexExpr(this, context);
    }

    @Override
    public String toString() {
        return array + "[" + index + "]";
    }
}
