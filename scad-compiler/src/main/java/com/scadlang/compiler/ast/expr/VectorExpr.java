package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;

import java.util.Collections;
import java.util.List;

/**
 * 向量字面量 [a, b, c]
 */
public class VectorExpr extends Expression {
    private final List<Expression> elements;

    public VectorExpr(Location location, List<Expression> elements) {
        super(location);
        this.elements = Collections.unmodifiableList(elements);
    }

    public List<Expression> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.VECTOR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVectorExpr(this, context);
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
