package com.scadlang.compiler.ast.geometry;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.stmt.InstantiationNode;
import com.scadlang.compiler.ast.stmt.Parameter;

import java.util.List;

/**
 * 球体；半径取自 r 或 d / 2
 */
public class Sphere extends InstantiationNode {
    private final double radius;

    public Sphere(Location location, List<Parameter> args, List<AstNode> children, String modifier, double radius) {
        super(location, "sphere", args, children, modifier);
        this.radius = radius;
    }

    public double getRadius() {
        return radius;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SPHERE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSphere(this, context);
    }
}
