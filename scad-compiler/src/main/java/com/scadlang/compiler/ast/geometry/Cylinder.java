package com.scadlang.compiler.ast.geometry;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.stmt.InstantiationNode;
import com.scadlang.compiler.ast.stmt.Parameter;

import java.util.List;

/**
 * 圆柱 / 圆台
 */
public class Cylinder extends InstantiationNode {
    private final double height;
    private final double r1;
    private final double r2;
    private final boolean center;

    public Cylinder(Location location, List<Parameter> args, List<AstNode> children, String modifier,
                    double height, double r1, double r2, boolean center) {
        super(location, "cylinder", args, children, modifier);
        this.height = height;
        this.r1 = r1;
        this.r2 = r2;
        this.center = center;
    }

    public double getHeight() {
        return height;
    }

    /** 底面半径 */
    public double getR1() {
        return r1;
    }

    /** 顶面半径 */
    public double getR2() {
        return r2;
    }

    public boolean isCenter() {
        return center;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CYLINDER;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCylinder(this, context);
    }
}
