package com.scadlang.compiler.ast.geometry;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.stmt.InstantiationNode;
import com.scadlang.compiler.ast.stmt.Parameter;

import java.util.List;

/**
 * 二维偏移：给出 r 时为圆角偏移，否则按 delta 直边偏移
 */
public class Offset extends InstantiationNode {
    private final Double r;
    private final double delta;
    private final boolean chamfer;

    public Offset(Location location, List<Parameter> args, List<AstNode> children, String modifier,
                  Double r, double delta, boolean chamfer) {
        super(location, "offset", args, children, modifier);
        this.r = r;
        this.delta = delta;
        this.chamfer = chamfer;
    }

    /** 圆角半径，未给出时为 null */
    public Double getR() {
        return r;
    }

    public double getDelta() {
        return delta;
    }

    public boolean isChamfer() {
        return chamfer;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.OFFSET;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitOffset(this, context);
    }
}
