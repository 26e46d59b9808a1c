package com.scadlang.compiler.ast.geometry;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.stmt.InstantiationNode;
import com.scadlang.compiler.ast.stmt.Parameter;

import java.util.Arrays;
import java.util.List;

/**
 * 镜像，v 为镜像平面的法向量；缺失分量以 0 补齐
 */
public class Mirror extends InstantiationNode {
    private final double[] v;

    public Mirror(Location location, List<Parameter> args, List<AstNode> children, String modifier, double[] v) {
        super(location, "mirror", args, children, modifier);
        this.v = v.clone();
    }

    /** 三维向量 */
    public double[] getV() {
        return v.clone();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MIRROR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMirror(this, context);
    }

    @Override
    public String toString() {
        return "Mirror" + Arrays.toString(v);
    }
}
