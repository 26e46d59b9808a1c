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
 * 缩放；标量 s 展开为 [s, s, s]，缺失分量以 1 补齐
 */
public class Scale extends InstantiationNode {
    private final double[] v;

    public Scale(Location location, List<Parameter> args, List<AstNode> children, String modifier, double[] v) {
        super(location, "scale", args, children, modifier);
        this.v = v.clone();
    }

    /** 三维向量 */
    public double[] getV() {
        return v.clone();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SCALE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitScale(this, context);
    }

    @Override
    public String toString() {
        return "Scale" + Arrays.toString(v);
    }
}
