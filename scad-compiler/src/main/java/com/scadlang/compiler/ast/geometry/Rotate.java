package com.scadlang.compiler.ast.geometry;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.stmt.InstantiationNode;
import com.scadlang.compiler.ast.stmt.Parameter;

import java.util.List;

/**
 * 旋转
 *
 * <p>标量角度绕轴 v 旋转（默认 z 轴）；向量角度依次绕 x、y、z 旋转，此时 v 为 null。</p>
 */
public class Rotate extends InstantiationNode {
    private final AngleSpec a;
    private final double[] v;

    public Rotate(Location location, List<Parameter> args, List<AstNode> children, String modifier,
                  AngleSpec a, double[] v) {
        super(location, "rotate", args, children, modifier);
        this.a = a;
        this.v = v == null ? null : v.clone();
    }

    public AngleSpec getA() {
        return a;
    }

    /** 旋转轴，向量角度时为 null */
    public double[] getV() {
        return v == null ? null : v.clone();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ROTATE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRotate(this, context);
    }

    @Override
    public String toString() {
        return "Rotate(" + a + ")";
    }
}
