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
 * 平移；二维向量以 0 补齐 z 分量
 */
public class Translate extends InstantiationNode {
    private final double[] v;

    public Translate(Location location, List<Parameter> args, List<AstNode> children, String modifier, double[] v) {
        super(location, "translate", args, children, modifier);
        this.v = v.clone();
    }

    /** 三维向量 */
    public double[] getV() {
        return v.clone();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TRANSLATE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTranslate(this, context);
    }

    @Override
    public String toString() {
        return "Translate" + Arrays.toString(v);
    }
}
