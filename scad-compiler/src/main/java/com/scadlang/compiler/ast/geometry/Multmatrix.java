package com.scadlang.compiler.ast.geometry;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.stmt.InstantiationNode;
import com.scadlang.compiler.ast.stmt.Parameter;

import java.util.List;

/**
 * 仿射变换矩阵；缺失的行列取单位矩阵对应元素
 */
public class Multmatrix extends InstantiationNode {
    private final double[][] m;

    public Multmatrix(Location location, List<Parameter> args, List<AstNode> children, String modifier,
                      double[][] m) {
        super(location, "multmatrix", args, children, modifier);
        this.m = copy(m);
    }

    /** 4x4 矩阵，按行存储 */
    public double[][] getM() {
        return copy(m);
    }

    private static double[][] copy(double[][] source) {
        double[][] result = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            result[i] = source[i].clone();
        }
        return result;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MULTMATRIX;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMultmatrix(this, context);
    }
}
