package com.scadlang.compiler.ast.geometry;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.stmt.InstantiationNode;
import com.scadlang.compiler.ast.stmt.Parameter;

import java.util.List;

/**
 * 颜色：颜色名 / 十六进制字符串，或 RGB(A) 向量
 */
public class Color extends InstantiationNode {
    private final String colorName;
    private final double[] rgba;
    private final double alpha;

    public Color(Location location, List<Parameter> args, List<AstNode> children, String modifier,
                 String colorName, double[] rgba, double alpha) {
        super(location, "color", args, children, modifier);
        this.colorName = colorName;
        this.rgba = rgba == null ? null : rgba.clone();
        this.alpha = alpha;
    }

    /** 字符串形式的颜色（如 "red"、"#ff0000"），向量形式时为 null */
    public String getColorName() {
        return colorName;
    }

    /** 四元 RGBA 向量，字符串形式时为 null */
    public double[] getRgba() {
        return rgba == null ? null : rgba.clone();
    }

    public double getAlpha() {
        return alpha;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.COLOR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitColor(this, context);
    }
}
