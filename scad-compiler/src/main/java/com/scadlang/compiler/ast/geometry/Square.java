package com.scadlang.compiler.ast.geometry;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.stmt.InstantiationNode;
import com.scadlang.compiler.ast.stmt.Parameter;

import java.util.List;

/**
 * 矩形
 */
public class Square extends InstantiationNode {
    private final double[] size;
    private final boolean center;

    public Square(Location location, List<Parameter> args, List<AstNode> children, String modifier,
                  double[] size, boolean center) {
        super(location, "square", args, children, modifier);
        this.size = size.clone();
        this.center = center;
    }

    public double[] getSize() {
        return size.clone();
    }

    public boolean isCenter() {
        return center;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SQUARE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSquare(this, context);
    }
}
