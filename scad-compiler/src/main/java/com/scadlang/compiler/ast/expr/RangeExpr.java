package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;

/**
 * 范围表达式 [start : end] 或 [start : step : end]
 */
public class RangeExpr extends Expression {
    private final Expression start;
    private final Expression end;
    private final Expression step;
    private final boolean explicitStep;

    public RangeExpr(Location location, Expression start, Expression end, Expression step, boolean explicitStep) {
        super(location);
        this.start = start;
        this.end = end;
        this.step = step;
        this.explicitStep = explicitStep;
    }

    public Expression getStart() {
        return start;
    }

    public Expression getEnd() {
        return end;
    }

    /** 步长；源码省略时为数值 1 */
    public Expression getStep() {
        return step;
    }

    /** 源码中是否显式写出步长 */
    public boolean hasExplicitStep() {
        return explicitStep;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RANGE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRangeExpr(this, context);
    }

    @Override
    public String toString() {
        return "[" + start + " : " + step + " : " + end + "]";
    }
}
