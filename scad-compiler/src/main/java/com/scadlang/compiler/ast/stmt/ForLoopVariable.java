package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.ast.expr.RangeExpr;

/**
 * for 循环的一个迭代子句 {@code name = range}
 */
public final class ForLoopVariable {
    private final String name;
    private final Expression range;
    private final Location location;

    public ForLoopVariable(String name, Expression range, Location location) {
        this.name = name;
        this.range = range;
        this.location = location;
    }

    public String getName() {
        return name;
    }

    /** 迭代对象：范围、向量或任意表达式 */
    public Expression getRange() {
        return range;
    }

    /**
     * 源码中显式写出的步长；迭代对象不是带步长的范围时返回 null
     */
    public Expression getStep() {
        if (range instanceof RangeExpr && ((RangeExpr) range).hasExplicitStep()) {
            return ((RangeExpr) range).getStep();
        }
        return null;
    }

    public Location getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return name + " = " + range;
    }
}
