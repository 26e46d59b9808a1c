package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.expr.Expression;

/**
 * assign 语句中的单个绑定
 */
public final class Assignment {
    private final String variable;
    private final Expression value;
    private final Location location;

    public Assignment(String variable, Expression value, Location location) {
        this.variable = variable;
        this.value = value;
        this.location = location;
    }

    public String getVariable() {
        return variable;
    }

    public Expression getValue() {
        return value;
    }

    public Location getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return variable + " = " + value;
    }
}
