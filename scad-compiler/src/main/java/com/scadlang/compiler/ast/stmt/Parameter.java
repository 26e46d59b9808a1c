package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.expr.Expression;

/**
 * 调用处的实参：具名（{@code name = value}）或位置实参
 */
public final class Parameter {
    private final String name;
    private final Expression value;
    private final Location location;

    public Parameter(String name, Expression value, Location location) {
        this.name = name;
        this.value = value;
        this.location = location;
    }

    /** 位置实参返回 null */
    public String getName() {
        return name;
    }

    public boolean isNamed() {
        return name != null;
    }

    /** 是否为 {@code $fn} 一类特殊变量实参 */
    public boolean isSpecial() {
        return name != null && name.startsWith("$");
    }

    public Expression getValue() {
        return value;
    }

    public Location getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return name == null ? String.valueOf(value) : name + " = " + value;
    }
}
