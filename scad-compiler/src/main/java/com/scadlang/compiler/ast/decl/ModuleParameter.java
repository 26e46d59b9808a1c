package com.scadlang.compiler.ast.decl;

import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.expr.Expression;

/**
 * 模块 / 函数的形参声明
 */
public final class ModuleParameter {
    private final String name;
    private final Expression defaultValue;
    private final Location location;

    public ModuleParameter(String name, Expression defaultValue, Location location) {
        this.name = name;
        this.defaultValue = defaultValue;
        this.location = location;
    }

    public String getName() {
        return name;
    }

    /** 默认值，没有默认值时为 null */
    public Expression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public Location getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return defaultValue == null ? name : name + " = " + defaultValue;
    }
}
