package com.scadlang.ide;

import com.scadlang.compiler.ast.Location;

import java.util.Collections;
import java.util.List;

/**
 * 文档中定义的一个符号
 */
public final class SymbolInfo {
    private final String name;
    private final SymbolKind kind;
    private final Location location;
    private final Location nameLocation;
    private final List<String> parameters;
    /** 所属定义名，顶层符号为 null */
    private final String scope;

    public SymbolInfo(String name, SymbolKind kind, Location location, Location nameLocation,
                      List<String> parameters, String scope) {
        this.name = name;
        this.kind = kind;
        this.location = location;
        this.nameLocation = nameLocation;
        this.parameters = parameters == null ? Collections.emptyList() : parameters;
        this.scope = scope;
    }

    public String getName() {
        return name;
    }

    public SymbolKind getKind() {
        return kind;
    }

    public Location getLocation() {
        return location;
    }

    public Location getNameLocation() {
        return nameLocation;
    }

    /** 模块 / 函数的形参名（含默认值文本），其他种类为空列表 */
    public List<String> getParameters() {
        return parameters;
    }

    public String getScope() {
        return scope;
    }

    public boolean isTopLevel() {
        return scope == null;
    }

    @Override
    public String toString() {
        return kind.getDisplayName() + " " + name + "@" + location;
    }
}
