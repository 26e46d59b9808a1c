package com.scadlang.ide;

/**
 * 符号种类
 */
public enum SymbolKind {
    MODULE("module"),
    FUNCTION("function"),
    VARIABLE("variable"),
    PARAMETER("parameter"),
    CONSTANT("constant");

    private final String displayName;

    SymbolKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
