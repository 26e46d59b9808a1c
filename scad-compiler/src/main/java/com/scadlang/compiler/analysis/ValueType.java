package com.scadlang.compiler.analysis;

/**
 * OpenSCAD 值类型
 */
public enum ValueType {
    NUMBER("number"),
    STRING("string"),
    BOOLEAN("boolean"),
    VECTOR("vector"),
    RANGE("range"),
    UNDEF("undef"),
    FUNCTION("function"),
    UNKNOWN("unknown");

    private final String displayName;

    ValueType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** number / string / boolean */
    public boolean isScalar() {
        return this == NUMBER || this == STRING || this == BOOLEAN;
    }

    public static ValueType fromDisplayName(String name) {
        for (ValueType type : values()) {
            if (type.displayName.equals(name)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
