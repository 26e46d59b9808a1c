package com.scadlang.compiler.ast.geometry;

/**
 * 布尔 / 包络运算
 */
public enum CsgOperator {
    UNION("union"),
    DIFFERENCE("difference"),
    INTERSECTION("intersection"),
    HULL("hull"),
    MINKOWSKI("minkowski");

    private final String moduleName;

    CsgOperator(String moduleName) {
        this.moduleName = moduleName;
    }

    public String getModuleName() {
        return moduleName;
    }

    /**
     * 按模块名查找，未知名字返回 null
     */
    public static CsgOperator fromModuleName(String name) {
        for (CsgOperator op : values()) {
            if (op.moduleName.equals(name)) {
                return op;
            }
        }
        return null;
    }
}
