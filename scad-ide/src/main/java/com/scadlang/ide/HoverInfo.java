package com.scadlang.ide;

import com.scadlang.compiler.ast.Location;

/**
 * 悬停提示内容
 */
public final class HoverInfo {
    private final String description;
    private final String kind;
    private final Location range;
    private final String documentation;

    public HoverInfo(String description, String kind, Location range, String documentation) {
        this.description = description;
        this.kind = kind;
        this.range = range;
        this.documentation = documentation;
    }

    public String getDescription() {
        return description;
    }

    /** module / function / variable / parameter / constant / expression / statement */
    public String getKind() {
        return kind;
    }

    public Location getRange() {
        return range;
    }

    /** 附加说明，没有时为 null */
    public String getDocumentation() {
        return documentation;
    }
}
