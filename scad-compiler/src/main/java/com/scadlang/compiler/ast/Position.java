package com.scadlang.compiler.ast;

/**
 * 源码位置（行、列从 0 开始，offset 为字符偏移）
 */
public final class Position {
    private final int line;
    private final int column;
    private final int offset;

    public Position(int line, int column, int offset) {
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    /** 按行列比较，行列相同视为同一位置 */
    public int compareTo(Position other) {
        if (line != other.line) {
            return Integer.compare(line, other.line);
        }
        return Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position other = (Position) o;
        return line == other.line && column == other.column && offset == other.offset;
    }

    @Override
    public int hashCode() {
        return (line * 31 + column) * 31 + offset;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
