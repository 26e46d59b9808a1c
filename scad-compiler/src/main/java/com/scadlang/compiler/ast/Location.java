package com.scadlang.compiler.ast;

/**
 * 源码区间 [start, end)
 */
public final class Location {
    private final Position start;
    private final Position end;

    public static final Location UNKNOWN = new Location(new Position(0, 0, 0), new Position(0, 0, 0));

    public Location(Position start, Position end) {
        this.start = start;
        this.end = end;
    }

    public Position getStart() {
        return start;
    }

    public Position getEnd() {
        return end;
    }

    public int getLength() {
        return end.getOffset() - start.getOffset();
    }

    /**
     * 位置是否落在区间内（起点含，终点不含）
     */
    public boolean contains(Position position) {
        return position.compareTo(start) >= 0 && position.compareTo(end) < 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Location)) return false;
        Location other = (Location) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return start.hashCode() * 31 + end.hashCode();
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
