package com.scadlang.compiler.extract;

import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.Position;
import com.scadlang.cst.Point;
import com.scadlang.cst.SyntaxNode;

/**
 * CST 区间到 AST 位置的转换
 */
public final class LocationUtils {

    private LocationUtils() {
    }

    public static Location getLocation(SyntaxNode node) {
        if (node == null) {
            return Location.UNKNOWN;
        }
        return new Location(toPosition(node.getStartPosition(), node.getStartIndex()),
                toPosition(node.getEndPosition(), node.getEndIndex()));
    }

    /**
     * 子节点缺失时退回到父节点的区间
     */
    public static Location getLocation(SyntaxNode node, SyntaxNode fallback) {
        return node != null ? getLocation(node) : getLocation(fallback);
    }

    /**
     * 从 first 起点到 last 终点的区间
     */
    public static Location span(SyntaxNode first, SyntaxNode last) {
        return new Location(toPosition(first.getStartPosition(), first.getStartIndex()),
                toPosition(last.getEndPosition(), last.getEndIndex()));
    }

    public static Location span(Location first, Location last) {
        return new Location(first.getStart(), last.getEnd());
    }

    public static Position toPosition(Point point, int offset) {
        return new Position(point.getRow(), point.getColumn(), offset);
    }

    /**
     * 按字符偏移计算行列
     */
    public static Position positionAt(String source, int offset) {
        int line = 0;
        int lineStart = 0;
        int end = Math.min(offset, source.length());
        for (int i = 0; i < end; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new Position(line, end - lineStart, end);
    }
}
