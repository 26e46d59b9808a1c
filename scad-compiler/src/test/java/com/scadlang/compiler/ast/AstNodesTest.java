package com.scadlang.compiler.ast;

import com.scadlang.compiler.ast.expr.Literal;
import com.scadlang.compiler.parser.ScadParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 位置、区间与遍历工具
 */
class AstNodesTest {

    @Test
    @DisplayName("区间包含起点不含终点")
    void testLocationContains() {
        Location location = new Location(new Position(0, 2, 2), new Position(0, 5, 5));
        assertTrue(location.contains(new Position(0, 2, 2)));
        assertTrue(location.contains(new Position(0, 4, 4)));
        assertFalse(location.contains(new Position(0, 5, 5)));
        assertFalse(location.contains(new Position(1, 0, 10)));
        assertEquals(3, location.getLength());
    }

    @Test
    @DisplayName("位置按行列比较")
    void testPositionOrder() {
        assertTrue(new Position(1, 0, 10).compareTo(new Position(0, 40, 40)) > 0);
        assertEquals(0, new Position(2, 3, 0).compareTo(new Position(2, 3, 99)));
        assertEquals("2:3", new Position(2, 3, 0).toString());
    }

    @Test
    @DisplayName("先序遍历覆盖实参与子节点")
    void testWalk() {
        AstNode root = new ScadParser().parse("translate([1, 2, 3]) { cube(4); }").getAst().get(0);
        List<NodeKind> kinds = new ArrayList<>();
        AstNodes.walk(root, node -> kinds.add(node.getKind()));
        assertEquals(NodeKind.TRANSLATE, kinds.get(0));
        assertThat(kinds).contains(NodeKind.VECTOR, NodeKind.CUBE);

        List<Double> numbers = new ArrayList<>();
        AstNodes.walk(root, node -> {
            if (node instanceof Literal) {
                numbers.add(((Literal) node).asNumber());
            }
        });
        assertThat(numbers).containsExactly(1.0, 2.0, 3.0, 4.0);
    }

    @Test
    @DisplayName("节点类别")
    void testFamilies() {
        assertEquals(NodeKind.Family.INSTANTIATION, NodeKind.CUBE.getFamily());
        assertEquals(NodeKind.Family.DEFINITION, NodeKind.MODULE_DEFINITION.getFamily());
    }
}
