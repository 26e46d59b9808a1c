package com.scadlang.compiler.extract;

import com.scadlang.compiler.ast.decl.AssignmentStatement;
import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.parser.ScadParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 常量折叠测试
 */
class ConstantFolderTest {

    private static Expression value(String expression) {
        return ((AssignmentStatement) new ScadParser().parse("x = " + expression + ";").getAst().get(0)).getValue();
    }

    @Test
    @DisplayName("算术")
    void testArithmetic() {
        assertEquals(8.0, ConstantFolder.foldNumber(value("2 * (3 + 1)")));
        assertEquals(-4.0, ConstantFolder.foldNumber(value("-2 ^ 2")));
        assertEquals(1.0, ConstantFolder.foldNumber(value("7 % 3")));
    }

    @Test
    @DisplayName("逻辑与比较")
    void testBoolean() {
        assertEquals(Boolean.TRUE, ConstantFolder.foldBoolean(value("true && !false")));
        assertEquals(Boolean.TRUE, ConstantFolder.foldBoolean(value("1 < 2")));
        assertEquals(Boolean.TRUE, ConstantFolder.foldBoolean(value("\"a\" == \"a\"")));
    }

    @Test
    @DisplayName("条件表达式")
    void testConditional() {
        assertEquals(5.0, ConstantFolder.foldNumber(value("1 < 2 ? 5 : 6")));
    }

    @Test
    @DisplayName("向量")
    void testVector() {
        assertArrayEquals(new double[]{1, 2, 3}, ConstantFolder.foldVector(value("[1, 1 + 1, 3]")));
        assertEquals(Arrays.asList(1.0, "a"), ConstantFolder.fold(value("[1, \"a\"]")));
        assertNull(ConstantFolder.foldVector(value("[1, \"a\"]")));
    }

    @Test
    @DisplayName("含变量或调用时不折叠")
    void testNonConstant() {
        assertNull(ConstantFolder.fold(value("a + 1")));
        assertNull(ConstantFolder.fold(value("sin(30)")));
        assertNull(ConstantFolder.foldVector(value("[a, 2]")));
        assertNull(ConstantFolder.foldNumber(null));
    }

    @Test
    @DisplayName("类型不符时返回 null")
    void testTypeMismatch() {
        assertNull(ConstantFolder.foldNumber(value("\"10\"")));
        assertNull(ConstantFolder.fold(value("true + 1")));
    }
}
