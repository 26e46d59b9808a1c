package com.scadlang.ide;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.ErrorNode;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.expr.Literal;
import com.scadlang.compiler.ast.expr.VectorExpr;
import com.scadlang.compiler.ast.geometry.Cube;
import com.scadlang.compiler.parser.ScadParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PositionUtilitiesTest {

    private final PositionUtilities positions = new PositionUtilities();

    private CompletionContext context(String source, int line, int column) {
        return positions.getCompletionContext(Sources.parse(source), Sources.at(source, line, column));
    }

    @Nested
    @DisplayName("节点查找")
    class FindTests {

        @Test
        @DisplayName("返回最内层节点")
        void testInnermost() {
            String source = "cube([1, 2, 3]);";
            List<AstNode> ast = Sources.parse(source);
            AstNode node = positions.findNodeAt(ast, Sources.at(source, 0, 6));
            assertTrue(node instanceof Literal);
            assertEquals(1.0, ((Literal) node).asNumber());

            List<AstNode> chain = positions.findNodesContaining(ast, Sources.at(source, 0, 6));
            assertEquals(3, chain.size());
            assertTrue(chain.get(0) instanceof Cube);
            assertTrue(chain.get(1) instanceof VectorExpr);
        }

        @Test
        @DisplayName("没有节点时返回 null")
        void testOutside() {
            String source = "cube(1);\n\n";
            List<AstNode> ast = Sources.parse(source);
            assertNull(positions.findNodeAt(ast, Sources.at(source, 2, 0)));
            assertTrue(positions.findNodesContaining(null, new Position(0, 0, 0)).isEmpty());
        }

        @Test
        @DisplayName("区间起点含、终点不含")
        void testRange() {
            Location range = new Location(new Position(1, 2, 10), new Position(1, 6, 14));
            assertTrue(PositionUtilities.isPositionInRange(new Position(1, 2, 10), range));
            assertFalse(PositionUtilities.isPositionInRange(new Position(1, 6, 14), range));
        }
    }

    @Nested
    @DisplayName("补全上下文")
    class CompletionTests {

        @Test
        @DisplayName("空文档处于语句位置")
        void testEmptyDocument() {
            CompletionContext context = positions.getCompletionContext(Sources.parse(""), new Position(0, 0, 0));
            assertEquals(CompletionContext.Type.STATEMENT, context.getType());
            assertTrue(context.getAvailableSymbols().isEmpty());
            assertNull(context.getParameterIndex());
        }

        @Test
        @DisplayName("模块名上为模块调用")
        void testModuleName() {
            assertEquals(CompletionContext.Type.MODULE_CALL, context("cube(10);", 0, 2).getType());
        }

        @Test
        @DisplayName("位置实参给出序号与期望类型")
        void testPositionalArgument() {
            CompletionContext context = context("cube(10);", 0, 5);
            assertEquals(CompletionContext.Type.PARAMETER, context.getType());
            assertEquals(0, context.getParameterIndex());
            assertEquals("number", context.getExpectedType());
        }

        @Test
        @DisplayName("具名实参按名字取期望类型")
        void testNamedArgument() {
            String source = "cube(size = 1, center = true);";
            CompletionContext inValue = context(source, 0, 25);
            assertEquals(1, inValue.getParameterIndex());
            assertEquals("boolean", inValue.getExpectedType());

            CompletionContext between = context(source, 0, 14);
            assertEquals(CompletionContext.Type.PARAMETER, between.getType());
            assertEquals(1, between.getParameterIndex());
        }

        @Test
        @DisplayName("函数调用")
        void testFunctionCall() {
            String source = "x = max(1, 2);";
            assertEquals(CompletionContext.Type.FUNCTION_CALL, context(source, 0, 5).getType());
            CompletionContext argument = context(source, 0, 11);
            assertEquals(CompletionContext.Type.PARAMETER, argument.getType());
            assertEquals(1, argument.getParameterIndex());
            assertNull(argument.getExpectedType());
        }

        @Test
        @DisplayName("赋值语句")
        void testAssignment() {
            assertEquals(CompletionContext.Type.ASSIGNMENT, context("x = max(1, 2);", 0, 0).getType());
        }

        @Test
        @DisplayName("形参只在所属模块内可见")
        void testVisibleParameters() {
            String source = "w = 5;\nmodule m(w) { cube(w); }\ncube(w);\n";
            assertThat(context(source, 1, 19).getAvailableSymbols())
                    .extracting("kind").contains(SymbolKind.PARAMETER);
            assertThat(context(source, 2, 5).getAvailableSymbols())
                    .extracting("kind").doesNotContain(SymbolKind.PARAMETER);
        }

        @Test
        @DisplayName("for 循环变量可见")
        void testLoopVariable() {
            assertThat(context("for (i = [0 : 3]) cube(i);", 0, 23).getAvailableSymbols())
                    .extracting("name").contains("i");
        }

        @Test
        @DisplayName("错误节点内上下文未知")
        void testErrorNode() {
            List<AstNode> ast = new ScadParser().parse("@@@ ;").getAst();
            assertTrue(ast.get(0) instanceof ErrorNode);
            CompletionContext context = positions.getCompletionContext(ast, ast.get(0).getLocation().getStart());
            assertEquals(CompletionContext.Type.UNKNOWN, context.getType());
        }
    }
}
