package com.scadlang.compiler.visitor;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.ErrorNode;
import com.scadlang.compiler.ast.decl.*;
import com.scadlang.compiler.ast.expr.Each;
import com.scadlang.compiler.ast.expr.RangeExpr;
import com.scadlang.compiler.ast.geometry.Cube;
import com.scadlang.compiler.ast.geometry.Sphere;
import com.scadlang.compiler.ast.stmt.*;
import com.scadlang.compiler.diagnostic.ErrorCode;
import com.scadlang.compiler.parser.ParseResult;
import com.scadlang.compiler.parser.ScadParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 语句访问者链测试：定义、控制结构与简单语句
 */
class StatementVisitorTest {

    private static List<AstNode> parse(String source) {
        ParseResult result = new ScadParser().parse(source);
        assertFalse(result.hasErrors(), () -> "unexpected diagnostics: " + result.getDiagnostics());
        return result.getAst();
    }

    @Nested
    @DisplayName("定义")
    class DefinitionTests {

        @Test
        @DisplayName("模块定义")
        void testModuleDefinition() {
            ModuleDefinition module = (ModuleDefinition) parse("module box(w, h = 2) { cube([w, w, h]); }").get(0);
            assertEquals("box", module.getName());
            assertEquals(2, module.getParameters().size());
            assertFalse(module.getParameters().get(0).hasDefault());
            assertTrue(module.getParameters().get(1).hasDefault());
            assertEquals(1, module.getBody().size());
            assertTrue(module.getBody().get(0) instanceof Cube);
            assertEquals(7, module.getNameLocation().getStart().getColumn());
        }

        @Test
        @DisplayName("单条语句作为模块体")
        void testModuleSingleStatementBody() {
            ModuleDefinition module = (ModuleDefinition) parse("module dot() sphere(1);").get(0);
            assertEquals(1, module.getBody().size());
            assertTrue(module.getBody().get(0) instanceof Sphere);
        }

        @Test
        @DisplayName("函数定义")
        void testFunctionDefinition() {
            FunctionDefinition function = (FunctionDefinition) parse("function area(r) = 3.14 * r * r;").get(0);
            assertEquals("area", function.getName());
            assertEquals(1, function.getParameters().size());
            assertNotNull(function.getValueExpr());
        }

        @Test
        @DisplayName("定义与同名实例化互不干扰")
        void testDefinitionAndInstantiation() {
            List<AstNode> ast = parse("module m() { cube(1); }\nm();");
            assertTrue(ast.get(0) instanceof ModuleDefinition);
            assertTrue(ast.get(1) instanceof ModuleInstantiation);
            assertEquals("m", ((ModuleInstantiation) ast.get(1)).getName());
        }

        @Test
        @DisplayName("缺少模块体时生成错误节点，只报告一次")
        void testMissingBody() {
            ParseResult result = new ScadParser().parse("module m()");
            assertTrue(result.getAst().get(0) instanceof ErrorNode);
            assertEquals(1, result.getErrorCount());
            assertEquals(ErrorCode.MISSING_FIELD, result.getDiagnostics().get(0).getCode());
        }

        @Test
        @DisplayName("赋值、include 与 use")
        void testSimpleStatements() {
            List<AstNode> ast = parse("include <lib/gears.scad>\nuse <util.scad>\n$fn = 32;\nsize = 10;");
            assertEquals("lib/gears.scad", ((IncludeStatement) ast.get(0)).getPath());
            assertEquals("util.scad", ((UseStatement) ast.get(1)).getPath());
            assertEquals("$fn", ((AssignmentStatement) ast.get(2)).getName());
            assertEquals("size", ((AssignmentStatement) ast.get(3)).getName());
        }
    }

    @Nested
    @DisplayName("控制结构")
    class ControlTests {

        @Test
        @DisplayName("for 循环")
        void testForLoop() {
            ForLoop loop = (ForLoop) parse("for (i = [0 : 3]) translate([i, 0, 0]) cube(1);").get(0);
            assertEquals(1, loop.getVariables().size());
            assertEquals("i", loop.getVariables().get(0).getName());
            assertTrue(loop.getVariables().get(0).getRange() instanceof RangeExpr);
            assertEquals(1, loop.getBody().size());
        }

        @Test
        @DisplayName("多变量 for 循环")
        void testForLoopMultipleVariables() {
            ForLoop loop = (ForLoop) parse("for (x = [0 : 1], y = [0 : 1]) { cube(1); sphere(1); }").get(0);
            assertThat(loop.getVariables()).extracting("name").containsExactly("x", "y");
            assertEquals(2, loop.getBody().size());
        }

        @Test
        @DisplayName("if / else")
        void testIfElse() {
            IfNode node = (IfNode) parse("if (a > 1) cube(1); else { sphere(1); sphere(2); }").get(0);
            assertNotNull(node.getCondition());
            assertEquals(1, node.getThenBranch().size());
            assertTrue(node.hasElse());
            assertEquals(2, node.getElseBranch().size());
        }

        @Test
        @DisplayName("没有 else 分支")
        void testIfWithoutElse() {
            IfNode node = (IfNode) parse("if (true) { cube(1); }").get(0);
            assertFalse(node.hasElse());
        }

        @Test
        @DisplayName("let 与 assign 语句")
        void testLetAndAssign() {
            Let let = (Let) parse("let (a = 1, b = 2) cube(a);").get(0);
            assertThat(let.getAssignments().keySet()).containsExactly("a", "b");
            assertEquals(1, let.getBody().size());

            Assign assign = (Assign) parse("assign (w = 3) cube(w);").get(0);
            assertEquals(1, assign.getAssignments().size());
            assertEquals(1, assign.getBody().size());
        }

        @Test
        @DisplayName("echo 语句")
        void testEcho() {
            EchoStatement echo = (EchoStatement) parse("echo(\"size\", 10);").get(0);
            assertEquals(2, echo.getArgs().size());
        }

        @Test
        @DisplayName("each 语句")
        void testEach() {
            assertTrue(parse("each [1, 2];").get(0) instanceof Each);
        }
    }

    @Nested
    @DisplayName("块与空语句")
    class BlockTests {

        @Test
        @DisplayName("顶层块展开为各条语句，空语句不产生节点")
        void testBlockFlattening() {
            List<AstNode> ast = parse("{ cube(1); ; sphere(1); }\n;");
            assertEquals(2, ast.size());
            assertTrue(ast.get(0) instanceof Cube);
            assertTrue(ast.get(1) instanceof Sphere);
        }
    }
}
