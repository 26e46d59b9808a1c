package com.scadlang.compiler.analysis;

import com.scadlang.compiler.ast.geometry.Cube;
import com.scadlang.compiler.diagnostic.Diagnostic;
import com.scadlang.compiler.diagnostic.DiagnosticSource;
import com.scadlang.compiler.diagnostic.ErrorCode;
import com.scadlang.compiler.parser.ParseResult;
import com.scadlang.compiler.parser.ParserOptions;
import com.scadlang.compiler.parser.ScadParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 运算数与内置模块实参的类型诊断
 */
class OperandTypeAnalyzerTest {

    private static List<Diagnostic> analyze(String source) {
        ParserOptions options = new ParserOptions();
        options.setTypeChecker(new LiteralTypeChecker());
        return new ScadParser(options).parse(source).getDiagnostics();
    }

    @Nested
    @DisplayName("运算数")
    class OperandTests {

        @Test
        @DisplayName("同类型运算没有诊断")
        void testSameType() {
            assertTrue(analyze("x = 1 + 2 * 3;").isEmpty());
            assertTrue(analyze("x = [1, 2] + [3, 4];").isEmpty());
        }

        @Test
        @DisplayName("字符串与数值：数值一侧转为字符串")
        void testStringAndNumber() {
            List<Diagnostic> diagnostics = analyze("x = \"a\" + 1;");
            assertEquals(1, diagnostics.size());
            Diagnostic diagnostic = diagnostics.get(0);
            assertEquals(ErrorCode.INVALID_OPERATION, diagnostic.getCode());
            assertEquals(DiagnosticSource.SEMANTIC, diagnostic.getSource());
            assertEquals("string", diagnostic.getExpectedType());
            assertEquals("number", diagnostic.getActualType());
            assertEquals(10, diagnostic.getLocation().getStart().getOffset());
            assertEquals(11, diagnostic.getLocation().getEnd().getOffset());
        }

        @Test
        @DisplayName("布尔与数值：布尔一侧转为数值")
        void testBooleanAndNumber() {
            Diagnostic diagnostic = analyze("x = 1 + true;").get(0);
            assertEquals("number", diagnostic.getExpectedType());
            assertEquals("boolean", diagnostic.getActualType());
            assertEquals(8, diagnostic.getLocation().getStart().getOffset());
        }

        @Test
        @DisplayName("比较与逻辑运算不检查")
        void testNonArithmetic() {
            assertTrue(analyze("x = 1 < \"a\";").isEmpty());
            assertTrue(analyze("x = 1 == true;").isEmpty());
        }

        @Test
        @DisplayName("类型未知的运算数不检查")
        void testUnknown() {
            assertTrue(analyze("x = a + \"b\";").isEmpty());
        }

        @Test
        @DisplayName("嵌套在实例化实参中的表达式也被检查")
        void testNested() {
            List<Diagnostic> diagnostics = analyze("translate([\"a\" * 2, 0, 0]) cube(1);");
            assertEquals(1, diagnostics.size());
            assertEquals(ErrorCode.INVALID_OPERATION, diagnostics.get(0).getCode());
        }
    }

    @Nested
    @DisplayName("内置模块实参")
    class ArgumentTests {

        @Test
        @DisplayName("具名实参类型不符")
        void testNamedArgument() {
            List<Diagnostic> diagnostics = analyze("cube(size=\"10\");");
            assertEquals(1, diagnostics.size());
            Diagnostic diagnostic = diagnostics.get(0);
            assertEquals(ErrorCode.INVALID_ARGUMENTS, diagnostic.getCode());
            assertEquals("number", diagnostic.getExpectedType());
            assertEquals("string", diagnostic.getActualType());
            assertTrue(diagnostic.getMessage().contains("number or vector"));
        }

        @Test
        @DisplayName("位置实参按签名顺序对应")
        void testPositionalArgument() {
            Diagnostic diagnostic = analyze("cube(10, 1);").get(0);
            assertEquals(ErrorCode.INVALID_ARGUMENTS, diagnostic.getCode());
            assertEquals("boolean", diagnostic.getExpectedType());
            assertEquals("number", diagnostic.getActualType());
        }

        @Test
        @DisplayName("具名实参之后的位置实参对应下一个未占用的形参")
        void testPositionalAfterNamed() {
            assertTrue(analyze("cube(size = 5, true);").isEmpty());
            assertTrue(analyze("cube(center = true, 5);").isEmpty());

            List<Diagnostic> diagnostics = analyze("cube(size = 5, \"x\");");
            assertEquals(1, diagnostics.size());
            assertTrue(diagnostics.get(0).getMessage().startsWith("Argument 'center'"));
            assertEquals("boolean", diagnostics.get(0).getExpectedType());
            assertEquals("string", diagnostics.get(0).getActualType());
        }

        @Test
        @DisplayName("合法的混合实参不被恢复改写")
        void testMixedArgumentsNotRewritten() {
            ParserOptions options = new ParserOptions();
            options.setTypeChecker(new LiteralTypeChecker());
            ParseResult result = new ScadParser(options).parseWithRecovery("cube(size = 5, true);");
            assertEquals("cube(size = 5, true);", result.getSource());
            assertEquals(0, result.getRecoveryAttempts());
            assertTrue(((Cube) result.getAst().get(0)).isCenter());
        }

        @Test
        @DisplayName("undef、非字面量与用户模块不检查")
        void testSkipped() {
            assertTrue(analyze("cube(size=undef);").isEmpty());
            assertTrue(analyze("cube(size=s);").isEmpty());
            assertTrue(analyze("gear(size=\"x\");").isEmpty());
            assertTrue(analyze("sphere(r=1, $fn=\"x\");").isEmpty());
        }

        @Test
        @DisplayName("可接受多种类型")
        void testAcceptedTypes() {
            assertTrue(analyze("color(\"red\") cube([1, 2, 3]);").isEmpty());
            assertTrue(analyze("color([1, 0, 0]) cube(1);").isEmpty());
        }
    }
}
