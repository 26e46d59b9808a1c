package com.scadlang.compiler.recovery;

import com.scadlang.compiler.analysis.LiteralTypeChecker;
import com.scadlang.compiler.analysis.ValueType;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.diagnostic.Diagnostic;
import com.scadlang.compiler.diagnostic.DiagnosticSource;
import com.scadlang.compiler.diagnostic.ErrorCode;
import com.scadlang.compiler.diagnostic.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 文本修补策略与注册表测试
 */
class RecoveryStrategyTest {

    /**
     * 单行源码中 [start, end) 处的诊断
     */
    private static Diagnostic diagnostic(ErrorCode code, int start, int end) {
        return new Diagnostic("test", code, Severity.ERROR,
                new Location(new Position(0, start, start), new Position(0, end, end)), DiagnosticSource.PARSER);
    }

    private static Diagnostic at(ErrorCode code, int line, int column, int offset) {
        Position position = new Position(line, column, offset);
        return new Diagnostic("test", code, Severity.ERROR, new Location(position, position),
                DiagnosticSource.PARSER);
    }

    private static Diagnostic typed(ErrorCode code, int start, int end, String expected, String actual) {
        return new Diagnostic("test", code, Severity.ERROR,
                new Location(new Position(0, start, start), new Position(0, end, end)), DiagnosticSource.SEMANTIC,
                expected, actual);
    }

    @Nested
    @DisplayName("缺少分号")
    class SemicolonTests {

        private final MissingSemicolonStrategy strategy = new MissingSemicolonStrategy();

        @Test
        @DisplayName("在行尾补分号")
        void testInsert() {
            assertEquals("cube(10);\nsphere(1);",
                    strategy.recover(at(ErrorCode.MISSING_SEMICOLON, 0, 8, 8), "cube(10)\nsphere(1);"));
        }

        @Test
        @DisplayName("分号插在行尾注释之前")
        void testBeforeComment() {
            assertEquals("cube(10); // box",
                    strategy.recover(at(ErrorCode.MISSING_SEMICOLON, 0, 8, 8), "cube(10) // box"));
        }

        @Test
        @DisplayName("已有分号时不处理")
        void testIdempotent() {
            String patched = strategy.recover(at(ErrorCode.MISSING_SEMICOLON, 0, 8, 8), "cube(10)");
            assertEquals("cube(10);", patched);
            assertNull(strategy.recover(at(ErrorCode.MISSING_SEMICOLON, 0, 8, 8), patched));
        }

        @Test
        @DisplayName("注释行不处理")
        void testCommentLine() {
            assertNull(strategy.recover(at(ErrorCode.MISSING_SEMICOLON, 0, 2, 2), "// note"));
        }

        @Test
        @DisplayName("只处理缺少分号的诊断")
        void testCanHandle() {
            assertTrue(strategy.canHandle(at(ErrorCode.MISSING_SEMICOLON, 0, 0, 0)));
            assertFalse(strategy.canHandle(at(ErrorCode.UNCLOSED_PAREN, 0, 0, 0)));
        }

        @Test
        @DisplayName("修复说明使用 1 起始的行号")
        void testSuggestion() {
            assertEquals("Insert ';' at the end of line 3",
                    strategy.getRecoverySuggestion(at(ErrorCode.MISSING_SEMICOLON, 2, 0, 20)));
        }
    }

    @Nested
    @DisplayName("未闭合的分隔符")
    class DelimiterTests {

        @Test
        @DisplayName("圆括号补在表达式末尾")
        void testParen() {
            UnclosedParenStrategy strategy = new UnclosedParenStrategy();
            assertEquals("cube(10)", strategy.recover(diagnostic(ErrorCode.UNCLOSED_PAREN, 4, 5), "cube(10"));
            assertEquals("cube(10);", strategy.recover(diagnostic(ErrorCode.UNCLOSED_PAREN, 4, 5), "cube(10;"));
        }

        @Test
        @DisplayName("同时补齐内部未闭合的方括号")
        void testNested() {
            UnclosedParenStrategy strategy = new UnclosedParenStrategy();
            assertEquals("cube([10, 20, 30])",
                    strategy.recover(diagnostic(ErrorCode.UNCLOSED_PAREN, 4, 5), "cube([10, 20, 30"));
        }

        @Test
        @DisplayName("已闭合或位置不是开括号时不处理")
        void testNotApplicable() {
            UnclosedParenStrategy strategy = new UnclosedParenStrategy();
            assertNull(strategy.recover(diagnostic(ErrorCode.UNCLOSED_PAREN, 4, 5), "cube(10);"));
            assertNull(strategy.recover(diagnostic(ErrorCode.UNCLOSED_PAREN, 0, 1), "cube(10"));
        }

        @Test
        @DisplayName("方括号")
        void testBracket() {
            UnclosedBracketStrategy strategy = new UnclosedBracketStrategy();
            assertEquals("x = [1, 2];", strategy.recover(diagnostic(ErrorCode.UNCLOSED_BRACKET, 4, 5), "x = [1, 2;"));
        }

        @Test
        @DisplayName("以逗号结尾的行视为延续")
        void testMultiLine() {
            UnclosedBracketStrategy strategy = new UnclosedBracketStrategy();
            assertEquals("x = [1,\n  2]\ny = 3;",
                    strategy.recover(diagnostic(ErrorCode.UNCLOSED_BRACKET, 4, 5), "x = [1,\n  2\ny = 3;"));
        }

        @Test
        @DisplayName("字符串中的括号不参与配对")
        void testStringContent() {
            UnclosedParenStrategy strategy = new UnclosedParenStrategy();
            assertEquals("echo(\")\")",
                    strategy.recover(diagnostic(ErrorCode.UNCLOSED_PAREN, 4, 5), "echo(\")\""));
        }

        @Test
        @DisplayName("花括号补在输入末尾")
        void testBrace() {
            UnclosedBraceStrategy strategy = new UnclosedBraceStrategy();
            assertEquals("module m() {\n  cube(1);\n}\n",
                    strategy.recover(diagnostic(ErrorCode.UNCLOSED_BRACE, 11, 12), "module m() {\n  cube(1);\n"));
            assertEquals("module m() {\n  if (a) {\n}\n}",
                    strategy.recover(diagnostic(ErrorCode.UNCLOSED_BRACE, 11, 12), "module m() {\n  if (a) {"));
        }

        @Test
        @DisplayName("已闭合的花括号不处理")
        void testBraceClosed() {
            UnclosedBraceStrategy strategy = new UnclosedBraceStrategy();
            assertNull(strategy.recover(diagnostic(ErrorCode.UNCLOSED_BRACE, 11, 12), "module m() { cube(1); }"));
        }
    }

    @Nested
    @DisplayName("类型修复")
    class TypeTests {

        private final TypeMismatchStrategy strategy = new TypeMismatchStrategy(new LiteralTypeChecker());

        @Test
        @DisplayName("转换规则")
        void testConvert() {
            assertEquals("str(1)", TypeMismatchStrategy.convert("1", ValueType.NUMBER, ValueType.STRING));
            assertEquals("str(true)", TypeMismatchStrategy.convert("true", ValueType.BOOLEAN, ValueType.STRING));
            assertEquals("(true ? 1 : 0)", TypeMismatchStrategy.convert("true", ValueType.BOOLEAN, ValueType.NUMBER));
            assertEquals("(5 != 0)", TypeMismatchStrategy.convert("5", ValueType.NUMBER, ValueType.BOOLEAN));
            assertEquals("10", TypeMismatchStrategy.convert("\"10\"", ValueType.STRING, ValueType.NUMBER));
            assertEquals("-2.5", TypeMismatchStrategy.convert("\"-2.5\"", ValueType.STRING, ValueType.NUMBER));
            assertNull(TypeMismatchStrategy.convert("\"abc\"", ValueType.STRING, ValueType.NUMBER));
            assertNull(TypeMismatchStrategy.convert("[1]", ValueType.VECTOR, ValueType.NUMBER));
        }

        @Test
        @DisplayName("替换诊断覆盖的文本")
        void testRecover() {
            assertEquals("cube(size=10);",
                    strategy.recover(typed(ErrorCode.INVALID_ARGUMENTS, 10, 14, "number", "string"),
                            "cube(size=\"10\");"));
        }

        @Test
        @DisplayName("缺少类型信息时不处理")
        void testCanHandle() {
            assertFalse(strategy.canHandle(diagnostic(ErrorCode.INVALID_ARGUMENTS, 0, 1)));
            assertTrue(strategy.canHandle(typed(ErrorCode.INVALID_OPERATION, 0, 1, "string", "number")));
        }

        @Test
        @DisplayName("类型兼容时不处理")
        void testAssignable() {
            assertNull(strategy.recover(typed(ErrorCode.TYPE_MISMATCH, 0, 1, "number", "number"), "1"));
        }
    }

    @Nested
    @DisplayName("注册表")
    class RegistryTests {

        @Test
        @DisplayName("按优先级排序")
        void testOrder() {
            RecoveryStrategyRegistry registry = RecoveryStrategyRegistry.createDefault(new LiteralTypeChecker());
            assertThat(registry.getStrategies()).extracting("name").containsExactly(
                    "unclosed-brace", "unclosed-paren", "unclosed-bracket", "missing-semicolon", "type-mismatch");
        }

        @Test
        @DisplayName("优先级高的策略先修补，与诊断顺序无关")
        void testPriorityWins() {
            RecoveryStrategyRegistry registry = RecoveryStrategyRegistry.createDefault(null);
            String source = "cube([10, 20, 30";
            String patched = registry.attemptRecovery(Arrays.asList(
                    diagnostic(ErrorCode.MISSING_SEMICOLON, 16, 16),
                    diagnostic(ErrorCode.UNCLOSED_BRACKET, 5, 6),
                    diagnostic(ErrorCode.UNCLOSED_PAREN, 4, 5)), source);
            assertEquals("cube([10, 20, 30])", patched);
        }

        @Test
        @DisplayName("没有策略适用时返回 null")
        void testNothingApplies() {
            RecoveryStrategyRegistry registry = RecoveryStrategyRegistry.createDefault(null);
            assertNull(registry.attemptRecovery(Collections.<Diagnostic>emptyList(), "cube(1);"));
            assertNull(registry.attemptRecovery(
                    Collections.singletonList(diagnostic(ErrorCode.UNEXPECTED_TOKEN, 0, 1)), "@"));
        }

        @Test
        @DisplayName("抛出异常的策略被跳过")
        void testFailingStrategy() {
            RecoveryStrategyRegistry registry = RecoveryStrategyRegistry.createDefault(null);
            registry.register(new AbstractRecoveryStrategy("broken", 1) {
                @Override
                public boolean canHandle(Diagnostic diagnostic) {
                    return true;
                }

                @Override
                public String recover(Diagnostic diagnostic, String source) {
                    throw new IllegalStateException("boom");
                }

                @Override
                public String getRecoverySuggestion(Diagnostic diagnostic) {
                    return null;
                }
            });
            assertEquals("broken", registry.getStrategies().get(0).getName());
            assertEquals("cube(10);", registry.attemptRecovery(
                    Collections.singletonList(at(ErrorCode.MISSING_SEMICOLON, 0, 8, 8)), "cube(10)"));
        }

        @Test
        @DisplayName("修复说明")
        void testSuggestion() {
            RecoveryStrategyRegistry registry = RecoveryStrategyRegistry.createDefault(null);
            assertEquals("Insert ')' to close the '(' at line 1",
                    registry.getSuggestion(diagnostic(ErrorCode.UNCLOSED_PAREN, 4, 5)));
            assertNull(registry.getSuggestion(typed(ErrorCode.INVALID_ARGUMENTS, 0, 1, "number", "string")));
        }
    }
}
