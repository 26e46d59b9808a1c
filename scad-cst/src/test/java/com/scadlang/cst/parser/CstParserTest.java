package com.scadlang.cst.parser;

import com.scadlang.cst.Point;
import com.scadlang.cst.SyntaxNode;
import com.scadlang.cst.SyntaxTree;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CST 解析器测试
 */
class CstParserTest {

    private final ScadCstProvider provider = new ScadCstProvider();

    private SyntaxNode root(String source) {
        return provider.parse(source).getRoot();
    }

    private String sexp(String source) {
        return ((TreeNode) root(source)).toSexp();
    }

    /** 语句包装内的实际节点 */
    private SyntaxNode statement(String source, int index) {
        SyntaxNode wrapper = root(source).getNamedChildren().get(index);
        assertThat(wrapper.getType()).isEqualTo("statement");
        List<SyntaxNode> named = wrapper.getNamedChildren();
        return named.get(named.size() - 1);
    }

    private static List<SyntaxNode> collect(SyntaxNode node, List<SyntaxNode> out, boolean missingOnly) {
        if (missingOnly ? node.isMissing() : node.isError()) {
            out.add(node);
        }
        for (SyntaxNode child : node.getChildren()) {
            collect(child, out, missingOnly);
        }
        return out;
    }

    private List<SyntaxNode> missingNodes(String source) {
        return collect(root(source), new ArrayList<>(), true);
    }

    private List<SyntaxNode> errorNodes(String source) {
        return collect(root(source), new ArrayList<>(), false);
    }

    @Nested
    @DisplayName("合法源码")
    class ValidSourceTests {

        @Test
        @DisplayName("模块实例化")
        void testModuleInstantiation() {
            assertThat(sexp("cube(10);")).isEqualTo(
                    "(source_file (statement (module_instantiation name: (identifier) "
                            + "arguments: (argument_list (arguments (argument value: (number)))))))");
            assertThat(provider.parse("cube(10);").hasErrors()).isFalse();
        }

        @Test
        @DisplayName("单个运算符使用 left / operator / right 字段")
        void testSingleBinaryOperator() {
            assertThat(sexp("x = 1 + 2;")).isEqualTo(
                    "(source_file (statement (assignment_statement name: (identifier) "
                            + "value: (binary_expression left: (number) right: (number)))))");
            SyntaxNode value = statement("x = 1 + 2;", 0).getChildForFieldName("value");
            assertThat(value.getChildForFieldName("operator").getText()).isEqualTo("+");
        }

        @Test
        @DisplayName("多个运算符按出现顺序平铺")
        void testFlatChain() {
            SyntaxNode value = statement("x = 1 + 2 * 3;", 0).getChildForFieldName("value");
            assertThat(value.getType()).isEqualTo("binary_expression");
            assertThat(value.getChildForFieldName("operator")).isNull();
            List<String> texts = new ArrayList<>();
            for (SyntaxNode child : value.getChildren()) {
                texts.add(child.getText());
            }
            assertThat(texts).containsExactly("1", "+", "2", "*", "3");
        }

        @Test
        @DisplayName("修饰符挂在模块实例化的 modifier 字段上")
        void testModifier() {
            SyntaxNode node = statement("#cube(1);", 0);
            assertThat(node.getType()).isEqualTo("module_instantiation");
            assertThat(node.getChildForFieldName("modifier").getText()).isEqualTo("#");
            assertThat(node.getChildForFieldName("name").getText()).isEqualTo("cube");
        }

        @Test
        @DisplayName("模块定义的形参与主体")
        void testModuleDefinition() {
            SyntaxNode node = statement("module m(a, b = 2) { cube(a); }", 0);
            assertThat(node.getType()).isEqualTo("module_definition");
            assertThat(node.getChildForFieldName("name").getText()).isEqualTo("m");
            SyntaxNode declarations = node.getChildForFieldName("parameters").getNamedChildren().get(0);
            assertThat(declarations.getType()).isEqualTo("parameter_declarations");
            assertThat(declarations.getNamedChildren()).hasSize(2);
            SyntaxNode second = declarations.getNamedChildren().get(1);
            assertThat(second.getChildForFieldName("value").getText()).isEqualTo("2");
            assertThat(node.getChildForFieldName("body").getType()).isEqualTo("block");
        }

        @Test
        @DisplayName("单个 for 子句直接挂在 for_statement 上")
        void testSingleForClause() {
            SyntaxNode node = statement("for (i = [0:1:3]) cube(i);", 0);
            assertThat(node.getChildForFieldName("iterator").getText()).isEqualTo("i");
            SyntaxNode range = node.getChildForFieldName("range");
            assertThat(range.getType()).isEqualTo("range_expression");
            assertThat(range.getChildForFieldName("step").getText()).isEqualTo("1");
            assertThat(range.getChildForFieldName("end").getText()).isEqualTo("3");
        }

        @Test
        @DisplayName("多个 for 子句包装为 for_assignment")
        void testMultipleForClauses() {
            SyntaxNode node = statement("for (i = [0:2], j = [1, 2]) cube(i);", 0);
            assertThat(node.getChildForFieldName("iterator")).isNull();
            long clauses = node.getNamedChildren().stream()
                    .filter(c -> "for_assignment".equals(c.getType())).count();
            assertThat(clauses).isEqualTo(2);
        }

        @Test
        @DisplayName("if / else 的分支是语句")
        void testIfElse() {
            SyntaxNode node = statement("if (x) cube(1); else sphere(1);", 0);
            assertThat(node.getChildForFieldName("condition").getType()).isEqualTo("identifier");
            assertThat(node.getChildForFieldName("consequence").getType()).isEqualTo("statement");
            assertThat(node.getChildForFieldName("alternative").getType()).isEqualTo("statement");
        }

        @Test
        @DisplayName("列表推导")
        void testListComprehension() {
            SyntaxNode value = statement("v = [for (i = [0:3]) i * 2];", 0).getChildForFieldName("value");
            assertThat(value.getType()).isEqualTo("list_comprehension");
            assertThat(value.getNamedChildren().get(0).getType()).isEqualTo("list_comprehension_for");
            assertThat(value.getChildForFieldName("expr").getType()).isEqualTo("binary_expression");
        }

        @Test
        @DisplayName("include 语句")
        void testInclude() {
            assertThat(sexp("include <a.scad>")).isEqualTo(
                    "(source_file (statement (include_statement path: (include_path))))");
        }

        @Test
        @DisplayName("节点位置与源码区间")
        void testPositions() {
            String source = "x = 1;\ny = 2;";
            SyntaxNode root = root(source);
            assertThat(root.getEndIndex()).isEqualTo(source.length());
            SyntaxNode second = root.getNamedChildren().get(1);
            assertThat(second.getStartPosition()).isEqualTo(new Point(1, 0));
            assertThat(second.getText()).isEqualTo("y = 2;");
        }
    }

    @Nested
    @DisplayName("容错解析")
    class RecoveryTests {

        @Test
        @DisplayName("缺少分号时补 MISSING 节点")
        void testMissingSemicolon() {
            assertThat(sexp("cube(10)")).isEqualTo(
                    "(source_file (statement (module_instantiation name: (identifier) "
                            + "arguments: (argument_list (arguments (argument value: (number)))) (MISSING ;))))");
            SyntaxNode missing = missingNodes("cube(10)").get(0);
            assertThat(missing.getStartIndex()).isEqualTo(8);
            assertThat(missing.getEndIndex()).isEqualTo(8);
        }

        @Test
        @DisplayName("缺少右括号")
        void testMissingParen() {
            List<SyntaxNode> missing = missingNodes("cube(10;");
            assertThat(missing).hasSize(1);
            assertThat(missing.get(0).getType()).isEqualTo(")");
            assertThat(missing.get(0).getStartIndex()).isEqualTo(7);
        }

        @Test
        @DisplayName("缺少右方括号与右括号")
        void testMissingBracketAndParen() {
            List<String> types = new ArrayList<>();
            for (SyntaxNode node : missingNodes("cube([10, 20, 30")) {
                types.add(node.getType());
            }
            assertThat(types).containsExactly("]", ")", ";");
        }

        @Test
        @DisplayName("缺少右花括号")
        void testMissingBrace() {
            List<SyntaxNode> missing = missingNodes("module m() {\n  cube(1);\n");
            assertThat(missing).extracting(SyntaxNode::getType).containsExactly("}");
        }

        @Test
        @DisplayName("无法解析的语句包裹为 ERROR 并同步到下一条语句")
        void testStatementSync() {
            SyntaxNode root = root("cube(1); @@@ ; sphere(2);");
            List<SyntaxNode> named = root.getNamedChildren();
            assertThat(named).extracting(SyntaxNode::getType).containsExactly("statement", "ERROR", "statement");
            assertThat(named.get(1).getText()).isEqualTo("@@@ ;");
            SyntaxNode sphere = named.get(2).getNamedChildren().get(0);
            assertThat(sphere.getChildForFieldName("name").getText()).isEqualTo("sphere");
        }

        @Test
        @DisplayName("未闭合字符串成为 ERROR 叶子")
        void testUnterminatedString() {
            List<SyntaxNode> errors = errorNodes("x = \"abc");
            assertThat(errors).hasSize(1);
            assertThat(errors.get(0).getText()).isEqualTo("\"abc");
            assertThat(errors.get(0).getChildren()).isEmpty();
        }

        @Test
        @DisplayName("错误标记向上传播")
        void testHasErrorPropagation() {
            SyntaxTree tree = provider.parse("a = 1;\nb = [1, 2;\n");
            assertThat(tree.hasErrors()).isTrue();
            assertThat(tree.getRoot().getNamedChildren().get(0).hasError()).isFalse();
            assertThat(tree.getRoot().getNamedChildren().get(1).hasError()).isTrue();
        }

        @Test
        @DisplayName("null 源码")
        void testNullSource() {
            assertThatThrownBy(() -> provider.parse(null)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
