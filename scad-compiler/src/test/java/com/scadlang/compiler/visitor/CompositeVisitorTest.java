package com.scadlang.compiler.visitor;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.ErrorNode;
import com.scadlang.compiler.ast.decl.ModuleDefinition;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.geometry.Cube;
import com.scadlang.compiler.ast.stmt.ModuleInstantiation;
import com.scadlang.compiler.diagnostic.DiagnosticCollector;
import com.scadlang.compiler.diagnostic.ErrorCode;
import com.scadlang.compiler.diagnostic.Severity;
import com.scadlang.cst.SyntaxNode;
import com.scadlang.cst.SyntaxTree;
import com.scadlang.cst.parser.ScadCstProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 访问者链分发测试
 */
class CompositeVisitorTest {

    private DiagnosticCollector diagnostics;
    private AstBuildContext context;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticCollector();
        context = new AstBuildContext(diagnostics);
    }

    private static SyntaxNode root(String source) {
        SyntaxTree tree = new ScadCstProvider().parse(source);
        return tree.getRoot();
    }

    @Test
    @DisplayName("没有访问者认领时记录警告并跳过")
    void testUnhandled() {
        CompositeVisitor composite = new CompositeVisitor(context);
        List<AstNode> nodes = composite.dispatchAll(root("cube(1);"));
        assertTrue(nodes.isEmpty());
        assertEquals(1, diagnostics.size());
        assertEquals(ErrorCode.UNHANDLED_CONSTRUCT, diagnostics.getDiagnostics().get(0).getCode());
        assertEquals(Severity.WARNING, diagnostics.getDiagnostics().get(0).getSeverity());
    }

    @Test
    @DisplayName("默认访问者链")
    void testDefaultChain() {
        CompositeVisitor composite = CompositeVisitor.createDefault(context);
        List<AstNode> nodes = composite.dispatchAll(root("cube(1);"));
        assertEquals(1, nodes.size());
        assertTrue(nodes.get(0) instanceof Cube);
        assertThat(composite.getClaimedTypes())
                .contains("module_definition", "module_instantiation", "for_statement", "if_statement",
                        "assign_statement", "assignment_statement", "include_statement");
    }

    @Test
    @DisplayName("先注册的访问者优先")
    void testOrder() {
        CompositeVisitor composite = new CompositeVisitor(context);
        composite.addVisitor(new StatementVisitor() {
            @Override
            public AstNode visitStatement(SyntaxNode node) {
                if (!"module_instantiation".equals(node.getType())) {
                    return null;
                }
                return new ModuleInstantiation(Location.UNKNOWN, "custom", Collections.emptyList(),
                        Collections.<AstNode>emptyList(), null);
            }

            @Override
            public Set<String> getClaimedTypes() {
                return Collections.singleton("module_instantiation");
            }
        });
        composite.addVisitor(new InstantiationVisitor(context));
        List<AstNode> nodes = composite.dispatchAll(root("cube(1);"));
        assertEquals("custom", ((ModuleInstantiation) nodes.get(0)).getName());
    }

    @Test
    @DisplayName("CST 错误节点直接转为错误节点")
    void testErrorNode() {
        CompositeVisitor composite = CompositeVisitor.createDefault(context);
        List<AstNode> nodes = composite.dispatchAll(root("@@@ ;"));
        assertEquals(1, nodes.size());
        assertTrue(nodes.get(0) instanceof ErrorNode);
        assertEquals(0, diagnostics.size());
    }

    @Test
    @DisplayName("null 节点")
    void testNull() {
        assertNull(new CompositeVisitor(context).dispatch(null));
    }

    private static SyntaxNode find(SyntaxNode node, String type) {
        if (type.equals(node.getType())) {
            return node;
        }
        for (SyntaxNode child : node.getNamedChildren()) {
            SyntaxNode found = find(child, type);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    @Nested
    @DisplayName("访问者互不干扰")
    class NonInterferenceTests {

        @Test
        @DisplayName("模块定义访问者不认领模块实例化")
        void testModuleVisitorSkipsInstantiation() {
            CompositeVisitor.createDefault(context);
            ModuleVisitor visitor = new ModuleVisitor(context);
            SyntaxNode instantiation = find(root("cube(1);"), "module_instantiation");
            assertNotNull(instantiation);
            assertNull(visitor.visitStatement(instantiation));
            assertEquals(0, diagnostics.size());

            SyntaxNode definition = find(root("module m() { cube(1); }"), "module_definition");
            assertTrue(visitor.visitStatement(definition) instanceof ModuleDefinition);
        }

        @Test
        @DisplayName("模块实例化落到链中的实例化访问者")
        void testChainFallsThrough() {
            CompositeVisitor composite = new CompositeVisitor(context);
            composite.addVisitor(new ModuleVisitor(context));
            composite.addVisitor(new InstantiationVisitor(context));

            SyntaxNode instantiation = find(root("cube(1);"), "module_instantiation");
            assertTrue(composite.dispatch(instantiation) instanceof Cube);

            List<AstNode> nodes = composite.dispatchAll(root("module m() { cube(1); }\nm();"));
            assertEquals(2, nodes.size());
            assertTrue(nodes.get(0) instanceof ModuleDefinition);
            assertEquals("m", ((ModuleInstantiation) nodes.get(1)).getName());
            assertEquals(0, diagnostics.size());
        }

        @Test
        @DisplayName("只有模块定义访问者时实例化无人认领")
        void testModuleVisitorAlone() {
            CompositeVisitor composite = new CompositeVisitor(context);
            composite.addVisitor(new ModuleVisitor(context));
            assertTrue(composite.dispatchAll(root("cube(1);")).isEmpty());
            assertEquals(ErrorCode.UNHANDLED_CONSTRUCT, diagnostics.getDiagnostics().get(0).getCode());
        }
    }
}
