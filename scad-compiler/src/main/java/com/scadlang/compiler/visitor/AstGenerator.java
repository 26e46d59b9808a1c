package com.scadlang.compiler.visitor;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.diagnostic.Diagnostic;
import com.scadlang.compiler.diagnostic.DiagnosticCollector;
import com.scadlang.compiler.diagnostic.SyntaxErrorCollector;
import com.scadlang.cst.SyntaxTree;

import java.util.List;
import java.util.logging.Logger;

/**
 * CST 到 AST 的一次转换：先收集语法诊断，再按访问者链转换顶层语句
 *
 * <p>实例可重复使用；每次转换前重置诊断。</p>
 */
public class AstGenerator {
    private static final Logger LOG = Logger.getLogger(AstGenerator.class.getName());

    private final DiagnosticCollector diagnostics;
    private final CompositeVisitor dispatcher;

    public AstGenerator() {
        this.diagnostics = new DiagnosticCollector();
        this.dispatcher = CompositeVisitor.createDefault(new AstBuildContext(diagnostics));
    }

    public AstGenerator(DiagnosticCollector diagnostics, CompositeVisitor dispatcher) {
        this.diagnostics = diagnostics;
        this.dispatcher = dispatcher;
    }

    public List<AstNode> generate(SyntaxTree tree) {
        diagnostics.reset();
        new SyntaxErrorCollector(tree.getSource(), diagnostics).collect(tree.getRoot());
        List<AstNode> nodes = dispatcher.dispatchAll(tree.getRoot());
        LOG.fine("生成 AST: " + nodes.size() + " 个顶层节点, " + diagnostics.size() + " 条诊断");
        return nodes;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics.getDiagnostics();
    }

    public DiagnosticCollector getDiagnosticCollector() {
        return diagnostics;
    }
}
