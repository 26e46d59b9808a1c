package com.scadlang.compiler.visitor;

import com.scadlang.compiler.diagnostic.DiagnosticCollector;
import com.scadlang.compiler.extract.ArgumentBinder;
import com.scadlang.compiler.extract.ExpressionReconstructor;
import com.scadlang.compiler.extract.ParameterExtractor;

/**
 * 访问者之间共享的构建上下文：诊断收集器、表达式重建器与分发器
 */
public final class AstBuildContext {
    private final DiagnosticCollector diagnostics;
    private final ExpressionReconstructor reconstructor;
    private final ArgumentBinder binder;
    private CompositeVisitor dispatcher;

    public AstBuildContext(DiagnosticCollector diagnostics) {
        this.diagnostics = diagnostics;
        this.reconstructor = new ExpressionReconstructor(diagnostics);
        this.binder = new ArgumentBinder(diagnostics);
    }

    public DiagnosticCollector getDiagnostics() {
        return diagnostics;
    }

    public ExpressionReconstructor getReconstructor() {
        return reconstructor;
    }

    public ParameterExtractor getParameterExtractor() {
        return reconstructor.getParameterExtractor();
    }

    public ArgumentBinder getBinder() {
        return binder;
    }

    public CompositeVisitor getDispatcher() {
        if (dispatcher == null) {
            throw new IllegalStateException("No dispatcher attached to build context");
        }
        return dispatcher;
    }

    void setDispatcher(CompositeVisitor dispatcher) {
        this.dispatcher = dispatcher;
    }
}
