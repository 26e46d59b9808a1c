package com.scadlang.compiler.parser;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.diagnostic.Diagnostic;
import com.scadlang.compiler.diagnostic.Severity;

import java.util.Collections;
import java.util.List;

/**
 * 解析结果：AST 森林、诊断与（可能经过修补的）源码
 */
public final class ParseResult {
    private final List<AstNode> ast;
    private final List<Diagnostic> diagnostics;
    private final String source;
    private final String originalSource;
    private final int recoveryAttempts;

    public ParseResult(List<AstNode> ast, List<Diagnostic> diagnostics, String source, String originalSource,
                       int recoveryAttempts) {
        this.ast = Collections.unmodifiableList(ast);
        this.diagnostics = Collections.unmodifiableList(diagnostics);
        this.source = source;
        this.originalSource = originalSource;
        this.recoveryAttempts = recoveryAttempts;
    }

    public List<AstNode> getAst() {
        return ast;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /** AST 对应的源码，恢复后为修补过的文本 */
    public String getSource() {
        return source;
    }

    public String getOriginalSource() {
        return originalSource;
    }

    /** 实际应用的修补次数 */
    public int getRecoveryAttempts() {
        return recoveryAttempts;
    }

    public boolean isRecovered() {
        return recoveryAttempts > 0 && !source.equals(originalSource);
    }

    public boolean hasErrors() {
        return getErrorCount() > 0;
    }

    public int getErrorCount() {
        int count = 0;
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.getSeverity() == Severity.ERROR) {
                count++;
            }
        }
        return count;
    }
}
