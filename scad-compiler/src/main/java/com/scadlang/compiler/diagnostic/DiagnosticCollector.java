package com.scadlang.compiler.diagnostic;

import com.scadlang.compiler.ast.Location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次解析过程中的诊断收集器（只追加，每次解析前重置）
 */
public class DiagnosticCollector {
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * 记录一条语法阶段的诊断
     */
    public void record(ErrorCode code, String message, Location location, Severity severity) {
        diagnostics.add(new Diagnostic(message, code, severity, location, DiagnosticSource.PARSER));
    }

    public void record(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void error(ErrorCode code, String message, Location location) {
        record(code, message, location, Severity.ERROR);
    }

    public void warning(ErrorCode code, String message, Location location) {
        record(code, message, location, Severity.WARNING);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public boolean hasErrors() {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.isError()) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return diagnostics.size();
    }

    public void reset() {
        diagnostics.clear();
    }
}
