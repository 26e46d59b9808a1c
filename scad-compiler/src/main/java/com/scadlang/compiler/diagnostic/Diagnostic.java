package com.scadlang.compiler.diagnostic;

import com.scadlang.compiler.ast.Location;

/**
 * 诊断条目
 *
 * <p>类型相关的诊断附带期望类型与实际类型名，供类型修复策略使用。</p>
 */
public final class Diagnostic {
    private final String message;
    private final ErrorCode code;
    private final Severity severity;
    private final Location location;
    private final DiagnosticSource source;
    private final String expectedType;
    private final String actualType;

    public Diagnostic(String message, ErrorCode code, Severity severity, Location location,
                      DiagnosticSource source) {
        this(message, code, severity, location, source, null, null);
    }

    public Diagnostic(String message, ErrorCode code, Severity severity, Location location,
                      DiagnosticSource source, String expectedType, String actualType) {
        this.message = message;
        this.code = code;
        this.severity = severity;
        this.location = location;
        this.source = source;
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public String getMessage() { return message; }
    public ErrorCode getCode() { return code; }
    public Severity getSeverity() { return severity; }
    public Location getLocation() { return location; }
    public DiagnosticSource getSource() { return source; }

    /** 期望的类型名，非类型诊断为 null */
    public String getExpectedType() { return expectedType; }

    /** 实际的类型名，非类型诊断为 null */
    public String getActualType() { return actualType; }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " " + code.getId() + " at " + location + ": " + message;
    }
}
