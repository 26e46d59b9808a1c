package com.scadlang.ide;

/**
 * 编辑器协议（LSP 3.17）中用到的数值常量
 */
public final class LspConstants {

    private LspConstants() {}

    // ==================== DiagnosticSeverity ====================

    public static final int SEVERITY_ERROR = 1;
    public static final int SEVERITY_WARNING = 2;
    public static final int SEVERITY_INFORMATION = 3;
    public static final int SEVERITY_HINT = 4;

    // ==================== SymbolKind ====================

    public static final int SYMBOL_MODULE = 2;
    public static final int SYMBOL_FUNCTION = 12;
    public static final int SYMBOL_VARIABLE = 13;
    public static final int SYMBOL_CONSTANT = 14;
    public static final int SYMBOL_TYPE_PARAMETER = 26;
}
