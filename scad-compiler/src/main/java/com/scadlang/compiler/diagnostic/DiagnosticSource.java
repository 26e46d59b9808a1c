package com.scadlang.compiler.diagnostic;

/**
 * 诊断来源：语法阶段或语义分析阶段
 */
public enum DiagnosticSource {
    PARSER, SEMANTIC
}
