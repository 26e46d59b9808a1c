package com.scadlang.compiler.diagnostic;

/**
 * 诊断严重级别
 */
public enum Severity {
    ERROR, WARNING, INFO, HINT
}
