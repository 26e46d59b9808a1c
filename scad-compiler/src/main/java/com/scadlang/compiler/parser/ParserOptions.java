package com.scadlang.compiler.parser;

import com.scadlang.compiler.analysis.TypeChecker;

/**
 * 解析配置
 */
public class ParserOptions {
    public static final int DEFAULT_MAX_RECOVERY_ATTEMPTS = 5;
    public static final int MAX_RECOVERY_ATTEMPTS_LIMIT = 20;

    private int maxRecoveryAttempts = DEFAULT_MAX_RECOVERY_ATTEMPTS;
    private boolean recoveryEnabled = true;
    private TypeChecker typeChecker;
    private String fileName = "<input>";

    public ParserOptions() {
    }

    public int getMaxRecoveryAttempts() {
        return maxRecoveryAttempts;
    }

    /**
     * @param maxRecoveryAttempts 0 到 20 之间
     */
    public void setMaxRecoveryAttempts(int maxRecoveryAttempts) {
        if (maxRecoveryAttempts < 0 || maxRecoveryAttempts > MAX_RECOVERY_ATTEMPTS_LIMIT) {
            throw new ScadParserException("maxRecoveryAttempts must be between 0 and "
                    + MAX_RECOVERY_ATTEMPTS_LIMIT + ", got " + maxRecoveryAttempts);
        }
        this.maxRecoveryAttempts = maxRecoveryAttempts;
    }

    public boolean isRecoveryEnabled() {
        return recoveryEnabled;
    }

    public void setRecoveryEnabled(boolean recoveryEnabled) {
        this.recoveryEnabled = recoveryEnabled;
    }

    /** 类型检查器，为 null 时不做语义分析与类型修复 */
    public TypeChecker getTypeChecker() {
        return typeChecker;
    }

    public void setTypeChecker(TypeChecker typeChecker) {
        this.typeChecker = typeChecker;
    }

    /** 仅用于日志与消息 */
    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }
}
