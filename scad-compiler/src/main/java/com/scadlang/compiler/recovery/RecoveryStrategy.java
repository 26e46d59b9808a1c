package com.scadlang.compiler.recovery;

import com.scadlang.compiler.diagnostic.Diagnostic;

/**
 * 错误恢复策略：针对一类诊断修补源码文本
 */
public interface RecoveryStrategy {

    /** 策略名，用于日志 */
    String getName();

    boolean canHandle(Diagnostic diagnostic);

    /** 优先级，数值小的先执行 */
    int getPriority();

    /**
     * 修补源码
     *
     * @return 修补后的源码；不适用时返回 null
     */
    String recover(Diagnostic diagnostic, String source);

    /**
     * 面向用户的修复说明
     */
    String getRecoverySuggestion(Diagnostic diagnostic);
}
