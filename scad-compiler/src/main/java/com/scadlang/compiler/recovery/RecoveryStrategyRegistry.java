package com.scadlang.compiler.recovery;

import com.scadlang.compiler.analysis.TypeChecker;
import com.scadlang.compiler.diagnostic.Diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 恢复策略注册表
 *
 * <p>按优先级从小到大尝试策略，每个策略依次检查各条诊断；第一个成功修改源码的结果即返回，
 * 一次只应用一个修补。</p>
 */
public class RecoveryStrategyRegistry {
    private static final Logger LOG = Logger.getLogger(RecoveryStrategyRegistry.class.getName());

    private final List<RecoveryStrategy> strategies = new ArrayList<>();

    /**
     * 内置策略；提供类型检查器时加入类型修复
     */
    public static RecoveryStrategyRegistry createDefault(TypeChecker typeChecker) {
        RecoveryStrategyRegistry registry = new RecoveryStrategyRegistry();
        registry.register(new UnclosedBraceStrategy());
        registry.register(new UnclosedParenStrategy());
        registry.register(new UnclosedBracketStrategy());
        registry.register(new MissingSemicolonStrategy());
        if (typeChecker != null) {
            registry.register(new TypeMismatchStrategy(typeChecker));
        }
        return registry;
    }

    public void register(RecoveryStrategy strategy) {
        strategies.add(strategy);
        strategies.sort(Comparator.comparingInt(RecoveryStrategy::getPriority));
    }

    /** 按优先级排序的策略 */
    public List<RecoveryStrategy> getStrategies() {
        return Collections.unmodifiableList(strategies);
    }

    /**
     * 尝试修补源码
     *
     * @return 修补后的源码；没有策略适用时返回 null
     */
    public String attemptRecovery(List<Diagnostic> diagnostics, String source) {
        for (RecoveryStrategy strategy : strategies) {
            for (Diagnostic diagnostic : diagnostics) {
                if (!strategy.canHandle(diagnostic)) {
                    continue;
                }
                String patched;
                try {
                    patched = strategy.recover(diagnostic, source);
                } catch (RuntimeException e) {
                    LOG.log(Level.WARNING, "恢复策略 " + strategy.getName() + " 执行失败，跳过", e);
                    continue;
                }
                if (patched != null && !patched.equals(source)) {
                    LOG.fine("恢复策略 " + strategy.getName() + " 修补了 " + diagnostic);
                    return patched;
                }
            }
        }
        return null;
    }

    /**
     * 第一个能处理该诊断的策略给出的修复说明，没有时返回 null
     */
    public String getSuggestion(Diagnostic diagnostic) {
        for (RecoveryStrategy strategy : strategies) {
            if (strategy.canHandle(diagnostic)) {
                return strategy.getRecoverySuggestion(diagnostic);
            }
        }
        return null;
    }
}
