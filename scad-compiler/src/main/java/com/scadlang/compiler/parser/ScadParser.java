package com.scadlang.compiler.parser;

import com.scadlang.compiler.analysis.OperandTypeAnalyzer;
import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.diagnostic.Diagnostic;
import com.scadlang.compiler.recovery.RecoveryStrategyRegistry;
import com.scadlang.compiler.visitor.AstGenerator;
import com.scadlang.cst.CstProvider;
import com.scadlang.cst.SyntaxTree;
import com.scadlang.cst.parser.ScadCstProvider;

import java.util.List;
import java.util.logging.Logger;

/**
 * OpenSCAD 前端入口：源码 → CST → AST + 诊断，可选的修补重解析循环
 *
 * <p>实例可重复使用，但不是线程安全的：每次调用都会重置内部的诊断收集器。</p>
 */
public class ScadParser {
    private static final Logger LOG = Logger.getLogger(ScadParser.class.getName());

    private final CstProvider cstProvider;
    private final ParserOptions options;
    private final AstGenerator generator = new AstGenerator();
    private final RecoveryStrategyRegistry recoveryRegistry;

    public ScadParser() {
        this(new ParserOptions());
    }

    public ScadParser(ParserOptions options) {
        this(new ScadCstProvider(), options);
    }

    public ScadParser(CstProvider cstProvider, ParserOptions options) {
        if (cstProvider == null || options == null) {
            throw new ScadParserException("cstProvider and options must not be null");
        }
        this.cstProvider = cstProvider;
        this.options = options;
        this.recoveryRegistry = RecoveryStrategyRegistry.createDefault(options.getTypeChecker());
    }

    /**
     * 单次解析，不做恢复
     */
    public ParseResult parse(String source) {
        if (source == null) {
            throw new ScadParserException("source must not be null");
        }
        SyntaxTree tree = cstProvider.parse(source);
        List<AstNode> ast = generator.generate(tree);
        if (options.getTypeChecker() != null) {
            new OperandTypeAnalyzer(options.getTypeChecker(), generator.getDiagnosticCollector()).analyze(ast);
        }
        return new ParseResult(ast, generator.getDiagnostics(), source, source, 0);
    }

    /**
     * 解析并在有错误时反复修补、重新解析，直到没有错误、没有策略适用或达到次数上限。
     * 修补后错误变多时保留修补前的结果。
     */
    public ParseResult parseWithRecovery(String source) {
        ParseResult best = parse(source);
        if (!options.isRecoveryEnabled()) {
            return best;
        }
        int attempts = 0;
        while (attempts < options.getMaxRecoveryAttempts() && best.hasErrors()) {
            String patched = recoveryRegistry.attemptRecovery(best.getDiagnostics(), best.getSource());
            if (patched == null) {
                break;
            }
            ParseResult candidate = parse(patched);
            if (candidate.getErrorCount() > best.getErrorCount()) {
                LOG.fine(options.getFileName() + ": 修补后错误增加 (" + best.getErrorCount() + " -> "
                        + candidate.getErrorCount() + ")，停止恢复");
                break;
            }
            attempts++;
            best = candidate;
            LOG.fine(options.getFileName() + ": 第 " + attempts + " 次恢复，剩余错误 " + best.getErrorCount());
        }
        return new ParseResult(best.getAst(), best.getDiagnostics(), best.getSource(), source, attempts);
    }

    /**
     * 单次修补，不重新解析
     *
     * @return 修补后的源码；没有策略适用时返回 null
     */
    public String attemptRecovery(List<Diagnostic> diagnostics, String source) {
        return recoveryRegistry.attemptRecovery(diagnostics, source);
    }

    public RecoveryStrategyRegistry getRecoveryRegistry() {
        return recoveryRegistry;
    }

    public ParserOptions getOptions() {
        return options;
    }
}
