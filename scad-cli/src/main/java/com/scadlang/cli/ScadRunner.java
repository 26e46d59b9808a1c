package com.scadlang.cli;

import com.scadlang.compiler.analysis.LiteralTypeChecker;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.diagnostic.Diagnostic;
import com.scadlang.compiler.parser.ParserOptions;
import com.scadlang.compiler.parser.ScadParser;
import com.scadlang.compiler.recovery.RecoveryStrategyRegistry;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * 子命令共用的读文件、建解析器与诊断输出
 */
class ScadRunner {

    private final PrintWriter out;
    private final PrintWriter err;

    ScadRunner(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    /**
     * 读取 UTF-8 源文件
     *
     * @return 文件不存在或读取失败时打印错误并返回 null
     */
    String readSource(String filePath) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return null;
        }
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("错误: 读取失败 - " + filePath + ": " + e.getMessage());
            return null;
        }
    }

    boolean writeSource(String filePath, String content) {
        try {
            Files.write(Paths.get(filePath), content.getBytes(StandardCharsets.UTF_8));
            return true;
        } catch (IOException e) {
            err.println("错误: 写入失败 - " + filePath + ": " + e.getMessage());
            return false;
        }
    }

    static ScadParser parser(String fileName, boolean typeCheck, int maxRecoveryAttempts) {
        ParserOptions options = new ParserOptions();
        options.setFileName(fileName);
        options.setMaxRecoveryAttempts(maxRecoveryAttempts);
        if (typeCheck) {
            options.setTypeChecker(new LiteralTypeChecker());
        }
        return new ScadParser(options);
    }

    /**
     * 以 {@code 文件:行:列: 级别 代码 消息} 的形式输出诊断，行列从 1 开始
     */
    void printDiagnostics(String fileName, List<Diagnostic> diagnostics, RecoveryStrategyRegistry registry) {
        for (Diagnostic diagnostic : diagnostics) {
            Position start = diagnostic.getLocation().getStart();
            out.println(fileName + ":" + (start.getLine() + 1) + ":" + (start.getColumn() + 1) + ": "
                    + diagnostic.getSeverity().name().toLowerCase(Locale.ROOT) + " "
                    + diagnostic.getCode().getId() + " " + diagnostic.getMessage());
            String suggestion = registry.getSuggestion(diagnostic);
            if (suggestion != null) {
                out.println("    提示: " + suggestion);
            }
        }
    }
}
