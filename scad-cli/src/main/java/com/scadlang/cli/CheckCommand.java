package com.scadlang.cli;

import com.scadlang.compiler.parser.ParseResult;
import com.scadlang.compiler.parser.ParserOptions;
import com.scadlang.compiler.parser.ScadParser;
import com.scadlang.ide.IdeJson;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * picocli check 子命令：输出诊断，有错误时退出码为 1
 */
@Command(name = "check", description = "检查源码文件并输出诊断")
public class CheckCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "源码文件路径")
    String file;

    @Option(names = "--json", description = "以 LSP 形状的 JSON 输出诊断")
    boolean json;

    @Option(names = "--no-type-check", negatable = false, description = "关闭字面量类型检查")
    boolean noTypeCheck;

    @Override
    public Integer call() {
        ScadRunner runner = new ScadRunner(spec.commandLine().getOut(), spec.commandLine().getErr());
        String source = runner.readSource(file);
        if (source == null) {
            return 1;
        }
        ScadParser parser = ScadRunner.parser(file, !noTypeCheck, ParserOptions.DEFAULT_MAX_RECOVERY_ATTEMPTS);
        ParseResult result = parser.parse(source);

        if (json) {
            spec.commandLine().getOut().println(IdeJson.toJson(IdeJson.diagnostics(result.getDiagnostics())));
        } else {
            runner.printDiagnostics(file, result.getDiagnostics(), parser.getRecoveryRegistry());
            spec.commandLine().getOut().println(file + ": " + result.getErrorCount() + " 个错误, "
                    + (result.getDiagnostics().size() - result.getErrorCount()) + " 个其他诊断");
        }
        return result.hasErrors() ? 1 : 0;
    }
}
