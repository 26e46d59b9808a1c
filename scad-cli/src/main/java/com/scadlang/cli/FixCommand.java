package com.scadlang.cli;

import com.scadlang.compiler.parser.ParseResult;
import com.scadlang.compiler.parser.ParserOptions;
import com.scadlang.compiler.parser.ScadParser;
import com.scadlang.compiler.parser.ScadParserException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * picocli fix 子命令：运行恢复循环，输出或写回修补后的源码
 */
@Command(name = "fix", description = "修补常见语法错误")
public class FixCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "源码文件路径")
    String file;

    @Option(names = {"-o", "--output"}, description = "输出文件路径（默认打印到标准输出）")
    String output;

    @Option(names = {"-w", "--write"}, description = "直接写回源文件")
    boolean write;

    @Option(names = "--max-attempts", defaultValue = "5", description = "最大修补次数（0-20，默认 5）")
    int maxAttempts;

    @Option(names = "--type-check", description = "同时修补字面量类型不匹配")
    boolean typeCheck;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        ScadRunner runner = new ScadRunner(out, err);
        String source = runner.readSource(file);
        if (source == null) {
            return 1;
        }

        ScadParser parser;
        try {
            parser = ScadRunner.parser(file, typeCheck, maxAttempts);
        } catch (ScadParserException e) {
            err.println("错误: " + e.getMessage() + "（上限 " + ParserOptions.MAX_RECOVERY_ATTEMPTS_LIMIT + "）");
            return 2;
        }
        ParseResult result = parser.parseWithRecovery(source);

        String target = write ? file : output;
        if (target == null) {
            out.print(result.getSource());
            out.flush();
        } else if (!runner.writeSource(target, result.getSource())) {
            return 1;
        }

        if (result.isRecovered()) {
            err.println(file + ": 已修补 " + result.getRecoveryAttempts() + " 次");
        }
        if (result.hasErrors()) {
            // 标准输出可能承载修补结果，诊断写到标准错误
            new ScadRunner(err, err).printDiagnostics(file, result.getDiagnostics(), parser.getRecoveryRegistry());
            return 1;
        }
        return 0;
    }
}
