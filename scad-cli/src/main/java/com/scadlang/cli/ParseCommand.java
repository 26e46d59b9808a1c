package com.scadlang.cli;

import com.google.gson.JsonObject;
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
 * picocli parse 子命令：输出 AST 与诊断的 JSON
 */
@Command(name = "parse", description = "解析源码文件并以 JSON 输出 AST")
public class ParseCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "源码文件路径")
    String file;

    @Option(names = "--recover", description = "解析前先尝试修补语法错误")
    boolean recover;

    @Option(names = "--type-check", description = "启用字面量类型检查")
    boolean typeCheck;

    @Override
    public Integer call() {
        ScadRunner runner = new ScadRunner(spec.commandLine().getOut(), spec.commandLine().getErr());
        String source = runner.readSource(file);
        if (source == null) {
            return 1;
        }
        ScadParser parser = ScadRunner.parser(file, typeCheck, ParserOptions.DEFAULT_MAX_RECOVERY_ATTEMPTS);
        ParseResult result = recover ? parser.parseWithRecovery(source) : parser.parse(source);

        JsonObject json = new JsonObject();
        json.addProperty("file", file);
        json.add("ast", new AstJsonWriter().write(result.getAst()));
        json.add("diagnostics", IdeJson.diagnostics(result.getDiagnostics()));
        if (result.isRecovered()) {
            json.addProperty("recoveredSource", result.getSource());
        }
        spec.commandLine().getOut().println(IdeJson.toJson(json));
        return 0;
    }
}
