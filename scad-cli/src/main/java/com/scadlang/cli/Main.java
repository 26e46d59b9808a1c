package com.scadlang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ScadLang CLI 入口点（picocli）
 */
@Command(name = "scad", version = "ScadLang v0.1.0",
         mixinStandardHelpOptions = true,
         subcommands = {ParseCommand.class, CheckCommand.class, FixCommand.class})
public class Main implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "输出解析与恢复过程的调试日志")
    boolean verbose;

    @Override
    public void run() {
        // 未指定子命令
        CommandLine.usage(this, System.out);
    }

    static CommandLine createCommandLine() {
        Main main = new Main();
        CommandLine cmd = new CommandLine(main);
        cmd.setExecutionStrategy(parseResult -> {
            if (main.verbose) {
                enableVerboseLogging();
            }
            return new CommandLine.RunLast().execute(parseResult);
        });
        return cmd;
    }

    /**
     * 根 logger 与其控制台处理器降到 FINE
     */
    static void enableVerboseLogging() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        boolean hasConsole = false;
        for (Handler handler : root.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(Level.FINE);
                hasConsole = true;
            }
        }
        if (!hasConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(Level.FINE);
            root.addHandler(console);
        }
    }

    public static void main(String[] args) {
        // Windows 控制台可能不是 UTF-8，按操作系统原生编码输出
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = createCommandLine();
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(createCommandLine().execute(args));
        }
    }

    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
