package com.scadlang.compiler.recovery;

import com.scadlang.compiler.diagnostic.Diagnostic;
import com.scadlang.compiler.diagnostic.ErrorCode;

/**
 * 缺少分号：在诊断所在行的代码末尾补分号
 *
 * <p>行已经以分号结尾或整行是 {@code //} 注释时不处理。</p>
 */
public class MissingSemicolonStrategy extends AbstractRecoveryStrategy {

    public static final int PRIORITY = 50;

    public MissingSemicolonStrategy() {
        super("missing-semicolon", PRIORITY);
    }

    @Override
    public boolean canHandle(Diagnostic diagnostic) {
        return diagnostic.getCode() == ErrorCode.MISSING_SEMICOLON;
    }

    @Override
    public String recover(Diagnostic diagnostic, String source) {
        int offset = startOffset(diagnostic, source);
        int start = lineStart(source, offset);
        int end = lineEnd(source, offset);
        String line = source.substring(start, end).trim();
        if (line.isEmpty() || line.endsWith(";") || line.startsWith("//")) {
            return null;
        }
        int insertAt = codeEnd(source, start, end);
        if (insertAt > start && source.charAt(insertAt - 1) == ';') {
            return null;
        }
        return insert(source, insertAt, ";");
    }

    @Override
    public String getRecoverySuggestion(Diagnostic diagnostic) {
        return "Insert ';' at the end of line " + (diagnostic.getLocation().getStart().getLine() + 1);
    }
}
