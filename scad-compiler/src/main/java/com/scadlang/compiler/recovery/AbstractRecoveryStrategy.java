package com.scadlang.compiler.recovery;

import com.scadlang.compiler.diagnostic.Diagnostic;

/**
 * 恢复策略基类：按行定位与文本扫描的辅助方法
 */
public abstract class AbstractRecoveryStrategy implements RecoveryStrategy {

    private final String name;
    private final int priority;

    protected AbstractRecoveryStrategy(String name, int priority) {
        this.name = name;
        this.priority = priority;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    /**
     * 诊断起点的字符偏移，限制在源码范围内
     */
    protected static int startOffset(Diagnostic diagnostic, String source) {
        int offset = diagnostic.getLocation().getStart().getOffset();
        return Math.max(0, Math.min(offset, source.length()));
    }

    protected static int endOffset(Diagnostic diagnostic, String source) {
        int offset = diagnostic.getLocation().getEnd().getOffset();
        return Math.max(0, Math.min(offset, source.length()));
    }

    protected static int lineStart(String source, int offset) {
        int index = source.lastIndexOf('\n', offset - 1);
        return index + 1;
    }

    protected static int lineEnd(String source, int offset) {
        int index = source.indexOf('\n', offset);
        return index < 0 ? source.length() : index;
    }

    /**
     * 行内代码的结束位置：去掉行尾空白与 {@code //} 注释（字符串内的 // 不算）
     */
    protected static int codeEnd(String source, int lineStart, int lineEnd) {
        int end = lineEnd;
        char quote = 0;
        for (int i = lineStart; i < lineEnd; i++) {
            char c = source.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '/' && i + 1 < lineEnd && source.charAt(i + 1) == '/') {
                end = i;
                break;
            }
        }
        while (end > lineStart && Character.isWhitespace(source.charAt(end - 1))) {
            end--;
        }
        return end;
    }

    protected static String insert(String source, int offset, String text) {
        return source.substring(0, offset) + text + source.substring(offset);
    }
}
