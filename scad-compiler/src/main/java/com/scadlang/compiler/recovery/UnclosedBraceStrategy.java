package com.scadlang.compiler.recovery;

import com.scadlang.compiler.diagnostic.ErrorCode;

/**
 * 未闭合的花括号：在输入末尾为每一层未闭合的块补一行 {@code }}
 */
public class UnclosedBraceStrategy extends UnclosedDelimiterStrategy {

    public static final int PRIORITY = 38;

    public UnclosedBraceStrategy() {
        super("unclosed-brace", PRIORITY, '{', '}', ErrorCode.UNCLOSED_BRACE);
    }

    @Override
    protected String closeFrom(String source, int start) {
        int depth = 0;
        int i = start;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipString(source, i);
                continue;
            }
            if (c == '/' && i + 1 < source.length()) {
                char next = source.charAt(i + 1);
                if (next == '/') {
                    i = lineEnd(source, i);
                    continue;
                }
                if (next == '*') {
                    int end = source.indexOf("*/", i + 2);
                    i = end < 0 ? source.length() : end + 2;
                    continue;
                }
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return null;
                }
            }
            i++;
        }
        int end = source.length();
        while (end > 0 && Character.isWhitespace(source.charAt(end - 1))) {
            end--;
        }
        StringBuilder sb = new StringBuilder(source.substring(0, end));
        for (int level = 0; level < depth; level++) {
            sb.append("\n}");
        }
        if (source.endsWith("\n")) {
            sb.append('\n');
        }
        return sb.toString();
    }
}
