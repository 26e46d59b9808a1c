package com.scadlang.compiler.recovery;

import com.scadlang.compiler.diagnostic.Diagnostic;
import com.scadlang.compiler.diagnostic.ErrorCode;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 未闭合分隔符的公共扫描逻辑
 *
 * <p>从诊断位置的开启记号向后扫描（跳过字符串与注释），开启记号已闭合时不处理。
 * 圆括号、方括号在所在表达式的末尾补齐，同时补齐其内部仍未闭合的分隔符（由内向外）。</p>
 */
public abstract class UnclosedDelimiterStrategy extends AbstractRecoveryStrategy {

    private static final String OPERATOR_CHARS = "+-*/%^<>=!&|?:";

    private final char open;
    private final char close;
    private final ErrorCode code;

    protected UnclosedDelimiterStrategy(String name, int priority, char open, char close, ErrorCode code) {
        super(name, priority);
        this.open = open;
        this.close = close;
        this.code = code;
    }

    @Override
    public boolean canHandle(Diagnostic diagnostic) {
        return diagnostic.getCode() == code;
    }

    @Override
    public String recover(Diagnostic diagnostic, String source) {
        int start = startOffset(diagnostic, source);
        if (start >= source.length() || source.charAt(start) != open) {
            return null;
        }
        return closeFrom(source, start);
    }

    /**
     * 从 start 处的开启记号开始扫描并补齐
     */
    protected abstract String closeFrom(String source, int start);

    @Override
    public String getRecoverySuggestion(Diagnostic diagnostic) {
        return "Insert '" + close + "' to close the '" + open + "' at line "
                + (diagnostic.getLocation().getStart().getLine() + 1);
    }

    /**
     * 表达式内分隔符（圆括号、方括号）的补齐
     */
    protected String closeExpression(String source, int start) {
        Deque<Character> stack = new ArrayDeque<>();
        stack.push(source.charAt(start));
        int insertAt = -1;
        int i = start + 1;
        while (i < source.length() && insertAt < 0) {
            char c = source.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipString(source, i);
                continue;
            }
            if (c == '/' && i + 1 < source.length() && source.charAt(i + 1) == '*') {
                int endComment = source.indexOf("*/", i + 2);
                i = endComment < 0 ? source.length() : endComment + 2;
                continue;
            }
            if (c == '\n' || (c == '/' && i + 1 < source.length() && source.charAt(i + 1) == '/')) {
                int lineEnd = lineEnd(source, i);
                int code = codeEnd(source, lineStart(source, i), lineEnd);
                if (!continuesOnNextLine(source, code)) {
                    insertAt = code;
                } else {
                    i = lineEnd + 1;
                }
                continue;
            }
            if (c == '(' || c == '[') {
                stack.push(c);
            } else if (c == ')' || c == ']') {
                if (stack.peek() == matching(c)) {
                    stack.pop();
                    if (stack.isEmpty()) {
                        return null;
                    }
                } else {
                    insertAt = i;
                }
            } else if (c == ';' || c == '{' || c == '}') {
                insertAt = i;
            }
            i++;
        }
        if (insertAt < 0) {
            insertAt = codeEnd(source, lineStart(source, source.length()), source.length());
        }
        StringBuilder closers = new StringBuilder();
        for (char opener : stack) {
            closers.append(opener == '(' ? ')' : ']');
        }
        return insert(source, insertAt, closers.toString());
    }

    private static boolean continuesOnNextLine(String source, int codeEnd) {
        if (codeEnd == 0) {
            return true;
        }
        char last = source.charAt(codeEnd - 1);
        return last == ',' || last == '(' || last == '[' || OPERATOR_CHARS.indexOf(last) >= 0
                || Character.isWhitespace(last);
    }

    private static char matching(char closer) {
        return closer == ')' ? '(' : '[';
    }

    /**
     * 跳过字符串字面量，返回结束引号之后的位置（未闭合时为行尾）
     */
    protected static int skipString(String source, int start) {
        char quote = source.charAt(start);
        int i = start + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            if (c == '\n') {
                return i;
            }
            i++;
        }
        return source.length();
    }
}
