package com.scadlang.compiler.recovery;

import com.scadlang.compiler.analysis.TypeChecker;
import com.scadlang.compiler.analysis.ValueType;
import com.scadlang.compiler.diagnostic.Diagnostic;
import com.scadlang.compiler.diagnostic.ErrorCode;

/**
 * 类型不匹配：在运算数或实参的位置插入显式转换
 *
 * <table>
 *   <caption>转换规则</caption>
 *   <tr><th>实际</th><th>期望</th><th>改写</th></tr>
 *   <tr><td>number / boolean</td><td>string</td><td>{@code str(v)}</td></tr>
 *   <tr><td>boolean</td><td>number</td><td>{@code (v ? 1 : 0)}</td></tr>
 *   <tr><td>number</td><td>boolean</td><td>{@code (v != 0)}</td></tr>
 *   <tr><td>数字字符串</td><td>number</td><td>去掉引号</td></tr>
 * </table>
 */
public class TypeMismatchStrategy extends AbstractRecoveryStrategy {

    public static final int PRIORITY = 70;

    private final TypeChecker typeChecker;

    public TypeMismatchStrategy(TypeChecker typeChecker) {
        super("type-mismatch", PRIORITY);
        this.typeChecker = typeChecker;
    }

    @Override
    public boolean canHandle(Diagnostic diagnostic) {
        ErrorCode code = diagnostic.getCode();
        return (code == ErrorCode.TYPE_MISMATCH || code == ErrorCode.INVALID_OPERATION
                || code == ErrorCode.INVALID_ARGUMENTS)
                && diagnostic.getExpectedType() != null && diagnostic.getActualType() != null;
    }

    @Override
    public String recover(Diagnostic diagnostic, String source) {
        ValueType expected = ValueType.fromDisplayName(diagnostic.getExpectedType());
        ValueType actual = ValueType.fromDisplayName(diagnostic.getActualType());
        if (typeChecker.isAssignable(actual, expected)) {
            return null;
        }
        int start = startOffset(diagnostic, source);
        int end = endOffset(diagnostic, source);
        if (end <= start) {
            return null;
        }
        String replacement = convert(source.substring(start, end), actual, expected);
        if (replacement == null) {
            return null;
        }
        return source.substring(0, start) + replacement + source.substring(end);
    }

    /**
     * 生成转换后的文本，没有合适的转换时返回 null
     */
    static String convert(String text, ValueType actual, ValueType expected) {
        if (expected == ValueType.STRING && (actual == ValueType.NUMBER || actual == ValueType.BOOLEAN)) {
            return "str(" + text + ")";
        }
        if (expected == ValueType.NUMBER && actual == ValueType.BOOLEAN) {
            return "(" + text + " ? 1 : 0)";
        }
        if (expected == ValueType.BOOLEAN && actual == ValueType.NUMBER) {
            return "(" + text + " != 0)";
        }
        if (expected == ValueType.NUMBER && actual == ValueType.STRING) {
            String unquoted = text.length() >= 2 ? text.substring(1, text.length() - 1).trim() : "";
            if (unquoted.matches("-?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?")) {
                return unquoted;
            }
        }
        return null;
    }

    @Override
    public String getRecoverySuggestion(Diagnostic diagnostic) {
        return "Convert the " + diagnostic.getActualType() + " value to " + diagnostic.getExpectedType();
    }
}
