package com.scadlang.compiler.diagnostic;

/**
 * 诊断错误码
 *
 * <ul>
 *   <li>E1xx 语法</li>
 *   <li>E2xx 类型</li>
 *   <li>E4xx 参数校验</li>
 *   <li>E9xx 内部错误</li>
 * </ul>
 */
public enum ErrorCode {
    SYNTAX_ERROR("E100"),
    UNEXPECTED_TOKEN("E101"),
    MISSING_SEMICOLON("E102"),
    UNCLOSED_BRACKET("E103"),
    UNCLOSED_BRACE("E104"),
    UNCLOSED_PAREN("E105"),
    INVALID_CHARACTER("E106"),
    MISSING_NAME("E107"),
    UNEXPECTED_EOF("E108"),
    INVALID_ESCAPE_SEQUENCE("E110"),
    MALFORMED_LITERAL("E111"),
    MISSING_FIELD("E112"),
    UNHANDLED_CONSTRUCT("E113"),

    TYPE_ERROR("E200"),
    TYPE_MISMATCH("E201"),
    INVALID_OPERATION("E202"),
    INVALID_TYPE("E203"),

    VALIDATION_ERROR("E400"),
    INVALID_ARGUMENTS("E401"),
    DUPLICATE_ARGUMENT("E403"),

    INTERNAL_ERROR("E900");

    private final String id;

    ErrorCode(String id) {
        this.id = id;
    }

    /** 稳定的编号，如 E102 */
    public String getId() {
        return id;
    }

    public boolean isSyntax() {
        return id.startsWith("E1");
    }

    public boolean isType() {
        return id.startsWith("E2");
    }

    public boolean isValidation() {
        return id.startsWith("E4");
    }

    /**
     * 缺失的分隔符类错误（可由文本补齐修复）
     */
    public boolean isUnclosedDelimiter() {
        return this == UNCLOSED_BRACE || this == UNCLOSED_BRACKET || this == UNCLOSED_PAREN;
    }

    public static ErrorCode fromId(String id) {
        for (ErrorCode code : values()) {
            if (code.id.equals(id)) {
                return code;
            }
        }
        return null;
    }
}
