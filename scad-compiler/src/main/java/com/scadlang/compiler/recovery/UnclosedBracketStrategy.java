package com.scadlang.compiler.recovery;

import com.scadlang.compiler.diagnostic.ErrorCode;

/**
 * 未闭合的方括号
 */
public class UnclosedBracketStrategy extends UnclosedDelimiterStrategy {

    public static final int PRIORITY = 42;

    public UnclosedBracketStrategy() {
        super("unclosed-bracket", PRIORITY, '[', ']', ErrorCode.UNCLOSED_BRACKET);
    }

    @Override
    protected String closeFrom(String source, int start) {
        return closeExpression(source, start);
    }
}
