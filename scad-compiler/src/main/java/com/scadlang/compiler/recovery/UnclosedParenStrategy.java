package com.scadlang.compiler.recovery;

import com.scadlang.compiler.diagnostic.ErrorCode;

/**
 * 未闭合的圆括号
 */
public class UnclosedParenStrategy extends UnclosedDelimiterStrategy {

    public static final int PRIORITY = 40;

    public UnclosedParenStrategy() {
        super("unclosed-paren", PRIORITY, '(', ')', ErrorCode.UNCLOSED_PAREN);
    }

    @Override
    protected String closeFrom(String source, int start) {
        return closeExpression(source, start);
    }
}
