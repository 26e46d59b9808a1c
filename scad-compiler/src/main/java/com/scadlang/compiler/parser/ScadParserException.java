package com.scadlang.compiler.parser;

/**
 * 解析器误用（空源码、非法配置）
 *
 * <p>源码本身的语法问题不会抛出该异常，而是以诊断形式返回。</p>
 */
public class ScadParserException extends RuntimeException {

    public ScadParserException(String message) {
        super(message);
    }

    public ScadParserException(String message, Throwable cause) {
        super(message, cause);
    }
}
