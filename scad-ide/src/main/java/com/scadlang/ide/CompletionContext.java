package com.scadlang.ide;

import com.scadlang.compiler.ast.AstNode;

import java.util.Collections;
import java.util.List;

/**
 * 补全上下文
 */
public final class CompletionContext {

    /**
     * 光标所处的语法位置
     */
    public enum Type {
        MODULE_CALL("module_call"),
        FUNCTION_CALL("function_call"),
        PARAMETER("parameter"),
        EXPRESSION("expression"),
        STATEMENT("statement"),
        ASSIGNMENT("assignment"),
        UNKNOWN("unknown");

        private final String displayName;

        Type(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    private final Type type;
    private final List<SymbolInfo> availableSymbols;
    private final Integer parameterIndex;
    private final String expectedType;
    private final AstNode node;
    private final AstNode parentNode;

    public CompletionContext(Type type, List<SymbolInfo> availableSymbols, Integer parameterIndex,
                             String expectedType, AstNode node, AstNode parentNode) {
        this.type = type;
        this.availableSymbols = availableSymbols == null ? Collections.emptyList() : availableSymbols;
        this.parameterIndex = parameterIndex;
        this.expectedType = expectedType;
        this.node = node;
        this.parentNode = parentNode;
    }

    public Type getType() {
        return type;
    }

    public List<SymbolInfo> getAvailableSymbols() {
        return availableSymbols;
    }

    /** 位于调用实参中时的实参序号，否则为 null */
    public Integer getParameterIndex() {
        return parameterIndex;
    }

    /** 内置模块形参期望的值类型名，未知时为 null */
    public String getExpectedType() {
        return expectedType;
    }

    public AstNode getNode() {
        return node;
    }

    public AstNode getParentNode() {
        return parentNode;
    }
}
