package com.scadlang.cst;

/**
 * 一次解析得到的 CST 及其源码快照
 */
public final class SyntaxTree {
    private final String source;
    private final SyntaxNode root;

    public SyntaxTree(String source, SyntaxNode root) {
        this.source = source;
        this.root = root;
    }

    public String getSource() {
        return source;
    }

    public SyntaxNode getRoot() {
        return root;
    }

    public boolean hasErrors() {
        return root.hasError();
    }
}
