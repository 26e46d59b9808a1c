package com.scadlang.compiler.ast;

/**
 * AST 节点基类
 *
 * <p>节点族是封闭的：每个具体节点对应一个 {@link NodeKind}，并在 {@link AstVisitor} 中有一个必须实现的方法。
 * 节点构造后不可变。</p>
 */
public abstract class AstNode {
    protected final Location location;

    protected AstNode(Location location) {
        this.location = location;
    }

    public Location getLocation() {
        return location;
    }

    public abstract NodeKind getKind();

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
