package com.scadlang.compiler.ast.decl;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;

/**
 * 库引用 {@code use <path>}，只导入定义
 */
public class UseStatement extends AstNode {
    private final String path;

    public UseStatement(Location location, String path) {
        super(location);
        this.path = path;
    }

    /** 尖括号内的路径，不含尖括号 */
    public String getPath() {
        return path;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.USE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUseStatement(this, context);
    }
}
