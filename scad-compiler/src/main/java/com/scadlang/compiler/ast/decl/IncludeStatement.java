package com.scadlang.compiler.ast.decl;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;

/**
 * 文件包含 {@code include <path>}
 */
public class IncludeStatement extends AstNode {
    private final String path;

    public IncludeStatement(Location location, String path) {
        super(location);
        this.path = path;
    }

    /** 尖括号内的路径，不含尖括号 */
    public String getPath() {
        return path;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.INCLUDE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIncludeStatement(this, context);
    }
}
