package com.scadlang.compiler.visitor;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.cst.SyntaxNode;

import java.util.Set;

/**
 * 把一类 CST 语句节点转换为 AST 节点的访问者
 */
public interface StatementVisitor {

    /**
     * 转换节点
     *
     * @return AST 节点；节点类型不属于本访问者时返回 null，交给链上的下一个访问者
     */
    AstNode visitStatement(SyntaxNode node);

    /** 本访问者认领的 CST 节点类型 */
    Set<String> getClaimedTypes();
}
