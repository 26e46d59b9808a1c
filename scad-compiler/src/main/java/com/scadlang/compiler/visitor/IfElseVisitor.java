package com.scadlang.compiler.visitor;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.stmt.IfNode;
import com.scadlang.cst.SyntaxNode;

import java.util.Collections;
import java.util.List;

/**
 * if / else；{@code else if} 链通过右递归生成嵌套的 {@link IfNode}
 */
public class IfElseVisitor extends AbstractStatementVisitor {

    public IfElseVisitor(AstBuildContext context) {
        super(context, "if_statement");
    }

    @Override
    protected AstNode convert(SyntaxNode node) {
        List<AstNode> thenBranch = visitBody(node.getChildForFieldName("consequence"));
        List<AstNode> elseBranch = null;
        SyntaxNode alternative = node.getChildForFieldName("alternative");
        if (alternative != null) {
            SyntaxNode nested = unwrap(alternative);
            if ("if_statement".equals(nested.getType())) {
                elseBranch = Collections.singletonList(convert(nested));
            } else {
                elseBranch = visitBody(alternative);
            }
        }
        return new IfNode(location(node), expression(node, "condition"), thenBranch, elseBranch);
    }

    /**
     * 取出 statement 包装内的实际语句
     */
    private static SyntaxNode unwrap(SyntaxNode node) {
        if (!"statement".equals(node.getType())) {
            return node;
        }
        List<SyntaxNode> named = node.getNamedChildren();
        return named.isEmpty() ? node : named.get(named.size() - 1);
    }
}
