package com.scadlang.compiler.visitor;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.expr.Each;
import com.scadlang.compiler.ast.stmt.Let;
import com.scadlang.cst.SyntaxNode;

import java.util.Arrays;
import java.util.List;

/**
 * 控制结构：if 与 for 交给组合的子访问者，let 与 each 在此转换
 */
public class ControlStructureVisitor extends AbstractStatementVisitor {

    private final List<StatementVisitor> delegates;

    public ControlStructureVisitor(AstBuildContext context) {
        super(context, "if_statement", "for_statement", "let_expression", "each_statement");
        this.delegates = Arrays.<StatementVisitor>asList(new IfElseVisitor(context), new ForLoopVisitor(context));
    }

    @Override
    protected AstNode convert(SyntaxNode node) {
        for (StatementVisitor delegate : delegates) {
            AstNode result = delegate.visitStatement(node);
            if (result != null) {
                return result;
            }
        }
        if ("let_expression".equals(node.getType())) {
            return new Let(location(node), context.getReconstructor().extractLetAssignments(node),
                    visitBody(node.getChildForFieldName("body")));
        }
        return new Each(location(node), expression(node, "value"));
    }
}
