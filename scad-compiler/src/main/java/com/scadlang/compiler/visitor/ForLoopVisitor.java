package com.scadlang.compiler.visitor;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.stmt.ForLoop;
import com.scadlang.compiler.ast.stmt.ForLoopVariable;
import com.scadlang.compiler.diagnostic.ErrorCode;
import com.scadlang.cst.SyntaxNode;

import java.util.List;

/**
 * for 循环；{@code for (i = a, j = b)} 的每个子句对应一个循环变量，共享同一个主体
 */
public class ForLoopVisitor extends AbstractStatementVisitor {

    public ForLoopVisitor(AstBuildContext context) {
        super(context, "for_statement");
    }

    @Override
    protected AstNode convert(SyntaxNode node) {
        List<ForLoopVariable> variables = context.getReconstructor().extractForClauses(node);
        if (variables.isEmpty()) {
            return missingField(node, "Missing loop variable", ErrorCode.MISSING_FIELD);
        }
        return new ForLoop(location(node), variables, visitBody(node.getChildForFieldName("body")));
    }
}
