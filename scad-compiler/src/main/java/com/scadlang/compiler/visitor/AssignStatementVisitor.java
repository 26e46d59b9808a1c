package com.scadlang.compiler.visitor;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.stmt.Assign;
import com.scadlang.compiler.ast.stmt.Assignment;
import com.scadlang.compiler.diagnostic.ErrorCode;
import com.scadlang.cst.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 已废弃的 assign 语句
 *
 * <p>缺少名字或值的子句跳过并给出警告，不影响其余子句。</p>
 */
public class AssignStatementVisitor extends AbstractStatementVisitor {

    public AssignStatementVisitor(AstBuildContext context) {
        super(context, "assign_statement");
    }

    @Override
    protected AstNode convert(SyntaxNode node) {
        List<Assignment> assignments = new ArrayList<>();
        for (SyntaxNode child : node.getNamedChildren()) {
            if (!"assign_assignment".equals(child.getType())) {
                continue;
            }
            SyntaxNode name = child.getChildForFieldName("name");
            SyntaxNode value = child.getChildForFieldName("value");
            if (isAbsent(name) || isAbsent(value)) {
                context.getDiagnostics().warning(ErrorCode.MISSING_FIELD,
                        "Incomplete assign clause skipped", location(child));
                continue;
            }
            assignments.add(new Assignment(name.getText(), context.getReconstructor().reconstruct(value),
                    location(child)));
        }
        return new Assign(location(node), assignments, visitBody(node.getChildForFieldName("body")));
    }
}
