package com.scadlang.compiler.visitor;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.decl.AssignmentStatement;
import com.scadlang.compiler.ast.decl.IncludeStatement;
import com.scadlang.compiler.ast.decl.UseStatement;
import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.ast.expr.Literal;
import com.scadlang.compiler.ast.stmt.AssertStatement;
import com.scadlang.compiler.ast.stmt.EchoStatement;
import com.scadlang.compiler.ast.stmt.Parameter;
import com.scadlang.compiler.diagnostic.ErrorCode;
import com.scadlang.compiler.extract.ExpressionReconstructor;
import com.scadlang.cst.SyntaxNode;

import java.util.List;

/**
 * 赋值、include / use、echo 与 assert 语句
 */
public class SimpleStatementVisitor extends AbstractStatementVisitor {

    public SimpleStatementVisitor(AstBuildContext context) {
        super(context, "assignment_statement", "include_statement", "use_statement",
                "echo_statement", "assert_statement");
    }

    @Override
    protected AstNode convert(SyntaxNode node) {
        switch (node.getType()) {
            case "assignment_statement":
                return assignment(node);
            case "include_statement":
            case "use_statement":
                return fileReference(node);
            case "echo_statement":
                return new EchoStatement(location(node), arguments(node),
                        visitBody(node.getChildForFieldName("body")));
            default:
                return assertion(node);
        }
    }

    private AstNode assignment(SyntaxNode node) {
        SyntaxNode name = node.getChildForFieldName("name");
        if (isAbsent(name)) {
            return missingField(node, "Missing variable name", ErrorCode.MISSING_NAME);
        }
        return new AssignmentStatement(location(node), name.getText(), location(name), expression(node, "value"));
    }

    private AstNode fileReference(SyntaxNode node) {
        SyntaxNode path = node.getChildForFieldName("path");
        if (isAbsent(path)) {
            return missingField(node, "Missing file path", ErrorCode.MISSING_FIELD);
        }
        String text = path.getText();
        if (text.startsWith("<") && text.endsWith(">") && text.length() >= 2) {
            text = text.substring(1, text.length() - 1);
        }
        if ("include_statement".equals(node.getType())) {
            return new IncludeStatement(location(node), text);
        }
        return new UseStatement(location(node), text);
    }

    private AstNode assertion(SyntaxNode node) {
        List<Parameter> args = arguments(node);
        Expression condition = ExpressionReconstructor.argument(args, "condition", 0);
        if (condition == null) {
            condition = new Literal(location(node), Literal.LiteralKind.UNDEF, null);
        }
        return new AssertStatement(location(node), condition, ExpressionReconstructor.argument(args, "message", 1),
                visitBody(node.getChildForFieldName("body")));
    }

    private List<Parameter> arguments(SyntaxNode node) {
        return context.getParameterExtractor().extractArguments(node.getChildForFieldName("arguments"));
    }
}
