package com.scadlang.compiler.visitor;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.decl.FunctionDefinition;
import com.scadlang.compiler.ast.decl.ModuleDefinition;
import com.scadlang.compiler.ast.decl.ModuleParameter;
import com.scadlang.compiler.diagnostic.ErrorCode;
import com.scadlang.cst.SyntaxNode;

import java.util.List;

/**
 * 模块与函数定义
 *
 * <p>只认领定义节点；模块实例化交给 {@link InstantiationVisitor}。</p>
 */
public class ModuleVisitor extends AbstractStatementVisitor {

    public ModuleVisitor(AstBuildContext context) {
        super(context, "module_definition", "function_definition");
    }

    @Override
    protected AstNode convert(SyntaxNode node) {
        SyntaxNode name = node.getChildForFieldName("name");
        if (isAbsent(name)) {
            return missingField(node, "Missing name in definition", ErrorCode.MISSING_NAME);
        }
        List<ModuleParameter> parameters =
                context.getParameterExtractor().extractParameters(node.getChildForFieldName("parameters"));

        if ("function_definition".equals(node.getType())) {
            return new FunctionDefinition(location(node), name.getText(), location(name), parameters,
                    expression(node, "value"));
        }

        SyntaxNode body = node.getChildForFieldName("body");
        if (isAbsent(body)) {
            return missingField(node, "Missing module body", ErrorCode.MISSING_FIELD);
        }
        return new ModuleDefinition(location(node), name.getText(), location(name), parameters, visitBody(body));
    }
}
