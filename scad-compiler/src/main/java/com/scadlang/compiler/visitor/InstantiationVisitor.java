package com.scadlang.compiler.visitor;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.stmt.Parameter;
import com.scadlang.compiler.diagnostic.ErrorCode;
import com.scadlang.cst.SyntaxNode;

import java.util.List;

/**
 * 模块实例化；内置变换、图元与 CSG 运算按名字特化
 */
public class InstantiationVisitor extends AbstractStatementVisitor {

    private final BuiltinModules builtins;

    public InstantiationVisitor(AstBuildContext context) {
        super(context, "module_instantiation");
        this.builtins = new BuiltinModules(context.getBinder());
    }

    @Override
    protected AstNode convert(SyntaxNode node) {
        SyntaxNode name = node.getChildForFieldName("name");
        if (isAbsent(name)) {
            return missingField(node, "Missing module name", ErrorCode.MISSING_NAME);
        }
        List<Parameter> args = context.getParameterExtractor().extractArguments(node.getChildForFieldName("arguments"));
        List<AstNode> children = visitBody(node.getChildForFieldName("body"));
        return builtins.instantiate(name.getText(), location(node), args, children, modifier(node));
    }

    /**
     * 修饰符 {@code # ! % *}，多个时按源码顺序拼接
     */
    private static String modifier(SyntaxNode node) {
        StringBuilder sb = null;
        for (SyntaxNode child : node.getChildren()) {
            if ("modifier".equals(node.getFieldName(child))) {
                if (sb == null) sb = new StringBuilder();
                sb.append(child.getText());
            }
        }
        return sb == null ? null : sb.toString();
    }
}
