package com.scadlang.compiler.extract;

import com.scadlang.compiler.ast.decl.ModuleParameter;
import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.ast.stmt.Parameter;
import com.scadlang.compiler.diagnostic.DiagnosticCollector;
import com.scadlang.compiler.diagnostic.ErrorCode;
import com.scadlang.cst.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 形参声明与调用实参的提取
 *
 * <p>同时接受带字段的 {@code parameter_declaration} / {@code argument} 节点，
 * 以及直接出现在列表中的标识符或表达式。尾随逗号不产生元素。</p>
 */
public class ParameterExtractor {

    private final ExpressionReconstructor reconstructor;
    private final DiagnosticCollector diagnostics;

    ParameterExtractor(ExpressionReconstructor reconstructor, DiagnosticCollector diagnostics) {
        this.reconstructor = reconstructor;
        this.diagnostics = diagnostics;
    }

    /**
     * 提取形参列表，保持声明顺序
     */
    public List<ModuleParameter> extractParameters(SyntaxNode parameterList) {
        if (parameterList == null || parameterList.isMissing()) {
            return Collections.emptyList();
        }
        List<ModuleParameter> parameters = new ArrayList<>();
        for (SyntaxNode item : listItems(parameterList, "parameter_declarations")) {
            switch (item.getType()) {
                case "parameter_declaration": {
                    SyntaxNode name = item.getChildForFieldName("name");
                    if (name == null || name.isMissing()) {
                        continue;
                    }
                    SyntaxNode value = item.getChildForFieldName("value");
                    parameters.add(new ModuleParameter(name.getText(),
                            value != null ? reconstructor.reconstruct(value) : null,
                            LocationUtils.getLocation(item)));
                    break;
                }
                case "identifier":
                case "special_variable":
                    parameters.add(new ModuleParameter(item.getText(), null, LocationUtils.getLocation(item)));
                    break;
                case SyntaxNode.ERROR:
                    // 已由语法诊断报告
                    break;
                default:
                    diagnostics.warning(ErrorCode.UNHANDLED_CONSTRUCT,
                            "Unsupported parameter '" + item.getType() + "'", LocationUtils.getLocation(item));
                    break;
            }
        }
        return parameters;
    }

    /**
     * 提取调用实参，保持源码顺序
     */
    public List<Parameter> extractArguments(SyntaxNode argumentList) {
        if (argumentList == null || argumentList.isMissing()) {
            return Collections.emptyList();
        }
        List<Parameter> arguments = new ArrayList<>();
        for (SyntaxNode item : listItems(argumentList, "arguments")) {
            if (item.isError()) {
                continue;
            }
            if ("argument".equals(item.getType())) {
                SyntaxNode name = item.getChildForFieldName("name");
                Expression value = reconstructor.reconstruct(item.getChildForFieldName("value"), item);
                arguments.add(new Parameter(name != null ? name.getText() : null, value,
                        LocationUtils.getLocation(item)));
            } else {
                arguments.add(new Parameter(null, reconstructor.reconstruct(item), LocationUtils.getLocation(item)));
            }
        }
        return arguments;
    }

    /**
     * 列表元素：优先取包装节点（arguments / parameter_declarations）下的具名子节点
     */
    private static List<SyntaxNode> listItems(SyntaxNode list, String wrapperType) {
        for (SyntaxNode child : list.getNamedChildren()) {
            if (wrapperType.equals(child.getType())) {
                return child.getNamedChildren();
            }
        }
        return list.getNamedChildren();
    }
}
