package com.scadlang.ide;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstNodes;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.decl.AssignmentStatement;
import com.scadlang.compiler.ast.decl.FunctionDefinition;
import com.scadlang.compiler.ast.decl.ModuleDefinition;
import com.scadlang.compiler.ast.decl.ModuleParameter;
import com.scadlang.compiler.ast.expr.Identifier;
import com.scadlang.compiler.ast.expr.Literal;
import com.scadlang.compiler.ast.expr.Variable;
import com.scadlang.compiler.ast.stmt.InstantiationNode;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 符号提取
 *
 * <p>收集模块、函数及其形参，以及赋值语句（字面量值视为常量）。
 * 嵌套在模块体内的定义记录所属模块名作为作用域。</p>
 */
public class SymbolProvider {
    private static final Logger LOG = Logger.getLogger(SymbolProvider.class.getName());

    /**
     * 文档中定义的全部符号，按源码顺序
     */
    public List<SymbolInfo> getSymbols(List<AstNode> ast) {
        List<SymbolInfo> symbols = new ArrayList<>();
        if (ast == null) {
            return symbols;
        }
        for (AstNode node : ast) {
            collect(node, null, symbols);
        }
        LOG.fine("提取符号 " + symbols.size() + " 个");
        return symbols;
    }

    private void collect(AstNode node, String scope, List<SymbolInfo> symbols) {
        if (node == null || node.getKind().getFamily() == NodeKind.Family.EXPRESSION) {
            return;
        }
        if (node instanceof ModuleDefinition) {
            ModuleDefinition module = (ModuleDefinition) node;
            if (module.getName().isEmpty()) return;
            symbols.add(new SymbolInfo(module.getName(), SymbolKind.MODULE, module.getLocation(),
                    module.getNameLocation(), parameterTexts(module.getParameters()), scope));
            addParameters(module.getParameters(), module.getName(), symbols);
            for (AstNode child : module.getBody()) {
                collect(child, module.getName(), symbols);
            }
            return;
        }
        if (node instanceof FunctionDefinition) {
            FunctionDefinition function = (FunctionDefinition) node;
            if (function.getName().isEmpty()) return;
            symbols.add(new SymbolInfo(function.getName(), SymbolKind.FUNCTION, function.getLocation(),
                    function.getNameLocation(), parameterTexts(function.getParameters()), scope));
            addParameters(function.getParameters(), function.getName(), symbols);
            return;
        }
        if (node instanceof AssignmentStatement) {
            AssignmentStatement assignment = (AssignmentStatement) node;
            if (assignment.getName().isEmpty()) return;
            SymbolKind kind = assignment.getValue() instanceof Literal ? SymbolKind.CONSTANT : SymbolKind.VARIABLE;
            symbols.add(new SymbolInfo(assignment.getName(), kind, assignment.getLocation(),
                    assignment.getNameLocation(), null, scope));
            return;
        }
        // 控制结构、实例化的子语句中也可能出现定义
        for (AstNode child : AstNodes.children(node)) {
            collect(child, scope, symbols);
        }
    }

    private void addParameters(List<ModuleParameter> parameters, String owner, List<SymbolInfo> symbols) {
        for (ModuleParameter parameter : parameters) {
            symbols.add(new SymbolInfo(parameter.getName(), SymbolKind.PARAMETER, parameter.getLocation(),
                    parameter.getLocation(), null, owner));
        }
    }

    static List<String> parameterTexts(List<ModuleParameter> parameters) {
        List<String> texts = new ArrayList<>(parameters.size());
        for (ModuleParameter parameter : parameters) {
            texts.add(parameter.toString());
        }
        return texts;
    }

    /**
     * 位置处的符号：位于定义名上时返回该定义；位于引用（标识符、模块调用）上时解析到定义
     *
     * @return 找不到时返回 null
     */
    public SymbolInfo getSymbolAtPosition(List<AstNode> ast, Position position) {
        List<SymbolInfo> symbols = getSymbols(ast);
        SymbolInfo best = null;
        for (SymbolInfo symbol : symbols) {
            if (symbol.getNameLocation().contains(position)
                    && (best == null || symbol.getNameLocation().getLength() < best.getNameLocation().getLength())) {
                best = symbol;
            }
        }
        if (best != null) {
            return best;
        }

        AstNode node = new PositionUtilities(this).findNodeAt(ast, position);
        if (node instanceof Identifier) {
            return resolve(symbols, ((Identifier) node).getName(), position, false);
        }
        if (node instanceof Variable) {
            return resolve(symbols, ((Variable) node).getName(), position, false);
        }
        if (node instanceof InstantiationNode) {
            return resolve(symbols, ((InstantiationNode) node).getName(), position, true);
        }
        return null;
    }

    /**
     * 按名字解析引用：所在定义的形参与局部符号优先于顶层符号
     */
    SymbolInfo resolve(List<SymbolInfo> symbols, String name, Position position, boolean moduleOnly) {
        SymbolInfo topLevel = null;
        for (SymbolInfo symbol : symbols) {
            if (!symbol.getName().equals(name)) continue;
            if (moduleOnly && symbol.getKind() != SymbolKind.MODULE) continue;
            if (symbol.isTopLevel()) {
                if (topLevel == null) topLevel = symbol;
            } else if (scopeContains(symbols, symbol.getScope(), position)) {
                return symbol;
            }
        }
        return topLevel;
    }

    private boolean scopeContains(List<SymbolInfo> symbols, String scope, Position position) {
        for (SymbolInfo symbol : symbols) {
            if (symbol.getName().equals(scope)
                    && (symbol.getKind() == SymbolKind.MODULE || symbol.getKind() == SymbolKind.FUNCTION)) {
                Location location = symbol.getLocation();
                if (location.contains(position)) {
                    return true;
                }
            }
        }
        return false;
    }
}
