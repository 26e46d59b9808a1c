package com.scadlang.ide;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstNodes;
import com.scadlang.compiler.ast.ErrorNode;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.decl.AssignmentStatement;
import com.scadlang.compiler.ast.decl.FunctionDefinition;
import com.scadlang.compiler.ast.decl.ModuleDefinition;
import com.scadlang.compiler.ast.expr.CallExpr;
import com.scadlang.compiler.ast.expr.LetExpr;
import com.scadlang.compiler.ast.expr.ListComprehension;
import com.scadlang.compiler.ast.stmt.Assign;
import com.scadlang.compiler.ast.stmt.Assignment;
import com.scadlang.compiler.ast.stmt.ForLoop;
import com.scadlang.compiler.ast.stmt.ForLoopVariable;
import com.scadlang.compiler.ast.stmt.InstantiationNode;
import com.scadlang.compiler.ast.stmt.Let;
import com.scadlang.compiler.ast.stmt.Parameter;
import com.scadlang.compiler.visitor.BuiltinModules;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 基于位置的 AST 查询
 *
 * <p>位置按行列比较，区间起点含、终点不含。补全查询额外接受落在节点末尾的光标。</p>
 */
public class PositionUtilities {

    private final SymbolProvider symbolProvider;

    public PositionUtilities() {
        this(new SymbolProvider());
    }

    public PositionUtilities(SymbolProvider symbolProvider) {
        this.symbolProvider = symbolProvider;
    }

    /**
     * 包含位置的最内层节点
     *
     * @return 没有节点包含该位置时返回 null
     */
    public AstNode findNodeAt(List<AstNode> ast, Position position) {
        List<AstNode> chain = findNodesContaining(ast, position);
        return chain.isEmpty() ? null : chain.get(chain.size() - 1);
    }

    /**
     * 包含位置的全部节点，由外到内
     */
    public List<AstNode> findNodesContaining(List<AstNode> ast, Position position) {
        List<AstNode> result = new ArrayList<>();
        if (ast != null) {
            search(ast, position, false, result);
        }
        return result;
    }

    public static boolean isPositionInRange(Position position, Location range) {
        return range.contains(position);
    }

    private static boolean touches(Position position, Location range, boolean inclusiveEnd) {
        if (range.contains(position)) {
            return true;
        }
        return inclusiveEnd && position.compareTo(range.getStart()) >= 0 && position.compareTo(range.getEnd()) == 0;
    }

    private static void search(List<AstNode> nodes, Position position, boolean inclusiveEnd, List<AstNode> result) {
        for (AstNode node : nodes) {
            if (node != null && touches(position, node.getLocation(), inclusiveEnd)) {
                result.add(node);
                search(AstNodes.children(node), position, inclusiveEnd, result);
                return;
            }
        }
    }

    /**
     * 位置处的补全上下文：语法位置、可见符号，以及位于调用实参中时的实参序号与期望类型
     */
    public CompletionContext getCompletionContext(List<AstNode> ast, Position position) {
        List<AstNode> chain = new ArrayList<>();
        if (ast != null) {
            search(ast, position, true, chain);
        }
        List<SymbolInfo> visible = visibleSymbols(ast, chain, position);
        if (chain.isEmpty()) {
            return new CompletionContext(CompletionContext.Type.STATEMENT, visible, null, null, null, null);
        }

        int last = chain.size() - 1;
        AstNode target = chain.get(last);
        AstNode parent = last > 0 ? chain.get(last - 1) : null;
        if (target instanceof ErrorNode) {
            return new CompletionContext(CompletionContext.Type.UNKNOWN, visible, null, null, target, parent);
        }

        for (int i = last; i >= 0; i--) {
            AstNode node = chain.get(i);
            if (node instanceof CallExpr) {
                CallExpr call = (CallExpr) node;
                if (touches(position, call.getCallee().getLocation(), true)) {
                    return new CompletionContext(CompletionContext.Type.FUNCTION_CALL, visible, null, null, target, parent);
                }
                int index = argumentIndex(call.getArgs(), position);
                return new CompletionContext(CompletionContext.Type.PARAMETER, visible, index, null, target, parent);
            }
            if (node instanceof InstantiationNode) {
                return instantiationContext((InstantiationNode) node, position, visible, target, parent);
            }
            if (node.getKind().getFamily() != NodeKind.Family.EXPRESSION) {
                if (i != last) {
                    return new CompletionContext(CompletionContext.Type.EXPRESSION, visible, null, null, target, parent);
                }
                CompletionContext.Type type = isAssignment(node)
                        ? CompletionContext.Type.ASSIGNMENT : CompletionContext.Type.STATEMENT;
                return new CompletionContext(type, visible, null, null, target, parent);
            }
        }
        return new CompletionContext(CompletionContext.Type.EXPRESSION, visible, null, null, target, parent);
    }

    private static boolean isAssignment(AstNode node) {
        return node instanceof AssignmentStatement || node instanceof Assign || node instanceof Let;
    }

    private CompletionContext instantiationContext(InstantiationNode node, Position position,
                                                   List<SymbolInfo> visible, AstNode target, AstNode parent) {
        int nameEnd = node.getLocation().getStart().getOffset() + node.getName().length()
                + (node.getModifier() == null ? 0 : node.getModifier().length());
        if (position.getOffset() <= nameEnd) {
            return new CompletionContext(CompletionContext.Type.MODULE_CALL, visible, null, null, target, parent);
        }
        List<AstNode> children = node.getChildren();
        if (position.getOffset() >= node.getLocation().getEnd().getOffset()
                || (!children.isEmpty() && position.compareTo(children.get(0).getLocation().getStart()) >= 0)) {
            return new CompletionContext(CompletionContext.Type.STATEMENT, visible, null, null, target, parent);
        }
        int index = argumentIndex(node.getArgs(), position);
        return new CompletionContext(CompletionContext.Type.PARAMETER, visible, index,
                expectedType(node, index), target, parent);
    }

    /**
     * 光标所在实参的序号；位于实参之间时为下一个实参的序号
     */
    private static int argumentIndex(List<Parameter> args, Position position) {
        int index = 0;
        for (Parameter arg : args) {
            if (touches(position, arg.getLocation(), true)) {
                return index;
            }
            if (arg.getLocation().getEnd().compareTo(position) <= 0) {
                index++;
            }
        }
        return index;
    }

    private static String expectedType(InstantiationNode node, int index) {
        BuiltinModules.Signature signature = BuiltinModules.getSignature(node.getName());
        if (signature == null) {
            return null;
        }
        String parameterName = null;
        if (index < node.getArgs().size() && node.getArgs().get(index).isNamed()) {
            parameterName = node.getArgs().get(index).getName();
        } else if (index < signature.getParameters().size()) {
            parameterName = signature.getParameters().get(index).getName();
        }
        Set<String> accepted = parameterName == null ? null : signature.getAcceptedTypes(parameterName);
        return accepted == null || accepted.isEmpty() ? null : accepted.iterator().next();
    }

    /**
     * 位置可见的符号：顶层符号、外围定义的形参，以及外围 for / let 引入的局部变量
     */
    private List<SymbolInfo> visibleSymbols(List<AstNode> ast, List<AstNode> chain, Position position) {
        List<SymbolInfo> all = symbolProvider.getSymbols(ast);
        List<String> scopes = new ArrayList<>();
        for (AstNode node : chain) {
            if (node instanceof ModuleDefinition) {
                scopes.add(((ModuleDefinition) node).getName());
            } else if (node instanceof FunctionDefinition) {
                scopes.add(((FunctionDefinition) node).getName());
            }
        }

        List<SymbolInfo> visible = new ArrayList<>();
        for (SymbolInfo symbol : all) {
            if (symbol.isTopLevel() || scopes.contains(symbol.getScope())) {
                visible.add(symbol);
            }
        }
        String innermostScope = scopes.isEmpty() ? null : scopes.get(scopes.size() - 1);
        for (AstNode node : chain) {
            if (node instanceof ForLoop) {
                for (ForLoopVariable variable : ((ForLoop) node).getVariables()) {
                    addLocal(visible, variable.getName(), variable.getLocation(), innermostScope);
                }
            } else if (node instanceof ListComprehension) {
                for (ForLoopVariable variable : ((ListComprehension) node).getForClauses()) {
                    addLocal(visible, variable.getName(), variable.getLocation(), innermostScope);
                }
            } else if (node instanceof Let) {
                for (String name : ((Let) node).getAssignments().keySet()) {
                    addLocal(visible, name, node.getLocation(), innermostScope);
                }
            } else if (node instanceof LetExpr) {
                for (String name : ((LetExpr) node).getAssignments().keySet()) {
                    addLocal(visible, name, node.getLocation(), innermostScope);
                }
            } else if (node instanceof Assign) {
                for (Assignment assignment : ((Assign) node).getAssignments()) {
                    addLocal(visible, assignment.getVariable(), assignment.getLocation(), innermostScope);
                }
            }
        }
        return visible;
    }

    private static void addLocal(List<SymbolInfo> visible, String name, Location location, String scope) {
        if (name == null || name.isEmpty()) {
            return;
        }
        visible.add(new SymbolInfo(name, SymbolKind.VARIABLE, location, location, null, scope));
    }
}
