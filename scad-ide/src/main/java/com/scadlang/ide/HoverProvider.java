package com.scadlang.ide;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.ast.expr.CallExpr;
import com.scadlang.compiler.ast.expr.Identifier;
import com.scadlang.compiler.ast.stmt.InstantiationNode;
import com.scadlang.compiler.visitor.BuiltinModules;

import java.util.List;
import java.util.Locale;

/**
 * 悬停提示
 *
 * <p>先解析到用户定义的符号；模块调用解析不到时查内置模块签名。</p>
 */
public class HoverProvider {

    private final SymbolProvider symbolProvider;
    private final PositionUtilities positions;

    public HoverProvider() {
        this(new SymbolProvider());
    }

    public HoverProvider(SymbolProvider symbolProvider) {
        this.symbolProvider = symbolProvider;
        this.positions = new PositionUtilities(symbolProvider);
    }

    /**
     * @return 位置上没有任何节点时返回 null
     */
    public HoverInfo hover(List<AstNode> ast, Position position) {
        List<AstNode> chain = positions.findNodesContaining(ast, position);
        if (chain.isEmpty()) {
            return null;
        }
        AstNode node = chain.get(chain.size() - 1);

        SymbolInfo symbol = symbolProvider.getSymbolAtPosition(ast, position);
        if (symbol != null) {
            return new HoverInfo(describe(symbol), symbol.getKind().getDisplayName(), node.getLocation(),
                    symbol.getScope() == null ? null : "defined in " + symbol.getScope());
        }

        if (node instanceof InstantiationNode) {
            BuiltinModules.Signature signature = BuiltinModules.getSignature(((InstantiationNode) node).getName());
            if (signature != null) {
                return new HoverInfo("builtin module " + signature.toDisplayString(), "module",
                        node.getLocation(), signature.getDescription());
            }
        }
        if (node instanceof Identifier && chain.size() > 1 && chain.get(chain.size() - 2) instanceof CallExpr) {
            return new HoverInfo("function " + ((Identifier) node).getName() + "(...)", "function",
                    node.getLocation(), null);
        }

        String kindName = node.getKind().name().toLowerCase(Locale.ROOT);
        String kind = node.getKind().getFamily() == NodeKind.Family.EXPRESSION ? "expression" : "statement";
        return new HoverInfo(kindName, kind, node.getLocation(), null);
    }

    static String describe(SymbolInfo symbol) {
        switch (symbol.getKind()) {
            case MODULE:
            case FUNCTION:
                return symbol.getKind().getDisplayName() + " " + symbol.getName()
                        + "(" + String.join(", ", symbol.getParameters()) + ")";
            default:
                return symbol.getKind().getDisplayName() + " " + symbol.getName();
        }
    }
}
