package com.scadlang.compiler.visitor;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.ErrorNode;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.diagnostic.ErrorCode;
import com.scadlang.compiler.extract.LocationUtils;
import com.scadlang.cst.SyntaxNode;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 语句访问者基类：类型认领、主体展开与错误节点生成
 */
public abstract class AbstractStatementVisitor implements StatementVisitor {
    private static final Logger LOG = Logger.getLogger(AbstractStatementVisitor.class.getName());

    protected final AstBuildContext context;
    private final Set<String> claimedTypes;

    protected AbstractStatementVisitor(AstBuildContext context, String... claimedTypes) {
        this.context = context;
        this.claimedTypes = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(claimedTypes)));
    }

    @Override
    public Set<String> getClaimedTypes() {
        return claimedTypes;
    }

    @Override
    public final AstNode visitStatement(SyntaxNode node) {
        if (node == null || !claimedTypes.contains(node.getType())) {
            return null;
        }
        try {
            return convert(node);
        } catch (RuntimeException e) {
            // 内部缺陷降级为错误节点
            LOG.log(Level.WARNING, "转换 " + node.getType() + " 时发生内部错误", e);
            Location at = location(node);
            context.getDiagnostics().error(ErrorCode.INTERNAL_ERROR,
                    "Internal error while converting '" + node.getType() + "': " + e.getMessage(), at);
            return new ErrorNode(at, "Internal error", ErrorCode.INTERNAL_ERROR, node.getType(), node.getText());
        }
    }

    /**
     * 转换已认领的节点，返回具体 AST 节点或 {@link ErrorNode}
     */
    protected abstract AstNode convert(SyntaxNode node);

    // ============ 辅助方法 ============

    protected Location location(SyntaxNode node) {
        return LocationUtils.getLocation(node);
    }

    protected Expression expression(SyntaxNode node, String field) {
        return context.getReconstructor().reconstruct(node.getChildForFieldName(field), node);
    }

    /**
     * 语句主体（块、单条语句或空语句）展开为节点列表
     */
    protected List<AstNode> visitBody(SyntaxNode body) {
        if (body == null) {
            return Collections.emptyList();
        }
        return context.getDispatcher().dispatchAll(body);
    }

    /**
     * 必需字段缺失：整条语句降级为错误节点；CST 已经标出问题时不重复记录诊断
     */
    protected ErrorNode missingField(SyntaxNode node, String message, ErrorCode code) {
        Location at = location(node);
        if (!node.hasError()) {
            context.getDiagnostics().error(code, message, at);
        }
        return new ErrorNode(at, message, code, node.getType(), node.getText());
    }

    protected static boolean isAbsent(SyntaxNode node) {
        return node == null || node.isMissing() || node.isError();
    }
}
