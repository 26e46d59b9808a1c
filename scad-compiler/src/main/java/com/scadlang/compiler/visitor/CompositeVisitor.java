package com.scadlang.compiler.visitor;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.ErrorNode;
import com.scadlang.compiler.diagnostic.ErrorCode;
import com.scadlang.compiler.extract.LocationUtils;
import com.scadlang.cst.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 按注册顺序依次尝试各访问者，第一个返回非 null 的结果生效
 *
 * <p>顺序决定了类型的归属：更具体的访问者必须排在通用访问者之前。</p>
 */
public class CompositeVisitor implements StatementVisitor {

    private final AstBuildContext context;
    private final List<StatementVisitor> visitors = new ArrayList<>();

    public CompositeVisitor(AstBuildContext context) {
        this.context = context;
        context.setDispatcher(this);
    }

    /**
     * 默认访问者链：定义、实例化、控制结构、assign、简单语句
     */
    public static CompositeVisitor createDefault(AstBuildContext context) {
        CompositeVisitor composite = new CompositeVisitor(context);
        composite.addVisitor(new ModuleVisitor(context));
        composite.addVisitor(new InstantiationVisitor(context));
        composite.addVisitor(new ControlStructureVisitor(context));
        composite.addVisitor(new AssignStatementVisitor(context));
        composite.addVisitor(new SimpleStatementVisitor(context));
        return composite;
    }

    public CompositeVisitor addVisitor(StatementVisitor visitor) {
        visitors.add(visitor);
        return this;
    }

    public List<StatementVisitor> getVisitors() {
        return Collections.unmodifiableList(visitors);
    }

    @Override
    public Set<String> getClaimedTypes() {
        Set<String> types = new LinkedHashSet<>();
        for (StatementVisitor visitor : visitors) {
            types.addAll(visitor.getClaimedTypes());
        }
        return types;
    }

    @Override
    public AstNode visitStatement(SyntaxNode node) {
        return dispatch(node);
    }

    /**
     * 分发单个 CST 节点
     *
     * @return AST 节点；没有访问者认领时记录警告并返回 null
     */
    public AstNode dispatch(SyntaxNode node) {
        if (node == null) {
            return null;
        }
        if ("statement".equals(node.getType())) {
            SyntaxNode inner = unwrap(node);
            return inner != null ? dispatch(inner) : null;
        }
        if (node.isError() || node.isMissing()) {
            // 已由语法诊断报告
            return new ErrorNode(LocationUtils.getLocation(node), "Invalid statement", ErrorCode.SYNTAX_ERROR,
                    node.getType(), node.getText());
        }
        for (StatementVisitor visitor : visitors) {
            AstNode result = visitor.visitStatement(node);
            if (result != null) {
                return result;
            }
        }
        context.getDiagnostics().warning(ErrorCode.UNHANDLED_CONSTRUCT,
                "Unhandled construct '" + node.getType() + "'", LocationUtils.getLocation(node));
        return null;
    }

    /**
     * 分发语句序列：源文件、块与包装块的语句展开为其中的各条语句，空语句不产生节点
     */
    public List<AstNode> dispatchAll(SyntaxNode node) {
        List<AstNode> result = new ArrayList<>();
        collect(node, result);
        return result;
    }

    private void collect(SyntaxNode node, List<AstNode> out) {
        if (node == null || ";".equals(node.getType())) {
            return;
        }
        SyntaxNode target = "statement".equals(node.getType()) ? unwrap(node) : node;
        if (target == null) {
            return;
        }
        if (("block".equals(target.getType()) || "source_file".equals(target.getType())) && !target.isMissing()) {
            for (SyntaxNode child : target.getNamedChildren()) {
                collect(child, out);
            }
            return;
        }
        AstNode converted = dispatch(target);
        if (converted != null) {
            out.add(converted);
        }
    }

    /**
     * statement 包装中修饰符之后的实际语句
     */
    private static SyntaxNode unwrap(SyntaxNode statement) {
        SyntaxNode inner = null;
        for (SyntaxNode child : statement.getNamedChildren()) {
            if (!"modifier".equals(child.getType())) {
                inner = child;
            }
        }
        return inner;
    }
}
