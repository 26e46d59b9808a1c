package com.scadlang.compiler.ast;

import com.scadlang.compiler.ast.decl.*;
import com.scadlang.compiler.ast.expr.*;
import com.scadlang.compiler.ast.geometry.*;
import com.scadlang.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST 通用工具
 */
public final class AstNodes {

    private static final ChildCollector CHILD_COLLECTOR = new ChildCollector();

    private AstNodes() {
    }

    /**
     * 节点的直接子节点（含形参默认值、实参值等表达式），按源码顺序
     */
    public static List<AstNode> children(AstNode node) {
        return node.accept(CHILD_COLLECTOR, null);
    }

    /**
     * 先序遍历整棵子树
     */
    public static void walk(AstNode node, java.util.function.Consumer<AstNode> action) {
        action.accept(node);
        for (AstNode child : children(node)) {
            walk(child, action);
        }
    }

    /**
     * 收集直接子节点的访问者
     */
    private static final class ChildCollector implements AstVisitor<List<AstNode>, Void> {

        private static List<AstNode> of(Object... parts) {
            List<AstNode> result = new ArrayList<>();
            for (Object part : parts) {
                add(result, part);
            }
            return result;
        }

        @SuppressWarnings("unchecked")
        private static void add(List<AstNode> result, Object part) {
            if (part == null) {
                return;
            }
            if (part instanceof AstNode) {
                result.add((AstNode) part);
            } else if (part instanceof ModuleParameter) {
                add(result, ((ModuleParameter) part).getDefaultValue());
            } else if (part instanceof Parameter) {
                add(result, ((Parameter) part).getValue());
            } else if (part instanceof ForLoopVariable) {
                add(result, ((ForLoopVariable) part).getRange());
            } else if (part instanceof Assignment) {
                add(result, ((Assignment) part).getValue());
            } else if (part instanceof Iterable) {
                for (Object item : (Iterable<Object>) part) {
                    add(result, item);
                }
            }
        }

        private static List<AstNode> instantiation(InstantiationNode node) {
            return of(node.getArgs(), node.getChildren());
        }

        @Override
        public List<AstNode> visitModuleDefinition(ModuleDefinition node, Void context) {
            return of(node.getParameters(), node.getBody());
        }

        @Override
        public List<AstNode> visitFunctionDefinition(FunctionDefinition node, Void context) {
            return of(node.getParameters(), node.getValueExpr());
        }

        @Override
        public List<AstNode> visitAssignmentStatement(AssignmentStatement node, Void context) {
            return of(node.getValue());
        }

        @Override
        public List<AstNode> visitIncludeStatement(IncludeStatement node, Void context) {
            return Collections.emptyList();
        }

        @Override
        public List<AstNode> visitUseStatement(UseStatement node, Void context) {
            return Collections.emptyList();
        }

        @Override
        public List<AstNode> visitModuleInstantiation(ModuleInstantiation node, Void context) {
            return instantiation(node);
        }

        @Override
        public List<AstNode> visitTranslate(Translate node, Void context) {
            return instantiation(node);
        }

        @Override
        public List<AstNode> visitRotate(Rotate node, Void context) {
            return instantiation(node);
        }

        @Override
        public List<AstNode> visitScale(Scale node, Void context) {
            return instantiation(node);
        }

        @Override
        public List<AstNode> visitMirror(Mirror node, Void context) {
            return instantiation(node);
        }

        @Override
        public List<AstNode> visitMultmatrix(Multmatrix node, Void context) {
            return instantiation(node);
        }

        @Override
        public List<AstNode> visitColor(Color node, Void context) {
            return instantiation(node);
        }

        @Override
        public List<AstNode> visitOffset(Offset node, Void context) {
            return instantiation(node);
        }

        @Override
        public List<AstNode> visitCube(Cube node, Void context) {
            return instantiation(node);
        }

        @Override
        public List<AstNode> visitSphere(Sphere node, Void context) {
            return instantiation(node);
        }

        @Override
        public List<AstNode> visitCylinder(Cylinder node, Void context) {
            return instantiation(node);
        }

        @Override
        public List<AstNode> visitSquare(Square node, Void context) {
            return instantiation(node);
        }

        @Override
        public List<AstNode> visitCircle(Circle node, Void context) {
            return instantiation(node);
        }

        @Override
        public List<AstNode> visitCsgOperation(CsgOperation node, Void context) {
            return instantiation(node);
        }

        @Override
        public List<AstNode> visitIf(IfNode node, Void context) {
            return of(node.getCondition(), node.getThenBranch(), node.getElseBranch());
        }

        @Override
        public List<AstNode> visitForLoop(ForLoop node, Void context) {
            return of(node.getVariables(), node.getBody());
        }

        @Override
        public List<AstNode> visitLet(Let node, Void context) {
            return of(node.getAssignments().values(), node.getBody());
        }

        @Override
        public List<AstNode> visitEach(Each node, Void context) {
            return of(node.getExpression());
        }

        @Override
        public List<AstNode> visitAssign(Assign node, Void context) {
            return of(node.getAssignments(), node.getBody());
        }

        @Override
        public List<AstNode> visitEchoStatement(EchoStatement node, Void context) {
            return of(node.getArgs(), node.getChildren());
        }

        @Override
        public List<AstNode> visitAssertStatement(AssertStatement node, Void context) {
            return of(node.getCondition(), node.getMessage(), node.getChildren());
        }

        @Override
        public List<AstNode> visitLiteral(Literal node, Void context) {
            return Collections.emptyList();
        }

        @Override
        public List<AstNode> visitIdentifier(Identifier node, Void context) {
            return Collections.emptyList();
        }

        @Override
        public List<AstNode> visitVariable(Variable node, Void context) {
            return Collections.emptyList();
        }

        @Override
        public List<AstNode> visitUnaryExpr(UnaryExpr node, Void context) {
            return of(node.getOperand());
        }

        @Override
        public List<AstNode> visitBinaryExpr(BinaryExpr node, Void context) {
            return of(node.getLeft(), node.getRight());
        }

        @Override
        public List<AstNode> visitConditionalExpr(ConditionalExpr node, Void context) {
            return of(node.getCondition(), node.getThenExpr(), node.getElseExpr());
        }

        @Override
        public List<AstNode> visitRangeExpr(RangeExpr node, Void context) {
            if (node.hasExplicitStep()) {
                return of(node.getStart(), node.getStep(), node.getEnd());
            }
            return of(node.getStart(), node.getEnd());
        }

        @Override
        public List<AstNode> visitVectorExpr(VectorExpr node, Void context) {
            return of(node.getElements());
        }

        @Override
        public List<AstNode> visitListComprehension(ListComprehension node, Void context) {
            return of(node.getForClauses(), node.getIfClause(), node.getElement());
        }

        @Override
        public List<AstNode> visitLetExpr(LetExpr node, Void context) {
            return of(node.getAssignments().values(), node.getBody());
        }

        @Override
        public List<AstNode> visitFunctionLiteral(FunctionLiteral node, Void context) {
            return of(node.getParameters(), node.getBody());
        }

        @Override
        public List<AstNode> visitCallExpr(CallExpr node, Void context) {
            return of(node.getCallee(), node.getArgs());
        }

        @Override
        public List<AstNode> visitIndexExpr(IndexExpr node, Void context) {
            return of(node.getArray(), node.getIndex());
        }

        @Override
        public List<AstNode> visitMemberExpr(MemberExpr node, Void context) {
            return of(node.getObject());
        }

        @Override
        public List<AstNode> visitEchoExpr(EchoExpr node, Void context) {
            return of(node.getArgs(), node.getBody());
        }

        @Override
        public List<AstNode> visitAssertExpr(AssertExpr node, Void context) {
            return of(node.getCondition(), node.getMessage(), node.getBody());
        }

        @Override
        public List<AstNode> visitErrorNode(ErrorNode node, Void context) {
            return Collections.emptyList();
        }
    }
}
