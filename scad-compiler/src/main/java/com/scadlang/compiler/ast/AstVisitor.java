package com.scadlang.compiler.ast;

import com.scadlang.compiler.ast.decl.*;
import com.scadlang.compiler.ast.expr.*;
import com.scadlang.compiler.ast.geometry.*;
import com.scadlang.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>没有默认实现：新增节点种类时，所有访问者都必须补齐对应方法。</p>
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface AstVisitor<R, C> {

    // ============ 定义 ============

    R visitModuleDefinition(ModuleDefinition node, C context);

    R visitFunctionDefinition(FunctionDefinition node, C context);

    R visitAssignmentStatement(AssignmentStatement node, C context);

    R visitIncludeStatement(IncludeStatement node, C context);

    R visitUseStatement(UseStatement node, C context);

    // ============ 实例化 ============

    R visitModuleInstantiation(ModuleInstantiation node, C context);

    R visitTranslate(Translate node, C context);

    R visitRotate(Rotate node, C context);

    R visitScale(Scale node, C context);

    R visitMirror(Mirror node, C context);

    R visitMultmatrix(Multmatrix node, C context);

    R visitColor(Color node, C context);

    R visitOffset(Offset node, C context);

    R visitCube(Cube node, C context);

    R visitSphere(Sphere node, C context);

    R visitCylinder(Cylinder node, C context);

    R visitSquare(Square node, C context);

    R visitCircle(Circle node, C context);

    R visitCsgOperation(CsgOperation node, C context);

    // ============ 控制流 ============

    R visitIf(IfNode node, C context);

    R visitForLoop(ForLoop node, C context);

    R visitLet(Let node, C context);

    R visitEach(Each node, C context);

    R visitAssign(Assign node, C context);

    R visitEchoStatement(EchoStatement node, C context);

    R visitAssertStatement(AssertStatement node, C context);

    // ============ 表达式 ============

    R visitLiteral(Literal node, C context);

    R visitIdentifier(Identifier node, C context);

    R visitVariable(Variable node, C context);

    R visitUnaryExpr(UnaryExpr node, C context);

    R visitBinaryExpr(BinaryExpr node, C context);

    R visitConditionalExpr(ConditionalExpr node, C context);

    R visitRangeExpr(RangeExpr node, C context);

    R visitVectorExpr(VectorExpr node, C context);

    R visitListComprehension(ListComprehension node, C context);

    R visitLetExpr(LetExpr node, C context);

    R visitFunctionLiteral(FunctionLiteral node, C context);

    R visitCallExpr(CallExpr node, C context);

    R visitIndexExpr(IndexExpr node, C context);

    R visitMemberExpr(MemberExpr node, C context);

    R visitEchoExpr(EchoExpr node, C context);

    R visitAssertExpr(AssertExpr node, C context);

    // ============ 错误 ============

    R visitErrorNode(ErrorNode node, C context);
}
