package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.stmt.Parameter;

import java.util.Collections;
import java.util.List;

/**
 * 函数调用表达式
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Parameter> args;

    public CallExpr(Location location, Expression callee, List<Parameter> args) {
        super(location);
        this.callee = callee;
        this.args = Collections.unmodifiableList(args);
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Parameter> getArgs() {
        return args;
    }

    /**
     * 被调用者为普通标识符时返回其名字，否则返回 null
     */
    public String getCalleeName() {
        return callee instanceof Identifier ? ((Identifier) callee).getName() : null;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CALL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }

    @Override
    public String toString() {
        return callee + "(" + args + ")";
    }
}
