package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.stmt.Parameter;

import java.util.Collections;
import java.util.List;

/**
 * 表达式位置的 echo：{@code echo("x") expr}
 */
public class EchoExpr extends Expression {
    private final List<Parameter> args;
    private final Expression body;

    public EchoExpr(Location location, List<Parameter> args, Expression body) {
        super(location);
        this.args = Collections.unmodifiableList(args);
        this.body = body;
    }

    public List<Parameter> getArgs() {
        return args;
    }

    /** 可为 null */
    public Expression getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ECHO_EXPRESSION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEchoExpr(this, context);
    }
}
