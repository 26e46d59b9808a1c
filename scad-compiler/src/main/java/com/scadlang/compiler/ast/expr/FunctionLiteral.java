package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.decl.ModuleParameter;

import java.util.Collections;
import java.util.List;

/**
 * 函数字面量 {@code function (x) x * 2}
 */
public class FunctionLiteral extends Expression {
    private final List<ModuleParameter> parameters;
    private final Expression body;

    public FunctionLiteral(Location location, List<ModuleParameter> parameters, Expression body) {
        super(location);
        this.parameters = Collections.unmodifiableList(parameters);
        this.body = body;
    }

    public List<ModuleParameter> getParameters() {
        return parameters;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION_LITERAL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionLiteral(this, context);
    }
}
