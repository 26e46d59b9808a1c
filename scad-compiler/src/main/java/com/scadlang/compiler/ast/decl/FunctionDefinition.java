package com.scadlang.compiler.ast.decl;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * 函数定义 {@code function name(params) = expr;}
 */
public class FunctionDefinition extends AstNode {
    private final String name;
    private final Location nameLocation;
    private final List<ModuleParameter> parameters;
    private final Expression valueExpr;

    public FunctionDefinition(Location location, String name, Location nameLocation,
                              List<ModuleParameter> parameters, Expression valueExpr) {
        super(location);
        this.name = name;
        this.nameLocation = nameLocation;
        this.parameters = Collections.unmodifiableList(parameters);
        this.valueExpr = valueExpr;
    }

    public String getName() {
        return name;
    }

    public Location getNameLocation() {
        return nameLocation;
    }

    public List<ModuleParameter> getParameters() {
        return parameters;
    }

    public Expression getValueExpr() {
        return valueExpr;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION_DEFINITION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDefinition(this, context);
    }
}
