package com.scadlang.compiler.ast.decl;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;

import java.util.Collections;
import java.util.List;

/**
 * 模块定义 {@code module name(params) { body }}
 */
public class ModuleDefinition extends AstNode {
    private final String name;
    private final Location nameLocation;
    private final List<ModuleParameter> parameters;
    private final List<AstNode> body;

    public ModuleDefinition(Location location, String name, Location nameLocation,
                            List<ModuleParameter> parameters, List<AstNode> body) {
        super(location);
        this.name = name;
        this.nameLocation = nameLocation;
        this.parameters = Collections.unmodifiableList(parameters);
        this.body = Collections.unmodifiableList(body);
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

    public List<AstNode> getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MODULE_DEFINITION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModuleDefinition(this, context);
    }
}
