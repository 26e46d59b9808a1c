package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;

import java.util.List;

/**
 * 用户模块或未特化内置模块的实例化
 */
public class ModuleInstantiation extends InstantiationNode {

    public ModuleInstantiation(Location location, String name, List<Parameter> args,
                               List<AstNode> children, String modifier) {
        super(location, name, args, children, modifier);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MODULE_INSTANTIATION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModuleInstantiation(this, context);
    }
}
