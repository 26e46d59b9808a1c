package com.scadlang.compiler.ast.geometry;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.stmt.InstantiationNode;
import com.scadlang.compiler.ast.stmt.Parameter;

import java.util.List;

/**
 * CSG 运算 union / difference / intersection / hull / minkowski
 */
public class CsgOperation extends InstantiationNode {
    private final CsgOperator operation;

    public CsgOperation(Location location, List<Parameter> args, List<AstNode> children, String modifier,
                        CsgOperator operation) {
        super(location, operation.getModuleName(), args, children, modifier);
        this.operation = operation;
    }

    public CsgOperator getOperation() {
        return operation;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CSG_OPERATION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCsgOperation(this, context);
    }
}
