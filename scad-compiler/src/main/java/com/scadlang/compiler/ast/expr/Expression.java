package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.Location;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(Location location) {
        super(location);
    }
}
