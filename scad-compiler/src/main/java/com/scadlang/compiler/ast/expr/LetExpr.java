package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 表达式位置的 let：{@code let (a = 1, b = a + 1) a * b}
 */
public class LetExpr extends Expression {
    private final Map<String, Expression> assignments;
    private final Expression body;

    public LetExpr(Location location, LinkedHashMap<String, Expression> assignments, Expression body) {
        super(location);
        this.assignments = Collections.unmodifiableMap(assignments);
        this.body = body;
    }

    /** 按源码顺序排列的绑定 */
    public Map<String, Expression> getAssignments() {
        return assignments;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LET_EXPRESSION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLetExpr(this, context);
    }
}
