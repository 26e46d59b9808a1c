package com.scadlang.compiler.ast.stmt;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;
import com.scadlang.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 语句位置的 let：{@code let (a = 1) cube(a);}
 */
public class Let extends AstNode {
    private final Map<String, Expression> assignments;
    private final List<AstNode> body;

    public Let(Location location, LinkedHashMap<String, Expression> assignments, List<AstNode> body) {
        super(location);
        this.assignments = Collections.unmodifiableMap(assignments);
        this.body = Collections.unmodifiableList(body);
    }

    /** 按源码顺序排列的绑定 */
    public Map<String, Expression> getAssignments() {
        return assignments;
    }

    public List<AstNode> getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LET;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLet(this, context);
    }
}
