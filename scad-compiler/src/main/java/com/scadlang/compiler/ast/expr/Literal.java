package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;

/**
 * 字面量表达式
 */
public class Literal extends Expression {
    private final LiteralKind literalKind;
    private final Object value;

    public Literal(Location location, LiteralKind literalKind, Object value) {
        super(location);
        this.literalKind = literalKind;
        this.value = value;
    }

    public LiteralKind getLiteralKind() {
        return literalKind;
    }

    /** NUMBER 为 Double，STRING 为反转义后的 String，BOOLEAN 为 Boolean，UNDEF 为 null */
    public Object getValue() {
        return value;
    }

    public double asNumber() {
        return (Double) value;
    }

    public String asString() {
        return (String) value;
    }

    public boolean asBoolean() {
        return (Boolean) value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LITERAL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    @Override
    public String toString() {
        return literalKind == LiteralKind.STRING ? "\"" + value + "\"" : String.valueOf(value);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        NUMBER,
        STRING,
        BOOLEAN,
        UNDEF
    }
}
