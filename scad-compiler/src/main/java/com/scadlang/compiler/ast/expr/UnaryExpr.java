package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;

/**
 * 一元表达式
 */
public class UnaryExpr extends Expression {
    private final UnaryOp operator;
    private final Expression operand;

    public UnaryExpr(Location location, UnaryOp operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNARY;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpr(this, context);
    }

    @Override
    public String toString() {
        return "(" + operator.toSourceString() + operand + ")";
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        NOT("!"),
        NEG("-"),
        POS("+");

        /** 一元运算符的优先级：高于乘除，低于乘方 */
        public static final int PRECEDENCE = 7;

        private final String source;

        UnaryOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }

        public static UnaryOp fromSource(String text) {
            for (UnaryOp op : values()) {
                if (op.source.equals(text)) {
                    return op;
                }
            }
            return null;
        }
    }
}
