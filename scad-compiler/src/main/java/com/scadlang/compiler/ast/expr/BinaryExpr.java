package com.scadlang.compiler.ast.expr;

import com.scadlang.compiler.ast.AstVisitor;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.NodeKind;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(Location location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BINARY;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.toSourceString() + " " + right + ")";
    }

    /**
     * 二元运算符（数值越大优先级越高）
     */
    public enum BinaryOp {
        // 逻辑
        OR("||", 1),
        AND("&&", 2),

        // 相等
        EQ("==", 3),
        NE("!=", 3),

        // 比较
        LT("<", 4),
        LE("<=", 4),
        GT(">", 4),
        GE(">=", 4),

        // 算术
        ADD("+", 5),
        SUB("-", 5),
        MUL("*", 6),
        DIV("/", 6),
        MOD("%", 6),

        // 乘方，右结合
        POW("^", 8);

        private final String source;
        private final int precedence;

        BinaryOp(String source, int precedence) {
            this.source = source;
            this.precedence = precedence;
        }

        public String toSourceString() {
            return source;
        }

        public int getPrecedence() {
            return precedence;
        }

        public boolean isRightAssociative() {
            return this == POW;
        }

        public boolean isArithmetic() {
            return precedence >= 5;
        }

        public static BinaryOp fromSource(String text) {
            for (BinaryOp op : values()) {
                if (op.source.equals(text)) {
                    return op;
                }
            }
            return null;
        }
    }
}
