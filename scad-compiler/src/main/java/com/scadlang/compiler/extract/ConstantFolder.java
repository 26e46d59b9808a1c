package com.scadlang.compiler.extract;

import com.scadlang.compiler.ast.expr.BinaryExpr;
import com.scadlang.compiler.ast.expr.ConditionalExpr;
import com.scadlang.compiler.ast.expr.Expression;
import com.scadlang.compiler.ast.expr.Literal;
import com.scadlang.compiler.ast.expr.UnaryExpr;
import com.scadlang.compiler.ast.expr.VectorExpr;

import java.util.ArrayList;
import java.util.List;

/**
 * 字面量常量折叠
 *
 * <p>结果为 Double、Boolean、String 或由它们组成的 List；含变量、调用等非常量部分时返回 null。</p>
 */
public final class ConstantFolder {

    private ConstantFolder() {
    }

    public static Object fold(Expression expr) {
        if (expr instanceof Literal) {
            return ((Literal) expr).getValue();
        }
        if (expr instanceof UnaryExpr) {
            return foldUnary((UnaryExpr) expr);
        }
        if (expr instanceof BinaryExpr) {
            return foldBinary((BinaryExpr) expr);
        }
        if (expr instanceof ConditionalExpr) {
            ConditionalExpr conditional = (ConditionalExpr) expr;
            Object condition = fold(conditional.getCondition());
            if (!(condition instanceof Boolean)) {
                return null;
            }
            return fold((Boolean) condition ? conditional.getThenExpr() : conditional.getElseExpr());
        }
        if (expr instanceof VectorExpr) {
            List<Object> values = new ArrayList<>();
            for (Expression element : ((VectorExpr) expr).getElements()) {
                Object value = fold(element);
                if (value == null) {
                    return null;
                }
                values.add(value);
            }
            return values;
        }
        return null;
    }

    public static Double foldNumber(Expression expr) {
        Object value = expr != null ? fold(expr) : null;
        return value instanceof Double ? (Double) value : null;
    }

    public static Boolean foldBoolean(Expression expr) {
        Object value = expr != null ? fold(expr) : null;
        return value instanceof Boolean ? (Boolean) value : null;
    }

    public static String foldString(Expression expr) {
        Object value = expr != null ? fold(expr) : null;
        return value instanceof String ? (String) value : null;
    }

    /**
     * 折叠为数值向量；任一元素不是数值时返回 null
     */
    public static double[] foldVector(Expression expr) {
        Object value = expr != null ? fold(expr) : null;
        if (!(value instanceof List)) {
            return null;
        }
        List<?> list = (List<?>) value;
        double[] result = new double[list.size()];
        for (int i = 0; i < result.length; i++) {
            if (!(list.get(i) instanceof Double)) {
                return null;
            }
            result[i] = (Double) list.get(i);
        }
        return result;
    }

    private static Object foldUnary(UnaryExpr expr) {
        Object operand = fold(expr.getOperand());
        switch (expr.getOperator()) {
            case NEG:
                return operand instanceof Double ? -(Double) operand : null;
            case POS:
                return operand instanceof Double ? operand : null;
            case NOT:
                return operand instanceof Boolean ? !(Boolean) operand : null;
            default:
                return null;
        }
    }

    private static Object foldBinary(BinaryExpr expr) {
        Object left = fold(expr.getLeft());
        Object right = fold(expr.getRight());
        if (left == null || right == null) {
            return null;
        }
        BinaryExpr.BinaryOp op = expr.getOperator();
        if (left instanceof Boolean && right instanceof Boolean) {
            boolean l = (Boolean) left;
            boolean r = (Boolean) right;
            switch (op) {
                case AND: return l && r;
                case OR: return l || r;
                case EQ: return l == r;
                case NE: return l != r;
                default: return null;
            }
        }
        if (left instanceof String && right instanceof String) {
            switch (op) {
                case EQ: return left.equals(right);
                case NE: return !left.equals(right);
                default: return null;
            }
        }
        if (!(left instanceof Double) || !(right instanceof Double)) {
            return null;
        }
        double l = (Double) left;
        double r = (Double) right;
        switch (op) {
            case ADD: return l + r;
            case SUB: return l - r;
            case MUL: return l * r;
            case DIV: return l / r;
            case MOD: return l % r;
            case POW: return Math.pow(l, r);
            case LT: return l < r;
            case LE: return l <= r;
            case GT: return l > r;
            case GE: return l >= r;
            case EQ: return l == r;
            case NE: return l != r;
            default: return null;
        }
    }
}
