package com.scadlang.compiler.analysis;

import com.scadlang.compiler.ast.expr.*;

import java.util.Arrays;
import java.util.List;

/**
 * 基于字面量的类型推断：只推断由字面量、向量与运算符直接组成的表达式
 */
public class LiteralTypeChecker implements TypeChecker {

    @Override
    public ValueType getType(Expression expr) {
        if (expr instanceof Literal) {
            switch (((Literal) expr).getLiteralKind()) {
                case NUMBER: return ValueType.NUMBER;
                case STRING: return ValueType.STRING;
                case BOOLEAN: return ValueType.BOOLEAN;
                default: return ValueType.UNDEF;
            }
        }
        if (expr instanceof VectorExpr || expr instanceof ListComprehension) {
            return ValueType.VECTOR;
        }
        if (expr instanceof RangeExpr) {
            return ValueType.RANGE;
        }
        if (expr instanceof FunctionLiteral) {
            return ValueType.FUNCTION;
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) expr;
            if (unary.getOperator() == UnaryExpr.UnaryOp.NOT) {
                return ValueType.BOOLEAN;
            }
            ValueType operand = getType(unary.getOperand());
            return operand == ValueType.NUMBER || operand == ValueType.VECTOR ? operand : ValueType.UNKNOWN;
        }
        if (expr instanceof BinaryExpr) {
            return binaryType((BinaryExpr) expr);
        }
        if (expr instanceof ConditionalExpr) {
            ConditionalExpr conditional = (ConditionalExpr) expr;
            return findCommonType(Arrays.asList(getType(conditional.getThenExpr()),
                    getType(conditional.getElseExpr())));
        }
        if (expr instanceof CallExpr) {
            String name = ((CallExpr) expr).getCalleeName();
            if ("str".equals(name) || "chr".equals(name)) {
                return ValueType.STRING;
            }
            if ("len".equals(name) || "abs".equals(name) || "sqrt".equals(name)) {
                return ValueType.NUMBER;
            }
            if ("is_num".equals(name) || "is_string".equals(name) || "is_bool".equals(name)
                    || "is_list".equals(name) || "is_undef".equals(name)) {
                return ValueType.BOOLEAN;
            }
        }
        return ValueType.UNKNOWN;
    }

    private ValueType binaryType(BinaryExpr expr) {
        BinaryExpr.BinaryOp op = expr.getOperator();
        if (!op.isArithmetic()) {
            return ValueType.BOOLEAN;
        }
        ValueType left = getType(expr.getLeft());
        ValueType right = getType(expr.getRight());
        if (left == ValueType.NUMBER && right == ValueType.NUMBER) {
            return ValueType.NUMBER;
        }
        if (left == ValueType.VECTOR || right == ValueType.VECTOR) {
            return left == ValueType.UNKNOWN || right == ValueType.UNKNOWN ? ValueType.UNKNOWN : ValueType.VECTOR;
        }
        return ValueType.UNKNOWN;
    }

    @Override
    public boolean isAssignable(ValueType from, ValueType to) {
        return from == to || from == ValueType.UNKNOWN || to == ValueType.UNKNOWN;
    }

    @Override
    public ValueType findCommonType(List<ValueType> types) {
        if (types.isEmpty()) {
            return ValueType.UNKNOWN;
        }
        ValueType common = types.get(0);
        for (ValueType type : types) {
            if (type != common) {
                return ValueType.UNKNOWN;
            }
        }
        return common;
    }
}
