package com.scadlang.compiler.analysis;

import com.scadlang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 类型检查协作者：启用语义诊断与类型修复
 */
public interface TypeChecker {

    /**
     * 表达式的静态类型，无法确定时返回 {@link ValueType#UNKNOWN}
     */
    ValueType getType(Expression expr);

    /**
     * from 类型的值能否直接用在期望 to 类型的位置
     */
    boolean isAssignable(ValueType from, ValueType to);

    /**
     * 一组类型的公共类型，不存在时返回 {@link ValueType#UNKNOWN}
     */
    ValueType findCommonType(List<ValueType> types);
}
