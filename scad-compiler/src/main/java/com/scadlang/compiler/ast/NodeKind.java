package com.scadlang.compiler.ast;

/**
 * AST 节点种类
 */
public enum NodeKind {
    // 定义
    MODULE_DEFINITION(Family.DEFINITION),
    FUNCTION_DEFINITION(Family.DEFINITION),
    ASSIGNMENT_STATEMENT(Family.DEFINITION),
    INCLUDE(Family.DEFINITION),
    USE(Family.DEFINITION),

    // 实例化
    MODULE_INSTANTIATION(Family.INSTANTIATION),
    TRANSLATE(Family.INSTANTIATION),
    ROTATE(Family.INSTANTIATION),
    SCALE(Family.INSTANTIATION),
    MIRROR(Family.INSTANTIATION),
    MULTMATRIX(Family.INSTANTIATION),
    COLOR(Family.INSTANTIATION),
    OFFSET(Family.INSTANTIATION),
    CUBE(Family.INSTANTIATION),
    SPHERE(Family.INSTANTIATION),
    CYLINDER(Family.INSTANTIATION),
    SQUARE(Family.INSTANTIATION),
    CIRCLE(Family.INSTANTIATION),
    CSG_OPERATION(Family.INSTANTIATION),

    // 控制流
    IF(Family.CONTROL_FLOW),
    FOR_LOOP(Family.CONTROL_FLOW),
    LET(Family.CONTROL_FLOW),
    EACH(Family.CONTROL_FLOW),
    ASSIGN(Family.CONTROL_FLOW),
    ECHO_STATEMENT(Family.CONTROL_FLOW),
    ASSERT_STATEMENT(Family.CONTROL_FLOW),

    // 表达式
    LITERAL(Family.EXPRESSION),
    IDENTIFIER(Family.EXPRESSION),
    VARIABLE(Family.EXPRESSION),
    UNARY(Family.EXPRESSION),
    BINARY(Family.EXPRESSION),
    CONDITIONAL(Family.EXPRESSION),
    RANGE(Family.EXPRESSION),
    VECTOR(Family.EXPRESSION),
    LIST_COMPREHENSION(Family.EXPRESSION),
    LET_EXPRESSION(Family.EXPRESSION),
    FUNCTION_LITERAL(Family.EXPRESSION),
    CALL(Family.EXPRESSION),
    INDEX(Family.EXPRESSION),
    MEMBER(Family.EXPRESSION),
    ECHO_EXPRESSION(Family.EXPRESSION),
    ASSERT_EXPRESSION(Family.EXPRESSION),

    // 错误
    ERROR(Family.ERROR);

    /**
     * 节点族
     */
    public enum Family {
        DEFINITION,
        INSTANTIATION,
        CONTROL_FLOW,
        EXPRESSION,
        ERROR
    }

    private final Family family;

    NodeKind(Family family) {
        this.family = family;
    }

    public Family getFamily() {
        return family;
    }
}
