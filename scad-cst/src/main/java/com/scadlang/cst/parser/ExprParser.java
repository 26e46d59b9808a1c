package com.scadlang.cst.parser;

import com.scadlang.cst.lexer.Token;

import static com.scadlang.cst.lexer.TokenType.*;

/**
 * 表达式、参数列表解析 Helper
 */
class ExprParser {

    private final CstParser p;

    ExprParser(CstParser parser) {
        this.p = parser;
    }

    /**
     * 当前记号能否开始一个表达式
     */
    boolean canStartExpression(Token token) {
        switch (token.getType()) {
            case NUMBER:
            case STRING:
            case IDENTIFIER:
            case SPECIAL_VARIABLE:
            case KW_TRUE:
            case KW_FALSE:
            case KW_UNDEF:
            case LPAREN:
            case LBRACKET:
            case NOT:
            case MINUS:
            case PLUS:
            case KW_LET:
            case KW_FUNCTION:
            case KW_ECHO:
            case KW_ASSERT:
            case KW_EACH:
            case ERROR:
                return true;
            default:
                return false;
        }
    }

    /** 表达式缺失时可以安全补齐 MISSING 的位置 */
    private boolean atExpressionBoundary() {
        return p.checkAny(SEMICOLON, RPAREN, RBRACKET, RBRACE, LBRACE, COMMA, COLON, EOF);
    }

    /**
     * 解析表达式；缺失时补 MISSING identifier，无法解析时抛出异常
     */
    TreeNode parseValueOrMissing() {
        if (canStartExpression(p.current)) {
            return parseValue();
        }
        if (atExpressionBoundary()) {
            return p.missing("identifier", true);
        }
        throw new CstParseException("Expected expression", p.current);
    }

    TreeNode parseValue() {
        return parseConditional();
    }

    // 三元条件（右结合）
    private TreeNode parseConditional() {
        TreeNode condition = parseChain();
        if (!p.check(QUESTION)) {
            return condition;
        }
        TreeNode node = p.node("conditional_expression");
        node.addChild("condition", condition);
        node.addChild(null, p.consumeLeaf()); // ?
        node.addChild("consequence", parseValueOrMissing());
        p.expect(node, COLON, ":");
        node.addChild("alternative", parseValueOrMissing());
        return p.finish(node);
    }

    /**
     * 二元运算链：单个运算符带 left / operator / right 字段，
     * 多个运算符时按出现顺序平铺为 操作数 运算符 操作数 …
     */
    private TreeNode parseChain() {
        TreeNode first = parseUnary();
        if (!p.current.getType().isBinaryOperator()) {
            return first;
        }
        TreeNode operator = p.consumeLeaf();
        TreeNode second = parseUnaryOrMissing();
        TreeNode node = p.node("binary_expression");
        if (!p.current.getType().isBinaryOperator()) {
            node.addChild("left", first);
            node.addChild("operator", operator);
            node.addChild("right", second);
            return p.finish(node);
        }
        node.addChild(null, first);
        node.addChild(null, operator);
        node.addChild(null, second);
        while (p.current.getType().isBinaryOperator()) {
            node.addChild(null, p.consumeLeaf());
            node.addChild(null, parseUnaryOrMissing());
        }
        return p.finish(node);
    }

    private TreeNode parseUnaryOrMissing() {
        if (canStartExpression(p.current)) {
            return parseUnary();
        }
        if (atExpressionBoundary()) {
            return p.missing("identifier", true);
        }
        throw new CstParseException("Expected operand", p.current);
    }

    // 一元 ! - +
    private TreeNode parseUnary() {
        if (p.checkAny(NOT, MINUS, PLUS)) {
            TreeNode node = p.node("unary_expression");
            node.addChild("operator", p.consumeLeaf());
            node.addChild("operand", parseUnaryOrMissing());
            return p.finish(node);
        }
        return parsePostfix();
    }

    // 调用 / 下标 / 成员访问
    private TreeNode parsePostfix() {
        TreeNode expr = parsePrimary();
        while (true) {
            if (p.check(LPAREN)) {
                TreeNode call = p.node("call_expression");
                call.addChild("function", expr);
                call.addChild("arguments", parseArgumentList());
                expr = p.finish(call);
            } else if (p.check(LBRACKET)) {
                TreeNode index = p.node("index_expression");
                index.addChild("array", expr);
                index.addChild(null, p.consumeLeaf()); // [
                index.addChild("index", parseValueOrMissing());
                p.expect(index, RBRACKET, "]");
                expr = p.finish(index);
            } else if (p.check(DOT)) {
                TreeNode member = p.node("member_expression");
                member.addChild("object", expr);
                member.addChild(null, p.consumeLeaf()); // .
                if (p.check(IDENTIFIER)) {
                    member.addChild("property", p.consumeLeaf());
                } else {
                    member.addChild("property", p.missing("identifier", true));
                }
                expr = p.finish(member);
            } else {
                return expr;
            }
        }
    }

    private TreeNode parsePrimary() {
        switch (p.current.getType()) {
            case NUMBER:
            case STRING:
            case IDENTIFIER:
            case SPECIAL_VARIABLE:
            case KW_TRUE:
            case KW_FALSE:
            case KW_UNDEF:
            case ERROR:
                return p.consumeLeaf();
            case LPAREN: {
                TreeNode node = p.node("parenthesized_expression");
                node.addChild(null, p.consumeLeaf());
                node.addChild(null, parseValueOrMissing());
                p.expect(node, RPAREN, ")");
                return p.finish(node);
            }
            case LBRACKET:
                return parseBracketExpression();
            case KW_LET: {
                TreeNode node = p.node("let_expression");
                node.addChild(null, p.consumeLeaf());
                parseAssignmentClauses(node, "let_assignment");
                node.addChild("body", parseValueOrMissing());
                return p.finish(node);
            }
            case KW_FUNCTION: {
                TreeNode node = p.node("function_literal");
                node.addChild(null, p.consumeLeaf());
                if (!p.check(LPAREN)) {
                    throw new CstParseException("Expected '(' after function", p.current);
                }
                node.addChild("parameters", parseParameterList());
                node.addChild("body", parseValueOrMissing());
                return p.finish(node);
            }
            case KW_ECHO:
            case KW_ASSERT: {
                TreeNode node = p.node(p.check(KW_ECHO) ? "echo_expression" : "assert_expression");
                node.addChild(null, p.consumeLeaf());
                if (!p.check(LPAREN)) {
                    throw new CstParseException("Expected '('", p.current);
                }
                node.addChild("arguments", parseArgumentList());
                if (canStartExpression(p.current)) {
                    node.addChild("body", parseValue());
                }
                return p.finish(node);
            }
            case KW_EACH: {
                TreeNode node = p.node("each_statement");
                node.addChild(null, p.consumeLeaf());
                node.addChild("value", parseValueOrMissing());
                return p.finish(node);
            }
            default:
                throw new CstParseException("Expected expression", p.current);
        }
    }

    /**
     * 方括号表达式：向量、范围、列表推导（含旧式 [expr for (...) if (...)]）
     */
    private TreeNode parseBracketExpression() {
        Token open = p.current;
        if (p.peek(1).is(RBRACKET)) {
            TreeNode empty = p.node("vector_expression");
            empty.addChild(null, p.consumeLeaf());
            empty.addChild(null, p.consumeLeaf());
            return p.finish(empty);
        }
        if (p.peek(1).is(KW_FOR)) {
            TreeNode node = p.node("list_comprehension");
            node.addChild(null, p.consumeLeaf()); // [
            parseComprehensionTail(node, false);
            return p.finish(node);
        }

        int mark = p.mark();
        p.advance(); // [
        TreeNode first;
        try {
            first = parseValue();
        } catch (CstParseException e) {
            // 首元素无法解析，按普通向量的容错规则处理
            p.reset(mark);
            return parseVector();
        }

        if (p.check(COLON)) {
            TreeNode range = p.node("range_expression");
            range.addChild(null, p.leafOf(open));
            range.addChild("start", first);
            range.addChild(null, p.consumeLeaf()); // :
            TreeNode second = parseValueOrMissing();
            if (p.check(COLON)) {
                range.addChild("step", second);
                range.addChild(null, p.consumeLeaf());
                range.addChild("end", parseValueOrMissing());
            } else {
                range.addChild("end", second);
            }
            p.expect(range, RBRACKET, "]");
            return p.finish(range);
        }
        if (p.check(KW_FOR)) {
            TreeNode node = p.node("list_comprehension");
            node.addChild(null, p.leafOf(open));
            node.addChild("expr", first);
            parseComprehensionTail(node, true);
            return p.finish(node);
        }

        p.reset(mark);
        return parseVector();
    }

    private TreeNode parseVector() {
        TreeNode vector = p.node("vector_expression");
        vector.addChild(null, p.consumeLeaf()); // [
        p.parseListInto(vector, RBRACKET, this::parseValue);
        p.expect(vector, RBRACKET, "]");
        return p.finish(vector);
    }

    /**
     * 列表推导的 for 子句、可选 if 条件与元素表达式
     */
    private void parseComprehensionTail(TreeNode node, boolean hasExpr) {
        while (p.check(KW_FOR)) {
            TreeNode clause = p.node("list_comprehension_for");
            clause.addChild(null, p.consumeLeaf()); // for
            p.expect(clause, LPAREN, "(");
            p.stmtParser.parseForClauses(clause);
            p.expect(clause, RPAREN, ")");
            node.addChild(null, p.finish(clause));
        }
        if (p.check(KW_IF)) {
            node.addChild(null, p.consumeLeaf());
            p.expect(node, LPAREN, "(");
            node.addChild("condition", parseValueOrMissing());
            p.expect(node, RPAREN, ")");
        }
        if (!hasExpr) {
            node.addChild("expr", parseValueOrMissing());
        }
        p.expect(node, RBRACKET, "]");
    }

    // ============ 参数 ============

    /**
     * 调用实参：'(' arguments? ')'
     */
    TreeNode parseArgumentList() {
        TreeNode list = p.node("argument_list");
        list.addChild(null, p.consumeLeaf()); // (
        if (!p.check(RPAREN)) {
            TreeNode arguments = p.node("arguments");
            p.parseListInto(arguments, RPAREN, this::parseArgument);
            if (arguments.childCount() > 0) {
                list.addChild(null, p.finish(arguments));
            }
        }
        p.expect(list, RPAREN, ")");
        return p.finish(list);
    }

    private TreeNode parseArgument() {
        TreeNode argument = p.node("argument");
        if (p.checkAny(IDENTIFIER, SPECIAL_VARIABLE) && p.peek(1).is(ASSIGN)) {
            argument.addChild("name", p.consumeLeaf());
            argument.addChild(null, p.consumeLeaf()); // =
            argument.addChild("value", parseValueOrMissing());
        } else {
            argument.addChild("value", parseValue());
        }
        return p.finish(argument);
    }

    /**
     * 形参：'(' parameter_declarations? ')'
     */
    TreeNode parseParameterList() {
        TreeNode list = p.node("parameter_list");
        list.addChild(null, p.consumeLeaf()); // (
        if (!p.check(RPAREN)) {
            TreeNode declarations = p.node("parameter_declarations");
            p.parseListInto(declarations, RPAREN, this::parseParameterDeclaration);
            if (declarations.childCount() > 0) {
                list.addChild(null, p.finish(declarations));
            }
        }
        p.expect(list, RPAREN, ")");
        return p.finish(list);
    }

    private TreeNode parseParameterDeclaration() {
        if (!p.checkAny(IDENTIFIER, SPECIAL_VARIABLE)) {
            throw new CstParseException("Expected parameter name", p.current);
        }
        TreeNode declaration = p.node("parameter_declaration");
        declaration.addChild("name", p.consumeLeaf());
        if (p.check(ASSIGN)) {
            declaration.addChild(null, p.consumeLeaf());
            declaration.addChild("value", parseValueOrMissing());
        }
        return p.finish(declaration);
    }

    /**
     * '(' name = value, ... ')' 形式的赋值子句（let / assign）
     */
    void parseAssignmentClauses(TreeNode node, String clauseType) {
        p.expect(node, LPAREN, "(");
        p.parseListInto(node, RPAREN, () -> parseAssignmentClause(clauseType));
        p.expect(node, RPAREN, ")");
    }

    private TreeNode parseAssignmentClause(String clauseType) {
        TreeNode clause = p.node(clauseType);
        if (p.checkAny(IDENTIFIER, SPECIAL_VARIABLE)) {
            clause.addChild("name", p.consumeLeaf());
        } else if (!p.check(ASSIGN)) {
            throw new CstParseException("Expected identifier", p.current);
        }
        if (p.check(ASSIGN)) {
            clause.addChild(null, p.consumeLeaf());
            clause.addChild("value", parseValueOrMissing());
        }
        return p.finish(clause);
    }
}
