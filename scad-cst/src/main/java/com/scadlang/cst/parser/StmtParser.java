package com.scadlang.cst.parser;

import com.scadlang.cst.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.scadlang.cst.lexer.TokenType.*;

/**
 * 语句解析 Helper
 */
class StmtParser {
    private static final Logger LOG = Logger.getLogger(StmtParser.class.getName());

    private final CstParser p;

    StmtParser(CstParser parser) {
        this.p = parser;
    }

    /**
     * 解析一条语句并挂到父节点上；失败时回溯并以 ERROR 节点覆盖整条语句
     */
    void parseStatementInto(TreeNode parent, String fieldName) {
        if (p.check(SEMICOLON)) {
            // 空语句
            parent.addChild(null, p.consumeLeaf());
            return;
        }
        int mark = p.mark();
        try {
            parent.addChild(fieldName, parseStatement());
        } catch (CstParseException e) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("语句解析失败，重新同步: " + e.getMessage());
            }
            p.reset(mark);
            parent.addChild(null, p.syncToStatementBoundary());
        }
    }

    private TreeNode parseStatement() {
        List<TreeNode> modifiers = new ArrayList<>(1);
        while (p.current.getType().isModifier() && startsStatement(p.peek(1).getType())) {
            TreeNode leaf = p.consumeLeaf();
            modifiers.add(TreeNode.leaf("modifier", true, p.source,
                    leaf.getStartIndex(), leaf.getStartPosition(), leaf.getEndIndex(), leaf.getEndPosition()));
        }

        TreeNode inner;
        switch (p.current.getType()) {
            case KW_MODULE: inner = parseModuleDefinition(); break;
            case KW_FUNCTION: inner = parseFunctionDefinition(); break;
            case KW_INCLUDE: inner = parseFileReference("include_statement"); break;
            case KW_USE: inner = parseFileReference("use_statement"); break;
            case KW_IF: inner = parseIf(); break;
            case KW_FOR: inner = parseFor(); break;
            case KW_LET: inner = parseLetStatement(); break;
            case KW_ASSIGN: inner = parseAssignStatement(); break;
            case KW_ECHO: inner = parseEchoOrAssert("echo_statement"); break;
            case KW_ASSERT: inner = parseEchoOrAssert("assert_statement"); break;
            case KW_EACH: inner = parseEachStatement(); break;
            case LBRACE: inner = parseBlock(); break;
            case IDENTIFIER:
                if (p.peek(1).is(ASSIGN)) {
                    inner = parseAssignment();
                } else {
                    inner = parseModuleInstantiation(modifiers);
                    modifiers.clear();
                }
                break;
            case SPECIAL_VARIABLE:
                if (p.peek(1).is(ASSIGN)) {
                    inner = parseAssignment();
                    break;
                }
                throw new CstParseException("Unexpected special variable", p.current);
            default:
                throw new CstParseException("Unexpected token", p.current);
        }

        TreeNode statement = p.node("statement");
        for (TreeNode modifier : modifiers) {
            statement.addChild("modifier", modifier);
        }
        statement.addChild(null, inner);
        return p.finish(statement);
    }

    /**
     * 修饰符之后可以出现的语句起始记号
     */
    private boolean startsStatement(TokenType type) {
        switch (type) {
            case IDENTIFIER:
            case KW_IF:
            case KW_FOR:
            case KW_LET:
            case KW_ASSIGN:
            case KW_ECHO:
            case KW_ASSERT:
            case LBRACE:
            case HASH:
            case NOT:
            case PERCENT:
            case STAR:
                return true;
            default:
                return false;
        }
    }

    /**
     * 可以作为子语句（模块实例化、控制结构的主体）的起始记号；
     * 赋值与定义不能作为子语句，遇到时视为前一语句缺少分号
     */
    private boolean startsChildStatement() {
        if (p.check(IDENTIFIER)) {
            return !p.peek(1).is(ASSIGN);
        }
        if (p.current.getType().isModifier()) {
            return startsStatement(p.peek(1).getType());
        }
        return p.checkAny(KW_IF, KW_FOR, KW_LET, KW_ASSIGN, KW_ECHO, KW_ASSERT);
    }

    /**
     * 语句主体：分号、花括号块或单条子语句
     */
    private void parseStatementBody(TreeNode node, String fieldName) {
        if (p.check(SEMICOLON)) {
            node.addChild(null, p.consumeLeaf());
        } else if (p.check(LBRACE)) {
            node.addChild(fieldName, parseBlock());
        } else if (startsChildStatement()) {
            parseStatementInto(node, fieldName);
        } else {
            node.addChild(null, p.missing(";", false));
        }
    }

    TreeNode parseBlock() {
        TreeNode block = p.node("block");
        block.addChild(null, p.consumeLeaf()); // {
        while (!p.check(RBRACE) && !p.isAtEnd()) {
            parseStatementInto(block, null);
        }
        p.expect(block, RBRACE, "}");
        return p.finish(block);
    }

    // ============ 定义 ============

    private TreeNode parseModuleDefinition() {
        TreeNode node = p.node("module_definition");
        node.addChild(null, p.consumeLeaf()); // module
        addDefinitionName(node);
        if (!p.check(LPAREN)) {
            throw new CstParseException("Expected '(' after module name", p.current);
        }
        node.addChild("parameters", p.exprParser.parseParameterList());

        if (p.check(LBRACE)) {
            node.addChild("body", parseBlock());
        } else if (p.isAtEnd() || p.check(RBRACE)) {
            node.addChild("body", p.missing("block", true));
        } else {
            parseStatementInto(node, "body");
        }
        return p.finish(node);
    }

    private TreeNode parseFunctionDefinition() {
        TreeNode node = p.node("function_definition");
        node.addChild(null, p.consumeLeaf()); // function
        addDefinitionName(node);
        if (!p.check(LPAREN)) {
            throw new CstParseException("Expected '(' after function name", p.current);
        }
        node.addChild("parameters", p.exprParser.parseParameterList());
        p.expect(node, ASSIGN, "=");
        node.addChild("value", p.exprParser.parseValueOrMissing());
        p.expect(node, SEMICOLON, ";");
        return p.finish(node);
    }

    private void addDefinitionName(TreeNode node) {
        if (p.check(IDENTIFIER)) {
            node.addChild("name", p.consumeLeaf());
        } else if (p.check(LPAREN)) {
            node.addChild("name", p.missing("identifier", true));
        } else {
            throw new CstParseException("Expected name", p.current);
        }
    }

    private TreeNode parseAssignment() {
        TreeNode node = p.node("assignment_statement");
        node.addChild("name", p.consumeLeaf());
        node.addChild(null, p.consumeLeaf()); // =
        node.addChild("value", p.exprParser.parseValueOrMissing());
        p.expect(node, SEMICOLON, ";");
        return p.finish(node);
    }

    private TreeNode parseFileReference(String type) {
        TreeNode node = p.node(type);
        node.addChild(null, p.consumeLeaf()); // include / use
        if (p.check(INCLUDE_PATH)) {
            node.addChild("path", p.consumeLeaf());
        } else if (p.check(ERROR)) {
            node.addChild("path", p.consumeLeaf());
        } else {
            node.addChild("path", p.missing("include_path", true));
        }
        if (p.check(SEMICOLON)) {
            node.addChild(null, p.consumeLeaf());
        }
        return p.finish(node);
    }

    // ============ 实例化 ============

    private TreeNode parseModuleInstantiation(List<TreeNode> modifiers) {
        TreeNode node = p.node("module_instantiation");
        for (TreeNode modifier : modifiers) {
            node.addChild("modifier", modifier);
        }
        node.addChild("name", p.consumeLeaf());
        if (!p.check(LPAREN)) {
            throw new CstParseException("Expected '(' after module name", p.current);
        }
        node.addChild("arguments", p.exprParser.parseArgumentList());
        parseStatementBody(node, "body");
        return p.finish(node);
    }

    private TreeNode parseEchoOrAssert(String type) {
        TreeNode node = p.node(type);
        node.addChild(null, p.consumeLeaf()); // echo / assert
        if (!p.check(LPAREN)) {
            throw new CstParseException("Expected '('", p.current);
        }
        node.addChild("arguments", p.exprParser.parseArgumentList());
        parseStatementBody(node, "body");
        return p.finish(node);
    }

    private TreeNode parseEachStatement() {
        TreeNode node = p.node("each_statement");
        node.addChild(null, p.consumeLeaf()); // each
        node.addChild("value", p.exprParser.parseValueOrMissing());
        p.expect(node, SEMICOLON, ";");
        return p.finish(node);
    }

    // ============ 控制结构 ============

    private TreeNode parseIf() {
        TreeNode node = p.node("if_statement");
        node.addChild(null, p.consumeLeaf()); // if
        p.expect(node, LPAREN, "(");
        node.addChild("condition", p.exprParser.parseValueOrMissing());
        p.expect(node, RPAREN, ")");
        parseStatementBody(node, "consequence");
        if (p.check(KW_ELSE)) {
            node.addChild(null, p.consumeLeaf());
            parseStatementBody(node, "alternative");
        }
        return p.finish(node);
    }

    private TreeNode parseFor() {
        TreeNode node = p.node("for_statement");
        node.addChild(null, p.consumeLeaf()); // for
        p.expect(node, LPAREN, "(");
        parseForClauses(node);
        p.expect(node, RPAREN, ")");
        parseStatementBody(node, "body");
        return p.finish(node);
    }

    /**
     * for 子句：单个子句的 iterator / range 字段直接挂在节点上，
     * 多个子句时各自包装为 for_assignment
     */
    void parseForClauses(TreeNode node) {
        TreeNode first = parseForAssignment();
        if (!p.check(COMMA)) {
            node.adoptChildren(first);
            return;
        }
        node.addChild(null, first);
        while (p.check(COMMA)) {
            node.addChild(null, p.consumeLeaf());
            if (p.check(RPAREN)) break;
            node.addChild(null, parseForAssignment());
        }
    }

    private TreeNode parseForAssignment() {
        TreeNode node = p.node("for_assignment");
        if (p.checkAny(IDENTIFIER, SPECIAL_VARIABLE)) {
            node.addChild("iterator", p.consumeLeaf());
        } else if (p.check(ASSIGN)) {
            node.addChild("iterator", p.missing("identifier", true));
        } else {
            throw new CstParseException("Expected loop variable", p.current);
        }
        p.expect(node, ASSIGN, "=");
        node.addChild("range", p.exprParser.parseValueOrMissing());
        return p.finish(node);
    }

    private TreeNode parseLetStatement() {
        TreeNode node = p.node("let_expression");
        node.addChild(null, p.consumeLeaf()); // let
        p.exprParser.parseAssignmentClauses(node, "let_assignment");
        parseStatementBody(node, "body");
        return p.finish(node);
    }

    private TreeNode parseAssignStatement() {
        TreeNode node = p.node("assign_statement");
        node.addChild(null, p.consumeLeaf()); // assign
        p.exprParser.parseAssignmentClauses(node, "assign_assignment");
        parseStatementBody(node, "body");
        return p.finish(node);
    }
}
