package com.scadlang.cst.parser;

import com.scadlang.cst.Point;
import com.scadlang.cst.SyntaxTree;
import com.scadlang.cst.lexer.Lexer;
import com.scadlang.cst.lexer.Token;
import com.scadlang.cst.lexer.TokenType;

import java.util.List;
import java.util.function.Supplier;

import static com.scadlang.cst.lexer.TokenType.*;

/**
 * OpenSCAD CST 语法分析器（递归下降，容错）
 *
 * <p>产生与 tree-sitter-openscad 语法同形的节点：</p>
 * <ul>
 *   <li>缺失的分隔符、分号、标识符以零宽 MISSING 节点补齐，不抛异常</li>
 *   <li>无法归约的记号包裹进 ERROR 节点，随后在语句 / 列表边界重新同步</li>
 *   <li>二元运算链按出现顺序平铺，优先级交给 AST 构建阶段决定</li>
 * </ul>
 */
public class CstParser {

    final String source;
    private final List<Token> tokens;
    private int position;
    Token current;
    Token previous;

    // === Helper 实例 ===
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public CstParser(String source) {
        this.source = source;
        this.tokens = new Lexer(source).scanTokens();
        this.position = 0;
        this.current = tokens.get(0);
    }

    /**
     * 解析整个源文件
     */
    public SyntaxTree parse() {
        TreeNode root = node("source_file");
        while (!isAtEnd()) {
            stmtParser.parseStatementInto(root, null);
        }
        Token eof = current;
        root.setSpan(0, new Point(0, 0), source.length(), new Point(eof.getEndLine(), eof.getEndColumn()));
        return new SyntaxTree(source, root);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        if (position < tokens.size() - 1) {
            position++;
        }
        current = tokens.get(position);
        return previous;
    }

    /**
     * 查看当前之后第 n 个 token（不消费）
     */
    Token peek(int n) {
        int index = Math.min(position + n, tokens.size() - 1);
        return tokens.get(index);
    }

    /**
     * 标记当前位置，用于回溯
     */
    int mark() {
        return position;
    }

    /**
     * 回溯到标记的位置
     */
    void reset(int mark) {
        position = mark;
        current = tokens.get(position);
        previous = position > 0 ? tokens.get(position - 1) : null;
    }

    boolean check(TokenType type) {
        return current.getType() == type;
    }

    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    // ============ 节点构建 ============

    TreeNode node(String type) {
        return new TreeNode(type, true, false, source);
    }

    /**
     * 消费当前 token 并生成叶子节点
     */
    TreeNode consumeLeaf() {
        Token token = advance();
        return leafOf(token);
    }

    /**
     * 记号对应的叶子：字面量、标识符为具名节点，其余为以原文命名的匿名节点
     */
    TreeNode leafOf(Token token) {
        String type;
        boolean named = true;
        switch (token.getType()) {
            case IDENTIFIER: type = "identifier"; break;
            case SPECIAL_VARIABLE: type = "special_variable"; break;
            case NUMBER: type = "number"; break;
            case STRING: type = "string"; break;
            case KW_TRUE:
            case KW_FALSE: type = "boolean"; break;
            case KW_UNDEF: type = "undef"; break;
            case INCLUDE_PATH: type = "include_path"; break;
            case ERROR: type = TreeNode.ERROR; break;
            default:
                type = token.getLexeme();
                named = false;
                break;
        }
        return TreeNode.leaf(type, named, source,
                token.getOffset(), new Point(token.getLine(), token.getColumn()),
                token.getEndOffset(), new Point(token.getEndLine(), token.getEndColumn()));
    }

    /**
     * 期望某个记号：存在则作为匿名子节点加入，否则补一个 MISSING 节点
     */
    void expect(TreeNode parent, TokenType type, String text) {
        if (check(type)) {
            parent.addChild(null, consumeLeaf());
        } else {
            parent.addChild(null, missing(text, false));
        }
    }

    /**
     * 在上一个记号末尾创建 MISSING 节点
     */
    TreeNode missing(String type, boolean named) {
        if (previous == null) {
            return TreeNode.missing(type, named, source, current.getOffset(),
                    new Point(current.getLine(), current.getColumn()));
        }
        return TreeNode.missing(type, named, source, previous.getEndOffset(),
                new Point(previous.getEndLine(), previous.getEndColumn()));
    }

    /**
     * 结束节点构建；空节点落在上一个记号末尾
     */
    TreeNode finish(TreeNode node) {
        if (previous == null) {
            return node.finish(current.getOffset(), new Point(current.getLine(), current.getColumn()));
        }
        return node.finish(previous.getEndOffset(), new Point(previous.getEndLine(), previous.getEndColumn()));
    }

    // ============ 错误恢复 ============

    /**
     * 解析带分隔符的列表元素，直到遇到闭合记号。
     * 元素解析失败时把记号包裹成 ERROR 节点并同步到下一个逗号或闭合记号。
     */
    void parseListInto(TreeNode list, TokenType closer, Supplier<TreeNode> element) {
        while (!check(closer) && !isListTerminator()) {
            if (check(COMMA)) {
                // 空元素：多余的逗号
                TreeNode error = node(TreeNode.ERROR);
                error.addChild(null, consumeLeaf());
                list.addChild(null, finish(error));
                continue;
            }
            int mark = mark();
            try {
                list.addChild(null, element.get());
            } catch (CstParseException e) {
                reset(mark);
                list.addChild(null, syncToListBoundary(closer));
            }
            if (check(COMMA)) {
                list.addChild(null, consumeLeaf());
            } else if (!check(closer) && !isListTerminator()) {
                list.addChild(null, syncToListBoundary(closer));
                if (check(COMMA)) list.addChild(null, consumeLeaf());
            }
        }
    }

    /** 列表内遇到这些记号视为列表结束（闭合记号缺失） */
    private boolean isListTerminator() {
        return checkAny(SEMICOLON, LBRACE, RBRACE, EOF) || current.getType().isCloser();
    }

    /**
     * 跳过记号直到逗号、闭合记号或语句边界（深度为 0 时），返回包裹它们的 ERROR 节点；
     * 没有可跳过的记号时返回 null
     */
    TreeNode syncToListBoundary(TokenType closer) {
        TreeNode error = node(TreeNode.ERROR);
        int depth = 0;
        while (!isAtEnd()) {
            if (checkAny(SEMICOLON, LBRACE, RBRACE)) {
                break;
            }
            if (depth == 0 && (check(COMMA) || check(closer) || isListTerminator())) {
                break;
            }
            if (current.getType().isOpener()) {
                depth++;
            } else if (current.getType().isCloser()) {
                depth--;
            }
            error.addChild(null, consumeLeaf());
        }
        if (error.childCount() == 0) {
            return null;
        }
        return finish(error);
    }

    /**
     * 语句级同步：至少跳过一个记号，然后停在分号之后、深度 0 的右花括号之前，
     * 或下一个定义 / 引用语句起点。
     */
    TreeNode syncToStatementBoundary() {
        TreeNode error = node(TreeNode.ERROR);
        error.addChild(null, consumeLeaf());
        if (previous.is(SEMICOLON) || previous.getType().isCloser()) {
            return finish(error);
        }
        int depth = openDelta(previous);
        while (!isAtEnd()) {
            if (depth <= 0) {
                if (check(RBRACE)) break;
                if (checkAny(KW_MODULE, KW_FUNCTION, KW_INCLUDE, KW_USE)) break;
            }
            Token token = advance();
            error.addChild(null, leafOf(token));
            depth += openDelta(token);
            if (depth <= 0 && token.is(SEMICOLON)) break;
            if (depth <= 0 && token.is(RBRACE)) break;
        }
        return finish(error);
    }

    private int openDelta(Token token) {
        if (token.getType().isOpener()) return 1;
        if (token.getType().isCloser()) return -1;
        return 0;
    }
}
