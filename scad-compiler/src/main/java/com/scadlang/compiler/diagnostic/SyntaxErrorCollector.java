package com.scadlang.compiler.diagnostic;

import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.extract.LocationUtils;
import com.scadlang.cst.SyntaxNode;

import java.util.List;

/**
 * 从 CST 的 ERROR / MISSING 节点生成语法诊断
 *
 * <p>每个有问题的 CST 节点只报告一次；ERROR 节点内部不再继续检查。</p>
 */
public class SyntaxErrorCollector {

    private static final int MAX_TEXT = 30;

    private final String source;
    private final DiagnosticCollector diagnostics;

    public SyntaxErrorCollector(String source, DiagnosticCollector diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    public void collect(SyntaxNode root) {
        visit(root);
    }

    private void visit(SyntaxNode node) {
        if (!node.hasError()) {
            return;
        }
        if (node.isMissing()) {
            reportMissing(node);
            return;
        }
        if (node.isError()) {
            reportError(node);
            return;
        }
        for (SyntaxNode child : node.getChildren()) {
            visit(child);
        }
    }

    private void reportMissing(SyntaxNode node) {
        Location at = LocationUtils.getLocation(node);
        String type = node.getType();
        switch (type) {
            case ";":
                diagnostics.error(ErrorCode.MISSING_SEMICOLON, "Missing semicolon", at);
                break;
            case ")":
                diagnostics.error(ErrorCode.UNCLOSED_PAREN, "Unclosed parenthesis", openerLocation(node, "("));
                break;
            case "]":
                diagnostics.error(ErrorCode.UNCLOSED_BRACKET, "Unclosed bracket", openerLocation(node, "["));
                break;
            case "}":
                diagnostics.error(ErrorCode.UNCLOSED_BRACE, "Unclosed brace", openerLocation(node, "{"));
                break;
            case "identifier":
                reportMissingIdentifier(node, at);
                break;
            case "block":
                diagnostics.error(ErrorCode.MISSING_FIELD, "Missing module body", at);
                break;
            case "include_path":
                diagnostics.error(ErrorCode.MISSING_FIELD, "Missing file path", at);
                break;
            default:
                diagnostics.error(ErrorCode.SYNTAX_ERROR, "Missing '" + type + "'", at);
                break;
        }
    }

    private void reportMissingIdentifier(SyntaxNode node, Location at) {
        SyntaxNode parent = node.getParent();
        String field = parent != null ? parent.getFieldName(node) : null;
        if ("name".equals(field) || "iterator".equals(field) || "property".equals(field)) {
            diagnostics.error(ErrorCode.MISSING_NAME, "Missing name", at);
        } else if (source.substring(Math.min(node.getStartIndex(), source.length())).trim().isEmpty()) {
            diagnostics.error(ErrorCode.UNEXPECTED_EOF, "Unexpected end of input", at);
        } else {
            diagnostics.error(ErrorCode.SYNTAX_ERROR, "Missing expression", at);
        }
    }

    /**
     * 缺失闭合记号时定位到同一父节点中最近的开启记号
     */
    private Location openerLocation(SyntaxNode missing, String opener) {
        SyntaxNode parent = missing.getParent();
        if (parent == null) {
            return LocationUtils.getLocation(missing);
        }
        List<SyntaxNode> siblings = parent.getChildren();
        SyntaxNode found = null;
        for (SyntaxNode sibling : siblings) {
            if (sibling == missing) {
                break;
            }
            if (opener.equals(sibling.getType()) && !sibling.isMissing()) {
                found = sibling;
            }
        }
        return LocationUtils.getLocation(found != null ? found : missing);
    }

    private void reportError(SyntaxNode node) {
        Location at = LocationUtils.getLocation(node);
        String text = node.getText();
        if (node.getChildren().isEmpty()) {
            // 词法错误
            if (text.startsWith("\"") || text.startsWith("'")) {
                diagnostics.error(ErrorCode.SYNTAX_ERROR, "Unterminated string literal", at);
            } else if (text.startsWith("/*")) {
                diagnostics.error(ErrorCode.SYNTAX_ERROR, "Unterminated block comment", at);
            } else if (text.startsWith("<")) {
                diagnostics.error(ErrorCode.SYNTAX_ERROR, "Unterminated include path", at);
            } else {
                diagnostics.error(ErrorCode.INVALID_CHARACTER, "Invalid character '" + text + "'", at);
            }
            return;
        }
        diagnostics.error(ErrorCode.UNEXPECTED_TOKEN, "Unexpected '" + abbreviate(text) + "'", at);
    }

    private static String abbreviate(String text) {
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= MAX_TEXT ? flat : flat.substring(0, MAX_TEXT) + "...";
    }
}
