package com.scadlang.cst.parser;

import com.scadlang.cst.Point;
import com.scadlang.cst.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link CstParser} 构建的 CST 节点
 *
 * <p>构建阶段通过 {@link #addChild} 追加子节点，{@link #finish} 后只读。</p>
 */
public final class TreeNode implements SyntaxNode {
    private final String type;
    private final boolean named;
    private final boolean missing;
    private final String source;

    private int startIndex;
    private int endIndex;
    private Point startPosition;
    private Point endPosition;

    private TreeNode parent;
    private final List<TreeNode> children = new ArrayList<>(4);
    private final List<String> fieldNames = new ArrayList<>(4);
    private List<SyntaxNode> childrenView;
    private List<SyntaxNode> namedChildrenView;
    private boolean errorInside;

    TreeNode(String type, boolean named, boolean missing, String source) {
        this.type = type;
        this.named = named;
        this.missing = missing;
        this.source = source;
    }

    /** 创建覆盖给定区间的叶子节点 */
    static TreeNode leaf(String type, boolean named, String source,
                         int startIndex, Point start, int endIndex, Point end) {
        TreeNode node = new TreeNode(type, named, false, source);
        node.setSpan(startIndex, start, endIndex, end);
        return node;
    }

    /** 创建零宽度的 MISSING 节点 */
    static TreeNode missing(String type, boolean named, String source, int index, Point at) {
        TreeNode node = new TreeNode(type, named, true, source);
        node.setSpan(index, at, index, at);
        node.errorInside = true;
        return node;
    }

    void addChild(String fieldName, TreeNode child) {
        if (child == null) return;
        child.parent = this;
        children.add(child);
        fieldNames.add(fieldName);
        if (child.errorInside || child.isError()) {
            errorInside = true;
        }
    }

    /**
     * 把另一个构建中节点的子节点（连同字段名）移到本节点
     */
    void adoptChildren(TreeNode from) {
        for (int i = 0; i < from.children.size(); i++) {
            addChild(from.fieldNames.get(i), from.children.get(i));
        }
        from.children.clear();
        from.fieldNames.clear();
    }

    void setSpan(int startIndex, Point start, int endIndex, Point end) {
        this.startIndex = startIndex;
        this.startPosition = start;
        this.endIndex = endIndex;
        this.endPosition = end;
    }

    /**
     * 结束构建：区间取首尾子节点；没有子节点时使用给定的默认位置
     */
    TreeNode finish(int defaultIndex, Point defaultPoint) {
        if (children.isEmpty()) {
            setSpan(defaultIndex, defaultPoint, defaultIndex, defaultPoint);
        } else {
            TreeNode first = children.get(0);
            TreeNode last = children.get(children.size() - 1);
            setSpan(first.startIndex, first.startPosition, last.endIndex, last.endPosition);
        }
        return this;
    }

    /** 调整起点（前导记号不作为子节点时使用） */
    void extendStart(int index, Point point) {
        if (index < startIndex) {
            startIndex = index;
            startPosition = point;
        }
    }

    int childCount() {
        return children.size();
    }

    @Override
    public String getType() {
        return type;
    }

    @Override
    public String getText() {
        return source.substring(startIndex, endIndex);
    }

    @Override
    public Point getStartPosition() {
        return startPosition;
    }

    @Override
    public Point getEndPosition() {
        return endPosition;
    }

    @Override
    public int getStartIndex() {
        return startIndex;
    }

    @Override
    public int getEndIndex() {
        return endIndex;
    }

    @Override
    public boolean isNamed() {
        return named;
    }

    @Override
    public boolean isMissing() {
        return missing;
    }

    @Override
    public boolean isError() {
        return ERROR.equals(type);
    }

    @Override
    public boolean hasError() {
        return errorInside || isError() || missing;
    }

    @Override
    public SyntaxNode getParent() {
        return parent;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        if (childrenView == null) {
            childrenView = Collections.<SyntaxNode>unmodifiableList(children);
        }
        return childrenView;
    }

    @Override
    public List<SyntaxNode> getNamedChildren() {
        if (namedChildrenView == null) {
            List<SyntaxNode> named = new ArrayList<>(children.size());
            for (TreeNode child : children) {
                if (child.named) {
                    named.add(child);
                }
            }
            namedChildrenView = Collections.unmodifiableList(named);
        }
        return namedChildrenView;
    }

    @Override
    public SyntaxNode getChildForFieldName(String fieldName) {
        for (int i = 0; i < children.size(); i++) {
            if (fieldName.equals(fieldNames.get(i))) {
                return children.get(i);
            }
        }
        return null;
    }

    @Override
    public String getFieldName(SyntaxNode child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return fieldNames.get(i);
            }
        }
        return null;
    }

    /** S 表达式形式，便于调试与测试 */
    public String toSexp() {
        StringBuilder sb = new StringBuilder();
        appendSexp(sb);
        return sb.toString();
    }

    private void appendSexp(StringBuilder sb) {
        if (missing) {
            sb.append("(MISSING ").append(type).append(')');
            return;
        }
        sb.append('(').append(type);
        for (int i = 0; i < children.size(); i++) {
            TreeNode child = children.get(i);
            if (!child.named && !child.missing) continue;
            sb.append(' ');
            if (fieldNames.get(i) != null) {
                sb.append(fieldNames.get(i)).append(": ");
            }
            child.appendSexp(sb);
        }
        sb.append(')');
    }

    @Override
    public String toString() {
        return type + " [" + startPosition + " - " + endPosition + "]";
    }
}
