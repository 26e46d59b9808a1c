package com.scadlang.cst;

import java.util.List;

/**
 * 具体语法树节点
 *
 * <p>编译器前端只通过该接口读取 CST，不修改节点。节点约定与 tree-sitter 保持一致：</p>
 * <ul>
 *   <li>{@code type} 为语法产生式名（如 {@code module_instantiation}）或匿名记号本身（如 {@code ";"}）</li>
 *   <li>{@code ERROR} 节点包裹无法归约的记号</li>
 *   <li>{@code MISSING} 节点宽度为 0，表示解析器补齐的缺失记号</li>
 * </ul>
 */
public interface SyntaxNode {

    /** 错误节点类型名 */
    String ERROR = "ERROR";

    String getType();

    /** 节点覆盖的源码文本 */
    String getText();

    Point getStartPosition();

    Point getEndPosition();

    /** 起始字符偏移（含） */
    int getStartIndex();

    /** 结束字符偏移（不含） */
    int getEndIndex();

    /** 是否为具名节点（匿名节点即标点、关键字等记号） */
    boolean isNamed();

    /** 是否为解析器补齐的缺失节点 */
    boolean isMissing();

    /** 是否为 ERROR 节点 */
    boolean isError();

    /** 自身或任一后代是否为 ERROR / MISSING 节点 */
    boolean hasError();

    SyntaxNode getParent();

    List<SyntaxNode> getChildren();

    List<SyntaxNode> getNamedChildren();

    /**
     * 按字段名获取子节点
     *
     * @return 子节点，不存在时返回 null
     */
    SyntaxNode getChildForFieldName(String fieldName);

    /** 子节点在父节点中的字段名，没有字段名时返回 null */
    String getFieldName(SyntaxNode child);
}
