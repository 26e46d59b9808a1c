package com.scadlang.cst;

/**
 * CST 提供者：把 OpenSCAD 源码转换为具体语法树
 *
 * <p>实现必须容错：任何输入都返回一棵覆盖全文的树，语法问题以 ERROR / MISSING 节点表示。</p>
 */
public interface CstProvider {

    SyntaxTree parse(String source);
}
