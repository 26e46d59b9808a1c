package com.scadlang.cst.parser;

import com.scadlang.cst.CstProvider;
import com.scadlang.cst.SyntaxTree;

/**
 * 内置的 OpenSCAD CST 提供者（手写词法 + 递归下降容错解析）
 */
public class ScadCstProvider implements CstProvider {

    @Override
    public SyntaxTree parse(String source) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        return new CstParser(source).parse();
    }
}
