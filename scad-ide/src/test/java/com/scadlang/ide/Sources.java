package com.scadlang.ide;

import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.parser.ParseResult;
import com.scadlang.compiler.parser.ScadParser;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;

/**
 * 测试用源码解析与位置换算
 */
final class Sources {

    private Sources() {}

    static List<AstNode> parse(String source) {
        ParseResult result = new ScadParser().parse(source);
        assertFalse(result.hasErrors(), () -> "unexpected diagnostics: " + result.getDiagnostics());
        return result.getAst();
    }

    static Position at(String source, int line, int column) {
        int offset = 0;
        for (int i = 0; i < line; i++) {
            offset = source.indexOf('\n', offset) + 1;
        }
        return new Position(line, column, offset + column);
    }
}
