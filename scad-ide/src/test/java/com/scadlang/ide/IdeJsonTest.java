package com.scadlang.ide;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.scadlang.compiler.analysis.LiteralTypeChecker;
import com.scadlang.compiler.ast.AstNode;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.ast.Position;
import com.scadlang.compiler.parser.ParseResult;
import com.scadlang.compiler.parser.ParserOptions;
import com.scadlang.compiler.parser.ScadParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IdeJsonTest {

    @Nested
    @DisplayName("诊断")
    class DiagnosticTests {

        @Test
        @DisplayName("语法诊断")
        void testSyntaxDiagnostic() {
            JsonArray array = IdeJson.diagnostics(new ScadParser().parse("cube(10)").getDiagnostics());
            assertEquals(1, array.size());
            JsonObject diag = array.get(0).getAsJsonObject();
            assertEquals(LspConstants.SEVERITY_ERROR, diag.get("severity").getAsInt());
            assertEquals("E102", diag.get("code").getAsString());
            assertEquals("scad-parser", diag.get("source").getAsString());
            assertEquals("Missing semicolon", diag.get("message").getAsString());
            JsonObject start = diag.getAsJsonObject("range").getAsJsonObject("start");
            assertEquals(0, start.get("line").getAsInt());
            assertEquals(8, start.get("character").getAsInt());
            assertFalse(diag.has("data"));
        }

        @Test
        @DisplayName("类型诊断附带期望类型")
        void testTypeDiagnostic() {
            ParserOptions options = new ParserOptions();
            options.setTypeChecker(new LiteralTypeChecker());
            ParseResult result = new ScadParser(options).parse("x = \"a\" + 1;");
            JsonObject diag = IdeJson.diagnostics(result.getDiagnostics()).get(0).getAsJsonObject();
            assertEquals("scad-semantic", diag.get("source").getAsString());
            JsonObject data = diag.getAsJsonObject("data");
            assertEquals("string", data.get("expectedType").getAsString());
            assertEquals("number", data.get("actualType").getAsString());
        }
    }

    @Test
    @DisplayName("模块的形参与局部符号作为子符号")
    void testSymbols() {
        List<AstNode> ast = Sources.parse("size = 1;\nmodule box(w) { inner = w; }\n");
        JsonArray array = IdeJson.symbols(new SymbolProvider().getSymbols(ast));
        assertEquals(2, array.size());
        assertEquals(LspConstants.SYMBOL_CONSTANT, array.get(0).getAsJsonObject().get("kind").getAsInt());

        JsonObject box = array.get(1).getAsJsonObject();
        assertEquals("box", box.get("name").getAsString());
        assertEquals(LspConstants.SYMBOL_MODULE, box.get("kind").getAsInt());
        assertEquals("module box(w)", box.get("detail").getAsString());
        JsonArray children = box.getAsJsonArray("children");
        assertEquals(2, children.size());
        assertEquals(LspConstants.SYMBOL_TYPE_PARAMETER, children.get(0).getAsJsonObject().get("kind").getAsInt());
        assertEquals("inner", children.get(1).getAsJsonObject().get("name").getAsString());
        assertEquals(LspConstants.SYMBOL_VARIABLE, children.get(1).getAsJsonObject().get("kind").getAsInt());
        assertEquals(7, box.getAsJsonObject("selectionRange").getAsJsonObject("start").get("character").getAsInt());
    }

    @Test
    @DisplayName("悬停内容为 markdown")
    void testHover() {
        HoverInfo info = new HoverProvider().hover(Sources.parse("cube(10);"), new Position(0, 1, 1));
        JsonObject json = IdeJson.hover(info);
        JsonObject contents = json.getAsJsonObject("contents");
        assertEquals("markdown", contents.get("kind").getAsString());
        assertEquals("```openscad\nbuiltin module cube(size, center)\n```\n\nCreates a cube",
                contents.get("value").getAsString());
        assertTrue(json.has("range"));
    }

    @Test
    @DisplayName("补全上下文")
    void testCompletionContext() {
        CompletionContext context = new PositionUtilities()
                .getCompletionContext(Sources.parse("cube(10);"), new Position(0, 5, 5));
        JsonObject json = IdeJson.completionContext(context);
        assertEquals("parameter", json.get("type").getAsString());
        assertEquals(0, json.get("parameterIndex").getAsInt());
        assertEquals("number", json.get("expectedType").getAsString());
        assertEquals(0, json.getAsJsonArray("availableSymbols").size());
    }

    @Test
    @DisplayName("区间与序列化")
    void testRangeAndSerialization() {
        JsonObject range = IdeJson.range(new Location(new Position(2, 4, 20), new Position(3, 1, 30)));
        assertEquals(2, range.getAsJsonObject("start").get("line").getAsInt());
        assertEquals(1, range.getAsJsonObject("end").get("character").getAsInt());

        String text = IdeJson.toJson(range);
        assertEquals(range, JsonParser.parseString(text));
    }
}
