package com.scadlang.ide;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.scadlang.compiler.ast.Location;
import com.scadlang.compiler.diagnostic.Diagnostic;

import java.util.List;
import java.util.Locale;

import static com.scadlang.ide.LspConstants.*;

/**
 * 诊断、符号与悬停信息到 LSP 形状 JSON 的转换
 *
 * <p>行列保持从 0 开始，与 LSP 一致。</p>
 */
public final class IdeJson {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private IdeJson() {}

    public static JsonArray diagnostics(List<Diagnostic> diagnostics) {
        JsonArray result = new JsonArray();
        for (Diagnostic diagnostic : diagnostics) {
            JsonObject diag = new JsonObject();
            diag.add("range", range(diagnostic.getLocation()));
            diag.addProperty("severity", severity(diagnostic));
            diag.addProperty("code", diagnostic.getCode().getId());
            diag.addProperty("source", "scad-" + diagnostic.getSource().name().toLowerCase(Locale.ROOT));
            diag.addProperty("message", diagnostic.getMessage());
            if (diagnostic.getExpectedType() != null) {
                JsonObject data = new JsonObject();
                data.addProperty("expectedType", diagnostic.getExpectedType());
                data.addProperty("actualType", diagnostic.getActualType());
                diag.add("data", data);
            }
            result.add(diag);
        }
        return result;
    }

    private static int severity(Diagnostic diagnostic) {
        switch (diagnostic.getSeverity()) {
            case ERROR: return SEVERITY_ERROR;
            case WARNING: return SEVERITY_WARNING;
            case INFO: return SEVERITY_INFORMATION;
            case HINT: return SEVERITY_HINT;
            default: return SEVERITY_ERROR;
        }
    }

    /**
     * 顶层符号为 DocumentSymbol，作用域内的符号挂到所属定义的 children 下
     */
    public static JsonArray symbols(List<SymbolInfo> symbols) {
        JsonArray result = new JsonArray();
        for (SymbolInfo symbol : symbols) {
            if (symbol.isTopLevel()) {
                result.add(documentSymbol(symbol, symbols));
            }
        }
        return result;
    }

    private static JsonObject documentSymbol(SymbolInfo symbol, List<SymbolInfo> all) {
        JsonObject docSym = new JsonObject();
        docSym.addProperty("name", symbol.getName());
        docSym.addProperty("kind", symbolKind(symbol.getKind()));
        docSym.addProperty("detail", HoverProvider.describe(symbol));
        docSym.add("range", range(symbol.getLocation()));
        docSym.add("selectionRange", range(symbol.getNameLocation()));
        if (symbol.getKind() == SymbolKind.MODULE || symbol.getKind() == SymbolKind.FUNCTION) {
            JsonArray children = new JsonArray();
            for (SymbolInfo member : all) {
                if (symbol.getName().equals(member.getScope()) && symbol.getLocation().contains(member.getLocation().getStart())) {
                    children.add(documentSymbol(member, all));
                }
            }
            if (children.size() > 0) {
                docSym.add("children", children);
            }
        }
        return docSym;
    }

    private static int symbolKind(SymbolKind kind) {
        switch (kind) {
            case MODULE: return SYMBOL_MODULE;
            case FUNCTION: return SYMBOL_FUNCTION;
            case PARAMETER: return SYMBOL_TYPE_PARAMETER;
            case CONSTANT: return SYMBOL_CONSTANT;
            default: return SYMBOL_VARIABLE;
        }
    }

    public static JsonObject hover(HoverInfo info) {
        JsonObject result = new JsonObject();
        JsonObject contents = new JsonObject();
        contents.addProperty("kind", "markdown");
        String value = "```openscad\n" + info.getDescription() + "\n```";
        if (info.getDocumentation() != null) {
            value += "\n\n" + info.getDocumentation();
        }
        contents.addProperty("value", value);
        result.add("contents", contents);
        result.add("range", range(info.getRange()));
        return result;
    }

    public static JsonObject completionContext(CompletionContext context) {
        JsonObject result = new JsonObject();
        result.addProperty("type", context.getType().getDisplayName());
        JsonArray names = new JsonArray();
        for (SymbolInfo symbol : context.getAvailableSymbols()) {
            JsonObject item = new JsonObject();
            item.addProperty("name", symbol.getName());
            item.addProperty("kind", symbol.getKind().getDisplayName());
            names.add(item);
        }
        result.add("availableSymbols", names);
        if (context.getParameterIndex() != null) {
            result.addProperty("parameterIndex", context.getParameterIndex());
        }
        if (context.getExpectedType() != null) {
            result.addProperty("expectedType", context.getExpectedType());
        }
        return result;
    }

    public static JsonObject range(Location location) {
        JsonObject range = new JsonObject();
        range.add("start", position(location.getStart().getLine(), location.getStart().getColumn()));
        range.add("end", position(location.getEnd().getLine(), location.getEnd().getColumn()));
        return range;
    }

    private static JsonObject position(int line, int character) {
        JsonObject pos = new JsonObject();
        pos.addProperty("line", line);
        pos.addProperty("character", character);
        return pos;
    }

    public static String toJson(JsonElement element) {
        return GSON.toJson(element);
    }
}
