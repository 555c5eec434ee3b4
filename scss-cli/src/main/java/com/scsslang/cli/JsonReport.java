package com.scsslang.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.scsslang.compiler.ast.SourceLocation;
import scss.runtime.CompileResult;
import scss.runtime.Diagnostic;

/**
 * {@code --json} 输出：编译结果与诊断的机器可读形式
 */
public final class JsonReport {

    private static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .setPrettyPrinting()
            .create();

    private JsonReport() {}

    public static String render(CompileResult result) {
        return GSON.toJson(toJson(result));
    }

    static JsonObject toJson(CompileResult result) {
        JsonObject root = new JsonObject();
        root.addProperty("success", result.isSuccess());
        root.addProperty("css", result.getCss());
        if (result.getSourceMap() != null) {
            root.add("sourceMap", JsonParser.parseString(result.getSourceMap()));
        }
        JsonArray diagnostics = new JsonArray();
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            diagnostics.add(toJson(diagnostic));
        }
        root.add("diagnostics", diagnostics);
        JsonArray loaded = new JsonArray();
        for (String url : result.getLoadedUrls()) {
            loaded.add(url);
        }
        root.add("loadedUrls", loaded);
        root.add("error", result.getError() == null ? null : toJson(result.getError()));
        return root;
    }

    static JsonObject toJson(Diagnostic diagnostic) {
        JsonObject json = new JsonObject();
        json.addProperty("severity", diagnostic.getSeverity().name().toLowerCase());
        json.addProperty("message", diagnostic.getMessage());
        json.add("span", toJson(diagnostic.getPrimarySpan()));
        JsonArray secondary = new JsonArray();
        for (SourceLocation span : diagnostic.getSecondarySpans()) {
            secondary.add(toJson(span));
        }
        json.add("secondarySpans", secondary);
        json.addProperty("stackTrace", diagnostic.getStackTrace());
        return json;
    }

    private static JsonObject toJson(SourceLocation span) {
        if (span == null || !span.isKnown()) {
            return null;
        }
        JsonObject json = new JsonObject();
        json.addProperty("url", span.getFile());
        json.addProperty("line", span.getLine());
        json.addProperty("column", span.getColumn());
        json.addProperty("length", span.getLength());
        return json;
    }
}
