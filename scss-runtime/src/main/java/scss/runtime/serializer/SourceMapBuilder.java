package scss.runtime.serializer;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.scsslang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 生成 v3 source map JSON（mappings 为 base64 VLQ 编码）
 */
public final class SourceMapBuilder {

    private static final String BASE64 = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private final List<SourceMapEntry> entries;
    private String file;

    public SourceMapBuilder(List<SourceMapEntry> entries) {
        this.entries = new ArrayList<>(entries);
    }

    /** 输出 CSS 文件名（map 的 {@code file} 字段） */
    public SourceMapBuilder file(String file) {
        this.file = file;
        return this;
    }

    public String build() {
        return GSON.toJson(buildJson());
    }

    public JsonObject buildJson() {
        Map<String, Integer> sources = new LinkedHashMap<>();
        StringBuilder mappings = new StringBuilder();
        int previousLine = 0;
        int previousColumn = 0;
        int previousSource = 0;
        int previousOriginalLine = 0;
        int previousOriginalColumn = 0;
        boolean firstInLine = true;

        for (SourceMapEntry entry : sorted()) {
            SourceLocation original = entry.getOriginal();
            if (original == null || !original.isKnown()) continue;
            while (previousLine < entry.getGeneratedLine()) {
                mappings.append(';');
                previousLine++;
                previousColumn = 0;
                firstInLine = true;
            }
            if (!firstInLine) mappings.append(',');
            firstInLine = false;

            Integer source = sources.get(original.getFile());
            if (source == null) {
                source = sources.size();
                sources.put(original.getFile(), source);
            }
            int originalLine = original.getLine() - 1;
            int originalColumn = original.getColumn() - 1;
            encode(mappings, entry.getGeneratedColumn() - previousColumn);
            encode(mappings, source - previousSource);
            encode(mappings, originalLine - previousOriginalLine);
            encode(mappings, originalColumn - previousOriginalColumn);
            previousColumn = entry.getGeneratedColumn();
            previousSource = source;
            previousOriginalLine = originalLine;
            previousOriginalColumn = originalColumn;
        }

        JsonObject json = new JsonObject();
        json.addProperty("version", 3);
        if (file != null) json.addProperty("file", file);
        JsonArray sourceArray = new JsonArray();
        for (String source : sources.keySet()) {
            sourceArray.add(source);
        }
        json.add("sources", sourceArray);
        json.add("names", new JsonArray());
        json.addProperty("mappings", mappings.toString());
        return json;
    }

    private List<SourceMapEntry> sorted() {
        List<SourceMapEntry> result = new ArrayList<>(entries);
        result.sort((a, b) -> a.getGeneratedLine() != b.getGeneratedLine()
                ? Integer.compare(a.getGeneratedLine(), b.getGeneratedLine())
                : Integer.compare(a.getGeneratedColumn(), b.getGeneratedColumn()));
        return result;
    }

    /** base64 VLQ：最低位为符号位，每 5 位一组，第 6 位为延续位 */
    static void encode(StringBuilder out, int value) {
        int vlq = value < 0 ? ((-value) << 1) | 1 : value << 1;
        do {
            int digit = vlq & 0x1F;
            vlq >>>= 5;
            if (vlq > 0) digit |= 0x20;
            out.append(BASE64.charAt(digit));
        } while (vlq > 0);
    }
}
