package com.scsslang.cli;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import scss.runtime.CompileResult;
import scss.runtime.SassCompiler;
import scss.runtime.loader.InMemoryModuleLoader;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JsonReport 测试")
class JsonReportTest {

    private static CompileResult compile(String source) {
        InMemoryModuleLoader loader = InMemoryModuleLoader.builder()
                .add("_lib.scss", "$x: 1px;")
                .build();
        return new SassCompiler(loader).compile(source, "main.scss");
    }

    @Test
    @DisplayName("成功结果")
    void testSuccess() {
        JsonObject json = JsonReport.toJson(compile("@use 'lib'; @warn \"w\"; a { b: lib.$x; }"));
        assertThat(json.get("success").getAsBoolean()).isTrue();
        assertThat(json.get("css").getAsString()).isEqualTo("a {\n  b: 1px;\n}\n");
        assertThat(json.get("error").isJsonNull()).isTrue();
        assertThat(json.getAsJsonArray("loadedUrls")).hasSize(2);

        JsonObject warning = json.getAsJsonArray("diagnostics").get(0).getAsJsonObject();
        assertThat(warning.get("severity").getAsString()).isEqualTo("warning");
        assertThat(warning.get("message").getAsString()).isEqualTo("w");
        assertThat(warning.getAsJsonObject("span").get("url").getAsString()).isEqualTo("main.scss");
    }

    @Test
    @DisplayName("失败结果")
    void testFailure() {
        JsonObject json = JsonReport.toJson(compile("a { b: $nope; }"));
        assertThat(json.get("success").getAsBoolean()).isFalse();
        assertThat(json.get("css").isJsonNull()).isTrue();
        JsonObject error = json.getAsJsonObject("error");
        assertThat(error.get("severity").getAsString()).isEqualTo("error");
        assertThat(error.get("message").getAsString()).isEqualTo("Undefined variable.");
        assertThat(error.getAsJsonObject("span").get("line").getAsInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("渲染为格式化的 JSON")
    void testRender() {
        String text = JsonReport.render(compile("a { b: c; }"));
        assertThat(text).contains("\"success\": true").contains("\"error\": null");
    }
}
