package com.scsslang.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import scss.runtime.CompileOptions;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CompileRunner 测试")
class CompileRunnerTest {

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private CompileRunner runner(CompileOptions options, boolean json) {
        return new CompileRunner(options, Collections.<Path>emptyList(), false, json,
                new PrintWriter(out, true), new PrintWriter(err, true));
    }

    private CompileRunner runner() {
        return runner(CompileOptions.defaults(), false);
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("输入文件不存在")
    void testMissingInput() {
        int code = runner().compileFile(dir.resolve("nope.scss"), null);
        assertThat(code).isEqualTo(Main.EXIT_IO_ERROR);
        assertThat(err.toString()).contains("错误: 文件不存在 - ");
    }

    @Test
    @DisplayName("编译结果写到标准输出")
    void testStdout() throws IOException {
        Path input = write("main.scss", "$c: red; .a { color: $c; }");
        int code = runner().compileFile(input, null);
        assertThat(code).isEqualTo(Main.EXIT_OK);
        assertThat(out.toString()).startsWith(".a {\n  color: red;\n}\n");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    @DisplayName("写输出文件与 source map")
    void testOutputFileWithSourceMap() throws IOException {
        Path input = write("main.scss", ".a { b: c; }");
        Path output = dir.resolve("build/main.css");
        CompileOptions options = CompileOptions.builder().sourceMap(true).build();

        int code = runner(options, false).compileFile(input, output);
        assertThat(code).isEqualTo(Main.EXIT_OK);
        assertThat(read(output)).startsWith(".a {\n  b: c;\n}\n")
                .endsWith("/*# sourceMappingURL=main.css.map */\n");
        assertThat(read(dir.resolve("build/main.css.map"))).contains("\"version\":3");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @DisplayName("编译错误返回 1 并输出诊断")
    void testCompileError() throws IOException {
        Path input = write("main.scss", ".a {\n  color: $missing;\n}\n");
        int code = runner().compileFile(input, null);
        assertThat(code).isEqualTo(Main.EXIT_COMPILE_ERROR);
        assertThat(err.toString()).startsWith("Error: Undefined variable.")
                .contains("main.scss:2:10");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @DisplayName("警告输出到标准错误，不影响结果")
    void testWarning() throws IOException {
        Path input = write("main.scss", "@warn \"careful\";\n.a { b: c; }");
        int code = runner().compileFile(input, null);
        assertThat(code).isEqualTo(Main.EXIT_OK);
        assertThat(err.toString()).startsWith("Warning: careful");
        assertThat(out.toString()).contains(".a {");
    }

    @Test
    @DisplayName("JSON 模式")
    void testJson() throws IOException {
        Path input = write("main.scss", ".a { b: c; }");
        int code = runner(CompileOptions.defaults(), true).compileFile(input, null);
        assertThat(code).isEqualTo(Main.EXIT_OK);
        assertThat(out.toString()).contains("\"success\": true").contains("\"loadedUrls\"");
    }

    @Test
    @DisplayName("读取标准输入")
    void testStdin() {
        ByteArrayInputStream in = new ByteArrayInputStream(
                "a { b: 1 + 2; }".getBytes(StandardCharsets.UTF_8));
        int code = runner(CompileOptions.compressed(), false).compileStdin(in, null);
        assertThat(code).isEqualTo(Main.EXIT_OK);
        assertThat(out.toString()).startsWith("a{b:3}");
    }
}
