package scss.runtime.loader;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import scss.runtime.CompileResult;
import scss.runtime.LoadException;
import scss.runtime.SassCompiler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FileSystemModuleLoader 测试")
class FileSystemModuleLoaderTest {

    @TempDir
    Path dir;

    private Path write(String relative, String content) throws IOException {
        Path file = dir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static String slashes(Path path) {
        return path.toAbsolutePath().normalize().toString().replace('\\', '/');
    }

    @Test
    @DisplayName("相对当前文件解析 partial")
    void testRelativePartial() throws IOException {
        Path main = write("main.scss", "");
        Path partial = write("_vars.scss", "$a: 1;");
        FileSystemModuleLoader loader = new FileSystemModuleLoader(Collections.<Path>emptyList());

        ParsedModule module = loader.resolve(LoadRequest.use("vars", "vars", null),
                new LoadContext(slashes(main), false));
        assertThat(module).isNotNull();
        assertThat(module.getCanonicalUrl()).isEqualTo(slashes(partial));
        assertThat(module.isDependency()).isFalse();
    }

    @Test
    @DisplayName("目录的 index 文件")
    void testIndexFile() throws IOException {
        Path main = write("main.scss", "");
        Path index = write("theme/_index.scss", "$c: red;");
        FileSystemModuleLoader loader = new FileSystemModuleLoader(Collections.<Path>emptyList());

        ParsedModule module = loader.resolve(LoadRequest.use("theme", "theme", null),
                new LoadContext(slashes(main), false));
        assertThat(module.getCanonicalUrl()).isEqualTo(slashes(index));
    }

    @Test
    @DisplayName("搜索路径中的文件视为依赖")
    void testLoadPathIsDependency() throws IOException {
        write("vendor/_grid.scss", ".grid { x: 1; }");
        FileSystemModuleLoader loader = new FileSystemModuleLoader(
                Collections.singletonList(dir.resolve("vendor")));

        ParsedModule module = loader.resolve(LoadRequest.use("grid", "grid", null),
                new LoadContext(null, false));
        assertThat(module).isNotNull();
        assertThat(module.isDependency()).isTrue();
    }

    @Test
    @DisplayName("partial 与非 partial 同时存在时报错")
    void testAmbiguous() throws IOException {
        Path main = write("main.scss", "");
        write("_a.scss", "");
        write("a.scss", "");
        FileSystemModuleLoader loader = new FileSystemModuleLoader(Collections.<Path>emptyList());

        assertThatThrownBy(() -> loader.resolve(LoadRequest.use("a", "a", null),
                new LoadContext(slashes(main), false)))
                .isInstanceOf(LoadException.class)
                .hasMessageStartingWith("It's not clear which file to import.");
    }

    @Test
    @DisplayName("其他 scheme 不处理")
    void testOtherScheme() {
        FileSystemModuleLoader loader = new FileSystemModuleLoader(Collections.<Path>emptyList());
        assertThat(loader.resolve(LoadRequest.use("sass:math", "math", null), new LoadContext(null, false)))
                .isNull();
    }

    @Test
    @DisplayName("编译文件时相对加载依赖")
    void testCompileFile() throws IOException {
        write("_colors.scss", "$primary: #333;");
        Path main = write("main.scss", "@use 'colors'; .a { color: colors.$primary; }");

        CompileResult result = new SassCompiler(InMemoryModuleLoader.builder().build()).compileFile(main);
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCss()).isEqualTo(".a {\n  color: #333;\n}\n");
        assertThat(result.getLoadedUrls()).hasSize(2);
    }

    @Test
    @DisplayName("入口文件不存在")
    void testMissingEntry() {
        FileSystemModuleLoader loader = new FileSystemModuleLoader(Collections.<Path>emptyList());
        assertThatThrownBy(() -> loader.loadEntry(dir.resolve("missing.scss")))
                .isInstanceOf(LoadException.class);
    }
}
