package com.scsslang.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import scss.runtime.CompileOptions;
import scss.runtime.OutputStyle;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Main 测试")
class MainTest {

    private static Main parse(String... args) {
        Main main = new Main();
        new CommandLine(main).parseArgs(args);
        return main;
    }

    @Test
    @DisplayName("默认选项")
    void testDefaults() {
        CompileOptions options = parse("in.scss").buildOptions();
        assertThat(options.getOutputStyle()).isEqualTo(OutputStyle.EXPANDED);
        assertThat(options.getPrecision()).isEqualTo(10);
        assertThat(options.isAllowLegacyImport()).isTrue();
        assertThat(options.isEmitCharset()).isTrue();
    }

    @Test
    @DisplayName("命令行选项映射到编译选项")
    void testOptions() {
        Main main = parse("-s", "compressed", "--precision", "3", "--no-legacy-import",
                "--quiet-deps", "--seed", "42", "--no-charset", "--source-map", "in.scss", "out.css");
        CompileOptions options = main.buildOptions();
        assertThat(options.getOutputStyle()).isEqualTo(OutputStyle.COMPRESSED);
        assertThat(options.getPrecision()).isEqualTo(3);
        assertThat(options.isAllowLegacyImport()).isFalse();
        assertThat(options.isQuietDeps()).isTrue();
        assertThat(options.getSeed()).isEqualTo(42L);
        assertThat(options.isEmitCharset()).isFalse();
        assertThat(options.isSourceMap()).isTrue();
        assertThat(main.output.toString()).isEqualTo("out.css");
    }

    @Test
    @DisplayName("未知输出格式")
    void testUnknownStyle() {
        assertThatThrownBy(() -> parse("-s", "nested", "in.scss").buildOptions())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown output style: nested");
    }
}
