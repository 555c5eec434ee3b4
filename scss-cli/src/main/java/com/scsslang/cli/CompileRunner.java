package com.scsslang.cli;

import scss.runtime.CompileOptions;
import scss.runtime.CompileResult;
import scss.runtime.Diagnostic;
import scss.runtime.SassCompiler;
import scss.runtime.loader.FileSystemModuleLoader;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 编译执行器：读入、编译、写出结果并报告诊断
 */
public class CompileRunner {

    private final CompileOptions options;
    private final List<Path> loadPaths;
    private final boolean quiet;
    private final boolean json;
    private final PrintWriter out;
    private final PrintWriter err;

    public CompileRunner(CompileOptions options, List<Path> loadPaths, boolean quiet, boolean json,
                         PrintWriter out, PrintWriter err) {
        this.options = options;
        this.loadPaths = loadPaths;
        this.quiet = quiet;
        this.json = json;
        this.out = out;
        this.err = err;
    }

    private SassCompiler compiler() {
        return new SassCompiler(new FileSystemModuleLoader(loadPaths), options);
    }

    /**
     * 编译文件
     *
     * @param output 输出文件，为 null 时写到标准输出
     * @return 退出码
     */
    public int compileFile(Path input, Path output) {
        if (!Files.isRegularFile(input)) {
            err.println("错误: 文件不存在 - " + input);
            return Main.EXIT_IO_ERROR;
        }
        return report(compiler().compileFile(input), output);
    }

    /** 编译标准输入 */
    public int compileStdin(InputStream in, Path output) {
        String source;
        try {
            source = readAll(in);
        } catch (IOException e) {
            err.println("错误: 无法读取标准输入 - " + e.getMessage());
            return Main.EXIT_IO_ERROR;
        }
        return report(compiler().compile(source, "stdin"), output);
    }

    private int report(CompileResult result, Path output) {
        if (json) {
            out.println(JsonReport.render(result));
            return result.isSuccess() ? Main.EXIT_OK : Main.EXIT_COMPILE_ERROR;
        }
        if (!quiet) {
            for (Diagnostic diagnostic : result.getDiagnostics()) {
                err.println(DiagnosticFormatter.format(diagnostic));
                err.println();
            }
        }
        if (!result.isSuccess()) {
            err.println(DiagnosticFormatter.format(result.getError()));
            return Main.EXIT_COMPILE_ERROR;
        }
        if (output == null) {
            out.print(result.getCss());
            if (!result.getCss().isEmpty()) out.println();
            out.flush();
            return Main.EXIT_OK;
        }
        try {
            writeOutput(result, output);
        } catch (IOException e) {
            err.println("错误: 无法写入 " + output + " - " + e.getMessage());
            return Main.EXIT_IO_ERROR;
        }
        return Main.EXIT_OK;
    }

    private void writeOutput(CompileResult result, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        StringBuilder css = new StringBuilder(result.getCss());
        if (result.getSourceMap() != null) {
            Path mapFile = output.resolveSibling(output.getFileName() + ".map");
            Files.write(mapFile, result.getSourceMap().getBytes(StandardCharsets.UTF_8));
            if (css.length() > 0) css.append('\n');
            css.append("/*# sourceMappingURL=").append(mapFile.getFileName()).append(" */");
        }
        if (css.length() > 0) css.append('\n');
        Files.write(output, css.toString().getBytes(StandardCharsets.UTF_8));
    }

    private static String readAll(InputStream in) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[8192];
        int n;
        while ((n = in.read(chunk)) != -1) {
            buffer.write(chunk, 0, n);
        }
        return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
    }
}
