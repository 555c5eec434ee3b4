package com.scsslang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import scss.runtime.CompileOptions;
import scss.runtime.OutputStyle;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * scssc 命令行入口（picocli）
 *
 * <p>退出码：0 成功，1 编译错误，2 输入输出错误。</p>
 */
@Command(name = "scssc", version = "ScssLang v0.1.0",
         mixinStandardHelpOptions = true,
         description = "将 SCSS 编译为 CSS")
public class Main implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILE_ERROR = 1;
    static final int EXIT_IO_ERROR = 2;

    @Option(names = {"-s", "--style"}, defaultValue = "expanded",
            description = "输出格式（expanded, compressed）")
    String style;

    @Option(names = "--precision", defaultValue = "10", description = "数字输出精度（0-15）")
    int precision;

    @Option(names = {"-I", "--load-path"}, description = "模块搜索路径，可重复")
    List<Path> loadPaths = new ArrayList<>();

    @Option(names = "--source-map", description = "在输出文件旁生成 .map 文件")
    boolean sourceMap;

    @Option(names = "--no-legacy-import", description = "禁止旧式 @import")
    boolean noLegacyImport;

    @Option(names = {"-q", "--quiet"}, description = "不输出警告与调试信息")
    boolean quiet;

    @Option(names = "--quiet-deps", description = "不输出来自依赖（搜索路径中）的警告")
    boolean quietDeps;

    @Option(names = "--seed", description = "random() 的随机种子，用于可复现的输出")
    Long seed;

    @Option(names = "--no-charset", description = "不输出 @charset 与 BOM")
    boolean noCharset;

    @Option(names = "--stdin", description = "从标准输入读取样式表")
    boolean stdin;

    @Option(names = "--json", description = "以 JSON 输出结果与诊断")
    boolean json;

    @Option(names = {"-v", "--verbose"}, description = "输出编译过程日志")
    boolean verbose;

    @Parameters(index = "0", arity = "0..1", description = "输入文件")
    Path input;

    @Parameters(index = "1", arity = "0..1", description = "输出文件，缺省写到标准输出")
    Path output;

    @Override
    public Integer call() {
        if (verbose) {
            enableVerboseLogging();
        }
        if (input == null && !stdin) {
            System.err.println("错误: 需要输入文件或 --stdin");
            return EXIT_IO_ERROR;
        }
        CompileOptions options;
        try {
            options = buildOptions();
        } catch (IllegalArgumentException e) {
            System.err.println("错误: " + e.getMessage());
            return EXIT_IO_ERROR;
        }
        CompileRunner runner = new CompileRunner(options, loadPaths, quiet, json,
                new PrintWriter(System.out, true), new PrintWriter(System.err, true));
        return stdin ? runner.compileStdin(System.in, output) : runner.compileFile(input, output);
    }

    CompileOptions buildOptions() {
        return CompileOptions.builder()
                .outputStyle(OutputStyle.fromName(style))
                .precision(precision)
                .sourceMap(sourceMap)
                .allowLegacyImport(!noLegacyImport)
                .quietDeps(quietDeps)
                .seed(seed)
                .emitCharset(!noCharset)
                .build();
    }

    /** 把 scss 包的日志级别调到 FINE 并输出到标准错误 */
    private static void enableVerboseLogging() {
        Logger logger = Logger.getLogger("scss");
        logger.setLevel(Level.FINE);
        Handler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        logger.addHandler(handler);
    }

    public static void main(String[] args) {
        String charsetName = getConsoleCharsetName();
        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main());
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(new CommandLine(new Main()).execute(args));
        }
    }

    /**
     * 控制台实际使用的字符编码；native.encoding 反映操作系统原生编码
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
