package scss.runtime;

import com.scsslang.compiler.ast.decl.Stylesheet;
import scss.runtime.builtin.BuiltinRegistry;
import scss.runtime.css.CssImport;
import scss.runtime.css.CssNode;
import scss.runtime.css.CssStyleRule;
import scss.runtime.css.CssStylesheet;
import scss.runtime.interpreter.CompilationContext;
import scss.runtime.interpreter.Evaluator;
import scss.runtime.interpreter.ModuleManager;
import scss.runtime.loader.CompositeModuleLoader;
import scss.runtime.loader.FileSystemModuleLoader;
import scss.runtime.loader.ModuleLoader;
import scss.runtime.loader.ParsedModule;
import scss.runtime.loader.ParsedStylesheetCache;
import scss.runtime.scope.Configuration;
import scss.runtime.scope.Module;
import scss.runtime.scope.SassModule;
import scss.runtime.serializer.CssSerializer;
import scss.runtime.serializer.SourceMapBuilder;
import scss.runtime.serializer.SourceMapEntry;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SCSS 编译入口
 *
 * <p>实例不可变，可在多个线程间共享；每次编译各自创建 {@link CompilationContext}。</p>
 *
 * <pre>
 * SassCompiler compiler = new SassCompiler(InMemoryModuleLoader.of("_vars.scss", "$c: red;"));
 * CompileResult result = compiler.compile("@use 'vars'; a { color: vars.$c; }", "main.scss");
 * </pre>
 */
public final class SassCompiler {

    private static final Logger LOG = Logger.getLogger(SassCompiler.class.getName());

    private final ModuleLoader loader;
    private final CompileOptions options;
    private final BuiltinRegistry registry;

    public SassCompiler(ModuleLoader loader) {
        this(loader, CompileOptions.defaults());
    }

    public SassCompiler(ModuleLoader loader, CompileOptions options) {
        this(loader, options, BuiltinRegistry.standard());
    }

    public SassCompiler(ModuleLoader loader, CompileOptions options, BuiltinRegistry registry) {
        if (loader == null) throw new IllegalArgumentException("loader must not be null");
        if (options == null) throw new IllegalArgumentException("options must not be null");
        this.loader = loader;
        this.options = options;
        this.registry = registry;
    }

    public CompileOptions getOptions() {
        return options;
    }

    public ModuleLoader getLoader() {
        return loader;
    }

    /** 使用另一组选项的编译器，共享加载器 */
    public SassCompiler withOptions(CompileOptions newOptions) {
        return new SassCompiler(loader, newOptions, registry);
    }

    // ============ 编译 ============

    /**
     * 编译源码；出错时返回失败的结果而不抛出
     *
     * @param url 入口的规范 URL，用于相对加载与诊断
     */
    public CompileResult compile(String source, String url) {
        CompilationContext context = newContext();
        try {
            Stylesheet stylesheet = ParsedStylesheetCache.shared().parse(url, source);
            return run(context, stylesheet, url, source);
        } catch (SassRuntimeException e) {
            return failed(context, e);
        } catch (StackOverflowError e) {
            return failed(context, stackOverflow());
        }
    }

    /** 编译已解析的样式表 */
    public CompileResult compile(Stylesheet stylesheet) {
        CompilationContext context = newContext();
        try {
            return run(context, stylesheet, stylesheet.getUrl(), null);
        } catch (SassRuntimeException e) {
            return failed(context, e);
        } catch (StackOverflowError e) {
            return failed(context, stackOverflow());
        }
    }

    /**
     * 编译文件；依赖先相对于该文件解析，找不到再交给本编译器的加载器
     */
    public CompileResult compileFile(Path file) {
        FileSystemModuleLoader files = fileLoader();
        ModuleLoader fileAware = files == loader ? loader : CompositeModuleLoader.of(files, loader);
        CompilationContext context = newContext(fileAware);
        try {
            ParsedModule entry = files.loadEntry(file);
            return run(context, entry.getStylesheet(), entry.getCanonicalUrl(), entry.getSource());
        } catch (SassRuntimeException e) {
            return failed(context, e);
        } catch (StackOverflowError e) {
            return failed(context, stackOverflow());
        }
    }

    /**
     * 编译并返回 CSS
     *
     * @throws SassRuntimeException 编译失败
     */
    public String compileOrThrow(String source, String url) {
        CompilationContext context = newContext();
        try {
            Stylesheet stylesheet = ParsedStylesheetCache.shared().parse(url, source);
            return run(context, stylesheet, url, source).getCss();
        } catch (StackOverflowError e) {
            throw stackOverflow();
        }
    }

    /** 在公共线程池中异步编译 */
    public CompletableFuture<CompileResult> compileAsync(String source, String url) {
        return CompletableFuture.supplyAsync(() -> compile(source, url));
    }

    public CompletableFuture<CompileResult> compileAsync(String source, String url, Executor executor) {
        return CompletableFuture.supplyAsync(() -> compile(source, url), executor);
    }

    // ============ 内部 ============

    private CompilationContext newContext() {
        return new CompilationContext(options, loader, registry);
    }

    private CompilationContext newContext(ModuleLoader contextLoader) {
        return new CompilationContext(options, contextLoader, registry);
    }

    private FileSystemModuleLoader fileLoader() {
        return loader instanceof FileSystemModuleLoader
                ? (FileSystemModuleLoader) loader
                : new FileSystemModuleLoader(Collections.<Path>emptyList());
    }

    private CompileResult run(CompilationContext context, Stylesheet stylesheet, String url, String source) {
        long start = System.nanoTime();
        ModuleManager modules = context.getModules();
        modules.begin(url, stylesheet.getLocation(), true);
        modules.recordSource(url, source, false);
        SassModule entry;
        try {
            entry = new Evaluator(context, url, false, Configuration.empty()).evaluate(stylesheet);
        } catch (RuntimeException e) {
            modules.abort(url);
            throw e;
        }
        modules.finish(url, entry);

        CssStylesheet output = assemble(context, entry, stylesheet);
        List<CssStyleRule> rules = context.getStyleRules();
        context.getExtensions().apply(rules);
        for (CssStyleRule rule : rules) {
            rule.setSelector(rule.getSelector().withoutPlaceholders());
        }
        output.freeze();

        CssSerializer.Result serialized = CssSerializer.serialize(output, options.getOutputStyle(),
                options.getPrecision(), options.isEmitCharset());
        String sourceMap = options.isSourceMap()
                ? new SourceMapBuilder(serialized.getMappings()).file(url).build()
                : null;
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("Compiled %s in %.2f ms (%d modules, %d style rules)", url,
                    (System.nanoTime() - start) / 1e6, modules.getLoadedUrls().size(), rules.size()));
        }
        return CompileResult.success(serialized.getCss(), sourceMap,
                options.isSourceMap() ? serialized.getMappings() : Collections.<SourceMapEntry>emptyList(),
                context.getDiagnostics(), modules.getLoadedUrls());
    }

    /**
     * 合并输出：纯 CSS {@code @import} 在最前，之后每个模块的 CSS 在其依赖之后出现一次，入口最后
     */
    private static CssStylesheet assemble(CompilationContext context, SassModule entry, Stylesheet stylesheet) {
        CssStylesheet output = new CssStylesheet(stylesheet.getLocation());
        for (CssImport cssImport : context.getImports()) {
            output.addChild(cssImport);
        }
        List<Module> ordered = new ArrayList<>();
        collect(entry, new HashSet<String>(), ordered);
        for (Module module : ordered) {
            for (CssNode child : new ArrayList<>(module.getCss().getChildren())) {
                output.addChild(child);
            }
        }
        return output;
    }

    private static void collect(Module module, Set<String> visited, List<Module> ordered) {
        if (module.isBuiltin() || !visited.add(module.getUrl())) return;
        for (Module upstream : module.getUpstream()) {
            collect(upstream, visited, ordered);
        }
        ordered.add(module);
    }

    private static CompileResult failed(CompilationContext context, SassRuntimeException e) {
        LOG.log(Level.FINE, "Compilation failed", e);
        return CompileResult.failure(e.toDiagnostic(), context.getDiagnostics(), context.getModules().getLoadedUrls());
    }

    private static RuntimeLimitException stackOverflow() {
        return new RuntimeLimitException("Stack depth exceeded.");
    }
}
