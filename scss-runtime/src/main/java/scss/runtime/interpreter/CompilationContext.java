package scss.runtime.interpreter;

import com.scsslang.compiler.ast.SourceLocation;
import scss.runtime.CompileOptions;
import scss.runtime.Diagnostic;
import scss.runtime.builtin.BuiltinRegistry;
import scss.runtime.builtin.SassRandom;
import scss.runtime.css.CssImport;
import scss.runtime.css.CssStyleRule;
import scss.runtime.loader.ModuleLoader;
import scss.runtime.selector.ExtensionStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次编译内各模块求值器共享的状态
 *
 * <p>每次编译一个实例，单线程使用。只读的内建函数表是进程级共享的。</p>
 */
public final class CompilationContext {

    private final CompileOptions options;
    private final ModuleLoader loader;
    private final BuiltinRegistry registry;
    private final ModuleManager modules = new ModuleManager();
    private final SassRandom random;
    private final SassCallStack callStack = new SassCallStack();
    private final ExtensionStore extensions = new ExtensionStore();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /** 全部样式规则，按创建顺序（{@code @extend} 作用对象） */
    private final List<CssStyleRule> styleRules = new ArrayList<>();

    /** 提升到输出顶部的纯 CSS {@code @import} */
    private final List<CssImport> imports = new ArrayList<>();

    public CompilationContext(CompileOptions options, ModuleLoader loader, BuiltinRegistry registry) {
        this.options = options;
        this.loader = loader;
        this.registry = registry;
        this.random = SassRandom.create(options.getSeed());
    }

    public CompileOptions getOptions() { return options; }
    public ModuleLoader getLoader() { return loader; }
    public BuiltinRegistry getRegistry() { return registry; }
    public ModuleManager getModules() { return modules; }
    public SassRandom getRandom() { return random; }
    public SassCallStack getCallStack() { return callStack; }
    public ExtensionStore getExtensions() { return extensions; }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    void addStyleRule(CssStyleRule rule) {
        styleRules.add(rule);
    }

    public List<CssStyleRule> getStyleRules() {
        return Collections.unmodifiableList(styleRules);
    }

    void addImport(CssImport cssImport) {
        imports.add(cssImport);
    }

    public List<CssImport> getImports() {
        return Collections.unmodifiableList(imports);
    }

    // ============ 诊断 ============

    /**
     * 记录警告或弃用提示；开启 quietDeps 时忽略来自依赖样式表的警告
     */
    void warn(String message, SourceLocation span, boolean deprecation) {
        if (options.isQuietDeps() && span != null && modules.isDependency(span.getFile())) {
            return;
        }
        Diagnostic.Severity severity = deprecation ? Diagnostic.Severity.DEPRECATION : Diagnostic.Severity.WARNING;
        diagnostics.add(new Diagnostic(severity, message, span, Collections.<SourceLocation>emptyList(),
                callStack.formatStackTrace(), sourceLine(span)));
    }

    void debug(String message, SourceLocation span) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.DEBUG, message, span));
    }

    /** 取位置所在的源码行，源码未知时返回 null */
    public String sourceLine(SourceLocation span) {
        if (span == null || !span.isKnown()) return null;
        String source = modules.getSource(span.getFile());
        if (source == null) return null;
        int line = 1;
        int start = 0;
        while (line < span.getLine()) {
            int next = source.indexOf('\n', start);
            if (next < 0) return null;
            start = next + 1;
            line++;
        }
        int end = source.indexOf('\n', start);
        String text = end < 0 ? source.substring(start) : source.substring(start, end);
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
    }
}
