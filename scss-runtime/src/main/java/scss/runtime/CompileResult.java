package scss.runtime;

import scss.runtime.serializer.SourceMapEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次编译的结果
 *
 * <p>成功时 {@link #getCss()} 非 null；失败时 {@link #getError()} 非 null，CSS 为 null。
 * 两种情况下 {@link #getDiagnostics()} 都包含编译过程中产生的警告与调试输出。</p>
 */
public final class CompileResult {

    private final String css;
    private final String sourceMap;
    private final List<SourceMapEntry> sourceMapEntries;
    private final List<Diagnostic> diagnostics;
    private final List<String> loadedUrls;
    private final Diagnostic error;

    private CompileResult(String css, String sourceMap, List<SourceMapEntry> sourceMapEntries,
                          List<Diagnostic> diagnostics, List<String> loadedUrls, Diagnostic error) {
        this.css = css;
        this.sourceMap = sourceMap;
        this.sourceMapEntries = Collections.unmodifiableList(new ArrayList<>(sourceMapEntries));
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
        this.loadedUrls = Collections.unmodifiableList(new ArrayList<>(loadedUrls));
        this.error = error;
    }

    static CompileResult success(String css, String sourceMap, List<SourceMapEntry> entries,
                                 List<Diagnostic> diagnostics, List<String> loadedUrls) {
        return new CompileResult(css, sourceMap, entries, diagnostics, loadedUrls, null);
    }

    static CompileResult failure(Diagnostic error, List<Diagnostic> diagnostics, List<String> loadedUrls) {
        return new CompileResult(null, null, Collections.<SourceMapEntry>emptyList(), diagnostics, loadedUrls, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** 生成的 CSS，失败时为 null */
    public String getCss() {
        return css;
    }

    /** v3 source map JSON，未开启或失败时为 null */
    public String getSourceMap() {
        return sourceMap;
    }

    public List<SourceMapEntry> getSourceMapEntries() {
        return sourceMapEntries;
    }

    /** 警告、弃用提示与 {@code @debug} 输出，按产生顺序 */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /** 本次编译加载过的规范 URL（含入口），按首次加载顺序 */
    public List<String> getLoadedUrls() {
        return loadedUrls;
    }

    public Diagnostic getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "CompileResult{success, " + css.length() + " chars, " + diagnostics.size() + " diagnostics}"
                : "CompileResult{failed: " + error + "}";
    }
}
