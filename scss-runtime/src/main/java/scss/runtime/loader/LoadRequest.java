package scss.runtime.loader;

import com.scsslang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.Set;

/**
 * 一次加载请求：旧式导入、{@code @use} 或 {@code @forward}
 */
public final class LoadRequest {

    public enum Kind {
        LEGACY_IMPORT,
        MODULE_USE,
        MODULE_FORWARD
    }

    private final Kind kind;
    private final String url;
    private final SourceLocation span;
    private final String namespace;        // MODULE_USE，null 表示 as *
    private final Set<String> shown;       // MODULE_FORWARD，可选
    private final Set<String> hidden;      // MODULE_FORWARD，可选

    private LoadRequest(Kind kind, String url, SourceLocation span, String namespace,
                        Set<String> shown, Set<String> hidden) {
        this.kind = kind;
        this.url = url;
        this.span = span;
        this.namespace = namespace;
        this.shown = shown;
        this.hidden = hidden;
    }

    public static LoadRequest legacyImport(String url, SourceLocation span) {
        return new LoadRequest(Kind.LEGACY_IMPORT, url, span, null, null, null);
    }

    public static LoadRequest use(String url, String namespace, SourceLocation span) {
        return new LoadRequest(Kind.MODULE_USE, url, span, namespace, null, null);
    }

    public static LoadRequest forward(String url, Set<String> shown, Set<String> hidden, SourceLocation span) {
        return new LoadRequest(Kind.MODULE_FORWARD, url, span, null,
                shown != null ? Collections.unmodifiableSet(shown) : null,
                hidden != null ? Collections.unmodifiableSet(hidden) : null);
    }

    public Kind getKind() {
        return kind;
    }

    /** 源码中书写的 url */
    public String getUrl() {
        return url;
    }

    public SourceLocation getSpan() {
        return span;
    }

    public String getNamespace() {
        return namespace;
    }

    public Set<String> getShown() {
        return shown;
    }

    public Set<String> getHidden() {
        return hidden;
    }

    @Override
    public String toString() {
        return kind + " \"" + url + "\"";
    }
}
