package scss.runtime.loader;

import com.scsslang.compiler.ast.decl.Stylesheet;

/**
 * 加载器的结果：规范 url、解析后的 AST 与源码
 */
public final class ParsedModule {

    private final String canonicalUrl;
    private final Stylesheet stylesheet;
    private final String source;
    private final boolean dependency;

    public ParsedModule(String canonicalUrl, Stylesheet stylesheet, String source, boolean dependency) {
        this.canonicalUrl = canonicalUrl;
        this.stylesheet = stylesheet;
        this.source = source;
        this.dependency = dependency;
    }

    /** 同一样式表的所有加载共享此 url，用作模块缓存的键 */
    public String getCanonicalUrl() {
        return canonicalUrl;
    }

    public Stylesheet getStylesheet() {
        return stylesheet;
    }

    public String getSource() {
        return source;
    }

    /** 是否为依赖（经加载路径找到）；{@code quietDeps} 时其警告被抑制 */
    public boolean isDependency() {
        return dependency;
    }
}
