package scss.runtime.loader;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 内存加载器：url → 源码的映射，用于嵌入与测试
 *
 * <p>url 按路径处理，相对于发起者所在目录解析，再退回到根；支持 partial 与 index 文件。
 * 以 {@link Builder#dependency} 加入的源码视为依赖。</p>
 */
public final class InMemoryModuleLoader implements ModuleLoader {

    private static final Logger LOG = Logger.getLogger(InMemoryModuleLoader.class.getName());

    private final Map<String, String> sources;
    private final Set<String> dependencies;
    private final ParsedStylesheetCache parseCache;

    private InMemoryModuleLoader(Map<String, String> sources, Set<String> dependencies,
                                 ParsedStylesheetCache parseCache) {
        this.sources = Collections.unmodifiableMap(sources);
        this.dependencies = Collections.unmodifiableSet(dependencies);
        this.parseCache = parseCache;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 单个源码的便捷构造 */
    public static InMemoryModuleLoader of(String url, String source) {
        return builder().add(url, source).build();
    }

    public boolean contains(String url) {
        return sources.containsKey(url);
    }

    @Override
    public ParsedModule resolve(LoadRequest request, LoadContext context) {
        String url = request.getUrl();
        String found = null;
        if (context.getBaseUrl() != null && !url.startsWith("/")) {
            String relative = UrlCandidates.normalize(UrlCandidates.directoryOf(context.getBaseUrl()) + url);
            found = UrlCandidates.resolve(relative, sources::containsKey);
        }
        if (found == null) {
            found = UrlCandidates.resolve(UrlCandidates.normalize(url), sources::containsKey);
        }
        if (found == null) {
            return null;
        }
        LOG.fine("Resolved " + request + " to " + found);
        String source = sources.get(found);
        return new ParsedModule(found, parseCache.parse(found, source), source,
                context.isFromDependency() || dependencies.contains(found));
    }

    public static final class Builder {
        private final Map<String, String> sources = new LinkedHashMap<String, String>();
        private final Set<String> dependencies = new HashSet<String>();
        private ParsedStylesheetCache parseCache = ParsedStylesheetCache.shared();

        private Builder() {}

        public Builder add(String url, String source) {
            sources.put(UrlCandidates.normalize(url), source);
            return this;
        }

        /** 加入依赖源码（{@code quietDeps} 时其警告被抑制） */
        public Builder dependency(String url, String source) {
            String normalized = UrlCandidates.normalize(url);
            sources.put(normalized, source);
            dependencies.add(normalized);
            return this;
        }

        public Builder parseCache(ParsedStylesheetCache parseCache) {
            this.parseCache = parseCache;
            return this;
        }

        public InMemoryModuleLoader build() {
            return new InMemoryModuleLoader(new LinkedHashMap<String, String>(sources),
                    new HashSet<String>(dependencies), parseCache);
        }
    }
}
