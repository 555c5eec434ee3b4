package scss.runtime.loader;

import com.scsslang.compiler.ast.decl.Stylesheet;
import com.scsslang.compiler.parser.ParseException;
import com.scsslang.compiler.parser.Parser;
import scss.runtime.ParseDelegationException;
import scss.runtime.cache.BoundedCache;
import scss.runtime.cache.CacheStats;
import scss.runtime.cache.CaffeineCache;

/**
 * 解析结果缓存：以规范 url 和源码文本为键，AST 只读，可在编译间共享
 */
public final class ParsedStylesheetCache {

    private static final int DEFAULT_MAXIMUM_SIZE = 512;

    private static final ParsedStylesheetCache SHARED = new ParsedStylesheetCache(DEFAULT_MAXIMUM_SIZE);

    private final BoundedCache<Key, Stylesheet> cache;

    public ParsedStylesheetCache(long maximumSize) {
        this.cache = new CaffeineCache<Key, Stylesheet>("stylesheets", maximumSize);
    }

    public static ParsedStylesheetCache shared() {
        return SHARED;
    }

    /**
     * 解析（命中缓存时直接返回）
     *
     * @throws ParseDelegationException 语法错误
     */
    public Stylesheet parse(String canonicalUrl, String source) {
        Key key = new Key(canonicalUrl, source);
        Stylesheet cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        Stylesheet stylesheet;
        try {
            stylesheet = Parser.parse(source, canonicalUrl);
        } catch (ParseException e) {
            throw new ParseDelegationException(e);
        }
        cache.put(key, stylesheet);
        return stylesheet;
    }

    public CacheStats getStats() {
        return cache.getStats();
    }

    public void clear() {
        cache.clear();
    }

    private static final class Key {
        private final String url;
        private final String source;

        Key(String url, String source) {
            this.url = url;
            this.source = source;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key key = (Key) o;
            return url.equals(key.url) && source.equals(key.source);
        }

        @Override
        public int hashCode() {
            return 31 * url.hashCode() + source.hashCode();
        }
    }
}
