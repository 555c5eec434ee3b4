package scss.runtime.selector;

import com.scsslang.compiler.ast.SourceLocation;
import scss.runtime.cache.BoundedCache;
import scss.runtime.cache.CacheStats;
import scss.runtime.cache.CaffeineCache;

/**
 * 进程级选择器解析缓存，并发编译共享
 *
 * <p>选择器列表不可变，按文本与解析选项作键；解析失败不缓存。</p>
 *
 * <p>缓存的选择器对象不带源码位置：{@code location} 只用于本次解析的错误报告，
 * 因此不同文件中的同一段选择器文本可以共享结果，输出规则的 span 由各自的规则节点提供。</p>
 */
public final class SelectorCache {

    private static final int DEFAULT_MAXIMUM_SIZE = 4096;

    private static final SelectorCache SHARED = new SelectorCache(DEFAULT_MAXIMUM_SIZE);

    private final BoundedCache<Key, SelectorList> cache;

    public SelectorCache(long maximumSize) {
        this.cache = new CaffeineCache<>("selectors", maximumSize);
    }

    public static SelectorCache shared() {
        return SHARED;
    }

    /**
     * 解析或取出缓存的选择器列表
     *
     * @param location 仅用于语法错误的位置
     */
    public SelectorList parse(String text, SourceLocation location, boolean allowParent, boolean allowPlaceholder) {
        return cache.computeIfAbsent(new Key(text, allowParent, allowPlaceholder),
                key -> SelectorParser.parse(text, location, allowParent, allowPlaceholder));
    }

    public CacheStats getStats() {
        return cache.getStats();
    }

    public void clear() {
        cache.clear();
    }

    private static final class Key {
        private final String text;
        private final boolean allowParent;
        private final boolean allowPlaceholder;

        Key(String text, boolean allowParent, boolean allowPlaceholder) {
            this.text = text;
            this.allowParent = allowParent;
            this.allowPlaceholder = allowPlaceholder;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Key)) return false;
            Key other = (Key) o;
            return text.equals(other.text) && allowParent == other.allowParent
                    && allowPlaceholder == other.allowPlaceholder;
        }

        @Override
        public int hashCode() {
            return (text.hashCode() * 31 + (allowParent ? 1 : 0)) * 31 + (allowPlaceholder ? 1 : 0);
        }
    }
}
