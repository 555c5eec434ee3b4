package scss.runtime.cache;

import java.util.function.Function;

/**
 * 编译间共享的有界缓存
 *
 * <p>只用于内容寻址的只读结果（解析后的选择器、样式表），实现必须线程安全。</p>
 */
public interface BoundedCache<K, V> {

    /** 缓存值，不存在则返回 null */
    V get(K key);

    void put(K key, V value);

    /**
     * 不存在时计算并缓存；mappingFunction 抛出的异常原样传播，且不缓存任何值
     */
    V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction);

    /** 使单个条目失效 */
    void invalidate(K key);

    long size();

    void clear();

    CacheStats getStats();
}
