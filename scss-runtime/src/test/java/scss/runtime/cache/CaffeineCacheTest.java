package scss.runtime.cache;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 共享缓存功能测试
 */
public class CaffeineCacheTest {

    @Test
    public void testBasicOperations() {
        BoundedCache<String, String> cache = new CaffeineCache<>("test", 100);

        cache.put(".a", ".a");
        assertEquals(".a", cache.get(".a"));
        assertNull(cache.get(".b"));

        String value = cache.computeIfAbsent(".b > .c", k -> k.replace(" ", ""));
        assertEquals(".b>.c", value);
        assertEquals(2L, cache.size());

        cache.invalidate(".a");
        assertNull(cache.get(".a"));
    }

    @Test
    public void testComputeOnlyOnce() {
        BoundedCache<String, Integer> cache = new CaffeineCache<>("test", 100);
        AtomicInteger calls = new AtomicInteger();

        assertEquals(Integer.valueOf(3), cache.computeIfAbsent("abc", k -> { calls.incrementAndGet(); return k.length(); }));
        assertEquals(Integer.valueOf(3), cache.computeIfAbsent("abc", k -> { calls.incrementAndGet(); return -1; }));
        assertEquals(1, calls.get());
    }

    @Test
    public void testFailedComputeIsNotCached() {
        BoundedCache<String, String> cache = new CaffeineCache<>("test", 100);

        assertThrows(IllegalStateException.class, () -> cache.computeIfAbsent("bad", k -> {
            throw new IllegalStateException("broken");
        }));
        assertNull(cache.get("bad"));
        assertEquals("ok", cache.computeIfAbsent("bad", k -> "ok"));
    }

    @Test
    public void testStats() {
        BoundedCache<String, String> cache = new CaffeineCache<>("selectors", 100);

        cache.put("a", "A");
        cache.get("a");  // hit
        cache.get("b");  // miss

        CacheStats stats = cache.getStats();
        assertEquals("selectors", stats.getName());
        assertEquals(1L, stats.getHitCount());
        assertEquals(1L, stats.getMissCount());
        assertEquals(0.5, stats.getHitRate(), 0.01);
        assertEquals(100L, stats.getMaximumSize());
    }

    @Test
    public void testClear() {
        BoundedCache<String, String> cache = new CaffeineCache<>("test", 100);
        cache.put("a", "A");
        cache.put("b", "B");

        cache.clear();
        assertEquals(0L, cache.size());
        assertNull(cache.get("a"));
    }

    @Test
    public void testInvalidSize() {
        assertThrows(IllegalArgumentException.class, () -> new CaffeineCache<String, String>("test", 0));
    }
}
