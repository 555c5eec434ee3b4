package scss.runtime.builtin;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 进程级随机种子来源：未指定种子的编译从这里取种子
 *
 * <p>线程安全；{@link #reseed(long)} 之后产生的种子序列可复现。</p>
 */
public final class SeedSource {

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private static final AtomicLong STATE = new AtomicLong(mix(System.nanoTime()));

    private SeedSource() {}

    /** 取下一个种子 */
    public static long nextSeed() {
        return mix(STATE.addAndGet(GOLDEN_GAMMA));
    }

    /** 重置种子序列 */
    public static void reseed(long seed) {
        STATE.set(seed);
    }

    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
