package scss.runtime.builtin;

import java.util.Locale;
import java.util.Random;

/**
 * 单次编译的随机数发生器（{@code random()}、{@code unique-id()}）
 *
 * <p>每次编译独占一个实例，不跨线程共享。</p>
 */
public final class SassRandom {

    /** 6 位 36 进制数的个数 */
    private static final long UNIQUE_ID_RANGE = 36L * 36 * 36 * 36 * 36 * 36;

    private final long seed;
    private final Random random;

    public SassRandom(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    /** 指定种子时可复现，否则从 {@link SeedSource} 取种子 */
    public static SassRandom create(Long seed) {
        return new SassRandom(seed != null ? seed : SeedSource.nextSeed());
    }

    public long getSeed() {
        return seed;
    }

    /** [0, 1) */
    public double nextDouble() {
        return random.nextDouble();
    }

    /** [0, bound) */
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    /** 形如 {@code u1a2b3c} 的标识符 */
    public String nextUniqueId() {
        String digits = Long.toString(Math.floorMod(random.nextLong(), UNIQUE_ID_RANGE), 36);
        StringBuilder sb = new StringBuilder("u");
        for (int i = digits.length(); i < 6; i++) {
            sb.append('0');
        }
        return sb.append(digits.toLowerCase(Locale.ROOT)).toString();
    }
}
