package scss.runtime.value;

/**
 * 带容差的浮点比较与取整
 *
 * <p>容差为 10 的 -(精度+1) 次方，精度固定为 10 位小数。</p>
 */
public final class NumberUtil {

    public static final int PRECISION = 10;
    public static final double EPSILON = Math.pow(10, -(PRECISION + 1));
    private static final double INVERSE_EPSILON = 1 / EPSILON;

    private NumberUtil() {}

    public static boolean fuzzyEquals(double a, double b) {
        if (a == b) return true;
        return Math.abs(a - b) <= EPSILON;
    }

    public static int fuzzyHashCode(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || Math.abs(value) > 1e7) {
            return Double.hashCode(value);
        }
        return Long.hashCode(Math.round(value * INVERSE_EPSILON / 10));
    }

    public static boolean fuzzyLessThan(double a, double b) {
        return a < b && !fuzzyEquals(a, b);
    }

    public static boolean fuzzyLessThanOrEquals(double a, double b) {
        return a < b || fuzzyEquals(a, b);
    }

    public static boolean fuzzyGreaterThan(double a, double b) {
        return a > b && !fuzzyEquals(a, b);
    }

    public static boolean fuzzyGreaterThanOrEquals(double a, double b) {
        return a > b || fuzzyEquals(a, b);
    }

    public static boolean fuzzyIsInt(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return false;
        return fuzzyEquals(value, Math.rint(value));
    }

    /** 容差内为整数时返回该整数，否则返回 null */
    public static Integer fuzzyAsInt(double value) {
        return fuzzyIsInt(value) ? (int) Math.rint(value) : null;
    }

    /** 四舍五入（.5 远离零），容差内的 .5 也视为 .5 */
    public static double fuzzyRound(double value) {
        if (value > 0) {
            return fuzzyLessThan(value % 1, 0.5) ? Math.floor(value) : Math.ceil(value);
        }
        return fuzzyLessThanOrEquals(value % 1, -0.5) ? Math.floor(value) : Math.ceil(value);
    }

    /** 将 value 夹在 [min, max] 内，容差内的越界视为边界 */
    public static double fuzzyCheckRange(double value, double min, double max) {
        if (fuzzyEquals(value, min)) return min;
        if (fuzzyEquals(value, max)) return max;
        if (value > min && value < max) return value;
        return Double.NaN;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /** 结果符号与除数一致的取模 */
    public static double moduloLikeSass(double num1, double num2) {
        if (num2 == 0) return Double.NaN;
        double result = num1 % num2;
        if (result == 0) return 0;
        return (result < 0) != (num2 < 0) ? result + num2 : result;
    }
}
