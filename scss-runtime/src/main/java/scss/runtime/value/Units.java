package scss.runtime.value;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 单位换算表
 *
 * <p>每个可换算单位归属一个族（长度、角度、时间、频率、分辨率），
 * 并记录其相对于族内规范单位的倍数。</p>
 */
public final class Units {

    private static final Map<String, String> FAMILY = new HashMap<>();
    private static final Map<String, Double> TO_CANONICAL = new HashMap<>();

    static {
        // 长度，规范单位 px
        unit("px", "length", 1);
        unit("in", "length", 96);
        unit("cm", "length", 96 / 2.54);
        unit("mm", "length", 96 / 25.4);
        unit("q", "length", 96 / 101.6);
        unit("pt", "length", 4.0 / 3);
        unit("pc", "length", 16);
        // 角度，规范单位 deg
        unit("deg", "angle", 1);
        unit("grad", "angle", 0.9);
        unit("rad", "angle", 180 / Math.PI);
        unit("turn", "angle", 360);
        // 时间，规范单位 s
        unit("s", "time", 1);
        unit("ms", "time", 0.001);
        // 频率，规范单位 hz
        unit("hz", "frequency", 1);
        unit("khz", "frequency", 1000);
        // 分辨率，规范单位 dppx
        unit("dppx", "resolution", 1);
        unit("dpi", "resolution", 1 / 96.0);
        unit("dpcm", "resolution", 2.54 / 96);
    }

    private Units() {}

    private static void unit(String name, String family, double factor) {
        FAMILY.put(name, family);
        TO_CANONICAL.put(name, factor);
    }

    private static String key(String unit) {
        return unit.toLowerCase(Locale.ROOT);
    }

    /** 单位所属族，未知单位返回 null */
    public static String familyOf(String unit) {
        return FAMILY.get(key(unit));
    }

    /** 两个单位是否相同或可互相换算 */
    public static boolean compatible(String a, String b) {
        if (a.equals(b)) return true;
        String family = familyOf(a);
        return family != null && family.equals(familyOf(b));
    }

    /**
     * 以 from 为单位的 1 个量等于多少个 to；不可换算时返回 null
     */
    public static Double conversionFactor(String from, String to) {
        if (from.equals(to)) return 1.0;
        if (!compatible(from, to)) return null;
        return TO_CANONICAL.get(key(from)) / TO_CANONICAL.get(key(to));
    }

    /** 换算到规范单位的倍数，未知单位为 1 */
    public static double canonicalMultiplier(String unit) {
        Double factor = TO_CANONICAL.get(key(unit));
        return factor == null ? 1 : factor;
    }

    /** 规范单位名，未知单位原样返回 */
    public static String canonicalUnit(String unit) {
        String family = familyOf(unit);
        if (family == null) return unit;
        switch (family) {
            case "length": return "px";
            case "angle": return "deg";
            case "time": return "s";
            case "frequency": return "hz";
            default: return "dppx";
        }
    }

    /** 单位表达式文本，如 {@code px}、{@code px*em/s}、{@code px^-1} */
    public static String unitString(List<String> numerators, List<String> denominators) {
        if (numerators.isEmpty()) {
            if (denominators.isEmpty()) return "";
            if (denominators.size() == 1) return denominators.get(0) + "^-1";
            return "(" + String.join("*", denominators) + ")^-1";
        }
        if (denominators.isEmpty()) return String.join("*", numerators);
        return String.join("*", numerators) + "/" + String.join("*", denominators);
    }
}
