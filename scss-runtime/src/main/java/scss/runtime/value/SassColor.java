package scss.runtime.value;

/**
 * 颜色：RGB 通道为 0-255 整数，alpha 为 0-1
 *
 * <p>由字面量产生的颜色保留原始文本（十六进制、颜色名），
 * 任何运算得到的新颜色都不再携带原始文本。</p>
 */
public final class SassColor extends SassValue {

    private final int red;
    private final int green;
    private final int blue;
    private final double alpha;
    private final String originalText;

    private SassColor(int red, int green, int blue, double alpha, String originalText) {
        this.red = red;
        this.green = green;
        this.blue = blue;
        this.alpha = alpha;
        this.originalText = originalText;
    }

    public static SassColor rgb(double red, double green, double blue, double alpha) {
        return new SassColor(channel(red), channel(green), channel(blue),
                NumberUtil.clamp(alpha, 0, 1), null);
    }

    public static SassColor rgb(int red, int green, int blue) {
        return rgb(red, green, blue, 1);
    }

    /** 字面量颜色，保留原始文本 */
    public static SassColor literal(int rgb, double alpha, String originalText) {
        return new SassColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF,
                NumberUtil.clamp(alpha, 0, 1), originalText);
    }

    /**
     * 由 HSL 构造：色相单位为度，饱和度与亮度为百分比
     */
    public static SassColor hsl(double hue, double saturation, double lightness, double alpha) {
        double h = (((hue % 360) + 360) % 360) / 360;
        double s = NumberUtil.clamp(saturation, 0, 100) / 100;
        double l = NumberUtil.clamp(lightness, 0, 100) / 100;
        double m2 = l <= 0.5 ? l * (s + 1) : l + s - l * s;
        double m1 = l * 2 - m2;
        return rgb(hueToRgb(m1, m2, h + 1.0 / 3) * 255,
                hueToRgb(m1, m2, h) * 255,
                hueToRgb(m1, m2, h - 1.0 / 3) * 255,
                alpha);
    }

    private static double hueToRgb(double m1, double m2, double hue) {
        if (hue < 0) hue += 1;
        if (hue > 1) hue -= 1;
        if (hue < 1.0 / 6) return m1 + (m2 - m1) * hue * 6;
        if (hue < 1.0 / 2) return m2;
        if (hue < 2.0 / 3) return m1 + (m2 - m1) * (2.0 / 3 - hue) * 6;
        return m1;
    }

    private static int channel(double value) {
        return (int) NumberUtil.fuzzyRound(NumberUtil.clamp(value, 0, 255));
    }

    public int getRed() {
        return red;
    }

    public int getGreen() {
        return green;
    }

    public int getBlue() {
        return blue;
    }

    public double getAlpha() {
        return alpha;
    }

    public String getOriginalText() {
        return originalText;
    }

    public boolean isOpaque() {
        return NumberUtil.fuzzyEquals(alpha, 1);
    }

    // ============ HSL ============

    public double getHue() {
        double r = red / 255.0, g = green / 255.0, b = blue / 255.0;
        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double delta = max - min;
        double hue;
        if (delta == 0) {
            hue = 0;
        } else if (max == r) {
            hue = 60 * (g - b) / delta;
        } else if (max == g) {
            hue = 60 * (b - r) / delta + 120;
        } else {
            hue = 60 * (r - g) / delta + 240;
        }
        return ((hue % 360) + 360) % 360;
    }

    public double getSaturation() {
        double r = red / 255.0, g = green / 255.0, b = blue / 255.0;
        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double delta = max - min;
        if (delta == 0) return 0;
        double lightness = (max + min) / 2;
        return 100 * (lightness < 0.5 ? delta / (max + min) : delta / (2 - max - min));
    }

    public double getLightness() {
        double r = red / 255.0, g = green / 255.0, b = blue / 255.0;
        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        return 50 * (max + min);
    }

    // ============ 派生 ============

    public SassColor changeRgb(Integer newRed, Integer newGreen, Integer newBlue, Double newAlpha) {
        return rgb(newRed == null ? red : newRed,
                newGreen == null ? green : newGreen,
                newBlue == null ? blue : newBlue,
                newAlpha == null ? alpha : newAlpha);
    }

    public SassColor changeHsl(Double hue, Double saturation, Double lightness, Double newAlpha) {
        return hsl(hue == null ? getHue() : hue,
                saturation == null ? getSaturation() : saturation,
                lightness == null ? getLightness() : lightness,
                newAlpha == null ? alpha : newAlpha);
    }

    public SassColor changeAlpha(double newAlpha) {
        return new SassColor(red, green, blue, NumberUtil.clamp(newAlpha, 0, 1), null);
    }

    @Override
    public Kind getKind() {
        return Kind.COLOR;
    }

    @Override
    public String getTypeName() {
        return "color";
    }

    @Override
    public SassColor assertColor(String name) {
        return this;
    }

    // ============ 运算 ============

    @Override
    public SassValue plus(SassValue other) {
        if (other instanceof SassNumber || other instanceof SassColor) throw undefinedOperation("+", other);
        return super.plus(other);
    }

    @Override
    public SassValue minus(SassValue other) {
        if (other instanceof SassNumber || other instanceof SassColor) throw undefinedOperation("-", other);
        return super.minus(other);
    }

    @Override
    public SassValue dividedBy(SassValue other) {
        if (other instanceof SassNumber || other instanceof SassColor) throw undefinedOperation("/", other);
        return super.dividedBy(other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SassColor)) return false;
        SassColor other = (SassColor) o;
        return red == other.red && green == other.green && blue == other.blue
                && NumberUtil.fuzzyEquals(alpha, other.alpha);
    }

    @Override
    public int hashCode() {
        return ((red * 31 + green) * 31 + blue) * 31 + NumberUtil.fuzzyHashCode(alpha);
    }
}
