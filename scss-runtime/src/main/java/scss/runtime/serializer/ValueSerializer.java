package scss.runtime.serializer;

import com.scsslang.compiler.lexer.NamedColors;
import scss.runtime.SassTypeException;
import scss.runtime.value.ListSeparator;
import scss.runtime.value.NumberUtil;
import scss.runtime.value.SassColor;
import scss.runtime.value.SassFunction;
import scss.runtime.value.SassList;
import scss.runtime.value.SassMap;
import scss.runtime.value.SassNumber;
import scss.runtime.value.SassSelector;
import scss.runtime.value.SassString;
import scss.runtime.value.SassValue;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

/**
 * 值到文本的转换：CSS 输出形式与 {@code inspect()} 形式
 *
 * <p>CSS 形式下 map、函数引用、空列表与复合单位数值不是合法的 CSS 值，转换时抛出
 * {@link SassTypeException}。</p>
 */
public final class ValueSerializer {

    private final boolean compressed;
    private final int precision;
    private final boolean inspect;
    private final StringBuilder buffer = new StringBuilder();

    private ValueSerializer(boolean compressed, int precision, boolean inspect) {
        this.compressed = compressed;
        this.precision = precision;
        this.inspect = inspect;
    }

    /** 表达式中的字符串转换：展开格式、默认精度 */
    public static String toCss(SassValue value) {
        return serialize(value, false, NumberUtil.PRECISION, false);
    }

    public static String inspect(SassValue value) {
        return serialize(value, false, NumberUtil.PRECISION, true);
    }

    public static String serialize(SassValue value, boolean compressed, int precision, boolean inspect) {
        ValueSerializer serializer = new ValueSerializer(compressed, precision, inspect);
        serializer.write(value);
        return serializer.buffer.toString();
    }

    private void write(SassValue value) {
        switch (value.getKind()) {
            case NUMBER:
                writeNumber((SassNumber) value);
                break;
            case COLOR:
                writeColor((SassColor) value);
                break;
            case STRING:
                writeString((SassString) value);
                break;
            case LIST:
            case ARGLIST:
                writeList(value);
                break;
            case MAP:
                writeMap((SassMap) value);
                break;
            case BOOLEAN:
                buffer.append(value.isTruthy() ? "true" : "false");
                break;
            case NULL:
                if (inspect) buffer.append("null");
                break;
            case FUNCTION:
                if (!inspect) throw invalid(value);
                buffer.append("get-function(\"").append(((SassFunction) value).getCallable().getName())
                        .append("\")");
                break;
            case SELECTOR:
                buffer.append(((SassSelector) value).getSelector().render(compressed));
                break;
            default:
                throw new IllegalStateException("Unknown value kind: " + value.getKind());
        }
    }

    private static SassTypeException invalid(SassValue value) {
        return new SassTypeException(inspect(value) + " isn't a valid CSS value.");
    }

    // ============ 数值 ============

    private void writeNumber(SassNumber number) {
        if (number.isSlash()) {
            writeNumber(number.getSlashNumerator());
            buffer.append('/');
            writeNumber(number.getSlashDenominator());
            return;
        }
        double value = number.getValue();
        if (Double.isNaN(value)) {
            buffer.append("NaN");
        } else if (Double.isInfinite(value)) {
            buffer.append(value > 0 ? "Infinity" : "-Infinity");
        } else {
            buffer.append(formatNumber(value, precision, compressed));
        }
        if (!inspect && !number.hasSimpleUnits()) {
            throw new SassTypeException(inspect(number) + " isn't a valid CSS value.");
        }
        buffer.append(number.getUnitString());
    }

    /**
     * 数字文本：按精度四舍五入，去掉末尾的 0，{@code -0} 输出为 {@code 0}，
     * 压缩模式下去掉整数部分的 0（{@code .5}）
     */
    public static String formatNumber(double value, int precision, boolean compressed) {
        if (NumberUtil.fuzzyIsInt(value)) {
            long rounded = Math.round(value);
            if (Math.abs(value) < 1e15) return Long.toString(rounded == 0 ? 0 : rounded);
        }
        BigDecimal decimal = new BigDecimal(value).setScale(precision, RoundingMode.HALF_UP).stripTrailingZeros();
        if (decimal.signum() == 0) return "0";
        String text = decimal.toPlainString();
        if (compressed) {
            if (text.startsWith("0.")) {
                text = text.substring(1);
            } else if (text.startsWith("-0.")) {
                text = "-" + text.substring(2);
            }
        }
        return text;
    }

    // ============ 颜色 ============

    private void writeColor(SassColor color) {
        if (!compressed && color.getOriginalText() != null) {
            buffer.append(color.getOriginalText());
            return;
        }
        if (!color.isOpaque()) {
            String separator = compressed ? "," : ", ";
            buffer.append("rgba(").append(color.getRed()).append(separator)
                    .append(color.getGreen()).append(separator)
                    .append(color.getBlue()).append(separator)
                    .append(formatNumber(color.getAlpha(), precision, compressed)).append(')');
            return;
        }
        String name = NamedColors.nameOf(color.getRed(), color.getGreen(), color.getBlue());
        String hex = hex(color, compressed);
        if (name != null && (!compressed || name.length() <= hex.length())) {
            buffer.append(name);
        } else {
            buffer.append(hex);
        }
    }

    private static String hex(SassColor color, boolean shorten) {
        int r = color.getRed();
        int g = color.getGreen();
        int b = color.getBlue();
        if (shorten && r >> 4 == (r & 0xF) && g >> 4 == (g & 0xF) && b >> 4 == (b & 0xF)) {
            return "#" + Integer.toHexString(r & 0xF) + Integer.toHexString(g & 0xF) + Integer.toHexString(b & 0xF);
        }
        return String.format("#%02x%02x%02x", r, g, b);
    }

    // ============ 字符串 ============

    private void writeString(SassString string) {
        if (string.isQuoted()) {
            buffer.append(quote(string.getText()));
        } else {
            buffer.append(string.getText());
        }
    }

    /** 加引号：优先双引号，文本只含双引号时改用单引号 */
    public static String quote(String text) {
        char quote = text.indexOf('"') >= 0 && text.indexOf('\'') < 0 ? '\'' : '"';
        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append(quote);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == quote || c == '\\') {
                sb.append('\\').append(c);
            } else if (c == '\n' || c == '\r' || c == '\f') {
                sb.append("\\a");
                if (i + 1 < text.length()) {
                    char next = text.charAt(i + 1);
                    if (Character.digit(next, 16) >= 0 || next == ' ' || next == '\t') sb.append(' ');
                }
            } else if (c < 0x20 && c != '\t' || c == 0x7F) {
                sb.append('\\').append(Integer.toHexString(c));
                if (i + 1 < text.length() && Character.digit(text.charAt(i + 1), 16) >= 0) sb.append(' ');
            } else {
                sb.append(c);
            }
        }
        return sb.append(quote).toString();
    }

    // ============ 列表与 map ============

    private void writeList(SassValue list) {
        List<SassValue> elements = list.asList();
        boolean bracketed = list.isBracketed();
        if (elements.isEmpty()) {
            if (bracketed) {
                buffer.append("[]");
            } else if (inspect) {
                buffer.append("()");
            } else {
                throw invalid(list);
            }
            return;
        }
        ListSeparator separator = list.getSeparator();
        boolean singleton = inspect && elements.size() == 1
                && (separator == ListSeparator.COMMA || separator == ListSeparator.SLASH);
        if (bracketed) buffer.append('[');
        if (singleton && !bracketed) buffer.append('(');
        boolean first = true;
        for (SassValue element : elements) {
            if (!inspect && element.isBlank()) continue;
            if (!first) buffer.append(separatorText(separator));
            first = false;
            if (inspect && needsParens(separator, element)) {
                buffer.append('(');
                write(element);
                buffer.append(')');
            } else {
                write(element);
            }
        }
        if (singleton) buffer.append(separator == ListSeparator.COMMA ? "," : "/");
        if (singleton && !bracketed) buffer.append(')');
        if (bracketed) buffer.append(']');
    }

    private String separatorText(ListSeparator separator) {
        switch (separator) {
            case COMMA:
                return compressed ? "," : ", ";
            case SLASH:
                return compressed ? "/" : " / ";
            default:
                return " ";
        }
    }

    private static boolean needsParens(ListSeparator separator, SassValue element) {
        if (!(element instanceof SassList) || element.asList().size() < 2 || element.isBracketed()) return false;
        ListSeparator inner = element.getSeparator();
        switch (separator) {
            case COMMA:
                return inner == ListSeparator.COMMA;
            case SLASH:
                return inner == ListSeparator.COMMA || inner == ListSeparator.SLASH;
            default:
                return inner != ListSeparator.UNDECIDED;
        }
    }

    private void writeMap(SassMap map) {
        if (!inspect) throw invalid(map);
        buffer.append('(');
        boolean first = true;
        for (Map.Entry<SassValue, SassValue> entry : map.getContents().entrySet()) {
            if (!first) buffer.append(", ");
            first = false;
            writeMapElement(entry.getKey());
            buffer.append(": ");
            writeMapElement(entry.getValue());
        }
        buffer.append(')');
    }

    private void writeMapElement(SassValue value) {
        boolean parens = value instanceof SassList && value.getSeparator() == ListSeparator.COMMA
                && !value.isBracketed() && value.asList().size() > 1;
        if (parens) buffer.append('(');
        write(value);
        if (parens) buffer.append(')');
    }
}
