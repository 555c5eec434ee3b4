package scss.runtime.builtin;

import scss.runtime.value.SassArgList;
import scss.runtime.value.SassString;
import scss.runtime.value.SassValue;

import java.util.List;
import java.util.Locale;

/**
 * 内建函数共用的小工具
 */
public final class BuiltinSupport {

    private static final String[] SPECIAL_FUNCTIONS = {"var(", "calc(", "env(", "min(", "max(", "clamp(", "attr("};

    private BuiltinSupport() {}

    /** 以纯 CSS 函数调用形式原样输出 */
    public static SassString plainCall(String name, List<SassValue> args) {
        StringBuilder sb = new StringBuilder(name).append('(');
        boolean first = true;
        for (SassValue arg : args) {
            if (arg instanceof SassArgList) {
                for (SassValue element : arg.asList()) {
                    if (!first) sb.append(", ");
                    sb.append(element.toCssString());
                    first = false;
                }
                continue;
            }
            if (!first) sb.append(", ");
            sb.append(arg.toCssString());
            first = false;
        }
        return SassString.unquoted(sb.append(')').toString());
    }

    /** {@code var()}、{@code calc()} 等需交给浏览器计算的值 */
    static boolean isSpecialFunction(SassValue value) {
        if (!(value instanceof SassString) || ((SassString) value).isQuoted()) {
            return false;
        }
        String text = ((SassString) value).getText().toLowerCase(Locale.ROOT);
        for (String prefix : SPECIAL_FUNCTIONS) {
            if (text.startsWith(prefix)) return true;
        }
        return false;
    }

    static boolean anySpecialFunction(List<SassValue> values) {
        for (SassValue value : values) {
            if (isSpecialFunction(value)) return true;
        }
        return false;
    }
}
