package scss.runtime.selector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 伪类 {@code :hover} 与伪元素 {@code ::before}，可带文本参数或选择器参数（{@code :not(.a)}）
 */
public final class PseudoSelector extends SimpleSelector {

    /** 单冒号写法的旧式伪元素 */
    private static final Set<String> LEGACY_ELEMENTS = new HashSet<>(Arrays.asList(
            "after", "before", "first-line", "first-letter"));

    /** 参数为选择器列表的伪类 */
    static final Set<String> SELECTOR_PSEUDOS = new HashSet<>(Arrays.asList(
            "not", "is", "matches", "where", "any", "-moz-any", "-webkit-any", "current", "has",
            "host", "host-context", "slotted", "nth-child", "nth-last-child"));

    private final String name;
    private final boolean syntacticClass;
    private final String argument;
    private final SelectorList selector;

    public PseudoSelector(String name, boolean syntacticClass, String argument, SelectorList selector) {
        this.name = name;
        this.syntacticClass = syntacticClass;
        this.argument = argument;
        this.selector = selector;
    }

    public String getName() {
        return name;
    }

    /** 去掉浏览器前缀后的小写名称 */
    public String getNormalizedName() {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.startsWith("-")) {
            int dash = lower.indexOf('-', 1);
            if (dash > 0) return lower.substring(dash + 1);
        }
        return lower;
    }

    public boolean isClass() {
        return !isElement();
    }

    public boolean isElement() {
        return !syntacticClass || LEGACY_ELEMENTS.contains(name.toLowerCase(Locale.ROOT));
    }

    public boolean isSyntacticClass() {
        return syntacticClass;
    }

    public String getArgument() {
        return argument;
    }

    public SelectorList getSelector() {
        return selector;
    }

    public PseudoSelector withSelector(SelectorList newSelector) {
        return new PseudoSelector(name, syntacticClass, argument, newSelector);
    }

    @Override
    public int getSpecificity() {
        if (isElement()) return 1;
        if (selector == null) return CLASS_SPECIFICITY;
        String normalized = getNormalizedName();
        if ("where".equals(normalized)) return 0;
        int max = 0;
        for (ComplexSelector complex : selector.getComponents()) {
            max = Math.max(max, complex.getSpecificity());
        }
        return "nth-child".equals(normalized) || "nth-last-child".equals(normalized)
                ? CLASS_SPECIFICITY + max : max;
    }

    @Override
    public SimpleSelector withSuffix(String suffix) {
        if (argument != null || selector != null) return null;
        return new PseudoSelector(name + suffix, syntacticClass, null, null);
    }

    @Override
    public List<SimpleSelector> unify(List<SimpleSelector> compound) {
        if (compound.size() == 1 && compound.get(0) instanceof UniversalSelector) {
            return compound.get(0).unify(singleton(this));
        }
        if (compound.contains(this)) return compound;
        List<SimpleSelector> result = new ArrayList<>(compound.size() + 1);
        boolean added = false;
        for (SimpleSelector simple : compound) {
            if (simple instanceof PseudoSelector && ((PseudoSelector) simple).isElement()) {
                // 一个复合选择器最多一个伪元素，且伪元素必须在最后
                if (isElement()) return null;
                if (!added) {
                    result.add(this);
                    added = true;
                }
            }
            result.add(simple);
        }
        if (!added) result.add(this);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(syntacticClass ? ":" : "::").append(name);
        if (argument == null && selector == null) return sb.toString();
        sb.append('(');
        if (argument != null) {
            sb.append(argument);
            if (selector != null) sb.append(' ');
        }
        if (selector != null) sb.append(selector);
        return sb.append(')').toString();
    }
}
