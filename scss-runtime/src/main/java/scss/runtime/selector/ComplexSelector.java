package scss.runtime.selector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 复杂选择器：由组合符连接的复合选择器序列
 *
 * <p>允许以组合符开头（{@code > .a}，仅出现在嵌套中）；相邻的两个复合选择器之间为后代组合符。</p>
 */
public final class ComplexSelector {

    private final List<SelectorComponent> components;

    public ComplexSelector(List<SelectorComponent> components) {
        if (components.isEmpty()) {
            throw new IllegalArgumentException("components may not be empty");
        }
        this.components = Collections.unmodifiableList(new ArrayList<>(components));
    }

    public List<SelectorComponent> getComponents() {
        return components;
    }

    public SelectorComponent getLast() {
        return components.get(components.size() - 1);
    }

    /** 最后一个复合选择器；以组合符结尾时为 null */
    public CompoundSelector getLastCompound() {
        SelectorComponent last = getLast();
        return last instanceof CompoundSelector ? (CompoundSelector) last : null;
    }

    /** 去掉最后一个组成部分后的前缀 */
    public List<SelectorComponent> getPrefix() {
        return components.subList(0, components.size() - 1);
    }

    public int getSpecificity() {
        int sum = 0;
        for (SelectorComponent component : components) {
            if (component instanceof CompoundSelector) {
                sum += ((CompoundSelector) component).getSpecificity();
            }
        }
        return sum;
    }

    public boolean containsParent() {
        for (SelectorComponent component : components) {
            if (component instanceof CompoundSelector && ((CompoundSelector) component).containsParent()) {
                return true;
            }
        }
        return false;
    }

    public boolean containsPlaceholder() {
        for (SelectorComponent component : components) {
            if (component instanceof CompoundSelector && ((CompoundSelector) component).containsPlaceholder()) {
                return true;
            }
        }
        return false;
    }

    /** 在后面接上另一个复杂选择器（后代组合或其开头的组合符） */
    public ComplexSelector concat(ComplexSelector child) {
        List<SelectorComponent> joined = new ArrayList<>(components);
        joined.addAll(child.components);
        return new ComplexSelector(joined);
    }

    /**
     * 本选择器匹配的元素是否包含 other 匹配的全部元素
     */
    public boolean isSuperselector(ComplexSelector other) {
        List<SelectorComponent> complex1 = components;
        List<SelectorComponent> complex2 = other.components;
        if (!(getLast() instanceof CompoundSelector) || !(other.getLast() instanceof CompoundSelector)) {
            return false;
        }
        int i1 = 0;
        int i2 = 0;
        while (true) {
            int remaining1 = complex1.size() - i1;
            int remaining2 = complex2.size() - i2;
            if (remaining1 == 0 || remaining2 == 0 || remaining1 > remaining2) return false;

            SelectorComponent first1 = complex1.get(i1);
            if (!(first1 instanceof CompoundSelector)) return false;
            CompoundSelector compound1 = (CompoundSelector) first1;
            if (remaining1 == 1) {
                return compound1.isSuperselector((CompoundSelector) other.getLast());
            }

            // 在 complex2 中找到第一个被 compound1 覆盖的复合选择器
            int after = i2 + 1;
            for (; after < complex2.size(); after++) {
                SelectorComponent candidate = complex2.get(after - 1);
                if (candidate instanceof CompoundSelector
                        && compound1.isSuperselector((CompoundSelector) candidate)) {
                    break;
                }
            }
            if (after == complex2.size()) return false;

            SelectorComponent next1 = complex1.get(i1 + 1);
            SelectorComponent next2 = complex2.get(after);
            if (next1 instanceof Combinator) {
                if (!(next2 instanceof Combinator)) return false;
                Combinator combinator1 = (Combinator) next1;
                Combinator combinator2 = (Combinator) next2;
                if (combinator1 == Combinator.FOLLOWING_SIBLING) {
                    if (combinator2 == Combinator.CHILD) return false;
                } else if (combinator1 != combinator2) {
                    return false;
                }
                // .foo > .baz 不是 .foo > .bar > .baz 的父集
                if (remaining1 == 3 && remaining2 > 3) return false;
                i1 += 2;
                i2 = after + 1;
            } else if (next2 instanceof Combinator) {
                if (next2 != Combinator.CHILD) return false;
                i1 += 1;
                i2 = after + 1;
            } else {
                i1 += 1;
                i2 = after;
            }
        }
    }

    /** 输出文本；compressed 时组合符两侧不留空格 */
    public String render(boolean compressed) {
        StringBuilder sb = new StringBuilder();
        SelectorComponent previous = null;
        for (SelectorComponent component : components) {
            if (previous != null) {
                if (component instanceof Combinator || previous instanceof Combinator) {
                    if (!compressed) sb.append(' ');
                } else {
                    sb.append(' ');
                }
            }
            sb.append(component);
            previous = component;
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ComplexSelector && components.equals(((ComplexSelector) o).components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    @Override
    public String toString() {
        return render(false);
    }
}
