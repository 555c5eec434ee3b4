package scss.runtime.selector;

import scss.runtime.SassRuntimeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 逗号分隔的选择器列表
 */
public final class SelectorList {

    private final List<ComplexSelector> components;

    public SelectorList(List<ComplexSelector> components) {
        this.components = Collections.unmodifiableList(new ArrayList<>(components));
    }

    public List<ComplexSelector> getComponents() {
        return components;
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    public boolean containsParent() {
        for (ComplexSelector complex : components) {
            if (complex.containsParent()) return true;
        }
        return false;
    }

    public boolean containsPlaceholder() {
        for (ComplexSelector complex : components) {
            if (complex.containsPlaceholder()) return true;
        }
        return false;
    }

    /** 去掉含占位符的复杂选择器 */
    public SelectorList withoutPlaceholders() {
        if (!containsPlaceholder()) return this;
        List<ComplexSelector> kept = new ArrayList<>();
        for (ComplexSelector complex : components) {
            if (!complex.containsPlaceholder()) kept.add(complex);
        }
        return new SelectorList(kept);
    }

    /**
     * 嵌套展开：父选择器 × 子选择器的笛卡尔积
     *
     * <p>含 {@code &} 的子选择器将其替换为父选择器；否则 implicitParent 为 true 时以后代组合接在父选择器后。
     * 结果按出现顺序去重。</p>
     *
     * @param parent 外层选择器，顶层时为 null
     */
    public SelectorList resolveParentSelectors(SelectorList parent, boolean implicitParent) {
        if (parent == null) {
            if (!containsParent()) return this;
            throw new SassRuntimeException("Top-level selectors may not contain the parent selector \"&\".");
        }
        Set<ComplexSelector> result = new LinkedHashSet<>();
        for (ComplexSelector complex : components) {
            if (!complex.containsParent()) {
                if (!implicitParent) {
                    result.add(complex);
                    continue;
                }
                for (ComplexSelector outer : parent.components) {
                    result.add(outer.concat(complex));
                }
                continue;
            }
            List<List<SelectorComponent>> paths = new ArrayList<>();
            paths.add(new ArrayList<SelectorComponent>());
            for (SelectorComponent component : complex.getComponents()) {
                if (component instanceof CompoundSelector && ((CompoundSelector) component).containsParent()) {
                    List<List<SelectorComponent>> resolved = ((CompoundSelector) component).resolveParent(parent);
                    List<List<SelectorComponent>> next = new ArrayList<>(paths.size() * resolved.size());
                    for (List<SelectorComponent> path : paths) {
                        for (List<SelectorComponent> option : resolved) {
                            List<SelectorComponent> joined = new ArrayList<>(path);
                            joined.addAll(option);
                            next.add(joined);
                        }
                    }
                    paths = next;
                } else {
                    for (List<SelectorComponent> path : paths) {
                        path.add(component);
                    }
                }
            }
            for (List<SelectorComponent> path : paths) {
                result.add(new ComplexSelector(path));
            }
        }
        return new SelectorList(new ArrayList<>(result));
    }

    /** 对 other 中每个复杂选择器，本列表都有其父集 */
    public boolean isSuperselector(SelectorList other) {
        for (ComplexSelector complex2 : other.components) {
            boolean covered = false;
            for (ComplexSelector complex1 : components) {
                if (complex1.isSuperselector(complex2)) {
                    covered = true;
                    break;
                }
            }
            if (!covered) return false;
        }
        return true;
    }

    /** 同时匹配两个列表的选择器；不可能同时匹配时返回 null */
    public SelectorList unify(SelectorList other) {
        List<ComplexSelector> result = new ArrayList<>();
        for (ComplexSelector complex1 : components) {
            for (ComplexSelector complex2 : other.components) {
                for (ComplexSelector unified : Unifier.unifyComplex(complex1, complex2)) {
                    if (!result.contains(unified)) result.add(unified);
                }
            }
        }
        return result.isEmpty() ? null : new SelectorList(result);
    }

    public String render(boolean compressed) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < components.size(); i++) {
            if (i > 0) sb.append(compressed ? "," : ", ");
            sb.append(components.get(i).render(compressed));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SelectorList && components.equals(((SelectorList) o).components);
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
