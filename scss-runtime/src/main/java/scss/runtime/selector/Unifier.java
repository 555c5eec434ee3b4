package scss.runtime.selector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 选择器合并：复合选择器统一与前缀交织
 */
public final class Unifier {

    private Unifier() {}

    /**
     * 同时匹配两个复合选择器的简单选择器序列，不可能同时匹配时返回 null
     */
    public static List<SimpleSelector> unifyCompound(List<SimpleSelector> compound1, List<SimpleSelector> compound2) {
        List<SimpleSelector> result = compound2;
        for (SimpleSelector simple : compound1) {
            result = simple.unify(result);
            if (result == null) return null;
        }
        return result;
    }

    /**
     * 同时匹配两个复杂选择器的所有选择器
     *
     * <p>合并出的复合选择器以 complex1 的简单选择器开头。</p>
     */
    public static List<ComplexSelector> unifyComplex(ComplexSelector complex1, ComplexSelector complex2) {
        CompoundSelector last1 = complex1.getLastCompound();
        CompoundSelector last2 = complex2.getLastCompound();
        if (last1 == null || last2 == null) return Collections.emptyList();
        List<SimpleSelector> unified = unifyCompound(last2.getComponents(), last1.getComponents());
        if (unified == null) return Collections.emptyList();
        CompoundSelector base = new CompoundSelector(unified);
        List<ComplexSelector> result = new ArrayList<>();
        for (List<SelectorComponent> prefix : weave(complex2.getPrefix(), complex1.getPrefix())) {
            List<SelectorComponent> components = new ArrayList<>(prefix);
            components.add(base);
            ComplexSelector complex = new ComplexSelector(components);
            if (!result.contains(complex)) result.add(complex);
        }
        return result;
    }

    /**
     * 交织两个祖先前缀，使结果同时满足两者
     *
     * <p>都只含后代关系时给出两种顺序（second 在前的优先）；以组合符结尾的前缀必须紧贴被修饰的复合选择器。</p>
     *
     * @param first  扩展者的前缀
     * @param second 被扩展选择器的前缀
     */
    public static List<List<SelectorComponent>> weave(List<SelectorComponent> first, List<SelectorComponent> second) {
        List<List<SelectorComponent>> result = new ArrayList<>();
        if (first.isEmpty()) {
            result.add(new ArrayList<>(second));
            return result;
        }
        if (second.isEmpty()) {
            result.add(new ArrayList<>(first));
            return result;
        }
        boolean firstEndsWithCombinator = first.get(first.size() - 1) instanceof Combinator;
        boolean secondEndsWithCombinator = second.get(second.size() - 1) instanceof Combinator;

        if (!firstEndsWithCombinator && !secondEndsWithCombinator) {
            result.add(concat(second, first));
            if (isDescendantOnly(first) && isDescendantOnly(second)) {
                List<SelectorComponent> other = concat(first, second);
                if (!other.equals(result.get(0))) result.add(other);
            }
            return result;
        }
        if (firstEndsWithCombinator && !secondEndsWithCombinator) {
            result.add(concat(second, first));
            return result;
        }
        if (!firstEndsWithCombinator) {
            result.add(concat(first, second));
            return result;
        }

        // 两者都以组合符结尾：组合符相同且前一个复合选择器可统一时合并
        Combinator combinator1 = (Combinator) first.get(first.size() - 1);
        Combinator combinator2 = (Combinator) second.get(second.size() - 1);
        if (combinator1 != combinator2 || first.size() < 2 || second.size() < 2) return result;
        SelectorComponent compound1 = first.get(first.size() - 2);
        SelectorComponent compound2 = second.get(second.size() - 2);
        if (!(compound1 instanceof CompoundSelector) || !(compound2 instanceof CompoundSelector)) return result;
        List<SimpleSelector> unified = unifyCompound(((CompoundSelector) compound1).getComponents(),
                ((CompoundSelector) compound2).getComponents());
        if (unified == null) return result;
        for (List<SelectorComponent> prefix : weave(first.subList(0, first.size() - 2),
                second.subList(0, second.size() - 2))) {
            prefix.add(new CompoundSelector(unified));
            prefix.add(combinator1);
            result.add(prefix);
        }
        return result;
    }

    private static boolean isDescendantOnly(List<SelectorComponent> components) {
        for (SelectorComponent component : components) {
            if (component instanceof Combinator) return false;
        }
        return true;
    }

    private static List<SelectorComponent> concat(List<SelectorComponent> a, List<SelectorComponent> b) {
        List<SelectorComponent> result = new ArrayList<>(a.size() + b.size());
        result.addAll(a);
        result.addAll(b);
        return result;
    }
}
