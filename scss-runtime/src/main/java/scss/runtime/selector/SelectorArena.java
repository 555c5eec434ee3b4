package scss.runtime.selector;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 扩展求解的选择器存储：条目按下标引用，每条记录所属规则与推导所用的扩展集合
 */
final class SelectorArena {

    private final List<ComplexSelector> selectors = new ArrayList<>();
    private final List<Integer> owners = new ArrayList<>();
    private final List<BitSet> derivations = new ArrayList<>();
    private final List<List<Integer>> byRule = new ArrayList<>();
    private final List<Map<ComplexSelector, Integer>> indexByRule = new ArrayList<>();

    SelectorArena(int ruleCount) {
        for (int i = 0; i < ruleCount; i++) {
            byRule.add(new ArrayList<Integer>());
            indexByRule.add(new HashMap<ComplexSelector, Integer>());
        }
    }

    /**
     * 向规则追加选择器
     *
     * @return 新条目下标；该规则已有相同选择器时返回 -1
     */
    int add(int rule, ComplexSelector selector, BitSet derivation) {
        Map<ComplexSelector, Integer> index = indexByRule.get(rule);
        if (index.containsKey(selector)) return -1;
        int id = selectors.size();
        selectors.add(selector);
        owners.add(rule);
        derivations.add(derivation);
        byRule.get(rule).add(id);
        index.put(selector, id);
        return id;
    }

    ComplexSelector selector(int entry) {
        return selectors.get(entry);
    }

    int owner(int entry) {
        return owners.get(entry);
    }

    BitSet derivation(int entry) {
        return derivations.get(entry);
    }

    int size() {
        return selectors.size();
    }

    /**
     * 候选选择器是否多余：规则中已有相同的选择器，或已有特异性不低于来源的父集选择器
     */
    boolean isRedundant(int rule, ComplexSelector candidate, int sourceSpecificity) {
        if (indexByRule.get(rule).containsKey(candidate)) return true;
        for (int entry : byRule.get(rule)) {
            ComplexSelector existing = selectors.get(entry);
            if (existing.getSpecificity() >= sourceSpecificity && existing.isSuperselector(candidate)) {
                return true;
            }
        }
        return false;
    }

    /** 规则的选择器，按加入顺序 */
    List<ComplexSelector> selectorsOf(int rule) {
        List<Integer> entries = byRule.get(rule);
        List<ComplexSelector> result = new ArrayList<>(entries.size());
        for (int entry : entries) {
            result.add(selectors.get(entry));
        }
        return result;
    }
}
