package scss.runtime.selector;

import com.scsslang.compiler.ast.SourceLocation;
import scss.runtime.ExtendTargetException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 扩展表：记录 {@code @extend}，在求值结束后统一作用于全部样式规则
 *
 * <p>求解是工作表驱动的不动点迭代：新产生的复杂选择器追加到所属规则并重新入队，
 * 直到不再产生新选择器。同一推导链上每条扩展最多使用一次，因此循环扩展必然终止。
 * 每次编译一个实例，不跨线程共享。</p>
 */
public final class ExtensionStore {

    private final Map<SimpleSelector, List<Extension>> byTarget = new LinkedHashMap<>();
    private final List<Extension> extensions = new ArrayList<>();
    /** 替换模式：扩展者放在目标原来的位置，而不是追加到复合选择器末尾 */
    private final boolean inPlace;

    public ExtensionStore() {
        this(false);
    }

    private ExtensionStore(boolean inPlace) {
        this.inPlace = inPlace;
    }

    /**
     * 记录 extender 扩展 target
     *
     * @param mediaContext {@code @extend} 所在的媒体查询上下文，可为 null
     */
    public void addExtension(SelectorList extender, SimpleSelector target, boolean optional,
                             List<String> mediaContext, SourceLocation span) {
        for (ComplexSelector complex : extender.getComponents()) {
            Extension extension = new Extension(extensions.size(), complex, target, optional, mediaContext, span);
            extensions.add(extension);
            byTarget.computeIfAbsent(target, k -> new ArrayList<Extension>()).add(extension);
        }
    }

    public boolean isEmpty() {
        return extensions.isEmpty();
    }

    public List<Extension> getExtensions() {
        return Collections.unmodifiableList(extensions);
    }

    /**
     * 将全部扩展作用于规则，新选择器按发现顺序追加在各规则原有选择器之后
     *
     * @throws ExtendTargetException 跨媒体查询扩展，或非 optional 的目标在任何规则中都不存在
     */
    public void apply(List<? extends Extendable> rules) {
        if (extensions.isEmpty()) return;
        SelectorArena arena = new SelectorArena(rules.size());
        Deque<Integer> worklist = new ArrayDeque<>();
        for (int rule = 0; rule < rules.size(); rule++) {
            for (ComplexSelector complex : rules.get(rule).getSelector().getComponents()) {
                int entry = arena.add(rule, complex, new BitSet());
                if (entry >= 0) worklist.add(entry);
            }
        }

        Set<Extension> matched = new HashSet<>();
        while (!worklist.isEmpty()) {
            int entry = worklist.poll();
            int rule = arena.owner(entry);
            List<String> ruleMedia = rules.get(rule).getMediaContext();
            ComplexSelector complex = arena.selector(entry);
            BitSet derivation = arena.derivation(entry);
            List<SelectorComponent> components = complex.getComponents();
            for (int k = 0; k < components.size(); k++) {
                if (!(components.get(k) instanceof CompoundSelector)) continue;
                for (SimpleSelector simple : ((CompoundSelector) components.get(k)).getComponents()) {
                    List<Extension> candidates = byTarget.get(simple);
                    if (candidates == null) continue;
                    for (Extension extension : candidates) {
                        if (!extension.appliesInMedia(ruleMedia)) {
                            throw new ExtendTargetException("You may not @extend selectors across media queries.",
                                    extension.getSpan());
                        }
                        matched.add(extension);
                        if (derivation.get(extension.getId())) continue;
                        int sourceSpecificity = extension.getExtender().getSpecificity();
                        for (ComplexSelector extended : extendAt(complex, k, simple, extension.getExtender(), inPlace)) {
                            if (arena.isRedundant(rule, extended, sourceSpecificity)) continue;
                            BitSet next = (BitSet) derivation.clone();
                            next.set(extension.getId());
                            worklist.add(arena.add(rule, extended, next));
                        }
                    }
                }
            }
        }

        for (Extension extension : extensions) {
            if (!extension.isOptional() && !matched.contains(extension)) {
                throw new ExtendTargetException("The target selector was not found.\n"
                        + "Use \"@extend " + extension.getTarget() + " !optional\" to avoid this error.",
                        extension.getSpan());
            }
        }
        for (int rule = 0; rule < rules.size(); rule++) {
            rules.get(rule).setSelector(new SelectorList(arena.selectorsOf(rule)));
        }
    }

    /**
     * {@code selector-extend()}：对单个选择器列表应用一组扩展，目标缺失不报错
     */
    public static SelectorList extendList(SelectorList selector, SelectorList targets, SelectorList extenders) {
        return extendList(selector, targets, extenders, false);
    }

    private static SelectorList extendList(SelectorList selector, SelectorList targets, SelectorList extenders,
                                           boolean inPlace) {
        ExtensionStore store = new ExtensionStore(inPlace);
        for (SimpleSelector target : targetSimples(targets)) {
            store.addExtension(extenders, target, true, null, null);
        }
        Holder holder = new Holder(selector);
        store.apply(Collections.singletonList(holder));
        return holder.selector;
    }

    /**
     * {@code selector-replace()}：扩展后去掉仍含目标的原选择器，替换者位于目标原来的位置
     */
    public static SelectorList replaceList(SelectorList selector, SelectorList targets, SelectorList replacements) {
        SelectorList extended = extendList(selector, targets, replacements, true);
        List<SimpleSelector> simples = targetSimples(targets);
        List<ComplexSelector> kept = new ArrayList<>();
        for (ComplexSelector complex : extended.getComponents()) {
            if (!containsAny(complex, simples)) kept.add(complex);
        }
        return kept.isEmpty() ? extended : new SelectorList(kept);
    }

    private static List<SimpleSelector> targetSimples(SelectorList targets) {
        List<SimpleSelector> result = new ArrayList<>();
        for (ComplexSelector complex : targets.getComponents()) {
            if (complex.getComponents().size() != 1 || complex.getLastCompound() == null) {
                throw new ExtendTargetException("Can't extend complex selector " + complex + ".");
            }
            for (SimpleSelector simple : complex.getLastCompound().getComponents()) {
                if (!result.contains(simple)) result.add(simple);
            }
        }
        return result;
    }

    private static boolean containsAny(ComplexSelector complex, List<SimpleSelector> simples) {
        for (SelectorComponent component : complex.getComponents()) {
            if (!(component instanceof CompoundSelector)) continue;
            for (SimpleSelector simple : ((CompoundSelector) component).getComponents()) {
                if (simples.contains(simple)) return true;
            }
        }
        return false;
    }

    private static final class Holder implements Extendable {
        private SelectorList selector;

        Holder(SelectorList selector) {
            this.selector = selector;
        }

        @Override
        public SelectorList getSelector() {
            return selector;
        }

        @Override
        public void setSelector(SelectorList selector) {
            this.selector = selector;
        }

        @Override
        public List<String> getMediaContext() {
            return null;
        }
    }

    /**
     * 用 extender 替换第 index 个复合选择器中的 target
     *
     * @param inPlace 为 true 时扩展者的简单选择器放在 target 的位置，否则追加在其余简单选择器之后
     */
    static List<ComplexSelector> extendAt(ComplexSelector complex, int index, SimpleSelector target,
                                          ComplexSelector extender, boolean inPlace) {
        CompoundSelector compound = (CompoundSelector) complex.getComponents().get(index);
        CompoundSelector extenderLast = extender.getLastCompound();
        if (extenderLast == null) return Collections.emptyList();
        List<SimpleSelector> rest = new ArrayList<>(compound.getComponents());
        int position = rest.indexOf(target);
        rest.remove(position);
        List<SimpleSelector> unified;
        if (inPlace) {
            List<SimpleSelector> head = Unifier.unifyCompound(extenderLast.getComponents(),
                    new ArrayList<>(rest.subList(0, position)));
            unified = head == null ? null : Unifier.unifyCompound(rest.subList(position, rest.size()), head);
        } else {
            unified = Unifier.unifyCompound(extenderLast.getComponents(), rest);
        }
        if (unified == null) return Collections.emptyList();

        List<SelectorComponent> before = complex.getComponents().subList(0, index);
        List<SelectorComponent> after = complex.getComponents().subList(index + 1, complex.getComponents().size());
        List<ComplexSelector> result = new ArrayList<>();
        for (List<SelectorComponent> prefix : Unifier.weave(extender.getPrefix(), before)) {
            List<SelectorComponent> components = new ArrayList<>(prefix);
            components.add(new CompoundSelector(unified));
            components.addAll(after);
            result.add(new ComplexSelector(components));
        }
        return result;
    }
}
