package scss.runtime.selector;

import scss.runtime.SassRuntimeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 复合选择器：作用于同一元素的简单选择器序列，如 {@code a.b:hover}
 */
public final class CompoundSelector implements SelectorComponent {

    private final List<SimpleSelector> components;

    public CompoundSelector(List<SimpleSelector> components) {
        if (components.isEmpty()) {
            throw new IllegalArgumentException("components may not be empty");
        }
        this.components = Collections.unmodifiableList(new ArrayList<>(components));
    }

    public List<SimpleSelector> getComponents() {
        return components;
    }

    public int getSpecificity() {
        int sum = 0;
        for (SimpleSelector simple : components) {
            sum += simple.getSpecificity();
        }
        return sum;
    }

    /** 含 {@code &}（包括伪类参数中的） */
    public boolean containsParent() {
        for (SimpleSelector simple : components) {
            if (simple instanceof ParentSelector) return true;
            if (simple instanceof PseudoSelector) {
                SelectorList inner = ((PseudoSelector) simple).getSelector();
                if (inner != null && inner.containsParent()) return true;
            }
        }
        return false;
    }

    public boolean containsPlaceholder() {
        for (SimpleSelector simple : components) {
            if (simple.isPlaceholder()) return true;
            if (simple instanceof PseudoSelector && ((PseudoSelector) simple).getSelector() != null
                    && !"not".equals(((PseudoSelector) simple).getNormalizedName())
                    && ((PseudoSelector) simple).getSelector().containsPlaceholder()) {
                return true;
            }
        }
        return false;
    }

    /**
     * 用父选择器替换 {@code &}，每个父复杂选择器产生一个组成部分序列
     */
    List<List<SelectorComponent>> resolveParent(SelectorList parent) {
        List<SimpleSelector> resolved = new ArrayList<>(components.size());
        for (SimpleSelector simple : components) {
            if (simple instanceof PseudoSelector && ((PseudoSelector) simple).getSelector() != null
                    && ((PseudoSelector) simple).getSelector().containsParent()) {
                PseudoSelector pseudo = (PseudoSelector) simple;
                resolved.add(pseudo.withSelector(pseudo.getSelector().resolveParentSelectors(parent, false)));
            } else {
                resolved.add(simple);
            }
        }
        List<List<SelectorComponent>> result = new ArrayList<>();
        if (!(resolved.get(0) instanceof ParentSelector)) {
            result.add(Collections.<SelectorComponent>singletonList(new CompoundSelector(resolved)));
            return result;
        }
        ParentSelector ampersand = (ParentSelector) resolved.get(0);
        List<SimpleSelector> rest = resolved.subList(1, resolved.size());
        for (ComplexSelector complex : parent.getComponents()) {
            if (rest.isEmpty() && ampersand.getSuffix() == null) {
                result.add(complex.getComponents());
                continue;
            }
            SelectorComponent last = complex.getComponents().get(complex.getComponents().size() - 1);
            if (!(last instanceof CompoundSelector)) {
                throw new SassRuntimeException("Parent \"" + complex + "\" is incompatible with this selector.");
            }
            List<SimpleSelector> simples = new ArrayList<>(((CompoundSelector) last).components);
            if (ampersand.getSuffix() != null) {
                SimpleSelector suffixed = simples.get(simples.size() - 1).withSuffix(ampersand.getSuffix());
                if (suffixed == null) {
                    throw new SassRuntimeException("Selector \"" + complex + "\" can't have a suffix");
                }
                simples.set(simples.size() - 1, suffixed);
            }
            simples.addAll(rest);
            List<SelectorComponent> path = new ArrayList<>(complex.getComponents().subList(0,
                    complex.getComponents().size() - 1));
            path.add(new CompoundSelector(simples));
            result.add(path);
        }
        return result;
    }

    /**
     * 本选择器匹配的元素是否包含 other 匹配的全部元素
     */
    public boolean isSuperselector(CompoundSelector other) {
        for (SimpleSelector simple : components) {
            if (simple instanceof UniversalSelector && ((UniversalSelector) simple).getNamespace() == null) {
                continue;
            }
            if (simple instanceof PseudoSelector && ((PseudoSelector) simple).getSelector() != null
                    && !other.components.contains(simple)) {
                if (!selectorPseudoIsSuperselector((PseudoSelector) simple, other)) return false;
                continue;
            }
            if (!other.components.contains(simple)) return false;
        }
        // 伪元素必须同时出现
        for (SimpleSelector simple : other.components) {
            if (simple instanceof PseudoSelector && ((PseudoSelector) simple).isElement()
                    && !components.contains(simple)) {
                return false;
            }
        }
        return true;
    }

    /** {@code :is(.a, .b)} 是任何含 {@code .a} 的复合选择器的父集 */
    private static boolean selectorPseudoIsSuperselector(PseudoSelector pseudo, CompoundSelector other) {
        String name = pseudo.getNormalizedName();
        if (!"is".equals(name) && !"matches".equals(name) && !"any".equals(name) && !"where".equals(name)) {
            return false;
        }
        ComplexSelector single = new ComplexSelector(Collections.<SelectorComponent>singletonList(other));
        for (ComplexSelector complex : pseudo.getSelector().getComponents()) {
            if (complex.isSuperselector(single)) return true;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CompoundSelector && components.equals(((CompoundSelector) o).components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (SimpleSelector simple : components) {
            sb.append(simple);
        }
        return sb.toString();
    }
}
