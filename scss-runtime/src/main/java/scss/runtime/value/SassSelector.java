package scss.runtime.value;

import scss.runtime.selector.ComplexSelector;
import scss.runtime.selector.SelectorComponent;
import scss.runtime.selector.SelectorList;

import java.util.ArrayList;
import java.util.List;

/**
 * 选择器值（{@code &} 与选择器函数的结果）
 *
 * <p>对列表函数与 {@code type-of} 表现为“逗号列表，元素是由无引号字符串组成的空格列表”。</p>
 */
public final class SassSelector extends SassValue {

    private final SelectorList selector;
    private SassList list;

    public SassSelector(SelectorList selector) {
        this.selector = selector;
    }

    public SelectorList getSelector() {
        return selector;
    }

    /** 列表形式 */
    public SassList toList() {
        if (list == null) {
            List<SassValue> complexes = new ArrayList<>();
            for (ComplexSelector complex : selector.getComponents()) {
                List<SassValue> parts = new ArrayList<>();
                for (SelectorComponent component : complex.getComponents()) {
                    parts.add(SassString.unquoted(component.toString()));
                }
                complexes.add(new SassList(parts, parts.size() > 1 ? ListSeparator.SPACE : ListSeparator.UNDECIDED));
            }
            list = new SassList(complexes, complexes.size() > 1 ? ListSeparator.COMMA : ListSeparator.UNDECIDED);
        }
        return list;
    }

    @Override
    public List<SassValue> asList() {
        return toList().asList();
    }

    @Override
    public ListSeparator getSeparator() {
        return selector.getComponents().size() > 1 ? ListSeparator.COMMA : ListSeparator.UNDECIDED;
    }

    @Override
    public Kind getKind() {
        return Kind.SELECTOR;
    }

    @Override
    public String getTypeName() {
        return "list";
    }

    @Override
    public boolean equals(Object o) {
        if (o instanceof SassSelector) return selector.equals(((SassSelector) o).selector);
        return toList().equals(o);
    }

    @Override
    public int hashCode() {
        return toList().hashCode();
    }
}
