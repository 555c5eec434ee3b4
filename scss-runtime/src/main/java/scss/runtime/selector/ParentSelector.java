package scss.runtime.selector;

import java.util.List;

/**
 * 父选择器 {@code &}，可带后缀（{@code &-item}）；嵌套解析后不再出现
 */
public final class ParentSelector extends SimpleSelector {

    private final String suffix;

    public ParentSelector(String suffix) {
        this.suffix = suffix;
    }

    public String getSuffix() {
        return suffix;
    }

    @Override
    public List<SimpleSelector> unify(List<SimpleSelector> compound) {
        throw new IllegalStateException("Parent selectors can't be unified");
    }

    @Override
    public String toString() {
        return suffix == null ? "&" : "&" + suffix;
    }
}
