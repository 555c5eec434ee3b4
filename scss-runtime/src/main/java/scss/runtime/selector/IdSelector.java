package scss.runtime.selector;

import java.util.List;

public final class IdSelector extends SimpleSelector {

    private final String name;

    public IdSelector(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public int getSpecificity() {
        return CLASS_SPECIFICITY * CLASS_SPECIFICITY;
    }

    @Override
    public SimpleSelector withSuffix(String suffix) {
        return new IdSelector(name + suffix);
    }

    /** 同一元素不能有两个不同的 ID */
    @Override
    public List<SimpleSelector> unify(List<SimpleSelector> compound) {
        for (SimpleSelector simple : compound) {
            if (simple instanceof IdSelector && !simple.equals(this)) return null;
        }
        return super.unify(compound);
    }

    @Override
    public String toString() {
        return "#" + name;
    }
}
