package scss.runtime.selector;

import java.util.ArrayList;
import java.util.List;

/**
 * 类型选择器 {@code div}、{@code svg|rect}
 */
public final class TypeSelector extends SimpleSelector {

    private final String namespace;
    private final String name;

    public TypeSelector(String namespace, String name) {
        this.namespace = namespace;
        this.name = name;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    @Override
    public int getSpecificity() {
        return 1;
    }

    @Override
    public SimpleSelector withSuffix(String suffix) {
        return new TypeSelector(namespace, name + suffix);
    }

    @Override
    public List<SimpleSelector> unify(List<SimpleSelector> compound) {
        if (!compound.isEmpty() && (compound.get(0) instanceof UniversalSelector
                || compound.get(0) instanceof TypeSelector)) {
            SimpleSelector unified = UniversalSelector.unifyElement(this, compound.get(0));
            if (unified == null) return null;
            List<SimpleSelector> result = new ArrayList<>(compound);
            result.set(0, unified);
            return result;
        }
        List<SimpleSelector> result = new ArrayList<>(compound.size() + 1);
        result.add(this);
        result.addAll(compound);
        return result;
    }

    @Override
    public String toString() {
        return namespace == null ? name : namespace + "|" + name;
    }
}
