package scss.runtime.selector;

import java.util.ArrayList;
import java.util.List;

/**
 * 通配选择器 {@code *}、{@code ns|*}
 */
public final class UniversalSelector extends SimpleSelector {

    private final String namespace;

    public UniversalSelector(String namespace) {
        this.namespace = namespace;
    }

    public String getNamespace() {
        return namespace;
    }

    @Override
    public int getSpecificity() {
        return 0;
    }

    @Override
    public List<SimpleSelector> unify(List<SimpleSelector> compound) {
        if (!compound.isEmpty() && (compound.get(0) instanceof UniversalSelector
                || compound.get(0) instanceof TypeSelector)) {
            SimpleSelector unified = unifyElement(this, compound.get(0));
            if (unified == null) return null;
            List<SimpleSelector> result = new ArrayList<>(compound);
            result.set(0, unified);
            return result;
        }
        if (!compound.isEmpty() && (namespace == null || "*".equals(namespace))) {
            return compound;
        }
        List<SimpleSelector> result = new ArrayList<>(compound.size() + 1);
        result.add(this);
        result.addAll(compound);
        return result;
    }

    /**
     * 合并两个元素级选择器（类型或通配），不兼容时返回 null
     */
    static SimpleSelector unifyElement(SimpleSelector a, SimpleSelector b) {
        String ns1 = a instanceof TypeSelector ? ((TypeSelector) a).getNamespace() : ((UniversalSelector) a).namespace;
        String ns2 = b instanceof TypeSelector ? ((TypeSelector) b).getNamespace() : ((UniversalSelector) b).namespace;
        String namespace;
        if (ns1 == null ? ns2 == null : ns1.equals(ns2)) {
            namespace = ns1;
        } else if (ns1 == null || "*".equals(ns1)) {
            namespace = ns2;
        } else if (ns2 == null || "*".equals(ns2)) {
            namespace = ns1;
        } else {
            return null;
        }
        String name1 = a instanceof TypeSelector ? ((TypeSelector) a).getName() : null;
        String name2 = b instanceof TypeSelector ? ((TypeSelector) b).getName() : null;
        if (name1 != null && name2 != null && !name1.equals(name2)) return null;
        String name = name1 != null ? name1 : name2;
        return name == null ? new UniversalSelector(namespace) : new TypeSelector(namespace, name);
    }

    @Override
    public String toString() {
        return namespace == null ? "*" : namespace + "|*";
    }
}
