package scss.runtime.selector;

import java.util.ArrayList;
import java.util.List;

/**
 * 简单选择器：类型/通配、类、ID、属性、伪类/伪元素、占位符、父选择器
 */
public abstract class SimpleSelector {

    /** 类、属性、伪类、占位符的特异性；ID 为其平方，类型与伪元素为 1 */
    static final int CLASS_SPECIFICITY = 1000;

    public int getSpecificity() {
        return CLASS_SPECIFICITY;
    }

    /** 是否为占位符选择器 {@code %x} */
    public boolean isPlaceholder() {
        return false;
    }

    /** 为 {@code &-suffix} 追加后缀；不支持后缀的选择器返回 null */
    public SimpleSelector withSuffix(String suffix) {
        return null;
    }

    /**
     * 将本选择器合并进复合选择器，不可能同时匹配时返回 null
     *
     * <p>新选择器放在第一个伪类/伪元素之前。</p>
     */
    public List<SimpleSelector> unify(List<SimpleSelector> compound) {
        if (compound.size() == 1 && compound.get(0) instanceof UniversalSelector) {
            return compound.get(0).unify(singleton(this));
        }
        if (compound.contains(this)) return compound;
        List<SimpleSelector> result = new ArrayList<>(compound.size() + 1);
        boolean added = false;
        for (SimpleSelector simple : compound) {
            if (!added && simple instanceof PseudoSelector) {
                result.add(this);
                added = true;
            }
            result.add(simple);
        }
        if (!added) result.add(this);
        return result;
    }

    static List<SimpleSelector> singleton(SimpleSelector simple) {
        List<SimpleSelector> list = new ArrayList<>(1);
        list.add(simple);
        return list;
    }

    /** CSS 文本 */
    @Override
    public abstract String toString();

    @Override
    public boolean equals(Object o) {
        return o != null && o.getClass() == getClass() && o.toString().equals(toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }
}
