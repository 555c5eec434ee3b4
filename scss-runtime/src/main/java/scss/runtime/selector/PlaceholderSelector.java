package scss.runtime.selector;

/**
 * 占位符选择器 {@code %name}：只作为 {@code @extend} 目标，自身从不输出
 */
public final class PlaceholderSelector extends SimpleSelector {

    private final String name;

    public PlaceholderSelector(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean isPlaceholder() {
        return true;
    }

    @Override
    public SimpleSelector withSuffix(String suffix) {
        return new PlaceholderSelector(name + suffix);
    }

    @Override
    public String toString() {
        return "%" + name;
    }
}
