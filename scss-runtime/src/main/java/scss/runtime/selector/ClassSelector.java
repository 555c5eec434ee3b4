package scss.runtime.selector;

public final class ClassSelector extends SimpleSelector {

    private final String name;

    public ClassSelector(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public SimpleSelector withSuffix(String suffix) {
        return new ClassSelector(name + suffix);
    }

    @Override
    public String toString() {
        return "." + name;
    }
}
