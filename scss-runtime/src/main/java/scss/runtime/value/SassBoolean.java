package scss.runtime.value;

public final class SassBoolean extends SassValue {

    public static final SassBoolean TRUE = new SassBoolean(true);
    public static final SassBoolean FALSE = new SassBoolean(false);

    private final boolean value;

    private SassBoolean(boolean value) {
        this.value = value;
    }

    public static SassBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public boolean isTruthy() {
        return value;
    }

    @Override
    public Kind getKind() {
        return Kind.BOOLEAN;
    }

    @Override
    public String getTypeName() {
        return "bool";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SassBoolean && ((SassBoolean) o).value == value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }
}
