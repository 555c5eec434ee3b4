package scss.runtime.value;

/**
 * 函数引用（{@code get-function()} 的结果）
 */
public final class SassFunction extends SassValue {

    private final SassCallable callable;

    public SassFunction(SassCallable callable) {
        this.callable = callable;
    }

    public SassCallable getCallable() {
        return callable;
    }

    @Override
    public SassFunction assertFunction(String name) {
        return this;
    }

    @Override
    public Kind getKind() {
        return Kind.FUNCTION;
    }

    @Override
    public String getTypeName() {
        return "function";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SassFunction && ((SassFunction) o).callable == callable;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(callable);
    }
}
