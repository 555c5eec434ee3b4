package scss.runtime.value;

import java.util.Collections;
import java.util.List;

public final class SassNull extends SassValue {

    public static final SassNull INSTANCE = new SassNull();

    private SassNull() {}

    @Override
    public boolean isTruthy() {
        return false;
    }

    @Override
    public boolean isNull() {
        return true;
    }

    @Override
    public boolean isBlank() {
        return true;
    }

    @Override
    public List<SassValue> asList() {
        return Collections.<SassValue>singletonList(this);
    }

    @Override
    public Kind getKind() {
        return Kind.NULL;
    }

    @Override
    public String getTypeName() {
        return "null";
    }

    @Override
    public SassValue unaryMinus() {
        return SassString.unquoted("-");
    }

    @Override
    public SassValue unaryPlus() {
        return SassString.unquoted("+");
    }

    @Override
    public SassValue unaryDivide() {
        return SassString.unquoted("/");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SassNull;
    }

    @Override
    public int hashCode() {
        return 0;
    }
}
