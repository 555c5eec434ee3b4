package scss.runtime.interpreter;

import scss.runtime.value.SassCallable;

/**
 * 未定义的函数名按纯 CSS 函数输出：{@code foo(1, 2)}
 */
public final class PlainCssCallable implements SassCallable {

    private final String name;

    public PlainCssCallable(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PlainCssCallable && ((PlainCssCallable) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name + "()";
    }
}
