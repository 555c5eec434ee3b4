package scss.runtime.interpreter;

import scss.runtime.value.SassValue;

/**
 * 控制流信号
 *
 * <p>{@code @return} 通过抛出本异常跳出函数体，由函数调用处捕获。不是真正的错误。</p>
 */
public final class ControlFlow extends RuntimeException {

    private final SassValue value;

    private ControlFlow(SassValue value) {
        super(null, null, false, false);  // 禁用堆栈跟踪
        this.value = value;
    }

    public SassValue getValue() {
        return value;
    }

    public static ControlFlow returnValue(SassValue value) {
        return new ControlFlow(value);
    }
}
