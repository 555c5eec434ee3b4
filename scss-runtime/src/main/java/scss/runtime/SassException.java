package scss.runtime;

/**
 * Sass 基础异常（无源位置信息）。
 *
 * <p>{@link SassRuntimeException} 继承此类，并添加源码位置与 Sass 调用栈等诊断信息。</p>
 */
public class SassException extends RuntimeException {

    public SassException(String message) {
        super(message);
    }

    public SassException(String message, Throwable cause) {
        super(message, cause);
    }
}
