package scss.runtime.value;

/**
 * 可调用体：内建函数、用户函数、用户 mixin 或纯 CSS 函数
 */
public interface SassCallable {

    String getName();
}
