package scss.runtime.builtin;

import scss.runtime.scope.Environment;
import scss.runtime.scope.Module;
import scss.runtime.value.SassCallable;
import scss.runtime.value.SassValue;

import java.util.List;
import java.util.Map;

/**
 * 内建函数可见的求值器能力
 */
public interface FunctionContext {

    SassRandom getRandom();

    /** 调用处的作用域 */
    Environment getEnvironment();

    /** 记录警告；deprecation 为 true 时为弃用提示 */
    void warn(String message, boolean deprecation);

    /**
     * 按名称查找函数（用户函数、模块函数、内建函数）
     *
     * @param namespace 模块命名空间，可为 null
     * @return 找不到时返回 null
     */
    SassCallable lookupFunction(String name, String namespace);

    SassCallable lookupMixin(String name, String namespace);

    /** 纯 CSS 函数引用（{@code get-function($name, $css: true)}） */
    SassCallable plainCssFunction(String name);

    /**
     * 调用函数引用（{@code call()}）
     */
    SassValue callFunction(SassCallable callable, List<SassValue> positional, Map<String, SassValue> named);

    /** 当前 mixin 调用是否带内容块 */
    boolean contentExists();

    /**
     * @throws scss.runtime.UndefinedNameException 命名空间不存在
     */
    Module getModule(String namespace);
}
