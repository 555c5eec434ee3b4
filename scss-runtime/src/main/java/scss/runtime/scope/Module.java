package scss.runtime.scope;

import scss.runtime.css.CssStylesheet;
import scss.runtime.value.SassCallable;
import scss.runtime.value.SassValue;

import java.util.List;
import java.util.Set;

/**
 * 已加载的模块：对外暴露变量、函数、mixin 与模块自身产生的 CSS
 *
 * <p>名称均为不带 {@code $} 的规范化名称；私有成员不可见。</p>
 */
public interface Module {

    String getUrl();

    /** 变量值，不存在或不可见时返回 null */
    SassValue getVariable(String name);

    boolean hasVariable(String name);

    /**
     * 修改模块变量
     *
     * @throws scss.runtime.UndefinedNameException 变量不存在
     */
    void setVariable(String name, SassValue value);

    SassCallable getFunction(String name);

    SassCallable getMixin(String name);

    Set<String> getVariableNames();

    Set<String> getFunctionNames();

    Set<String> getMixinNames();

    /** 模块自身的 CSS（不含依赖模块的 CSS），内建模块为 null */
    CssStylesheet getCss();

    /** 本模块 {@code @use}/{@code @forward} 的模块，按加载顺序 */
    List<Module> getUpstream();

    boolean isBuiltin();
}
