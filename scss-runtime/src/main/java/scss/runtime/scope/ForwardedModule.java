package scss.runtime.scope;

import scss.runtime.UndefinedNameException;
import scss.runtime.css.CssStylesheet;
import scss.runtime.value.SassCallable;
import scss.runtime.value.SassValue;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@code @forward} 产生的模块视图：对外名称加前缀，并按 show/hide 过滤
 *
 * <p>show/hide 中的变量名带 {@code $}，均针对加前缀后的名称。</p>
 */
public final class ForwardedModule implements Module {

    private final Module inner;
    private final String prefix;
    private final Set<String> shown;
    private final Set<String> hidden;

    public ForwardedModule(Module inner, String prefix, Set<String> shown, Set<String> hidden) {
        this.inner = inner;
        this.prefix = prefix == null ? null : Names.normalize(prefix);
        this.shown = normalizeAll(shown);
        this.hidden = normalizeAll(hidden);
    }

    private static Set<String> normalizeAll(Set<String> names) {
        if (names == null) return null;
        Set<String> result = new LinkedHashSet<>();
        for (String name : names) {
            result.add(Names.normalize(name));
        }
        return result;
    }

    public Module getInner() {
        return inner;
    }

    /** 外部名称对应的内部名称；不可见时返回 null */
    private String innerName(String name, boolean variable) {
        String key = Names.normalize(name);
        String filterKey = variable ? "$" + key : key;
        if (shown != null && !shown.contains(filterKey)) return null;
        if (hidden != null && hidden.contains(filterKey)) return null;
        if (prefix == null) return key;
        if (!key.startsWith(prefix)) return null;
        return key.substring(prefix.length());
    }

    private String outerName(String name, boolean variable) {
        String key = prefix == null ? name : prefix + name;
        String filterKey = variable ? "$" + key : key;
        if (shown != null && !shown.contains(filterKey)) return null;
        if (hidden != null && hidden.contains(filterKey)) return null;
        return key;
    }

    @Override
    public String getUrl() {
        return inner.getUrl();
    }

    @Override
    public SassValue getVariable(String name) {
        String innerName = innerName(name, true);
        return innerName == null ? null : inner.getVariable(innerName);
    }

    @Override
    public boolean hasVariable(String name) {
        return getVariable(name) != null;
    }

    @Override
    public void setVariable(String name, SassValue value) {
        String innerName = innerName(name, true);
        if (innerName == null) throw new UndefinedNameException("Undefined variable.");
        inner.setVariable(innerName, value);
    }

    @Override
    public SassCallable getFunction(String name) {
        String innerName = innerName(name, false);
        return innerName == null ? null : inner.getFunction(innerName);
    }

    @Override
    public SassCallable getMixin(String name) {
        String innerName = innerName(name, false);
        return innerName == null ? null : inner.getMixin(innerName);
    }

    @Override
    public Set<String> getVariableNames() {
        return outerNames(inner.getVariableNames(), true);
    }

    @Override
    public Set<String> getFunctionNames() {
        return outerNames(inner.getFunctionNames(), false);
    }

    @Override
    public Set<String> getMixinNames() {
        return outerNames(inner.getMixinNames(), false);
    }

    private Set<String> outerNames(Set<String> names, boolean variable) {
        Set<String> result = new LinkedHashSet<>();
        for (String name : names) {
            String outer = outerName(name, variable);
            if (outer != null) result.add(outer);
        }
        return result;
    }

    /** 视图不拥有 CSS，CSS 由被转发的模块本身输出 */
    @Override
    public CssStylesheet getCss() {
        return null;
    }

    @Override
    public List<Module> getUpstream() {
        return Collections.singletonList(inner);
    }

    @Override
    public boolean isBuiltin() {
        return inner.isBuiltin();
    }

    @Override
    public String toString() {
        return "forward(" + inner + ")";
    }
}
