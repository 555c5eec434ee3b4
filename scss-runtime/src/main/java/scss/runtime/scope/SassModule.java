package scss.runtime.scope;

import scss.runtime.UndefinedNameException;
import scss.runtime.css.CssStylesheet;
import scss.runtime.value.SassCallable;
import scss.runtime.value.SassValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 用户样式表求值得到的模块：成员来自其根帧与 {@code @forward} 的模块
 */
public final class SassModule implements Module {

    private final String url;
    private final Environment environment;
    private final CssStylesheet css;
    private final List<Module> upstream;

    public SassModule(String url, Environment environment, CssStylesheet css, List<Module> upstream) {
        this.url = url;
        this.environment = environment;
        this.css = css;
        this.upstream = Collections.unmodifiableList(new ArrayList<>(upstream));
    }

    @Override
    public String getUrl() {
        return url;
    }

    public Environment getEnvironment() {
        return environment;
    }

    @Override
    public SassValue getVariable(String name) {
        String key = Names.normalize(name);
        if (Names.isPrivate(key)) return null;
        SassValue own = environment.getLocalVariables().get(key);
        if (own != null) return own;
        for (Module forwarded : environment.getForwardedModules()) {
            SassValue value = forwarded.getVariable(key);
            if (value != null) return value;
        }
        return null;
    }

    @Override
    public boolean hasVariable(String name) {
        return getVariable(name) != null;
    }

    @Override
    public void setVariable(String name, SassValue value) {
        String key = Names.normalize(name);
        if (!Names.isPrivate(key)) {
            if (environment.getLocalVariables().containsKey(key)) {
                environment.setVariable(key, value, true);
                return;
            }
            for (Module forwarded : environment.getForwardedModules()) {
                if (forwarded.hasVariable(key)) {
                    forwarded.setVariable(key, value);
                    return;
                }
            }
        }
        throw new UndefinedNameException("Undefined variable.");
    }

    @Override
    public SassCallable getFunction(String name) {
        String key = Names.normalize(name);
        if (Names.isPrivate(key)) return null;
        SassCallable own = environment.getLocalFunctions().get(key);
        if (own != null) return own;
        for (Module forwarded : environment.getForwardedModules()) {
            SassCallable callable = forwarded.getFunction(key);
            if (callable != null) return callable;
        }
        return null;
    }

    @Override
    public SassCallable getMixin(String name) {
        String key = Names.normalize(name);
        if (Names.isPrivate(key)) return null;
        SassCallable own = environment.getLocalMixins().get(key);
        if (own != null) return own;
        for (Module forwarded : environment.getForwardedModules()) {
            SassCallable callable = forwarded.getMixin(key);
            if (callable != null) return callable;
        }
        return null;
    }

    @Override
    public Set<String> getVariableNames() {
        Set<String> names = publicNames(environment.getLocalVariables().keySet());
        for (Module forwarded : environment.getForwardedModules()) {
            names.addAll(forwarded.getVariableNames());
        }
        return names;
    }

    @Override
    public Set<String> getFunctionNames() {
        Set<String> names = publicNames(environment.getLocalFunctions().keySet());
        for (Module forwarded : environment.getForwardedModules()) {
            names.addAll(forwarded.getFunctionNames());
        }
        return names;
    }

    @Override
    public Set<String> getMixinNames() {
        Set<String> names = publicNames(environment.getLocalMixins().keySet());
        for (Module forwarded : environment.getForwardedModules()) {
            names.addAll(forwarded.getMixinNames());
        }
        return names;
    }

    private static Set<String> publicNames(Set<String> names) {
        Set<String> result = new LinkedHashSet<>();
        for (String name : names) {
            if (!Names.isPrivate(name)) result.add(name);
        }
        return result;
    }

    @Override
    public CssStylesheet getCss() {
        return css;
    }

    @Override
    public List<Module> getUpstream() {
        return upstream;
    }

    @Override
    public boolean isBuiltin() {
        return false;
    }

    @Override
    public String toString() {
        return url;
    }
}
