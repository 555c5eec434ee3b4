package scss.runtime.scope;

import scss.runtime.SassRuntimeException;
import scss.runtime.css.CssStylesheet;
import scss.runtime.value.SassCallable;
import scss.runtime.value.SassValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 内建模块（{@code sass:math} 等），成员只读
 */
public final class BuiltinModule implements Module {

    private final String url;
    private final Map<String, SassCallable> functions;
    private final Map<String, SassCallable> mixins;
    private final Map<String, SassValue> variables;

    public BuiltinModule(String url, Map<String, SassCallable> functions, Map<String, SassCallable> mixins,
                         Map<String, SassValue> variables) {
        this.url = url;
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        this.mixins = Collections.unmodifiableMap(new LinkedHashMap<>(mixins));
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    @Override
    public String getUrl() {
        return url;
    }

    @Override
    public SassValue getVariable(String name) {
        return variables.get(Names.normalize(name));
    }

    @Override
    public boolean hasVariable(String name) {
        return variables.containsKey(Names.normalize(name));
    }

    @Override
    public void setVariable(String name, SassValue value) {
        throw new SassRuntimeException("Cannot modify built-in variable.");
    }

    @Override
    public SassCallable getFunction(String name) {
        return functions.get(Names.normalize(name));
    }

    @Override
    public SassCallable getMixin(String name) {
        return mixins.get(Names.normalize(name));
    }

    @Override
    public Set<String> getVariableNames() {
        return variables.keySet();
    }

    @Override
    public Set<String> getFunctionNames() {
        return functions.keySet();
    }

    @Override
    public Set<String> getMixinNames() {
        return mixins.keySet();
    }

    @Override
    public CssStylesheet getCss() {
        return null;
    }

    @Override
    public List<Module> getUpstream() {
        return Collections.emptyList();
    }

    @Override
    public boolean isBuiltin() {
        return true;
    }

    @Override
    public String toString() {
        return url;
    }
}
