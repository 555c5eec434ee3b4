package scss.runtime.scope;

import scss.runtime.UndefinedNameException;
import scss.runtime.value.SassCallable;
import scss.runtime.value.SassValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 词法作用域帧
 *
 * <p>每个帧持有变量、函数、mixin 三张表，查找沿 parent 链向外。根帧是模块作用域，
 * 另外持有通过 {@code @use} 引入的模块绑定。</p>
 *
 * <p>赋值规则：{@code !global} 写根帧；名字已存在时写所在帧，但非半全局帧中对根帧变量的赋值创建局部变量；
 * 否则在当前帧新建。根层控制流（{@code @if}/{@code @each}/{@code @for}/{@code @while}）的帧是半全局的。</p>
 */
public final class Environment {

    private final Environment parent;
    private final boolean semiGlobal;
    private Map<String, SassValue> variables;
    private Map<String, SassCallable> functions;
    private Map<String, SassCallable> mixins;

    // 仅根帧使用
    private Map<String, Module> namespaces;
    private List<Module> globalModules;
    private List<Module> forwardedModules;

    /** 创建模块根帧 */
    public Environment() {
        this(null, false);
    }

    private Environment(Environment parent, boolean semiGlobal) {
        this.parent = parent;
        this.semiGlobal = semiGlobal;
    }

    public Environment getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * 创建子帧
     *
     * @param flowControl 是否为控制流块；只有直接位于根帧或半全局帧之下时才是半全局的
     */
    public Environment child(boolean flowControl) {
        return new Environment(this, flowControl && (parent == null || semiGlobal));
    }

    public Environment child() {
        return child(false);
    }

    public Environment getRoot() {
        Environment env = this;
        while (env.parent != null) {
            env = env.parent;
        }
        return env;
    }

    /** 当前帧能否直接修改根帧中已有的变量 */
    private boolean canWriteRoot() {
        return parent == null || semiGlobal;
    }

    // ============ 变量 ============

    public SassValue getVariable(String name) {
        String key = Names.normalize(name);
        for (Environment env = this; env != null; env = env.parent) {
            if (env.variables != null) {
                SassValue value = env.variables.get(key);
                if (value != null) return value;
            }
        }
        Module module = getRoot().globalModuleWithVariable(key);
        return module == null ? null : module.getVariable(key);
    }

    public boolean variableExists(String name) {
        return getVariable(name) != null;
    }

    /** 根帧或 {@code as *} 模块中是否存在 */
    public boolean globalVariableExists(String name) {
        Environment root = getRoot();
        String key = Names.normalize(name);
        if (root.variables != null && root.variables.containsKey(key)) return true;
        return root.globalModuleWithVariable(key) != null;
    }

    /**
     * 变量赋值（{@code $x: value}）
     *
     * @param global 是否带 {@code !global}
     */
    public void setVariable(String name, SassValue value, boolean global) {
        String key = Names.normalize(name);
        Environment root = getRoot();
        if (global) {
            if ((root.variables == null || !root.variables.containsKey(key))) {
                Module module = root.globalModuleWithVariable(key);
                if (module != null) {
                    module.setVariable(key, value);
                    return;
                }
            }
            root.putVariable(key, value);
            return;
        }
        for (Environment env = this; env != null; env = env.parent) {
            if (env.variables != null && env.variables.containsKey(key)) {
                if (env.parent == null && !canWriteRoot()) {
                    break;
                }
                env.variables.put(key, value);
                return;
            }
        }
        if (canWriteRoot()) {
            Module module = root.globalModuleWithVariable(key);
            if (module != null && (root.variables == null || !root.variables.containsKey(key))) {
                module.setVariable(key, value);
                return;
            }
        }
        putVariable(key, value);
    }

    /** 在当前帧声明（参数、循环变量） */
    public void declareLocal(String name, SassValue value) {
        putVariable(Names.normalize(name), value);
    }

    private void putVariable(String key, SassValue value) {
        if (variables == null) variables = new LinkedHashMap<>();
        variables.put(key, value);
    }

    /** 本帧的变量（规范化名称，按声明顺序） */
    public Map<String, SassValue> getLocalVariables() {
        return variables == null ? Collections.<String, SassValue>emptyMap() : Collections.unmodifiableMap(variables);
    }

    // ============ 函数与 mixin ============

    public SassCallable getFunction(String name) {
        String key = Names.normalize(name);
        for (Environment env = this; env != null; env = env.parent) {
            if (env.functions != null) {
                SassCallable callable = env.functions.get(key);
                if (callable != null) return callable;
            }
        }
        Environment root = getRoot();
        if (root.globalModules != null) {
            SassCallable found = null;
            for (Module module : root.globalModules) {
                SassCallable callable = module.getFunction(key);
                if (callable == null) continue;
                if (found != null && found != callable) {
                    throw new UndefinedNameException("This function is available from multiple global modules.");
                }
                found = callable;
            }
            return found;
        }
        return null;
    }

    public void setFunction(String name, SassCallable callable) {
        if (functions == null) functions = new LinkedHashMap<>();
        functions.put(Names.normalize(name), callable);
    }

    public SassCallable getMixin(String name) {
        String key = Names.normalize(name);
        for (Environment env = this; env != null; env = env.parent) {
            if (env.mixins != null) {
                SassCallable callable = env.mixins.get(key);
                if (callable != null) return callable;
            }
        }
        Environment root = getRoot();
        if (root.globalModules != null) {
            SassCallable found = null;
            for (Module module : root.globalModules) {
                SassCallable callable = module.getMixin(key);
                if (callable == null) continue;
                if (found != null && found != callable) {
                    throw new UndefinedNameException("This mixin is available from multiple global modules.");
                }
                found = callable;
            }
            return found;
        }
        return null;
    }

    public void setMixin(String name, SassCallable callable) {
        if (mixins == null) mixins = new LinkedHashMap<>();
        mixins.put(Names.normalize(name), callable);
    }

    public Map<String, SassCallable> getLocalFunctions() {
        return functions == null ? Collections.<String, SassCallable>emptyMap() : Collections.unmodifiableMap(functions);
    }

    public Map<String, SassCallable> getLocalMixins() {
        return mixins == null ? Collections.<String, SassCallable>emptyMap() : Collections.unmodifiableMap(mixins);
    }

    // ============ 模块绑定（根帧） ============

    /**
     * 绑定 {@code @use} 的模块
     *
     * @param namespace 命名空间，{@code as *} 时为 null
     */
    public void addModule(String namespace, Module module) {
        Environment root = getRoot();
        if (namespace == null) {
            if (root.globalModules == null) root.globalModules = new ArrayList<>();
            if (!root.globalModules.contains(module)) root.globalModules.add(module);
            return;
        }
        if (root.namespaces == null) root.namespaces = new HashMap<>();
        if (root.namespaces.containsKey(namespace)) {
            throw new UndefinedNameException("There's already a module with namespace \"" + namespace + "\".");
        }
        root.namespaces.put(namespace, module);
    }

    /**
     * 按命名空间取模块
     *
     * @throws UndefinedNameException 命名空间不存在
     */
    public Module getModule(String namespace) {
        Environment root = getRoot();
        Module module = root.namespaces == null ? null : root.namespaces.get(namespace);
        if (module == null) {
            throw new UndefinedNameException("There is no module with the namespace \"" + namespace + "\".");
        }
        return module;
    }

    public Map<String, Module> getNamespaces() {
        Environment root = getRoot();
        return root.namespaces == null ? Collections.<String, Module>emptyMap()
                : Collections.unmodifiableMap(root.namespaces);
    }

    /** 记录 {@code @forward} 转发的模块视图 */
    public void addForwardedModule(Module module) {
        Environment root = getRoot();
        if (root.forwardedModules == null) root.forwardedModules = new ArrayList<>();
        root.forwardedModules.add(module);
    }

    public List<Module> getForwardedModules() {
        Environment root = getRoot();
        return root.forwardedModules == null ? Collections.<Module>emptyList()
                : Collections.unmodifiableList(root.forwardedModules);
    }

    private Module globalModuleWithVariable(String key) {
        if (globalModules == null) return null;
        Module found = null;
        for (Module module : globalModules) {
            if (!module.hasVariable(key)) continue;
            if (found != null) {
                throw new UndefinedNameException("This variable is available from multiple global modules.");
            }
            found = module;
        }
        return found;
    }
}
