package scss.runtime.builtin;

import scss.runtime.scope.BuiltinModule;
import scss.runtime.value.SassCallable;
import scss.runtime.value.SassValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 内建函数注册表
 *
 * <p>同一实现可同时出现在 {@code sass:xxx} 模块中和全局（旧式）命名空间中。
 * 标准注册表只构建一次，构建后不可变，可在线程间共享。</p>
 */
public final class BuiltinRegistry {

    private static final Logger LOG = Logger.getLogger(BuiltinRegistry.class.getName());

    private static final BuiltinRegistry STANDARD = createStandard();

    private final Map<String, BuiltinFunction> globals;
    private final Map<String, BuiltinModule> modules;

    private BuiltinRegistry(Map<String, BuiltinFunction> globals, Map<String, BuiltinModule> modules) {
        this.globals = Collections.unmodifiableMap(globals);
        this.modules = Collections.unmodifiableMap(modules);
    }

    public static BuiltinRegistry standard() {
        return STANDARD;
    }

    private static BuiltinRegistry createStandard() {
        Builder builder = new Builder();
        MathFunctions.register(builder);
        ColorFunctions.register(builder);
        StringFunctions.register(builder);
        ListFunctions.register(builder);
        MapFunctions.register(builder);
        MetaFunctions.register(builder);
        SelectorFunctions.register(builder);
        BuiltinRegistry registry = builder.build();
        LOG.fine("Registered " + registry.globals.size() + " global functions and "
                + registry.modules.size() + " built-in modules");
        return registry;
    }

    /** 全局函数，按规范化名称查找 */
    public BuiltinFunction getGlobalFunction(String name) {
        return globals.get(name.replace('_', '-'));
    }

    public Set<String> getGlobalFunctionNames() {
        return globals.keySet();
    }

    /**
     * @param url 形如 {@code sass:math}
     * @return 不存在时返回 null
     */
    public BuiltinModule getModule(String url) {
        return modules.get(url);
    }

    public Set<String> getModuleUrls() {
        return modules.keySet();
    }

    /**
     * 注册表构建器
     */
    public static final class Builder {
        private final Map<String, BuiltinFunction> globals = new LinkedHashMap<String, BuiltinFunction>();
        private final Map<String, Map<String, SassCallable>> functions =
                new LinkedHashMap<String, Map<String, SassCallable>>();
        private final Map<String, Map<String, SassValue>> variables =
                new LinkedHashMap<String, Map<String, SassValue>>();

        Builder() {}

        /** 只放入模块 */
        public BuiltinFunction module(String module, BuiltinFunction function) {
            moduleFunctions(module).put(function.getName(), function);
            return function;
        }

        /** 只放入模块 */
        public BuiltinFunction module(String module, String name, String signature, BuiltinFunction.Body body) {
            return module(module, BuiltinFunction.create(name, signature, body));
        }

        /** 模块与全局同名 */
        public BuiltinFunction both(String module, BuiltinFunction function) {
            module(module, function);
            global(function.getName(), function);
            return function;
        }

        /** 模块与全局同名 */
        public BuiltinFunction both(String module, String name, String signature, BuiltinFunction.Body body) {
            return both(module, BuiltinFunction.create(name, signature, body));
        }

        /** 以指定名称放入全局 */
        public Builder global(String name, BuiltinFunction function) {
            if (globals.containsKey(name)) {
                throw new IllegalStateException("Duplicate global function " + name);
            }
            globals.put(name, function.withName(name));
            return this;
        }

        /** 只放入全局 */
        public BuiltinFunction global(String name, String signature, BuiltinFunction.Body body) {
            BuiltinFunction function = BuiltinFunction.create(name, signature, body);
            global(name, function);
            return function;
        }

        public Builder variable(String module, String name, SassValue value) {
            moduleVariables(module).put(name, value);
            return this;
        }

        private Map<String, SassCallable> moduleFunctions(String module) {
            Map<String, SassCallable> map = functions.get(module);
            if (map == null) {
                map = new LinkedHashMap<String, SassCallable>();
                functions.put(module, map);
            }
            return map;
        }

        private Map<String, SassValue> moduleVariables(String module) {
            Map<String, SassValue> map = variables.get(module);
            if (map == null) {
                map = new LinkedHashMap<String, SassValue>();
                variables.put(module, map);
            }
            return map;
        }

        BuiltinRegistry build() {
            Map<String, BuiltinModule> modules = new LinkedHashMap<String, BuiltinModule>();
            for (Map.Entry<String, Map<String, SassCallable>> entry : functions.entrySet()) {
                String url = "sass:" + entry.getKey();
                Map<String, SassValue> vars = variables.get(entry.getKey());
                modules.put(url, new BuiltinModule(url, entry.getValue(), Collections.<String, SassCallable>emptyMap(),
                        vars != null ? vars : Collections.<String, SassValue>emptyMap()));
            }
            return new BuiltinRegistry(new LinkedHashMap<String, BuiltinFunction>(globals), modules);
        }
    }
}
