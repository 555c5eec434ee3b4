package scss.runtime.builtin;

import scss.runtime.SassRuntimeException;
import scss.runtime.SassTypeException;
import scss.runtime.scope.Module;
import scss.runtime.value.SassArgList;
import scss.runtime.value.SassBoolean;
import scss.runtime.value.SassCallable;
import scss.runtime.value.SassFunction;
import scss.runtime.value.SassMap;
import scss.runtime.value.SassString;
import scss.runtime.value.SassValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code sass:meta} 与对应的全局函数
 */
final class MetaFunctions {

    private static final String MODULE = "meta";

    private static final Set<String> FEATURES = new HashSet<String>(Arrays.asList(
            "global-variable-shadowing", "extend-selector-pseudoclass", "units-level-3", "at-error",
            "custom-property"));

    private MetaFunctions() {}

    static void register(BuiltinRegistry.Builder r) {
        // ============ 值 ============

        r.global("if", "$condition, $if-true, $if-false", (ctx, args) ->
                args.get(0).isTruthy() ? args.get(1) : args.get(2));
        r.both(MODULE, "type-of", "$value", (ctx, args) -> SassString.unquoted(args.get(0).getTypeName()));
        r.both(MODULE, "inspect", "$value", (ctx, args) -> SassString.unquoted(args.get(0).inspect()));
        r.both(MODULE, "feature-exists", "$feature", (ctx, args) ->
                SassBoolean.of(FEATURES.contains(args.get(0).assertString("feature").getText())));
        r.both(MODULE, "keywords", "$args", (ctx, args) -> {
            if (!(args.get(0) instanceof SassArgList)) {
                throw new SassTypeException("$args: " + args.get(0).inspect() + " is not an argument list.");
            }
            Map<SassValue, SassValue> contents = new LinkedHashMap<SassValue, SassValue>();
            for (Map.Entry<String, SassValue> entry : ((SassArgList) args.get(0)).getKeywords().entrySet()) {
                contents.put(SassString.unquoted(entry.getKey()), entry.getValue());
            }
            return new SassMap(contents);
        });

        // ============ 作用域 ============

        r.both(MODULE, "variable-exists", "$name", (ctx, args) ->
                SassBoolean.of(ctx.getEnvironment().variableExists(name(args.get(0)))));
        r.both(MODULE, "global-variable-exists", "$name, $module: null", (ctx, args) -> {
            String name = name(args.get(0));
            if (!args.get(1).isNull()) {
                return SassBoolean.of(ctx.getModule(moduleName(args.get(1))).hasVariable(name));
            }
            return SassBoolean.of(ctx.getEnvironment().globalVariableExists(name));
        });
        r.both(MODULE, "function-exists", "$name, $module: null", (ctx, args) ->
                SassBoolean.of(ctx.lookupFunction(name(args.get(0)), optionalModule(args.get(1))) != null));
        r.both(MODULE, "mixin-exists", "$name, $module: null", (ctx, args) ->
                SassBoolean.of(ctx.lookupMixin(name(args.get(0)), optionalModule(args.get(1))) != null));
        r.both(MODULE, "content-exists", "", (ctx, args) -> SassBoolean.of(ctx.contentExists()));

        r.module(MODULE, "module-variables", "$module", (ctx, args) -> {
            Module module = ctx.getModule(moduleName(args.get(0)));
            Map<SassValue, SassValue> contents = new LinkedHashMap<SassValue, SassValue>();
            for (String name : module.getVariableNames()) {
                contents.put(SassString.quoted(name), module.getVariable(name));
            }
            return new SassMap(contents);
        });
        r.module(MODULE, "module-functions", "$module", (ctx, args) -> {
            Module module = ctx.getModule(moduleName(args.get(0)));
            Map<SassValue, SassValue> contents = new LinkedHashMap<SassValue, SassValue>();
            for (String name : module.getFunctionNames()) {
                contents.put(SassString.quoted(name), new SassFunction(module.getFunction(name)));
            }
            return new SassMap(contents);
        });

        // ============ 函数引用 ============

        r.both(MODULE, "get-function", "$name, $css: false, $module: null", (ctx, args) -> {
            String name = name(args.get(0));
            String module = optionalModule(args.get(2));
            if (args.get(1).isTruthy()) {
                if (module != null) {
                    throw new SassRuntimeException("$css and $module may not both be passed at once.");
                }
                return new SassFunction(ctx.plainCssFunction(name));
            }
            SassCallable callable = ctx.lookupFunction(name, module);
            if (callable == null) {
                throw new SassRuntimeException("Function not found: " + name);
            }
            return new SassFunction(callable);
        });

        r.both(MODULE, "call", "$function, $args...", (ctx, args) -> {
            SassValue function = args.get(0);
            SassArgList rest = (SassArgList) args.get(1);
            SassCallable callable;
            if (function instanceof SassString) {
                String name = ((SassString) function).getText();
                ctx.warn("Passing a string to call() is deprecated and will be illegal in a future release.\n"
                        + "Recommendation: call(get-function(" + function.inspect() + "))", true);
                callable = ctx.lookupFunction(name, null);
                if (callable == null) {
                    callable = ctx.plainCssFunction(name);
                }
            } else {
                callable = function.assertFunction("function").getCallable();
            }
            List<SassValue> positional = new ArrayList<SassValue>(rest.asList());
            return ctx.callFunction(callable, positional, rest.getKeywords());
        });
    }

    private static String name(SassValue value) {
        return value.assertString("name").getText().replace('_', '-');
    }

    private static String moduleName(SassValue value) {
        return value.assertString("module").getText();
    }

    private static String optionalModule(SassValue value) {
        return value.isNull() ? null : moduleName(value);
    }
}
