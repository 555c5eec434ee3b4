package scss.runtime.builtin;

import com.scsslang.compiler.ast.decl.ArgumentDeclaration;
import com.scsslang.compiler.ast.decl.Parameter;
import scss.runtime.ArityException;
import scss.runtime.scope.Names;
import scss.runtime.value.ListSeparator;
import scss.runtime.value.SassArgList;
import scss.runtime.value.SassValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 实参到形参的绑定，内建函数、用户函数与 mixin 共用
 */
public final class ArgumentBinder {

    /**
     * 绑定目标
     */
    public interface Sink {
        /** 依形参顺序逐个回调；可变参数最后回调 */
        void bind(String name, SassValue value);

        /** 求缺省值，此前的形参已经 bind */
        SassValue evaluateDefault(Parameter parameter);
    }

    /** 只收集值、不声明变量的绑定目标 */
    public interface DefaultEvaluator {
        SassValue evaluateDefault(Parameter parameter);
    }

    private ArgumentBinder() {}

    /**
     * 绑定实参
     *
     * @param named 键为规范化名称（不带 {@code $}）
     * @param restSeparator 可变参数列表的分隔符（展开 {@code $list...} 时沿用其分隔符）
     * @return 按形参顺序的值；有可变参数时末尾追加 arglist
     * @throws ArityException 缺少参数、参数过多或命名参数未知
     */
    public static List<SassValue> bind(ArgumentDeclaration declaration, List<SassValue> positional,
                                       Map<String, SassValue> named, ListSeparator restSeparator, Sink sink) {
        verify(declaration, positional.size(), named.keySet());
        List<Parameter> parameters = declaration.getParameters();
        Map<String, SassValue> remaining = new LinkedHashMap<String, SassValue>(named);
        List<SassValue> result = new ArrayList<SassValue>(parameters.size() + 1);
        for (int i = 0; i < parameters.size(); i++) {
            Parameter parameter = parameters.get(i);
            String key = Names.normalize(parameter.getName());
            SassValue value;
            if (i < positional.size()) {
                value = positional.get(i);
            } else if (remaining.containsKey(key)) {
                value = remaining.remove(key);
            } else {
                value = sink.evaluateDefault(parameter);
            }
            sink.bind(parameter.getName(), value);
            result.add(value);
        }
        if (declaration.hasRest()) {
            List<SassValue> extra = positional.size() > parameters.size()
                    ? positional.subList(parameters.size(), positional.size())
                    : new ArrayList<SassValue>();
            ListSeparator separator = restSeparator == null || restSeparator == ListSeparator.UNDECIDED
                    ? ListSeparator.COMMA : restSeparator;
            SassArgList rest = new SassArgList(extra, remaining, separator);
            sink.bind(declaration.getRestParameter(), rest);
            result.add(rest);
        }
        return result;
    }

    /** 不声明变量的绑定 */
    public static List<SassValue> bind(ArgumentDeclaration declaration, List<SassValue> positional,
                                       Map<String, SassValue> named, ListSeparator restSeparator,
                                       final DefaultEvaluator defaults) {
        return bind(declaration, positional, named, restSeparator, new Sink() {
            @Override
            public void bind(String name, SassValue value) {
            }

            @Override
            public SassValue evaluateDefault(Parameter parameter) {
                return defaults.evaluateDefault(parameter);
            }
        });
    }

    /**
     * 校验实参个数与命名参数
     *
     * @throws ArityException 不匹配时
     */
    public static void verify(ArgumentDeclaration declaration, int positional, Set<String> named) {
        List<Parameter> parameters = declaration.getParameters();
        int namedUsed = 0;
        for (int i = 0; i < parameters.size(); i++) {
            Parameter parameter = parameters.get(i);
            String key = Names.normalize(parameter.getName());
            if (i < positional) {
                if (named.contains(key)) {
                    throw new ArityException("Argument $" + parameter.getName()
                            + " was passed both by position and by name.");
                }
            } else if (named.contains(key)) {
                namedUsed++;
            } else if (!parameter.hasDefault()) {
                throw new ArityException("Missing argument $" + parameter.getName() + ".");
            }
        }
        if (declaration.hasRest()) {
            return;
        }
        if (positional > parameters.size()) {
            throw new ArityException("Only " + parameters.size() + " "
                    + (parameters.size() == 1 ? "argument" : "arguments") + " allowed, but " + positional + " "
                    + (positional == 1 ? "was" : "were") + " passed.");
        }
        if (namedUsed < named.size()) {
            Set<String> unknown = new LinkedHashSet<String>(named);
            for (Parameter parameter : parameters) {
                unknown.remove(Names.normalize(parameter.getName()));
            }
            throw unknownNames(unknown);
        }
    }

    /** 与 {@link #verify} 同样的规则，只返回是否匹配 */
    public static boolean matches(ArgumentDeclaration declaration, int positional, Set<String> named) {
        List<Parameter> parameters = declaration.getParameters();
        int namedUsed = 0;
        for (int i = 0; i < parameters.size(); i++) {
            Parameter parameter = parameters.get(i);
            String key = Names.normalize(parameter.getName());
            if (i < positional) {
                if (named.contains(key)) return false;
            } else if (named.contains(key)) {
                namedUsed++;
            } else if (!parameter.hasDefault()) {
                return false;
            }
        }
        if (declaration.hasRest()) return true;
        return positional <= parameters.size() && namedUsed >= named.size();
    }

    /**
     * 调用结束后检查 arglist 中未被读取的关键字
     */
    public static void checkKeywordsUsed(List<SassValue> boundArgs) {
        if (boundArgs.isEmpty()) return;
        SassValue last = boundArgs.get(boundArgs.size() - 1);
        if (!(last instanceof SassArgList)) return;
        SassArgList rest = (SassArgList) last;
        if (!rest.wereKeywordsAccessed() && !rest.peekKeywords().isEmpty()) {
            throw unknownNames(rest.peekKeywords().keySet());
        }
    }

    static ArityException unknownNames(Collection<String> names) {
        List<String> prefixed = new ArrayList<String>();
        for (String name : names) {
            prefixed.add("$" + name);
        }
        return new ArityException("No " + (prefixed.size() == 1 ? "argument" : "arguments") + " named "
                + toSentence(prefixed, "or") + ".");
    }

    /** {@code a, b or c} */
    static String toSentence(List<String> items, String conjunction) {
        if (items.size() == 1) return items.get(0);
        StringBuilder sb = new StringBuilder();
        Iterator<String> it = items.iterator();
        for (int i = 0; i < items.size() - 1; i++) {
            if (i > 0) sb.append(", ");
            sb.append(it.next());
        }
        return sb.append(' ').append(conjunction).append(' ').append(it.next()).toString();
    }
}
