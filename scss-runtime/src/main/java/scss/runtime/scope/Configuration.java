package scss.runtime.scope;

import com.scsslang.compiler.ast.SourceLocation;
import scss.runtime.value.SassValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code @use ... with (...)} / {@code @forward ... with (...)} 的模块配置
 *
 * <p>配置值只作用于模块根层带 {@code !default} 的变量声明；求值结束后仍未被使用的条目是错误。</p>
 */
public final class Configuration {

    /** 单个配置项 */
    public static final class Entry {
        private final SassValue value;
        private final SourceLocation span;
        private final boolean guarded;

        public Entry(SassValue value, SourceLocation span, boolean guarded) {
            this.value = value;
            this.span = span;
            this.guarded = guarded;
        }

        public SassValue getValue() {
            return value;
        }

        public SourceLocation getSpan() {
            return span;
        }

        /** {@code @forward ... with ($x: 1 !default)}：可被外层配置覆盖 */
        public boolean isGuarded() {
            return guarded;
        }
    }

    private static final Configuration EMPTY = new Configuration(Collections.<String, Entry>emptyMap(), true);

    private final Map<String, Entry> values;
    private final boolean implicit;

    private Configuration(Map<String, Entry> values, boolean implicit) {
        this.values = new LinkedHashMap<>();
        for (Map.Entry<String, Entry> entry : values.entrySet()) {
            this.values.put(Names.normalize(entry.getKey()), entry.getValue());
        }
        this.implicit = implicit;
    }

    public static Configuration empty() {
        return EMPTY;
    }

    /** 用户显式写出的配置 */
    public static Configuration explicit(Map<String, Entry> values) {
        return new Configuration(values, false);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** 没有显式 {@code with} 的配置（例如经由未配置的 @forward 传递） */
    public boolean isImplicit() {
        return implicit;
    }

    /** 取出并消费配置项 */
    public Entry remove(String name) {
        return values.remove(Names.normalize(name));
    }

    public Map<String, Entry> getValues() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * 经由 {@code @forward} 传递：去掉前缀，并与转发自身的 with 合并
     */
    public Configuration throughForward(String prefix, Map<String, Entry> forwardWith) {
        Map<String, Entry> result = new LinkedHashMap<>();
        if (forwardWith != null) {
            for (Map.Entry<String, Entry> entry : forwardWith.entrySet()) {
                result.put(Names.normalize(entry.getKey()), entry.getValue());
            }
        }
        String normalizedPrefix = prefix == null ? null : Names.normalize(prefix);
        for (Map.Entry<String, Entry> entry : values.entrySet()) {
            String name = entry.getKey();
            if (normalizedPrefix != null) {
                if (!name.startsWith(normalizedPrefix)) continue;
                name = name.substring(normalizedPrefix.length());
            }
            Entry existing = result.get(name);
            if (existing == null || existing.isGuarded()) {
                result.put(name, entry.getValue());
            }
        }
        return new Configuration(result, implicit && (forwardWith == null || forwardWith.isEmpty()));
    }
}
