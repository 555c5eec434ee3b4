package scss.runtime.interpreter;

import scss.runtime.SassRuntimeException;
import scss.runtime.css.CssAtRule;
import scss.runtime.css.CssMediaRule;
import scss.runtime.css.CssNode;
import scss.runtime.css.CssStyleRule;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * {@code @at-root (with: ...)} / {@code (without: ...)} 查询
 *
 * <p>名称 {@code rule} 指样式规则，{@code all} 指全部外层节点，其余按 at-rule 名称匹配。
 * 不写查询时等价于 {@code (without: rule)}。</p>
 */
final class AtRootQuery {

    static final AtRootQuery DEFAULT = new AtRootQuery(false, Collections.singleton("rule"));

    private final boolean include;
    private final Set<String> names;
    private final boolean all;
    private final boolean rule;

    private AtRootQuery(boolean include, Set<String> names) {
        this.include = include;
        this.names = names;
        this.all = names.contains("all");
        this.rule = names.contains("rule");
    }

    static AtRootQuery parse(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("(") || !trimmed.endsWith(")")) {
            throw new SassRuntimeException("Expected \"(\".");
        }
        String body = trimmed.substring(1, trimmed.length() - 1).trim();
        int colon = body.indexOf(':');
        if (colon < 0) throw new SassRuntimeException("Expected \":\".");
        String keyword = body.substring(0, colon).trim().toLowerCase(Locale.ROOT);
        boolean include;
        if (keyword.equals("with")) {
            include = true;
        } else if (keyword.equals("without")) {
            include = false;
        } else {
            throw new SassRuntimeException("Expected \"with\" or \"without\".");
        }
        String list = body.substring(colon + 1).trim();
        if (list.isEmpty()) throw new SassRuntimeException("Expected identifier.");
        Set<String> names = new HashSet<>(Arrays.asList(list.toLowerCase(Locale.ROOT).split("\\s+")));
        return new AtRootQuery(include, names);
    }

    boolean excludesName(String name) {
        return (all || names.contains(name)) != include;
    }

    boolean excludesStyleRules() {
        return (all || rule) != include;
    }

    boolean excludes(CssNode node) {
        if (node instanceof CssStyleRule) return excludesStyleRules();
        if (node instanceof CssMediaRule) return excludesName("media");
        if (node instanceof CssAtRule) return excludesName(((CssAtRule) node).getName().toLowerCase(Locale.ROOT));
        return false;
    }
}
