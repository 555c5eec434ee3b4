package scss.runtime.css;

import com.scsslang.compiler.ast.SourceLocation;

import java.util.Locale;

/**
 * 通用 at 规则（{@code @supports}、{@code @keyframes}、{@code @font-face}、未知规则等）
 */
public final class CssAtRule extends CssParentNode {

    private final String name;
    private final String params;
    private final boolean childless;

    public CssAtRule(String name, String params, boolean childless, SourceLocation span) {
        super(span);
        this.name = name;
        this.params = params;
        this.childless = childless;
    }

    public String getName() {
        return name;
    }

    /** 规则参数，可为 null */
    public String getParams() {
        return params;
    }

    /** 无块的规则（{@code @foo bar;}），始终输出 */
    public boolean isChildless() {
        return childless;
    }

    /** 是否为 keyframes 规则（含浏览器前缀） */
    public boolean isKeyframes() {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.equals("keyframes") || lower.startsWith("-") && lower.endsWith("-keyframes");
    }

    @Override
    public boolean isInvisible() {
        return !childless && super.isInvisible();
    }

    @Override
    public <R> R accept(CssVisitor<R> visitor) {
        return visitor.visitAtRule(this);
    }
}
