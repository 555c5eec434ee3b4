package scss.runtime.css;

import com.scsslang.compiler.ast.SourceLocation;

/**
 * 纯 CSS {@code @import}，url 为原样文本（含引号或 {@code url()}），modifiers 为其后的媒体查询等
 */
public final class CssImport extends CssNode {

    private final String url;
    private final String modifiers;

    public CssImport(String url, String modifiers, SourceLocation span) {
        super(span);
        this.url = url;
        this.modifiers = modifiers;
    }

    public String getUrl() {
        return url;
    }

    public String getModifiers() {
        return modifiers;
    }

    @Override
    public boolean isInvisible() {
        return false;
    }

    @Override
    public <R> R accept(CssVisitor<R> visitor) {
        return visitor.visitImport(this);
    }
}
