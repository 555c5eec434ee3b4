package scss.runtime.css;

import com.scsslang.compiler.ast.SourceLocation;

/**
 * 可见注释，text 含 {@code /* *\/} 定界符
 */
public final class CssComment extends CssNode {

    private final String text;

    public CssComment(String text, SourceLocation span) {
        super(span);
        this.text = text;
    }

    public String getText() {
        return text;
    }

    /** {@code /*!} 注释在压缩模式下保留 */
    public boolean isPreserved() {
        return text.startsWith("/*!");
    }

    @Override
    public boolean isInvisible() {
        return false;
    }

    @Override
    public <R> R accept(CssVisitor<R> visitor) {
        return visitor.visitComment(this);
    }
}
