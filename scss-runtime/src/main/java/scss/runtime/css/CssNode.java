package scss.runtime.css;

import com.scsslang.compiler.ast.SourceLocation;

/**
 * CSS 输出树节点
 *
 * <p>由求值器构建；序列化前调用 {@link #freeze()}，之后任何修改都抛出 {@link IllegalStateException}。</p>
 */
public abstract class CssNode {

    protected final SourceLocation span;
    private CssParentNode parent;
    private boolean frozen;

    protected CssNode(SourceLocation span) {
        this.span = span != null ? span : SourceLocation.UNKNOWN;
    }

    public SourceLocation getSpan() {
        return span;
    }

    public CssParentNode getParent() {
        return parent;
    }

    void setParent(CssParentNode parent) {
        checkMutable();
        this.parent = parent;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /** 冻结本节点及全部子孙 */
    public void freeze() {
        frozen = true;
    }

    protected void checkMutable() {
        if (frozen) {
            throw new IllegalStateException(getClass().getSimpleName() + " is frozen");
        }
    }

    /** 序列化时是否不产生任何输出 */
    public abstract boolean isInvisible();

    public abstract <R> R accept(CssVisitor<R> visitor);
}
