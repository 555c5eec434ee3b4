package scss.runtime.css;

import com.scsslang.compiler.ast.SourceLocation;
import scss.runtime.selector.Extendable;
import scss.runtime.selector.SelectorList;

import java.util.List;

/**
 * 样式规则；选择器在冻结前可被扩展表改写
 */
public final class CssStyleRule extends CssParentNode implements Extendable {

    private SelectorList selector;
    private final List<String> mediaContext;

    public CssStyleRule(SelectorList selector, List<String> mediaContext, SourceLocation span) {
        super(span);
        this.selector = selector;
        this.mediaContext = mediaContext;
    }

    @Override
    public SelectorList getSelector() {
        return selector;
    }

    @Override
    public void setSelector(SelectorList selector) {
        checkMutable();
        this.selector = selector;
    }

    @Override
    public List<String> getMediaContext() {
        return mediaContext;
    }

    @Override
    public boolean isInvisible() {
        return selector.isEmpty() || super.isInvisible();
    }

    @Override
    public <R> R accept(CssVisitor<R> visitor) {
        return visitor.visitStyleRule(this);
    }
}
