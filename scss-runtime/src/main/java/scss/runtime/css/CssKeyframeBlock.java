package scss.runtime.css;

import com.scsslang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * keyframes 内的块（{@code from}、{@code 50%}），选择器不参与嵌套与扩展
 */
public final class CssKeyframeBlock extends CssParentNode {

    private final List<String> selectors;

    public CssKeyframeBlock(List<String> selectors, SourceLocation span) {
        super(span);
        this.selectors = Collections.unmodifiableList(new ArrayList<>(selectors));
    }

    public List<String> getSelectors() {
        return selectors;
    }

    @Override
    public <R> R accept(CssVisitor<R> visitor) {
        return visitor.visitKeyframeBlock(this);
    }
}
