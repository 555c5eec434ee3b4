package scss.runtime.css;

import com.scsslang.compiler.ast.SourceLocation;
import scss.runtime.value.SassValue;

/**
 * 属性声明
 *
 * <p>普通声明保存求值后的值；自定义属性（{@code --x}）保存插值求值后的原样文本。</p>
 */
public final class CssDeclaration extends CssNode {

    private final String name;
    private final SassValue value;
    private final String customValue;
    private final boolean important;
    private final SourceLocation valueSpan;

    public CssDeclaration(String name, SassValue value, boolean important,
                          SourceLocation span, SourceLocation valueSpan) {
        super(span);
        this.name = name;
        this.value = value;
        this.customValue = null;
        this.important = important;
        this.valueSpan = valueSpan;
    }

    /** 自定义属性 */
    public CssDeclaration(String name, String customValue, SourceLocation span) {
        super(span);
        this.name = name;
        this.value = null;
        this.customValue = customValue;
        this.important = false;
        this.valueSpan = span;
    }

    public String getName() {
        return name;
    }

    public SassValue getValue() {
        return value;
    }

    public String getCustomValue() {
        return customValue;
    }

    public boolean isCustomProperty() {
        return customValue != null;
    }

    public boolean isImportant() {
        return important;
    }

    public SourceLocation getValueSpan() {
        return valueSpan;
    }

    @Override
    public boolean isInvisible() {
        return false;
    }

    @Override
    public <R> R accept(CssVisitor<R> visitor) {
        return visitor.visitDeclaration(this);
    }
}
