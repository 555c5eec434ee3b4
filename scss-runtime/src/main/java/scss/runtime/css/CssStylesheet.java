package scss.runtime.css;

import com.scsslang.compiler.ast.SourceLocation;

public final class CssStylesheet extends CssParentNode {

    public CssStylesheet(SourceLocation span) {
        super(span);
    }

    @Override
    public <R> R accept(CssVisitor<R> visitor) {
        return visitor.visitStylesheet(this);
    }
}
