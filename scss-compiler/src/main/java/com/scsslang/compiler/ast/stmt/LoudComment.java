package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.Interpolation;
import com.scsslang.compiler.ast.SourceLocation;

/**
 * 保留到输出的注释 {@code /* ... *}{@code /}，文本含定界符，可含插值
 */
public class LoudComment extends Statement {
    private final Interpolation text;

    public LoudComment(SourceLocation location, Interpolation text) {
        super(location);
        this.text = text;
    }

    public Interpolation getText() {
        return text;
    }

    /** {@code /*!} 开头的注释在压缩模式下也保留 */
    public boolean isPreserved() {
        return text.getInitialPlain().startsWith("/*!");
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLoudComment(this, context);
    }
}
