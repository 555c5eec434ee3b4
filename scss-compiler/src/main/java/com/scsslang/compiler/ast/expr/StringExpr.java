package com.scsslang.compiler.ast.expr;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.Interpolation;
import com.scsslang.compiler.ast.SourceLocation;

/**
 * 字符串表达式（带引号或不带引号的标识符），内容可含插值
 */
public class StringExpr extends Expression {
    private final Interpolation text;
    private final boolean quoted;

    public StringExpr(SourceLocation location, Interpolation text, boolean quoted) {
        super(location);
        this.text = text;
        this.quoted = quoted;
    }

    public Interpolation getText() {
        return text;
    }

    public boolean isQuoted() {
        return quoted;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStringExpr(this, context);
    }

    @Override
    public String toString() {
        return quoted ? "\"" + text + "\"" : text.toString();
    }
}
