package com.scsslang.compiler.ast.expr;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;

/**
 * SassScript 中的 {@code &}：当前父选择器
 */
public class ParentSelectorExpr extends Expression {

    public ParentSelectorExpr(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParentSelectorExpr(this, context);
    }

    @Override
    public String toString() {
        return "&";
    }
}
