package com.scsslang.compiler.ast.expr;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;

/**
 * 布尔字面量
 */
public class BooleanLiteral extends Expression {
    private final boolean value;

    public BooleanLiteral(SourceLocation location, boolean value) {
        super(location);
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBooleanLiteral(this, context);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
