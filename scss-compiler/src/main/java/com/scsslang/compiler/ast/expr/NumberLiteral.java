package com.scsslang.compiler.ast.expr;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;

/**
 * 数值字面量，如 {@code 10px}、{@code 1.5}、{@code 50%}
 */
public class NumberLiteral extends Expression {
    private final double value;
    private final String unit;  // 可为 null（无单位）

    public NumberLiteral(SourceLocation location, double value, String unit) {
        super(location);
        this.value = value;
        this.unit = unit;
    }

    public double getValue() {
        return value;
    }

    public String getUnit() {
        return unit;
    }

    public boolean hasUnit() {
        return unit != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNumberLiteral(this, context);
    }

    @Override
    public String toString() {
        return unit == null ? String.valueOf(value) : value + unit;
    }
}
