package com.scsslang.compiler.ast.decl;

import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.expr.Expression;

/**
 * mixin / function 形参
 */
public final class Parameter {
    private final SourceLocation location;
    private final String name;
    private final Expression defaultValue;  // 可选

    public Parameter(SourceLocation location, String name, Expression defaultValue) {
        this.location = location;
        this.name = name;
        this.defaultValue = defaultValue;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    @Override
    public String toString() {
        return defaultValue == null ? "$" + name : "$" + name + ": " + defaultValue;
    }
}
