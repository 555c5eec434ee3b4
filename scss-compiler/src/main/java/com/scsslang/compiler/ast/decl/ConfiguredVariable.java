package com.scsslang.compiler.ast.decl;

import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.expr.Expression;

/**
 * {@code @use ... with ($name: value)} / {@code @forward ... with (...)} 中的配置项
 */
public final class ConfiguredVariable {
    private final SourceLocation location;
    private final String name;
    private final Expression expression;
    private final boolean guarded;  // !default（仅 @forward 允许）

    public ConfiguredVariable(SourceLocation location, String name, Expression expression, boolean guarded) {
        this.location = location;
        this.name = name;
        this.expression = expression;
        this.guarded = guarded;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public Expression getExpression() {
        return expression;
    }

    public boolean isGuarded() {
        return guarded;
    }
}
