package com.scsslang.compiler.ast.expr;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.Interpolation;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.decl.ArgumentInvocation;

/**
 * 名称含插值的函数调用，如 {@code foo-#{$x}(1)}，总是作为普通 CSS 函数输出
 */
public class InterpolatedFunctionExpr extends Expression {
    private final Interpolation name;
    private final ArgumentInvocation arguments;

    public InterpolatedFunctionExpr(SourceLocation location, Interpolation name, ArgumentInvocation arguments) {
        super(location);
        this.name = name;
        this.arguments = arguments;
    }

    public Interpolation getName() {
        return name;
    }

    public ArgumentInvocation getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitInterpolatedFunctionExpr(this, context);
    }
}
