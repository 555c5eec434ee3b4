package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.decl.ArgumentInvocation;

/**
 * mixin 体内的 {@code @content[(args)]}
 */
public class ContentRule extends Statement {
    private final ArgumentInvocation arguments;

    public ContentRule(SourceLocation location, ArgumentInvocation arguments) {
        super(location);
        this.arguments = arguments != null ? arguments : ArgumentInvocation.EMPTY;
    }

    public ArgumentInvocation getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitContentRule(this, context);
    }
}
