package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.Interpolation;
import com.scsslang.compiler.ast.SourceLocation;

/**
 * {@code @extend selector [!optional];}
 */
public class ExtendRule extends Statement {
    private final Interpolation selector;
    private final boolean optional;

    public ExtendRule(SourceLocation location, Interpolation selector, boolean optional) {
        super(location);
        this.selector = selector;
        this.optional = optional;
    }

    public Interpolation getSelector() {
        return selector;
    }

    public boolean isOptional() {
        return optional;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExtendRule(this, context);
    }
}
