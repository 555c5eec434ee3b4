package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.Interpolation;
import com.scsslang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 样式规则：{@code selector { ... }}
 */
public class StyleRule extends ParentStatement {
    private final Interpolation selector;

    public StyleRule(SourceLocation location, Interpolation selector, List<Statement> children) {
        super(location, children);
        this.selector = selector;
    }

    public Interpolation getSelector() {
        return selector;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStyleRule(this, context);
    }
}
