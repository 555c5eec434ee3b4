package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.decl.ArgumentDeclaration;

import java.util.List;

/**
 * {@code @mixin name($args) { ... }}
 */
public class MixinRule extends CallableDeclaration {
    private final boolean hasContent;

    public MixinRule(SourceLocation location, String name, ArgumentDeclaration arguments,
                     List<Statement> children, boolean hasContent) {
        super(location, name, arguments, children);
        this.hasContent = hasContent;
    }

    /** 函数体内（直接或嵌套）出现 {@code @content} */
    public boolean hasContent() {
        return hasContent;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMixinRule(this, context);
    }
}
