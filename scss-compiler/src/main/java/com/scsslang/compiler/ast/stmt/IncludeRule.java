package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.decl.ArgumentDeclaration;
import com.scsslang.compiler.ast.decl.ArgumentInvocation;

import java.util.Collections;
import java.util.List;

/**
 * {@code @include [ns.]name(args) [using ($x)] { content }}
 */
public class IncludeRule extends Statement {
    private final String namespace;  // 可选
    private final String name;
    private final ArgumentInvocation arguments;
    private final ContentBlock content;  // 可选

    public IncludeRule(SourceLocation location, String namespace, String name, ArgumentInvocation arguments,
                       ContentBlock content) {
        super(location);
        this.namespace = namespace;
        this.name = name;
        this.arguments = arguments != null ? arguments : ArgumentInvocation.EMPTY;
        this.content = content;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    public ArgumentInvocation getArguments() {
        return arguments;
    }

    public ContentBlock getContent() {
        return content;
    }

    public boolean hasContent() {
        return content != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIncludeRule(this, context);
    }

    /**
     * 传递给 mixin 的内容块，可声明 {@code using ($args)} 形参
     */
    public static final class ContentBlock {
        private final SourceLocation location;
        private final ArgumentDeclaration parameters;
        private final List<Statement> children;

        public ContentBlock(SourceLocation location, ArgumentDeclaration parameters, List<Statement> children) {
            this.location = location;
            this.parameters = parameters != null ? parameters : ArgumentDeclaration.EMPTY;
            this.children = Collections.unmodifiableList(children);
        }

        public SourceLocation getLocation() {
            return location;
        }

        public ArgumentDeclaration getParameters() {
            return parameters;
        }

        public List<Statement> getChildren() {
            return children;
        }
    }
}
