package com.scsslang.compiler.ast.expr;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.decl.ArgumentInvocation;

/**
 * 函数调用：{@code name(args)} 或 {@code ns.name(args)}
 *
 * <p>名称未解析到 Sass 函数时按普通 CSS 函数原样输出。</p>
 */
public class FunctionCallExpr extends Expression {
    private final String namespace;  // 可选
    private final String name;
    private final ArgumentInvocation arguments;

    public FunctionCallExpr(SourceLocation location, String namespace, String name, ArgumentInvocation arguments) {
        super(location);
        this.namespace = namespace;
        this.name = name;
        this.arguments = arguments;
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

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionCallExpr(this, context);
    }

    @Override
    public String toString() {
        return (namespace == null ? "" : namespace + ".") + name + "(" + arguments + ")";
    }
}
