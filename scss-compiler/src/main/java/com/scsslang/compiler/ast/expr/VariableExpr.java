package com.scsslang.compiler.ast.expr;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;

/**
 * 变量引用：{@code $name} 或 {@code ns.$name}
 */
public class VariableExpr extends Expression {
    private final String namespace;  // 可选
    private final String name;

    public VariableExpr(SourceLocation location, String namespace, String name) {
        super(location);
        this.namespace = namespace;
        this.name = name;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVariableExpr(this, context);
    }

    @Override
    public String toString() {
        return namespace == null ? "$" + name : namespace + ".$" + name;
    }
}
