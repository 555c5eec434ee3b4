package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.expr.Expression;

/**
 * 变量声明：{@code $name: value [!default] [!global];}
 */
public class VariableDecl extends Statement {
    private final String namespace;  // 可选：ns.$x: value
    private final String name;
    private final Expression expression;
    private final boolean guarded;   // !default
    private final boolean global;    // !global

    public VariableDecl(SourceLocation location, String namespace, String name, Expression expression,
                        boolean guarded, boolean global) {
        super(location);
        this.namespace = namespace;
        this.name = name;
        this.expression = expression;
        this.guarded = guarded;
        this.global = global;
    }

    public String getNamespace() {
        return namespace;
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

    public boolean isGlobal() {
        return global;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVariableDecl(this, context);
    }
}
