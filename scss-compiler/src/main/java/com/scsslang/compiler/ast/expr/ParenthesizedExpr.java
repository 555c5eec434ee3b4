package com.scsslang.compiler.ast.expr;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;

/**
 * 括号表达式
 */
public class ParenthesizedExpr extends Expression {
    private final Expression inner;

    public ParenthesizedExpr(SourceLocation location, Expression inner) {
        super(location);
        this.inner = inner;
    }

    public Expression getInner() {
        return inner;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParenthesizedExpr(this, context);
    }

    @Override
    public String toString() {
        return "(" + inner + ")";
    }
}
