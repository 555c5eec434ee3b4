package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.expr.Expression;

/**
 * {@code @debug expression;}
 */
public class DebugRule extends Statement {
    private final Expression expression;

    public DebugRule(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDebugRule(this, context);
    }
}
