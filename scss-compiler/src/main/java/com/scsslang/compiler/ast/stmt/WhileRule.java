package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * {@code @while condition { ... }}
 */
public class WhileRule extends ParentStatement {
    private final Expression condition;

    public WhileRule(SourceLocation location, Expression condition, List<Statement> children) {
        super(location, children);
        this.condition = condition;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhileRule(this, context);
    }
}
