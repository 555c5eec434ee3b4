package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * {@code @for $i from A through|to B { ... }}
 */
public class ForRule extends ParentStatement {
    private final String variable;
    private final Expression from;
    private final Expression to;
    private final boolean exclusive;  // to = 不含终点，through = 含终点

    public ForRule(SourceLocation location, String variable, Expression from, Expression to, boolean exclusive,
                   List<Statement> children) {
        super(location, children);
        this.variable = variable;
        this.from = from;
        this.to = to;
        this.exclusive = exclusive;
    }

    public String getVariable() {
        return variable;
    }

    public Expression getFrom() {
        return from;
    }

    public Expression getTo() {
        return to;
    }

    public boolean isExclusive() {
        return exclusive;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForRule(this, context);
    }
}
