package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * {@code @if / @else if / @else}
 */
public class IfRule extends Statement {
    private final List<IfClause> clauses;
    private final List<Statement> elseChildren;  // 可选

    public IfRule(SourceLocation location, List<IfClause> clauses, List<Statement> elseChildren) {
        super(location);
        this.clauses = Collections.unmodifiableList(clauses);
        this.elseChildren = elseChildren != null ? Collections.unmodifiableList(elseChildren) : null;
    }

    public List<IfClause> getClauses() {
        return clauses;
    }

    public List<Statement> getElseChildren() {
        return elseChildren;
    }

    public boolean hasElse() {
        return elseChildren != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfRule(this, context);
    }

    /**
     * 条件分支
     */
    public static final class IfClause {
        private final Expression condition;
        private final List<Statement> children;

        public IfClause(Expression condition, List<Statement> children) {
            this.condition = condition;
            this.children = Collections.unmodifiableList(children);
        }

        public Expression getCondition() {
            return condition;
        }

        public List<Statement> getChildren() {
            return children;
        }
    }
}
