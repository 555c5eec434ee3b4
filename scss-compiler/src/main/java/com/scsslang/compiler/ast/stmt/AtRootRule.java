package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.Interpolation;
import com.scsslang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * {@code @at-root [selector] { ... }} 或 {@code @at-root (without: media) { ... }}
 */
public class AtRootRule extends ParentStatement {
    private final Interpolation query;  // 可选：(with: ...) / (without: ...)

    public AtRootRule(SourceLocation location, Interpolation query, List<Statement> children) {
        super(location, children);
        this.query = query;
    }

    public Interpolation getQuery() {
        return query;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAtRootRule(this, context);
    }
}
