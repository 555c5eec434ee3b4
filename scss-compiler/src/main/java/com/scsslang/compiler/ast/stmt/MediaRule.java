package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.Interpolation;
import com.scsslang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * {@code @media query { ... }}，嵌套时向外冒泡并与外层查询合并
 */
public class MediaRule extends ParentStatement {
    private final Interpolation query;

    public MediaRule(SourceLocation location, Interpolation query, List<Statement> children) {
        super(location, children);
        this.query = query;
    }

    public Interpolation getQuery() {
        return query;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMediaRule(this, context);
    }
}
