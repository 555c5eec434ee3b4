package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * {@code @each $a, $b in <list|map> { ... }}
 */
public class EachRule extends ParentStatement {
    private final List<String> variables;  // 支持解构
    private final Expression list;

    public EachRule(SourceLocation location, List<String> variables, Expression list, List<Statement> children) {
        super(location, children);
        this.variables = Collections.unmodifiableList(variables);
        this.list = list;
    }

    public List<String> getVariables() {
        return variables;
    }

    public Expression getList() {
        return list;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEachRule(this, context);
    }
}
