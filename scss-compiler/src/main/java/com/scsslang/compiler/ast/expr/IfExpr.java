package com.scsslang.compiler.ast.expr;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.decl.ArgumentInvocation;

/**
 * 内置 {@code if($condition, $if-true, $if-false)}：只求值被选中的分支
 */
public class IfExpr extends Expression {
    private final ArgumentInvocation arguments;

    public IfExpr(SourceLocation location, ArgumentInvocation arguments) {
        super(location);
        this.arguments = arguments;
    }

    public ArgumentInvocation getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfExpr(this, context);
    }

    @Override
    public String toString() {
        return "if(" + arguments + ")";
    }
}
