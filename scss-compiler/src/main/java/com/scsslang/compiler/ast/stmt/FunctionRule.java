package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.decl.ArgumentDeclaration;

import java.util.List;

/**
 * {@code @function name($args) { ... @return value; }}
 */
public class FunctionRule extends CallableDeclaration {

    public FunctionRule(SourceLocation location, String name, ArgumentDeclaration arguments,
                        List<Statement> children) {
        super(location, name, arguments, children);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionRule(this, context);
    }
}
