package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.decl.ArgumentDeclaration;

import java.util.List;

/**
 * {@code @mixin} 与 {@code @function} 的公共基类
 */
public abstract class CallableDeclaration extends ParentStatement {
    protected final String name;
    protected final ArgumentDeclaration arguments;

    protected CallableDeclaration(SourceLocation location, String name, ArgumentDeclaration arguments,
                                  List<Statement> children) {
        super(location, children);
        this.name = name;
        this.arguments = arguments != null ? arguments : ArgumentDeclaration.EMPTY;
    }

    public String getName() {
        return name;
    }

    public ArgumentDeclaration getArguments() {
        return arguments;
    }
}
