package com.scsslang.compiler.ast.expr;

import com.scsslang.compiler.ast.AstNode;
import com.scsslang.compiler.ast.SourceLocation;

/**
 * SassScript 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
