package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstNode;
import com.scsslang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
