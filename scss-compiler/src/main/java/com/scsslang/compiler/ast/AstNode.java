package com.scsslang.compiler.ast;

/**
 * AST 节点基类
 *
 * <p>AST 由前端构建后只读，求值器不会修改任何节点。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
