package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 带子语句块的语句基类。children 为 null 表示无块（如 {@code @import}），空列表表示空块。
 */
public abstract class ParentStatement extends Statement {
    protected final List<Statement> children;

    protected ParentStatement(SourceLocation location, List<Statement> children) {
        super(location);
        this.children = children != null ? Collections.unmodifiableList(children) : null;
    }

    public List<Statement> getChildren() {
        return children != null ? children : Collections.<Statement>emptyList();
    }

    public boolean hasBlock() {
        return children != null;
    }

    /** 块中是否直接包含变量、mixin 或函数声明（决定是否需要新作用域帧） */
    public boolean hasDeclarations() {
        if (children == null) return false;
        for (Statement child : children) {
            if (child instanceof VariableDecl || child instanceof MixinRule || child instanceof FunctionRule) {
                return true;
            }
        }
        return false;
    }
}
