package com.scsslang.compiler.ast.expr;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 列表表达式：逗号或空格分隔，可带方括号
 */
public class ListExpr extends Expression {
    private final List<Expression> elements;
    private final Separator separator;
    private final boolean bracketed;

    public ListExpr(SourceLocation location, List<Expression> elements, Separator separator, boolean bracketed) {
        super(location);
        this.elements = Collections.unmodifiableList(elements);
        this.separator = separator;
        this.bracketed = bracketed;
    }

    public List<Expression> getElements() {
        return elements;
    }

    public Separator getSeparator() {
        return separator;
    }

    public boolean isBracketed() {
        return bracketed;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitListExpr(this, context);
    }

    /**
     * 列表分隔符
     */
    public enum Separator {
        COMMA,
        SPACE,
        SLASH,
        UNDECIDED
    }
}
