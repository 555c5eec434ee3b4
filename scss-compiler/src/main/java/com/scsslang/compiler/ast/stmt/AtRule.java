package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.Interpolation;
import com.scsslang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 其他 at-rule（{@code @supports}、{@code @font-face}、{@code @keyframes}、未知规则），原样输出
 */
public class AtRule extends ParentStatement {
    private final Interpolation name;
    private final Interpolation value;  // 可选

    public AtRule(SourceLocation location, Interpolation name, Interpolation value, List<Statement> children) {
        super(location, children);
        this.name = name;
        this.value = value;
    }

    public Interpolation getName() {
        return name;
    }

    public Interpolation getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAtRule(this, context);
    }
}
