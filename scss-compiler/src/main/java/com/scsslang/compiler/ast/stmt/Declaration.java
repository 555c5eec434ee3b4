package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.Interpolation;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 属性声明：{@code name: value;}，可带嵌套属性块 {@code font: 12px { family: x; }}
 *
 * <p>自定义属性（{@code --x}）的值按插值文本保存，不作为 SassScript 求值。</p>
 */
public class Declaration extends ParentStatement {
    private final Interpolation name;
    private final Expression value;                 // 可选（仅有嵌套块时为 null）
    private final Interpolation customPropertyValue; // 仅自定义属性
    private final boolean important;

    public Declaration(SourceLocation location, Interpolation name, Expression value, boolean important,
                       List<Statement> children) {
        super(location, children);
        this.name = name;
        this.value = value;
        this.customPropertyValue = null;
        this.important = important;
    }

    public Declaration(SourceLocation location, Interpolation name, Interpolation customPropertyValue) {
        super(location, null);
        this.name = name;
        this.value = null;
        this.customPropertyValue = customPropertyValue;
        this.important = false;
    }

    public Interpolation getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    public Interpolation getCustomPropertyValue() {
        return customPropertyValue;
    }

    public boolean isCustomProperty() {
        return customPropertyValue != null;
    }

    public boolean isImportant() {
        return important;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDeclaration(this, context);
    }
}
