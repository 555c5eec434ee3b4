package com.scsslang.compiler.ast.expr;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;

/**
 * 颜色字面量：十六进制（{@code #abc}）或命名颜色（{@code red}）
 *
 * <p>保留原始文本，输出时按原样回写。</p>
 */
public class ColorLiteral extends Expression {
    private final int red;
    private final int green;
    private final int blue;
    private final double alpha;
    private final String originalText;

    public ColorLiteral(SourceLocation location, int red, int green, int blue, double alpha, String originalText) {
        super(location);
        this.red = red;
        this.green = green;
        this.blue = blue;
        this.alpha = alpha;
        this.originalText = originalText;
    }

    public int getRed() {
        return red;
    }

    public int getGreen() {
        return green;
    }

    public int getBlue() {
        return blue;
    }

    public double getAlpha() {
        return alpha;
    }

    public String getOriginalText() {
        return originalText;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitColorLiteral(this, context);
    }

    @Override
    public String toString() {
        return originalText;
    }
}
