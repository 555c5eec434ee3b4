package com.scsslang.compiler.ast.expr;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;
    /** 两侧均为数值字面量且未加括号：{@code /} 保留为斜杠分隔 */
    private final boolean allowsSlash;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        this(location, left, operator, right, false);
    }

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right,
                      boolean allowsSlash) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
        this.allowsSlash = allowsSlash;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    public boolean allowsSlash() {
        return allowsSlash;
    }

    /** 返回清除斜杠标记后的副本（被括号包裹或参与其他运算时） */
    public BinaryExpr withoutSlash() {
        if (!allowsSlash) return this;
        return new BinaryExpr(location, left, operator, right, false);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    @Override
    public String toString() {
        return left + " " + operator.toSourceString() + " " + right;
    }

    /**
     * 二元运算符（按优先级从低到高排列）
     */
    public enum BinaryOp {
        OR("or", 0),
        AND("and", 1),
        EQ("==", 2),
        NE("!=", 2),
        LT("<", 3),
        LE("<=", 3),
        GT(">", 3),
        GE(">=", 3),
        ADD("+", 4),
        SUB("-", 4),
        MUL("*", 5),
        DIV("/", 5),
        MOD("%", 5);

        private final String source;
        private final int precedence;

        BinaryOp(String source, int precedence) {
            this.source = source;
            this.precedence = precedence;
        }

        /** 返回 SCSS 源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public int getPrecedence() {
            return precedence;
        }
    }
}
