package com.scsslang.compiler.ast.expr;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * Map 字面量：{@code (key: value, ...)}，保持书写顺序
 */
public class MapExpr extends Expression {
    private final List<Expression> keys;
    private final List<Expression> values;

    public MapExpr(SourceLocation location, List<Expression> keys, List<Expression> values) {
        super(location);
        if (keys.size() != values.size()) {
            throw new IllegalArgumentException("keys/values size mismatch");
        }
        this.keys = Collections.unmodifiableList(keys);
        this.values = Collections.unmodifiableList(values);
    }

    public List<Expression> getKeys() {
        return keys;
    }

    public List<Expression> getValues() {
        return values;
    }

    public int size() {
        return keys.size();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMapExpr(this, context);
    }
}
