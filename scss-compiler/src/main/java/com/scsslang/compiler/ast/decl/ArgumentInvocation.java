package com.scsslang.compiler.ast.decl;

import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 实参列表：位置参数、命名参数、{@code $list...} 与 {@code $map...} 展开
 */
public final class ArgumentInvocation {
    private final SourceLocation location;
    private final List<Expression> positional;
    private final Map<String, Expression> named;
    private final Expression rest;         // 可选：$args...
    private final Expression keywordRest;  // 可选：$kwargs...

    public static final ArgumentInvocation EMPTY = new ArgumentInvocation(SourceLocation.UNKNOWN,
            Collections.<Expression>emptyList(), Collections.<String, Expression>emptyMap(), null, null);

    public ArgumentInvocation(SourceLocation location, List<Expression> positional, Map<String, Expression> named,
                              Expression rest, Expression keywordRest) {
        this.location = location;
        this.positional = Collections.unmodifiableList(positional);
        this.named = Collections.unmodifiableMap(new LinkedHashMap<String, Expression>(named));
        this.rest = rest;
        this.keywordRest = keywordRest;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<Expression> getPositional() {
        return positional;
    }

    public Map<String, Expression> getNamed() {
        return named;
    }

    public Expression getRest() {
        return rest;
    }

    public Expression getKeywordRest() {
        return keywordRest;
    }

    public boolean isEmpty() {
        return positional.isEmpty() && named.isEmpty() && rest == null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Expression e : positional) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(e);
        }
        for (Map.Entry<String, Expression> e : named.entrySet()) {
            if (sb.length() > 0) sb.append(", ");
            sb.append('$').append(e.getKey()).append(": ").append(e.getValue());
        }
        if (rest != null) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(rest).append("...");
        }
        return sb.toString();
    }
}
