package com.scsslang.compiler.ast.decl;

import com.scsslang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 形参列表：{@code ($a, $b: 1, $rest...)}
 */
public final class ArgumentDeclaration {
    private final SourceLocation location;
    private final List<Parameter> parameters;
    private final String restParameter;  // 可选

    public static final ArgumentDeclaration EMPTY =
            new ArgumentDeclaration(SourceLocation.UNKNOWN, Collections.<Parameter>emptyList(), null);

    public ArgumentDeclaration(SourceLocation location, List<Parameter> parameters, String restParameter) {
        this.location = location;
        this.parameters = Collections.unmodifiableList(parameters);
        this.restParameter = restParameter;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public String getRestParameter() {
        return restParameter;
    }

    public boolean hasRest() {
        return restParameter != null;
    }

    public boolean isEmpty() {
        return parameters.isEmpty() && restParameter == null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(parameters.get(i));
        }
        if (restParameter != null) {
            if (!parameters.isEmpty()) sb.append(", ");
            sb.append('$').append(restParameter).append("...");
        }
        return sb.append(')').toString();
    }
}
