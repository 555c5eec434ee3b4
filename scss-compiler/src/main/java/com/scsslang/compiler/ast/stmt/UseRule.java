package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.decl.ConfiguredVariable;

import java.util.Collections;
import java.util.List;

/**
 * {@code @use "url" [as ns|*] [with (...)];}
 */
public class UseRule extends Statement {
    private final String url;
    private final String namespace;  // null 表示 as *
    private final List<ConfiguredVariable> configuration;

    public UseRule(SourceLocation location, String url, String namespace, List<ConfiguredVariable> configuration) {
        super(location);
        this.url = url;
        this.namespace = namespace;
        this.configuration = Collections.unmodifiableList(configuration);
    }

    public String getUrl() {
        return url;
    }

    public String getNamespace() {
        return namespace;
    }

    public boolean isGlobalNamespace() {
        return namespace == null;
    }

    public List<ConfiguredVariable> getConfiguration() {
        return configuration;
    }

    /** 由 url 推导默认命名空间：{@code "src/corners"} → {@code corners}，{@code "sass:math"} → {@code math} */
    public static String defaultNamespace(String url) {
        String base = url;
        int slash = base.lastIndexOf('/');
        if (slash >= 0) base = base.substring(slash + 1);
        int colon = base.indexOf(':');
        if (colon >= 0) base = base.substring(colon + 1);
        int dot = base.indexOf('.');
        if (dot >= 0) base = base.substring(0, dot);
        if (base.startsWith("_")) base = base.substring(1);
        return base;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUseRule(this, context);
    }
}
