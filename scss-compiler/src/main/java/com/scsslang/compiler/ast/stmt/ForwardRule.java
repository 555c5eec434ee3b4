package com.scsslang.compiler.ast.stmt;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.decl.ConfiguredVariable;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * {@code @forward "url" [as prefix-*] [show a, $b | hide c] [with (...)];}
 *
 * <p>show/hide 中的变量以 {@code $} 开头存储，mixin/函数名不带前缀。</p>
 */
public class ForwardRule extends Statement {
    private final String url;
    private final String prefix;          // 可选
    private final Set<String> shown;      // 可选
    private final Set<String> hidden;     // 可选
    private final List<ConfiguredVariable> configuration;

    public ForwardRule(SourceLocation location, String url, String prefix, Set<String> shown, Set<String> hidden,
                       List<ConfiguredVariable> configuration) {
        super(location);
        this.url = url;
        this.prefix = prefix;
        this.shown = shown != null ? Collections.unmodifiableSet(shown) : null;
        this.hidden = hidden != null ? Collections.unmodifiableSet(hidden) : null;
        this.configuration = Collections.unmodifiableList(configuration);
    }

    public String getUrl() {
        return url;
    }

    public String getPrefix() {
        return prefix;
    }

    public Set<String> getShown() {
        return shown;
    }

    public Set<String> getHidden() {
        return hidden;
    }

    public List<ConfiguredVariable> getConfiguration() {
        return configuration;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForwardRule(this, context);
    }
}
