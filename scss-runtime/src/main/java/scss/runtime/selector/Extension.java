package scss.runtime.selector;

import com.scsslang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 一条扩展记录：extender 扩展 target
 */
public final class Extension {

    private final int id;
    private final ComplexSelector extender;
    private final SimpleSelector target;
    private final boolean optional;
    private final List<String> mediaContext;
    private final SourceLocation span;

    Extension(int id, ComplexSelector extender, SimpleSelector target, boolean optional,
              List<String> mediaContext, SourceLocation span) {
        this.id = id;
        this.extender = extender;
        this.target = target;
        this.optional = optional;
        this.mediaContext = mediaContext;
        this.span = span;
    }

    public int getId() {
        return id;
    }

    public ComplexSelector getExtender() {
        return extender;
    }

    public SimpleSelector getTarget() {
        return target;
    }

    public boolean isOptional() {
        return optional;
    }

    public List<String> getMediaContext() {
        return mediaContext;
    }

    public SourceLocation getSpan() {
        return span;
    }

    /** 能否作用于处在 ruleMedia 中的规则 */
    boolean appliesInMedia(List<String> ruleMedia) {
        return mediaContext == null || mediaContext.equals(ruleMedia);
    }

    @Override
    public String toString() {
        return extender + " extends " + target;
    }
}
