package scss.runtime.interpreter;

import com.scsslang.compiler.ast.decl.ArgumentDeclaration;
import com.scsslang.compiler.ast.stmt.IncludeRule;
import scss.runtime.scope.Environment;
import scss.runtime.value.SassCallable;

/**
 * 传给 {@code @include} 的内容块
 *
 * <p>作用域是调用处（{@code @include} 所在）的作用域，而不是 mixin 的定义处。
 * 块内的 {@code @content} 指向调用处外层 mixin 的内容块。</p>
 */
public final class ContentCallable implements SassCallable {

    private final IncludeRule.ContentBlock block;
    private final Environment environment;
    private final ContentCallable outerContent;

    public ContentCallable(IncludeRule.ContentBlock block, Environment environment, ContentCallable outerContent) {
        this.block = block;
        this.environment = environment;
        this.outerContent = outerContent;
    }

    @Override
    public String getName() {
        return "@content";
    }

    public IncludeRule.ContentBlock getBlock() {
        return block;
    }

    /** {@code using (...)} 的形参；没有时为空声明 */
    public ArgumentDeclaration getParameters() {
        return block.getParameters() != null ? block.getParameters() : ArgumentDeclaration.EMPTY;
    }

    public Environment getEnvironment() {
        return environment;
    }

    public ContentCallable getOuterContent() {
        return outerContent;
    }
}
