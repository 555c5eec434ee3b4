package scss.runtime.interpreter;

import com.scsslang.compiler.ast.stmt.MixinRule;
import scss.runtime.scope.Environment;
import scss.runtime.value.SassCallable;

/**
 * {@code @mixin} 定义的 mixin，持有定义处的作用域链
 */
public final class UserMixin implements SassCallable {

    private final MixinRule declaration;
    private final Environment closure;

    public UserMixin(MixinRule declaration, Environment closure) {
        this.declaration = declaration;
        this.closure = closure;
    }

    @Override
    public String getName() {
        return declaration.getName();
    }

    public MixinRule getDeclaration() {
        return declaration;
    }

    public Environment getClosure() {
        return closure;
    }

    /** 体内是否出现 {@code @content} */
    public boolean acceptsContent() {
        return declaration.hasContent();
    }

    @Override
    public String toString() {
        return "mixin " + getName();
    }
}
