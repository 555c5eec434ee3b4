package scss.runtime.interpreter;

import com.scsslang.compiler.ast.stmt.FunctionRule;
import scss.runtime.scope.Environment;
import scss.runtime.value.SassCallable;

/**
 * {@code @function} 定义的函数，持有定义处的作用域链
 */
public final class UserFunction implements SassCallable {

    private final FunctionRule declaration;
    private final Environment closure;

    public UserFunction(FunctionRule declaration, Environment closure) {
        this.declaration = declaration;
        this.closure = closure;
    }

    @Override
    public String getName() {
        return declaration.getName();
    }

    public FunctionRule getDeclaration() {
        return declaration;
    }

    public Environment getClosure() {
        return closure;
    }

    @Override
    public String toString() {
        return "function " + getName();
    }
}
