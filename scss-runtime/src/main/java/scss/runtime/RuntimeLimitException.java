package scss.runtime;

import com.scsslang.compiler.ast.SourceLocation;

/**
 * 循环次数或调用深度超出限制
 */
public class RuntimeLimitException extends SassRuntimeException {

    public RuntimeLimitException(String message) {
        super(message);
    }

    public RuntimeLimitException(String message, SourceLocation location) {
        super(message, location);
    }
}
