package scss.runtime;

import com.scsslang.compiler.ast.SourceLocation;

/**
 * 未定义的变量、函数、mixin 或命名空间
 */
public class UndefinedNameException extends SassRuntimeException {

    public UndefinedNameException(String message) {
        super(message);
    }

    public UndefinedNameException(String message, SourceLocation location) {
        super(message, location);
    }
}
