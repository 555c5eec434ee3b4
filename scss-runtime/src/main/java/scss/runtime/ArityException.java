package scss.runtime;

import com.scsslang.compiler.ast.SourceLocation;

/**
 * 参数绑定错误：缺少参数、未知命名参数或参数过多
 */
public class ArityException extends SassRuntimeException {

    public ArityException(String message) {
        super(message);
    }

    public ArityException(String message, SourceLocation location) {
        super(message, location);
    }
}
