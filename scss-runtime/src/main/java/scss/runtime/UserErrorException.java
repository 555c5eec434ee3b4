package scss.runtime;

import com.scsslang.compiler.ast.SourceLocation;

/**
 * 样式表中 {@code @error} 抛出的错误
 */
public class UserErrorException extends SassRuntimeException {

    public UserErrorException(String message) {
        super(message);
    }

    public UserErrorException(String message, SourceLocation location) {
        super(message, location);
    }
}
