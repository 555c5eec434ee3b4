package scss.runtime;

import com.scsslang.compiler.ast.SourceLocation;

/**
 * 模块加载失败（找不到、无法读取或有歧义）
 */
public class LoadException extends SassRuntimeException {

    public LoadException(String message) {
        super(message);
    }

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }

    public LoadException(String message, SourceLocation location) {
        super(message, location);
    }
}
