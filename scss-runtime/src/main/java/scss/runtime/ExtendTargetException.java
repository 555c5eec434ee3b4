package scss.runtime;

import com.scsslang.compiler.ast.SourceLocation;

/**
 * {@code @extend} 错误：目标未匹配、目标不是简单选择器或跨媒体查询扩展
 */
public class ExtendTargetException extends SassRuntimeException {

    public ExtendTargetException(String message) {
        super(message);
    }

    public ExtendTargetException(String message, SourceLocation location) {
        super(message, location);
    }
}
