package scss.runtime;

import com.scsslang.compiler.ast.SourceLocation;

/**
 * 类型错误：运算或函数参数的值类型不符合要求
 */
public class SassTypeException extends SassRuntimeException {

    public SassTypeException(String message) {
        super(message);
    }

    public SassTypeException(String message, SourceLocation location) {
        super(message, location);
    }
}
