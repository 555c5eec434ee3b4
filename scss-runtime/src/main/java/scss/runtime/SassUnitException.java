package scss.runtime;

import com.scsslang.compiler.ast.SourceLocation;

/**
 * 单位错误：不兼容单位之间的运算或比较
 */
public class SassUnitException extends SassRuntimeException {

    public SassUnitException(String message) {
        super(message);
    }

    public SassUnitException(String message, SourceLocation location) {
        super(message, location);
    }
}
