package scss.runtime;

import com.scsslang.compiler.ast.SourceLocation;

/**
 * 模块或导入循环
 */
public class ImportCycleException extends SassRuntimeException {

    public ImportCycleException(String message) {
        super(message);
    }

    public ImportCycleException(String message, SourceLocation location) {
        super(message, location);
    }
}
