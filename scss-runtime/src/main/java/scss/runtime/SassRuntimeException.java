package scss.runtime;

import com.scsslang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译期运行时异常
 *
 * <p>值运算、内置函数等底层代码抛出时可不带位置，由求值器在最近的语句或表达式处补上
 * （{@link #attachLocation}），调用栈同理只补一次。</p>
 */
public class SassRuntimeException extends SassException {

    private SourceLocation location;
    private String sourceLine;
    private final List<SourceLocation> secondarySpans = new ArrayList<SourceLocation>();
    private String sassStackTrace;

    public SassRuntimeException(String message) {
        super(message);
    }

    public SassRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }

    public SassRuntimeException(String message, SourceLocation location) {
        super(message);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public boolean hasLocation() {
        return location != null && location.isKnown();
    }

    public String getSourceLine() {
        return sourceLine;
    }

    /** 若尚无位置则设置位置；已有位置时只补充源码行 */
    public SassRuntimeException attachLocation(SourceLocation location, String sourceLine) {
        if (!hasLocation()) {
            this.location = location;
            this.sourceLine = sourceLine;
        } else if (this.sourceLine == null && location != null && location.equals(this.location)) {
            this.sourceLine = sourceLine;
        }
        return this;
    }

    public void setSourceLine(String sourceLine) {
        if (this.sourceLine == null) {
            this.sourceLine = sourceLine;
        }
    }

    public SassRuntimeException addSecondarySpan(SourceLocation span) {
        if (span != null) {
            secondarySpans.add(span);
        }
        return this;
    }

    public List<SourceLocation> getSecondarySpans() {
        return Collections.unmodifiableList(secondarySpans);
    }

    public String getSassStackTrace() {
        return sassStackTrace;
    }

    public void setSassStackTrace(String trace) {
        if (trace != null && this.sassStackTrace == null) {
            this.sassStackTrace = trace;
        }
    }

    /** 返回不含位置信息的纯错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (!hasLocation()) {
            return super.getMessage();
        }
        return super.getMessage() + "\n  --> " + location;
    }

    /** 转换为结构化诊断 */
    public Diagnostic toDiagnostic() {
        return new Diagnostic(Diagnostic.Severity.ERROR, getRawMessage(), location, getSecondarySpans(),
                sassStackTrace, sourceLine);
    }
}
