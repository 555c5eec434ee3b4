package scss.runtime;

import com.scsslang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译诊断条目（错误、警告、弃用提示、{@code @debug} 输出）
 *
 * <p>核心只产生诊断，不向任何流输出；渲染由宿主负责。</p>
 */
public final class Diagnostic {

    public enum Severity {
        ERROR, WARNING, DEPRECATION, DEBUG
    }

    private final Severity severity;
    private final String message;
    private final SourceLocation primarySpan;
    private final List<SourceLocation> secondarySpans;
    private final String stackTrace;
    private final String sourceLine;

    public Diagnostic(Severity severity, String message, SourceLocation primarySpan) {
        this(severity, message, primarySpan, Collections.<SourceLocation>emptyList(), null, null);
    }

    public Diagnostic(Severity severity, String message, SourceLocation primarySpan,
                      List<SourceLocation> secondarySpans, String stackTrace, String sourceLine) {
        this.severity = severity;
        this.message = message;
        this.primarySpan = primarySpan;
        this.secondarySpans = Collections.unmodifiableList(new ArrayList<SourceLocation>(secondarySpans));
        this.stackTrace = stackTrace;
        this.sourceLine = sourceLine;
    }

    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public SourceLocation getPrimarySpan() { return primarySpan; }
    public List<SourceLocation> getSecondarySpans() { return secondarySpans; }
    public String getStackTrace() { return stackTrace; }
    public String getSourceLine() { return sourceLine; }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity.name()).append(": ").append(message);
        if (primarySpan != null && primarySpan.isKnown()) {
            sb.append(" (").append(primarySpan).append(')');
        }
        return sb.toString();
    }
}
