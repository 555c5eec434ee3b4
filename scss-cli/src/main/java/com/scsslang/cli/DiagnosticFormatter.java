package com.scsslang.cli;

import com.scsslang.compiler.ast.SourceLocation;
import scss.runtime.Diagnostic;

/**
 * 终端诊断渲染
 *
 * <p>输出格式类似:</p>
 * <pre>
 * Error: Undefined variable.
 *   --> main.scss:5:10
 *   |
 * 5 |   color: $primary;
 *   |          ^^^^^^^^
 *   main.scss 5:10  root stylesheet
 * </pre>
 */
public final class DiagnosticFormatter {

    private DiagnosticFormatter() {}

    public static String format(Diagnostic diagnostic) {
        StringBuilder sb = new StringBuilder();
        sb.append(label(diagnostic.getSeverity())).append(": ").append(diagnostic.getMessage());
        SourceLocation span = diagnostic.getPrimarySpan();
        if (span != null && span.isKnown()) {
            sb.append('\n').append(formatLocation(span, diagnostic.getSourceLine()));
        }
        if (diagnostic.getStackTrace() != null && !diagnostic.getStackTrace().isEmpty()) {
            sb.append('\n').append(stripTrailingNewline(diagnostic.getStackTrace()));
        } else if (span != null && span.isKnown() && diagnostic.getSeverity() != Diagnostic.Severity.DEBUG) {
            sb.append("\n  ").append(span.getFile()).append(' ')
              .append(span.getLine()).append(':').append(span.getColumn())
              .append("  root stylesheet");
        }
        return sb.toString();
    }

    static String label(Diagnostic.Severity severity) {
        switch (severity) {
            case ERROR:       return "Error";
            case WARNING:     return "Warning";
            case DEPRECATION: return "Deprecation Warning";
            case DEBUG:       return "Debug";
            default:          return severity.name();
        }
    }

    private static String formatLocation(SourceLocation location, String sourceLine) {
        StringBuilder sb = new StringBuilder();
        sb.append("  --> ").append(location.getFile())
          .append(":").append(location.getLine())
          .append(":").append(location.getColumn());

        if (sourceLine != null && !sourceLine.isEmpty()) {
            String lineNum = String.valueOf(location.getLine());
            String padding = repeat(" ", lineNum.length());
            sb.append('\n').append(padding).append(" |\n");
            sb.append(lineNum).append(" | ").append(sourceLine).append('\n');
            sb.append(padding).append(" | ");
            int col = Math.max(location.getColumn(), 1);
            sb.append(repeat(" ", col - 1));
            // 跨行的范围只标到行尾
            int len = Math.min(location.getLength(), sourceLine.length() - col + 1);
            sb.append(repeat("^", Math.max(len, 1)));
        }
        return sb.toString();
    }

    private static String stripTrailingNewline(String text) {
        return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
    }

    private static String repeat(String s, int count) {
        if (count <= 0) return "";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(s);
        }
        return sb.toString();
    }
}
