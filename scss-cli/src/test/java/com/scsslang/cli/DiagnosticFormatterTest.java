package com.scsslang.cli;

import com.scsslang.compiler.ast.SourceLocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import scss.runtime.Diagnostic;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 终端诊断格式
 */
class DiagnosticFormatterTest {

    @Test
    @DisplayName("无位置只输出消息")
    void testMessageOnly() {
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Severity.ERROR, "boom", null);
        assertEquals("Error: boom", DiagnosticFormatter.format(diagnostic));
    }

    @Test
    @DisplayName("源码行与下划线")
    void testSourceLine() {
        SourceLocation span = new SourceLocation("main.scss", 5, 10, 40, 8);
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Severity.ERROR, "Undefined variable.", span,
                Collections.<SourceLocation>emptyList(), null, "  color: $primary;");
        String expected = "Error: Undefined variable.\n"
                + "  --> main.scss:5:10\n"
                + "  |\n"
                + "5 |   color: $primary;\n"
                + "  |          ^^^^^^^^\n"
                + "  main.scss 5:10  root stylesheet";
        assertEquals(expected, DiagnosticFormatter.format(diagnostic));
    }

    @Test
    @DisplayName("有调用栈时输出调用栈")
    void testStackTrace() {
        SourceLocation span = new SourceLocation("main.scss", 1, 1, 0, 3);
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Severity.WARNING, "careful", span,
                Collections.<SourceLocation>emptyList(), "main.scss 1:1  f()\n", null);
        assertEquals("Warning: careful\n  --> main.scss:1:1\nmain.scss 1:1  f()",
                DiagnosticFormatter.format(diagnostic));
    }

    @Test
    @DisplayName("跨行范围只标到行尾")
    void testMultiLineSpan() {
        SourceLocation span = new SourceLocation("a.scss", 1, 3, 2, 50);
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Severity.ERROR, "x", span,
                Collections.<SourceLocation>emptyList(), null, "a {b");
        assertTrue(DiagnosticFormatter.format(diagnostic).contains("\n  |   ^^\n"));
    }

    @Test
    @DisplayName("严重程度标签")
    void testLabels() {
        assertEquals("Error", DiagnosticFormatter.label(Diagnostic.Severity.ERROR));
        assertEquals("Warning", DiagnosticFormatter.label(Diagnostic.Severity.WARNING));
        assertEquals("Deprecation Warning", DiagnosticFormatter.label(Diagnostic.Severity.DEPRECATION));
        assertEquals("Debug", DiagnosticFormatter.label(Diagnostic.Severity.DEBUG));
    }
}
