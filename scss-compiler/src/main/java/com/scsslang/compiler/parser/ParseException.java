package com.scsslang.compiler.parser;

import com.scsslang.compiler.ast.SourceLocation;

/**
 * 解析异常
 */
public class ParseException extends RuntimeException {
    private final SourceLocation location;
    private final String expected;
    private final String sourceLine;

    public ParseException(String message, SourceLocation location) {
        this(message, location, null, null);
    }

    public ParseException(String message, SourceLocation location, String expected, String sourceLine) {
        super(message);
        this.location = location;
        this.expected = expected;
        this.sourceLine = sourceLine;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getExpected() {
        return expected;
    }

    /** 出错行的源码文本，可能为 null */
    public String getSourceLine() {
        return sourceLine;
    }

    /** 不含位置信息的原始消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (expected != null) {
            sb.append(", expected ").append(expected);
        }
        if (location != null && location.isKnown()) {
            sb.append(" at ").append(location.getFile());
            sb.append(':').append(location.getLine());
            sb.append(':').append(location.getColumn());
        }
        return sb.toString();
    }
}
