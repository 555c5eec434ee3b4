package scss.runtime;

import com.scsslang.compiler.parser.ParseException;

/**
 * 前端解析错误的包装，消息与位置保持原样
 */
public class ParseDelegationException extends SassRuntimeException {

    private final ParseException parseException;

    public ParseDelegationException(ParseException cause) {
        super(cause.getRawMessage(), cause);
        this.parseException = cause;
        attachLocation(cause.getLocation(), cause.getSourceLine());
    }

    public ParseException getParseException() {
        return parseException;
    }
}
