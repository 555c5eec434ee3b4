package scss.runtime.value;

/**
 * 字符串：文本 + 是否带引号
 *
 * <p>相等性只比较文本，{@code "a" == a}。</p>
 */
public final class SassString extends SassValue {

    public static final SassString EMPTY_QUOTED = new SassString("", true);
    public static final SassString EMPTY_UNQUOTED = new SassString("", false);

    private final String text;
    private final boolean quoted;

    public SassString(String text, boolean quoted) {
        this.text = text;
        this.quoted = quoted;
    }

    public static SassString quoted(String text) {
        return new SassString(text, true);
    }

    public static SassString unquoted(String text) {
        return new SassString(text, false);
    }

    public String getText() {
        return text;
    }

    public boolean isQuoted() {
        return quoted;
    }

    /** 按码点计的长度 */
    public int sassLength() {
        return text.codePointCount(0, text.length());
    }

    @Override
    public Kind getKind() {
        return Kind.STRING;
    }

    @Override
    public String getTypeName() {
        return "string";
    }

    @Override
    public boolean isBlank() {
        return !quoted && text.isEmpty();
    }

    @Override
    public SassString assertString(String name) {
        return this;
    }

    /** 左侧带引号时结果带引号 */
    @Override
    public SassValue plus(SassValue other) {
        if (other instanceof SassString) {
            return new SassString(text + ((SassString) other).text, quoted);
        }
        return new SassString(text + other.toCssString(), quoted);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof SassString && text.equals(((SassString) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }
}
