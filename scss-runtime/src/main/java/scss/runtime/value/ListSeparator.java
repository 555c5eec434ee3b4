package scss.runtime.value;

/**
 * 列表分隔符
 */
public enum ListSeparator {
    COMMA("comma", ","),
    SPACE("space", " "),
    SLASH("slash", "/"),
    /** 尚未确定（空列表或单元素列表） */
    UNDECIDED("space", null);

    private final String sassName;
    private final String separator;

    ListSeparator(String sassName, String separator) {
        this.sassName = sassName;
        this.separator = separator;
    }

    /** {@code list-separator()} 返回的名称 */
    public String getSassName() {
        return sassName;
    }

    public String getSeparator() {
        return separator;
    }

    public static ListSeparator fromSassName(String name) {
        switch (name) {
            case "comma": return COMMA;
            case "space": return SPACE;
            case "slash": return SLASH;
            default: return null;
        }
    }
}
