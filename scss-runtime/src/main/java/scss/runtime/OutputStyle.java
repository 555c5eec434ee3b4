package scss.runtime;

/**
 * CSS 输出格式
 */
public enum OutputStyle {
    /** 两空格缩进，每行一条声明，顶层块之间空一行 */
    EXPANDED,
    /** 去掉全部可省略的空白与最后一个分号 */
    COMPRESSED;

    public static OutputStyle fromName(String name) {
        for (OutputStyle style : values()) {
            if (style.name().equalsIgnoreCase(name)) return style;
        }
        throw new IllegalArgumentException("Unknown output style: " + name);
    }
}
