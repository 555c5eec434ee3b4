package scss.runtime.selector;

/**
 * 显式组合符；后代组合符由两个相邻的复合选择器隐式表示
 */
public enum Combinator implements SelectorComponent {
    CHILD(">"),
    NEXT_SIBLING("+"),
    FOLLOWING_SIBLING("~");

    private final String text;

    Combinator(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    public static Combinator fromChar(char c) {
        switch (c) {
            case '>': return CHILD;
            case '+': return NEXT_SIBLING;
            case '~': return FOLLOWING_SIBLING;
            default: return null;
        }
    }

    @Override
    public String toString() {
        return text;
    }
}
