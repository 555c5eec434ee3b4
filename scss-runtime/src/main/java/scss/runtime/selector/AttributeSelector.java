package scss.runtime.selector;

/**
 * 属性选择器 {@code [name]}、{@code [name op value modifier]}
 */
public final class AttributeSelector extends SimpleSelector {

    private final String name;
    private final String operator;
    private final String value;
    private final String modifier;

    public AttributeSelector(String name, String operator, String value, String modifier) {
        this.name = name;
        this.operator = operator;
        this.value = value;
        this.modifier = modifier;
    }

    public String getName() {
        return name;
    }

    public String getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    public String getModifier() {
        return modifier;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[").append(name);
        if (operator != null) {
            sb.append(operator).append(value);
            if (modifier != null) sb.append(' ').append(modifier);
        }
        return sb.append(']').toString();
    }
}
