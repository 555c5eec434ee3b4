package scss.runtime.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 列表：元素 + 分隔符 + 是否带方括号
 */
public class SassList extends SassValue {

    public static final SassList EMPTY = new SassList(Collections.<SassValue>emptyList(), ListSeparator.UNDECIDED, false);

    private final List<SassValue> contents;
    private final ListSeparator separator;
    private final boolean bracketed;

    public SassList(List<? extends SassValue> contents, ListSeparator separator, boolean bracketed) {
        this.contents = Collections.unmodifiableList(new ArrayList<SassValue>(contents));
        if (separator == ListSeparator.UNDECIDED && this.contents.size() > 1) {
            throw new IllegalArgumentException("A list with more than one element must have an explicit separator");
        }
        this.separator = separator;
        this.bracketed = bracketed;
    }

    public SassList(List<? extends SassValue> contents, ListSeparator separator) {
        this(contents, separator, false);
    }

    /** 相同分隔符与括号、不同元素的新列表 */
    public SassList withContents(List<? extends SassValue> newContents) {
        ListSeparator sep = separator == ListSeparator.UNDECIDED && newContents.size() > 1
                ? ListSeparator.SPACE : separator;
        return new SassList(newContents, sep, bracketed);
    }

    @Override
    public List<SassValue> asList() {
        return contents;
    }

    @Override
    public ListSeparator getSeparator() {
        return separator;
    }

    @Override
    public boolean isBracketed() {
        return bracketed;
    }

    @Override
    public Kind getKind() {
        return Kind.LIST;
    }

    @Override
    public String getTypeName() {
        return "list";
    }

    @Override
    public SassMap tryMap() {
        return contents.isEmpty() ? SassMap.EMPTY : null;
    }

    @Override
    public boolean isBlank() {
        if (bracketed) return false;
        for (SassValue element : contents) {
            if (!element.isBlank()) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o instanceof SassMap) {
            return contents.isEmpty() && ((SassMap) o).getContents().isEmpty();
        }
        if (o instanceof SassSelector) return equals(((SassSelector) o).toList());
        if (!(o instanceof SassList)) return false;
        SassList other = (SassList) o;
        if (contents.isEmpty() && other.contents.isEmpty() && bracketed == other.bracketed) return true;
        return separator == other.separator && bracketed == other.bracketed && contents.equals(other.contents);
    }

    @Override
    public int hashCode() {
        if (contents.isEmpty()) return bracketed ? 1 : 0;
        return (contents.hashCode() * 31 + separator.hashCode()) * 31 + (bracketed ? 1 : 0);
    }
}
