package scss.runtime.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 有序 map，键按值相等去重，后写覆盖先写
 */
public final class SassMap extends SassValue {

    public static final SassMap EMPTY = new SassMap(Collections.<SassValue, SassValue>emptyMap());

    private final Map<SassValue, SassValue> contents;

    public SassMap(Map<SassValue, SassValue> contents) {
        this.contents = Collections.unmodifiableMap(new LinkedHashMap<>(contents));
    }

    public Map<SassValue, SassValue> getContents() {
        return contents;
    }

    public SassValue get(SassValue key) {
        return contents.get(key);
    }

    /** 作为列表时，每个条目是 key/value 的空格列表 */
    @Override
    public List<SassValue> asList() {
        List<SassValue> result = new ArrayList<>();
        for (Map.Entry<SassValue, SassValue> entry : contents.entrySet()) {
            List<SassValue> pair = new ArrayList<>(2);
            pair.add(entry.getKey());
            pair.add(entry.getValue());
            result.add(new SassList(pair, ListSeparator.SPACE));
        }
        return result;
    }

    @Override
    public ListSeparator getSeparator() {
        return contents.isEmpty() ? ListSeparator.UNDECIDED : ListSeparator.COMMA;
    }

    @Override
    public SassMap tryMap() {
        return this;
    }

    @Override
    public Kind getKind() {
        return Kind.MAP;
    }

    @Override
    public String getTypeName() {
        return "map";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o instanceof SassList) {
            return contents.isEmpty() && ((SassList) o).asList().isEmpty() && !((SassList) o).isBracketed();
        }
        return o instanceof SassMap && contents.equals(((SassMap) o).contents);
    }

    @Override
    public int hashCode() {
        return contents.isEmpty() ? 0 : contents.hashCode();
    }
}
