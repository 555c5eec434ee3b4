package scss.runtime.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 可变参数列表：收集多余的位置参数，并携带多余的关键字参数
 *
 * <p>关键字被 {@code keywords()} 读取后标记为已访问，调用结束时未访问的关键字视为未知参数。</p>
 */
public final class SassArgList extends SassList {

    private final Map<String, SassValue> keywords;
    private boolean keywordsAccessed;

    public SassArgList(List<? extends SassValue> contents, Map<String, SassValue> keywords, ListSeparator separator) {
        super(contents, separator);
        this.keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    /** 读取关键字并标记为已访问 */
    public Map<String, SassValue> getKeywords() {
        keywordsAccessed = true;
        return keywords;
    }

    /** 不标记访问，仅供参数绑定校验 */
    public Map<String, SassValue> peekKeywords() {
        return keywords;
    }

    public boolean wereKeywordsAccessed() {
        return keywordsAccessed;
    }

    @Override
    public Kind getKind() {
        return Kind.ARGLIST;
    }

    @Override
    public String getTypeName() {
        return "arglist";
    }
}
