package scss.runtime.selector;

import java.util.List;

/**
 * 可被 {@code @extend} 改写选择器的样式规则
 */
public interface Extendable {

    SelectorList getSelector();

    void setSelector(SelectorList selector);

    /** 所在的媒体查询上下文，不在 {@code @media} 内时为 null */
    List<String> getMediaContext();
}
