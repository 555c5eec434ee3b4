package scss.runtime.selector;

/**
 * 复杂选择器的组成部分：复合选择器或组合符
 */
public interface SelectorComponent {
}
