package scss.runtime.loader;

/**
 * 样式表加载器
 *
 * <p>求值器只通过此接口加载其他样式表，核心本身不做 I/O。实现需可在多个编译间共享。</p>
 */
public interface ModuleLoader {

    /**
     * 解析并加载请求的样式表
     *
     * @return 此加载器找不到时返回 null
     * @throws scss.runtime.LoadException 找到但无法读取，或候选文件有歧义
     * @throws scss.runtime.ParseDelegationException 样式表语法错误
     */
    ParsedModule resolve(LoadRequest request, LoadContext context);
}
