package scss.runtime.loader;

/**
 * 发起加载的样式表信息
 */
public final class LoadContext {

    private final String baseUrl;
    private final boolean fromDependency;

    public LoadContext(String baseUrl, boolean fromDependency) {
        this.baseUrl = baseUrl;
        this.fromDependency = fromDependency;
    }

    /** 发起加载的样式表的规范 url，入口样式表无 url 时为 null */
    public String getBaseUrl() {
        return baseUrl;
    }

    /** 发起者本身是否为依赖（其加载的模块同样视为依赖） */
    public boolean isFromDependency() {
        return fromDependency;
    }
}
