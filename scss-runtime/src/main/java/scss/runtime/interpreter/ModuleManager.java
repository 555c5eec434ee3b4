package scss.runtime.interpreter;

import com.scsslang.compiler.ast.SourceLocation;
import scss.runtime.ImportCycleException;
import scss.runtime.scope.Module;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 一次编译内的模块表
 *
 * <p>按规范 URL 缓存已求值的模块，同一 URL 在整个依赖图中只求值一次。
 * 正在求值的 URL 记在活动集合中，再次进入即为循环依赖。求值失败时移除，避免留下半成品模块。</p>
 */
public final class ModuleManager {

    private static final Logger LOG = Logger.getLogger(ModuleManager.class.getName());

    private final Map<String, Module> modules = new HashMap<>();
    private final Set<String> active = new LinkedHashSet<>();
    private final Set<String> loadedUrls = new LinkedHashSet<>();
    private final Set<String> dependencyUrls = new HashSet<>();
    private final Map<String, String> sources = new LinkedHashMap<>();

    /** 已求值的模块，没有时返回 null */
    public Module get(String canonicalUrl) {
        return modules.get(canonicalUrl);
    }

    /**
     * 开始求值
     *
     * @throws ImportCycleException URL 正在求值中
     */
    public void begin(String canonicalUrl, SourceLocation span, boolean module) {
        if (!active.add(canonicalUrl)) {
            throw new ImportCycleException(module
                    ? "Module loop: this module is already being loaded."
                    : "This file is already being loaded.", span);
        }
        LOG.fine(() -> "Loading " + canonicalUrl);
    }

    /** 求值完成；module 为 null 表示旧式导入（不缓存模块） */
    public void finish(String canonicalUrl, Module module) {
        active.remove(canonicalUrl);
        if (module != null) {
            modules.put(canonicalUrl, module);
        }
        LOG.fine(() -> "Loaded " + canonicalUrl);
    }

    /** 求值失败，移除活动标记 */
    public void abort(String canonicalUrl) {
        active.remove(canonicalUrl);
        modules.remove(canonicalUrl);
        LOG.fine(() -> "Failed to load " + canonicalUrl);
    }

    /** 记录已读入的样式表源码（错误报告取源码行） */
    public void recordSource(String canonicalUrl, String source, boolean dependency) {
        loadedUrls.add(canonicalUrl);
        if (source != null) sources.put(canonicalUrl, source);
        if (dependency) dependencyUrls.add(canonicalUrl);
    }

    public boolean isDependency(String url) {
        return url != null && dependencyUrls.contains(url);
    }

    public String getSource(String url) {
        return url == null ? null : sources.get(url);
    }

    /** 本次编译读入的全部 URL，按首次加载顺序 */
    public List<String> getLoadedUrls() {
        return Collections.unmodifiableList(new ArrayList<>(loadedUrls));
    }
}
