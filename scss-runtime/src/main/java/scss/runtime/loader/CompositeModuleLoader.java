package scss.runtime.loader;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 依次尝试多个加载器，返回第一个找到的结果
 */
public final class CompositeModuleLoader implements ModuleLoader {

    private final List<ModuleLoader> loaders;

    public CompositeModuleLoader(List<ModuleLoader> loaders) {
        this.loaders = Collections.unmodifiableList(new ArrayList<ModuleLoader>(loaders));
    }

    public static CompositeModuleLoader of(ModuleLoader... loaders) {
        return new CompositeModuleLoader(Arrays.asList(loaders));
    }

    @Override
    public ParsedModule resolve(LoadRequest request, LoadContext context) {
        for (ModuleLoader loader : loaders) {
            ParsedModule module = loader.resolve(request, context);
            if (module != null) {
                return module;
            }
        }
        return null;
    }
}
