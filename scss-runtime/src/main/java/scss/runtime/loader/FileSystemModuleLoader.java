package scss.runtime.loader;

import scss.runtime.LoadException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 文件系统加载器
 *
 * <p>先相对于发起者所在目录解析，再依次尝试加载路径；经加载路径找到的样式表视为依赖。
 * 规范 url 为规范化后的绝对路径。</p>
 */
public final class FileSystemModuleLoader implements ModuleLoader {

    private static final Logger LOG = Logger.getLogger(FileSystemModuleLoader.class.getName());

    private final List<Path> loadPaths;
    private final ParsedStylesheetCache parseCache;

    public FileSystemModuleLoader(List<Path> loadPaths) {
        this(loadPaths, ParsedStylesheetCache.shared());
    }

    public FileSystemModuleLoader(List<Path> loadPaths, ParsedStylesheetCache parseCache) {
        List<Path> absolute = new ArrayList<Path>(loadPaths.size());
        for (Path path : loadPaths) {
            absolute.add(path.toAbsolutePath().normalize());
        }
        this.loadPaths = Collections.unmodifiableList(absolute);
        this.parseCache = parseCache;
    }

    public List<Path> getLoadPaths() {
        return loadPaths;
    }

    @Override
    public ParsedModule resolve(LoadRequest request, LoadContext context) {
        String url = request.getUrl();
        if (url.contains(":") && !isWindowsAbsolute(url)) {
            // 其他 scheme（sass:、http: 等）不归文件系统处理
            return null;
        }
        if (context.getBaseUrl() != null) {
            Path base = Paths.get(context.getBaseUrl()).getParent();
            if (base != null) {
                Path found = find(base, url);
                if (found != null) {
                    return load(request, found, context.isFromDependency());
                }
            }
        }
        for (Path loadPath : loadPaths) {
            Path found = find(loadPath, url);
            if (found != null) {
                return load(request, found, true);
            }
        }
        return null;
    }

    /** 加载入口文件 */
    public ParsedModule loadEntry(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        if (!Files.isRegularFile(absolute)) {
            throw new LoadException("Cannot open file: " + file);
        }
        return load(null, absolute, false);
    }

    private Path find(Path base, String url) {
        String joined = toSlashes(base.resolve(url).normalize());
        String found = UrlCandidates.resolve(joined, path -> Files.isRegularFile(Paths.get(path)));
        return found == null ? null : Paths.get(found);
    }

    private ParsedModule load(LoadRequest request, Path file, boolean dependency) {
        String canonical = toSlashes(file);
        String source;
        try {
            source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LoadException("Cannot read stylesheet: " + canonical, e);
        }
        if (request != null) {
            LOG.fine("Resolved " + request + " to " + canonical);
        }
        return new ParsedModule(canonical, parseCache.parse(canonical, source), source, dependency);
    }

    private static String toSlashes(Path path) {
        return path.toString().replace('\\', '/');
    }

    private static boolean isWindowsAbsolute(String url) {
        return url.length() > 2 && Character.isLetter(url.charAt(0)) && url.charAt(1) == ':'
                && (url.charAt(2) == '/' || url.charAt(2) == '\\');
    }
}
