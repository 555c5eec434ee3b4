package scss.runtime.loader;

import scss.runtime.LoadException;

import java.util.ArrayList;
import java.util.List;

/**
 * 由导入 url 推出候选文件路径：扩展名、partial（{@code _x.scss}）与 index 文件
 */
final class UrlCandidates {

    /** 判断路径是否存在 */
    interface FileCheck {
        boolean exists(String path);
    }

    private UrlCandidates() {}

    /**
     * 解析 url 对应的唯一文件
     *
     * @param path 已与基准目录拼接的路径（不含扩展名时自动补全）
     * @return 找不到时返回 null
     * @throws LoadException 同一优先级有多个候选
     */
    static String resolve(String path, FileCheck check) {
        String found = tryPath(path, check);
        if (found != null) return found;
        if (hasExtension(path)) return null;
        return tryIndex(path, check);
    }

    private static String tryPath(String path, FileCheck check) {
        if (hasExtension(path)) {
            return exactlyOne(existing(withPartials(path), check));
        }
        String scss = exactlyOne(existing(withPartials(path + ".scss"), check));
        if (scss != null) return scss;
        return exactlyOne(existing(withPartials(path + ".css"), check));
    }

    private static String tryIndex(String path, FileCheck check) {
        String dir = path.endsWith("/") ? path : path + "/";
        String scss = exactlyOne(existing(withPartials(dir + "index.scss"), check));
        if (scss != null) return scss;
        return exactlyOne(existing(withPartials(dir + "index.css"), check));
    }

    private static boolean hasExtension(String path) {
        return path.endsWith(".scss") || path.endsWith(".css");
    }

    /** {@code a/b.scss} → {@code [a/_b.scss, a/b.scss]} */
    private static List<String> withPartials(String path) {
        List<String> result = new ArrayList<String>(2);
        int slash = path.lastIndexOf('/');
        String dir = path.substring(0, slash + 1);
        String base = path.substring(slash + 1);
        if (!base.startsWith("_")) {
            result.add(dir + "_" + base);
        }
        result.add(path);
        return result;
    }

    private static List<String> existing(List<String> candidates, FileCheck check) {
        List<String> result = new ArrayList<String>(candidates.size());
        for (String candidate : candidates) {
            if (check.exists(candidate)) result.add(candidate);
        }
        return result;
    }

    private static String exactlyOne(List<String> paths) {
        if (paths.isEmpty()) return null;
        if (paths.size() == 1) return paths.get(0);
        StringBuilder sb = new StringBuilder("It's not clear which file to import. Found:");
        for (String path : paths) {
            sb.append("\n  ").append(path);
        }
        throw new LoadException(sb.toString());
    }

    /** 规范化 {@code .} 与 {@code ..} 段 */
    static String normalize(String path) {
        String[] segments = path.split("/");
        List<String> result = new ArrayList<String>();
        for (String segment : segments) {
            if (segment.isEmpty() || ".".equals(segment)) continue;
            if ("..".equals(segment)) {
                if (!result.isEmpty() && !"..".equals(result.get(result.size() - 1))) {
                    result.remove(result.size() - 1);
                } else {
                    result.add(segment);
                }
                continue;
            }
            result.add(segment);
        }
        StringBuilder sb = new StringBuilder(path.startsWith("/") ? "/" : "");
        for (int i = 0; i < result.size(); i++) {
            if (i > 0) sb.append('/');
            sb.append(result.get(i));
        }
        return sb.toString();
    }

    /** url 所在目录（含末尾 {@code /}），无目录时返回空串 */
    static String directoryOf(String url) {
        if (url == null) return "";
        int slash = url.lastIndexOf('/');
        return slash < 0 ? "" : url.substring(0, slash + 1);
    }
}
