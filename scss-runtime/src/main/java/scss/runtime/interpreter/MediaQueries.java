package scss.runtime.interpreter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 媒体查询文本的拆分与嵌套合并
 *
 * <p>嵌套的 {@code @media} 与外层按笛卡尔积合并为 {@code outer and inner}，
 * 媒体类型冲突（如 {@code screen} 与 {@code print}）的组合被丢弃。</p>
 */
final class MediaQueries {

    private MediaQueries() {}

    /** 按顶层逗号拆分查询列表 */
    static List<String> split(String text) {
        List<String> result = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                else if (c == '\\') i++;
                continue;
            }
            if (c == '"' || c == '\'') quote = c;
            else if (c == '(') depth++;
            else if (c == ')') depth--;
            else if (c == ',' && depth == 0) {
                addTrimmed(result, text.substring(start, i));
                start = i + 1;
            }
        }
        addTrimmed(result, text.substring(start));
        return result;
    }

    private static void addTrimmed(List<String> result, String query) {
        String trimmed = query.trim().replaceAll("\\s+", " ");
        if (!trimmed.isEmpty()) result.add(trimmed);
    }

    /**
     * 合并外层与内层查询
     *
     * @return 合并结果；全部组合互斥时为空列表
     */
    static List<String> merge(List<String> outer, List<String> inner) {
        if (outer == null) return inner;
        List<String> result = new ArrayList<>();
        for (String o : outer) {
            Query q1 = Query.parse(o);
            for (String i : inner) {
                Query merged = q1.merge(Query.parse(i));
                if (merged != null) {
                    String text = merged.toString();
                    if (!result.contains(text)) result.add(text);
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

    /** {@code [only|not] [type] [and (feature)]*} */
    private static final class Query {
        final String modifier;
        final String type;
        final List<String> features;

        Query(String modifier, String type, List<String> features) {
            this.modifier = modifier;
            this.type = type;
            this.features = features;
        }

        static Query parse(String text) {
            List<String> parts = splitAnd(text);
            String modifier = null;
            String type = null;
            List<String> features = new ArrayList<>();
            for (int i = 0; i < parts.size(); i++) {
                String part = parts.get(i);
                if (i == 0 && !part.startsWith("(")) {
                    String[] words = part.split(" ");
                    if (words.length == 2) {
                        modifier = words[0];
                        type = words[1];
                    } else {
                        type = part;
                    }
                } else {
                    features.add(part);
                }
            }
            return new Query(modifier, type, features);
        }

        private static List<String> splitAnd(String text) {
            List<String> parts = new ArrayList<>();
            int depth = 0;
            int start = 0;
            String lower = text.toLowerCase(Locale.ROOT);
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '(') depth++;
                else if (c == ')') depth--;
                else if (depth == 0 && lower.startsWith(" and ", i)) {
                    parts.add(text.substring(start, i).trim());
                    start = i + 5;
                    i += 4;
                }
            }
            parts.add(text.substring(start).trim());
            return parts;
        }

        Query merge(Query other) {
            String mergedType;
            if (type == null) {
                mergedType = other.type;
            } else if (other.type == null) {
                mergedType = type;
            } else {
                String t1 = type.toLowerCase(Locale.ROOT);
                String t2 = other.type.toLowerCase(Locale.ROOT);
                if (t1.equals(t2) || t2.equals("all")) {
                    mergedType = type;
                } else if (t1.equals("all")) {
                    mergedType = other.type;
                } else {
                    return null;
                }
            }
            String mergedModifier;
            if (modifier == null) {
                mergedModifier = other.modifier;
            } else if (other.modifier == null || modifier.equalsIgnoreCase(other.modifier)) {
                mergedModifier = modifier;
            } else {
                return null;
            }
            List<String> mergedFeatures = new ArrayList<>(features);
            for (String feature : other.features) {
                if (!mergedFeatures.contains(feature)) mergedFeatures.add(feature);
            }
            if (mergedType == null) mergedModifier = null;
            return new Query(mergedModifier, mergedType, mergedFeatures);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            if (type != null) {
                if (modifier != null) sb.append(modifier).append(' ');
                sb.append(type);
            }
            for (String feature : features) {
                if (sb.length() > 0) sb.append(" and ");
                sb.append(feature);
            }
            return sb.toString();
        }
    }
}
