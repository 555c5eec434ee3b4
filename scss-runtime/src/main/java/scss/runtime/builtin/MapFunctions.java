package scss.runtime.builtin;

import scss.runtime.SassRuntimeException;
import scss.runtime.value.ListSeparator;
import scss.runtime.value.SassBoolean;
import scss.runtime.value.SassList;
import scss.runtime.value.SassMap;
import scss.runtime.value.SassNull;
import scss.runtime.value.SassValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code sass:map} 与对应的全局函数
 *
 * <p>{@code get}、{@code has-key}、{@code merge}、{@code set} 等支持嵌套键路径。</p>
 */
final class MapFunctions {

    private static final String MODULE = "map";

    private MapFunctions() {}

    /** 路径末端的修改 */
    private interface Modifier {
        SassValue apply(SassValue current);
    }

    static void register(BuiltinRegistry.Builder r) {
        r.global("map-get", r.module(MODULE, "get", "$map, $key, $keys...", (ctx, args) -> {
            SassValue value = args.get(0).assertMap("map");
            for (SassValue key : keyPath(args.get(1), args.get(2))) {
                SassMap map = value.tryMap();
                if (map == null) return SassNull.INSTANCE;
                value = map.get(key);
                if (value == null) return SassNull.INSTANCE;
            }
            return value;
        }));

        r.global("map-has-key", r.module(MODULE, "has-key", "$map, $key, $keys...", (ctx, args) -> {
            SassValue value = args.get(0).assertMap("map");
            for (SassValue key : keyPath(args.get(1), args.get(2))) {
                SassMap map = value.tryMap();
                if (map == null) return SassBoolean.FALSE;
                value = map.get(key);
                if (value == null) return SassBoolean.FALSE;
            }
            return SassBoolean.TRUE;
        }));

        r.global("map-merge", r.module(MODULE, BuiltinFunction.overloaded("merge")
                .overload("$map1, $map2", (ctx, args) ->
                        merge(args.get(0).assertMap("map1"), args.get(1).assertMap("map2")))
                .overload("$map1, $args...", (ctx, args) -> {
                    SassMap map1 = args.get(0).assertMap("map1");
                    List<SassValue> rest = args.get(1).asList();
                    if (rest.isEmpty()) {
                        throw new SassRuntimeException("Expected $args to contain a key.");
                    }
                    if (rest.size() == 1) {
                        throw new SassRuntimeException("Expected $args to contain a map.");
                    }
                    final SassMap map2 = rest.get(rest.size() - 1).assertMap("map2");
                    return modify(map1, rest.subList(0, rest.size() - 1), current -> {
                        SassMap nested = current == null ? null : current.tryMap();
                        return nested == null ? map2 : merge(nested, map2);
                    });
                })
                .build()));

        r.module(MODULE, "deep-merge", "$map1, $map2", (ctx, args) ->
                deepMerge(args.get(0).assertMap("map1"), args.get(1).assertMap("map2")));

        r.module(MODULE, "set", "$map, $args...", (ctx, args) -> {
            SassMap map = args.get(0).assertMap("map");
            List<SassValue> rest = args.get(1).asList();
            if (rest.isEmpty()) {
                throw new SassRuntimeException("Expected $args to contain a key.");
            }
            if (rest.size() == 1) {
                throw new SassRuntimeException("Expected $args to contain a value.");
            }
            final SassValue value = rest.get(rest.size() - 1);
            return modify(map, rest.subList(0, rest.size() - 1), current -> value);
        });

        r.global("map-remove", r.module(MODULE, BuiltinFunction.overloaded("remove")
                .overload("$map", (ctx, args) -> args.get(0).assertMap("map"))
                .overload("$map, $key, $keys...", (ctx, args) -> {
                    SassMap map = args.get(0).assertMap("map");
                    Map<SassValue, SassValue> contents = new LinkedHashMap<SassValue, SassValue>(map.getContents());
                    contents.remove(args.get(1));
                    for (SassValue key : args.get(2).asList()) {
                        contents.remove(key);
                    }
                    return new SassMap(contents);
                })
                .build()));

        r.module(MODULE, "deep-remove", "$map, $key, $keys...", (ctx, args) -> {
            SassMap map = args.get(0).assertMap("map");
            List<SassValue> path = keyPath(args.get(1), args.get(2));
            final SassValue last = path.get(path.size() - 1);
            return modify(map, path.subList(0, path.size() - 1), current -> {
                SassMap nested = current == null ? null : current.tryMap();
                if (nested == null || nested.get(last) == null) {
                    return current;
                }
                Map<SassValue, SassValue> contents = new LinkedHashMap<SassValue, SassValue>(nested.getContents());
                contents.remove(last);
                return new SassMap(contents);
            });
        });

        r.global("map-keys", r.module(MODULE, "keys", "$map", (ctx, args) ->
                commaList(new ArrayList<SassValue>(args.get(0).assertMap("map").getContents().keySet()))));
        r.global("map-values", r.module(MODULE, "values", "$map", (ctx, args) ->
                commaList(new ArrayList<SassValue>(args.get(0).assertMap("map").getContents().values()))));
    }

    private static List<SassValue> keyPath(SassValue key, SassValue keys) {
        List<SassValue> path = new ArrayList<SassValue>();
        path.add(key);
        path.addAll(keys.asList());
        return path;
    }

    private static SassList commaList(List<SassValue> contents) {
        return new SassList(contents, contents.isEmpty() ? ListSeparator.UNDECIDED : ListSeparator.COMMA);
    }

    static SassMap merge(SassMap map1, SassMap map2) {
        Map<SassValue, SassValue> contents = new LinkedHashMap<SassValue, SassValue>(map1.getContents());
        contents.putAll(map2.getContents());
        return new SassMap(contents);
    }

    static SassMap deepMerge(SassMap map1, SassMap map2) {
        if (map1.getContents().isEmpty()) return map2;
        if (map2.getContents().isEmpty()) return map1;
        Map<SassValue, SassValue> contents = new LinkedHashMap<SassValue, SassValue>(map1.getContents());
        for (Map.Entry<SassValue, SassValue> entry : map2.getContents().entrySet()) {
            SassValue existing = contents.get(entry.getKey());
            SassMap existingMap = existing == null ? null : existing.tryMap();
            SassMap newMap = entry.getValue().tryMap();
            if (existingMap != null && newMap != null) {
                contents.put(entry.getKey(), deepMerge(existingMap, newMap));
            } else {
                contents.put(entry.getKey(), entry.getValue());
            }
        }
        return new SassMap(contents);
    }

    /**
     * 沿键路径修改嵌套 map；路径为空时修改 map 本身，中途缺失的层级以空 map 补上
     */
    private static SassMap modify(SassMap map, List<SassValue> path, Modifier modifier) {
        if (path.isEmpty()) {
            SassValue result = modifier.apply(map);
            return result.assertMap("map");
        }
        return modifyNested(map, path, 0, modifier);
    }

    private static SassMap modifyNested(SassMap map, List<SassValue> path, int index, Modifier modifier) {
        SassValue key = path.get(index);
        Map<SassValue, SassValue> contents = new LinkedHashMap<SassValue, SassValue>(map.getContents());
        SassValue current = contents.get(key);
        if (index == path.size() - 1) {
            SassValue result = modifier.apply(current);
            if (result == null) return map;
            contents.put(key, result);
            return new SassMap(contents);
        }
        SassMap nested = current == null ? null : current.tryMap();
        contents.put(key, modifyNested(nested == null ? SassMap.EMPTY : nested, path, index + 1, modifier));
        return new SassMap(contents);
    }
}
