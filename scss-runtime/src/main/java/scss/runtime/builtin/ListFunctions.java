package scss.runtime.builtin;

import scss.runtime.SassRuntimeException;
import scss.runtime.SassTypeException;
import scss.runtime.value.ListSeparator;
import scss.runtime.value.SassBoolean;
import scss.runtime.value.SassList;
import scss.runtime.value.SassNull;
import scss.runtime.value.SassNumber;
import scss.runtime.value.SassString;
import scss.runtime.value.SassValue;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code sass:list} 与对应的全局函数
 */
final class ListFunctions {

    private static final String MODULE = "list";

    private ListFunctions() {}

    static void register(BuiltinRegistry.Builder r) {
        r.both(MODULE, "length", "$list", (ctx, args) -> new SassNumber(args.get(0).asList().size()));

        r.both(MODULE, "nth", "$list, $n", (ctx, args) -> {
            SassValue list = args.get(0);
            return list.asList().get(list.sassIndexToListIndex(args.get(1), "n"));
        });

        r.both(MODULE, "set-nth", "$list, $n, $value", (ctx, args) -> {
            SassValue list = args.get(0);
            List<SassValue> contents = new ArrayList<SassValue>(list.asList());
            contents.set(list.sassIndexToListIndex(args.get(1), "n"), args.get(2));
            return list(contents, list.getSeparator(), list.isBracketed());
        });

        r.both(MODULE, "join", "$list1, $list2, $separator: auto, $bracketed: auto", (ctx, args) -> {
            SassValue list1 = args.get(0);
            SassValue list2 = args.get(1);
            String separatorName = args.get(2).assertString("separator").getText();
            ListSeparator separator;
            if ("auto".equals(separatorName)) {
                if (list1.getSeparator() != ListSeparator.UNDECIDED) {
                    separator = list1.getSeparator();
                } else if (list2.getSeparator() != ListSeparator.UNDECIDED) {
                    separator = list2.getSeparator();
                } else {
                    separator = ListSeparator.SPACE;
                }
            } else {
                separator = parseSeparator(separatorName);
            }
            SassValue bracketedArg = args.get(3);
            boolean bracketed = isAuto(bracketedArg) ? list1.isBracketed() : bracketedArg.isTruthy();
            List<SassValue> contents = new ArrayList<SassValue>(list1.asList());
            contents.addAll(list2.asList());
            return list(contents, separator, bracketed);
        });

        r.both(MODULE, "append", "$list, $val, $separator: auto", (ctx, args) -> {
            SassValue list = args.get(0);
            String separatorName = args.get(2).assertString("separator").getText();
            ListSeparator separator;
            if ("auto".equals(separatorName)) {
                separator = list.getSeparator() == ListSeparator.UNDECIDED ? ListSeparator.SPACE : list.getSeparator();
            } else {
                separator = parseSeparator(separatorName);
            }
            List<SassValue> contents = new ArrayList<SassValue>(list.asList());
            contents.add(args.get(1));
            return list(contents, separator, list.isBracketed());
        });

        r.both(MODULE, "zip", "$lists...", (ctx, args) -> {
            List<List<SassValue>> lists = new ArrayList<List<SassValue>>();
            int shortest = Integer.MAX_VALUE;
            for (SassValue value : args.get(0).asList()) {
                List<SassValue> contents = value.asList();
                lists.add(contents);
                shortest = Math.min(shortest, contents.size());
            }
            if (lists.isEmpty()) {
                return new SassList(new ArrayList<SassValue>(), ListSeparator.COMMA);
            }
            List<SassValue> result = new ArrayList<SassValue>(shortest);
            for (int i = 0; i < shortest; i++) {
                List<SassValue> tuple = new ArrayList<SassValue>(lists.size());
                for (List<SassValue> contents : lists) {
                    tuple.add(contents.get(i));
                }
                result.add(list(tuple, ListSeparator.SPACE, false));
            }
            return new SassList(result, ListSeparator.COMMA);
        });

        r.both(MODULE, "index", "$list, $value", (ctx, args) -> {
            int index = args.get(0).asList().indexOf(args.get(1));
            return index < 0 ? SassNull.INSTANCE : new SassNumber(index + 1);
        });

        r.global("list-separator", r.module(MODULE, "separator", "$list", (ctx, args) ->
                SassString.unquoted(args.get(0).getSeparator().getSassName())));

        r.both(MODULE, "is-bracketed", "$list", (ctx, args) -> SassBoolean.of(args.get(0).isBracketed()));

        r.module(MODULE, "slash", "$elements...", (ctx, args) -> {
            List<SassValue> elements = args.get(0).asList();
            if (elements.size() < 2) {
                throw new SassRuntimeException("At least two elements are required.");
            }
            return new SassList(elements, ListSeparator.SLASH);
        });
    }

    /** 多于一个元素时未定的分隔符按空格处理 */
    static SassList list(List<SassValue> contents, ListSeparator separator, boolean bracketed) {
        if (separator == ListSeparator.UNDECIDED && contents.size() > 1) {
            separator = ListSeparator.SPACE;
        }
        return new SassList(contents, separator, bracketed);
    }

    private static ListSeparator parseSeparator(String name) {
        ListSeparator separator = ListSeparator.fromSassName(name);
        if (separator == null) {
            throw new SassTypeException("$separator: Must be \"space\", \"comma\", \"slash\", or \"auto\".");
        }
        return separator;
    }

    private static boolean isAuto(SassValue value) {
        return value instanceof SassString && "auto".equals(((SassString) value).getText());
    }
}
