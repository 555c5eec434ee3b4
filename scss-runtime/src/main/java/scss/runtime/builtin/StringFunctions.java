package scss.runtime.builtin;

import scss.runtime.value.SassNull;
import scss.runtime.value.SassNumber;
import scss.runtime.value.SassString;
import scss.runtime.value.SassValue;

/**
 * {@code sass:string} 与对应的全局函数
 *
 * <p>下标按 Unicode 码点计，从 1 开始，负数从尾部计。</p>
 */
final class StringFunctions {

    private static final String MODULE = "string";

    private StringFunctions() {}

    static void register(BuiltinRegistry.Builder r) {
        r.both(MODULE, "quote", "$string", (ctx, args) ->
                SassString.quoted(args.get(0).assertString("string").getText()));
        r.both(MODULE, "unquote", "$string", (ctx, args) ->
                SassString.unquoted(args.get(0).assertString("string").getText()));

        r.global("str-length", r.module(MODULE, "length", "$string", (ctx, args) ->
                new SassNumber(args.get(0).assertString("string").sassLength())));

        r.global("str-index", r.module(MODULE, "index", "$string, $substring", (ctx, args) -> {
            String text = args.get(0).assertString("string").getText();
            String substring = args.get(1).assertString("substring").getText();
            int index = text.indexOf(substring);
            if (index < 0) return SassNull.INSTANCE;
            return new SassNumber(text.codePointCount(0, index) + 1);
        }));

        r.global("str-insert", r.module(MODULE, "insert", "$string, $insert, $index", (ctx, args) -> {
            SassString string = args.get(0).assertString("string");
            String insert = args.get(1).assertString("insert").getText();
            int index = args.get(2).assertNumber("index").assertInt("index");
            int length = string.sassLength();
            if (index < 0) {
                index = length + index + 2;
            }
            int codePoint = codePointForIndex(index, length, false);
            String text = string.getText();
            int offset = text.offsetByCodePoints(0, codePoint);
            return new SassString(text.substring(0, offset) + insert + text.substring(offset), string.isQuoted());
        }));

        r.global("str-slice", r.module(MODULE, "slice", "$string, $start-at, $end-at: -1", (ctx, args) -> {
            SassString string = args.get(0).assertString("string");
            int start = args.get(1).assertNumber("start-at").assertInt("start-at");
            int end = args.get(2).assertNumber("end-at").assertInt("end-at");
            int length = string.sassLength();
            if (length == 0 || end == 0) {
                return new SassString("", string.isQuoted());
            }
            int startCodePoint = codePointForIndex(start, length, false);
            int endCodePoint = codePointForIndex(end, length, true);
            if (endCodePoint == length) endCodePoint--;
            if (endCodePoint < startCodePoint) {
                return new SassString("", string.isQuoted());
            }
            String text = string.getText();
            return new SassString(text.substring(text.offsetByCodePoints(0, startCodePoint),
                    text.offsetByCodePoints(0, endCodePoint + 1)), string.isQuoted());
        }));

        r.both(MODULE, "to-upper-case", "$string", (ctx, args) -> {
            SassString string = args.get(0).assertString("string");
            return new SassString(asciiCase(string.getText(), true), string.isQuoted());
        });
        r.both(MODULE, "to-lower-case", "$string", (ctx, args) -> {
            SassString string = args.get(0).assertString("string");
            return new SassString(asciiCase(string.getText(), false), string.isQuoted());
        });

        r.both(MODULE, "unique-id", "", (ctx, args) -> SassString.unquoted(ctx.getRandom().nextUniqueId()));
    }

    /** Sass 下标转码点下标 */
    static int codePointForIndex(int index, int length, boolean allowNegative) {
        if (index == 0) return 0;
        if (index > 0) return Math.min(index - 1, length);
        int result = length + index;
        if (result < 0 && !allowNegative) return 0;
        return result;
    }

    private static String asciiCase(String text, boolean upper) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (upper && c >= 'a' && c <= 'z') {
                c = (char) (c - 32);
            } else if (!upper && c >= 'A' && c <= 'Z') {
                c = (char) (c + 32);
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
