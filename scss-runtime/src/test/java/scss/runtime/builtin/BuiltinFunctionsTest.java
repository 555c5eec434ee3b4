package scss.runtime.builtin;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import scss.runtime.CompileResult;
import scss.runtime.SassCompiler;
import scss.runtime.loader.InMemoryModuleLoader;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 内置函数测试：通过编译单条声明取值
 */
class BuiltinFunctionsTest {

    private static final SassCompiler COMPILER = new SassCompiler(InMemoryModuleLoader.builder().build());

    /** 编译 {@code a { v: <expr>; }} 并取出 v 的值 */
    private static String eval(String expression) {
        return eval("", expression);
    }

    private static String eval(String prelude, String expression) {
        CompileResult result = COMPILER.compile(prelude + "a { v: " + expression + "; }", "main.scss");
        assertTrue(result.isSuccess(), () -> String.valueOf(result.getError()));
        String css = result.getCss();
        String prefix = "a {\n  v: ";
        assertTrue(css.startsWith(prefix), css);
        return css.substring(prefix.length(), css.indexOf(";\n}"));
    }

    private static String error(String expression) {
        CompileResult result = COMPILER.compile("a { v: " + expression + "; }", "main.scss");
        assertFalse(result.isSuccess());
        return result.getError().getMessage();
    }

    // ============ math ============

    @Nested
    @DisplayName("math")
    class MathTests {

        @Test
        @DisplayName("取整与绝对值")
        void testRounding() {
            assertEquals("3", eval("round(2.5)"));
            assertEquals("2px", eval("ceil(1.2px)"));
            assertEquals("1px", eval("floor(1.8px)"));
            assertEquals("2", eval("abs(-2)"));
        }

        @Test
        @DisplayName("单位相关")
        void testUnits() {
            assertEquals("25%", eval("percentage(0.25)"));
            assertEquals("false", eval("unitless(1px)"));
            assertEquals("true", eval("comparable(1px, 1in)"));
            assertEquals("\"px\"", eval("unit(3px)"));
            assertEquals("$number: Expected 1px to have no units.", error("percentage(1px)"));
        }

        @Test
        @DisplayName("最值与 clamp")
        void testExtremes() {
            assertEquals("3px", eval("max(1px, 3px, 2px)"));
            assertEquals("1px", eval("@use 'sass:math';", "math.min(1px, 3px)"));
            assertEquals("3", eval("@use 'sass:math';", "math.clamp(0, 5, 3)"));
        }

        @Test
        @DisplayName("幂与开方")
        void testPowers() {
            assertEquals("8", eval("@use 'sass:math';", "math.pow(2, 3)"));
            assertEquals("4", eval("@use 'sass:math';", "math.sqrt(16)"));
            assertEquals("5px", eval("@use 'sass:math';", "math.hypot(3px, 4px)"));
        }
    }

    // ============ string ============

    @Nested
    @DisplayName("string")
    class StringTests {

        @Test
        @DisplayName("大小写与引号")
        void testCaseAndQuotes() {
            assertEquals("ABC", eval("to-upper-case(abc)"));
            assertEquals("\"x\"", eval("quote(x)"));
            assertEquals("a b", eval("unquote(\"a b\")"));
        }

        @Test
        @DisplayName("下标从 1 开始")
        void testIndexing() {
            assertEquals("3", eval("str-length(\"abc\")"));
            assertEquals("3", eval("str-index(\"abcd\", \"c\")"));
            assertEquals("\"bc\"", eval("str-slice(\"abcd\", 2, 3)"));
            assertEquals("\"cd\"", eval("str-slice(\"abcd\", -2)"));
            assertEquals("\"abcd\"", eval("str-insert(\"ad\", \"bc\", 2)"));
        }
    }

    // ============ list ============

    @Nested
    @DisplayName("list")
    class ListTests {

        @Test
        @DisplayName("拼接与追加")
        void testJoinAppend() {
            assertEquals("a b c d", eval("join(a b, c d)"));
            assertEquals("a, b", eval("join(a, b, comma)"));
            assertEquals("a, b, c", eval("append((a, b), c)"));
        }

        @Test
        @DisplayName("查询")
        void testQueries() {
            assertEquals("3", eval("index(a b c, c)"));
            assertEquals("comma", eval("list-separator((a, b))"));
            assertEquals("true", eval("is-bracketed([a])"));
            assertEquals("a 1, b 2", eval("zip(a b, 1 2)"));
            assertEquals("a x c", eval("set-nth(a b c, 2, x)"));
        }

        @Test
        @DisplayName("下标越界")
        void testOutOfRange() {
            assertTrue(error("nth(a b, 5)").startsWith("$n: Invalid index 5"));
        }
    }

    // ============ map ============

    @Nested
    @DisplayName("map")
    class MapTests {

        @Test
        @DisplayName("读写与合并")
        void testAccess() {
            assertEquals("a, b", eval("map-keys((a: 1, b: 2))"));
            assertEquals("true", eval("map-has-key((a: 1), a)"));
            assertEquals("2", eval("map-get(map-merge((a: 1), (b: 2)), b)"));
            assertEquals("1", eval("length(map-remove((a: 1, b: 2), a))"));
        }

        @Test
        @DisplayName("嵌套键路径")
        void testNestedKeys() {
            String use = "@use 'sass:map';";
            assertEquals("3", eval(use, "map.get((a: (b: 3)), a, b)"));
            assertEquals("2", eval(use, "map.get(map.deep-merge((a: (b: 1)), (a: (c: 2))), a, c)"));
            assertEquals("1", eval(use, "map.get(map.deep-merge((a: (b: 1)), (a: (c: 2))), a, b)"));
        }
    }

    // ============ color ============

    @Nested
    @DisplayName("color")
    class ColorTests {

        @Test
        @DisplayName("通道")
        void testChannels() {
            assertEquals("16", eval("red(#102030)"));
            assertEquals("48", eval("blue(#102030)"));
            assertEquals("1", eval("alpha(#102030)"));
        }

        @Test
        @DisplayName("构造与变换")
        void testTransforms() {
            assertEquals("rgba(255, 0, 0, 0.5)", eval("rgba(255, 0, 0, 0.5)"));
            assertEquals("red", eval("mix(#f00, #00f, 100%)"));
            assertEquals("black", eval("darken(#fff, 100%)"));
        }
    }

    // ============ selector ============

    @Nested
    @DisplayName("selector")
    class SelectorTests {

        @Test
        @DisplayName("嵌套、拼接与合并")
        void testCombining() {
            assertEquals(".a:hover", eval("selector-nest(\".a\", \"&:hover\")"));
            assertEquals(".a .b", eval("selector-nest(\".a\", \".b\")"));
            assertEquals(".a.b", eval("selector-append(\".a\", \".b\")"));
            assertEquals(".a.b", eval("selector-unify(\".a\", \".b\")"));
        }

        @Test
        @DisplayName("扩展与替换")
        void testExtend() {
            assertEquals(".a, .b", eval("selector-extend(\".a\", \".a\", \".b\")"));
            assertEquals(".c.b", eval("selector-replace(\".a.b\", \".a\", \".c\")"));
            assertEquals("true", eval("is-superselector(\".a\", \".a.b\")"));
            assertEquals(".a, .b", eval("simple-selectors(\".a.b\")"));
        }
    }

    // ============ meta ============

    @Nested
    @DisplayName("meta")
    class MetaTests {

        @Test
        @DisplayName("存在性检查")
        void testExists() {
            assertEquals("true", eval("function-exists(lighten)"));
            assertEquals("false", eval("function-exists(nope)"));
            assertEquals("true", eval("$x: 1;", "variable-exists(x)"));
            assertEquals("true", eval("@mixin m { }", "mixin-exists(m)"));
            assertEquals("true", eval("feature-exists(at-error)"));
        }

        @Test
        @DisplayName("函数引用与 call()")
        void testCall() {
            assertEquals("2", eval("call(get-function(str-length), \"ab\")"));
            assertEquals("6", eval("@function triple($n) { @return $n * 3; }", "call(get-function(triple), 2)"));
        }

        @Test
        @DisplayName("类型名")
        void testTypeOf() {
            assertEquals("map", eval("type-of((a: 1))"));
            assertEquals("list", eval("type-of(1 2)"));
            assertEquals("string", eval("type-of(a)"));
            assertEquals("bool", eval("type-of(true)"));
        }
    }
}
