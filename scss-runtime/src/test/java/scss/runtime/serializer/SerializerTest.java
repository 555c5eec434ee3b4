package scss.runtime.serializer;

import com.scsslang.compiler.ast.SourceLocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import scss.runtime.OutputStyle;
import scss.runtime.SassTypeException;
import scss.runtime.css.CssComment;
import scss.runtime.css.CssDeclaration;
import scss.runtime.css.CssMediaRule;
import scss.runtime.css.CssStyleRule;
import scss.runtime.css.CssStylesheet;
import scss.runtime.selector.SelectorParser;
import scss.runtime.value.ListSeparator;
import scss.runtime.value.SassList;
import scss.runtime.value.SassMap;
import scss.runtime.value.SassNumber;
import scss.runtime.value.SassString;
import scss.runtime.value.SassValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 值与 CSS 树的文本输出
 */
class SerializerTest {

    private static final SourceLocation SPAN = new SourceLocation("main.scss", 1, 1, 0, 1);

    private static SassValue n(double value) {
        return new SassNumber(value);
    }

    // ============ 数值 ============

    @Nested
    @DisplayName("数字格式")
    class NumberTests {

        @Test
        @DisplayName("整数不带小数")
        void testIntegers() {
            assertEquals("1", ValueSerializer.formatNumber(1.0, 10, false));
            assertEquals("0", ValueSerializer.formatNumber(-0.0, 10, false));
            assertEquals("-3", ValueSerializer.formatNumber(-3.0, 10, false));
        }

        @Test
        @DisplayName("按精度舍入并去掉末尾的 0")
        void testPrecision() {
            assertEquals("0.3", ValueSerializer.formatNumber(0.1 + 0.2, 10, false));
            assertEquals("0.3333333333", ValueSerializer.formatNumber(1.0 / 3, 10, false));
            assertEquals("0.33", ValueSerializer.formatNumber(1.0 / 3, 2, false));
            assertEquals("3", ValueSerializer.formatNumber(2.5, 0, false));
        }

        @Test
        @DisplayName("压缩模式去掉前导 0")
        void testCompressed() {
            assertEquals(".5", ValueSerializer.formatNumber(0.5, 10, true));
            assertEquals("-.5", ValueSerializer.formatNumber(-0.5, 10, true));
        }

        @Test
        @DisplayName("复合单位不是合法 CSS")
        void testComplexUnits() {
            SassNumber area = new SassNumber(4, Arrays.asList("px", "px"), Collections.<String>emptyList());
            assertThrows(SassTypeException.class, area::toCssString);
            assertEquals("4px*px", area.inspect());
        }
    }

    // ============ 字符串与集合 ============

    @Nested
    @DisplayName("字符串、列表与 map")
    class CollectionTests {

        @Test
        @DisplayName("引号选择")
        void testQuote() {
            assertEquals("\"ab\"", ValueSerializer.quote("ab"));
            assertEquals("'a\"b'", ValueSerializer.quote("a\"b"));
            assertEquals("\"a\\a b\"", ValueSerializer.quote("a\nb"));
        }

        @Test
        @DisplayName("列表分隔符")
        void testLists() {
            assertEquals("1, 2", new SassList(Arrays.asList(n(1), n(2)), ListSeparator.COMMA).toCssString());
            assertEquals("1 2", new SassList(Arrays.asList(n(1), n(2)), ListSeparator.SPACE).toCssString());
            assertEquals("[1, 2]",
                    new SassList(Arrays.asList(n(1), n(2)), ListSeparator.COMMA, true).toCssString());
            assertEquals("(1,)", new SassList(Arrays.asList(n(1)), ListSeparator.COMMA).inspect());
            assertEquals("()", SassList.EMPTY.inspect());
        }

        @Test
        @DisplayName("嵌套列表 inspect 加括号")
        void testNestedList() {
            SassList inner = new SassList(Arrays.asList(n(1), n(2)), ListSeparator.SPACE);
            SassList outer = new SassList(Arrays.asList(inner, n(3)), ListSeparator.SPACE);
            assertEquals("(1 2) 3", outer.inspect());
            assertEquals("1 2 3", outer.toCssString());
        }

        @Test
        @DisplayName("map 只能 inspect")
        void testMap() {
            Map<SassValue, SassValue> contents = new LinkedHashMap<SassValue, SassValue>();
            contents.put(SassString.unquoted("a"), n(1));
            SassMap map = new SassMap(contents);
            assertEquals("(a: 1)", map.inspect());
            SassTypeException e = assertThrows(SassTypeException.class, map::toCssString);
            assertEquals("(a: 1) isn't a valid CSS value.", e.getMessage());
        }
    }

    // ============ CSS 树 ============

    @Nested
    @DisplayName("CSS 树")
    class TreeTests {

        private CssStylesheet sample() {
            CssStylesheet sheet = new CssStylesheet(SPAN);
            sheet.addChild(new CssComment("/* c */", SPAN));
            CssStyleRule rule = new CssStyleRule(SelectorParser.parse(".a, .b"), null, SPAN);
            rule.addChild(new CssDeclaration("color", SassString.unquoted("red"), false, SPAN, SPAN));
            rule.addChild(new CssDeclaration("margin", n(0), true, SPAN, SPAN));
            sheet.addChild(rule);
            sheet.addChild(new CssStyleRule(SelectorParser.parse(".empty"), null, SPAN));
            CssMediaRule media = new CssMediaRule(Collections.singletonList("print"), SPAN);
            CssStyleRule inner = new CssStyleRule(SelectorParser.parse(".c"), Collections.singletonList("print"), SPAN);
            inner.addChild(new CssDeclaration("--x", "1px", SPAN));
            media.addChild(inner);
            sheet.addChild(media);
            return sheet;
        }

        @Test
        @DisplayName("展开格式")
        void testExpanded() {
            String css = CssSerializer.serialize(sample(), OutputStyle.EXPANDED, 10, true).getCss();
            assertEquals("/* c */\n\n"
                    + ".a, .b {\n  color: red;\n  margin: 0 !important;\n}\n\n"
                    + "@media print {\n  .c {\n    --x: 1px;\n  }\n}\n", css);
        }

        @Test
        @DisplayName("压缩格式去掉普通注释")
        void testCompressed() {
            String css = CssSerializer.serialize(sample(), OutputStyle.COMPRESSED, 10, true).getCss();
            assertEquals(".a,.b{color:red;margin:0!important}@media print{.c{--x:1px}}", css);
        }

        @Test
        @DisplayName("记录映射")
        void testMappings() {
            CssSerializer.Result result = CssSerializer.serialize(sample(), OutputStyle.EXPANDED, 10, true);
            assertFalse(result.getMappings().isEmpty());
            SourceMapEntry first = result.getMappings().get(0);
            assertEquals(2, first.getGeneratedLine());
            assertEquals(0, first.getGeneratedColumn());
        }
    }

    // ============ source map ============

    @Nested
    @DisplayName("source map")
    class SourceMapTests {

        private String vlq(int value) {
            StringBuilder sb = new StringBuilder();
            SourceMapBuilder.encode(sb, value);
            return sb.toString();
        }

        @Test
        @DisplayName("VLQ 编码")
        void testVlq() {
            assertEquals("A", vlq(0));
            assertEquals("C", vlq(1));
            assertEquals("D", vlq(-1));
            assertEquals("gB", vlq(16));
        }

        @Test
        @DisplayName("JSON 结构")
        void testJson() {
            SourceMapBuilder builder = new SourceMapBuilder(Arrays.asList(
                    new SourceMapEntry(0, 0, SPAN),
                    new SourceMapEntry(1, 2, new SourceLocation("main.scss", 2, 3, 10, 1))));
            String json = builder.file("main.css").build();
            assertEquals("{\"version\":3,\"file\":\"main.css\",\"sources\":[\"main.scss\"],"
                    + "\"names\":[],\"mappings\":\"AAAA;EACE\"}", json);
        }
    }
}
