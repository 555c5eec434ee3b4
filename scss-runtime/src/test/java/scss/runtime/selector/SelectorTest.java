package scss.runtime.selector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import scss.runtime.ExtendTargetException;
import scss.runtime.SassRuntimeException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 选择器解析、嵌套展开、父集判断与 @extend
 */
class SelectorTest {

    private static SelectorList sel(String text) {
        return SelectorParser.parse(text);
    }

    private static String render(SelectorList list) {
        return list.render(false);
    }

    /** 测试用的规则 */
    private static final class Rule implements Extendable {
        private SelectorList selector;
        private final List<String> media;

        Rule(String selector) {
            this(selector, null);
        }

        Rule(String selector, List<String> media) {
            this.selector = sel(selector);
            this.media = media;
        }

        @Override
        public SelectorList getSelector() {
            return selector;
        }

        @Override
        public void setSelector(SelectorList selector) {
            this.selector = selector;
        }

        @Override
        public List<String> getMediaContext() {
            return media;
        }
    }

    private static ExtensionStore extend(String extender, String target) {
        ExtensionStore store = new ExtensionStore();
        store.addExtension(sel(extender), SelectorParser.parseCompound(target, null).getComponents().get(0),
                false, null, null);
        return store;
    }

    // ============ 解析与输出 ============

    @Nested
    @DisplayName("解析与输出")
    class ParseTests {

        @Test
        @DisplayName("组合符与列表")
        void testRender() {
            assertEquals("a > b, .c ~ .d", render(sel("a>b , .c~.d")));
            assertEquals("a>b,.c~.d", sel("a > b, .c ~ .d").render(true));
        }

        @Test
        @DisplayName("十六进制转义解码后按规范形式输出")
        void testHexEscape() {
            assertEquals(".a", render(sel(".\\61")));
            assertEquals(".a", render(sel(".\\000061")));
            assertEquals(".\\31 23", render(sel(".\\31 23")));
            assertEquals(".\\31 23", render(sel(".\\31 2\\33")));
            assertEquals("#\\31x", render(sel("#\\31x")));
            assertEquals(".a .b", render(sel(".\\61  .b")));
        }

        @Test
        @DisplayName("转义后的名称与未转义名称相等")
        void testEscapedEquality() {
            assertEquals(new ClassSelector("a"), sel(".\\61").getComponents().get(0).getLastCompound()
                    .getComponents().get(0));
            assertEquals(".a\\:b", render(sel(".a\\:b")));
            assertEquals(".a\\:b", render(sel(".a\\3a b")));
            assertEquals(".gh", render(sel(".\\g\\h")));
        }

        @Test
        @DisplayName("语法错误")
        void testInvalid() {
            assertThrows(SassRuntimeException.class, () -> sel(".a {"));
        }
    }

    // ============ 嵌套 ============

    @Nested
    @DisplayName("父选择器展开")
    class NestingTests {

        @Test
        @DisplayName("隐式后代组合")
        void testImplicitDescendant() {
            SelectorList resolved = sel(".b, .c").resolveParentSelectors(sel(".a"), true);
            assertEquals(".a .b, .a .c", render(resolved));
        }

        @Test
        @DisplayName("& 替换与后缀")
        void testExplicitParent() {
            assertEquals(".btn:hover", render(sel("&:hover").resolveParentSelectors(sel(".btn"), true)));
            assertEquals(".btn-primary", render(sel("&-primary").resolveParentSelectors(sel(".btn"), true)));
            assertEquals(".x .a, .x .b",
                    render(sel(".x &").resolveParentSelectors(sel(".a, .b"), true)));
        }

        @Test
        @DisplayName("顶层不允许 &")
        void testTopLevelParent() {
            assertThrows(SassRuntimeException.class, () -> sel("&.a").resolveParentSelectors(null, true));
        }

        @Test
        @DisplayName("去掉占位符")
        void testWithoutPlaceholders() {
            assertEquals(".a", render(sel(".a, %b").withoutPlaceholders()));
            assertTrue(sel("%b").withoutPlaceholders().isEmpty());
        }
    }

    // ============ 父集与合并 ============

    @Nested
    @DisplayName("父集与合并")
    class SuperselectorTests {

        @Test
        @DisplayName("父集判断")
        void testSuperselector() {
            assertTrue(sel(".a").isSuperselector(sel(".a.b")));
            assertTrue(sel(".a .b").isSuperselector(sel(".x .a > .b")));
            assertFalse(sel(".a.b").isSuperselector(sel(".a")));
        }

        @Test
        @DisplayName("合并复合选择器")
        void testUnify() {
            assertEquals("a.b", render(sel(".b").unify(sel("a"))));
            assertEquals(".a.b", render(sel(".a").unify(sel(".b"))));
            assertEquals(".b.a", render(sel(".b").unify(sel(".a"))));
            assertEquals(".x .y .a.b, .y .x .a.b", render(sel(".x .a").unify(sel(".y .b"))));
            assertNull(sel("#x").unify(sel("#y")));
        }
    }

    // ============ @extend ============

    @Nested
    @DisplayName("@extend")
    class ExtendTests {

        @Test
        @DisplayName("扩展追加在原选择器之后")
        void testSimpleExtend() {
            Rule rule = new Rule(".a");
            extend(".b", ".a").apply(Collections.singletonList(rule));
            assertEquals(".a, .b", render(rule.getSelector()));
        }

        @Test
        @DisplayName("复合选择器中的目标被替换")
        void testCompoundTarget() {
            Rule rule = new Rule(".a.c > span");
            extend(".b", ".a").apply(Collections.singletonList(rule));
            assertEquals(".a.c > span, .c.b > span", render(rule.getSelector()));
        }

        @Test
        @DisplayName("占位符扩展后可移除")
        void testPlaceholder() {
            Rule rule = new Rule("%msg");
            extend(".a, .b", "%msg").apply(Collections.singletonList(rule));
            assertEquals(".a, .b", render(rule.getSelector().withoutPlaceholders()));
        }

        @Test
        @DisplayName("传递扩展")
        void testTransitive() {
            ExtensionStore store = new ExtensionStore();
            store.addExtension(sel(".b"), new ClassSelector("a"), false, null, null);
            store.addExtension(sel(".c"), new ClassSelector("b"), false, null, null);
            Rule rule = new Rule(".a");
            store.apply(Collections.singletonList(rule));
            assertEquals(".a, .b, .c", render(rule.getSelector()));
        }

        @Test
        @DisplayName("相互扩展能终止")
        void testCycle() {
            ExtensionStore store = new ExtensionStore();
            store.addExtension(sel(".b"), new ClassSelector("a"), false, null, null);
            store.addExtension(sel(".a"), new ClassSelector("b"), false, null, null);
            Rule a = new Rule(".a");
            Rule b = new Rule(".b");
            store.apply(Arrays.asList(a, b));
            assertEquals(".a, .b", render(a.getSelector()));
            assertEquals(".b, .a", render(b.getSelector()));
        }

        @Test
        @DisplayName("重复应用结果不变")
        void testIdempotent() {
            ExtensionStore store = extend(".b", ".a");
            Rule rule = new Rule(".a, .x .a");
            store.apply(Collections.singletonList(rule));
            String once = render(rule.getSelector());
            store.apply(Collections.singletonList(rule));
            assertEquals(once, render(rule.getSelector()));
        }

        @Test
        @DisplayName("目标不存在时报错")
        void testMissingTarget() {
            ExtendTargetException e = assertThrows(ExtendTargetException.class,
                    () -> extend(".b", ".missing").apply(Collections.singletonList(new Rule(".a"))));
            assertTrue(e.getRawMessage().startsWith("The target selector was not found."));
        }

        @Test
        @DisplayName("!optional 目标不存在不报错")
        void testOptionalTarget() {
            ExtensionStore store = new ExtensionStore();
            store.addExtension(sel(".b"), new ClassSelector("missing"), true, null, null);
            Rule rule = new Rule(".a");
            store.apply(Collections.singletonList(rule));
            assertEquals(".a", render(rule.getSelector()));
        }

        @Test
        @DisplayName("不能跨媒体查询扩展")
        void testAcrossMedia() {
            ExtensionStore store = new ExtensionStore();
            store.addExtension(sel(".b"), new ClassSelector("a"), false,
                    Collections.singletonList("print"), null);
            List<Rule> rules = new ArrayList<Rule>();
            rules.add(new Rule(".a"));
            assertThrows(ExtendTargetException.class, () -> store.apply(rules));
        }

        @Test
        @DisplayName("selector-replace 把替换者放在目标的位置")
        void testReplace() {
            assertEquals(".b.c", render(ExtensionStore.replaceList(sel(".a.c"), sel(".a"), sel(".b"))));
            assertEquals(".c.b", render(ExtensionStore.replaceList(sel(".c.a"), sel(".a"), sel(".b"))));
            assertEquals(".x.b.y", render(ExtensionStore.replaceList(sel(".x.a.y"), sel(".a"), sel(".b"))));
            assertEquals("div .p.c", render(ExtensionStore.replaceList(sel("div .a.c"), sel(".a"), sel(".p"))));
        }

        @Test
        @DisplayName("@extend 仍把扩展者追加在末尾")
        void testExtendStillAppends() {
            Rule rule = new Rule(".a.c");
            extend(".b", ".a").apply(Collections.singletonList(rule));
            assertEquals(".a.c, .c.b", render(rule.getSelector()));
        }
    }
}
