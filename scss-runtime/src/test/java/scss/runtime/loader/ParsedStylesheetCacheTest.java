package scss.runtime.loader;

import com.scsslang.compiler.ast.decl.Stylesheet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import scss.runtime.ParseDelegationException;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ParsedStylesheetCache 测试")
class ParsedStylesheetCacheTest {

    @Test
    @DisplayName("同一 url 与源码命中缓存")
    void testHit() {
        ParsedStylesheetCache cache = new ParsedStylesheetCache(16);
        Stylesheet first = cache.parse("a.scss", "a { b: c; }");
        Stylesheet second = cache.parse("a.scss", "a { b: c; }");
        assertThat(second).isSameAs(first);
        assertThat(cache.getStats().getHitCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("源码变化后重新解析")
    void testSourceChange() {
        ParsedStylesheetCache cache = new ParsedStylesheetCache(16);
        Stylesheet first = cache.parse("a.scss", "a { b: c; }");
        Stylesheet second = cache.parse("a.scss", "a { b: d; }");
        assertThat(second).isNotSameAs(first);
    }

    @Test
    @DisplayName("语法错误包装为 ParseDelegationException")
    void testParseError() {
        ParsedStylesheetCache cache = new ParsedStylesheetCache(16);
        assertThatThrownBy(() -> cache.parse("bad.scss", "a {"))
                .isInstanceOf(ParseDelegationException.class);
    }

    @Test
    @DisplayName("清空")
    void testClear() {
        ParsedStylesheetCache cache = new ParsedStylesheetCache(16);
        Stylesheet first = cache.parse("a.scss", "a { b: c; }");
        cache.clear();
        assertThat(cache.parse("a.scss", "a { b: c; }")).isNotSameAs(first);
    }
}
