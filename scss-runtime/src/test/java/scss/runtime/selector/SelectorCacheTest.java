package scss.runtime.selector;

import com.scsslang.compiler.ast.SourceLocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import scss.runtime.ParseDelegationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 选择器解析缓存
 */
class SelectorCacheTest {

    private static final SourceLocation FIRST = new SourceLocation("first.scss", 3, 1, 20, 2);
    private static final SourceLocation SECOND = new SourceLocation("second.scss", 7, 5, 80, 2);

    @Test
    @DisplayName("不同文件中的同一选择器文本共享解析结果")
    void testSharedAcrossFiles() {
        SelectorCache cache = new SelectorCache(16);
        SelectorList first = cache.parse(".a > .b", FIRST, true, true);
        SelectorList second = cache.parse(".a > .b", SECOND, true, true);
        assertSame(first, second);
        assertEquals(".a > .b", second.render(false));
        assertEquals(1L, cache.getStats().getHitCount());
    }

    @Test
    @DisplayName("解析选项不同不共享")
    void testOptionsAreKeyed() {
        SelectorCache cache = new SelectorCache(16);
        cache.parse("%p", FIRST, true, true);
        assertThrows(ParseDelegationException.class, () -> cache.parse("%p", FIRST, true, false));
    }

    @Test
    @DisplayName("语法错误不缓存，位置取本次调用")
    void testErrorsUseCallerLocation() {
        SelectorCache cache = new SelectorCache(16);
        ParseDelegationException first = assertThrows(ParseDelegationException.class,
                () -> cache.parse(".a {", FIRST, true, true));
        ParseDelegationException second = assertThrows(ParseDelegationException.class,
                () -> cache.parse(".a {", SECOND, true, true));
        assertEquals("first.scss", first.getParseException().getLocation().getFile());
        assertEquals("second.scss", second.getParseException().getLocation().getFile());
    }
}
