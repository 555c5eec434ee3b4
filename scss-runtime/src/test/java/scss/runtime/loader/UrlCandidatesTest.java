package scss.runtime.loader;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import scss.runtime.LoadException;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 候选文件推导
 */
class UrlCandidatesTest {

    private static String resolve(String path, String... files) {
        Set<String> existing = new HashSet<String>(Arrays.asList(files));
        return UrlCandidates.resolve(path, existing::contains);
    }

    @Test
    @DisplayName("补全扩展名")
    void testExtension() {
        assertEquals("a/b.scss", resolve("a/b", "a/b.scss"));
        assertEquals("a/b.css", resolve("a/b", "a/b.css"));
    }

    @Test
    @DisplayName(".scss 优先于 .css")
    void testScssFirst() {
        assertEquals("b.scss", resolve("b", "b.scss", "b.css"));
    }

    @Test
    @DisplayName("partial")
    void testPartial() {
        assertEquals("a/_b.scss", resolve("a/b", "a/_b.scss"));
        assertEquals("_b.scss", resolve("_b", "_b.scss"));
    }

    @Test
    @DisplayName("index 文件")
    void testIndex() {
        assertEquals("lib/_index.scss", resolve("lib", "lib/_index.scss"));
    }

    @Test
    @DisplayName("带扩展名时不查 index")
    void testExplicitExtension() {
        assertNull(resolve("lib.scss", "lib.scss/index.scss"));
    }

    @Test
    @DisplayName("同一优先级多个候选")
    void testAmbiguous() {
        assertThrows(LoadException.class, () -> resolve("b", "b.scss", "_b.scss"));
    }

    @Test
    @DisplayName("规范化路径")
    void testNormalize() {
        assertEquals("a/c", UrlCandidates.normalize("a/./b/../c"));
        assertEquals("/x/y", UrlCandidates.normalize("/x//y"));
        assertEquals("../a", UrlCandidates.normalize("../a"));
        assertEquals("src/", UrlCandidates.directoryOf("src/main.scss"));
        assertEquals("", UrlCandidates.directoryOf("main.scss"));
    }
}
