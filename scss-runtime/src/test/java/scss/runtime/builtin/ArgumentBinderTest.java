package scss.runtime.builtin;

import com.scsslang.compiler.ast.decl.ArgumentDeclaration;
import com.scsslang.compiler.ast.decl.Parameter;
import com.scsslang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import scss.runtime.ArityException;
import scss.runtime.value.ListSeparator;
import scss.runtime.value.SassArgList;
import scss.runtime.value.SassNumber;
import scss.runtime.value.SassString;
import scss.runtime.value.SassValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 实参绑定与元数检查
 */
class ArgumentBinderTest {

    private static final ArgumentBinder.DefaultEvaluator DEFAULTS = new ArgumentBinder.DefaultEvaluator() {
        @Override
        public SassValue evaluateDefault(Parameter parameter) {
            return SassString.unquoted("default-" + parameter.getName());
        }
    };

    private static ArgumentDeclaration declaration(String text) {
        return new Parser(text, "test.scss").parseArgumentDeclaration();
    }

    private static List<SassValue> bind(String signature, List<SassValue> positional, Map<String, SassValue> named) {
        return ArgumentBinder.bind(declaration(signature), positional, named, ListSeparator.UNDECIDED, DEFAULTS);
    }

    private static SassValue n(double value) {
        return new SassNumber(value);
    }

    @Test
    @DisplayName("位置参数与缺省值")
    void testPositionalAndDefaults() {
        List<SassValue> bound = bind("($a, $b: 2)", Arrays.asList(n(1)), Collections.<String, SassValue>emptyMap());
        assertEquals(2, bound.size());
        assertEquals(n(1), bound.get(0));
        assertEquals(SassString.unquoted("default-b"), bound.get(1));
    }

    @Test
    @DisplayName("命名参数按规范化名称匹配")
    void testNamedArguments() {
        Map<String, SassValue> named = new LinkedHashMap<String, SassValue>();
        named.put("main-color", n(7));
        List<SassValue> bound = bind("($main_color)", Collections.<SassValue>emptyList(), named);
        assertEquals(n(7), bound.get(0));
    }

    @Test
    @DisplayName("缺少参数")
    void testMissingArgument() {
        ArityException e = assertThrows(ArityException.class,
                () -> bind("($a, $b)", Arrays.asList(n(1)), Collections.<String, SassValue>emptyMap()));
        assertEquals("Missing argument $b.", e.getMessage());
    }

    @Test
    @DisplayName("参数过多")
    void testTooManyArguments() {
        ArityException e = assertThrows(ArityException.class,
                () -> bind("($a)", Arrays.asList(n(1), n(2)), Collections.<String, SassValue>emptyMap()));
        assertEquals("Only 1 argument allowed, but 2 were passed.", e.getMessage());
    }

    @Test
    @DisplayName("同一参数既按位置又按名称")
    void testPassedTwice() {
        Map<String, SassValue> named = Collections.singletonMap("a", n(2));
        ArityException e = assertThrows(ArityException.class,
                () -> bind("($a)", Arrays.asList(n(1)), named));
        assertEquals("Argument $a was passed both by position and by name.", e.getMessage());
    }

    @Test
    @DisplayName("未知的命名参数")
    void testUnknownNames() {
        Map<String, SassValue> named = new LinkedHashMap<String, SassValue>();
        named.put("x", n(1));
        named.put("y", n(2));
        ArityException e = assertThrows(ArityException.class,
                () -> bind("($a: 0)", Collections.<SassValue>emptyList(), named));
        assertEquals("No arguments named $x or $y.", e.getMessage());
    }

    @Test
    @DisplayName("可变参数收集多余的实参与关键字")
    void testRestParameter() {
        Map<String, SassValue> named = Collections.singletonMap("extra", n(9));
        List<SassValue> bound = bind("($first, $rest...)", Arrays.asList(n(1), n(2), n(3)), named);
        assertEquals(2, bound.size());
        SassArgList rest = (SassArgList) bound.get(1);
        assertEquals(Arrays.asList(n(2), n(3)), rest.asList());
        assertEquals(ListSeparator.COMMA, rest.getSeparator());

        ArityException e = assertThrows(ArityException.class, () -> ArgumentBinder.checkKeywordsUsed(bound));
        assertEquals("No argument named $extra.", e.getMessage());
    }

    @Test
    @DisplayName("matches 与 verify 规则一致")
    void testMatches() {
        ArgumentDeclaration declaration = declaration("($a, $b: 1)");
        assertTrue(ArgumentBinder.matches(declaration, 1, Collections.<String>emptySet()));
        assertTrue(ArgumentBinder.matches(declaration, 1, new HashSet<String>(Arrays.asList("b"))));
        assertFalse(ArgumentBinder.matches(declaration, 0, Collections.<String>emptySet()));
        assertFalse(ArgumentBinder.matches(declaration, 3, Collections.<String>emptySet()));
    }
}
