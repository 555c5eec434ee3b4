package scss.runtime.selector;

import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.lexer.CharClass;
import com.scsslang.compiler.parser.ParseException;
import scss.runtime.ParseDelegationException;

import java.util.ArrayList;
import java.util.List;

/**
 * 选择器文本解析（插值已求值后的纯文本）
 */
public final class SelectorParser {

    private final String text;
    private final SourceLocation location;
    private final boolean allowParent;
    private final boolean allowPlaceholder;
    private int pos;

    private SelectorParser(String text, SourceLocation location, boolean allowParent, boolean allowPlaceholder) {
        this.text = text;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.allowParent = allowParent;
        this.allowPlaceholder = allowPlaceholder;
    }

    /**
     * 解析选择器列表
     *
     * @param location 选择器所在 span，用于错误报告
     * @throws ParseDelegationException 语法错误
     */
    public static SelectorList parse(String text, SourceLocation location, boolean allowParent,
                                     boolean allowPlaceholder) {
        SelectorParser parser = new SelectorParser(text, location, allowParent, allowPlaceholder);
        SelectorList result = parser.parseList();
        parser.whitespace();
        if (!parser.isDone()) {
            throw parser.error("expected selector.");
        }
        return result;
    }

    public static SelectorList parse(String text) {
        return parse(text, null, true, true);
    }

    /** 解析单个复合选择器（{@code @extend} 目标） */
    public static CompoundSelector parseCompound(String text, SourceLocation location) {
        SelectorParser parser = new SelectorParser(text, location, false, true);
        parser.whitespace();
        CompoundSelector result = parser.compound();
        parser.whitespace();
        if (!parser.isDone()) {
            throw parser.error("expected selector.");
        }
        return result;
    }

    // ============ 语法 ============

    private SelectorList parseList() {
        List<ComplexSelector> components = new ArrayList<>();
        whitespace();
        components.add(complex());
        whitespace();
        while (scan(',')) {
            whitespace();
            if (isDone() || peek() == ',' || peek() == ')') continue;
            components.add(complex());
            whitespace();
        }
        return new SelectorList(components);
    }

    private ComplexSelector complex() {
        List<SelectorComponent> components = new ArrayList<>();
        while (true) {
            whitespace();
            if (isDone()) break;
            char c = peek();
            if (c == ',' || c == ')' || c == '{') break;
            Combinator combinator = Combinator.fromChar(c);
            if (combinator != null) {
                pos++;
                components.add(combinator);
            } else {
                components.add(compound());
            }
        }
        if (components.isEmpty()) {
            throw error("expected selector.");
        }
        return new ComplexSelector(components);
    }

    private CompoundSelector compound() {
        List<SimpleSelector> simples = new ArrayList<>();
        simples.add(simple(true));
        while (!isDone() && isSimpleStart(peek())) {
            simples.add(simple(false));
        }
        return new CompoundSelector(simples);
    }

    private boolean isSimpleStart(char c) {
        switch (c) {
            case '*': case '.': case '#': case '%': case '[': case ':': case '&': case '|': case '\\':
                return true;
            default:
                return CharClass.isNameStart(c) || c == '-';
        }
    }

    private SimpleSelector simple(boolean first) {
        char c = peek();
        switch (c) {
            case '&':
                return parentSelector(first);
            case '.':
                pos++;
                return new ClassSelector(identifier());
            case '#':
                pos++;
                return new IdSelector(identifier());
            case '%':
                if (!allowPlaceholder) throw error("Placeholder selectors aren't allowed here.");
                pos++;
                return new PlaceholderSelector(identifier());
            case '[':
                return attribute();
            case ':':
                return pseudo();
            default:
                return typeOrUniversal();
        }
    }

    private SimpleSelector parentSelector(boolean first) {
        if (!allowParent) throw error("Parent selectors aren't allowed here.");
        if (!first) throw error("\"&\" may only used at the beginning of a compound selector.");
        pos++;
        if (!isDone() && (CharClass.isName(peek()) || peek() == '\\')) {
            return new ParentSelector(identifierSuffix());
        }
        return new ParentSelector(null);
    }

    private SimpleSelector typeOrUniversal() {
        String namespace = null;
        if (scan('*')) {
            if (!scanNamespaceBar()) return new UniversalSelector(null);
            namespace = "*";
        } else if (peek() == '|') {
            pos++;
            namespace = "";
        } else {
            String name = identifier();
            if (!scanNamespaceBar()) return new TypeSelector(null, name);
            namespace = name;
        }
        if (scan('*')) return new UniversalSelector(namespace);
        return new TypeSelector(namespace, identifier());
    }

    /** 扫描命名空间分隔符 {@code |}（不含属性运算符 {@code |=}） */
    private boolean scanNamespaceBar() {
        if (peek() == '|' && peekAt(1) != '=') {
            pos++;
            return true;
        }
        return false;
    }

    private AttributeSelector attribute() {
        pos++;
        whitespace();
        StringBuilder name = new StringBuilder();
        if (scan('*')) {
            name.append('*');
            expect('|');
            name.append('|');
        } else if (peek() == '|') {
            pos++;
            name.append('|');
        }
        name.append(identifier());
        if (scanNamespaceBar()) {
            name.append('|').append(identifier());
        }
        whitespace();
        if (scan(']')) {
            return new AttributeSelector(name.toString(), null, null, null);
        }
        String operator;
        char c = peek();
        if (c == '=') {
            pos++;
            operator = "=";
        } else if ((c == '~' || c == '|' || c == '^' || c == '$' || c == '*') && peekAt(1) == '=') {
            pos += 2;
            operator = c + "=";
        } else {
            throw error("Expected \"]\".");
        }
        whitespace();
        String value;
        if (peek() == '"' || peek() == '\'') {
            value = quotedString();
        } else {
            int start = pos;
            while (!isDone() && peek() != ']' && !CharClass.isWhitespace(peek())) pos++;
            if (start == pos) throw error("Expected identifier.");
            value = text.substring(start, pos);
        }
        whitespace();
        String modifier = null;
        if (CharClass.isAlphabetic(peek())) {
            modifier = String.valueOf(text.charAt(pos++));
            whitespace();
        }
        expect(']');
        return new AttributeSelector(name.toString(), operator, value, modifier);
    }

    private PseudoSelector pseudo() {
        pos++;
        boolean element = scan(':');
        String name = identifier();
        if (!scan('(')) {
            return new PseudoSelector(name, !element, null, null);
        }
        whitespace();
        String normalized = new PseudoSelector(name, true, null, null).getNormalizedName();
        String argument = null;
        SelectorList selector = null;
        if (!element && PseudoSelector.SELECTOR_PSEUDOS.contains(normalized)) {
            if ("nth-child".equals(normalized) || "nth-last-child".equals(normalized)) {
                argument = nthArgument();
                whitespace();
                if (scanIdentifier("of")) {
                    whitespace();
                    selector = parseList();
                }
            } else {
                selector = parseList();
            }
        } else {
            argument = rawArgument();
        }
        whitespace();
        expect(')');
        return new PseudoSelector(name, !element, argument, selector);
    }

    /** {@code An+B} 部分 */
    private String nthArgument() {
        int start = pos;
        while (!isDone() && peek() != ')') {
            if (CharClass.isWhitespace(peek())) {
                int save = pos;
                whitespace();
                if (lookingAtIdentifier("of")) {
                    pos = save;
                    break;
                }
                continue;
            }
            pos++;
        }
        return collapse(text.substring(start, pos));
    }

    /** 平衡括号内的原样参数 */
    private String rawArgument() {
        int start = pos;
        int depth = 0;
        while (!isDone()) {
            char c = peek();
            if (c == '"' || c == '\'') {
                quotedString();
                continue;
            }
            if (c == '(') depth++;
            if (c == ')') {
                if (depth == 0) break;
                depth--;
            }
            pos++;
        }
        return collapse(text.substring(start, pos));
    }

    private static String collapse(String raw) {
        return raw.trim().replaceAll("\\s+", " ");
    }

    private String quotedString() {
        int start = pos;
        char quote = text.charAt(pos++);
        while (!isDone() && peek() != quote) {
            if (peek() == '\\') pos++;
            pos++;
        }
        expect(quote);
        return text.substring(start, pos);
    }

    // ============ 标识符 ============

    /** 标识符，转义序列解码后按规范形式重新转义，{@code .\61} 与 {@code .a} 得到同一名称 */
    private String identifier() {
        StringBuilder sb = new StringBuilder();
        if (scan('-')) {
            sb.append('-');
            if (scan('-')) {
                sb.append('-');
                identifierBody(sb);
                return escapeIdentifier(sb.toString(), false);
            }
        }
        if (isDone() || !(CharClass.isNameStart(peek()) || peek() == '\\')) {
            throw error("Expected identifier.");
        }
        identifierBody(sb);
        return escapeIdentifier(sb.toString(), true);
    }

    private String identifierSuffix() {
        StringBuilder sb = new StringBuilder();
        identifierBody(sb);
        return escapeIdentifier(sb.toString(), false);
    }

    /** 读取名称字符并解码转义，结果是未转义的原始文本 */
    private void identifierBody(StringBuilder sb) {
        while (!isDone()) {
            char c = peek();
            if (c == '\\') {
                pos++;
                escape(sb);
            } else if (CharClass.isName(c)) {
                sb.append(c);
                pos++;
            } else {
                return;
            }
        }
    }

    /** 反斜杠之后：至多 6 位十六进制加一个可选空白，或单个字面字符 */
    private void escape(StringBuilder sb) {
        if (isDone() || CharClass.isNewline(peek())) {
            throw error("Expected escape sequence.");
        }
        if (!CharClass.isHex(peek())) {
            sb.append(text.charAt(pos++));
            return;
        }
        int value = 0;
        for (int i = 0; i < 6 && !isDone() && CharClass.isHex(peek()); i++) {
            value = value * 16 + CharClass.hexValue(text.charAt(pos++));
        }
        if (!isDone() && CharClass.isWhitespace(peek())) {
            if (peek() == '\r' && peekAt(1) == '\n') pos++;
            pos++;
        }
        if (value == 0 || value > Character.MAX_CODE_POINT
                || (value >= Character.MIN_SURROGATE && value <= Character.MAX_SURROGATE)) {
            value = 0xFFFD;
        }
        sb.appendCodePoint(value);
    }

    /**
     * 按 CSS 规则转义标识符文本
     *
     * @param atStart 文本是否位于标识符开头（开头的数字必须转义）
     */
    static String escapeIdentifier(String raw, boolean atStart) {
        StringBuilder sb = new StringBuilder(raw.length());
        int startIndex = atStart ? (raw.startsWith("-") ? 1 : 0) : -1;
        for (int i = 0; i < raw.length(); ) {
            int cp = raw.codePointAt(i);
            int next = i + Character.charCount(cp);
            if (cp < 0x20 || cp == 0x7F || (i == startIndex && cp < 0x80 && CharClass.isDigit((char) cp))) {
                sb.append('\\').append(Integer.toHexString(cp));
                if (next < raw.length() && (CharClass.isHex(raw.charAt(next)) || CharClass.isWhitespace(raw.charAt(next)))) {
                    sb.append(' ');
                }
            } else if (cp >= 0x80 || CharClass.isName((char) cp)) {
                sb.appendCodePoint(cp);
            } else {
                sb.append('\\').append((char) cp);
            }
            i = next;
        }
        return sb.toString();
    }

    private boolean lookingAtIdentifier(String word) {
        if (!text.regionMatches(true, pos, word, 0, word.length())) return false;
        int after = pos + word.length();
        return after >= text.length() || !CharClass.isName(text.charAt(after));
    }

    private boolean scanIdentifier(String word) {
        if (!lookingAtIdentifier(word)) return false;
        pos += word.length();
        return true;
    }

    // ============ 字符 ============

    private boolean isDone() {
        return pos >= text.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekAt(int offset) {
        int index = pos + offset;
        return index < text.length() ? text.charAt(index) : '\0';
    }

    private boolean scan(char c) {
        if (peek() == c && !isDone()) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(char c) {
        if (!scan(c)) throw error("expected \"" + c + "\".");
    }

    private void whitespace() {
        while (!isDone()) {
            char c = peek();
            if (CharClass.isWhitespace(c)) {
                pos++;
            } else if (c == '/' && peekAt(1) == '*') {
                int end = text.indexOf("*/", pos + 2);
                pos = end < 0 ? text.length() : end + 2;
            } else {
                return;
            }
        }
    }

    private ParseDelegationException error(String message) {
        return new ParseDelegationException(new ParseException(message, location));
    }
}
