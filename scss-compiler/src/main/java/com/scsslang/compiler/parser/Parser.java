package com.scsslang.compiler.parser;

import com.scsslang.compiler.ast.Interpolation;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.decl.ArgumentDeclaration;
import com.scsslang.compiler.ast.decl.Stylesheet;
import com.scsslang.compiler.ast.expr.Expression;
import com.scsslang.compiler.ast.expr.VariableExpr;
import com.scsslang.compiler.lexer.CharClass;
import com.scsslang.compiler.lexer.Scanner;

import java.util.ArrayList;
import java.util.List;

/**
 * SCSS 语法分析器（递归下降，字符级）
 *
 * <p>语句解析委托给 {@link StmtParser}，表达式解析委托给 {@link ExprParser}；
 * 本类提供两者共享的空白、注释、标识符、字符串与插值文本读取。</p>
 */
public class Parser {

    final Scanner scanner;
    final String url;

    // === Helper 实例 ===
    final ExprParser exprParser;
    final StmtParser stmtParser;

    public Parser(String source, String url) {
        this.scanner = new Scanner(source, url);
        this.url = url;
        this.exprParser = new ExprParser(this);
        this.stmtParser = new StmtParser(this);
    }

    /** 便捷入口：解析整个样式表 */
    public static Stylesheet parse(String source, String url) {
        return new Parser(source, url).parse();
    }

    /** 解析样式表 */
    public Stylesheet parse() {
        return stmtParser.parseStylesheet();
    }

    /** 解析单个 SassScript 表达式（必须消费全部输入） */
    public Expression parseExpression() {
        whitespace();
        Expression result = exprParser.parseExpression();
        whitespace();
        if (!scanner.isDone()) {
            throw error("Expected end of expression");
        }
        return result;
    }

    /** 解析形如 {@code ($a, $b: 1, $rest...)} 的参数声明（必须消费全部输入） */
    public ArgumentDeclaration parseArgumentDeclaration() {
        whitespace();
        ArgumentDeclaration result = exprParser.parseArgumentDeclaration();
        whitespace();
        if (!scanner.isDone()) {
            throw error("Expected end of argument declaration");
        }
        return result;
    }

    // ============ 错误 ============

    ParseException error(String message) {
        return error(message, scanner.location());
    }

    ParseException error(String message, SourceLocation location) {
        return new ParseException(message, location, null, scanner.lineText(location.getLine()));
    }

    ParseException expected(String what) {
        return new ParseException("Unexpected " + describeCurrent(), scanner.location(), what,
                scanner.lineText(scanner.location().getLine()));
    }

    private String describeCurrent() {
        if (scanner.isDone()) return "end of input";
        return "'" + scanner.peekChar() + "'";
    }

    void expectChar(char c) {
        if (!scanner.scanChar(c)) {
            throw expected("\"" + c + "\"");
        }
    }

    /** 期望关键字（后面不能紧跟标识符字符） */
    void expectKeyword(String keyword) {
        if (!scanKeyword(keyword)) {
            throw expected("\"" + keyword + "\"");
        }
    }

    /** 匹配完整单词（忽略大小写），不消费部分标识符 */
    boolean scanKeyword(String keyword) {
        if (!scanner.matchesIgnoreCase(keyword)) return false;
        char after = scanner.peekChar(keyword.length());
        if (CharClass.isName(after) || after == '\\') return false;
        scanner.reset(scanner.getPosition() + keyword.length());
        return true;
    }

    boolean lookingAtKeyword(String keyword) {
        int start = scanner.getPosition();
        boolean result = scanKeyword(keyword);
        scanner.reset(start);
        return result;
    }

    // ============ 空白与注释 ============

    /** 跳过空白及注释 */
    void whitespace() {
        while (true) {
            whitespaceWithoutComments();
            if (!scanComment()) return;
        }
    }

    /** 跳过空白，返回是否消费了任何内容 */
    boolean whitespaceConsumed() {
        int start = scanner.getPosition();
        whitespace();
        return scanner.getPosition() != start;
    }

    void whitespaceWithoutComments() {
        while (!scanner.isDone() && CharClass.isWhitespace(scanner.peekChar())) {
            scanner.readChar();
        }
    }

    /** 跳过一条注释（静默或可见），返回是否跳过 */
    boolean scanComment() {
        if (scanner.peekChar() != '/') return false;
        char next = scanner.peekChar(1);
        if (next == '/') {
            silentComment();
            return true;
        }
        if (next == '*') {
            int start = scanner.getPosition();
            scanner.scan("/*");
            while (!scanner.scan("*/")) {
                if (scanner.isDone()) throw error("Unterminated comment", scanner.spanAt(start, 2));
                scanner.readChar();
            }
            return true;
        }
        return false;
    }

    void silentComment() {
        scanner.scan("//");
        while (!scanner.isDone() && !CharClass.isNewline(scanner.peekChar())) {
            scanner.readChar();
        }
    }

    // ============ 标识符 ============

    /** 当前位置是否为纯标识符开头 */
    boolean lookingAtIdentifier() {
        return lookingAtIdentifier(0);
    }

    boolean lookingAtIdentifier(int offset) {
        char first = scanner.peekChar(offset);
        if (CharClass.isNameStart(first) || first == '\\') return true;
        if (first != '-') return false;
        char second = scanner.peekChar(offset + 1);
        return CharClass.isNameStart(second) || second == '\\' || second == '-';
    }

    /** 当前位置是否为（可能含插值的）标识符开头 */
    boolean lookingAtInterpolatedIdentifier() {
        char first = scanner.peekChar();
        if (first == '#' && scanner.peekChar(1) == '{') return true;
        if (first == '-') {
            char second = scanner.peekChar(1);
            if (second == '#' && scanner.peekChar(2) == '{') return true;
        }
        return lookingAtIdentifier();
    }

    String identifier() {
        return identifier(false);
    }

    /**
     * 读取纯标识符。unit 模式下不消费后跟数字的 {@code -}（{@code 1px-2px} 为减法）。
     */
    String identifier(boolean unit) {
        if (!lookingAtIdentifier()) {
            throw expected("identifier");
        }
        StringBuilder sb = new StringBuilder();
        if (scanner.scanChar('-')) {
            sb.append('-');
            if (scanner.scanChar('-')) {
                sb.append('-');
                identifierBody(sb, unit);
                return sb.toString();
            }
        }
        char first = scanner.peekChar();
        if (first == '\\') {
            escape(sb);
        } else {
            sb.append(scanner.readChar());
        }
        identifierBody(sb, unit);
        return sb.toString();
    }

    private void identifierBody(StringBuilder sb, boolean unit) {
        while (!scanner.isDone()) {
            char c = scanner.peekChar();
            if (unit && c == '-') {
                char next = scanner.peekChar(1);
                if (CharClass.isDigit(next) || next == '.') return;
            }
            if (CharClass.isName(c)) {
                sb.append(scanner.readChar());
            } else if (c == '\\') {
                escape(sb);
            } else {
                return;
            }
        }
    }

    /** 原样保留标识符中的转义序列 */
    private void escape(StringBuilder sb) {
        sb.append(scanner.readChar());
        if (scanner.isDone()) throw error("Expected escape sequence");
        if (CharClass.isHex(scanner.peekChar())) {
            for (int i = 0; i < 6 && CharClass.isHex(scanner.peekChar()); i++) {
                sb.append(scanner.readChar());
            }
            if (CharClass.isWhitespace(scanner.peekChar())) {
                sb.append(scanner.readChar());
            }
        } else {
            sb.append(scanner.readChar());
        }
    }

    /** 读取可能含 {@code #{}} 插值的标识符 */
    Interpolation interpolatedIdentifier() {
        int start = scanner.getPosition();
        List<Object> parts = new ArrayList<Object>();
        StringBuilder buf = new StringBuilder();
        if (scanner.scanChar('-')) {
            buf.append('-');
            if (scanner.scanChar('-')) {
                buf.append('-');
            }
        }
        char first = scanner.peekChar();
        if (first == '#' && scanner.peekChar(1) == '{') {
            flush(buf, parts);
            parts.add(interpolationExpression());
        } else if (CharClass.isNameStart(first) || first == '\\') {
            if (first == '\\') {
                escape(buf);
            } else {
                buf.append(scanner.readChar());
            }
        } else if (buf.length() != 2) {
            throw expected("identifier");
        }
        while (!scanner.isDone()) {
            char c = scanner.peekChar();
            if (CharClass.isName(c)) {
                buf.append(scanner.readChar());
            } else if (c == '\\') {
                escape(buf);
            } else if (c == '#' && scanner.peekChar(1) == '{') {
                flush(buf, parts);
                parts.add(interpolationExpression());
            } else {
                break;
            }
        }
        flush(buf, parts);
        return new Interpolation(parts, scanner.spanFrom(start));
    }

    /** 读取 {@code $name}，返回不带 $ 的名称 */
    String variableName() {
        expectChar('$');
        return identifier();
    }

    /** 读取 {@code #{expression}} */
    Expression interpolationExpression() {
        int start = scanner.getPosition();
        if (!scanner.scan("#{")) throw expected("\"#{\"");
        whitespace();
        Expression expression = exprParser.parseInterpolated();
        whitespace();
        if (!scanner.scanChar('}')) {
            throw error("Expected \"}\"", scanner.spanFrom(start));
        }
        return expression;
    }

    /** 读取不含插值的带引号字符串，返回内容 */
    String plainQuotedString() {
        char quote = scanner.peekChar();
        if (quote != '"' && quote != '\'') throw expected("string");
        int start = scanner.getPosition();
        Interpolation text = quotedStringText();
        String plain = text.getAsPlain();
        if (plain == null) {
            throw error("Interpolation isn't allowed here", scanner.spanFrom(start));
        }
        return plain;
    }

    /**
     * 读取带引号字符串，解码转义，保留插值。调用时当前字符为引号。
     */
    Interpolation quotedStringText() {
        int start = scanner.getPosition();
        char quote = scanner.readChar();
        List<Object> parts = new ArrayList<Object>();
        StringBuilder buf = new StringBuilder();
        while (true) {
            if (scanner.isDone() || CharClass.isNewline(scanner.peekChar())) {
                throw error("Expected " + quote + ".", scanner.spanFrom(start));
            }
            char c = scanner.peekChar();
            if (c == quote) {
                scanner.readChar();
                break;
            }
            if (c == '\\') {
                scanner.readChar();
                char next = scanner.peekChar();
                if (CharClass.isNewline(next)) {
                    scanner.readChar();
                    if (next == '\r') scanner.scanChar('\n');
                } else if (CharClass.isHex(next)) {
                    int value = 0;
                    for (int i = 0; i < 6 && CharClass.isHex(scanner.peekChar()); i++) {
                        value = value * 16 + CharClass.hexValue(scanner.readChar());
                    }
                    if (CharClass.isWhitespace(scanner.peekChar())) scanner.readChar();
                    buf.appendCodePoint(value == 0 || value > 0x10FFFF ? 0xFFFD : value);
                } else if (scanner.isDone()) {
                    throw error("Expected " + quote + ".", scanner.spanFrom(start));
                } else {
                    buf.append(scanner.readChar());
                }
            } else if (c == '#' && scanner.peekChar(1) == '{') {
                flush(buf, parts);
                parts.add(interpolationExpression());
            } else {
                buf.append(scanner.readChar());
            }
        }
        flush(buf, parts);
        return new Interpolation(parts, scanner.spanFrom(start));
    }

    // ============ 原始文本 ============

    /**
     * 读取原始文本直到深度 0 处遇到 terminators 中的字符（不消费）。
     * 空白折叠为单个空格并去除首尾空白，注释被丢弃，字符串、括号与 {@code url()} 原样保留。
     *
     * @param mediaQuery 为 true 时，括号内 {@code name: value} 的 value 与裸 {@code $var} 按表达式解析
     */
    Interpolation readRaw(String terminators, boolean mediaQuery) {
        int start = scanner.getPosition();
        List<Object> parts = new ArrayList<Object>();
        StringBuilder buf = new StringBuilder();
        StringBuilder brackets = new StringBuilder();
        boolean pendingSpace = false;
        while (!scanner.isDone()) {
            char c = scanner.peekChar();
            if (brackets.length() == 0 && terminators.indexOf(c) >= 0) break;
            if (CharClass.isWhitespace(c)) {
                whitespaceWithoutComments();
                pendingSpace = true;
                continue;
            }
            if (c == '/' && (scanner.peekChar(1) == '*' || scanner.peekChar(1) == '/')) {
                scanComment();
                pendingSpace = true;
                continue;
            }
            if (pendingSpace) {
                if (buf.length() > 0 || !parts.isEmpty()) buf.append(' ');
                pendingSpace = false;
            }
            if (c == '"' || c == '\'') {
                rawQuoted(buf, parts);
            } else if (c == '#' && scanner.peekChar(1) == '{') {
                flush(buf, parts);
                parts.add(interpolationExpression());
            } else if (c == '\\') {
                buf.append(scanner.readChar());
                if (!scanner.isDone()) buf.append(scanner.readChar());
            } else if (c == '(' || c == '[') {
                brackets.append(CharClass.closingBracket(scanner.readChar()));
                buf.append(c);
                if (c == '(' && buf.length() >= 4 && buf.substring(buf.length() - 4).equalsIgnoreCase("url(")) {
                    rawUrlBody(buf, parts);
                    brackets.setLength(brackets.length() - 1);
                }
            } else if (c == ')' || c == ']') {
                if (brackets.length() == 0 || brackets.charAt(brackets.length() - 1) != c) {
                    throw error("Unexpected \"" + c + "\"");
                }
                brackets.setLength(brackets.length() - 1);
                buf.append(scanner.readChar());
            } else if (mediaQuery && c == ':' && brackets.length() > 0) {
                scanner.readChar();
                buf.append(": ");
                whitespace();
                flush(buf, parts);
                parts.add(exprParser.parseExpression());
                whitespace();
            } else if (mediaQuery && c == '$') {
                int varStart = scanner.getPosition();
                String name = variableName();
                flush(buf, parts);
                parts.add(new VariableExpr(scanner.spanFrom(varStart), null, name));
            } else {
                buf.append(scanner.readChar());
            }
        }
        if (brackets.length() > 0) {
            throw error("Expected \"" + brackets.charAt(brackets.length() - 1) + "\"");
        }
        flush(buf, parts);
        return new Interpolation(parts, scanner.spanFrom(start));
    }

    /** 复制带引号字符串的原始文本（含引号与转义），其中插值保留为表达式 */
    private void rawQuoted(StringBuilder buf, List<Object> parts) {
        int start = scanner.getPosition();
        char quote = scanner.readChar();
        buf.append(quote);
        while (true) {
            if (scanner.isDone() || CharClass.isNewline(scanner.peekChar())) {
                throw error("Expected " + quote + ".", scanner.spanFrom(start));
            }
            char c = scanner.peekChar();
            if (c == quote) {
                buf.append(scanner.readChar());
                return;
            }
            if (c == '\\') {
                buf.append(scanner.readChar());
                if (!scanner.isDone()) buf.append(scanner.readChar());
            } else if (c == '#' && scanner.peekChar(1) == '{') {
                flush(buf, parts);
                parts.add(interpolationExpression());
            } else {
                buf.append(scanner.readChar());
            }
        }
    }

    /** 复制 {@code url(} 之后直到匹配 {@code )} 的内容（含右括号） */
    void rawUrlBody(StringBuilder buf, List<Object> parts) {
        int depth = 1;
        while (true) {
            if (scanner.isDone()) throw error("Expected \")\"");
            char c = scanner.peekChar();
            if (c == '"' || c == '\'') {
                rawQuoted(buf, parts);
                continue;
            }
            if (c == '#' && scanner.peekChar(1) == '{') {
                flush(buf, parts);
                parts.add(interpolationExpression());
                continue;
            }
            if (c == '\\') {
                buf.append(scanner.readChar());
                if (!scanner.isDone()) buf.append(scanner.readChar());
                continue;
            }
            if (c == '(') depth++;
            if (c == ')' && --depth == 0) {
                buf.append(scanner.readChar());
                return;
            }
            buf.append(scanner.readChar());
        }
    }

    /**
     * 前瞻：返回深度 0 处最先出现的 {@code {}、{@code ;} 或 {@code }}，到达末尾返回 0。不移动位置。
     */
    char lookaheadTerminator() {
        int start = scanner.getPosition();
        try {
            int depth = 0;
            while (!scanner.isDone()) {
                char c = scanner.peekChar();
                if (c == '/' && (scanner.peekChar(1) == '/' || scanner.peekChar(1) == '*')) {
                    scanComment();
                    continue;
                }
                if (c == '"' || c == '\'') {
                    skipQuoted();
                    continue;
                }
                if (c == '#' && scanner.peekChar(1) == '{') {
                    skipInterpolation();
                    continue;
                }
                if (c == '\\') {
                    scanner.readChar();
                    if (!scanner.isDone()) scanner.readChar();
                    continue;
                }
                if (c == '(' || c == '[') depth++;
                if ((c == ')' || c == ']') && depth > 0) depth--;
                if (depth == 0 && (c == '{' || c == ';' || c == '}')) return c;
                scanner.readChar();
            }
            return 0;
        } finally {
            scanner.reset(start);
        }
    }

    private void skipQuoted() {
        char quote = scanner.readChar();
        while (!scanner.isDone()) {
            char c = scanner.readChar();
            if (c == '\\' && !scanner.isDone()) {
                scanner.readChar();
            } else if (c == quote || CharClass.isNewline(c)) {
                return;
            }
        }
    }

    private void skipInterpolation() {
        scanner.scan("#{");
        int depth = 1;
        while (!scanner.isDone()) {
            char c = scanner.peekChar();
            if (c == '"' || c == '\'') {
                skipQuoted();
                continue;
            }
            scanner.readChar();
            if (c == '{') depth++;
            if (c == '}' && --depth == 0) return;
        }
    }

    static void flush(StringBuilder buf, List<Object> parts) {
        if (buf.length() > 0) {
            parts.add(buf.toString());
            buf.setLength(0);
        }
    }

    /** 去除插值首尾空白（只处理首尾的纯文本片段） */
    static Interpolation trim(Interpolation interpolation) {
        List<Object> parts = new ArrayList<Object>(interpolation.getParts());
        if (!parts.isEmpty() && parts.get(0) instanceof String) {
            parts.set(0, stripLeading((String) parts.get(0)));
        }
        int last = parts.size() - 1;
        if (last >= 0 && parts.get(last) instanceof String) {
            parts.set(last, stripTrailing((String) parts.get(last)));
        }
        return new Interpolation(parts, interpolation.getLocation());
    }

    private static String stripLeading(String s) {
        int i = 0;
        while (i < s.length() && CharClass.isWhitespace(s.charAt(i))) i++;
        return s.substring(i);
    }

    private static String stripTrailing(String s) {
        int i = s.length();
        while (i > 0 && CharClass.isWhitespace(s.charAt(i - 1))) i--;
        return s.substring(0, i);
    }
}
