package com.scsslang.compiler.lexer;

import com.scsslang.compiler.ast.SourceLocation;

import java.util.Arrays;

/**
 * 字符级扫描器
 *
 * <p>SCSS 的词法依赖上下文（选择器、属性值、插值各有不同规则），因此解析器直接在字符流上工作，
 * 由本类负责位置跟踪、前瞻与回溯。位置即字符偏移，行列号按需由行首表计算。</p>
 */
public final class Scanner {
    private final String source;
    private final String fileName;
    private final int[] lineStarts;
    private int position;

    public Scanner(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
        this.lineStarts = computeLineStarts(source);
    }

    private static int[] computeLineStarts(String source) {
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            boolean newline = c == '\n' || (c == '\r' && (i + 1 >= source.length() || source.charAt(i + 1) != '\n'))
                    || c == '\f';
            if (newline) {
                if (count == starts.length) starts = Arrays.copyOf(starts, count * 2);
                starts[count++] = i + 1;
            }
        }
        return Arrays.copyOf(starts, count);
    }

    // ============ 基础操作 ============

    public String getSource() {
        return source;
    }

    public String getFileName() {
        return fileName;
    }

    public int getPosition() {
        return position;
    }

    /** 回溯到之前记录的位置 */
    public void reset(int position) {
        if (position < 0 || position > source.length()) {
            throw new IllegalArgumentException("Invalid position: " + position);
        }
        this.position = position;
    }

    public boolean isDone() {
        return position >= source.length();
    }

    /** 当前字符，到达末尾时返回 0 */
    public char peekChar() {
        return peekChar(0);
    }

    public char peekChar(int offset) {
        int index = position + offset;
        if (index < 0 || index >= source.length()) return 0;
        return source.charAt(index);
    }

    public char readChar() {
        if (isDone()) {
            throw new IllegalStateException("Unexpected end of input");
        }
        return source.charAt(position++);
    }

    /** 若当前字符为 c 则消费并返回 true */
    public boolean scanChar(char c) {
        if (peekChar() == c && !isDone()) {
            position++;
            return true;
        }
        return false;
    }

    /** 若当前位置以 text 开头则消费并返回 true */
    public boolean scan(String text) {
        if (source.startsWith(text, position)) {
            position += text.length();
            return true;
        }
        return false;
    }

    /** 忽略大小写匹配 */
    public boolean scanIgnoreCase(String text) {
        if (matchesIgnoreCase(text)) {
            position += text.length();
            return true;
        }
        return false;
    }

    public boolean matches(String text) {
        return source.startsWith(text, position);
    }

    public boolean matchesIgnoreCase(String text) {
        return source.regionMatches(true, position, text, 0, text.length());
    }

    public String substring(int start) {
        return source.substring(start, position);
    }

    public String substring(int start, int end) {
        return source.substring(start, end);
    }

    // ============ 位置 ============

    /** 当前位置（长度为 0） */
    public SourceLocation location() {
        return spanAt(position, 0);
    }

    /** 从 start 到当前位置的 span */
    public SourceLocation spanFrom(int start) {
        return spanAt(start, Math.max(0, position - start));
    }

    public SourceLocation spanAt(int offset, int length) {
        int line = lineIndex(offset);
        int column = offset - lineStarts[line] + 1;
        return new SourceLocation(fileName, line + 1, column, offset, length);
    }

    private int lineIndex(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        return index >= 0 ? index : -index - 2;
    }

    /** 取出第 line 行（从 1 开始）的文本，不含换行符 */
    public String lineText(int line) {
        if (line < 1 || line > lineStarts.length) return "";
        int start = lineStarts[line - 1];
        int end = line < lineStarts.length ? lineStarts[line] : source.length();
        while (end > start && CharClass.isNewline(source.charAt(end - 1))) end--;
        return source.substring(start, end);
    }
}
