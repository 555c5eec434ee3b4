package com.scsslang.compiler.lexer;

/**
 * CSS 语法中的字符分类
 */
public final class CharClass {

    private CharClass() {}

    public static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || isNewline(c);
    }

    public static boolean isNewline(char c) {
        return c == '\n' || c == '\r' || c == '\f';
    }

    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    public static boolean isHex(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    public static boolean isAlphabetic(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    /** 标识符首字符：字母、下划线或非 ASCII */
    public static boolean isNameStart(char c) {
        return c == '_' || isAlphabetic(c) || c >= 0x80;
    }

    /** 标识符后续字符 */
    public static boolean isName(char c) {
        return isNameStart(c) || isDigit(c) || c == '-';
    }

    public static int hexValue(char c) {
        if (isDigit(c)) return c - '0';
        if (c >= 'a' && c <= 'f') return c - 'a' + 10;
        if (c >= 'A' && c <= 'F') return c - 'A' + 10;
        throw new IllegalArgumentException("Not a hex digit: " + c);
    }

    /** 开括号对应的闭括号 */
    public static char closingBracket(char c) {
        switch (c) {
            case '(': return ')';
            case '[': return ']';
            case '{': return '}';
            default: throw new IllegalArgumentException("Not a bracket: " + c);
        }
    }
}
