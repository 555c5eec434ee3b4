package com.scsslang.compiler.parser;

import com.scsslang.compiler.ast.Interpolation;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.decl.ArgumentDeclaration;
import com.scsslang.compiler.ast.decl.ArgumentInvocation;
import com.scsslang.compiler.ast.decl.Parameter;
import com.scsslang.compiler.ast.expr.*;
import com.scsslang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.scsslang.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.scsslang.compiler.lexer.CharClass;
import com.scsslang.compiler.lexer.NamedColors;
import com.scsslang.compiler.lexer.Scanner;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 表达式解析器
 *
 * <p>优先级从低到高：逗号列表 → 空格列表 → or → and → 相等 → 比较 → 加减 → 乘除模 → 一元 → 基本表达式。</p>
 */
final class ExprParser {

    /** 参数按原始文本保留的函数 */
    private static final Set<String> RAW_FUNCTIONS = new HashSet<String>(Arrays.asList(
            "calc", "-webkit-calc", "-moz-calc", "element", "expression", "url"));

    private final Parser parser;
    private final Scanner scanner;
    private Set<String> stopWords = Collections.emptySet();

    ExprParser(Parser parser) {
        this.parser = parser;
        this.scanner = parser.scanner;
    }

    // ============ 列表 ============

    /** 完整表达式（允许逗号列表） */
    Expression parseExpression() {
        int start = scanner.getPosition();
        Expression first = parseSpaceList();
        parser.whitespace();
        if (scanner.peekChar() != ',') return first;
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (scanner.scanChar(',')) {
            parser.whitespace();
            if (!lookingAtExpression()) break;
            elements.add(parseSpaceList());
            parser.whitespace();
        }
        return new ListExpr(scanner.spanFrom(start), elements, ListExpr.Separator.COMMA, false);
    }

    /** 表达式，遇到给定关键字时停止（{@code @for ... through}） */
    Expression parseExpressionUntil(Set<String> words) {
        Set<String> saved = stopWords;
        stopWords = words;
        try {
            return parseExpression();
        } finally {
            stopWords = saved;
        }
    }

    /** {@code #{}} 内的表达式不受外层停止词影响 */
    Expression parseInterpolated() {
        return parseExpressionUntil(Collections.<String>emptySet());
    }

    /** 空格分隔的列表（不含逗号） */
    Expression parseSpaceList() {
        int start = scanner.getPosition();
        Expression first = parseOr();
        List<Expression> elements = null;
        while (true) {
            int save = scanner.getPosition();
            parser.whitespace();
            if (!lookingAtExpression()) {
                scanner.reset(save);
                break;
            }
            if (elements == null) {
                elements = new ArrayList<Expression>();
                elements.add(first);
            }
            elements.add(parseOr());
        }
        if (elements == null) return first;
        return new ListExpr(scanner.spanFrom(start), elements, ListExpr.Separator.SPACE, false);
    }

    /** 当前位置能否开始一个新的列表元素 */
    boolean lookingAtExpression() {
        char c = scanner.peekChar();
        if (scanner.isDone()) return false;
        switch (c) {
            case '.':
                return CharClass.isDigit(scanner.peekChar(1));
            case '!':
                return lookingAtImportant();
            case '+':
                return CharClass.isDigit(scanner.peekChar(1)) || scanner.peekChar(1) == '.';
            case '-':
            case '#':
            case '"':
            case '\'':
            case '(':
            case '[':
            case '$':
            case '&':
            case '\\':
                return true;
            default:
                if (CharClass.isDigit(c)) return true;
                if (CharClass.isNameStart(c)) {
                    for (String word : stopWords) {
                        if (parser.lookingAtKeyword(word)) return false;
                    }
                    return true;
                }
                return false;
        }
    }

    private boolean lookingAtImportant() {
        int start = scanner.getPosition();
        try {
            scanner.scanChar('!');
            parser.whitespace();
            return parser.scanKeyword("important");
        } finally {
            scanner.reset(start);
        }
    }

    // ============ 二元运算 ============

    private Expression parseOr() {
        Expression left = parseAnd();
        while (true) {
            int save = scanner.getPosition();
            parser.whitespace();
            if (!parser.scanKeyword("or")) {
                scanner.reset(save);
                return left;
            }
            parser.whitespace();
            left = binary(left, BinaryOp.OR, parseAnd());
        }
    }

    private Expression parseAnd() {
        Expression left = parseEquality();
        while (true) {
            int save = scanner.getPosition();
            parser.whitespace();
            if (!parser.scanKeyword("and")) {
                scanner.reset(save);
                return left;
            }
            parser.whitespace();
            left = binary(left, BinaryOp.AND, parseEquality());
        }
    }

    private Expression parseEquality() {
        Expression left = parseRelational();
        while (true) {
            int save = scanner.getPosition();
            parser.whitespace();
            BinaryOp op;
            if (scanner.scan("==")) {
                op = BinaryOp.EQ;
            } else if (scanner.scan("!=")) {
                op = BinaryOp.NE;
            } else {
                scanner.reset(save);
                return left;
            }
            parser.whitespace();
            left = binary(left, op, parseRelational());
        }
    }

    private Expression parseRelational() {
        Expression left = parseAdditive();
        while (true) {
            int save = scanner.getPosition();
            parser.whitespace();
            BinaryOp op;
            if (scanner.scan("<=")) {
                op = BinaryOp.LE;
            } else if (scanner.scan(">=")) {
                op = BinaryOp.GE;
            } else if (scanner.scanChar('<')) {
                op = BinaryOp.LT;
            } else if (scanner.scanChar('>')) {
                op = BinaryOp.GT;
            } else {
                scanner.reset(save);
                return left;
            }
            parser.whitespace();
            left = binary(left, op, parseAdditive());
        }
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (true) {
            int save = scanner.getPosition();
            boolean spaceBefore = parser.whitespaceConsumed();
            char c = scanner.peekChar();
            if (c != '+' && c != '-') {
                scanner.reset(save);
                return left;
            }
            char next = scanner.peekChar(1);
            // "1 -2" 是两个元素的空格列表，"1 - 2" 与 "1-2" 是减法
            if (spaceBefore && !CharClass.isWhitespace(next)
                    && (CharClass.isDigit(next) || next == '.' || next == '$' || next == '(' || c == '-')) {
                scanner.reset(save);
                return left;
            }
            if (c == '-' && !spaceBefore && (CharClass.isNameStart(next) || next == '-')) {
                scanner.reset(save);
                return left;
            }
            scanner.readChar();
            parser.whitespace();
            left = binary(left, c == '+' ? BinaryOp.ADD : BinaryOp.SUB, parseMultiplicative());
        }
    }

    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (true) {
            int save = scanner.getPosition();
            parser.whitespace();
            char c = scanner.peekChar();
            BinaryOp op;
            if (c == '*') {
                op = BinaryOp.MUL;
            } else if (c == '/' && scanner.peekChar(1) != '/' && scanner.peekChar(1) != '*') {
                op = BinaryOp.DIV;
            } else if (c == '%') {
                op = BinaryOp.MOD;
            } else {
                scanner.reset(save);
                return left;
            }
            scanner.readChar();
            parser.whitespace();
            Expression right = parseUnary();
            if (op == BinaryOp.DIV && isSlashOperand(left) && isSlashOperand(right)) {
                left = new BinaryExpr(left.getLocation().extendTo(right.getLocation()), left, op, right, true);
            } else {
                left = binary(left, op, right);
            }
        }
    }

    /** 数值字面量或仍保留斜杠的除法可组成 {@code 1/2/3} 形式 */
    private static boolean isSlashOperand(Expression expression) {
        if (expression instanceof NumberLiteral) return true;
        return expression instanceof BinaryExpr && ((BinaryExpr) expression).allowsSlash();
    }

    private static Expression binary(Expression left, BinaryOp op, Expression right) {
        return new BinaryExpr(left.getLocation().extendTo(right.getLocation()),
                withoutSlash(left), op, withoutSlash(right));
    }

    static Expression withoutSlash(Expression expression) {
        if (expression instanceof BinaryExpr) {
            return ((BinaryExpr) expression).withoutSlash();
        }
        return expression;
    }

    // ============ 一元 ============

    private Expression parseUnary() {
        int start = scanner.getPosition();
        char c = scanner.peekChar();
        char next = scanner.peekChar(1);
        if (c == '-') {
            if (CharClass.isDigit(next) || (next == '.' && CharClass.isDigit(scanner.peekChar(2)))) {
                return number();
            }
            if (parser.lookingAtInterpolatedIdentifier()) {
                return identifierLike();
            }
            scanner.readChar();
            parser.whitespace();
            Expression operand = parseUnary();
            return new UnaryExpr(scanner.spanFrom(start), UnaryOp.MINUS, operand);
        }
        if (c == '+') {
            if (CharClass.isDigit(next) || (next == '.' && CharClass.isDigit(scanner.peekChar(2)))) {
                return number();
            }
            scanner.readChar();
            parser.whitespace();
            Expression operand = parseUnary();
            return new UnaryExpr(scanner.spanFrom(start), UnaryOp.PLUS, operand);
        }
        if (c == '/') {
            scanner.readChar();
            parser.whitespace();
            Expression operand = parseUnary();
            return new UnaryExpr(scanner.spanFrom(start), UnaryOp.DIVIDE, operand);
        }
        if (parser.lookingAtKeyword("not") && !isFunctionCallAhead("not")) {
            parser.scanKeyword("not");
            parser.whitespace();
            Expression operand = parseUnary();
            return new UnaryExpr(scanner.spanFrom(start), UnaryOp.NOT, operand);
        }
        return parsePrimary();
    }

    private boolean isFunctionCallAhead(String name) {
        return scanner.peekChar(name.length()) == '(';
    }

    // ============ 基本表达式 ============

    private Expression parsePrimary() {
        char c = scanner.peekChar();
        if (scanner.isDone()) throw parser.expected("expression");
        switch (c) {
            case '(':
                return parenthesized();
            case '[':
                return bracketedList();
            case '"':
            case '\'': {
                int start = scanner.getPosition();
                Interpolation text = parser.quotedStringText();
                return new StringExpr(scanner.spanFrom(start), text, true);
            }
            case '#':
                if (scanner.peekChar(1) == '{') return identifierLike();
                return hexColor();
            case '$':
                return variable(null, scanner.getPosition());
            case '&': {
                int start = scanner.getPosition();
                scanner.readChar();
                return new ParentSelectorExpr(scanner.spanFrom(start));
            }
            case '!':
                return important();
            case '.':
                return number();
            default:
                if (CharClass.isDigit(c)) return number();
                if (parser.lookingAtInterpolatedIdentifier()) return identifierLike();
                throw parser.expected("expression");
        }
    }

    private Expression important() {
        int start = scanner.getPosition();
        parser.expectChar('!');
        parser.whitespace();
        parser.expectKeyword("important");
        SourceLocation span = scanner.spanFrom(start);
        return new StringExpr(span, Interpolation.plain("!important", span), false);
    }

    private Expression variable(String namespace, int start) {
        String name = parser.variableName();
        return new VariableExpr(scanner.spanFrom(start), namespace, name);
    }

    private Expression parenthesized() {
        int start = scanner.getPosition();
        Set<String> saved = stopWords;
        stopWords = Collections.emptySet();
        try {
            parser.expectChar('(');
            parser.whitespace();
            if (scanner.scanChar(')')) {
                return new ListExpr(scanner.spanFrom(start), Collections.<Expression>emptyList(),
                        ListExpr.Separator.UNDECIDED, false);
            }
            Expression first = parseSpaceList();
            parser.whitespace();
            if (scanner.scanChar(':')) {
                return map(start, first);
            }
            if (scanner.peekChar() == ',') {
                List<Expression> elements = new ArrayList<Expression>();
                elements.add(first);
                while (scanner.scanChar(',')) {
                    parser.whitespace();
                    if (scanner.peekChar() == ')') break;
                    elements.add(parseSpaceList());
                    parser.whitespace();
                }
                parser.expectChar(')');
                return new ListExpr(scanner.spanFrom(start), elements, ListExpr.Separator.COMMA, false);
            }
            parser.expectChar(')');
            return new ParenthesizedExpr(scanner.spanFrom(start), withoutSlash(first));
        } finally {
            stopWords = saved;
        }
    }

    private Expression map(int start, Expression firstKey) {
        List<Expression> keys = new ArrayList<Expression>();
        List<Expression> values = new ArrayList<Expression>();
        parser.whitespace();
        keys.add(firstKey);
        values.add(parseSpaceList());
        parser.whitespace();
        while (scanner.scanChar(',')) {
            parser.whitespace();
            if (scanner.peekChar() == ')') break;
            keys.add(parseSpaceList());
            parser.whitespace();
            parser.expectChar(':');
            parser.whitespace();
            values.add(parseSpaceList());
            parser.whitespace();
        }
        parser.expectChar(')');
        return new MapExpr(scanner.spanFrom(start), keys, values);
    }

    private Expression bracketedList() {
        int start = scanner.getPosition();
        Set<String> saved = stopWords;
        stopWords = Collections.emptySet();
        try {
            parser.expectChar('[');
            parser.whitespace();
            if (scanner.scanChar(']')) {
                return new ListExpr(scanner.spanFrom(start), Collections.<Expression>emptyList(),
                        ListExpr.Separator.UNDECIDED, true);
            }
            Expression inner = parseExpression();
            parser.whitespace();
            parser.expectChar(']');
            SourceLocation span = scanner.spanFrom(start);
            if (inner instanceof ListExpr && !((ListExpr) inner).isBracketed()) {
                ListExpr list = (ListExpr) inner;
                return new ListExpr(span, list.getElements(), list.getSeparator(), true);
            }
            return new ListExpr(span, Collections.singletonList(inner), ListExpr.Separator.UNDECIDED, true);
        } finally {
            stopWords = saved;
        }
    }

    private Expression number() {
        int start = scanner.getPosition();
        StringBuilder sb = new StringBuilder();
        if (scanner.peekChar() == '+' || scanner.peekChar() == '-') {
            sb.append(scanner.readChar());
        }
        while (CharClass.isDigit(scanner.peekChar())) {
            sb.append(scanner.readChar());
        }
        if (scanner.peekChar() == '.' && CharClass.isDigit(scanner.peekChar(1))) {
            sb.append(scanner.readChar());
            while (CharClass.isDigit(scanner.peekChar())) {
                sb.append(scanner.readChar());
            }
        }
        char e = scanner.peekChar();
        if (e == 'e' || e == 'E') {
            char next = scanner.peekChar(1);
            if (CharClass.isDigit(next)
                    || ((next == '+' || next == '-') && CharClass.isDigit(scanner.peekChar(2)))) {
                sb.append(scanner.readChar());
                sb.append(scanner.readChar());
                while (CharClass.isDigit(scanner.peekChar())) {
                    sb.append(scanner.readChar());
                }
            }
        }
        if (sb.length() == 0 || "+".contentEquals(sb) || "-".contentEquals(sb)) {
            throw parser.expected("number");
        }
        double value = Double.parseDouble(sb.toString());
        String unit = null;
        if (scanner.scanChar('%')) {
            unit = "%";
        } else if (parser.lookingAtIdentifier() && !(scanner.peekChar() == '-' && scanner.peekChar(1) == '-')) {
            unit = parser.identifier(true);
        }
        return new NumberLiteral(scanner.spanFrom(start), value, unit);
    }

    private Expression hexColor() {
        int start = scanner.getPosition();
        parser.expectChar('#');
        int digitsStart = scanner.getPosition();
        while (CharClass.isHex(scanner.peekChar())) {
            scanner.readChar();
        }
        String digits = scanner.substring(digitsStart);
        if (CharClass.isName(scanner.peekChar())
                || (digits.length() != 3 && digits.length() != 4 && digits.length() != 6 && digits.length() != 8)) {
            throw parser.error("Expected hex digit.", scanner.spanFrom(start));
        }
        int r, g, b;
        double alpha = 1;
        if (digits.length() <= 4) {
            r = CharClass.hexValue(digits.charAt(0)) * 17;
            g = CharClass.hexValue(digits.charAt(1)) * 17;
            b = CharClass.hexValue(digits.charAt(2)) * 17;
            if (digits.length() == 4) alpha = CharClass.hexValue(digits.charAt(3)) * 17 / 255.0;
        } else {
            r = Integer.parseInt(digits.substring(0, 2), 16);
            g = Integer.parseInt(digits.substring(2, 4), 16);
            b = Integer.parseInt(digits.substring(4, 6), 16);
            if (digits.length() == 8) alpha = Integer.parseInt(digits.substring(6, 8), 16) / 255.0;
        }
        return new ColorLiteral(scanner.spanFrom(start), r, g, b, alpha, scanner.substring(start));
    }

    /** 标识符开头：关键字字面量、颜色名、函数调用、命名空间成员或不带引号的字符串 */
    private Expression identifierLike() {
        int start = scanner.getPosition();
        Interpolation ident = parser.interpolatedIdentifier();
        String plain = ident.getAsPlain();
        if (plain == null) {
            if (scanner.peekChar() == '(') {
                ArgumentInvocation args = parseArgumentInvocation();
                return new InterpolatedFunctionExpr(scanner.spanFrom(start), ident, args);
            }
            return new StringExpr(scanner.spanFrom(start), ident, false);
        }

        String lower = plain.toLowerCase(Locale.ROOT);
        char next = scanner.peekChar();
        if (next == '(') {
            if (RAW_FUNCTIONS.contains(lower) && !(lower.equals("url") && isQuotedUrl())) {
                return rawFunction(start, plain);
            }
            if (plain.equals("if")) {
                return new IfExpr(scanner.spanFrom(start), parseArgumentInvocation());
            }
            ArgumentInvocation args = parseArgumentInvocation();
            return new FunctionCallExpr(scanner.spanFrom(start), null, plain, args);
        }
        if (next == '.' && !plain.startsWith("-")) {
            char after = scanner.peekChar(1);
            if (after == '$') {
                scanner.readChar();
                return variable(plain, start);
            }
            if (CharClass.isNameStart(after)) {
                int save = scanner.getPosition();
                scanner.readChar();
                String member = parser.identifier();
                if (scanner.peekChar() == '(') {
                    ArgumentInvocation args = parseArgumentInvocation();
                    return new FunctionCallExpr(scanner.spanFrom(start), plain, member, args);
                }
                scanner.reset(save);
            }
        }

        SourceLocation span = scanner.spanFrom(start);
        if (plain.equals("true")) return new BooleanLiteral(span, true);
        if (plain.equals("false")) return new BooleanLiteral(span, false);
        if (plain.equals("null")) return new NullLiteral(span);
        Integer rgb = NamedColors.lookup(plain);
        if (rgb != null) {
            return new ColorLiteral(span, (rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF, 1, plain);
        }
        return new StringExpr(span, ident, false);
    }

    private boolean isQuotedUrl() {
        int save = scanner.getPosition();
        scanner.readChar();
        parser.whitespace();
        char c = scanner.peekChar();
        scanner.reset(save);
        return c == '"' || c == '\'';
    }

    /**
     * {@code calc(...)}、{@code url(...)} 等：参数作为原始文本输出，
     * 其中的 {@code #{}} 与 {@code $var} 被替换为求值结果。
     */
    private Expression rawFunction(int start, String name) {
        List<Object> parts = new ArrayList<Object>();
        StringBuilder buf = new StringBuilder(name);
        parser.expectChar('(');
        buf.append('(');
        if (name.equalsIgnoreCase("url")) {
            parser.whitespace();
            parser.rawUrlBody(buf, parts);
        } else {
            int depth = 1;
            while (true) {
                if (scanner.isDone()) throw parser.expected("\")\"");
                char c = scanner.peekChar();
                if (c == '#' && scanner.peekChar(1) == '{') {
                    Parser.flush(buf, parts);
                    parts.add(parser.interpolationExpression());
                } else if (c == '$') {
                    int varStart = scanner.getPosition();
                    String variable = parser.variableName();
                    Parser.flush(buf, parts);
                    parts.add(new VariableExpr(scanner.spanFrom(varStart), null, variable));
                } else if (CharClass.isWhitespace(c)) {
                    parser.whitespaceWithoutComments();
                    if (scanner.peekChar() != ')') buf.append(' ');
                } else {
                    scanner.readChar();
                    if (c == '(') depth++;
                    if (c == ')' && --depth == 0) {
                        buf.append(')');
                        break;
                    }
                    buf.append(c);
                }
            }
        }
        Parser.flush(buf, parts);
        SourceLocation span = scanner.spanFrom(start);
        return new StringExpr(span, new Interpolation(parts, span), false);
    }

    // ============ 参数 ============

    /** {@code (a, $b: c, $rest...)} */
    ArgumentInvocation parseArgumentInvocation() {
        int start = scanner.getPosition();
        Set<String> saved = stopWords;
        stopWords = Collections.emptySet();
        try {
            parser.expectChar('(');
            parser.whitespace();
            List<Expression> positional = new ArrayList<Expression>();
            Map<String, Expression> named = new LinkedHashMap<String, Expression>();
            Expression rest = null;
            Expression keywordRest = null;
            while (scanner.peekChar() != ')') {
                String name = namedArgumentName();
                if (name != null) {
                    if (named.containsKey(name)) {
                        throw parser.error("Duplicate argument.", scanner.spanFrom(start));
                    }
                    parser.whitespace();
                    named.put(name, parseSpaceList());
                } else {
                    Expression expression = parseSpaceList();
                    parser.whitespace();
                    if (scanner.scan("...")) {
                        if (rest == null) {
                            rest = expression;
                        } else if (keywordRest == null) {
                            keywordRest = expression;
                        } else {
                            throw parser.error("Only two rest arguments allowed.", expression.getLocation());
                        }
                    } else if (!named.isEmpty() || rest != null) {
                        throw parser.error("Positional arguments must come before keyword arguments.",
                                expression.getLocation());
                    } else {
                        positional.add(expression);
                    }
                }
                parser.whitespace();
                if (!scanner.scanChar(',')) break;
                parser.whitespace();
            }
            parser.expectChar(')');
            return new ArgumentInvocation(scanner.spanFrom(start), positional, named, rest, keywordRest);
        } finally {
            stopWords = saved;
        }
    }

    /** 若当前为 {@code $name:} 则消费并返回名称，否则不移动位置并返回 null */
    private String namedArgumentName() {
        if (scanner.peekChar() != '$') return null;
        int save = scanner.getPosition();
        String name = parser.variableName();
        parser.whitespace();
        if (scanner.scanChar(':')) {
            return name;
        }
        scanner.reset(save);
        return null;
    }

    /** {@code ($a, $b: default, $rest...)} */
    ArgumentDeclaration parseArgumentDeclaration() {
        int start = scanner.getPosition();
        parser.expectChar('(');
        parser.whitespace();
        List<Parameter> parameters = new ArrayList<Parameter>();
        Set<String> names = new HashSet<String>();
        String rest = null;
        while (scanner.peekChar() == '$') {
            int paramStart = scanner.getPosition();
            String name = parser.variableName();
            parser.whitespace();
            Expression defaultValue = null;
            if (scanner.scanChar(':')) {
                parser.whitespace();
                defaultValue = parseSpaceList();
            } else if (scanner.scan("...")) {
                rest = name;
                parser.whitespace();
                break;
            }
            if (!names.add(name.replace('_', '-'))) {
                throw parser.error("Duplicate argument.", scanner.spanFrom(paramStart));
            }
            parameters.add(new Parameter(scanner.spanFrom(paramStart), name, defaultValue));
            parser.whitespace();
            if (!scanner.scanChar(',')) break;
            parser.whitespace();
        }
        parser.expectChar(')');
        return new ArgumentDeclaration(scanner.spanFrom(start), parameters, rest);
    }
}
