package com.scsslang.compiler.parser;

import com.scsslang.compiler.ast.Interpolation;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.decl.ArgumentDeclaration;
import com.scsslang.compiler.ast.decl.ArgumentInvocation;
import com.scsslang.compiler.ast.decl.ConfiguredVariable;
import com.scsslang.compiler.ast.decl.Stylesheet;
import com.scsslang.compiler.ast.expr.Expression;
import com.scsslang.compiler.ast.expr.ListExpr;
import com.scsslang.compiler.ast.expr.StringExpr;
import com.scsslang.compiler.ast.stmt.*;
import com.scsslang.compiler.lexer.CharClass;
import com.scsslang.compiler.lexer.Scanner;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 语句解析器
 */
final class StmtParser {

    private static final Set<String> FOR_STOP_WORDS = Collections.unmodifiableSet(
            new HashSet<String>(Arrays.asList("through", "to")));

    private final Parser parser;
    private final Scanner scanner;

    /** 是否位于 @mixin 体内（@content 仅在此处合法） */
    private boolean inMixin;
    private boolean mixinHasContent;
    private boolean inFunction;

    StmtParser(Parser parser) {
        this.parser = parser;
        this.scanner = parser.scanner;
    }

    private ExprParser expr() {
        return parser.exprParser;
    }

    // ============ 样式表 ============

    Stylesheet parseStylesheet() {
        int start = scanner.getPosition();
        scanner.scanChar('\uFEFF');
        List<Statement> children = statements(true);
        boolean plainCss = parser.url != null && parser.url.endsWith(".css");
        return new Stylesheet(scanner.spanFrom(start), parser.url, children, plainCss);
    }

    private List<Statement> statements(boolean root) {
        List<Statement> children = new ArrayList<Statement>();
        boolean sawOtherRule = false;
        while (true) {
            parser.whitespaceWithoutComments();
            if (scanner.isDone()) {
                if (root) break;
                throw parser.expected("\"}\"");
            }
            char c = scanner.peekChar();
            if (c == '}') {
                if (root) throw parser.error("Unmatched \"}\"");
                break;
            }
            if (c == ';') {
                scanner.readChar();
                continue;
            }
            if (c == '/' && scanner.peekChar(1) == '/') {
                parser.silentComment();
                continue;
            }
            if (c == '/' && scanner.peekChar(1) == '*') {
                children.add(loudComment());
                continue;
            }
            Statement statement = statement(root);
            if (statement == null) continue;
            if (root) {
                if ((statement instanceof UseRule || statement instanceof ForwardRule) && sawOtherRule) {
                    throw parser.error("@" + (statement instanceof UseRule ? "use" : "forward")
                            + " rules must be written before any other rules.", statement.getLocation());
                }
                if (!(statement instanceof UseRule || statement instanceof ForwardRule
                        || statement instanceof VariableDecl)) {
                    sawOtherRule = true;
                }
            }
            children.add(statement);
        }
        return children;
    }

    /** {@code { statements }} */
    private List<Statement> children() {
        parser.whitespace();
        parser.expectChar('{');
        List<Statement> children = statements(false);
        parser.expectChar('}');
        return children;
    }

    private Statement statement(boolean root) {
        char c = scanner.peekChar();
        if (c == '$') {
            return variableDecl(null, scanner.getPosition());
        }
        if (c == '@') {
            return atRule();
        }
        if (lookingAtNamespacedVariable()) {
            int start = scanner.getPosition();
            String namespace = parser.identifier();
            parser.expectChar('.');
            return variableDecl(namespace, start);
        }
        if (root) {
            return styleRule();
        }
        return declarationOrStyleRule();
    }

    private boolean lookingAtNamespacedVariable() {
        if (!parser.lookingAtIdentifier()) return false;
        int save = scanner.getPosition();
        try {
            parser.identifier();
            return scanner.peekChar() == '.' && scanner.peekChar(1) == '$';
        } finally {
            scanner.reset(save);
        }
    }

    private LoudComment loudComment() {
        int start = scanner.getPosition();
        List<Object> parts = new ArrayList<Object>();
        StringBuilder buf = new StringBuilder();
        scanner.scan("/*");
        buf.append("/*");
        while (true) {
            if (scanner.isDone()) throw parser.error("Unterminated comment", scanner.spanFrom(start));
            if (scanner.scan("*/")) {
                buf.append("*/");
                break;
            }
            if (scanner.peekChar() == '#' && scanner.peekChar(1) == '{') {
                Parser.flush(buf, parts);
                parts.add(parser.interpolationExpression());
            } else {
                buf.append(scanner.readChar());
            }
        }
        Parser.flush(buf, parts);
        SourceLocation span = scanner.spanFrom(start);
        return new LoudComment(span, new Interpolation(parts, span));
    }

    // ============ 变量 ============

    private VariableDecl variableDecl(String namespace, int start) {
        String name = parser.variableName();
        parser.whitespace();
        parser.expectChar(':');
        parser.whitespace();
        Expression value = expr().parseExpression();
        boolean guarded = false;
        boolean global = false;
        parser.whitespace();
        while (scanner.scanChar('!')) {
            int flagStart = scanner.getPosition();
            String flag = parser.identifier();
            if (flag.equals("default")) {
                guarded = true;
            } else if (flag.equals("global")) {
                if (namespace != null) {
                    throw parser.error("!global isn't allowed for variables in other modules.",
                            scanner.spanFrom(flagStart));
                }
                global = true;
            } else {
                throw parser.error("Invalid flag name.", scanner.spanFrom(flagStart));
            }
            parser.whitespace();
        }
        expectStatementEnd();
        return new VariableDecl(scanner.spanFrom(start), namespace, name, value, guarded, global);
    }

    // ============ 样式规则与声明 ============

    private Statement declarationOrStyleRule() {
        char terminator = parser.lookaheadTerminator();
        if (terminator == '{' && !looksLikeNestedProperty()) {
            return styleRule();
        }
        return declaration();
    }

    /** {@code font: 12px { ... }} 或 {@code font: { ... }}：冒号后紧跟空白或块 */
    private boolean looksLikeNestedProperty() {
        int save = scanner.getPosition();
        try {
            if (!parser.lookingAtInterpolatedIdentifier()) return false;
            Interpolation name = parser.interpolatedIdentifier();
            if (name.getInitialPlain().startsWith("--")) return false;
            parser.whitespace();
            if (!scanner.scanChar(':')) return false;
            char next = scanner.peekChar();
            return CharClass.isWhitespace(next) || next == '{';
        } finally {
            scanner.reset(save);
        }
    }

    private StyleRule styleRule() {
        int start = scanner.getPosition();
        Interpolation selector = parser.readRaw("{;}", false);
        if (selector.getParts().isEmpty()) {
            throw parser.expected("selector");
        }
        if (scanner.peekChar() != '{') {
            throw parser.expected("\"{\"");
        }
        List<Statement> children = children();
        return new StyleRule(scanner.spanFrom(start), selector, children);
    }

    private Declaration declaration() {
        int start = scanner.getPosition();
        Interpolation name;
        if (scanner.peekChar() == '*') {
            // IE hack 前缀
            List<Object> parts = new ArrayList<Object>();
            parts.add(String.valueOf(scanner.readChar()));
            parts.addAll(parser.interpolatedIdentifier().getParts());
            name = new Interpolation(parts, scanner.spanFrom(start));
        } else {
            name = parser.interpolatedIdentifier();
        }
        parser.whitespace();
        parser.expectChar(':');

        if (name.getInitialPlain().startsWith("--")) {
            Interpolation value = parser.readRaw(";}", false);
            expectStatementEnd();
            return new Declaration(scanner.spanFrom(start), name, value);
        }

        parser.whitespace();
        if (scanner.peekChar() == '{') {
            List<Statement> children = children();
            return new Declaration(scanner.spanFrom(start), name, null, false, children);
        }

        Expression value = expr().parseExpression();
        boolean important = false;
        if (isImportant(value)) {
            important = true;
            value = null;
        } else if (value instanceof ListExpr) {
            ListExpr list = (ListExpr) value;
            List<Expression> elements = list.getElements();
            if (list.getSeparator() == ListExpr.Separator.SPACE && isImportant(elements.get(elements.size() - 1))) {
                important = true;
                List<Expression> rest = elements.subList(0, elements.size() - 1);
                value = rest.size() == 1 ? rest.get(0)
                        : new ListExpr(list.getLocation(), new ArrayList<Expression>(rest), list.getSeparator(), false);
            }
        }
        if (value == null) {
            throw parser.error("Expected expression.", scanner.spanFrom(start));
        }
        parser.whitespace();
        if (scanner.peekChar() == '{') {
            List<Statement> children = children();
            return new Declaration(scanner.spanFrom(start), name, value, important, children);
        }
        expectStatementEnd();
        return new Declaration(scanner.spanFrom(start), name, value, important, null);
    }

    private static boolean isImportant(Expression expression) {
        if (!(expression instanceof StringExpr)) return false;
        StringExpr string = (StringExpr) expression;
        return !string.isQuoted() && "!important".equals(string.getText().getAsPlain());
    }

    private void expectStatementEnd() {
        parser.whitespace();
        if (scanner.scanChar(';')) return;
        if (scanner.isDone() || scanner.peekChar() == '}') return;
        throw parser.expected("\";\"");
    }

    // ============ at-rule ============

    private Statement atRule() {
        int start = scanner.getPosition();
        parser.expectChar('@');
        Interpolation name = parser.interpolatedIdentifier();
        parser.whitespace();
        String plain = name.getAsPlain();
        if (plain == null) {
            return unknownAtRule(start, name);
        }
        switch (plain) {
            case "use":
                return useRule(start);
            case "forward":
                return forwardRule(start);
            case "import":
                return importRule(start);
            case "mixin":
                return mixinRule(start);
            case "include":
                return includeRule(start);
            case "content":
                return contentRule(start);
            case "function":
                return functionRule(start);
            case "return":
                return returnRule(start);
            case "if":
                return ifRule(start);
            case "else":
            case "elseif":
                throw parser.error("This at-rule is not allowed here.", scanner.spanFrom(start));
            case "each":
                return eachRule(start);
            case "for":
                return forRule(start);
            case "while":
                return whileRule(start);
            case "extend":
                return extendRule(start);
            case "media":
                return mediaRule(start);
            case "at-root":
                return atRootRule(start);
            case "debug": {
                Expression value = expr().parseExpression();
                expectStatementEnd();
                return new DebugRule(scanner.spanFrom(start), value);
            }
            case "warn": {
                Expression value = expr().parseExpression();
                expectStatementEnd();
                return new WarnRule(scanner.spanFrom(start), value);
            }
            case "error": {
                Expression value = expr().parseExpression();
                expectStatementEnd();
                return new ErrorRule(scanner.spanFrom(start), value);
            }
            case "charset":
                parser.plainQuotedString();
                expectStatementEnd();
                return null;
            default:
                return unknownAtRule(start, name);
        }
    }

    private UseRule useRule(int start) {
        String url = parser.plainQuotedString();
        parser.whitespace();
        String namespace = UseRule.defaultNamespace(url);
        if (parser.scanKeyword("as")) {
            parser.whitespace();
            namespace = scanner.scanChar('*') ? null : parser.identifier();
            parser.whitespace();
        }
        List<ConfiguredVariable> configuration = Collections.emptyList();
        if (parser.scanKeyword("with")) {
            configuration = configuration(false);
        }
        expectStatementEnd();
        return new UseRule(scanner.spanFrom(start), url, namespace, configuration);
    }

    private ForwardRule forwardRule(int start) {
        String url = parser.plainQuotedString();
        parser.whitespace();
        String prefix = null;
        if (parser.scanKeyword("as")) {
            parser.whitespace();
            prefix = parser.identifier();
            parser.expectChar('*');
            parser.whitespace();
        }
        Set<String> shown = null;
        Set<String> hidden = null;
        if (parser.scanKeyword("show")) {
            shown = memberList();
        } else if (parser.scanKeyword("hide")) {
            hidden = memberList();
        }
        List<ConfiguredVariable> configuration = Collections.emptyList();
        if (parser.scanKeyword("with")) {
            configuration = configuration(true);
        }
        expectStatementEnd();
        return new ForwardRule(scanner.spanFrom(start), url, prefix, shown, hidden, configuration);
    }

    private Set<String> memberList() {
        Set<String> members = new LinkedHashSet<String>();
        do {
            parser.whitespace();
            if (scanner.peekChar() == '$') {
                members.add("$" + parser.variableName());
            } else {
                members.add(parser.identifier());
            }
            parser.whitespace();
        } while (scanner.scanChar(','));
        return members;
    }

    /** {@code with ($a: 1, $b: 2 !default)} */
    private List<ConfiguredVariable> configuration(boolean allowGuarded) {
        parser.whitespace();
        parser.expectChar('(');
        List<ConfiguredVariable> result = new ArrayList<ConfiguredVariable>();
        Set<String> names = new HashSet<String>();
        while (true) {
            parser.whitespace();
            int varStart = scanner.getPosition();
            String name = parser.variableName();
            parser.whitespace();
            parser.expectChar(':');
            parser.whitespace();
            Expression value = expr().parseSpaceList();
            parser.whitespace();
            boolean guarded = false;
            if (allowGuarded && scanner.scanChar('!')) {
                parser.expectKeyword("default");
                guarded = true;
                parser.whitespace();
            }
            if (!names.add(name.replace('_', '-'))) {
                throw parser.error("The same variable may only be configured once.", scanner.spanFrom(varStart));
            }
            result.add(new ConfiguredVariable(scanner.spanFrom(varStart), name, value, guarded));
            if (!scanner.scanChar(',')) break;
            parser.whitespace();
            if (scanner.peekChar() == ')') break;
        }
        parser.expectChar(')');
        parser.whitespace();
        return result;
    }

    private ImportRule importRule(int start) {
        List<ImportRule.ImportTarget> targets = new ArrayList<ImportRule.ImportTarget>();
        do {
            parser.whitespace();
            int targetStart = scanner.getPosition();
            if (scanner.matchesIgnoreCase("url(")) {
                Interpolation text = Parser.trim(parser.readRaw(",;}", false));
                targets.add(ImportRule.ImportTarget.ofStatic(scanner.spanFrom(targetStart), text));
            } else {
                char quote = scanner.peekChar();
                if (quote != '"' && quote != '\'') throw parser.expected("string");
                Interpolation urlText = parser.quotedStringText();
                String raw = scanner.substring(targetStart);
                parser.whitespace();
                boolean hasModifiers = !scanner.isDone() && ",;}".indexOf(scanner.peekChar()) < 0;
                String url = urlText.getAsPlain();
                if (url == null || hasModifiers || isPlainCssImport(url)) {
                    List<Object> parts = new ArrayList<Object>();
                    if (url == null) {
                        // 带插值的导入总是静态的
                        parts.add(String.valueOf(raw.charAt(0)));
                        parts.addAll(urlText.getParts());
                        parts.add(String.valueOf(raw.charAt(0)));
                    } else {
                        parts.add(raw);
                    }
                    if (hasModifiers) {
                        parts.add(" ");
                        parts.addAll(parser.readRaw(",;}", true).getParts());
                    }
                    targets.add(ImportRule.ImportTarget.ofStatic(scanner.spanFrom(targetStart),
                            new Interpolation(parts, scanner.spanFrom(targetStart))));
                } else {
                    targets.add(ImportRule.ImportTarget.dynamic(scanner.spanFrom(targetStart), url));
                }
            }
            parser.whitespace();
        } while (scanner.scanChar(','));
        expectStatementEnd();
        return new ImportRule(scanner.spanFrom(start), targets);
    }

    /** 原样输出为 CSS @import 的地址 */
    static boolean isPlainCssImport(String url) {
        if (url.length() < 5) return false;
        return url.endsWith(".css") || url.startsWith("http://") || url.startsWith("https://")
                || url.startsWith("//");
    }

    private MixinRule mixinRule(int start) {
        String name = parser.identifier();
        parser.whitespace();
        ArgumentDeclaration arguments = scanner.peekChar() == '('
                ? expr().parseArgumentDeclaration() : ArgumentDeclaration.EMPTY;
        if (inMixin || inFunction) {
            throw parser.error("Mixins may not contain mixin declarations.", scanner.spanFrom(start));
        }
        inMixin = true;
        mixinHasContent = false;
        List<Statement> children;
        boolean hasContent;
        try {
            children = children();
            hasContent = mixinHasContent;
        } finally {
            inMixin = false;
            mixinHasContent = false;
        }
        return new MixinRule(scanner.spanFrom(start), name, arguments, children, hasContent);
    }

    private IncludeRule includeRule(int start) {
        String namespace = null;
        String name = parser.identifier();
        if (scanner.scanChar('.')) {
            namespace = name;
            name = parser.identifier();
        }
        parser.whitespace();
        ArgumentInvocation arguments = scanner.peekChar() == '('
                ? expr().parseArgumentInvocation() : ArgumentInvocation.EMPTY;
        parser.whitespace();
        ArgumentDeclaration contentParameters = null;
        if (parser.scanKeyword("using")) {
            parser.whitespace();
            contentParameters = expr().parseArgumentDeclaration();
            parser.whitespace();
        }
        IncludeRule.ContentBlock content = null;
        if (scanner.peekChar() == '{' || contentParameters != null) {
            int contentStart = scanner.getPosition();
            List<Statement> children = children();
            content = new IncludeRule.ContentBlock(scanner.spanFrom(contentStart), contentParameters, children);
        } else {
            expectStatementEnd();
        }
        return new IncludeRule(scanner.spanFrom(start), namespace, name, arguments, content);
    }

    private ContentRule contentRule(int start) {
        if (!inMixin) {
            throw parser.error("@content is only allowed within mixin declarations.", scanner.spanFrom(start));
        }
        mixinHasContent = true;
        ArgumentInvocation arguments = scanner.peekChar() == '('
                ? expr().parseArgumentInvocation() : ArgumentInvocation.EMPTY;
        expectStatementEnd();
        return new ContentRule(scanner.spanFrom(start), arguments);
    }

    private FunctionRule functionRule(int start) {
        String name = parser.identifier();
        parser.whitespace();
        ArgumentDeclaration arguments = expr().parseArgumentDeclaration();
        if (inMixin || inFunction) {
            throw parser.error("Functions may not be declared in mixins or functions.", scanner.spanFrom(start));
        }
        inFunction = true;
        List<Statement> children;
        try {
            children = children();
        } finally {
            inFunction = false;
        }
        return new FunctionRule(scanner.spanFrom(start), name, arguments, children);
    }

    private ReturnRule returnRule(int start) {
        Expression value = expr().parseExpression();
        expectStatementEnd();
        return new ReturnRule(scanner.spanFrom(start), value);
    }

    private IfRule ifRule(int start) {
        List<IfRule.IfClause> clauses = new ArrayList<IfRule.IfClause>();
        Expression condition = expr().parseExpression();
        clauses.add(new IfRule.IfClause(condition, children()));
        List<Statement> elseChildren = null;
        while (true) {
            int save = scanner.getPosition();
            parser.whitespace();
            if (scanner.scan("@elseif") && !CharClass.isName(scanner.peekChar())) {
                parser.whitespace();
                Expression elseIf = expr().parseExpression();
                clauses.add(new IfRule.IfClause(elseIf, children()));
                continue;
            }
            scanner.reset(save);
            parser.whitespace();
            if (!(scanner.scan("@else") && !CharClass.isName(scanner.peekChar()))) {
                scanner.reset(save);
                break;
            }
            parser.whitespace();
            if (parser.scanKeyword("if")) {
                parser.whitespace();
                Expression elseIf = expr().parseExpression();
                clauses.add(new IfRule.IfClause(elseIf, children()));
            } else {
                elseChildren = children();
                break;
            }
        }
        return new IfRule(scanner.spanFrom(start), clauses, elseChildren);
    }

    private EachRule eachRule(int start) {
        List<String> variables = new ArrayList<String>();
        variables.add(parser.variableName());
        parser.whitespace();
        while (scanner.scanChar(',')) {
            parser.whitespace();
            variables.add(parser.variableName());
            parser.whitespace();
        }
        parser.expectKeyword("in");
        parser.whitespace();
        Expression list = expr().parseExpression();
        List<Statement> children = children();
        return new EachRule(scanner.spanFrom(start), variables, list, children);
    }

    private ForRule forRule(int start) {
        String variable = parser.variableName();
        parser.whitespace();
        parser.expectKeyword("from");
        parser.whitespace();
        Expression from = expr().parseExpressionUntil(FOR_STOP_WORDS);
        parser.whitespace();
        boolean exclusive;
        if (parser.scanKeyword("through")) {
            exclusive = false;
        } else if (parser.scanKeyword("to")) {
            exclusive = true;
        } else {
            throw parser.expected("\"to\" or \"through\"");
        }
        parser.whitespace();
        Expression to = expr().parseExpression();
        List<Statement> children = children();
        return new ForRule(scanner.spanFrom(start), variable, from, to, exclusive, children);
    }

    private WhileRule whileRule(int start) {
        Expression condition = expr().parseExpression();
        List<Statement> children = children();
        return new WhileRule(scanner.spanFrom(start), condition, children);
    }

    private ExtendRule extendRule(int start) {
        Interpolation selector = parser.readRaw(";}!", false);
        if (selector.getParts().isEmpty()) {
            throw parser.expected("selector");
        }
        boolean optional = false;
        if (scanner.scanChar('!')) {
            parser.expectKeyword("optional");
            optional = true;
        }
        expectStatementEnd();
        return new ExtendRule(scanner.spanFrom(start), selector, optional);
    }

    private MediaRule mediaRule(int start) {
        Interpolation query = parser.readRaw("{;}", true);
        if (query.getParts().isEmpty()) {
            throw parser.expected("media query");
        }
        List<Statement> children = children();
        return new MediaRule(scanner.spanFrom(start), query, children);
    }

    private AtRootRule atRootRule(int start) {
        if (scanner.peekChar() == '(') {
            Interpolation query = parser.readRaw("{", false);
            List<Statement> children = children();
            return new AtRootRule(scanner.spanFrom(start), query, children);
        }
        if (scanner.peekChar() == '{') {
            List<Statement> children = children();
            return new AtRootRule(scanner.spanFrom(start), null, children);
        }
        StyleRule rule = styleRule();
        return new AtRootRule(scanner.spanFrom(start), null, Collections.<Statement>singletonList(rule));
    }

    private AtRule unknownAtRule(int start, Interpolation name) {
        Interpolation value = null;
        if (!scanner.isDone() && "{;}".indexOf(scanner.peekChar()) < 0) {
            value = parser.readRaw("{;}", false);
        }
        if (scanner.peekChar() == '{') {
            List<Statement> children = children();
            return new AtRule(scanner.spanFrom(start), name, value, children);
        }
        expectStatementEnd();
        return new AtRule(scanner.spanFrom(start), name, value, null);
    }
}
