package scss.runtime.interpreter;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.decl.ConfiguredVariable;
import com.scsslang.compiler.ast.decl.Stylesheet;
import com.scsslang.compiler.ast.expr.Expression;
import com.scsslang.compiler.ast.stmt.*;
import scss.runtime.ArityException;
import scss.runtime.LoadException;
import scss.runtime.RuntimeLimitException;
import scss.runtime.SassRuntimeException;
import scss.runtime.UndefinedNameException;
import scss.runtime.UserErrorException;
import scss.runtime.builtin.ArgumentBinder;
import scss.runtime.css.*;
import scss.runtime.loader.LoadContext;
import scss.runtime.loader.LoadRequest;
import scss.runtime.loader.ParsedModule;
import scss.runtime.scope.Configuration;
import scss.runtime.scope.Environment;
import scss.runtime.scope.ForwardedModule;
import scss.runtime.scope.Module;
import scss.runtime.scope.Names;
import scss.runtime.scope.SassModule;
import scss.runtime.selector.ComplexSelector;
import scss.runtime.selector.CompoundSelector;
import scss.runtime.selector.SelectorCache;
import scss.runtime.selector.SelectorComponent;
import scss.runtime.selector.SelectorList;
import scss.runtime.value.SassCallable;
import scss.runtime.value.SassNull;
import scss.runtime.value.SassNumber;
import scss.runtime.value.SassString;
import scss.runtime.value.SassValue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 样式表求值器
 *
 * <p>每个模块一个实例：执行语句，产出该模块自身的 CSS 树与顶层作用域。
 * 依赖模块通过 {@code @use}/{@code @forward} 递归创建新的实例求值，
 * 整个编译共享 {@link CompilationContext}（模块缓存、调用栈、@extend 记录）。</p>
 *
 * <p>表达式求值委托给 {@link ExpressionEvaluator}。</p>
 */
public final class Evaluator implements AstVisitor<Void, Void> {

    private static final Logger LOG = Logger.getLogger(Evaluator.class.getName());

    /** {@link #addChild} 向上越过哪些父节点 */
    private enum Through {
        NONE, STYLE, STYLE_AND_MEDIA
    }

    private final CompilationContext context;
    private final Configuration configuration;
    private final ExpressionEvaluator expressions;

    /** 当前文件（@import 时临时切换） */
    private String url;
    private boolean dependency;

    Environment environment;

    private CssStylesheet root;
    private CssParentNode parent;

    /** 最近的样式规则，忽略 @at-root */
    private CssStyleRule styleRuleIgnoringAtRoot;
    private boolean atRootExcludingStyleRule;

    /** 当前媒体查询上下文，不在 @media 中为 null */
    private List<String> mediaQueries;

    private boolean inKeyframes;
    private boolean inUnknownAtRule;
    private boolean inFunction;
    private boolean inMixin;

    /** 当前 mixin 调用的内容块 */
    ContentCallable content;

    /** 嵌套属性前缀（{@code font: { family: x }}） */
    private String declarationPrefix;

    /** 本模块 @use/@forward 的模块，按加载顺序 */
    private final List<Module> upstream = new ArrayList<>();

    public Evaluator(CompilationContext context, String url, boolean dependency, Configuration configuration) {
        this.context = context;
        this.url = url;
        this.dependency = dependency;
        this.configuration = configuration == null ? Configuration.empty() : configuration;
        this.expressions = new ExpressionEvaluator(this, context);
    }

    /**
     * 求值整个样式表
     *
     * @return 求值完成的模块
     * @throws SassRuntimeException 求值出错
     */
    public SassModule evaluate(Stylesheet stylesheet) {
        environment = new Environment();
        root = new CssStylesheet(stylesheet.getLocation());
        parent = root;
        executeAll(stylesheet.getChildren());
        return new SassModule(url, environment, root, new ArrayList<>(upstream));
    }

    // ============ 状态访问 ============

    CssStyleRule getStyleRuleIgnoringAtRoot() {
        return styleRuleIgnoringAtRoot;
    }

    /** 当前生效的样式规则，被 @at-root 排除时为 null */
    private CssStyleRule currentStyleRule() {
        return atRootExcludingStyleRule ? null : styleRuleIgnoringAtRoot;
    }

    boolean isInMixin() {
        return inMixin;
    }

    // ============ 执行 ============

    private void execute(Statement statement) {
        try {
            statement.accept(this, null);
        } catch (SassRuntimeException e) {
            throw e.attachLocation(statement.getLocation(), context.sourceLine(statement.getLocation()));
        }
    }

    private void executeAll(List<Statement> statements) {
        for (Statement statement : statements) {
            execute(statement);
        }
    }

    /** 在给定作用域中执行，结束后恢复 */
    private void inScope(Environment scope, Runnable body) {
        Environment saved = environment;
        environment = scope;
        try {
            body.run();
        } finally {
            environment = saved;
        }
    }

    /** 以 node 为父节点执行 */
    private void withParent(CssParentNode node, Runnable body) {
        CssParentNode saved = parent;
        parent = node;
        try {
            body.run();
        } finally {
            parent = saved;
        }
    }

    /**
     * 把节点加入 CSS 树
     *
     * <p>按 through 向上越过样式规则（及媒体规则）；目标父节点后面已有兄弟节点时，
     * 复用或追加一个同样的空父节点，保持输出顺序与源码顺序一致。</p>
     */
    private void addChild(CssNode node, Through through) {
        CssParentNode target = parent;
        if (through != Through.NONE) {
            while (isSkipped(target, through)) {
                target = target.getParent();
            }
            CssParentNode grandparent = target.getParent();
            if (grandparent != null) {
                List<CssNode> siblings = grandparent.getChildren();
                CssNode last = siblings.get(siblings.size() - 1);
                if (last != target) {
                    if (last instanceof CssParentNode && equalsIgnoringChildren(target, last)) {
                        target = (CssParentNode) last;
                    } else {
                        CssParentNode copy = copyWithoutChildren(target);
                        grandparent.addChild(copy);
                        target = copy;
                    }
                }
            }
        }
        target.addChild(node);
    }

    private static boolean isSkipped(CssParentNode node, Through through) {
        if (node instanceof CssStyleRule) return true;
        return through == Through.STYLE_AND_MEDIA && node instanceof CssMediaRule;
    }

    private static boolean equalsIgnoringChildren(CssNode a, CssNode b) {
        if (a.getClass() != b.getClass()) return false;
        if (a instanceof CssStyleRule) {
            CssStyleRule x = (CssStyleRule) a, y = (CssStyleRule) b;
            return x.getSelector().equals(y.getSelector())
                    && Objects.equals(x.getMediaContext(), y.getMediaContext());
        }
        if (a instanceof CssMediaRule) {
            return ((CssMediaRule) a).getQueries().equals(((CssMediaRule) b).getQueries());
        }
        if (a instanceof CssAtRule) {
            CssAtRule x = (CssAtRule) a, y = (CssAtRule) b;
            return x.getName().equals(y.getName()) && Objects.equals(x.getParams(), y.getParams());
        }
        if (a instanceof CssKeyframeBlock) {
            return ((CssKeyframeBlock) a).getSelectors().equals(((CssKeyframeBlock) b).getSelectors());
        }
        return false;
    }

    private CssParentNode copyWithoutChildren(CssParentNode node) {
        if (node instanceof CssStyleRule) {
            CssStyleRule rule = (CssStyleRule) node;
            CssStyleRule copy = new CssStyleRule(rule.getSelector(), rule.getMediaContext(), rule.getSpan());
            context.addStyleRule(copy);
            return copy;
        }
        if (node instanceof CssMediaRule) {
            return new CssMediaRule(((CssMediaRule) node).getQueries(), node.getSpan());
        }
        if (node instanceof CssAtRule) {
            CssAtRule rule = (CssAtRule) node;
            return new CssAtRule(rule.getName(), rule.getParams(), rule.isChildless(), rule.getSpan());
        }
        if (node instanceof CssKeyframeBlock) {
            return new CssKeyframeBlock(((CssKeyframeBlock) node).getSelectors(), node.getSpan());
        }
        throw new IllegalStateException("Cannot copy " + node.getClass().getSimpleName());
    }

    // ============ 调用栈 ============

    /**
     * 压入调用帧
     *
     * @throws RuntimeLimitException 超过最大调用深度
     */
    void enterCall(String name, SourceLocation site) {
        SassCallStack stack = context.getCallStack();
        int max = context.getOptions().getMaxCallDepth();
        if (stack.depth() >= max) {
            throw new RuntimeLimitException("Stack depth exceeded max of " + max + ".", site);
        }
        stack.push(SassCallFrame.at(name, site));
    }

    void exitCall() {
        context.getCallStack().pop();
    }

    /**
     * 调用用户函数
     */
    SassValue callFunction(UserFunction function, ExpressionEvaluator.Arguments args, SourceLocation site) {
        FunctionRule declaration = function.getDeclaration();
        Environment scope = function.getClosure().child();
        enterCall(function.getName(), site);
        Environment savedEnvironment = environment;
        boolean savedInFunction = inFunction;
        boolean savedInMixin = inMixin;
        ContentCallable savedContent = content;
        try {
            environment = scope;
            inFunction = true;
            inMixin = false;
            content = null;
            List<SassValue> bound = expressions.bindArguments(declaration.getArguments(), args, scope);
            try {
                executeAll(declaration.getChildren());
            } catch (ControlFlow flow) {
                if (declaration.getArguments().hasRest()) {
                    ArgumentBinder.checkKeywordsUsed(bound);
                }
                return flow.getValue().withoutSlash();
            }
            throw new SassRuntimeException("Function finished without @return.", declaration.getLocation());
        } catch (SassRuntimeException e) {
            e.setSassStackTrace(context.getCallStack().formatStackTrace());
            throw e;
        } finally {
            environment = savedEnvironment;
            inFunction = savedInFunction;
            inMixin = savedInMixin;
            content = savedContent;
            exitCall();
        }
    }

    // ============ 样式规则与声明 ============

    @Override
    public Void visitStyleRule(StyleRule node, Void ctx) {
        String text = expressions.interpolate(node.getSelector()).trim();
        if (inKeyframes && parent instanceof CssAtRule && ((CssAtRule) parent).isKeyframes()) {
            List<String> selectors = new ArrayList<>();
            for (String part : text.split(",")) {
                selectors.add(part.trim());
            }
            final CssKeyframeBlock block = new CssKeyframeBlock(selectors, node.getLocation());
            parent.addChild(block);
            withParent(block, () -> inScope(environment.child(), () -> executeAll(node.getChildren())));
            return null;
        }

        SelectorList parsed = SelectorCache.shared().parse(text, node.getLocation(), true, true);
        SelectorList parentSelector = styleRuleIgnoringAtRoot == null ? null : styleRuleIgnoringAtRoot.getSelector();
        SelectorList resolved = parsed.resolveParentSelectors(parentSelector, !atRootExcludingStyleRule);

        final CssStyleRule rule = new CssStyleRule(resolved, mediaQueries, node.getLocation());
        addChild(rule, Through.STYLE);
        context.addStyleRule(rule);

        CssStyleRule savedRule = styleRuleIgnoringAtRoot;
        boolean savedExcluding = atRootExcludingStyleRule;
        styleRuleIgnoringAtRoot = rule;
        atRootExcludingStyleRule = false;
        try {
            withParent(rule, () -> inScope(environment.child(), () -> executeAll(node.getChildren())));
        } finally {
            styleRuleIgnoringAtRoot = savedRule;
            atRootExcludingStyleRule = savedExcluding;
        }
        return null;
    }

    @Override
    public Void visitDeclaration(Declaration node, Void ctx) {
        if (currentStyleRule() == null && !inUnknownAtRule && !inKeyframes && declarationPrefix == null) {
            throw new SassRuntimeException("Declarations may only be used within style rules.", node.getLocation());
        }
        String name = expressions.interpolate(node.getName());
        if (declarationPrefix != null) {
            name = declarationPrefix + "-" + name;
        }

        if (node.isCustomProperty()) {
            String value = expressions.interpolate(node.getCustomPropertyValue());
            parent.addChild(new CssDeclaration(name, value, node.getLocation()));
            return null;
        }

        if (node.getValue() != null) {
            SassValue value = expressions.evaluate(node.getValue());
            if (!value.isBlank() || isEmptyList(value)) {
                parent.addChild(new CssDeclaration(name, value, node.isImportant(),
                        node.getLocation(), node.getValue().getLocation()));
            } else if (name.startsWith("--")) {
                throw new SassRuntimeException("Custom property values may not be empty.", node.getValue().getLocation());
            }
        }

        if (!node.getChildren().isEmpty()) {
            String savedPrefix = declarationPrefix;
            declarationPrefix = name;
            try {
                inScope(environment.child(), () -> executeAll(node.getChildren()));
            } finally {
                declarationPrefix = savedPrefix;
            }
        }
        return null;
    }

    /** 空列表交给序列化器报错 */
    private static boolean isEmptyList(SassValue value) {
        return value.asList().isEmpty() && !(value instanceof SassString) && !value.isNull();
    }

    // ============ 变量 ============

    @Override
    public Void visitVariableDecl(VariableDecl node, Void ctx) {
        if (node.getNamespace() != null) {
            SassValue value = expressions.evaluate(node.getExpression()).withoutSlash();
            Module module = environment.getModule(node.getNamespace());
            if (!module.hasVariable(node.getName())) {
                throw new UndefinedNameException("Undefined variable.", node.getLocation());
            }
            module.setVariable(node.getName(), value);
            return null;
        }

        if (node.isGuarded()) {
            if (environment.isRoot()) {
                Configuration.Entry configured = configuration.remove(node.getName());
                if (configured != null && !configured.getValue().isNull()) {
                    environment.setVariable(node.getName(), configured.getValue(), true);
                    return null;
                }
            }
            SassValue existing = node.isGlobal()
                    ? environment.getRoot().getVariable(node.getName())
                    : environment.getVariable(node.getName());
            if (existing != null && !existing.isNull()) {
                return null;
            }
        }

        SassValue value = expressions.evaluate(node.getExpression()).withoutSlash();
        environment.setVariable(node.getName(), value, node.isGlobal());
        return null;
    }

    // ============ 控制流 ============

    @Override
    public Void visitIfRule(IfRule node, Void ctx) {
        List<Statement> chosen = null;
        for (IfRule.IfClause clause : node.getClauses()) {
            if (expressions.evaluate(clause.getCondition()).isTruthy()) {
                chosen = clause.getChildren();
                break;
            }
        }
        if (chosen == null && node.hasElse()) {
            chosen = node.getElseChildren();
        }
        if (chosen != null) {
            final List<Statement> body = chosen;
            inScope(environment.child(true), () -> executeAll(body));
        }
        return null;
    }

    @Override
    public Void visitEachRule(EachRule node, Void ctx) {
        List<SassValue> items = expressions.evaluate(node.getList()).asList();
        List<String> variables = node.getVariables();
        for (SassValue item : items) {
            Environment scope = environment.child(true);
            if (variables.size() == 1) {
                scope.declareLocal(variables.get(0), item.withoutSlash());
            } else {
                List<SassValue> parts = item.asList();
                for (int i = 0; i < variables.size(); i++) {
                    SassValue part = i < parts.size() ? parts.get(i).withoutSlash() : SassNull.INSTANCE;
                    scope.declareLocal(variables.get(i), part);
                }
            }
            inScope(scope, () -> executeAll(node.getChildren()));
        }
        return null;
    }

    @Override
    public Void visitForRule(ForRule node, Void ctx) {
        SassNumber from = expressions.evaluate(node.getFrom()).assertNumber(null);
        SassNumber to = expressions.evaluate(node.getTo()).assertNumber(null)
                .coerce(from.getNumeratorUnits(), from.getDenominatorUnits());
        int start = from.assertInt(null);
        int end = to.assertInt(null);
        int direction = start > end ? -1 : 1;
        if (!node.isExclusive()) {
            end += direction;
        }
        for (int i = start; i != end; i += direction) {
            Environment scope = environment.child(true);
            scope.declareLocal(node.getVariable(),
                    new SassNumber(i, from.getNumeratorUnits(), from.getDenominatorUnits()));
            inScope(scope, () -> executeAll(node.getChildren()));
        }
        return null;
    }

    @Override
    public Void visitWhileRule(WhileRule node, Void ctx) {
        long limit = context.getOptions().getMaxLoopIterations();
        long iterations = 0;
        while (expressions.evaluate(node.getCondition()).isTruthy()) {
            if (++iterations > limit) {
                throw new RuntimeLimitException("@while loop exceeded " + limit + " iterations.", node.getLocation());
            }
            inScope(environment.child(true), () -> executeAll(node.getChildren()));
        }
        return null;
    }

    // ============ 函数与 mixin ============

    @Override
    public Void visitFunctionRule(FunctionRule node, Void ctx) {
        environment.setFunction(node.getName(), new UserFunction(node, environment));
        return null;
    }

    @Override
    public Void visitMixinRule(MixinRule node, Void ctx) {
        environment.setMixin(node.getName(), new UserMixin(node, environment));
        return null;
    }

    @Override
    public Void visitReturnRule(ReturnRule node, Void ctx) {
        if (!inFunction) {
            throw new SassRuntimeException("This at-rule is not allowed here.", node.getLocation());
        }
        throw ControlFlow.returnValue(expressions.evaluate(node.getExpression()));
    }

    @Override
    public Void visitIncludeRule(IncludeRule node, Void ctx) {
        if (inFunction) {
            throw new SassRuntimeException("Mixins may not be used within functions.", node.getLocation());
        }
        SassCallable callable = expressions.lookupMixin(node.getName(), node.getNamespace());
        if (!(callable instanceof UserMixin)) {
            throw new UndefinedNameException("Undefined mixin.", node.getLocation());
        }
        UserMixin mixin = (UserMixin) callable;
        if (node.hasContent() && !mixin.acceptsContent()) {
            throw new ArityException("Mixin doesn't accept a content block.", node.getLocation());
        }
        ContentCallable block = node.hasContent()
                ? new ContentCallable(node.getContent(), environment, content)
                : null;
        ExpressionEvaluator.Arguments args = expressions.evaluateArguments(node.getArguments());

        MixinRule declaration = mixin.getDeclaration();
        Environment scope = mixin.getClosure().child();
        enterCall(mixin.getName(), node.getLocation());
        Environment savedEnvironment = environment;
        ContentCallable savedContent = content;
        boolean savedInMixin = inMixin;
        try {
            environment = scope;
            List<SassValue> bound = expressions.bindArguments(declaration.getArguments(), args, scope);
            content = block;
            inMixin = true;
            executeAll(declaration.getChildren());
            if (declaration.getArguments().hasRest()) {
                ArgumentBinder.checkKeywordsUsed(bound);
            }
        } catch (SassRuntimeException e) {
            e.setSassStackTrace(context.getCallStack().formatStackTrace());
            throw e;
        } finally {
            environment = savedEnvironment;
            content = savedContent;
            inMixin = savedInMixin;
            exitCall();
        }
        return null;
    }

    @Override
    public Void visitContentRule(ContentRule node, Void ctx) {
        final ContentCallable current = content;
        if (current == null) {
            return null;
        }
        ExpressionEvaluator.Arguments args = expressions.evaluateArguments(node.getArguments());
        Environment scope = current.getEnvironment().child();
        enterCall(current.getName(), node.getLocation());
        Environment savedEnvironment = environment;
        try {
            environment = scope;
            expressions.bindArguments(current.getParameters(), args, scope);
            content = current.getOuterContent();
            executeAll(current.getBlock().getChildren());
        } finally {
            environment = savedEnvironment;
            content = current;
            exitCall();
        }
        return null;
    }

    // ============ @extend ============

    @Override
    public Void visitExtendRule(ExtendRule node, Void ctx) {
        CssStyleRule rule = currentStyleRule();
        if (rule == null || declarationPrefix != null) {
            throw new SassRuntimeException("@extend may only be used within style rules.", node.getLocation());
        }
        String text = expressions.interpolate(node.getSelector()).trim();
        SelectorList targets = SelectorCache.shared().parse(text, node.getLocation(), false, true);
        for (ComplexSelector complex : targets.getComponents()) {
            List<SelectorComponent> components = complex.getComponents();
            if (components.size() != 1 || !(components.get(0) instanceof CompoundSelector)) {
                throw new SassRuntimeException("complex selectors may not be extended.", node.getLocation());
            }
            CompoundSelector compound = (CompoundSelector) components.get(0);
            if (compound.getComponents().size() != 1) {
                throw new SassRuntimeException("compound selectors may no longer be extended.\n"
                        + "Consider `@extend " + joinSimple(compound) + "` instead.", node.getLocation());
            }
            context.getExtensions().addExtension(rule.getSelector(), compound.getComponents().get(0),
                    node.isOptional(), mediaQueries, node.getLocation());
        }
        return null;
    }

    private static String joinSimple(CompoundSelector compound) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < compound.getComponents().size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(compound.getComponents().get(i));
        }
        return sb.toString();
    }

    // ============ at 规则 ============

    @Override
    public Void visitMediaRule(MediaRule node, Void ctx) {
        List<String> queries = MediaQueries.split(expressions.interpolate(node.getQuery()));
        final List<String> merged = mediaQueries == null ? queries : MediaQueries.merge(mediaQueries, queries);
        if (merged.isEmpty()) {
            return null;
        }
        final CssMediaRule rule = new CssMediaRule(merged, node.getLocation());
        addChild(rule, mediaQueries == null ? Through.STYLE : Through.STYLE_AND_MEDIA);

        List<String> savedQueries = mediaQueries;
        mediaQueries = merged;
        try {
            withParent(rule, () -> {
                CssStyleRule styleRule = currentStyleRule();
                if (styleRule == null || inKeyframes) {
                    inScope(environment.child(), () -> executeAll(node.getChildren()));
                } else {
                    runInStyleRuleCopy(styleRule, node.getChildren());
                }
            });
        } finally {
            mediaQueries = savedQueries;
        }
        return null;
    }

    /** 在当前父节点下放一个样式规则的副本，让 at 规则内的声明有处可放 */
    private void runInStyleRuleCopy(CssStyleRule styleRule, List<Statement> children) {
        CssStyleRule copy = new CssStyleRule(styleRule.getSelector(), mediaQueries, styleRule.getSpan());
        parent.addChild(copy);
        context.addStyleRule(copy);
        withParent(copy, () -> inScope(environment.child(), () -> executeAll(children)));
    }

    @Override
    public Void visitAtRootRule(AtRootRule node, Void ctx) {
        AtRootQuery query = node.getQuery() == null
                ? AtRootQuery.DEFAULT
                : AtRootQuery.parse(expressions.interpolate(node.getQuery()).trim());

        List<CssParentNode> included = new ArrayList<>();
        boolean excludedAny = false;
        for (CssParentNode ancestor = parent; !(ancestor instanceof CssStylesheet); ancestor = ancestor.getParent()) {
            if (query.excludes(ancestor)) {
                excludedAny = true;
            } else {
                included.add(ancestor);
            }
        }

        CssParentNode target;
        if (!excludedAny) {
            target = parent;
        } else if (included.isEmpty()) {
            target = root;
        } else {
            CssParentNode innerCopy = copyWithoutChildren(included.get(0));
            CssParentNode outerCopy = innerCopy;
            for (int i = 1; i < included.size(); i++) {
                CssParentNode copy = copyWithoutChildren(included.get(i));
                copy.addChild(outerCopy);
                outerCopy = copy;
            }
            root.addChild(outerCopy);
            target = innerCopy;
        }

        boolean savedExcluding = atRootExcludingStyleRule;
        List<String> savedQueries = mediaQueries;
        boolean savedKeyframes = inKeyframes;
        boolean savedUnknown = inUnknownAtRule;
        try {
            if (query.excludesStyleRules()) {
                atRootExcludingStyleRule = true;
            }
            if (mediaQueries != null && query.excludesName("media")) {
                mediaQueries = null;
            }
            if (inKeyframes && query.excludesName("keyframes")) {
                inKeyframes = false;
            }
            if (inUnknownAtRule && !containsAtRule(included)) {
                inUnknownAtRule = false;
            }
            withParent(target, () -> inScope(environment.child(), () -> executeAll(node.getChildren())));
        } finally {
            atRootExcludingStyleRule = savedExcluding;
            mediaQueries = savedQueries;
            inKeyframes = savedKeyframes;
            inUnknownAtRule = savedUnknown;
        }
        return null;
    }

    private static boolean containsAtRule(List<CssParentNode> nodes) {
        for (CssParentNode node : nodes) {
            if (node instanceof CssAtRule) return true;
        }
        return false;
    }

    @Override
    public Void visitAtRule(AtRule node, Void ctx) {
        String name = expressions.interpolate(node.getName());
        String params = node.getValue() == null ? null : expressions.interpolate(node.getValue()).trim();
        if (!node.hasBlock()) {
            parent.addChild(new CssAtRule(name, params, true, node.getLocation()));
            return null;
        }

        final CssAtRule rule = new CssAtRule(name, params, false, node.getLocation());
        addChild(rule, Through.STYLE);

        String unvendored = unvendor(name.toLowerCase(Locale.ROOT));
        boolean keyframes = "keyframes".equals(unvendored);
        boolean savedKeyframes = inKeyframes;
        boolean savedUnknown = inUnknownAtRule;
        try {
            if (keyframes) {
                inKeyframes = true;
            } else {
                inUnknownAtRule = true;
            }
            withParent(rule, () -> {
                CssStyleRule styleRule = currentStyleRule();
                if (styleRule == null || inKeyframes || "font-face".equals(unvendored)) {
                    inScope(environment.child(), () -> executeAll(node.getChildren()));
                } else {
                    runInStyleRuleCopy(styleRule, node.getChildren());
                }
            });
        } finally {
            inKeyframes = savedKeyframes;
            inUnknownAtRule = savedUnknown;
        }
        return null;
    }

    /** 去掉厂商前缀：{@code -webkit-keyframes} → {@code keyframes} */
    static String unvendor(String name) {
        if (name.length() < 2 || name.charAt(0) != '-' || name.charAt(1) == '-') return name;
        int dash = name.indexOf('-', 1);
        return dash < 0 ? name : name.substring(dash + 1);
    }

    // ============ 模块系统 ============

    @Override
    public Void visitImportRule(ImportRule node, Void ctx) {
        for (ImportRule.ImportTarget target : node.getTargets()) {
            if (target.isStatic()) {
                CssImport cssImport = new CssImport(expressions.interpolate(target.getStaticImport()), null,
                        target.getLocation());
                if (parent == root && currentStyleRule() == null) {
                    context.addImport(cssImport);
                } else {
                    parent.addChild(cssImport);
                }
            } else {
                importStylesheet(target);
            }
        }
        return null;
    }

    /**
     * 旧式 @import：被导入文件的语句在当前作用域、当前位置执行
     */
    private void importStylesheet(ImportRule.ImportTarget target) {
        SourceLocation span = target.getLocation();
        if (!context.getOptions().isAllowLegacyImport()) {
            throw new LoadException("@import is not allowed; use @use instead.", span);
        }
        ParsedModule parsed = resolve(LoadRequest.legacyImport(target.getUrl(), span), span);
        ModuleManager modules = context.getModules();
        String canonical = parsed.getCanonicalUrl();
        modules.begin(canonical, span, false);
        modules.recordSource(canonical, parsed.getSource(), parsed.isDependency());
        String savedUrl = url;
        boolean savedDependency = dependency;
        try {
            url = canonical;
            dependency = parsed.isDependency();
            executeAll(parsed.getStylesheet().getChildren());
        } catch (RuntimeException e) {
            modules.abort(canonical);
            throw e;
        } finally {
            url = savedUrl;
            dependency = savedDependency;
        }
        modules.finish(canonical, null);
    }

    private ParsedModule resolve(LoadRequest request, SourceLocation span) {
        ParsedModule parsed = context.getLoader().resolve(request, new LoadContext(url, dependency));
        if (parsed == null) {
            throw new LoadException("Can't find stylesheet to import.", span);
        }
        return parsed;
    }

    @Override
    public Void visitUseRule(UseRule node, Void ctx) {
        Configuration config = evaluateConfiguration(node.getConfiguration());
        Module module = loadModule(node.getUrl(), node.getLocation(), config,
                LoadRequest.use(node.getUrl(), node.getNamespace(), node.getLocation()), true);
        environment.addModule(node.getNamespace(), module);
        upstream.add(module);
        return null;
    }

    @Override
    public Void visitForwardRule(ForwardRule node, Void ctx) {
        Map<String, Configuration.Entry> with = evaluateEntries(node.getConfiguration());
        Configuration forwarded = configuration.throughForward(node.getPrefix(), with);
        Set<String> offered = new HashSet<>(forwarded.getValues().keySet());

        Module module = loadModule(node.getUrl(), node.getLocation(), forwarded,
                LoadRequest.forward(node.getUrl(), node.getShown(), node.getHidden(), node.getLocation()), false);

        String prefix = node.getPrefix() == null ? "" : Names.normalize(node.getPrefix());
        for (String name : offered) {
            if (!forwarded.getValues().containsKey(name)) {
                configuration.remove(prefix + name);
            }
        }
        environment.addForwardedModule(new ForwardedModule(module, node.getPrefix(), node.getShown(), node.getHidden()));
        upstream.add(module);
        return null;
    }

    private Configuration evaluateConfiguration(List<ConfiguredVariable> variables) {
        if (variables.isEmpty()) {
            return Configuration.empty();
        }
        return Configuration.explicit(evaluateEntries(variables));
    }

    private Map<String, Configuration.Entry> evaluateEntries(List<ConfiguredVariable> variables) {
        Map<String, Configuration.Entry> entries = new LinkedHashMap<>();
        for (ConfiguredVariable variable : variables) {
            SassValue value = expressions.evaluate(variable.getExpression()).withoutSlash();
            entries.put(variable.getName(), new Configuration.Entry(value, variable.getLocation(), variable.isGuarded()));
        }
        return entries;
    }

    /**
     * 加载并求值模块；同一 URL 在一次编译中只求值一次
     *
     * @param assertConfigured 是否检查配置项都被 {@code !default} 变量消费
     */
    private Module loadModule(String moduleUrl, SourceLocation span, Configuration config,
                              LoadRequest request, boolean assertConfigured) {
        if (moduleUrl.startsWith("sass:")) {
            Module builtin = context.getRegistry().getModule(moduleUrl);
            if (builtin == null) {
                throw new LoadException("Can't find stylesheet to import.", span);
            }
            if (!config.isEmpty() && !config.isImplicit()) {
                throw new LoadException("Built-in modules can't be configured.", span);
            }
            return builtin;
        }

        ParsedModule parsed = resolve(request, span);
        String canonical = parsed.getCanonicalUrl();
        ModuleManager modules = context.getModules();
        Module cached = modules.get(canonical);
        if (cached != null) {
            if (!config.isEmpty() && !config.isImplicit()) {
                throw new SassRuntimeException(
                        "This module was already loaded, so it can't be configured using \"with\".", span);
            }
            return cached;
        }

        modules.begin(canonical, span, true);
        modules.recordSource(canonical, parsed.getSource(), parsed.isDependency());
        SassModule module;
        try {
            LOG.log(Level.FINE, "Evaluating module {0}", canonical);
            module = new Evaluator(context, canonical, parsed.isDependency(), config)
                    .evaluate(parsed.getStylesheet());
            if (assertConfigured && !config.isImplicit()) {
                if (!config.getValues().isEmpty()) {
                    Configuration.Entry entry = config.getValues().values().iterator().next();
                    throw new SassRuntimeException(
                            "This variable was not declared with !default in the @used module.", entry.getSpan());
                }
            }
        } catch (RuntimeException e) {
            modules.abort(canonical);
            throw e;
        }
        modules.finish(canonical, module);
        return module;
    }

    // ============ 诊断 ============

    @Override
    public Void visitDebugRule(DebugRule node, Void ctx) {
        context.debug(messageOf(node.getExpression()), node.getLocation());
        return null;
    }

    @Override
    public Void visitWarnRule(WarnRule node, Void ctx) {
        context.warn(messageOf(node.getExpression()), node.getLocation(), false);
        return null;
    }

    @Override
    public Void visitErrorRule(ErrorRule node, Void ctx) {
        UserErrorException error = new UserErrorException(messageOf(node.getExpression()), node.getLocation());
        error.setSassStackTrace(context.getCallStack().formatStackTrace());
        throw error;
    }

    private String messageOf(Expression expression) {
        SassValue value = expressions.evaluate(expression);
        return value instanceof SassString ? ((SassString) value).getText() : value.inspect();
    }

    @Override
    public Void visitLoudComment(LoudComment node, Void ctx) {
        if (inFunction) {
            return null;
        }
        parent.addChild(new CssComment(expressions.interpolate(node.getText()), node.getLocation()));
        return null;
    }

    /** 样式表根节点只在入口处求值 */
    @Override
    public Void visitStylesheet(Stylesheet node, Void ctx) {
        executeAll(node.getChildren());
        return null;
    }
}
