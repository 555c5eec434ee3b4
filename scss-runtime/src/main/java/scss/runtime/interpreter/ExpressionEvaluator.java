package scss.runtime.interpreter;

import com.scsslang.compiler.ast.AstVisitor;
import com.scsslang.compiler.ast.Interpolation;
import com.scsslang.compiler.ast.SourceLocation;
import com.scsslang.compiler.ast.decl.ArgumentDeclaration;
import com.scsslang.compiler.ast.decl.ArgumentInvocation;
import com.scsslang.compiler.ast.decl.Parameter;
import com.scsslang.compiler.ast.expr.*;
import com.scsslang.compiler.parser.Parser;
import scss.runtime.SassRuntimeException;
import scss.runtime.SassTypeException;
import scss.runtime.UndefinedNameException;
import scss.runtime.builtin.ArgumentBinder;
import scss.runtime.builtin.BuiltinFunction;
import scss.runtime.builtin.BuiltinSupport;
import scss.runtime.builtin.FunctionContext;
import scss.runtime.builtin.SassRandom;
import scss.runtime.css.CssStyleRule;
import scss.runtime.scope.Environment;
import scss.runtime.scope.Module;
import scss.runtime.scope.Names;
import scss.runtime.value.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SassScript 表达式求值
 *
 * <p>与 {@link Evaluator} 共享作用域与调用栈；同时作为内建函数看到的 {@link FunctionContext}。
 * 值运算抛出的异常不带位置，在最内层表达式处补上。</p>
 */
final class ExpressionEvaluator implements AstVisitor<SassValue, Void>, FunctionContext {

    private static final ArgumentDeclaration IF_SIGNATURE =
            new Parser("($condition, $if-true, $if-false)", "sass:meta").parseArgumentDeclaration();

    private static final String DIVISION_DEPRECATION =
            "Using / for division outside of calc() is deprecated and will be removed in Dart Sass 2.0.0.\n\n"
            + "Recommendation: math.div(%s, %s)";

    private final Evaluator evaluator;
    private final CompilationContext context;

    /** 当前内建函数调用处（内建函数的警告位置） */
    private SourceLocation callSite;

    ExpressionEvaluator(Evaluator evaluator, CompilationContext context) {
        this.evaluator = evaluator;
        this.context = context;
    }

    /**
     * 已求值的实参
     */
    static final class Arguments {
        final List<SassValue> positional;
        final Map<String, SassValue> named;
        final ListSeparator separator;

        Arguments(List<SassValue> positional, Map<String, SassValue> named, ListSeparator separator) {
            this.positional = positional;
            this.named = named;
            this.separator = separator;
        }

        /** 传入可调用体时去掉数值的斜杠来源 */
        List<SassValue> positionalWithoutSlash() {
            List<SassValue> result = new ArrayList<>(positional.size());
            for (SassValue value : positional) {
                result.add(value.withoutSlash());
            }
            return result;
        }

        Map<String, SassValue> namedWithoutSlash() {
            Map<String, SassValue> result = new LinkedHashMap<>();
            for (Map.Entry<String, SassValue> entry : named.entrySet()) {
                result.put(entry.getKey(), entry.getValue().withoutSlash());
            }
            return result;
        }
    }

    SassValue evaluate(Expression expression) {
        try {
            return expression.accept(this, null);
        } catch (SassRuntimeException e) {
            throw e.attachLocation(expression.getLocation(), context.sourceLine(expression.getLocation()));
        }
    }

    /**
     * 插值求值：字符串取不带引号的文本，null 为空，其余取 CSS 形式
     */
    String interpolate(Interpolation interpolation) {
        if (interpolation.isPlain()) {
            return interpolation.getAsPlain();
        }
        StringBuilder sb = new StringBuilder();
        for (Object part : interpolation.getParts()) {
            if (part instanceof String) {
                sb.append((String) part);
                continue;
            }
            SassValue value = evaluate((Expression) part);
            if (value instanceof SassString) {
                sb.append(((SassString) value).getText());
            } else if (!value.isNull()) {
                sb.append(value.toCssString());
            }
        }
        return sb.toString();
    }

    // ============ 字面量 ============

    @Override
    public SassValue visitNumberLiteral(NumberLiteral node, Void ctx) {
        return new SassNumber(node.getValue(), node.getUnit());
    }

    @Override
    public SassValue visitStringExpr(StringExpr node, Void ctx) {
        return new SassString(interpolate(node.getText()), node.isQuoted());
    }

    @Override
    public SassValue visitColorLiteral(ColorLiteral node, Void ctx) {
        int rgb = (node.getRed() << 16) | (node.getGreen() << 8) | node.getBlue();
        return SassColor.literal(rgb, node.getAlpha(), node.getOriginalText());
    }

    @Override
    public SassValue visitBooleanLiteral(BooleanLiteral node, Void ctx) {
        return SassBoolean.of(node.getValue());
    }

    @Override
    public SassValue visitNullLiteral(NullLiteral node, Void ctx) {
        return SassNull.INSTANCE;
    }

    @Override
    public SassValue visitParentSelectorExpr(ParentSelectorExpr node, Void ctx) {
        CssStyleRule rule = evaluator.getStyleRuleIgnoringAtRoot();
        return rule == null ? SassNull.INSTANCE : new SassSelector(rule.getSelector());
    }

    // ============ 变量 ============

    @Override
    public SassValue visitVariableExpr(VariableExpr node, Void ctx) {
        SassValue value = node.getNamespace() != null
                ? getModule(node.getNamespace()).getVariable(node.getName())
                : evaluator.environment.getVariable(node.getName());
        if (value == null) {
            throw new UndefinedNameException("Undefined variable.", node.getLocation());
        }
        return value;
    }

    // ============ 运算 ============

    @Override
    public SassValue visitBinaryExpr(BinaryExpr node, Void ctx) {
        BinaryExpr.BinaryOp op = node.getOperator();
        SassValue left = evaluate(node.getLeft());
        switch (op) {
            case OR:
                return left.isTruthy() ? left : evaluate(node.getRight());
            case AND:
                return left.isTruthy() ? evaluate(node.getRight()) : left;
            default:
                break;
        }
        SassValue right = evaluate(node.getRight());
        switch (op) {
            case EQ:
                return SassBoolean.of(left.equals(right));
            case NE:
                return SassBoolean.of(!left.equals(right));
            case LT:
                return left.lessThan(right);
            case LE:
                return left.lessThanOrEquals(right);
            case GT:
                return left.greaterThan(right);
            case GE:
                return left.greaterThanOrEquals(right);
            case ADD:
                return left.plus(right);
            case SUB:
                return left.minus(right);
            case MUL:
                return left.times(right);
            case MOD:
                return left.modulo(right);
            case DIV:
                return divide(node, left, right);
            default:
                throw new IllegalStateException("Unknown operator: " + op);
        }
    }

    /**
     * 两个数字字面量之间的 {@code /} 保留斜杠形式（{@code 1/2} 原样输出），
     * 其余数值相除给出弃用提示
     */
    private SassValue divide(BinaryExpr node, SassValue left, SassValue right) {
        SassValue result = left.dividedBy(right);
        if (left instanceof SassNumber && right instanceof SassNumber && result instanceof SassNumber) {
            if (node.allowsSlash()) {
                return ((SassNumber) result).withSlash((SassNumber) left, (SassNumber) right);
            }
            context.warn(String.format(DIVISION_DEPRECATION, node.getLeft(), node.getRight()),
                    node.getLocation(), true);
        }
        return result;
    }

    @Override
    public SassValue visitUnaryExpr(UnaryExpr node, Void ctx) {
        SassValue operand = evaluate(node.getOperand());
        switch (node.getOperator()) {
            case PLUS:
                return operand.unaryPlus();
            case MINUS:
                return operand.unaryMinus();
            case DIVIDE:
                return operand.unaryDivide();
            case NOT:
                return SassBoolean.of(!operand.isTruthy());
            default:
                throw new IllegalStateException("Unknown operator: " + node.getOperator());
        }
    }

    @Override
    public SassValue visitParenthesizedExpr(ParenthesizedExpr node, Void ctx) {
        return evaluate(node.getInner());
    }

    // ============ 集合 ============

    @Override
    public SassValue visitListExpr(ListExpr node, Void ctx) {
        List<SassValue> values = new ArrayList<>(node.getElements().size());
        for (Expression element : node.getElements()) {
            values.add(evaluate(element));
        }
        return new SassList(values, separatorOf(node.getSeparator()), node.isBracketed());
    }

    private static ListSeparator separatorOf(ListExpr.Separator separator) {
        switch (separator) {
            case COMMA:
                return ListSeparator.COMMA;
            case SPACE:
                return ListSeparator.SPACE;
            case SLASH:
                return ListSeparator.SLASH;
            default:
                return ListSeparator.UNDECIDED;
        }
    }

    @Override
    public SassValue visitMapExpr(MapExpr node, Void ctx) {
        Map<SassValue, SassValue> contents = new LinkedHashMap<>();
        List<Expression> keys = node.getKeys();
        List<Expression> values = node.getValues();
        for (int i = 0; i < keys.size(); i++) {
            SassValue key = evaluate(keys.get(i)).withoutSlash();
            if (contents.containsKey(key)) {
                throw new SassRuntimeException("Duplicate key.", keys.get(i).getLocation());
            }
            contents.put(key, evaluate(values.get(i)).withoutSlash());
        }
        return new SassMap(contents);
    }

    // ============ 调用 ============

    @Override
    public SassValue visitFunctionCallExpr(FunctionCallExpr node, Void ctx) {
        SassCallable callable = lookupFunction(node.getName(), node.getNamespace());
        if (callable == null) {
            if (node.getNamespace() != null) {
                throw new UndefinedNameException("Undefined function.", node.getLocation());
            }
            callable = new PlainCssCallable(node.getName());
        }
        return invoke(callable, evaluateArguments(node.getArguments()), node.getLocation());
    }

    @Override
    public SassValue visitInterpolatedFunctionExpr(InterpolatedFunctionExpr node, Void ctx) {
        PlainCssCallable callable = new PlainCssCallable(interpolate(node.getName()));
        return invoke(callable, evaluateArguments(node.getArguments()), node.getLocation());
    }

    /**
     * {@code if($condition, $if-true, $if-false)}：只求值被选中的分支
     */
    @Override
    public SassValue visitIfExpr(IfExpr node, Void ctx) {
        ArgumentInvocation invocation = node.getArguments();
        if (invocation.getRest() != null || invocation.getKeywordRest() != null) {
            Arguments args = evaluateArguments(invocation);
            List<SassValue> bound = ArgumentBinder.bind(IF_SIGNATURE, args.positional, args.named,
                    args.separator, parameter -> SassNull.INSTANCE);
            return (bound.get(0).isTruthy() ? bound.get(1) : bound.get(2)).withoutSlash();
        }
        Map<String, Expression> named = new LinkedHashMap<>();
        for (Map.Entry<String, Expression> entry : invocation.getNamed().entrySet()) {
            named.put(Names.normalize(entry.getKey()), entry.getValue());
        }
        ArgumentBinder.verify(IF_SIGNATURE, invocation.getPositional().size(), named.keySet());
        Expression[] slots = new Expression[3];
        List<Parameter> parameters = IF_SIGNATURE.getParameters();
        for (int i = 0; i < slots.length; i++) {
            slots[i] = i < invocation.getPositional().size()
                    ? invocation.getPositional().get(i)
                    : named.get(Names.normalize(parameters.get(i).getName()));
        }
        SassValue condition = evaluate(slots[0]);
        return evaluate(condition.isTruthy() ? slots[1] : slots[2]).withoutSlash();
    }

    /**
     * 求值实参并展开 {@code $args...}：map 展开为命名参数，arglist 展开为位置参数加关键字参数，
     * 其余列表展开为位置参数并沿用其分隔符
     */
    Arguments evaluateArguments(ArgumentInvocation invocation) {
        List<SassValue> positional = new ArrayList<>();
        for (Expression expression : invocation.getPositional()) {
            positional.add(evaluate(expression));
        }
        Map<String, SassValue> named = new LinkedHashMap<>();
        for (Map.Entry<String, Expression> entry : invocation.getNamed().entrySet()) {
            named.put(Names.normalize(entry.getKey()), evaluate(entry.getValue()));
        }
        ListSeparator separator = ListSeparator.UNDECIDED;
        if (invocation.getRest() != null) {
            SassValue rest = evaluate(invocation.getRest());
            if (rest instanceof SassMap) {
                addKeywords(named, (SassMap) rest);
            } else if (rest instanceof SassArgList) {
                positional.addAll(rest.asList());
                named.putAll(((SassArgList) rest).getKeywords());
                separator = rest.getSeparator();
            } else if (rest instanceof SassList) {
                positional.addAll(rest.asList());
                separator = rest.getSeparator();
            } else {
                positional.add(rest);
            }
        }
        if (invocation.getKeywordRest() != null) {
            SassValue rest = evaluate(invocation.getKeywordRest());
            SassMap map = rest.tryMap();
            if (map == null) {
                throw new SassTypeException("Variable keyword arguments must be a map (was " + rest.inspect() + ").",
                        invocation.getKeywordRest().getLocation());
            }
            addKeywords(named, map);
        }
        return new Arguments(positional, named, separator);
    }

    private static void addKeywords(Map<String, SassValue> named, SassMap map) {
        for (Map.Entry<SassValue, SassValue> entry : map.getContents().entrySet()) {
            if (!(entry.getKey() instanceof SassString)) {
                throw new SassTypeException("Variable keyword argument map must have string keys.\n"
                        + entry.getKey().inspect() + " is not a string in " + map.inspect() + ".");
            }
            named.put(Names.normalize(((SassString) entry.getKey()).getText()), entry.getValue());
        }
    }

    /**
     * 把实参绑定到作用域；调用方须已把当前作用域切换为 scope（缺省值在其中求值）
     *
     * @return 按形参顺序的值，供调用结束后检查未使用的关键字参数
     */
    List<SassValue> bindArguments(ArgumentDeclaration declaration, Arguments args, final Environment scope) {
        return ArgumentBinder.bind(declaration, args.positionalWithoutSlash(), args.namedWithoutSlash(),
                args.separator, new ArgumentBinder.Sink() {
                    @Override
                    public void bind(String name, SassValue value) {
                        scope.declareLocal(name, value);
                    }

                    @Override
                    public SassValue evaluateDefault(Parameter parameter) {
                        return evaluate(parameter.getDefaultValue()).withoutSlash();
                    }
                });
    }

    SassValue invoke(SassCallable callable, Arguments args, SourceLocation site) {
        if (callable instanceof BuiltinFunction) {
            return callBuiltin((BuiltinFunction) callable, args, site);
        }
        if (callable instanceof UserFunction) {
            return evaluator.callFunction((UserFunction) callable, args, site);
        }
        if (callable instanceof PlainCssCallable) {
            if (!args.named.isEmpty()) {
                throw new SassRuntimeException("Plain CSS functions don't support keyword arguments.", site);
            }
            return BuiltinSupport.plainCall(callable.getName(), args.positional);
        }
        throw new SassTypeException(callable.getName() + " is not a function.", site);
    }

    private SassValue callBuiltin(BuiltinFunction function, Arguments args, SourceLocation site) {
        BuiltinFunction.Overload overload = function.selectOverload(args.positional.size(), args.named.keySet());
        List<SassValue> bound = ArgumentBinder.bind(overload.getSignature(), args.positionalWithoutSlash(),
                args.namedWithoutSlash(), args.separator, this::evaluateBuiltinDefault);
        SourceLocation savedSite = callSite;
        evaluator.enterCall(function.getName(), site);
        try {
            callSite = site;
            SassValue result = overload.getBody().apply(this, bound);
            if (overload.getSignature().hasRest()) {
                ArgumentBinder.checkKeywordsUsed(bound);
            }
            return result;
        } catch (SassRuntimeException e) {
            e.setSassStackTrace(context.getCallStack().formatStackTrace());
            throw e;
        } finally {
            callSite = savedSite;
            evaluator.exitCall();
        }
    }

    /** 内建函数签名的缺省值都是常量，在空作用域中求值 */
    private SassValue evaluateBuiltinDefault(Parameter parameter) {
        Environment saved = evaluator.environment;
        evaluator.environment = new Environment();
        try {
            return evaluate(parameter.getDefaultValue()).withoutSlash();
        } finally {
            evaluator.environment = saved;
        }
    }

    // ============ FunctionContext ============

    @Override
    public SassRandom getRandom() {
        return context.getRandom();
    }

    @Override
    public Environment getEnvironment() {
        return evaluator.environment;
    }

    @Override
    public void warn(String message, boolean deprecation) {
        context.warn(message, callSite, deprecation);
    }

    @Override
    public SassCallable lookupFunction(String name, String namespace) {
        if (namespace != null) {
            return getModule(namespace).getFunction(name);
        }
        SassCallable callable = evaluator.environment.getFunction(name);
        return callable != null ? callable : context.getRegistry().getGlobalFunction(name);
    }

    @Override
    public SassCallable lookupMixin(String name, String namespace) {
        if (namespace != null) {
            return getModule(namespace).getMixin(name);
        }
        return evaluator.environment.getMixin(name);
    }

    @Override
    public SassCallable plainCssFunction(String name) {
        return new PlainCssCallable(name);
    }

    @Override
    public SassValue callFunction(SassCallable callable, List<SassValue> positional, Map<String, SassValue> named) {
        Map<String, SassValue> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, SassValue> entry : named.entrySet()) {
            normalized.put(Names.normalize(entry.getKey()), entry.getValue());
        }
        Arguments args = new Arguments(new ArrayList<>(positional), normalized, ListSeparator.UNDECIDED);
        return invoke(callable, args, callSite);
    }

    @Override
    public boolean contentExists() {
        if (!evaluator.isInMixin()) {
            throw new SassRuntimeException("content-exists() may only be called within a mixin.");
        }
        return evaluator.content != null;
    }

    @Override
    public Module getModule(String namespace) {
        return evaluator.environment.getModule(namespace);
    }
}
