package scss.runtime.builtin;

import scss.runtime.SassRuntimeException;
import scss.runtime.SassTypeException;
import scss.runtime.selector.ComplexSelector;
import scss.runtime.selector.CompoundSelector;
import scss.runtime.selector.ExtensionStore;
import scss.runtime.selector.ParentSelector;
import scss.runtime.selector.SelectorCache;
import scss.runtime.selector.SelectorComponent;
import scss.runtime.selector.SelectorList;
import scss.runtime.selector.SelectorParser;
import scss.runtime.selector.SimpleSelector;
import scss.runtime.value.ListSeparator;
import scss.runtime.value.SassBoolean;
import scss.runtime.value.SassList;
import scss.runtime.value.SassNull;
import scss.runtime.value.SassSelector;
import scss.runtime.value.SassString;
import scss.runtime.value.SassValue;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code sass:selector} 与对应的全局函数
 *
 * <p>参数接受字符串、字符串列表或字符串列表的列表。</p>
 */
final class SelectorFunctions {

    private static final String MODULE = "selector";

    private SelectorFunctions() {}

    static void register(BuiltinRegistry.Builder r) {
        r.global("selector-nest", r.module(MODULE, "nest", "$selectors...", (ctx, args) -> {
            List<SassValue> selectors = args.get(0).asList();
            if (selectors.isEmpty()) {
                throw new SassRuntimeException("$selectors: At least one selector must be passed.");
            }
            SelectorList result = null;
            for (SassValue value : selectors) {
                SelectorList selector = selectorFrom(value, null, result != null);
                result = result == null ? selector : selector.resolveParentSelectors(result, true);
            }
            return new SassSelector(result);
        }));

        r.global("selector-append", r.module(MODULE, "append", "$selectors...", (ctx, args) -> {
            List<SassValue> selectors = args.get(0).asList();
            if (selectors.isEmpty()) {
                throw new SassRuntimeException("$selectors: At least one selector must be passed.");
            }
            SelectorList result = null;
            for (SassValue value : selectors) {
                SelectorList selector = selectorFrom(value, null, false);
                result = result == null ? selector : append(result, selector);
            }
            return new SassSelector(result);
        }));

        r.global("selector-parse", r.module(MODULE, "parse", "$selector", (ctx, args) ->
                new SassSelector(selectorFrom(args.get(0), "selector", false))));

        r.both(MODULE, "simple-selectors", "$selector", (ctx, args) -> {
            CompoundSelector compound = SelectorParser.parseCompound(textFrom(args.get(0), "selector"), null);
            List<SassValue> result = new ArrayList<SassValue>();
            for (SimpleSelector simple : compound.getComponents()) {
                result.add(SassString.unquoted(simple.toString()));
            }
            return new SassList(result, result.size() > 1 ? ListSeparator.COMMA : ListSeparator.UNDECIDED);
        });

        r.both(MODULE, "is-superselector", "$super, $sub", (ctx, args) -> {
            SelectorList superSelector = selectorFrom(args.get(0), "super", false);
            SelectorList subSelector = selectorFrom(args.get(1), "sub", false);
            return SassBoolean.of(superSelector.isSuperselector(subSelector));
        });

        r.global("selector-extend", r.module(MODULE, "extend", "$selector, $extendee, $extender", (ctx, args) -> {
            SelectorList selector = selectorFrom(args.get(0), "selector", false);
            SelectorList targets = selectorFrom(args.get(1), "extendee", false);
            SelectorList extender = selectorFrom(args.get(2), "extender", false);
            return new SassSelector(ExtensionStore.extendList(selector, targets, extender));
        }));

        r.global("selector-replace", r.module(MODULE, "replace", "$selector, $original, $replacement",
                (ctx, args) -> {
                    SelectorList selector = selectorFrom(args.get(0), "selector", false);
                    SelectorList targets = selectorFrom(args.get(1), "original", false);
                    SelectorList replacement = selectorFrom(args.get(2), "replacement", false);
                    return new SassSelector(ExtensionStore.replaceList(selector, targets, replacement));
                }));

        r.global("selector-unify", r.module(MODULE, "unify", "$selector1, $selector2", (ctx, args) -> {
            SelectorList selector1 = selectorFrom(args.get(0), "selector1", false);
            SelectorList selector2 = selectorFrom(args.get(1), "selector2", false);
            SelectorList unified = selector1.unify(selector2);
            return unified == null ? SassNull.INSTANCE : new SassSelector(unified);
        }));
    }

    /** 把 child 的每个复杂选择器直接接在 parent 之后（{@code .a} + {@code .b} 得 {@code .a.b}） */
    private static SelectorList append(SelectorList parent, SelectorList child) {
        List<ComplexSelector> prefixed = new ArrayList<ComplexSelector>();
        for (ComplexSelector complex : child.getComponents()) {
            SelectorComponent first = complex.getComponents().get(0);
            if (!(first instanceof CompoundSelector)) {
                throw new SassRuntimeException("Can't append " + complex + " to " + parent + ".");
            }
            List<SimpleSelector> simples = new ArrayList<SimpleSelector>();
            simples.add(new ParentSelector(null));
            simples.addAll(((CompoundSelector) first).getComponents());
            List<SelectorComponent> components = new ArrayList<SelectorComponent>();
            components.add(new CompoundSelector(simples));
            components.addAll(complex.getComponents().subList(1, complex.getComponents().size()));
            prefixed.add(new ComplexSelector(components));
        }
        return new SelectorList(prefixed).resolveParentSelectors(parent, false);
    }

    private static SelectorList selectorFrom(SassValue value, String name, boolean allowParent) {
        if (value instanceof SassSelector) {
            return ((SassSelector) value).getSelector();
        }
        return SelectorCache.shared().parse(textFrom(value, name), null, allowParent, true);
    }

    /** 值转为选择器文本 */
    private static String textFrom(SassValue value, String name) {
        String text = selectorText(value, true);
        if (text == null) {
            throw new SassTypeException(SassValue.argumentPrefix(name) + value.inspect()
                    + " is not a valid selector: it must be a string,\n"
                    + "a list of strings, or a list of lists of strings.");
        }
        return text;
    }

    private static String selectorText(SassValue value, boolean topLevel) {
        if (value instanceof SassString) {
            return ((SassString) value).getText();
        }
        if (value instanceof SassSelector) {
            return ((SassSelector) value).getSelector().render(false);
        }
        if (!(value instanceof SassList) || value.isBracketed()) {
            return null;
        }
        List<SassValue> elements = value.asList();
        if (elements.isEmpty()) {
            return null;
        }
        ListSeparator separator = value.getSeparator();
        if (separator == ListSeparator.COMMA && !topLevel) {
            return null;
        }
        if (separator != ListSeparator.COMMA && separator != ListSeparator.SPACE
                && separator != ListSeparator.UNDECIDED) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < elements.size(); i++) {
            String part = separator == ListSeparator.COMMA
                    ? selectorText(elements.get(i), false)
                    : elements.get(i) instanceof SassString ? ((SassString) elements.get(i)).getText() : null;
            if (part == null) return null;
            if (i > 0) sb.append(separator == ListSeparator.COMMA ? ", " : " ");
            sb.append(part);
        }
        return sb.toString();
    }
}
