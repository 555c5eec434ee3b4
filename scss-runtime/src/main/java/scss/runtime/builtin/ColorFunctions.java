package scss.runtime.builtin;

import scss.runtime.ArityException;
import scss.runtime.SassRuntimeException;
import scss.runtime.SassTypeException;
import scss.runtime.value.ListSeparator;
import scss.runtime.value.NumberUtil;
import scss.runtime.value.SassArgList;
import scss.runtime.value.SassColor;
import scss.runtime.value.SassNumber;
import scss.runtime.value.SassString;
import scss.runtime.value.SassValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@code sass:color} 与对应的全局函数
 */
final class ColorFunctions {

    private static final String MODULE = "color";

    private ColorFunctions() {}

    static void register(BuiltinRegistry.Builder r) {
        // ============ 构造 ============

        r.global("rgb", rgb("rgb"));
        r.global("rgba", rgb("rgba"));
        r.global("hsl", hsl("hsl"));
        r.global("hsla", hsl("hsla"));

        // ============ 通道 ============

        r.both(MODULE, "red", "$color", (ctx, args) -> new SassNumber(args.get(0).assertColor("color").getRed()));
        r.both(MODULE, "green", "$color", (ctx, args) -> new SassNumber(args.get(0).assertColor("color").getGreen()));
        r.both(MODULE, "blue", "$color", (ctx, args) -> new SassNumber(args.get(0).assertColor("color").getBlue()));
        r.both(MODULE, "hue", "$color", (ctx, args) ->
                new SassNumber(args.get(0).assertColor("color").getHue(), "deg"));
        r.both(MODULE, "saturation", "$color", (ctx, args) ->
                new SassNumber(args.get(0).assertColor("color").getSaturation(), "%"));
        r.both(MODULE, "lightness", "$color", (ctx, args) ->
                new SassNumber(args.get(0).assertColor("color").getLightness(), "%"));
        r.both(MODULE, "alpha", "$color", (ctx, args) -> {
            SassValue color = args.get(0);
            if (isMicrosoftFilter(color)) {
                return BuiltinSupport.plainCall("alpha", args);
            }
            return new SassNumber(color.assertColor("color").getAlpha());
        });
        r.both(MODULE, "opacity", "$color", (ctx, args) -> {
            if (args.get(0) instanceof SassNumber) {
                return BuiltinSupport.plainCall("opacity", args);
            }
            return new SassNumber(args.get(0).assertColor("color").getAlpha());
        });

        // ============ 混合与变换 ============

        r.both(MODULE, "mix", "$color1, $color2, $weight: 50%", (ctx, args) ->
                mix(args.get(0).assertColor("color1"), args.get(1).assertColor("color2"),
                        args.get(2).assertNumber("weight")));

        r.global("lighten", "$color, $amount", (ctx, args) -> {
            SassColor color = args.get(0).assertColor("color");
            double amount = args.get(1).assertNumber("amount").valueInRange(0, 100, "amount");
            return color.changeHsl(null, null, NumberUtil.clamp(color.getLightness() + amount, 0, 100), null);
        });
        r.global("darken", "$color, $amount", (ctx, args) -> {
            SassColor color = args.get(0).assertColor("color");
            double amount = args.get(1).assertNumber("amount").valueInRange(0, 100, "amount");
            return color.changeHsl(null, null, NumberUtil.clamp(color.getLightness() - amount, 0, 100), null);
        });
        r.global("saturate", BuiltinFunction.overloaded("saturate")
                .overload("$amount", (ctx, args) -> {
                    args.get(0).assertNumber("amount");
                    return BuiltinSupport.plainCall("saturate", args);
                })
                .overload("$color, $amount", (ctx, args) -> {
                    SassColor color = args.get(0).assertColor("color");
                    double amount = args.get(1).assertNumber("amount").valueInRange(0, 100, "amount");
                    return color.changeHsl(null, NumberUtil.clamp(color.getSaturation() + amount, 0, 100), null, null);
                })
                .build());
        r.global("desaturate", "$color, $amount", (ctx, args) -> {
            SassColor color = args.get(0).assertColor("color");
            double amount = args.get(1).assertNumber("amount").valueInRange(0, 100, "amount");
            return color.changeHsl(null, NumberUtil.clamp(color.getSaturation() - amount, 0, 100), null, null);
        });
        r.global("adjust-hue", "$color, $degrees", (ctx, args) -> {
            SassColor color = args.get(0).assertColor("color");
            double degrees = args.get(1).assertNumber("degrees").getValue();
            return color.changeHsl(color.getHue() + degrees, null, null, null);
        });
        r.both(MODULE, "grayscale", "$color", (ctx, args) -> {
            if (args.get(0) instanceof SassNumber) {
                return BuiltinSupport.plainCall("grayscale", args);
            }
            return args.get(0).assertColor("color").changeHsl(null, 0.0, null, null);
        });
        r.both(MODULE, "complement", "$color", (ctx, args) -> {
            SassColor color = args.get(0).assertColor("color");
            return color.changeHsl(color.getHue() + 180, null, null, null);
        });
        r.both(MODULE, "invert", "$color, $weight: 100%", (ctx, args) -> {
            SassNumber weight = args.get(1).assertNumber("weight");
            if (args.get(0) instanceof SassNumber) {
                if (weight.getValue() != 100 || !weight.hasUnit("%")) {
                    throw new SassTypeException("Only one argument may be passed to the plain-CSS invert() function.");
                }
                return BuiltinSupport.plainCall("invert", args.subList(0, 1));
            }
            SassColor color = args.get(0).assertColor("color");
            SassColor inverse = color.changeRgb(255 - color.getRed(), 255 - color.getGreen(),
                    255 - color.getBlue(), null);
            if (NumberUtil.fuzzyEquals(weight.getValue(), 100)) {
                return inverse;
            }
            return mix(inverse, color, weight);
        });

        // ============ 透明度 ============

        BuiltinFunction transparentize = BuiltinFunction.create("transparentize", "$color, $amount",
                (ctx, args) -> {
                    SassColor color = args.get(0).assertColor("color");
                    double amount = args.get(1).assertNumber("amount").valueInRange(0, 1, "amount");
                    return color.changeAlpha(NumberUtil.clamp(color.getAlpha() - amount, 0, 1));
                });
        r.global("transparentize", transparentize);
        r.global("fade-out", transparentize);
        BuiltinFunction opacify = BuiltinFunction.create("opacify", "$color, $amount", (ctx, args) -> {
            SassColor color = args.get(0).assertColor("color");
            double amount = args.get(1).assertNumber("amount").valueInRange(0, 1, "amount");
            return color.changeAlpha(NumberUtil.clamp(color.getAlpha() + amount, 0, 1));
        });
        r.global("opacify", opacify);
        r.global("fade-in", opacify);

        // ============ adjust / scale / change ============

        r.global("adjust-color", r.module(MODULE, "adjust", "$color, $kwargs...",
                (ctx, args) -> updateComponents(args, Mode.ADJUST)));
        r.global("scale-color", r.module(MODULE, "scale", "$color, $kwargs...",
                (ctx, args) -> updateComponents(args, Mode.SCALE)));
        r.global("change-color", r.module(MODULE, "change", "$color, $kwargs...",
                (ctx, args) -> updateComponents(args, Mode.CHANGE)));

        r.both(MODULE, "ie-hex-str", "$color", (ctx, args) -> {
            SassColor color = args.get(0).assertColor("color");
            int alpha = (int) NumberUtil.fuzzyRound(color.getAlpha() * 255);
            return SassString.unquoted(String.format(Locale.ROOT, "#%02X%02X%02X%02X",
                    alpha, color.getRed(), color.getGreen(), color.getBlue()));
        });
    }

    // ============ rgb() / hsl() ============

    private static BuiltinFunction rgb(final String name) {
        return BuiltinFunction.overloaded(name)
                .overload("$red, $green, $blue, $alpha", (ctx, args) -> rgbFromChannels(name, args))
                .overload("$red, $green, $blue", (ctx, args) -> rgbFromChannels(name, args))
                .overload("$color, $alpha", (ctx, args) -> {
                    if (BuiltinSupport.anySpecialFunction(args)) {
                        return BuiltinSupport.plainCall(name, args);
                    }
                    SassColor color = args.get(0).assertColor("color");
                    SassNumber alpha = args.get(1).assertNumber("alpha");
                    return color.changeAlpha(percentageOrUnitless(alpha, 1, "alpha"));
                })
                .overload("$channels", (ctx, args) -> {
                    List<SassValue> channels = parseChannels(name, args.get(0), "red", "green", "blue");
                    if (channels == null) {
                        return BuiltinSupport.plainCall(name, args);
                    }
                    return rgbFromChannels(name, channels);
                })
                .build();
    }

    private static BuiltinFunction hsl(final String name) {
        return BuiltinFunction.overloaded(name)
                .overload("$hue, $saturation, $lightness, $alpha", (ctx, args) -> hslFromChannels(name, args))
                .overload("$hue, $saturation, $lightness", (ctx, args) -> hslFromChannels(name, args))
                .overload("$hue, $saturation", (ctx, args) -> {
                    if (BuiltinSupport.anySpecialFunction(args)) {
                        return BuiltinSupport.plainCall(name, args);
                    }
                    throw new ArityException("Missing argument $lightness.");
                })
                .overload("$channels", (ctx, args) -> {
                    List<SassValue> channels = parseChannels(name, args.get(0), "hue", "saturation", "lightness");
                    if (channels == null) {
                        return BuiltinSupport.plainCall(name, args);
                    }
                    return hslFromChannels(name, channels);
                })
                .build();
    }

    private static SassValue rgbFromChannels(String name, List<SassValue> args) {
        if (BuiltinSupport.anySpecialFunction(args)) {
            return BuiltinSupport.plainCall(name, args);
        }
        double red = percentageOrUnitless(args.get(0).assertNumber("red"), 255, "red");
        double green = percentageOrUnitless(args.get(1).assertNumber("green"), 255, "green");
        double blue = percentageOrUnitless(args.get(2).assertNumber("blue"), 255, "blue");
        double alpha = args.size() > 3 ? percentageOrUnitless(args.get(3).assertNumber("alpha"), 1, "alpha") : 1;
        return SassColor.rgb(red, green, blue, alpha);
    }

    private static SassValue hslFromChannels(String name, List<SassValue> args) {
        if (BuiltinSupport.anySpecialFunction(args)) {
            return BuiltinSupport.plainCall(name, args);
        }
        SassNumber hue = args.get(0).assertNumber("hue");
        double degrees = hue.hasUnits()
                ? hue.convert(Collections.singletonList("deg"), Collections.<String>emptyList()).getValue()
                : hue.getValue();
        double saturation = NumberUtil.clamp(args.get(1).assertNumber("saturation").getValue(), 0, 100);
        double lightness = NumberUtil.clamp(args.get(2).assertNumber("lightness").getValue(), 0, 100);
        double alpha = args.size() > 3 ? percentageOrUnitless(args.get(3).assertNumber("alpha"), 1, "alpha") : 1;
        return SassColor.hsl(degrees, saturation, lightness, alpha);
    }

    /**
     * 拆分 {@code rgb(1 2 3 / 0.5)} 形式的空格列表
     *
     * @return 通道值（可能带 alpha），含 {@code var()} 等无法在编译期计算的值时返回 null
     */
    private static List<SassValue> parseChannels(String name, SassValue channels, String... names) {
        if (BuiltinSupport.isSpecialFunction(channels)) {
            return null;
        }
        SassValue alpha = null;
        List<SassValue> elements;
        if (channels.getSeparator() == ListSeparator.SLASH) {
            List<SassValue> parts = channels.asList();
            if (parts.size() != 2) {
                throw new SassTypeException("Only 2 slash-separated elements allowed, but " + parts.size()
                        + " " + (parts.size() == 1 ? "was" : "were") + " passed.");
            }
            elements = new ArrayList<SassValue>(parts.get(0).asList());
            alpha = parts.get(1);
        } else {
            if (channels.isBracketed() || channels.getSeparator() == ListSeparator.COMMA) {
                throw new SassTypeException("$channels: Expected " + channels.inspect()
                        + " to be a space-separated list.");
            }
            elements = new ArrayList<SassValue>(channels.asList());
            if (!elements.isEmpty()) {
                SassValue last = elements.get(elements.size() - 1);
                if (last instanceof SassNumber && ((SassNumber) last).isSlash()) {
                    SassNumber slash = (SassNumber) last;
                    elements.set(elements.size() - 1, slash.getSlashNumerator());
                    alpha = slash.getSlashDenominator();
                }
            }
        }
        if (BuiltinSupport.anySpecialFunction(elements) || (alpha != null && BuiltinSupport.isSpecialFunction(alpha))) {
            return null;
        }
        if (elements.size() > 3) {
            throw new SassTypeException("$channels: Only 3 elements allowed, but " + elements.size() + " were passed.");
        }
        if (elements.size() < 3) {
            throw new SassTypeException("$channels: Missing element $" + names[elements.size()] + ".");
        }
        if (alpha != null) {
            elements.add(alpha);
        }
        return elements;
    }

    /** 无单位时按原值，百分比时按 max 的比例 */
    private static double percentageOrUnitless(SassNumber number, double max, String name) {
        double value;
        if (!number.hasUnits()) {
            value = number.getValue();
        } else if (number.hasUnit("%")) {
            value = max * number.getValue() / 100;
        } else {
            throw new SassTypeException("$" + name + ": Expected " + number.inspect()
                    + " to have no units or \"%\".");
        }
        return NumberUtil.clamp(value, 0, max);
    }

    private static boolean isMicrosoftFilter(SassValue value) {
        if (!(value instanceof SassString) || ((SassString) value).isQuoted()) return false;
        return ((SassString) value).getText().matches("^[a-zA-Z]+\\s*=.*");
    }

    // ============ mix ============

    static SassColor mix(SassColor color1, SassColor color2, SassNumber weight) {
        double weightScale = weight.valueInRange(0, 100, "weight") / 100;
        double normalizedWeight = weightScale * 2 - 1;
        double alphaDistance = color1.getAlpha() - color2.getAlpha();
        double combinedWeight1 = normalizedWeight * alphaDistance == -1
                ? normalizedWeight
                : (normalizedWeight + alphaDistance) / (1 + normalizedWeight * alphaDistance);
        double weight1 = (combinedWeight1 + 1) / 2;
        double weight2 = 1 - weight1;
        return SassColor.rgb(
                color1.getRed() * weight1 + color2.getRed() * weight2,
                color1.getGreen() * weight1 + color2.getGreen() * weight2,
                color1.getBlue() * weight1 + color2.getBlue() * weight2,
                color1.getAlpha() * weightScale + color2.getAlpha() * (1 - weightScale));
    }

    // ============ adjust / scale / change ============

    private enum Mode { ADJUST, SCALE, CHANGE }

    private static final List<String> COMPONENTS =
            Arrays.asList("red", "green", "blue", "hue", "saturation", "lightness", "alpha");

    private static SassValue updateComponents(List<SassValue> args, Mode mode) {
        SassColor color = args.get(0).assertColor("color");
        SassArgList rest = (SassArgList) args.get(1);
        if (!rest.asList().isEmpty()) {
            throw new ArityException("Only one positional argument is allowed. All other arguments must "
                    + "be passed by name.");
        }
        Map<String, SassNumber> values = new LinkedHashMap<String, SassNumber>();
        List<String> unknown = new ArrayList<String>();
        for (Map.Entry<String, SassValue> entry : rest.getKeywords().entrySet()) {
            if (COMPONENTS.contains(entry.getKey())) {
                values.put(entry.getKey(), entry.getValue().assertNumber(entry.getKey()));
            } else {
                unknown.add(entry.getKey());
            }
        }
        if (!unknown.isEmpty()) {
            throw ArgumentBinder.unknownNames(unknown);
        }
        if (mode == Mode.SCALE && values.containsKey("hue")) {
            throw new ArityException("No argument named $hue.");
        }
        boolean hasRgb = values.containsKey("red") || values.containsKey("green") || values.containsKey("blue");
        boolean hasHsl = values.containsKey("hue") || values.containsKey("saturation")
                || values.containsKey("lightness");
        if (hasRgb && hasHsl) {
            throw new SassRuntimeException("RGB parameters may not be passed along with HSL parameters.");
        }

        Double alpha = values.containsKey("alpha")
                ? update(mode, color.getAlpha(), values.get("alpha"), 1, "alpha") : null;
        if (hasRgb) {
            return color.changeRgb(
                    channel(mode, color.getRed(), values.get("red"), "red"),
                    channel(mode, color.getGreen(), values.get("green"), "green"),
                    channel(mode, color.getBlue(), values.get("blue"), "blue"),
                    alpha);
        }
        if (hasHsl) {
            Double hue = null;
            if (values.containsKey("hue")) {
                double degrees = values.get("hue").getValue();
                hue = mode == Mode.ADJUST ? color.getHue() + degrees : degrees;
            }
            Double saturation = values.containsKey("saturation")
                    ? update(mode, color.getSaturation(), values.get("saturation"), 100, "saturation") : null;
            Double lightness = values.containsKey("lightness")
                    ? update(mode, color.getLightness(), values.get("lightness"), 100, "lightness") : null;
            return color.changeHsl(hue, saturation, lightness, alpha);
        }
        return alpha != null ? color.changeAlpha(alpha) : color;
    }

    private static Integer channel(Mode mode, int current, SassNumber amount, String name) {
        if (amount == null) return null;
        return (int) NumberUtil.fuzzyRound(update(mode, current, amount, 255, name));
    }

    private static double update(Mode mode, double current, SassNumber amount, double max, String name) {
        switch (mode) {
            case ADJUST:
                return NumberUtil.clamp(current + amount.valueInRange(-max, max, name), 0, max);
            case SCALE: {
                amount.assertUnit("%", name);
                double factor = amount.valueInRange(-100, 100, name) / 100;
                return current + (factor > 0 ? max - current : current) * factor;
            }
            default:
                return amount.valueInRange(0, max, name);
        }
    }
}
