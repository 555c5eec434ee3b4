package scss.runtime.builtin;

import scss.runtime.SassRuntimeException;
import scss.runtime.SassTypeException;
import scss.runtime.SassUnitException;
import scss.runtime.value.NumberUtil;
import scss.runtime.value.SassArgList;
import scss.runtime.value.SassBoolean;
import scss.runtime.value.SassNumber;
import scss.runtime.value.SassString;
import scss.runtime.value.SassValue;

import java.util.Collections;
import java.util.List;

/**
 * {@code sass:math} 与对应的全局函数
 */
final class MathFunctions {

    private static final String MODULE = "math";

    private MathFunctions() {}

    /** 单参数数值运算 */
    private interface DoubleOp {
        double apply(double value);
    }

    static void register(BuiltinRegistry.Builder r) {
        r.variable(MODULE, "pi", new SassNumber(Math.PI));
        r.variable(MODULE, "e", new SassNumber(Math.E));

        // ============ 取整 ============

        r.both(MODULE, "ceil", "$number", (ctx, args) -> transform(args.get(0), "number", Math::ceil));
        r.both(MODULE, "floor", "$number", (ctx, args) -> transform(args.get(0), "number", Math::floor));
        r.both(MODULE, "round", "$number", (ctx, args) -> transform(args.get(0), "number", NumberUtil::fuzzyRound));
        r.both(MODULE, "abs", "$number", (ctx, args) -> transform(args.get(0), "number", Math::abs));

        // ============ 最值 ============

        r.module(MODULE, "max", "$numbers...", (ctx, args) -> extreme((SassArgList) args.get(0), true));
        r.module(MODULE, "min", "$numbers...", (ctx, args) -> extreme((SassArgList) args.get(0), false));
        r.global("max", "$numbers...", (ctx, args) -> cssExtreme("max", (SassArgList) args.get(0), true));
        r.global("min", "$numbers...", (ctx, args) -> cssExtreme("min", (SassArgList) args.get(0), false));

        r.module(MODULE, "clamp", "$min, $number, $max", (ctx, args) -> {
            SassNumber min = args.get(0).assertNumber("min");
            SassNumber number = args.get(1).assertNumber("number");
            SassNumber max = args.get(2).assertNumber("max");
            checkCompatible(min, "min", number, "number");
            checkCompatible(min, "min", max, "max");
            if (min.greaterThanOrEquals(number).getValue()) return min;
            if (number.greaterThanOrEquals(max).getValue()) return max;
            return number;
        });

        // ============ 单位 ============

        r.both(MODULE, "percentage", "$number", (ctx, args) -> {
            SassNumber number = args.get(0).assertNumber("number");
            number.assertNoUnits("number");
            return new SassNumber(number.getValue() * 100, "%");
        });
        r.both(MODULE, "unit", "$number", (ctx, args) ->
                SassString.quoted(args.get(0).assertNumber("number").getUnitString()));
        BuiltinFunction unitless = r.module(MODULE, "is-unitless", "$number", (ctx, args) ->
                SassBoolean.of(!args.get(0).assertNumber("number").hasUnits()));
        r.global("unitless", unitless);
        BuiltinFunction compatible = r.module(MODULE, "compatible", "$number1, $number2", (ctx, args) ->
                SassBoolean.of(args.get(0).assertNumber("number1")
                        .isComparableTo(args.get(1).assertNumber("number2"))));
        r.global("comparable", compatible);

        // ============ 运算 ============

        BuiltinFunction div = r.module(MODULE, "div", "$number1, $number2", (ctx, args) -> {
            SassValue number1 = args.get(0);
            SassValue number2 = args.get(1);
            if (!(number1 instanceof SassNumber) || !(number2 instanceof SassNumber)) {
                ctx.warn("math.div() will only support number arguments in a future release.", true);
            }
            return number1.dividedBy(number2);
        });
        r.global("divide", div);

        r.module(MODULE, "sqrt", "$number", (ctx, args) -> new SassNumber(Math.sqrt(unitlessValue(args.get(0), "number"))));
        r.module(MODULE, "pow", "$base, $exponent", (ctx, args) -> new SassNumber(
                Math.pow(unitlessValue(args.get(0), "base"), unitlessValue(args.get(1), "exponent"))));
        r.module(MODULE, "log", "$number, $base: null", (ctx, args) -> {
            double number = unitlessValue(args.get(0), "number");
            if (args.get(1).isNull()) {
                return new SassNumber(Math.log(number));
            }
            double base = unitlessValue(args.get(1), "base");
            return new SassNumber(Math.log(number) / Math.log(base));
        });
        r.module(MODULE, "hypot", "$numbers...", (ctx, args) -> {
            List<SassValue> numbers = args.get(0).asList();
            if (numbers.isEmpty()) {
                throw new SassRuntimeException("At least one argument must be passed.");
            }
            SassNumber first = numbers.get(0).assertNumber(null);
            double sum = 0;
            for (int i = 0; i < numbers.size(); i++) {
                SassNumber number = numbers.get(i).assertNumber(null);
                if (number.hasUnits() != first.hasUnits()) {
                    throw new SassUnitException("Argument 1 is " + (first.hasUnits() ? "" : "unit") + "less and argument "
                            + (i + 1) + " is " + (number.hasUnits() ? "" : "unit") + "less.");
                }
                double value = number.coerceValueToMatch(first);
                sum += value * value;
            }
            return new SassNumber(Math.sqrt(sum), first.getNumeratorUnits(), first.getDenominatorUnits());
        });

        // ============ 三角函数 ============

        r.module(MODULE, "sin", "$number", (ctx, args) -> new SassNumber(Math.sin(radians(args.get(0)))));
        r.module(MODULE, "cos", "$number", (ctx, args) -> new SassNumber(Math.cos(radians(args.get(0)))));
        r.module(MODULE, "tan", "$number", (ctx, args) -> new SassNumber(Math.tan(radians(args.get(0)))));
        r.module(MODULE, "asin", "$number", (ctx, args) ->
                new SassNumber(Math.toDegrees(Math.asin(unitlessValue(args.get(0), "number"))), "deg"));
        r.module(MODULE, "acos", "$number", (ctx, args) ->
                new SassNumber(Math.toDegrees(Math.acos(unitlessValue(args.get(0), "number"))), "deg"));
        r.module(MODULE, "atan", "$number", (ctx, args) ->
                new SassNumber(Math.toDegrees(Math.atan(unitlessValue(args.get(0), "number"))), "deg"));

        // ============ 随机数 ============

        r.both(MODULE, "random", "$limit: null", (ctx, args) -> {
            if (args.get(0).isNull()) {
                return new SassNumber(ctx.getRandom().nextDouble());
            }
            SassNumber limit = args.get(0).assertNumber("limit");
            int bound = limit.assertInt("limit");
            if (bound < 1) {
                throw new SassTypeException("$limit: Must be greater than 0, was " + limit.inspect() + ".");
            }
            return new SassNumber(1 + ctx.getRandom().nextInt(bound));
        });
    }

    private static SassValue transform(SassValue value, String name, DoubleOp op) {
        SassNumber number = value.assertNumber(name);
        return number.withValue(op.apply(number.getValue()));
    }

    private static double unitlessValue(SassValue value, String name) {
        SassNumber number = value.assertNumber(name);
        number.assertNoUnits(name);
        return number.getValue();
    }

    /** 无单位按弧度处理，否则须为角度单位 */
    private static double radians(SassValue value) {
        SassNumber number = value.assertNumber("number");
        if (!number.hasUnits()) {
            return number.getValue();
        }
        return number.convert(Collections.singletonList("rad"), Collections.<String>emptyList()).getValue();
    }

    private static void checkCompatible(SassNumber a, String aName, SassNumber b, String bName) {
        if (a.hasUnits() != b.hasUnits()) {
            throw new SassUnitException("$" + aName + " and $" + bName
                    + " must either both have units or both be unitless.");
        }
        if (!a.isComparableTo(b)) {
            throw new SassUnitException("$" + aName + " and $" + bName + " have incompatible units.");
        }
    }

    private static SassNumber extreme(SassArgList args, boolean max) {
        SassNumber result = null;
        for (SassValue value : args.asList()) {
            SassNumber number = value.assertNumber(null);
            if (result == null
                    || (max ? number.greaterThan(result) : number.lessThan(result)).getValue()) {
                result = number;
            }
        }
        if (result == null) {
            throw new SassRuntimeException("At least one argument must be passed.");
        }
        return result;
    }

    /** 全局 min()/max()：参数无法在编译期比较时原样输出为 CSS 函数 */
    private static SassValue cssExtreme(String name, SassArgList args, boolean max) {
        List<SassValue> values = args.asList();
        if (values.isEmpty()) {
            throw new SassRuntimeException("At least one argument must be passed.");
        }
        if (comparableNumbers(values)) {
            return extreme(args, max);
        }
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(values.get(i).toCssString());
        }
        return SassString.unquoted(sb.append(')').toString());
    }

    private static boolean comparableNumbers(List<SassValue> values) {
        for (SassValue value : values) {
            if (!(value instanceof SassNumber)) return false;
        }
        for (int i = 0; i < values.size(); i++) {
            for (int j = i + 1; j < values.size(); j++) {
                if (!((SassNumber) values.get(i)).isComparableTo((SassNumber) values.get(j))) return false;
            }
        }
        return true;
    }
}
