package scss.runtime.value;

import scss.runtime.SassTypeException;
import scss.runtime.SassUnitException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 数值：浮点量 + 单位表达式（分子/分母单位多重集）
 *
 * <p>由两个数字字面量相除得到的数值会记住斜杠来源，输出为 {@code a/b}；
 * 参与其他任何运算时使用商。</p>
 */
public final class SassNumber extends SassValue {

    private final double value;
    private final List<String> numeratorUnits;
    private final List<String> denominatorUnits;
    private final SassNumber slashNumerator;
    private final SassNumber slashDenominator;

    public SassNumber(double value) {
        this(value, Collections.<String>emptyList(), Collections.<String>emptyList(), null, null);
    }

    public SassNumber(double value, String unit) {
        this(value, unit == null || unit.isEmpty()
                ? Collections.<String>emptyList() : Collections.singletonList(unit),
                Collections.<String>emptyList(), null, null);
    }

    public SassNumber(double value, List<String> numeratorUnits, List<String> denominatorUnits) {
        this(value, numeratorUnits, denominatorUnits, null, null);
    }

    private SassNumber(double value, List<String> numeratorUnits, List<String> denominatorUnits,
                       SassNumber slashNumerator, SassNumber slashDenominator) {
        this.value = value;
        this.numeratorUnits = Collections.unmodifiableList(new ArrayList<>(numeratorUnits));
        this.denominatorUnits = Collections.unmodifiableList(new ArrayList<>(denominatorUnits));
        this.slashNumerator = slashNumerator;
        this.slashDenominator = slashDenominator;
    }

    public double getValue() {
        return value;
    }

    public List<String> getNumeratorUnits() {
        return numeratorUnits;
    }

    public List<String> getDenominatorUnits() {
        return denominatorUnits;
    }

    public boolean hasUnits() {
        return !numeratorUnits.isEmpty() || !denominatorUnits.isEmpty();
    }

    /** 是否为单一分子单位（可直接作为 CSS 值输出） */
    public boolean hasSimpleUnits() {
        return numeratorUnits.size() <= 1 && denominatorUnits.isEmpty();
    }

    public boolean hasUnit(String unit) {
        return numeratorUnits.size() == 1 && denominatorUnits.isEmpty()
                && numeratorUnits.get(0).equals(unit);
    }

    public String getUnitString() {
        return Units.unitString(numeratorUnits, denominatorUnits);
    }

    public SassNumber getSlashNumerator() {
        return slashNumerator;
    }

    public SassNumber getSlashDenominator() {
        return slashDenominator;
    }

    public boolean isSlash() {
        return slashNumerator != null;
    }

    /** 记录斜杠来源 */
    public SassNumber withSlash(SassNumber numerator, SassNumber denominator) {
        return new SassNumber(value, numeratorUnits, denominatorUnits, numerator, denominator);
    }

    @Override
    public SassNumber withoutSlash() {
        return isSlash() ? new SassNumber(value, numeratorUnits, denominatorUnits) : this;
    }

    /** 保留单位，替换数值 */
    public SassNumber withValue(double newValue) {
        return new SassNumber(newValue, numeratorUnits, denominatorUnits);
    }

    public boolean isInt() {
        return NumberUtil.fuzzyIsInt(value);
    }

    public int assertInt(String name) {
        Integer i = NumberUtil.fuzzyAsInt(value);
        if (i == null) {
            throw new SassTypeException(argumentPrefix(name) + inspect() + " is not an int.");
        }
        return i;
    }

    public void assertNoUnits(String name) {
        if (hasUnits()) {
            throw new SassTypeException(argumentPrefix(name) + "Expected " + inspect() + " to have no units.");
        }
    }

    public void assertUnit(String unit, String name) {
        if (!hasUnit(unit)) {
            throw new SassTypeException(argumentPrefix(name) + "Expected " + inspect() + " to have unit \""
                    + unit + "\".");
        }
    }

    /** 数值须落在 [min, max] 内（容差内的越界归到边界） */
    public double valueInRange(double min, double max, String name) {
        double result = NumberUtil.fuzzyCheckRange(value, min, max);
        if (Double.isNaN(result)) {
            throw new SassTypeException(argumentPrefix(name) + "Expected " + inspect() + " to be within "
                    + fmt(min) + getUnitString() + " and " + fmt(max) + getUnitString() + ".");
        }
        return result;
    }

    private static String fmt(double d) {
        return d == Math.rint(d) ? Long.toString((long) d) : Double.toString(d);
    }

    @Override
    public Kind getKind() {
        return Kind.NUMBER;
    }

    @Override
    public String getTypeName() {
        return "number";
    }

    @Override
    public SassNumber assertNumber(String name) {
        return this;
    }

    // ============ 单位换算 ============

    /** 单位是否可比较：任一方无单位，或双方可换算 */
    public boolean isComparableTo(SassNumber other) {
        if (!hasUnits() || !other.hasUnits()) return true;
        try {
            greaterThan(other);
            return true;
        } catch (SassUnitException e) {
            return false;
        }
    }

    /** 是否可换算到 other 的单位（无单位的一方不与有单位的一方兼容） */
    public boolean hasCompatibleUnits(SassNumber other) {
        if (hasUnits() != other.hasUnits()) return false;
        try {
            convertValue(other.numeratorUnits, other.denominatorUnits, false);
            return true;
        } catch (SassUnitException e) {
            return false;
        }
    }

    /** 换算到指定单位，无单位的一方按原值处理 */
    public SassNumber coerce(List<String> numerators, List<String> denominators) {
        return new SassNumber(convertValue(numerators, denominators, true), numerators, denominators);
    }

    /** 换算到 other 的单位后的数值 */
    public double coerceValueToMatch(SassNumber other) {
        return convertValue(other.numeratorUnits, other.denominatorUnits, true);
    }

    /** 严格换算：无单位与有单位之间不可换算 */
    public SassNumber convert(List<String> numerators, List<String> denominators) {
        return new SassNumber(convertValue(numerators, denominators, false), numerators, denominators);
    }

    private double convertValue(List<String> newNumerators, List<String> newDenominators, boolean coerceUnitless) {
        if (numeratorUnits.equals(newNumerators) && denominatorUnits.equals(newDenominators)) {
            return value;
        }
        boolean otherHasUnits = !newNumerators.isEmpty() || !newDenominators.isEmpty();
        if (coerceUnitless && (!hasUnits() || !otherHasUnits)) {
            return value;
        }
        double result = value;
        List<String> oldNumerators = new ArrayList<>(numeratorUnits);
        for (String newNumerator : newNumerators) {
            int index = indexOfCompatible(oldNumerators, newNumerator);
            if (index < 0) throw incompatible(newNumerators, newDenominators);
            result *= Units.conversionFactor(oldNumerators.remove(index), newNumerator);
        }
        List<String> oldDenominators = new ArrayList<>(denominatorUnits);
        for (String newDenominator : newDenominators) {
            int index = indexOfCompatible(oldDenominators, newDenominator);
            if (index < 0) throw incompatible(newNumerators, newDenominators);
            result /= Units.conversionFactor(oldDenominators.remove(index), newDenominator);
        }
        if (!oldNumerators.isEmpty() || !oldDenominators.isEmpty()) {
            throw incompatible(newNumerators, newDenominators);
        }
        return result;
    }

    private static int indexOfCompatible(List<String> units, String unit) {
        for (int i = 0; i < units.size(); i++) {
            if (Units.compatible(units.get(i), unit)) return i;
        }
        return -1;
    }

    private SassUnitException incompatible(List<String> numerators, List<String> denominators) {
        String other = Units.unitString(numerators, denominators);
        if (!hasUnits() || other.isEmpty()) {
            return new SassUnitException("Expected " + inspect() + " to have "
                    + (other.isEmpty() ? "no units" : "unit " + other) + ".");
        }
        return new SassUnitException("Incompatible units " + getUnitString() + " and " + other + ".");
    }

    /** 合并单位并约去可换算的分子/分母 */
    private static SassNumber multiplyUnits(double value, List<String> numerators, List<String> denominators) {
        List<String> newNumerators = new ArrayList<>();
        List<String> remaining = new ArrayList<>(denominators);
        double result = value;
        for (String numerator : numerators) {
            int index = indexOfCompatible(remaining, numerator);
            if (index >= 0) {
                result *= Units.conversionFactor(numerator, remaining.remove(index));
            } else {
                newNumerators.add(numerator);
            }
        }
        return new SassNumber(result, newNumerators, remaining);
    }

    // ============ 运算 ============

    /** 加减取模：无单位的一方取另一方的单位 */
    private SassNumber additive(SassNumber other, double result) {
        if (hasUnits()) return new SassNumber(result, numeratorUnits, denominatorUnits);
        return new SassNumber(result, other.numeratorUnits, other.denominatorUnits);
    }

    private double otherValue(SassNumber other) {
        try {
            return other.coerceValueToMatch(this);
        } catch (SassUnitException e) {
            throw new SassUnitException("Incompatible units " + other.getUnitString() + " and "
                    + getUnitString() + ".");
        }
    }

    @Override
    public SassValue plus(SassValue other) {
        if (other instanceof SassNumber) {
            SassNumber number = (SassNumber) other;
            double v = otherValue(number);
            return additive(number, value + v);
        }
        if (other instanceof SassColor) throw undefinedOperation("+", other);
        return super.plus(other);
    }

    @Override
    public SassValue minus(SassValue other) {
        if (other instanceof SassNumber) {
            SassNumber number = (SassNumber) other;
            double v = otherValue(number);
            return additive(number, value - v);
        }
        if (other instanceof SassColor) throw undefinedOperation("-", other);
        return super.minus(other);
    }

    @Override
    public SassValue times(SassValue other) {
        if (other instanceof SassNumber) {
            SassNumber number = (SassNumber) other;
            List<String> numerators = new ArrayList<>(numeratorUnits);
            numerators.addAll(number.numeratorUnits);
            List<String> denominators = new ArrayList<>(denominatorUnits);
            denominators.addAll(number.denominatorUnits);
            return multiplyUnits(value * number.value, numerators, denominators);
        }
        return super.times(other);
    }

    @Override
    public SassValue dividedBy(SassValue other) {
        if (other instanceof SassNumber) {
            SassNumber number = (SassNumber) other;
            List<String> numerators = new ArrayList<>(numeratorUnits);
            numerators.addAll(number.denominatorUnits);
            List<String> denominators = new ArrayList<>(denominatorUnits);
            denominators.addAll(number.numeratorUnits);
            return multiplyUnits(value / number.value, numerators, denominators);
        }
        if (other instanceof SassColor) throw undefinedOperation("/", other);
        return super.dividedBy(other);
    }

    @Override
    public SassValue modulo(SassValue other) {
        if (other instanceof SassNumber) {
            SassNumber number = (SassNumber) other;
            double v = otherValue(number);
            return additive(number, NumberUtil.moduloLikeSass(value, v));
        }
        return super.modulo(other);
    }

    @Override
    public SassValue unaryPlus() {
        return this;
    }

    @Override
    public SassValue unaryMinus() {
        return withValue(-value);
    }

    private double comparable(SassValue other, String operator) {
        if (!(other instanceof SassNumber)) throw undefinedOperation(operator, other);
        return otherValue((SassNumber) other);
    }

    @Override
    public SassBoolean greaterThan(SassValue other) {
        return SassBoolean.of(NumberUtil.fuzzyGreaterThan(value, comparable(other, ">")));
    }

    @Override
    public SassBoolean greaterThanOrEquals(SassValue other) {
        return SassBoolean.of(NumberUtil.fuzzyGreaterThanOrEquals(value, comparable(other, ">=")));
    }

    @Override
    public SassBoolean lessThan(SassValue other) {
        return SassBoolean.of(NumberUtil.fuzzyLessThan(value, comparable(other, "<")));
    }

    @Override
    public SassBoolean lessThanOrEquals(SassValue other) {
        return SassBoolean.of(NumberUtil.fuzzyLessThanOrEquals(value, comparable(other, "<=")));
    }

    // ============ 相等性 ============

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SassNumber)) return false;
        SassNumber other = (SassNumber) o;
        if (hasUnits() != other.hasUnits()) return false;
        if (!hasUnits()) return NumberUtil.fuzzyEquals(value, other.value);
        double converted;
        try {
            converted = other.convertValue(numeratorUnits, denominatorUnits, false);
        } catch (SassUnitException e) {
            return false;
        }
        return NumberUtil.fuzzyEquals(value, converted);
    }

    @Override
    public int hashCode() {
        double canonical = value;
        for (String unit : numeratorUnits) canonical *= Units.canonicalMultiplier(unit);
        for (String unit : denominatorUnits) canonical /= Units.canonicalMultiplier(unit);
        return NumberUtil.fuzzyHashCode(canonical);
    }
}
