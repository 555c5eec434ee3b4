package scss.runtime.value;

import scss.runtime.SassTypeException;
import scss.runtime.serializer.ValueSerializer;

import java.util.Collections;
import java.util.List;

/**
 * Sass 运行时值的基类
 *
 * <p>值的种类是封闭的（{@link Kind}），各处按种类做穷举 switch。所有值不可变。</p>
 */
public abstract class SassValue {

    /** 值种类 */
    public enum Kind {
        NUMBER, COLOR, STRING, LIST, ARGLIST, MAP, BOOLEAN, NULL, FUNCTION, SELECTOR
    }

    public abstract Kind getKind();

    /** {@code type-of()} 返回的类型名 */
    public abstract String getTypeName();

    /** 只有 false 与 null 为假，空列表为真 */
    public boolean isTruthy() {
        return true;
    }

    public boolean isNull() {
        return false;
    }

    /** 作为列表看待时的元素：非列表值视为单元素列表 */
    public List<SassValue> asList() {
        return Collections.singletonList(this);
    }

    public ListSeparator getSeparator() {
        return ListSeparator.UNDECIDED;
    }

    public boolean isBracketed() {
        return false;
    }

    /** 作为 map 看待：map 自身、空列表为空 map，其余返回 null */
    public SassMap tryMap() {
        return null;
    }

    /** 输出为 CSS 时是否为空白（null、空列表） */
    public boolean isBlank() {
        return false;
    }

    /** 清除数值的斜杠来源（用于变量读取与参数传递） */
    public SassValue withoutSlash() {
        return this;
    }

    // ============ 类型断言 ============

    public SassNumber assertNumber(String name) {
        throw typeError(name, "a number");
    }

    public SassColor assertColor(String name) {
        throw typeError(name, "a color");
    }

    public SassString assertString(String name) {
        throw typeError(name, "a string");
    }

    public SassMap assertMap(String name) {
        SassMap map = tryMap();
        if (map == null) throw typeError(name, "a map");
        return map;
    }

    public SassFunction assertFunction(String name) {
        throw typeError(name, "a function reference");
    }

    protected SassTypeException typeError(String name, String expected) {
        return new SassTypeException(argumentPrefix(name) + inspect() + " is not " + expected + ".");
    }

    public static String argumentPrefix(String name) {
        return name == null ? "" : "$" + name + ": ";
    }

    // ============ 列表索引 ============

    /**
     * 将 Sass 下标（从 1 开始，负数从尾部计）转换为 Java 下标
     */
    public int sassIndexToListIndex(SassValue index, String name) {
        SassNumber number = index.assertNumber(name);
        int size = asList().size();
        if (size == 0) {
            throw new SassTypeException(argumentPrefix(name) + "List " + inspect() + " is empty.");
        }
        int i = number.assertInt(name);
        if (i == 0 || Math.abs(i) > size) {
            throw new SassTypeException(argumentPrefix(name) + "Invalid index " + i + " for a list with "
                    + size + " element" + (size == 1 ? "" : "s") + ".");
        }
        return i < 0 ? size + i : i - 1;
    }

    // ============ 运算 ============

    /** {@code +}：非数值默认按字符串拼接，右侧带引号时结果带引号 */
    public SassValue plus(SassValue other) {
        if (other instanceof SassString) {
            SassString string = (SassString) other;
            return new SassString(toCssString() + string.getText(), string.isQuoted());
        }
        return SassString.unquoted(toCssString() + other.toCssString());
    }

    public SassValue minus(SassValue other) {
        return SassString.unquoted(toCssString() + "-" + other.toCssString());
    }

    public SassValue dividedBy(SassValue other) {
        return SassString.unquoted(toCssString() + "/" + other.toCssString());
    }

    public SassValue times(SassValue other) {
        throw undefinedOperation("*", other);
    }

    public SassValue modulo(SassValue other) {
        throw undefinedOperation("%", other);
    }

    public SassValue unaryPlus() {
        return SassString.unquoted("+" + toCssString());
    }

    public SassValue unaryMinus() {
        return SassString.unquoted("-" + toCssString());
    }

    public SassValue unaryDivide() {
        return SassString.unquoted("/" + toCssString());
    }

    public SassBoolean greaterThan(SassValue other) {
        throw undefinedOperation(">", other);
    }

    public SassBoolean greaterThanOrEquals(SassValue other) {
        throw undefinedOperation(">=", other);
    }

    public SassBoolean lessThan(SassValue other) {
        throw undefinedOperation("<", other);
    }

    public SassBoolean lessThanOrEquals(SassValue other) {
        throw undefinedOperation("<=", other);
    }

    protected SassTypeException undefinedOperation(String operator, SassValue other) {
        return new SassTypeException("Undefined operation \"" + inspect() + " " + operator + " "
                + other.inspect() + "\".");
    }

    // ============ 文本形式 ============

    /** 作为 CSS 文本（不合法时抛出 {@link SassTypeException}） */
    public String toCssString() {
        return ValueSerializer.toCss(this);
    }

    /** {@code inspect()} 形式 */
    public String inspect() {
        return ValueSerializer.inspect(this);
    }

    @Override
    public String toString() {
        return inspect();
    }
}
