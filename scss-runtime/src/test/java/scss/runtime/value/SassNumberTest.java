package scss.runtime.value;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import scss.runtime.SassTypeException;
import scss.runtime.SassUnitException;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SassNumber 测试")
class SassNumberTest {

    private static SassNumber px(double value) {
        return new SassNumber(value, "px");
    }

    @Test
    @DisplayName("a + a 等于 a * 2")
    void testPlusEqualsTimesTwo() {
        SassNumber a = px(3.5);
        assertThat(a.plus(a)).isEqualTo(a.times(new SassNumber(2)));
    }

    @Test
    @DisplayName("无单位的一方取另一方的单位")
    void testUnitlessTakesOtherUnit() {
        SassValue sum = new SassNumber(1).plus(px(2));
        assertThat(sum).isEqualTo(px(3));
        assertThat(((SassNumber) sum).getUnitString()).isEqualTo("px");
    }

    @Test
    @DisplayName("可换算单位相加按左侧单位")
    void testConvertibleUnits() {
        SassNumber sum = (SassNumber) px(1).plus(new SassNumber(1, "in"));
        assertThat(sum.getValue()).isEqualTo(97.0);
        assertThat(sum.getUnitString()).isEqualTo("px");
    }

    @Test
    @DisplayName("不兼容单位相加报错")
    void testIncompatibleUnits() {
        assertThatThrownBy(() -> px(1).plus(new SassNumber(1, "s")))
                .isInstanceOf(SassUnitException.class)
                .hasMessage("Incompatible units s and px.");
    }

    @Test
    @DisplayName("乘法合并单位，除法约去单位")
    void testMultiplyAndDivideUnits() {
        SassNumber area = (SassNumber) px(2).times(px(3));
        assertThat(area.getNumeratorUnits()).containsExactly("px", "px");
        assertThat(area.hasSimpleUnits()).isFalse();

        SassNumber ratio = (SassNumber) area.dividedBy(px(3));
        assertThat(ratio).isEqualTo(px(2));

        SassNumber unitless = (SassNumber) px(6).dividedBy(px(2));
        assertThat(unitless.hasUnits()).isFalse();
        assertThat(unitless.getValue()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("相等性带容差且跨单位")
    void testFuzzyEquality() {
        assertThat(new SassNumber(0.1 + 0.2)).isEqualTo(new SassNumber(0.3));
        assertThat(new SassNumber(1, "in")).isEqualTo(px(96));
        assertThat(new SassNumber(1, "in").hashCode()).isEqualTo(px(96).hashCode());
        assertThat(px(1)).isNotEqualTo(new SassNumber(1));
    }

    @Test
    @DisplayName("比较运算")
    void testComparison() {
        assertThat(px(1).lessThan(new SassNumber(1, "in")).getValue()).isTrue();
        assertThat(px(2).greaterThanOrEquals(px(2)).getValue()).isTrue();
        assertThatThrownBy(() -> px(1).lessThan(SassString.unquoted("a")))
                .isInstanceOf(SassTypeException.class);
    }

    @Test
    @DisplayName("取模的符号跟随除数")
    void testModulo() {
        assertThat(new SassNumber(-5).modulo(new SassNumber(3))).isEqualTo(new SassNumber(1));
        assertThat(new SassNumber(5).modulo(new SassNumber(-3))).isEqualTo(new SassNumber(-1));
    }

    @Test
    @DisplayName("斜杠形式在运算后消失")
    void testSlash() {
        SassNumber slash = new SassNumber(0.5).withSlash(new SassNumber(1), new SassNumber(2));
        assertThat(slash.isSlash()).isTrue();
        assertThat(slash.toCssString()).isEqualTo("1/2");
        assertThat(slash.withoutSlash().toCssString()).isEqualTo("0.5");
    }

    @Test
    @DisplayName("整数断言")
    void testAssertInt() {
        assertThat(new SassNumber(3.0).assertInt("n")).isEqualTo(3);
        assertThatThrownBy(() -> new SassNumber(1.5).assertInt("n"))
                .isInstanceOf(SassTypeException.class);
    }

    @Test
    @DisplayName("严格换算")
    void testConvert() {
        SassNumber ms = new SassNumber(1, "s").convert(Collections.singletonList("ms"),
                Collections.<String>emptyList());
        assertThat(ms.getValue()).isEqualTo(1000.0);
        assertThatThrownBy(() -> new SassNumber(1).convert(Arrays.asList("px"), Collections.<String>emptyList()))
                .isInstanceOf(SassUnitException.class);
    }
}
