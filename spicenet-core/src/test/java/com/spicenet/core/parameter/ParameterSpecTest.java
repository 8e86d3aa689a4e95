package com.spicenet.core.parameter;

import com.spicenet.core.error.ParameterValidationException;
import com.spicenet.core.unit.UnitValue;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ParameterSpec} and the rules of each {@link ParameterKind}.
 */
class ParameterSpecTest {

    private static ParameterSpec key(ParameterKind kind, String serializedName) {
        return new ParameterSpec(serializedName, kind, serializedName, -1, false, null);
    }

    private static ParameterSpec positional(ParameterKind kind) {
        return new ParameterSpec("value", kind, null, 0, false, null);
    }

    @Test
    void constructor_positionalWithoutPosition_throwsException() {
        assertThatThrownBy(() -> new ParameterSpec("value", ParameterKind.FLOAT, null, -1, false, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("needs a position");
    }

    @Test
    void constructor_keyValueWithoutSerializedName_throwsException() {
        assertThatThrownBy(() -> new ParameterSpec("temperature", ParameterKind.KEY_FLOAT, null, -1, false, null))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new ParameterSpec("temperature", ParameterKind.KEY_FLOAT, "", -1, false, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_keyValueAsKeyParameter_throwsException() {
        assertThatThrownBy(() -> new ParameterSpec("temperature", ParameterKind.KEY_FLOAT, "temp", -1, true, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be a key parameter");
    }

    @Test
    void constructor_normalizesUnusedComponents() {
        ParameterSpec positional = new ParameterSpec("value", ParameterKind.FLOAT, "ignored", 0, false, null);
        ParameterSpec keyValue = new ParameterSpec("temperature", ParameterKind.KEY_FLOAT, "temp", 5, false, null);

        assertThat(positional.serializedName()).isNull();
        assertThat(keyValue.position()).isEqualTo(-1);
    }

    @Test
    void constructor_coercesDefaultValue() {
        ParameterSpec spec = new ParameterSpec("multiplier", ParameterKind.KEY_INT, "m", -1, false, "4");

        assertThat(spec.defaultValue()).isEqualTo(4);
    }

    @Test
    void validate_null_throwsException() {
        assertThatThrownBy(() -> positional(ParameterKind.FLOAT).validate(null))
            .isInstanceOf(ParameterValidationException.class)
            .hasMessageContaining("must not be null");
    }

    @Test
    void validate_invalidValue_namesParameterAndValue() {
        ParameterSpec spec = key(ParameterKind.KEY_INT, "m");

        assertThatThrownBy(() -> spec.validate("two"))
            .isInstanceOf(ParameterValidationException.class)
            .hasMessageContaining("'two'")
            .hasMessageContaining("'m'")
            .isInstanceOfSatisfying(ParameterValidationException.class, e -> {
                assertThat(e.getParameterName()).isEqualTo("m");
                assertThat(e.getRejectedValue()).isEqualTo("two");
            });
    }

    @Test
    void float_storesUnitValueAndRendersItsText() {
        ParameterSpec spec = positional(ParameterKind.FLOAT);

        Object value = spec.validate("4.7k");

        assertThat(value).isEqualTo(UnitValue.parse("4.7k"));
        assertThat(spec.format(value)).isEqualTo("4.7k");
        assertThat(spec.format(spec.validate(100))).isEqualTo("100");
    }

    @Test
    void expression_isRenderedVerbatim() {
        ParameterSpec spec = positional(ParameterKind.EXPRESSION);

        assertThat(spec.format(spec.validate("PULSE(0 5 1n 1n 1n 5u 10u)"))).isEqualTo("PULSE(0 5 1n 1n 1n 5u 10u)");
        assertThat(spec.isNonZero("")).isFalse();
        assertThat(spec.isNonZero(null)).isFalse();
    }

    @Test
    void initialState_rendersOnOrOff() {
        ParameterSpec spec = positional(ParameterKind.INITIAL_STATE);

        assertThat(spec.format(spec.validate(true))).isEqualTo("on");
        assertThat(spec.format(spec.validate("off"))).isEqualTo("off");
    }

    @Test
    void keyInt_acceptsIntegralValuesOnly() {
        ParameterSpec spec = key(ParameterKind.KEY_INT, "m");

        assertThat(spec.validate(3)).isEqualTo(3);
        assertThat(spec.validate(3L)).isEqualTo(3);
        assertThat(spec.validate(3.0)).isEqualTo(3);
        assertThat(spec.validate(" 7 ")).isEqualTo(7);
        assertThat(spec.format(3)).isEqualTo("m=3");
        assertThatThrownBy(() -> spec.validate(2.5)).isInstanceOf(ParameterValidationException.class);
        assertThatThrownBy(() -> spec.validate(Long.MAX_VALUE)).isInstanceOf(ParameterValidationException.class);
    }

    @Test
    void keyFloat_acceptsNumbersAndSpiceText() {
        ParameterSpec spec = key(ParameterKind.KEY_FLOAT, "temp");

        assertThat(spec.format(spec.validate(27))).isEqualTo("temp=27");
        assertThat(spec.format(spec.validate("1k"))).isEqualTo("temp=1000");
        assertThat(spec.format(spec.validate(0))).isEqualTo("temp=0");
        assertThatThrownBy(() -> spec.validate("{tnom}"))
            .isInstanceOf(ParameterValidationException.class)
            .hasMessageContaining("expressions");
    }

    @Test
    void keyInt_outOfIntRange_throwsException() {
        ParameterSpec spec = key(ParameterKind.KEY_INT, "m");

        assertThatThrownBy(() -> spec.validate(1e20))
            .isInstanceOf(ParameterValidationException.class)
            .hasMessageContaining("out of int range");
        assertThatThrownBy(() -> spec.validate(BigInteger.TEN.pow(12)))
            .isInstanceOf(ParameterValidationException.class);
        assertThat(spec.validate((double) Integer.MAX_VALUE)).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void keyFloat_nonFiniteValue_throwsException() {
        ParameterSpec spec = key(ParameterKind.KEY_FLOAT, "temp");

        for (Object raw : List.of(Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, "1e400")) {
            assertThatThrownBy(() -> spec.validate(raw))
                .hasMessageContaining("not a finite number")
                .isInstanceOfSatisfying(ParameterValidationException.class,
                    e -> assertThat(e.getParameterName()).isEqualTo("temp"));
        }
    }

    @Test
    void keyFloatPair_nonFiniteMember_throwsException() {
        ParameterSpec spec = key(ParameterKind.KEY_FLOAT_PAIR, "ic");

        assertThatThrownBy(() -> spec.validate(List.of(0.6, Double.NaN)))
            .isInstanceOf(ParameterValidationException.class)
            .hasMessageContaining("not a finite number");
    }

    @Test
    void keyFloatPair_nullMember_throwsValidationException() {
        ParameterSpec spec = key(ParameterKind.KEY_FLOAT_PAIR, "ic");

        assertThatThrownBy(() -> spec.validate(Arrays.asList(0.7, null)))
            .isInstanceOf(ParameterValidationException.class)
            .hasMessageContaining("must not be null");
    }

    @Test
    void keyFloatPair_rendersCommaSeparatedPair() {
        ParameterSpec spec = key(ParameterKind.KEY_FLOAT_PAIR, "ic");

        assertThat(spec.format(spec.validate(List.of(0.6, 5)))).isEqualTo("ic=0.6,5");
        assertThat(spec.format(spec.validate(new double[] {1.5, 2.0}))).isEqualTo("ic=1.5,2");
        assertThat(spec.format(spec.validate(new Object[] {"1m", 0}))).isEqualTo("ic=0.001,0");
    }

    @Test
    void keyFloatPair_wrongSize_throwsException() {
        ParameterSpec spec = key(ParameterKind.KEY_FLOAT_PAIR, "ic");

        assertThatThrownBy(() -> spec.validate(List.of(1.0)))
            .isInstanceOf(ParameterValidationException.class)
            .hasMessageContaining("pair");
        assertThatThrownBy(() -> spec.validate(1.0))
            .isInstanceOf(ParameterValidationException.class);
    }

    @Test
    void keyFlag_rendersBareNameOnlyWhenTrue() {
        ParameterSpec spec = key(ParameterKind.KEY_FLAG, "off");

        Object on = spec.validate(true);
        Object off = spec.validate(false);

        assertThat(spec.isNonZero(on)).isTrue();
        assertThat(spec.format(on)).isEqualTo("off");
        assertThat(spec.isNonZero(off)).isFalse();
        assertThat(spec.format(off)).isEmpty();
    }

    @Test
    void keyBoolean_rendersInvertedDigits() {
        ParameterSpec spec = key(ParameterKind.KEY_BOOLEAN, "noisy");

        assertThat(spec.format(spec.validate(true))).isEqualTo("noisy=0");
        assertThat(spec.format(spec.validate(false))).isEqualTo("noisy=1");
        assertThat(spec.isNonZero(false)).isTrue();
    }

    @Test
    void booleanKinds_acceptCommonSpellings() {
        ParameterSpec spec = key(ParameterKind.KEY_BOOLEAN, "noisy");

        assertThat(spec.validate("yes")).isEqualTo(true);
        assertThat(spec.validate("OFF")).isEqualTo(false);
        assertThat(spec.validate(1)).isEqualTo(true);
        assertThat(spec.validate(0)).isEqualTo(false);
        assertThatThrownBy(() -> spec.validate("maybe")).isInstanceOf(ParameterValidationException.class);
    }
}
