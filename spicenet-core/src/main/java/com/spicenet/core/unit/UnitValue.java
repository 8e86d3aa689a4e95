package com.spicenet.core.unit;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Physical value in SPICE notation.
 *
 * <p>Values are built from a number ({@code UnitValue.of(1000)} renders {@code 1000}) or parsed
 * from SPICE text ({@code UnitValue.parse("1k")} renders {@code 1k}). Braced parameter
 * expressions such as {@code {rload}} are accepted and rendered verbatim.
 *
 * <p>Instances are immutable.
 */
public final class UnitValue {

    private static final Pattern SPICE_NUMBER = Pattern.compile(
        "([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)([a-zA-Z]*)");

    private static final Pattern EXPRESSION = Pattern.compile("\\{[^{}]+}");

    private static final Map<String, Integer> SCALE_EXPONENTS = Map.of(
        "t", 12,
        "g", 9,
        "meg", 6,
        "k", 3,
        "m", -3,
        "u", -6,
        "n", -9,
        "p", -12,
        "f", -15
    );

    private static final BigDecimal MIL = new BigDecimal("25.4E-6");

    private final String text;
    private final BigDecimal magnitude;

    private UnitValue(String text, BigDecimal magnitude) {
        this.text = text;
        this.magnitude = magnitude;
    }

    /**
     * Creates a value from a number.
     *
     * @param number numeric value
     * @return unit value rendering the number in plain notation
     */
    public static UnitValue of(Number number) {
        Objects.requireNonNull(number, "number must not be null");
        BigDecimal decimal = number instanceof BigDecimal big ? big : new BigDecimal(number.toString());
        decimal = decimal.stripTrailingZeros();
        return new UnitValue(decimal.toPlainString(), decimal);
    }

    /**
     * Parses SPICE notation such as {@code 1k}, {@code 10uF}, {@code 2.2meg} or {@code {rload}}.
     *
     * @param text value text
     * @return parsed value
     * @throws IllegalArgumentException if the text is not a SPICE value
     */
    public static UnitValue parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        String trimmed = text.strip();
        if (EXPRESSION.matcher(trimmed).matches()) {
            return new UnitValue(trimmed, null);
        }
        Matcher matcher = SPICE_NUMBER.matcher(trimmed);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a SPICE value: '" + text + "'");
        }
        BigDecimal mantissa = new BigDecimal(matcher.group(1));
        return new UnitValue(trimmed, mantissa.multiply(scaleOf(matcher.group(2))));
    }

    /**
     * Converts a number, a string or an existing unit value.
     *
     * @param raw value to convert
     * @return unit value
     * @throws IllegalArgumentException if the value has no SPICE representation
     */
    public static UnitValue valueOf(Object raw) {
        if (raw instanceof UnitValue unit) {
            return unit;
        }
        if (raw instanceof Number number) {
            return of(number);
        }
        if (raw instanceof CharSequence chars) {
            return parse(chars.toString());
        }
        throw new IllegalArgumentException("Cannot convert " + (raw == null ? "null" : raw.getClass().getSimpleName())
            + " to a unit value");
    }

    private static BigDecimal scaleOf(String suffix) {
        String lower = suffix.toLowerCase(Locale.ROOT);
        if (lower.startsWith("mil")) {
            return MIL;
        }
        if (lower.startsWith("meg")) {
            return BigDecimal.ONE.scaleByPowerOfTen(SCALE_EXPONENTS.get("meg"));
        }
        if (lower.isEmpty()) {
            return BigDecimal.ONE;
        }
        Integer exponent = SCALE_EXPONENTS.get(lower.substring(0, 1));
        // Anything else is a bare unit name, e.g. "V" or "Ohm".
        return exponent == null ? BigDecimal.ONE : BigDecimal.ONE.scaleByPowerOfTen(exponent);
    }

    /**
     * @return true if this value is a braced parameter expression
     */
    public boolean isExpression() {
        return magnitude == null;
    }

    /**
     * Returns the scaled magnitude, e.g. {@code 1000.0} for {@code 1k}.
     *
     * @return magnitude
     * @throws IllegalStateException if this value is a parameter expression
     */
    public double doubleValue() {
        if (magnitude == null) {
            throw new IllegalStateException("Expression " + text + " has no numeric value");
        }
        return magnitude.doubleValue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UnitValue other)) {
            return false;
        }
        return text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    /**
     * @return canonical SPICE text of this value
     */
    @Override
    public String toString() {
        return text;
    }
}
