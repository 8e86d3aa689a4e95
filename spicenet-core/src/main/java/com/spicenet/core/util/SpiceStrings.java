package com.spicenet.core.util;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * String helpers for building netlist text.
 *
 * <p>Netlist lines are whitespace sensitive: fields are separated by exactly one space,
 * empty fields are dropped, and every line is terminated by {@code \n}.
 */
public final class SpiceStrings {

    /** Separator between the fields of one netlist line. */
    public static final String FIELD_SEPARATOR = " ";

    /** Line terminator used for every rendered line. */
    public static final String NEWLINE = "\n";

    /** Separator between the entries of a model parameter list. */
    public static final String DICT_SEPARATOR = ", ";

    private static final Pattern WHITESPACE = Pattern.compile("\\s");
    private static final Pattern LINE_BREAKS = Pattern.compile("\\s*[\\r\\n]+\\s*");

    private SpiceStrings() {
        // Prevent instantiation
    }

    /**
     * Joins tokens with a single space, skipping null and empty tokens.
     *
     * @param tokens tokens to join
     * @return space-separated line fragment
     */
    public static String joinFields(Iterable<?> tokens) {
        StringJoiner joiner = new StringJoiner(FIELD_SEPARATOR);
        for (Object token : tokens) {
            if (token == null) {
                continue;
            }
            String text = token.toString();
            if (!text.isEmpty()) {
                joiner.add(text);
            }
        }
        return joiner.toString();
    }

    /**
     * Renders every item on its own line, each line prefixed and newline terminated.
     *
     * @param items items rendered with {@code toString()}
     * @param prefix prefix put in front of every line (may be empty)
     * @return newline-terminated block, empty when there are no items
     */
    public static String joinLines(Iterable<?> items, String prefix) {
        StringBuilder sb = new StringBuilder();
        for (Object item : items) {
            sb.append(prefix).append(item).append(NEWLINE);
        }
        return sb.toString();
    }

    /**
     * Renders a map as {@code k=v, k=v} in iteration order.
     *
     * @param entries entries to render
     * @return comma separated key/value list
     */
    public static String joinDict(Map<String, ?> entries) {
        StringJoiner joiner = new StringJoiner(DICT_SEPARATOR);
        entries.forEach((key, value) -> joiner.add(key + "=" + value));
        return joiner.toString();
    }

    /**
     * Checks that a value can be written as a single netlist token.
     *
     * @param value candidate token
     * @param what description used in the error message
     * @return the value unchanged
     * @throws IllegalArgumentException if the value is blank or contains whitespace
     */
    public static String requireToken(String value, String what) {
        Objects.requireNonNull(value, what + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
        if (WHITESPACE.matcher(value).find()) {
            throw new IllegalArgumentException(what + " must not contain whitespace: '" + value + "'");
        }
        return value;
    }

    /**
     * Collapses line breaks into single spaces so that free text stays on one line.
     *
     * @param text free text
     * @return text without line breaks
     */
    public static String singleLine(String text) {
        return LINE_BREAKS.matcher(text.strip()).replaceAll(FIELD_SEPARATOR);
    }

    /**
     * Wraps a path in double quotes when it contains whitespace.
     *
     * @param path file path
     * @return path, quoted if needed
     */
    public static String quoteIfNeeded(String path) {
        if (WHITESPACE.matcher(path).find()) {
            return "\"" + path + "\"";
        }
        return path;
    }

    /**
     * Formats a number in plain decimal notation without trailing zeros.
     *
     * @param value number to format
     * @return e.g. {@code 1000}, {@code 0.5}, {@code 0.0001}
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Not a finite number: " + value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
