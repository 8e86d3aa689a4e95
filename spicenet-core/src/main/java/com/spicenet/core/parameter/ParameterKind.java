package com.spicenet.core.parameter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

import com.spicenet.core.unit.UnitValue;
import com.spicenet.core.util.SpiceStrings;

/**
 * The kinds of element parameters and their validation and rendering rules.
 *
 * <p>Positional kinds render as a bare token in a fixed slot of the element line. Key-value kinds
 * render as {@code name=value}, except for {@link #KEY_FLAG} which renders its bare name.
 *
 * <p>Two kinds do not render their value literally:
 * <ul>
 *   <li>{@link #KEY_FLAG}: a {@code true} value emits the flag token, {@code false} emits nothing</li>
 *   <li>{@link #KEY_BOOLEAN}: {@code true} renders {@code 0}, {@code false} renders {@code 1}</li>
 * </ul>
 */
public enum ParameterKind {

    /** Physical value, stored as a {@link UnitValue}. */
    FLOAT(true) {
        @Override
        Object coerce(Object raw) {
            return UnitValue.valueOf(raw);
        }
    },

    /** Free expression, stored as a string. */
    EXPRESSION(true),

    /** Name of another element, e.g. the controlling source of a current controlled source. */
    ELEMENT_NAME(true),

    /** Name of a device model or sub-circuit. */
    MODEL(true),

    /** Initial switch state, rendered {@code on} or {@code off}. */
    INITIAL_STATE(true) {
        @Override
        Object coerce(Object raw) {
            return toBoolean(raw);
        }

        @Override
        String formatValue(Object value) {
            return (Boolean) value ? "on" : "off";
        }
    },

    KEY_INT(false) {
        @Override
        Object coerce(Object raw) {
            if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
                return ((Number) raw).intValue();
            }
            if (raw instanceof Long value) {
                return Math.toIntExact(value);
            }
            if (raw instanceof Number number) {
                double value = number.doubleValue();
                if (value != Math.rint(value) || Double.isInfinite(value)) {
                    throw new IllegalArgumentException("not an integer");
                }
                if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                    throw new IllegalArgumentException("out of int range");
                }
                return (int) value;
            }
            if (raw instanceof CharSequence chars) {
                return Integer.parseInt(chars.toString().strip());
            }
            throw unsupported(raw);
        }
    },

    KEY_FLOAT(false) {
        @Override
        Object coerce(Object raw) {
            return toDouble(raw);
        }

        @Override
        String formatValue(Object value) {
            return SpiceStrings.formatNumber((Double) value);
        }
    },

    /** Two floats, rendered {@code name=a,b}. */
    KEY_FLOAT_PAIR(false) {
        @Override
        Object coerce(Object raw) {
            List<?> items = toList(raw);
            if (items.size() != 2) {
                throw new IllegalArgumentException("expected a pair of two values, got " + items.size());
            }
            return List.of(toDouble(items.get(0)), toDouble(items.get(1)));
        }

        @Override
        String formatValue(Object value) {
            List<?> pair = (List<?>) value;
            return SpiceStrings.formatNumber((Double) pair.get(0)) + "," + SpiceStrings.formatNumber((Double) pair.get(1));
        }
    },

    KEY_EXPRESSION(false),

    KEY_FLAG(false) {
        @Override
        Object coerce(Object raw) {
            return toBoolean(raw);
        }

        @Override
        boolean isNonZero(Object value) {
            return Boolean.TRUE.equals(value);
        }

        @Override
        String format(ParameterSpec spec, Object value) {
            return isNonZero(value) ? spec.serializedName() : "";
        }
    },

    KEY_BOOLEAN(false) {
        @Override
        Object coerce(Object raw) {
            return toBoolean(raw);
        }

        @Override
        String formatValue(Object value) {
            return (Boolean) value ? "0" : "1";
        }
    };

    private final boolean positional;

    ParameterKind(boolean positional) {
        this.positional = positional;
    }

    /**
     * @return true if values of this kind are bound by position and rendered without a key
     */
    public boolean isPositional() {
        return positional;
    }

    /**
     * Converts a raw value to the stored representation of this kind.
     *
     * <p>The default is a plain string coercion.
     *
     * @param raw raw value, never null
     * @return stored value, immutable
     * @throws IllegalArgumentException if the value cannot be converted
     */
    Object coerce(Object raw) {
        return raw.toString();
    }

    /**
     * Returns whether a stored value produces a token at all.
     *
     * @param value stored value
     * @return false for null and empty values
     */
    boolean isNonZero(Object value) {
        if (value == null) {
            return false;
        }
        return !(value instanceof String text) || !text.isEmpty();
    }

    /**
     * Renders the token for a stored value.
     *
     * @param spec the field being rendered
     * @param value stored value
     * @return token, or an empty string when nothing is emitted
     */
    String format(ParameterSpec spec, Object value) {
        if (positional) {
            return formatValue(value);
        }
        return spec.serializedName() + "=" + formatValue(value);
    }

    String formatValue(Object value) {
        return value.toString();
    }

    private static boolean toBoolean(Object raw) {
        if (raw instanceof Boolean value) {
            return value;
        }
        if (raw instanceof Number number) {
            return number.doubleValue() != 0;
        }
        if (raw instanceof CharSequence chars) {
            return switch (chars.toString().strip().toLowerCase(Locale.ROOT)) {
                case "true", "on", "1", "yes" -> true;
                case "false", "off", "0", "no" -> false;
                default -> throw new IllegalArgumentException("not a boolean");
            };
        }
        throw unsupported(raw);
    }

    private static double toDouble(Object raw) {
        double value;
        if (raw instanceof UnitValue unit) {
            if (unit.isExpression()) {
                throw new IllegalArgumentException("expressions have no numeric value");
            }
            value = unit.doubleValue();
        } else if (raw instanceof Number number) {
            value = number.doubleValue();
        } else if (raw instanceof CharSequence chars) {
            value = toDouble(UnitValue.parse(chars.toString()));
        } else {
            throw unsupported(raw);
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("not a finite number");
        }
        return value;
    }

    private static List<?> toList(Object raw) {
        if (raw instanceof double[] array) {
            return Arrays.stream(array).boxed().toList();
        }
        if (raw instanceof Object[] array) {
            return Arrays.asList(array);
        }
        if (raw instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        throw new IllegalArgumentException("expected a pair of two values");
    }

    private static IllegalArgumentException unsupported(Object raw) {
        if (raw == null) {
            return new IllegalArgumentException("value must not be null");
        }
        return new IllegalArgumentException("unsupported type " + raw.getClass().getSimpleName());
    }
}
