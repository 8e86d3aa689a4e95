package com.spicenet.core.parameter;

import java.util.Objects;

import com.spicenet.core.error.ParameterValidationException;
import com.spicenet.core.util.SpiceStrings;

/**
 * Declaration of one element parameter.
 *
 * @param name field identifier, used for keyword arguments and lookups
 * @param kind parameter kind
 * @param serializedName token written in the netlist (key-value kinds only, null otherwise)
 * @param position order index (positional kinds only, -1 otherwise)
 * @param keyParameter true for positional fields that must be supplied by name; they render
 *                     after the purely positional fields
 * @param defaultValue value reported while the field is unset (never rendered)
 */
public record ParameterSpec(
    String name,
    ParameterKind kind,
    String serializedName,
    int position,
    boolean keyParameter,
    Object defaultValue
) {
    /**
     * Compact constructor with validation.
     */
    public ParameterSpec {
        SpiceStrings.requireToken(name, "parameter name");
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind.isPositional()) {
            if (position < 0) {
                throw new IllegalArgumentException("Positional parameter " + name + " needs a position");
            }
            serializedName = null;
        } else {
            SpiceStrings.requireToken(serializedName, "serialized name of " + name);
            if (keyParameter) {
                throw new IllegalArgumentException("Key-value parameter " + name + " cannot be a key parameter");
            }
            position = -1;
        }
        if (defaultValue != null) {
            defaultValue = kind.coerce(defaultValue);
        }
    }

    /**
     * @return true if this field is bound by position
     */
    public boolean isPositional() {
        return kind.isPositional();
    }

    /**
     * Validates a raw value against this field's kind.
     *
     * @param raw raw value
     * @return validated value
     * @throws ParameterValidationException naming this field and the rejected value
     */
    public Object validate(Object raw) {
        if (raw == null) {
            throw new ParameterValidationException(name, null, "value must not be null");
        }
        try {
            return kind.coerce(raw);
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new ParameterValidationException(name, raw, e.getMessage(), e);
        }
    }

    /**
     * Returns whether a stored value produces a token.
     *
     * @param value stored value
     * @return true if {@link #format(Object)} emits something
     */
    public boolean isNonZero(Object value) {
        return kind.isNonZero(value);
    }

    /**
     * Renders a stored value as its netlist token.
     *
     * @param value stored value
     * @return token
     */
    public String format(Object value) {
        return kind.format(this, value);
    }
}
