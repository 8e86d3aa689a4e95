package com.spicenet.core.parameter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.spicenet.core.error.ParameterValidationException;
import com.spicenet.core.util.SpiceStrings;

/**
 * Parameter values of one element instance.
 *
 * <p>Values are validated when assigned and stay unchanged until reassigned. A field that was
 * never assigned reports its default through {@link #get(String)} but renders nothing.
 */
public final class ParameterValues {

    private final ParameterTable table;
    private final Map<String, Object> values = new LinkedHashMap<>();

    public ParameterValues(ParameterTable table) {
        this.table = Objects.requireNonNull(table, "table must not be null");
    }

    public ParameterTable table() {
        return table;
    }

    /**
     * Validates and stores a value.
     *
     * @param name field name
     * @param raw raw value
     * @return the stored value
     * @throws ParameterValidationException if the field is unknown or the value is invalid
     */
    public Object set(String name, Object raw) {
        ParameterSpec spec = table.find(name)
            .orElseThrow(() -> new ParameterValidationException(name, raw, "unknown parameter"));
        Object value = spec.validate(raw);
        values.put(name, value);
        return value;
    }

    /**
     * @param name field name
     * @return true if the field was explicitly assigned
     */
    public boolean isSet(String name) {
        return values.containsKey(name);
    }

    /**
     * Returns the stored value, or the declared default if the field is unset.
     *
     * @param name field name
     * @return value, may be null
     * @throws IllegalArgumentException if the field is not declared
     */
    public Object get(String name) {
        ParameterSpec spec = table.find(name)
            .orElseThrow(() -> new IllegalArgumentException("Unknown parameter: " + name));
        return values.containsKey(name) ? values.get(name) : spec.defaultValue();
    }

    /**
     * Returns the tokens of every assigned field producing output, in render order.
     *
     * @return tokens
     */
    public List<String> formatTokens() {
        List<String> tokens = new ArrayList<>();
        for (ParameterSpec spec : table.renderOrder()) {
            if (!values.containsKey(spec.name())) {
                continue;
            }
            Object value = values.get(spec.name());
            if (spec.isNonZero(value)) {
                tokens.add(spec.format(value));
            }
        }
        return tokens;
    }

    /**
     * @return assigned parameters as a space separated line fragment
     */
    public String format() {
        return SpiceStrings.joinFields(formatTokens());
    }
}
