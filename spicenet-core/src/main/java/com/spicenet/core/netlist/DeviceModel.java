package com.spicenet.core.netlist;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.spicenet.core.util.SpiceStrings;

/**
 * Named set of physical parameters describing a device, rendered as a {@code .model} line.
 *
 * <p>Parameter values are not validated; they are written with {@code toString()}.
 *
 * @param name model name
 * @param type model type
 * @param parameters model parameters, in insertion order
 */
public record DeviceModel(
    String name,
    ModelType type,
    Map<String, Object> parameters
) {
    /**
     * Compact constructor with validation.
     */
    public DeviceModel {
        SpiceStrings.requireToken(name, "model name");
        Objects.requireNonNull(type, "type must not be null");
        Map<String, Object> copy = new LinkedHashMap<>();
        if (parameters != null) {
            parameters.forEach((key, value) -> copy.put(
                SpiceStrings.requireToken(key, "model parameter name"),
                Objects.requireNonNull(value, "value of model parameter " + key + " must not be null")));
        }
        parameters = Collections.unmodifiableMap(copy);
    }

    /**
     * @return {@code .model <name> <type> (<k=v>, ...)}
     */
    public String toSpice() {
        return ".model " + name + " " + type + " (" + SpiceStrings.joinDict(parameters) + ")";
    }
}
