package com.spicenet.core.parameter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, immutable set of parameter declarations for one element kind.
 *
 * <p>Each element kind registers its fields once, statically:
 * <pre>{@code
 * static final ParameterTable PARAMETERS = ParameterTable.builder()
 *     .positional(ParameterKind.FLOAT, "capacitance", 0)
 *     .keyParameter(ParameterKind.MODEL, "model", 1)
 *     .key(ParameterKind.KEY_FLOAT, "initial_condition", "ic")
 *     .build();
 * }</pre>
 *
 * <p>Positional fields render first, non-key fields by ascending position followed by
 * key-parameter fields by ascending position. Key-value fields render afterwards in
 * declaration order.
 */
public final class ParameterTable {

    private static final ParameterTable EMPTY = new Builder().build();

    private static final Comparator<ParameterSpec> RENDER_ORDER =
        Comparator.comparing(ParameterSpec::keyParameter).thenComparingInt(ParameterSpec::position);

    private final List<ParameterSpec> positionalParameters;
    private final List<ParameterSpec> keyValueParameters;
    private final List<ParameterSpec> parametersFromArgs;
    private final List<ParameterSpec> renderOrder;
    private final Map<String, ParameterSpec> byName;

    private ParameterTable(List<ParameterSpec> declared) {
        List<ParameterSpec> positional = new ArrayList<>();
        List<ParameterSpec> keyValue = new ArrayList<>();
        Map<String, ParameterSpec> names = new LinkedHashMap<>();
        for (ParameterSpec spec : declared) {
            (spec.isPositional() ? positional : keyValue).add(spec);
            names.put(spec.name(), spec);
        }
        positional.sort(RENDER_ORDER);

        this.positionalParameters = List.copyOf(positional);
        this.keyValueParameters = List.copyOf(keyValue);
        this.parametersFromArgs = positional.stream().filter(spec -> !spec.keyParameter()).toList();
        List<ParameterSpec> all = new ArrayList<>(positional);
        all.addAll(keyValue);
        this.renderOrder = List.copyOf(all);
        this.byName = Collections.unmodifiableMap(names);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a table without any parameter
     */
    public static ParameterTable empty() {
        return EMPTY;
    }

    /**
     * @return positional fields in render order
     */
    public List<ParameterSpec> positionalParameters() {
        return positionalParameters;
    }

    /**
     * @return key-value fields in declaration order
     */
    public List<ParameterSpec> keyValueParameters() {
        return keyValueParameters;
    }

    /**
     * Returns the fields bound to positional constructor arguments: positional fields not
     * flagged as key parameters, by ascending position.
     *
     * @return fields bound by argument order
     */
    public List<ParameterSpec> parametersFromArgs() {
        return parametersFromArgs;
    }

    /**
     * @return every field, positional fields first, in render order
     */
    public List<ParameterSpec> renderOrder() {
        return renderOrder;
    }

    public Optional<ParameterSpec> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    public int size() {
        return byName.size();
    }

    /**
     * Builder registering fields in declaration order.
     */
    public static final class Builder {

        private final List<ParameterSpec> declared = new ArrayList<>();
        private final Set<String> names = new HashSet<>();
        private final Set<Integer> positions = new HashSet<>();

        private Builder() {
        }

        /**
         * Declares a positional field bound by argument order.
         */
        public Builder positional(ParameterKind kind, String name, int position) {
            requirePositional(kind, name, true);
            return add(new ParameterSpec(name, kind, null, position, false, null));
        }

        /**
         * Declares a positional field that must be supplied by name.
         */
        public Builder keyParameter(ParameterKind kind, String name, int position) {
            requirePositional(kind, name, true);
            return add(new ParameterSpec(name, kind, null, position, true, null));
        }

        /**
         * Declares a key-value field.
         */
        public Builder key(ParameterKind kind, String name, String serializedName) {
            return key(kind, name, serializedName, null);
        }

        /**
         * Declares a key-value field with a default value.
         */
        public Builder key(ParameterKind kind, String name, String serializedName, Object defaultValue) {
            requirePositional(kind, name, false);
            return add(new ParameterSpec(name, kind, serializedName, -1, false, defaultValue));
        }

        private static void requirePositional(ParameterKind kind, String name, boolean positional) {
            if (kind.isPositional() != positional) {
                throw new IllegalStateException("Parameter " + name + " cannot be declared "
                    + (positional ? "positional" : "key-value") + " with kind " + kind);
            }
        }

        private Builder add(ParameterSpec spec) {
            if (!names.add(spec.name())) {
                throw new IllegalStateException("Parameter " + spec.name() + " is declared twice");
            }
            if (spec.isPositional() && !positions.add(spec.position())) {
                throw new IllegalStateException("Position " + spec.position() + " is declared twice");
            }
            declared.add(spec);
            return this;
        }

        public ParameterTable build() {
            return new ParameterTable(declared);
        }
    }
}
