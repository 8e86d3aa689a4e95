package com.spicenet.core.element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.spicenet.core.error.ArgumentArityException;
import com.spicenet.core.error.ParameterValidationException;
import com.spicenet.core.parameter.ParameterSpec;
import com.spicenet.core.parameter.ParameterTable;
import com.spicenet.core.parameter.ParameterValues;
import com.spicenet.core.util.SpiceStrings;

/**
 * Base class of every circuit element.
 *
 * <p>An element is identified by its prefix followed by its local name ({@code R} + {@code 1}
 * gives {@code R1}). It owns an ordered list of pins, whose order is the node order of the
 * rendered line, and the values of the parameters declared by its {@link ParameterTable}.
 *
 * <p>Construction binds positional arguments to {@link ParameterTable#parametersFromArgs()} in
 * order, then applies keyword arguments by field name. Supplying more positional arguments
 * than declared, leaving a positional field without value, or naming an unknown field fails.
 *
 * <p>Name uniqueness is enforced by the netlist the element is added to, not here.
 */
public abstract class Element {

    private final String prefix;
    private final String name;
    private final List<Pin> pins;
    private final ParameterValues parameters;

    protected Element(String prefix, ParameterTable table, String name, List<PinBinding> bindings,
                      List<?> args, Map<String, ?> kwargs) {
        this.prefix = SpiceStrings.requireToken(prefix, "prefix");
        this.name = SpiceStrings.requireToken(name, "element name");
        Objects.requireNonNull(bindings, "bindings must not be null");

        Set<String> roles = new HashSet<>();
        List<Pin> list = new ArrayList<>(bindings.size());
        for (PinBinding binding : bindings) {
            if (!roles.add(binding.role())) {
                throw new IllegalArgumentException("Pin role " + binding.role() + " is used twice on " + name());
            }
            list.add(new Pin(this, binding.role(), binding.node()));
        }
        this.pins = List.copyOf(list);
        this.parameters = new ParameterValues(table);

        bindArguments(args == null ? List.of() : args, kwargs == null ? Map.of() : kwargs);
    }

    private void bindArguments(List<?> args, Map<String, ?> kwargs) {
        List<ParameterSpec> fromArgs = parameters.table().parametersFromArgs();
        if (args.size() > fromArgs.size()) {
            throw new ArgumentArityException(name(), fromArgs.size(), args.size());
        }
        for (int i = 0; i < args.size(); i++) {
            parameters.set(fromArgs.get(i).name(), args.get(i));
        }
        for (Map.Entry<String, ?> entry : kwargs.entrySet()) {
            parameters.set(entry.getKey(), entry.getValue());
        }
        for (ParameterSpec spec : fromArgs) {
            if (!parameters.isSet(spec.name())) {
                throw new ArgumentArityException(name(), fromArgs.size(), args.size());
            }
        }
    }

    /**
     * @return the prefix identifying the element kind, e.g. "R"
     */
    public String prefix() {
        return prefix;
    }

    /**
     * @return prefix followed by the local name, e.g. "R1"
     */
    public String name() {
        return prefix + name;
    }

    /**
     * @return the name given at construction, without prefix
     */
    public String localName() {
        return name;
    }

    public List<Pin> pins() {
        return pins;
    }

    /**
     * @param role pin role
     * @return the pin with that role
     * @throws IllegalArgumentException if the element has no such pin
     */
    public Pin pin(String role) {
        for (Pin pin : pins) {
            if (pin.role().equals(role)) {
                return pin;
            }
        }
        throw new IllegalArgumentException(name() + " has no pin " + role);
    }

    /**
     * @return node names in pin order
     */
    public List<String> nodes() {
        return pins.stream().map(Pin::node).toList();
    }

    public ParameterTable parameterTable() {
        return parameters.table();
    }

    /**
     * Returns a parameter value, or its default if it was never assigned.
     *
     * @param parameter field name
     * @return value, may be null
     */
    public Object get(String parameter) {
        return parameters.get(parameter);
    }

    public boolean isSet(String parameter) {
        return parameters.isSet(parameter);
    }

    /**
     * Assigns a parameter.
     *
     * @param parameter field name
     * @param value raw value, validated against the field kind
     * @return this element
     * @throws ParameterValidationException if the field is unknown or the value invalid
     */
    public Element set(String parameter, Object value) {
        parameters.set(parameter, value);
        return this;
    }

    public String formatNodeNames() {
        List<String> fields = new ArrayList<>();
        fields.add(name());
        fields.addAll(nodes());
        return SpiceStrings.joinFields(fields);
    }

    public String formatSpiceParameters() {
        return parameters.format();
    }

    /**
     * @return the element line, without line terminator
     */
    public String toSpice() {
        return SpiceStrings.joinFields(List.of(formatNodeNames(), formatSpiceParameters()));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + " " + name();
    }
}
