package com.spicenet.core.element.impl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.spicenet.core.element.MultiPinElement;
import com.spicenet.core.element.PinBinding;
import com.spicenet.core.parameter.ParameterKind;
import com.spicenet.core.parameter.ParameterTable;

/**
 * Instance of a sub-circuit.
 *
 * <p>Nodes are given in the order of the sub-circuit's interface; pin roles are their
 * one-based index ({@code "1"}, {@code "2"}, ...).
 *
 * <pre>XYYYYYYY n1 n2 ... subcircuitName</pre>
 */
public class SubCircuitInstance extends MultiPinElement {

    public static final String PREFIX = "X";

    public static final ParameterTable PARAMETERS = ParameterTable.builder()
        .positional(ParameterKind.MODEL, "subcircuitName", 0)
        .build();

    public SubCircuitInstance(String name, String subcircuitName, String... nodes) {
        this(name, Arrays.asList(nodes), List.of(subcircuitName), Map.of());
    }

    public SubCircuitInstance(String name, List<String> nodes, List<?> args, Map<String, ?> kwargs) {
        super(PREFIX, PARAMETERS, name, bindings(nodes), args, kwargs);
    }

    private static List<PinBinding> bindings(List<String> nodes) {
        List<PinBinding> bindings = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            bindings.add(new PinBinding(Integer.toString(i + 1), nodes.get(i)));
        }
        return bindings;
    }

    public String subcircuitName() {
        return (String) get("subcircuitName");
    }
}
