package com.spicenet.core.element;

import java.util.List;
import java.util.Map;

import com.spicenet.core.parameter.ParameterTable;

/**
 * Element with an input port and an output port.
 *
 * <p>Input nodes are passed before output nodes, but the netlist expects the output nodes
 * first, so the pins are ordered {@code output_plus, output_minus, input_plus, input_minus}.
 */
public abstract class TwoPortElement extends Element {

    protected TwoPortElement(String prefix, ParameterTable table, String name,
                             String inputPlus, String inputMinus, String outputPlus, String outputMinus,
                             List<?> args, Map<String, ?> kwargs) {
        super(prefix, table, name, List.of(
            new PinBinding("output_plus", outputPlus),
            new PinBinding("output_minus", outputMinus),
            new PinBinding("input_plus", inputPlus),
            new PinBinding("input_minus", inputMinus)
        ), args, kwargs);
    }

    public Pin outputPlus() {
        return pins().get(0);
    }

    public Pin outputMinus() {
        return pins().get(1);
    }

    public Pin inputPlus() {
        return pins().get(2);
    }

    public Pin inputMinus() {
        return pins().get(3);
    }
}
