package com.spicenet.core.element.impl;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.spicenet.core.element.TwoPortElement;
import com.spicenet.core.parameter.ParameterKind;
import com.spicenet.core.parameter.ParameterTable;

/**
 * Voltage controlled switch.
 *
 * <pre>SXXXXXXX n+ n- nc+ nc- model [on|off]</pre>
 */
public class VoltageControlledSwitch extends TwoPortElement {

    public static final String PREFIX = "S";

    public static final ParameterTable PARAMETERS = ParameterTable.builder()
        .positional(ParameterKind.MODEL, "model", 0)
        .keyParameter(ParameterKind.INITIAL_STATE, "initialState", 1)
        .build();

    public VoltageControlledSwitch(String name, String inputPlus, String inputMinus, String outputPlus, String outputMinus, Object... args) {
        this(name, inputPlus, inputMinus, outputPlus, outputMinus, Arrays.asList(args), Map.of());
    }

    public VoltageControlledSwitch(String name, String inputPlus, String inputMinus, String outputPlus, String outputMinus, List<?> args, Map<String, ?> kwargs) {
        super(PREFIX, PARAMETERS, name, inputPlus, inputMinus, outputPlus, outputMinus, args, kwargs);
    }
}
