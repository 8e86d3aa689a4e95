package com.spicenet.core.element.impl;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.spicenet.core.element.TwoPortElement;
import com.spicenet.core.parameter.ParameterKind;
import com.spicenet.core.parameter.ParameterTable;

/** Linear voltage controlled current source. */
public class VoltageControlledCurrentSource extends TwoPortElement {

    public static final String PREFIX = "G";

    public static final ParameterTable PARAMETERS = ParameterTable.builder()
        .positional(ParameterKind.FLOAT, "transconductance", 0)
        .build();

    public VoltageControlledCurrentSource(String name, String inputPlus, String inputMinus, String outputPlus, String outputMinus, Object... args) {
        this(name, inputPlus, inputMinus, outputPlus, outputMinus, Arrays.asList(args), Map.of());
    }

    public VoltageControlledCurrentSource(String name, String inputPlus, String inputMinus, String outputPlus, String outputMinus, List<?> args, Map<String, ?> kwargs) {
        super(PREFIX, PARAMETERS, name, inputPlus, inputMinus, outputPlus, outputMinus, args, kwargs);
    }
}
