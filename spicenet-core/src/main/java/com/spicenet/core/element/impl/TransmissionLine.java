package com.spicenet.core.element.impl;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.spicenet.core.element.TwoPortElement;
import com.spicenet.core.parameter.ParameterKind;
import com.spicenet.core.parameter.ParameterTable;

/**
 * Lossless transmission line.
 *
 * <p>The line length is given either by {@code TD} or by {@code F} with an optional {@code NL}.
 */
public class TransmissionLine extends TwoPortElement {

    public static final String PREFIX = "T";

    public static final ParameterTable PARAMETERS = ParameterTable.builder()
        .key(ParameterKind.KEY_FLOAT, "impedance", "Z0")
        .key(ParameterKind.KEY_FLOAT, "timeDelay", "TD")
        .key(ParameterKind.KEY_FLOAT, "frequency", "F")
        .key(ParameterKind.KEY_FLOAT, "normalizedLength", "NL")
        .build();

    public TransmissionLine(String name, String inputPlus, String inputMinus, String outputPlus, String outputMinus, Object... args) {
        this(name, inputPlus, inputMinus, outputPlus, outputMinus, Arrays.asList(args), Map.of());
    }

    public TransmissionLine(String name, String inputPlus, String inputMinus, String outputPlus, String outputMinus, List<?> args, Map<String, ?> kwargs) {
        super(PREFIX, PARAMETERS, name, inputPlus, inputMinus, outputPlus, outputMinus, args, kwargs);
    }
}
