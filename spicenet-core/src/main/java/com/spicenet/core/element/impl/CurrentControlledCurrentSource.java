package com.spicenet.core.element.impl;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.spicenet.core.element.TwoPinElement;
import com.spicenet.core.parameter.ParameterKind;
import com.spicenet.core.parameter.ParameterTable;

/**
 * Linear current controlled current source. The controlling current flows through
 * the voltage source named by {@code source}.
 */
public class CurrentControlledCurrentSource extends TwoPinElement {

    public static final String PREFIX = "F";

    public static final ParameterTable PARAMETERS = ParameterTable.builder()
        .positional(ParameterKind.ELEMENT_NAME, "source", 0)
        .positional(ParameterKind.FLOAT, "currentGain", 1)
        .build();

    public CurrentControlledCurrentSource(String name, String plus, String minus, Object... args) {
        this(name, plus, minus, Arrays.asList(args), Map.of());
    }

    public CurrentControlledCurrentSource(String name, String plus, String minus, List<?> args, Map<String, ?> kwargs) {
        super(PREFIX, PARAMETERS, name, plus, minus, args, kwargs);
    }
}
