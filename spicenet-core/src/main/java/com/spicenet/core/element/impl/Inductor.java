package com.spicenet.core.element.impl;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.spicenet.core.element.TwoPinElement;
import com.spicenet.core.parameter.ParameterKind;
import com.spicenet.core.parameter.ParameterTable;

/** Inductor. */
public class Inductor extends TwoPinElement {

    public static final String PREFIX = "L";

    public static final ParameterTable PARAMETERS = ParameterTable.builder()
        .positional(ParameterKind.FLOAT, "inductance", 0)
        .keyParameter(ParameterKind.MODEL, "model", 1)
        .key(ParameterKind.KEY_FLOAT, "nt", "nt")
        .key(ParameterKind.KEY_INT, "multiplier", "m")
        .key(ParameterKind.KEY_FLOAT, "scale", "scale")
        .key(ParameterKind.KEY_FLOAT, "temperature", "temp")
        .key(ParameterKind.KEY_FLOAT, "deviceTemperature", "dtemp")
        .key(ParameterKind.KEY_FLOAT, "initialCondition", "ic")
        .build();

    public Inductor(String name, String plus, String minus, Object... args) {
        this(name, plus, minus, Arrays.asList(args), Map.of());
    }

    public Inductor(String name, String plus, String minus, List<?> args, Map<String, ?> kwargs) {
        super(PREFIX, PARAMETERS, name, plus, minus, args, kwargs);
    }
}
