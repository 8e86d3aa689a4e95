package com.spicenet.core.element.impl;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.spicenet.core.element.TwoPinElement;
import com.spicenet.core.parameter.ParameterKind;
import com.spicenet.core.parameter.ParameterTable;

/** Current controlled switch. */
public class CurrentControlledSwitch extends TwoPinElement {

    public static final String PREFIX = "W";

    public static final ParameterTable PARAMETERS = ParameterTable.builder()
        .positional(ParameterKind.ELEMENT_NAME, "source", 0)
        .positional(ParameterKind.MODEL, "model", 1)
        .keyParameter(ParameterKind.INITIAL_STATE, "initialState", 2)
        .build();

    public CurrentControlledSwitch(String name, String plus, String minus, Object... args) {
        this(name, plus, minus, Arrays.asList(args), Map.of());
    }

    public CurrentControlledSwitch(String name, String plus, String minus, List<?> args, Map<String, ?> kwargs) {
        super(PREFIX, PARAMETERS, name, plus, minus, args, kwargs);
    }
}
