package com.spicenet.core.element.impl;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.spicenet.core.element.TwoPinElement;
import com.spicenet.core.parameter.ParameterKind;
import com.spicenet.core.parameter.ParameterTable;

/** Linear current controlled voltage source. */
public class CurrentControlledVoltageSource extends TwoPinElement {

    public static final String PREFIX = "H";

    public static final ParameterTable PARAMETERS = ParameterTable.builder()
        .positional(ParameterKind.ELEMENT_NAME, "source", 0)
        .positional(ParameterKind.FLOAT, "transresistance", 1)
        .build();

    public CurrentControlledVoltageSource(String name, String plus, String minus, Object... args) {
        this(name, plus, minus, Arrays.asList(args), Map.of());
    }

    public CurrentControlledVoltageSource(String name, String plus, String minus, List<?> args, Map<String, ?> kwargs) {
        super(PREFIX, PARAMETERS, name, plus, minus, args, kwargs);
    }
}
