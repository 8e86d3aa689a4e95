package com.spicenet.core.element.impl;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.spicenet.core.element.TwoPinElement;
import com.spicenet.core.parameter.ParameterKind;
import com.spicenet.core.parameter.ParameterTable;

/**
 * Independent voltage source. The value is written as given, so it may carry a
 * {@code DC}/{@code AC} value or a transient function.
 */
public class VoltageSource extends TwoPinElement {

    public static final String PREFIX = "V";

    public static final ParameterTable PARAMETERS = ParameterTable.builder()
        .positional(ParameterKind.EXPRESSION, "dcValue", 0)
        .build();

    public VoltageSource(String name, String plus, String minus, Object... args) {
        this(name, plus, minus, Arrays.asList(args), Map.of());
    }

    public VoltageSource(String name, String plus, String minus, List<?> args, Map<String, ?> kwargs) {
        super(PREFIX, PARAMETERS, name, plus, minus, args, kwargs);
    }
}
