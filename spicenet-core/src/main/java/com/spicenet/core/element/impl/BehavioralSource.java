package com.spicenet.core.element.impl;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.spicenet.core.element.TwoPinElement;
import com.spicenet.core.parameter.ParameterKind;
import com.spicenet.core.parameter.ParameterTable;

/**
 * Non-linear dependent source defined by a voltage ({@code v=}) or current ({@code i=})
 * expression.
 */
public class BehavioralSource extends TwoPinElement {

    public static final String PREFIX = "B";

    public static final ParameterTable PARAMETERS = ParameterTable.builder()
        .key(ParameterKind.KEY_EXPRESSION, "voltageExpression", "v")
        .key(ParameterKind.KEY_EXPRESSION, "currentExpression", "i")
        .build();

    public BehavioralSource(String name, String plus, String minus, Object... args) {
        this(name, plus, minus, Arrays.asList(args), Map.of());
    }

    public BehavioralSource(String name, String plus, String minus, List<?> args, Map<String, ?> kwargs) {
        super(PREFIX, PARAMETERS, name, plus, minus, args, kwargs);
    }
}
