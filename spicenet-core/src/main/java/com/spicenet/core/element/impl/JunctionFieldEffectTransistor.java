package com.spicenet.core.element.impl;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.spicenet.core.element.MultiPinElement;
import com.spicenet.core.element.PinBinding;
import com.spicenet.core.parameter.ParameterKind;
import com.spicenet.core.parameter.ParameterTable;

/** Junction field effect transistor. */
public class JunctionFieldEffectTransistor extends MultiPinElement {

    public static final String PREFIX = "J";

    public static final ParameterTable PARAMETERS = ParameterTable.builder()
        .positional(ParameterKind.MODEL, "model", 0)
        .key(ParameterKind.KEY_FLOAT, "area", "area")
        .key(ParameterKind.KEY_INT, "multiplier", "m")
        .key(ParameterKind.KEY_FLAG, "off", "off")
        .key(ParameterKind.KEY_FLOAT_PAIR, "initialCondition", "ic")
        .key(ParameterKind.KEY_FLOAT, "temperature", "temp")
        .build();

    public JunctionFieldEffectTransistor(String name, String drain, String gate, String source, Object... args) {
        this(name, drain, gate, source, Arrays.asList(args), Map.of());
    }

    public JunctionFieldEffectTransistor(String name, String drain, String gate, String source, List<?> args, Map<String, ?> kwargs) {
        super(PREFIX, PARAMETERS, name, List.of(
            new PinBinding("drain", drain),
            new PinBinding("gate", gate),
            new PinBinding("source", source)
        ), args, kwargs);
    }
}
