package com.spicenet.core.element.impl;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.spicenet.core.element.TwoPinElement;
import com.spicenet.core.parameter.ParameterKind;
import com.spicenet.core.parameter.ParameterTable;

/**
 * Resistor.
 *
 * <pre>RXXXXXXX n+ n- value [ac=val] [m=val] [scale=val] [temp=val] [dtemp=val] [tc1=val] [tc2=val] [noisy=0|1]</pre>
 */
public class Resistor extends TwoPinElement {

    public static final String PREFIX = "R";

    public static final ParameterTable PARAMETERS = ParameterTable.builder()
        .positional(ParameterKind.FLOAT, "resistance", 0)
        .key(ParameterKind.KEY_FLOAT, "ac", "ac")
        .key(ParameterKind.KEY_INT, "multiplier", "m")
        .key(ParameterKind.KEY_FLOAT, "scale", "scale")
        .key(ParameterKind.KEY_FLOAT, "temperature", "temp")
        .key(ParameterKind.KEY_FLOAT, "deviceTemperature", "dtemp")
        .key(ParameterKind.KEY_FLOAT, "tc1", "tc1")
        .key(ParameterKind.KEY_FLOAT, "tc2", "tc2")
        .key(ParameterKind.KEY_BOOLEAN, "noisy", "noisy")
        .build();

    public Resistor(String name, String plus, String minus, Object... args) {
        this(name, plus, minus, Arrays.asList(args), Map.of());
    }

    public Resistor(String name, String plus, String minus, List<?> args, Map<String, ?> kwargs) {
        super(PREFIX, PARAMETERS, name, plus, minus, args, kwargs);
    }
}
