package com.spicenet.core.element.impl;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.spicenet.core.element.TwoPinElement;
import com.spicenet.core.parameter.ParameterKind;
import com.spicenet.core.parameter.ParameterTable;

/**
 * Junction diode.
 *
 * <pre>DXXXXXXX n+ n- mname [area=val] [m=val] [pj=val] [off] [ic=vd] [temp=val] [dtemp=val]</pre>
 */
public class Diode extends TwoPinElement {

    public static final String PREFIX = "D";

    public static final ParameterTable PARAMETERS = ParameterTable.builder()
        .positional(ParameterKind.MODEL, "model", 0)
        .key(ParameterKind.KEY_FLOAT, "area", "area")
        .key(ParameterKind.KEY_INT, "multiplier", "m")
        .key(ParameterKind.KEY_FLOAT, "pj", "pj")
        .key(ParameterKind.KEY_FLAG, "off", "off")
        .key(ParameterKind.KEY_FLOAT, "initialCondition", "ic")
        .key(ParameterKind.KEY_FLOAT, "temperature", "temp")
        .key(ParameterKind.KEY_FLOAT, "deviceTemperature", "dtemp")
        .build();

    public Diode(String name, String plus, String minus, Object... args) {
        this(name, plus, minus, Arrays.asList(args), Map.of());
    }

    public Diode(String name, String plus, String minus, List<?> args, Map<String, ?> kwargs) {
        super(PREFIX, PARAMETERS, name, plus, minus, args, kwargs);
    }
}
