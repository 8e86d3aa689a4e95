package com.spicenet.core.element.impl;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.spicenet.core.element.MultiPinElement;
import com.spicenet.core.element.PinBinding;
import com.spicenet.core.parameter.ParameterKind;
import com.spicenet.core.parameter.ParameterTable;

/**
 * Bipolar junction transistor.
 *
 * <pre>QXXXXXXX nc nb ne mname [area=val] [areac=val] [areab=val] [m=val] [off] [ic=vbe,vce] [temp=val] [dtemp=val]</pre>
 */
public class BipolarTransistor extends MultiPinElement {

    public static final String PREFIX = "Q";

    public static final ParameterTable PARAMETERS = ParameterTable.builder()
        .positional(ParameterKind.MODEL, "model", 0)
        .key(ParameterKind.KEY_FLOAT, "area", "area")
        .key(ParameterKind.KEY_FLOAT, "areac", "areac")
        .key(ParameterKind.KEY_FLOAT, "areab", "areab")
        .key(ParameterKind.KEY_INT, "multiplier", "m")
        .key(ParameterKind.KEY_FLAG, "off", "off")
        .key(ParameterKind.KEY_FLOAT_PAIR, "initialCondition", "ic")
        .key(ParameterKind.KEY_FLOAT, "temperature", "temp")
        .key(ParameterKind.KEY_FLOAT, "deviceTemperature", "dtemp")
        .build();

    public BipolarTransistor(String name, String collector, String base, String emitter, Object... args) {
        this(name, collector, base, emitter, Arrays.asList(args), Map.of());
    }

    public BipolarTransistor(String name, String collector, String base, String emitter, List<?> args, Map<String, ?> kwargs) {
        super(PREFIX, PARAMETERS, name, List.of(
            new PinBinding("collector", collector),
            new PinBinding("base", base),
            new PinBinding("emitter", emitter)
        ), args, kwargs);
    }
}
