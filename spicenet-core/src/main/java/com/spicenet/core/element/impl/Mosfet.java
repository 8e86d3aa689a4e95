package com.spicenet.core.element.impl;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.spicenet.core.element.MultiPinElement;
import com.spicenet.core.element.PinBinding;
import com.spicenet.core.parameter.ParameterKind;
import com.spicenet.core.parameter.ParameterTable;

/**
 * MOS field effect transistor.
 *
 * <p>{@code ic} takes the pair {@code vds,vgs}.
 */
public class Mosfet extends MultiPinElement {

    public static final String PREFIX = "M";

    public static final ParameterTable PARAMETERS = ParameterTable.builder()
        .positional(ParameterKind.MODEL, "model", 0)
        .key(ParameterKind.KEY_INT, "multiplier", "m")
        .key(ParameterKind.KEY_FLOAT, "length", "l")
        .key(ParameterKind.KEY_FLOAT, "width", "w")
        .key(ParameterKind.KEY_FLOAT, "drainSquares", "nrd")
        .key(ParameterKind.KEY_FLOAT, "sourceSquares", "nrs")
        .key(ParameterKind.KEY_FLAG, "off", "off")
        .key(ParameterKind.KEY_FLOAT_PAIR, "initialCondition", "ic")
        .key(ParameterKind.KEY_FLOAT, "temperature", "temp")
        .build();

    public Mosfet(String name, String drain, String gate, String source, String bulk, Object... args) {
        this(name, drain, gate, source, bulk, Arrays.asList(args), Map.of());
    }

    public Mosfet(String name, String drain, String gate, String source, String bulk, List<?> args, Map<String, ?> kwargs) {
        super(PREFIX, PARAMETERS, name, List.of(
            new PinBinding("drain", drain),
            new PinBinding("gate", gate),
            new PinBinding("source", source),
            new PinBinding("bulk", bulk)
        ), args, kwargs);
    }
}
