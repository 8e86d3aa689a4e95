package com.spicenet.core.element.impl;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.spicenet.core.element.MultiPinElement;
import com.spicenet.core.parameter.ParameterKind;
import com.spicenet.core.parameter.ParameterTable;

/**
 * Mutual coupling between two inductors. It has no pins of its own.
 *
 * <pre>KXXXXXXX LYYYYYYY LZZZZZZZ value</pre>
 */
public class CoupledInductor extends MultiPinElement {

    public static final String PREFIX = "K";

    public static final ParameterTable PARAMETERS = ParameterTable.builder()
        .positional(ParameterKind.ELEMENT_NAME, "inductor1", 0)
        .positional(ParameterKind.ELEMENT_NAME, "inductor2", 1)
        .positional(ParameterKind.FLOAT, "couplingFactor", 2)
        .build();

    public CoupledInductor(String name, Object... args) {
        this(name, Arrays.asList(args), Map.of());
    }

    public CoupledInductor(String name, List<?> args, Map<String, ?> kwargs) {
        super(PREFIX, PARAMETERS, name, List.of(), args, kwargs);
    }
}
