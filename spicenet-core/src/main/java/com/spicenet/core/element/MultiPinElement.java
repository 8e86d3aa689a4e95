package com.spicenet.core.element;

import java.util.List;
import java.util.Map;

import com.spicenet.core.parameter.ParameterTable;

/**
 * Element whose terminals are given as an explicit, already ordered list.
 */
public abstract class MultiPinElement extends Element {

    protected MultiPinElement(String prefix, ParameterTable table, String name, List<PinBinding> bindings,
                              List<?> args, Map<String, ?> kwargs) {
        super(prefix, table, name, bindings, args, kwargs);
    }
}
