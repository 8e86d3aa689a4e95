package com.spicenet.core.element;

import java.util.List;
import java.util.Map;

import com.spicenet.core.parameter.ParameterTable;

/**
 * Element with two terminals, {@code plus} and {@code minus}.
 */
public abstract class TwoPinElement extends Element {

    protected TwoPinElement(String prefix, ParameterTable table, String name, String plus, String minus,
                            List<?> args, Map<String, ?> kwargs) {
        super(prefix, table, name, List.of(new PinBinding("plus", plus), new PinBinding("minus", minus)), args, kwargs);
    }

    public Pin plus() {
        return pins().get(0);
    }

    public Pin minus() {
        return pins().get(1);
    }
}
