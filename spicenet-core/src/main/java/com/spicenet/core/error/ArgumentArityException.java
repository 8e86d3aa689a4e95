package com.spicenet.core.error;

/**
 * Thrown when an element is constructed with more positional arguments than it declares,
 * or when a positional parameter is left without a value.
 */
public class ArgumentArityException extends NetlistException {

    private final int expected;
    private final int actual;

    public ArgumentArityException(String elementName, int expected, int actual) {
        super("Element " + elementName + " takes " + expected + " positional argument(s) but " + actual + " were given");
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
