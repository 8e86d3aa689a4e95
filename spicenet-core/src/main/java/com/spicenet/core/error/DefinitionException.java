package com.spicenet.core.error;

/**
 * Thrown when a circuit definition file cannot be read or parsed.
 */
public class DefinitionException extends NetlistException {

    public DefinitionException(String message) {
        super(message);
    }

    public DefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
