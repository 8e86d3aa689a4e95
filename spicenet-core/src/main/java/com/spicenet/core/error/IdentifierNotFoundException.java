package com.spicenet.core.error;

/**
 * Thrown when an identifier resolves to no element, model or node.
 */
public class IdentifierNotFoundException extends NetlistException {

    private final String identifier;

    public IdentifierNotFoundException(String identifier) {
        super("No element, model or node named " + identifier);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
