package com.spicenet.core.error;

/**
 * Thrown when a name is already defined in the target netlist scope.
 * The netlist is left unmodified.
 */
public class DuplicateNameException extends NetlistException {

    private final String name;

    public DuplicateNameException(String what, String name) {
        super(what + " name " + name + " is already defined");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
