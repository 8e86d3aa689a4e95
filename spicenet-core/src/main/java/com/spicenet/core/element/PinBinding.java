package com.spicenet.core.element;

import com.spicenet.core.util.SpiceStrings;

/**
 * A pin role paired with the node it is wired to, used to declare an element's terminals.
 *
 * @param role pin role, e.g. "plus" or "gate"
 * @param node node name
 */
public record PinBinding(
    String role,
    String node
) {
    /**
     * Compact constructor with validation.
     */
    public PinBinding {
        SpiceStrings.requireToken(role, "pin role");
        SpiceStrings.requireToken(node, "node name");
    }
}
