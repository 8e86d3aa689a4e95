package com.spicenet.core.netlist;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A named connection point and the names of the elements touching it.
 *
 * <p>Nodes are a derived view rebuilt by {@link Netlist#nodes()} from the elements' pins. They
 * hold element names rather than elements; use {@link Netlist#elementsOn(Node)} to resolve them.
 *
 * @param name node name
 * @param elementNames names of the connected elements, in netlist order
 */
public record Node(
    String name,
    Set<String> elementNames
) {
    /**
     * Compact constructor with validation.
     */
    public Node {
        Objects.requireNonNull(name, "name must not be null");
        elementNames = elementNames == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(elementNames));
    }
}
