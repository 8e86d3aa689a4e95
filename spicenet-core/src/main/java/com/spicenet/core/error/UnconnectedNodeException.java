package com.spicenet.core.error;

import java.util.List;

/**
 * Thrown by the explicit sub-circuit connectivity check when interface nodes
 * have no connecting element.
 */
public class UnconnectedNodeException extends NetlistException {

    private final List<String> nodes;

    public UnconnectedNodeException(String subcircuitName, List<String> nodes) {
        super("SubCircuit " + subcircuitName + " nodes " + nodes + " are not connected");
        this.nodes = List.copyOf(nodes);
    }

    /**
     * @return the unconnected interface nodes, in interface order
     */
    public List<String> getNodes() {
        return nodes;
    }
}
