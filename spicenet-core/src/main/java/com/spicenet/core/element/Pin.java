package com.spicenet.core.element;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.spicenet.core.element.impl.VoltageSource;
import com.spicenet.core.netlist.Netlist;

/**
 * A terminal of an element, bound to a named node.
 *
 * <p>The binding is fixed at construction. The only way to change it is
 * {@link #addCurrentProbe(Netlist)}.
 */
public final class Pin {

    private static final Logger log = LoggerFactory.getLogger(Pin.class);

    private final Element owner;
    private final String role;
    private String node;

    Pin(Element owner, String role, String node) {
        this.owner = Objects.requireNonNull(owner, "owner must not be null");
        this.role = role;
        this.node = node;
    }

    public Element owner() {
        return owner;
    }

    public String role() {
        return role;
    }

    public String node() {
        return node;
    }

    /**
     * Splices a zero valued voltage source in series with this pin so that the branch current
     * can be observed.
     *
     * <p>The pin is moved from its node {@code N} to a new node {@code <element>_<role>}, and a
     * voltage source named {@code V<element>_<role>} is added to the netlist between {@code N}
     * and the new node.
     *
     * <p>Not idempotent: a second call on the same pin tries to add a probe with the same name
     * and fails with a {@link com.spicenet.core.error.DuplicateNameException}, leaving the pin and
     * the netlist as they were after the first call.
     *
     * @param netlist netlist receiving the probe
     * @return the inserted probe
     */
    public VoltageSource addCurrentProbe(Netlist netlist) {
        Objects.requireNonNull(netlist, "netlist must not be null");
        String original = node;
        String probeNode = owner.name() + "_" + role;
        VoltageSource probe = new VoltageSource(probeNode, original, probeNode, List.of("0"), Map.of());
        netlist.add(probe);
        node = probeNode;
        log.debug("Inserted current probe {} between {} and {}", probe.name(), original, probeNode);
        return probe;
    }

    @Override
    public String toString() {
        return "Pin " + role + " of " + owner.name() + " on node " + node;
    }
}
