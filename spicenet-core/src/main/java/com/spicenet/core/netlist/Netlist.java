package com.spicenet.core.netlist;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.spicenet.core.element.Element;
import com.spicenet.core.element.ElementKind;
import com.spicenet.core.element.impl.Capacitor;
import com.spicenet.core.element.impl.CurrentSource;
import com.spicenet.core.element.impl.Diode;
import com.spicenet.core.element.impl.Inductor;
import com.spicenet.core.element.impl.Resistor;
import com.spicenet.core.element.impl.SubCircuitInstance;
import com.spicenet.core.element.impl.VoltageSource;
import com.spicenet.core.error.DuplicateNameException;
import com.spicenet.core.error.IdentifierNotFoundException;
import com.spicenet.core.util.SpiceStrings;

/**
 * Elements and device models of one netlist scope, plus the node index derived from them.
 *
 * <p>Elements and models keep their insertion order, which is the order they are rendered in.
 * The node index is rebuilt from the elements' pins the first time {@link #nodes()} is read
 * after an element was added.
 *
 * <p>Not thread-safe. Callers sharing a netlist between threads must serialize access to it.
 */
public class Netlist {

    private static final Logger log = LoggerFactory.getLogger(Netlist.class);

    /** Ground node used when none is given. */
    public static final String DEFAULT_GROUND = "0";

    private final String ground;
    private final Map<String, Element> elements = new LinkedHashMap<>();
    private final Map<String, DeviceModel> models = new LinkedHashMap<>();
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private boolean dirty = true;

    public Netlist() {
        this(DEFAULT_GROUND);
    }

    protected Netlist(String ground) {
        this.ground = SpiceStrings.requireToken(ground, "ground node");
    }

    /**
     * @return the ground node name of this scope
     */
    public String gnd() {
        return ground;
    }

    /**
     * Adds an element.
     *
     * @param element element to add
     * @param <E> element type
     * @return the element
     * @throws DuplicateNameException if an element with the same name exists; the netlist is
     *                                left unchanged
     */
    public <E extends Element> E add(E element) {
        Objects.requireNonNull(element, "element must not be null");
        if (elements.containsKey(element.name())) {
            throw new DuplicateNameException("Element", element.name());
        }
        elements.put(element.name(), element);
        dirty = true;
        log.debug("Added element {} on nodes {}", element.name(), element.nodes());
        return element;
    }

    /**
     * Creates an element of the given kind and adds it.
     *
     * @see ElementKind#create(String, List, List, Map)
     */
    public Element element(ElementKind kind, String name, List<String> nodes, List<?> args, Map<String, ?> kwargs) {
        Objects.requireNonNull(kind, "kind must not be null");
        return add(kind.create(name, nodes, args, kwargs));
    }

    public Resistor resistor(String name, String plus, String minus, Object... args) {
        return add(new Resistor(name, plus, minus, args));
    }

    public Capacitor capacitor(String name, String plus, String minus, Object... args) {
        return add(new Capacitor(name, plus, minus, args));
    }

    public Inductor inductor(String name, String plus, String minus, Object... args) {
        return add(new Inductor(name, plus, minus, args));
    }

    public VoltageSource voltageSource(String name, String plus, String minus, Object... args) {
        return add(new VoltageSource(name, plus, minus, args));
    }

    public CurrentSource currentSource(String name, String plus, String minus, Object... args) {
        return add(new CurrentSource(name, plus, minus, args));
    }

    public Diode diode(String name, String anode, String cathode, Object... args) {
        return add(new Diode(name, anode, cathode, args));
    }

    /**
     * Adds an instance of a sub-circuit.
     *
     * @param name local name of the instance
     * @param subcircuit the instantiated sub-circuit
     * @param nodes nodes wired to the sub-circuit interface, in interface order
     * @return the instance
     * @throws IllegalArgumentException if the node count differs from the interface
     */
    public SubCircuitInstance subcircuitInstance(String name, SubCircuit subcircuit, String... nodes) {
        Objects.requireNonNull(subcircuit, "subcircuit must not be null");
        if (nodes.length != subcircuit.externalNodes().size()) {
            throw new IllegalArgumentException("SubCircuit " + subcircuit.name() + " has "
                + subcircuit.externalNodes().size() + " nodes but " + nodes.length + " were given");
        }
        return add(new SubCircuitInstance(name, subcircuit.name(), nodes));
    }

    /**
     * Registers a device model.
     *
     * @param name model name
     * @param type model type
     * @param parameters model parameters, rendered in iteration order
     * @return the new model
     * @throws DuplicateNameException if a model with the same name exists
     */
    public DeviceModel model(String name, ModelType type, Map<String, ?> parameters) {
        Map<String, Object> copy = parameters == null ? Map.of() : new LinkedHashMap<>(parameters);
        DeviceModel model = new DeviceModel(name, type, copy);
        if (models.containsKey(model.name())) {
            throw new DuplicateNameException("Model", model.name());
        }
        models.put(model.name(), model);
        log.debug("Added model {} of type {}", model.name(), model.type());
        return model;
    }

    public DeviceModel model(String name, String type, Map<String, ?> parameters) {
        return model(name, ModelType.fromCode(type), parameters);
    }

    public Collection<Element> elements() {
        return Collections.unmodifiableCollection(elements.values());
    }

    public Collection<DeviceModel> models() {
        return Collections.unmodifiableCollection(models.values());
    }

    public Optional<Element> findElement(String name) {
        return Optional.ofNullable(elements.get(name));
    }

    public Optional<DeviceModel> findModel(String name) {
        return Optional.ofNullable(models.get(name));
    }

    public Optional<Node> findNode(String name) {
        refreshNodes();
        return Optional.ofNullable(nodes.get(name));
    }

    /**
     * Returns the node index, rebuilding it if elements were added since the last read.
     *
     * @return nodes in order of first appearance
     */
    public Collection<Node> nodes() {
        refreshNodes();
        return Collections.unmodifiableCollection(nodes.values());
    }

    /**
     * @param node a node of this netlist
     * @return the elements connected to the node, in netlist order
     */
    public List<Element> elementsOn(Node node) {
        Objects.requireNonNull(node, "node must not be null");
        List<Element> connected = new ArrayList<>();
        for (String elementName : node.elementNames()) {
            Element element = elements.get(elementName);
            if (element != null) {
                connected.add(element);
            }
        }
        return connected;
    }

    /**
     * Resolves an identifier against elements, then models, then nodes.
     *
     * @param identifier element name (with prefix), model name or node name
     * @return the resolved entry
     * @throws IdentifierNotFoundException if nothing has that name
     */
    public NetlistEntry lookup(String identifier) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Element element = elements.get(identifier);
        if (element != null) {
            return NetlistEntry.of(element);
        }
        DeviceModel model = models.get(identifier);
        if (model != null) {
            return NetlistEntry.of(model);
        }
        return findNode(identifier)
            .map(NetlistEntry::of)
            .orElseThrow(() -> new IdentifierNotFoundException(identifier));
    }

    private void refreshNodes() {
        if (!dirty) {
            return;
        }
        Map<String, Set<String>> index = new LinkedHashMap<>();
        for (Element element : elements.values()) {
            for (String nodeName : element.nodes()) {
                index.computeIfAbsent(nodeName, key -> new LinkedHashSet<>()).add(element.name());
            }
        }
        nodes.clear();
        index.forEach((nodeName, elementNames) -> nodes.put(nodeName, new Node(nodeName, elementNames)));
        dirty = false;
        log.debug("Rebuilt node index: {} nodes, {} elements", nodes.size(), elements.size());
    }

    /**
     * Renders every element line followed by every model line.
     *
     * @return newline terminated netlist body
     */
    public String toSpice() {
        StringBuilder sb = new StringBuilder();
        for (Element element : elements.values()) {
            sb.append(element.toSpice()).append(SpiceStrings.NEWLINE);
        }
        for (DeviceModel model : models.values()) {
            sb.append(model.toSpice()).append(SpiceStrings.NEWLINE);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toSpice();
    }
}
