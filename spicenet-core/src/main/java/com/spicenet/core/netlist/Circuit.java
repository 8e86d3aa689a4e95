package com.spicenet.core.netlist;

import java.nio.file.Path;
import java.util.Arrays;
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

import com.spicenet.core.error.DuplicateNameException;
import com.spicenet.core.util.SpiceStrings;

/**
 * Top level netlist: a title, directives and sub-circuits around the element and model body.
 *
 * <p>{@link #toSpice()} writes the sections in a fixed order, skipping empty ones:
 * <ol>
 *   <li>{@code .title}</li>
 *   <li>one {@code .include} per include</li>
 *   <li>{@code .global} with every global node</li>
 *   <li>one {@code .param name=expression} per parameter</li>
 *   <li>every sub-circuit</li>
 *   <li>elements, then models</li>
 *   <li>{@code .end}</li>
 * </ol>
 * Every collection keeps insertion order, so rendering the same circuit twice gives the same
 * text.
 */
public class Circuit extends Netlist {

    private static final Logger log = LoggerFactory.getLogger(Circuit.class);

    private final String title;
    private final Set<String> globalNodes = new LinkedHashSet<>();
    private final Set<String> includes = new LinkedHashSet<>();
    private final Map<String, String> parameters = new LinkedHashMap<>();
    private final Map<String, SubCircuit> subcircuits = new LinkedHashMap<>();

    public Circuit(String title) {
        this(title, DEFAULT_GROUND, List.of());
    }

    public Circuit(String title, String ground, Collection<String> globalNodes) {
        super(ground);
        this.title = SpiceStrings.singleLine(Objects.requireNonNull(title, "title must not be null"));
        globalNodes.forEach(this::global);
    }

    public String title() {
        return title;
    }

    /**
     * Declares global nodes.
     *
     * @param nodes node names
     * @return this circuit
     */
    public Circuit global(String... nodes) {
        Arrays.stream(nodes).forEach(node -> globalNodes.add(SpiceStrings.requireToken(node, "global node")));
        return this;
    }

    /**
     * Includes a file. Including the same path twice has no effect.
     *
     * @param path file path
     * @return this circuit
     */
    public Circuit include(String path) {
        Objects.requireNonNull(path, "path must not be null");
        if (path.isBlank()) {
            throw new IllegalArgumentException("include path must not be blank");
        }
        includes.add(path.strip());
        return this;
    }

    public Circuit include(Path path) {
        return include(Objects.requireNonNull(path, "path must not be null").toString());
    }

    /**
     * Sets a parameter. Setting it again replaces the expression but keeps its position.
     *
     * @param name parameter name
     * @param expression value or expression, written verbatim
     * @return this circuit
     */
    public Circuit parameter(String name, Object expression) {
        SpiceStrings.requireToken(name, "parameter name");
        Objects.requireNonNull(expression, "expression must not be null");
        parameters.put(name, SpiceStrings.singleLine(expression.toString()));
        return this;
    }

    /**
     * Attaches a sub-circuit.
     *
     * @param subcircuit sub-circuit to render with this circuit
     * @return the sub-circuit
     * @throws DuplicateNameException if a sub-circuit with that name is already attached
     */
    public SubCircuit subcircuit(SubCircuit subcircuit) {
        Objects.requireNonNull(subcircuit, "subcircuit must not be null");
        if (subcircuits.containsKey(subcircuit.name())) {
            throw new DuplicateNameException("SubCircuit", subcircuit.name());
        }
        subcircuits.put(subcircuit.name(), subcircuit);
        log.debug("Attached subcircuit {} with nodes {}", subcircuit.name(), subcircuit.externalNodes());
        return subcircuit;
    }

    public Set<String> globalNodes() {
        return Collections.unmodifiableSet(globalNodes);
    }

    public Set<String> includes() {
        return Collections.unmodifiableSet(includes);
    }

    public Map<String, String> parameters() {
        return Collections.unmodifiableMap(parameters);
    }

    public Collection<SubCircuit> subcircuits() {
        return Collections.unmodifiableCollection(subcircuits.values());
    }

    public Optional<SubCircuit> findSubcircuit(String name) {
        return Optional.ofNullable(subcircuits.get(name));
    }

    /**
     * Runs {@link SubCircuit#checkNodes()} on every attached sub-circuit.
     */
    public void checkSubcircuits() {
        subcircuits.values().forEach(SubCircuit::checkNodes);
    }

    @Override
    public String toSpice() {
        StringBuilder sb = new StringBuilder();
        sb.append(title.isEmpty() ? ".title" : ".title " + title).append(SpiceStrings.NEWLINE);
        sb.append(SpiceStrings.joinLines(includes.stream().map(SpiceStrings::quoteIfNeeded).toList(), ".include "));
        if (!globalNodes.isEmpty()) {
            sb.append(".global ").append(SpiceStrings.joinFields(globalNodes)).append(SpiceStrings.NEWLINE);
        }
        sb.append(SpiceStrings.joinLines(
            parameters.entrySet().stream().map(entry -> entry.getKey() + "=" + entry.getValue()).toList(), ".param "));
        for (SubCircuit subcircuit : subcircuits.values()) {
            sb.append(subcircuit.toSpice());
        }
        sb.append(super.toSpice());
        sb.append(".end").append(SpiceStrings.NEWLINE);
        return sb.toString();
    }
}
