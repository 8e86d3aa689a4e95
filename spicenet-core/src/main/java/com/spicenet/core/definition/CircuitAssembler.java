package com.spicenet.core.definition;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.spicenet.core.definition.CircuitDefinition.ElementDefinition;
import com.spicenet.core.definition.CircuitDefinition.ModelDefinition;
import com.spicenet.core.definition.CircuitDefinition.SubCircuitDefinition;
import com.spicenet.core.element.Element;
import com.spicenet.core.element.ElementKind;
import com.spicenet.core.netlist.Circuit;
import com.spicenet.core.netlist.Netlist;
import com.spicenet.core.netlist.SubCircuit;

/**
 * Builds a {@link Circuit} from a {@link CircuitDefinition} through the public netlist API,
 * so that every name, node and parameter rule applies to definitions as well.
 *
 * <p>Current probes are inserted after every element of a scope has been added, in definition
 * order.
 */
public class CircuitAssembler {

    private static final Logger log = LoggerFactory.getLogger(CircuitAssembler.class);

    /**
     * @param definition circuit definition
     * @return the assembled circuit
     * @throws IllegalArgumentException on unknown element kinds, model types or node counts
     * @throws com.spicenet.core.error.NetlistException on invalid names or parameters
     */
    public Circuit assemble(CircuitDefinition definition) {
        String ground = definition.ground() == null ? Netlist.DEFAULT_GROUND : definition.ground();
        Circuit circuit = new Circuit(definition.title(), ground, definition.globals());
        definition.includes().forEach(circuit::include);
        definition.parameters().forEach(circuit::parameter);

        for (SubCircuitDefinition subDefinition : definition.subcircuits()) {
            String subGround = subDefinition.ground() == null ? Netlist.DEFAULT_GROUND : subDefinition.ground();
            SubCircuit subcircuit = new SubCircuit(subDefinition.name(), subDefinition.nodes(), subGround);
            populate(subcircuit, subDefinition.models(), subDefinition.elements());
            circuit.subcircuit(subcircuit);
        }
        populate(circuit, definition.models(), definition.elements());

        log.info("Assembled circuit '{}': {} elements, {} models, {} subcircuits",
            circuit.title(), circuit.elements().size(), circuit.models().size(), circuit.subcircuits().size());
        return circuit;
    }

    private void populate(Netlist netlist, List<ModelDefinition> models, List<ElementDefinition> elements) {
        for (ModelDefinition model : models) {
            netlist.model(model.name(), model.type(), model.parameters());
        }

        List<Element> probed = new ArrayList<>();
        List<ElementDefinition> probedDefinitions = new ArrayList<>();
        for (ElementDefinition elementDefinition : elements) {
            if (elementDefinition.name() == null) {
                throw new IllegalArgumentException("Element of kind " + elementDefinition.kind() + " has no name");
            }
            if (elementDefinition.kind() == null) {
                throw new IllegalArgumentException("Element " + elementDefinition.name() + " has no kind");
            }
            ElementKind kind = ElementKind.fromString(elementDefinition.kind());
            Element element = netlist.element(kind, elementDefinition.name(), elementDefinition.nodes(),
                elementDefinition.args(), elementDefinition.params());
            if (!elementDefinition.probes().isEmpty()) {
                probed.add(element);
                probedDefinitions.add(elementDefinition);
            }
        }

        for (int i = 0; i < probed.size(); i++) {
            Element element = probed.get(i);
            for (String role : probedDefinitions.get(i).probes()) {
                element.pin(role).addCurrentProbe(netlist);
            }
        }
    }
}
