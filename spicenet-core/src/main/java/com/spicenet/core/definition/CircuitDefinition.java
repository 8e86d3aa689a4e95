package com.spicenet.core.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Declarative description of a circuit, loaded from YAML.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * title: "RC low pass"
 * includes:
 *   - models.lib
 * parameters:
 *   rload: 1k
 * models:
 *   - name: dmod
 *     type: D
 *     parameters:
 *       is: 1e-14
 * elements:
 *   - kind: voltage-source
 *     name: in
 *     nodes: [in, 0]
 *     args: ["DC 5"]
 *   - kind: resistor
 *     name: 1
 *     nodes: [in, out]
 *     args: ["{rload}"]
 *     probes: [plus]
 *   - kind: capacitor
 *     name: 1
 *     nodes: [out, 0]
 *     args: [1u]
 *     params:
 *       initialCondition: 0
 * }</pre>
 *
 * @param title circuit title
 * @param ground ground node (default "0")
 * @param globals global nodes
 * @param includes included files
 * @param parameters circuit parameters, in declaration order
 * @param models device models
 * @param subcircuits sub-circuit definitions
 * @param elements elements of the top level netlist
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CircuitDefinition(
    @JsonProperty("title") String title,
    @JsonProperty("ground") String ground,
    @JsonProperty("globals") List<String> globals,
    @JsonProperty("includes") List<String> includes,
    @JsonProperty("parameters") Map<String, Object> parameters,
    @JsonProperty("models") List<ModelDefinition> models,
    @JsonProperty("subcircuits") List<SubCircuitDefinition> subcircuits,
    @JsonProperty("elements") List<ElementDefinition> elements
) {
    /**
     * Compact constructor with validation.
     */
    public CircuitDefinition {
        if (title == null) {
            title = "";
        }
        if (globals == null) {
            globals = List.of();
        }
        if (includes == null) {
            includes = List.of();
        }
        if (parameters == null) {
            parameters = Map.of();
        }
        if (models == null) {
            models = List.of();
        }
        if (subcircuits == null) {
            subcircuits = List.of();
        }
        if (elements == null) {
            elements = List.of();
        }
    }

    /**
     * Device model definition.
     *
     * @param name model name
     * @param type model type code (D, NPN, NMOS, ...)
     * @param parameters model parameters, in declaration order
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ModelDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("parameters") Map<String, Object> parameters
    ) {
        public ModelDefinition {
            if (parameters == null) {
                parameters = Map.of();
            }
        }
    }

    /**
     * Sub-circuit definition.
     *
     * @param name sub-circuit name
     * @param nodes interface nodes, in order
     * @param ground local ground (default "0")
     * @param models device models local to the sub-circuit
     * @param elements elements of the sub-circuit
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SubCircuitDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("nodes") List<String> nodes,
        @JsonProperty("ground") String ground,
        @JsonProperty("models") List<ModelDefinition> models,
        @JsonProperty("elements") List<ElementDefinition> elements
    ) {
        public SubCircuitDefinition {
            if (nodes == null) {
                nodes = List.of();
            }
            if (models == null) {
                models = List.of();
            }
            if (elements == null) {
                elements = List.of();
            }
        }
    }

    /**
     * Element definition.
     *
     * @param kind element kind name or prefix (see {@link com.spicenet.core.element.ElementKind})
     * @param name local element name, without prefix
     * @param nodes nodes in constructor order
     * @param args positional arguments
     * @param params keyword arguments
     * @param probes pin roles that get a current probe
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ElementDefinition(
        @JsonProperty("kind") String kind,
        @JsonProperty("name") String name,
        @JsonProperty("nodes") List<String> nodes,
        @JsonProperty("args") List<Object> args,
        @JsonProperty("params") Map<String, Object> params,
        @JsonProperty("probes") List<String> probes
    ) {
        public ElementDefinition {
            if (nodes == null) {
                nodes = List.of();
            }
            if (args == null) {
                args = List.of();
            }
            if (params == null) {
                params = Map.of();
            }
            if (probes == null) {
                probes = List.of();
            }
        }
    }
}
