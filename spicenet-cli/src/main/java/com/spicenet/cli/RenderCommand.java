package com.spicenet.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.spicenet.core.config.ConfigLoader;
import com.spicenet.core.config.SpicenetConfig;
import com.spicenet.core.definition.CircuitAssembler;
import com.spicenet.core.definition.CircuitDefinition;
import com.spicenet.core.definition.DefinitionLoader;
import com.spicenet.core.netlist.Circuit;
import com.spicenet.core.renderer.GeneratedDeck;
import com.spicenet.core.renderer.OutputRenderer;
import com.spicenet.core.renderer.RenderContext;
import com.spicenet.core.renderer.impl.ConsoleRenderer;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to assemble a circuit definition and render its netlist.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load configuration ({@code spicenet.yaml} next to the definition unless {@code -c} is given)</li>
 *   <li>Load and assemble the circuit definition</li>
 *   <li>Check sub-circuit connectivity when {@code validation.checkSubcircuits} is on</li>
 *   <li>Render the deck with the configured renderer</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * spicenet render amplifier.yaml
 * spicenet render amplifier.yaml -o out/ --stdout
 * }</pre>
 */
@Command(
    name = "render",
    description = "Assemble a circuit definition and write the SPICE netlist",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);
    private static final String DEFAULT_CONFIG = "spicenet.yaml";

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Circuit definition (YAML)")
    private Path definitionPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: spicenet.yaml next to the definition)"
    )
    private Path configPath;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"--stdout"},
        description = "Print the netlist instead of writing a file"
    )
    private boolean stdout;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            SpicenetConfig config = ConfigLoader.load(resolveConfigPath());
            CircuitDefinition definition = DefinitionLoader.load(definitionPath);
            Circuit circuit = new CircuitAssembler().assemble(definition);

            if (config.checkSubcircuits()) {
                circuit.checkSubcircuits();
            }

            GeneratedDeck deck = GeneratedDeck.of(circuit, config.outputExtension());
            String rendererId = stdout ? "console" : config.rendererId();
            OutputRenderer renderer = findRenderer(rendererId, out);
            RenderContext context = new RenderContext(resolveOutputDirectory(config), Map.of());

            log.info("Rendering deck {} with: {}", deck.fileName(), renderer.getId());
            renderer.render(deck, context);

            if (!"console".equals(renderer.getId())) {
                out.println("✓ Wrote " + Path.of(context.outputDirectory()).resolve(deck.fileName()));
            }
            return 0;
        } catch (Exception e) {
            log.error("Render failed", e);
            err.println("✗ Render failed: " + e.getMessage());
            return 1;
        }
    }

    private Path resolveConfigPath() {
        if (configPath != null) {
            return configPath;
        }
        Path parent = definitionPath.toAbsolutePath().getParent();
        return parent == null ? Path.of(DEFAULT_CONFIG) : parent.resolve(DEFAULT_CONFIG);
    }

    private String resolveOutputDirectory(SpicenetConfig config) {
        if (outputDir != null) {
            return outputDir.toAbsolutePath().toString();
        }
        return Path.of(config.outputDirectory()).toAbsolutePath().toString();
    }

    private OutputRenderer findRenderer(String id, PrintWriter out) {
        if ("console".equals(id)) {
            return new ConsoleRenderer(out);
        }
        log.debug("Discovering output renderers via ServiceLoader");
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return renderer;
            }
        }
        throw new IllegalStateException("Unknown renderer: " + id);
    }
}
