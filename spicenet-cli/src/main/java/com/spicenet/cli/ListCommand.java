package com.spicenet.cli;

import com.spicenet.core.element.ElementKind;
import com.spicenet.core.netlist.ModelType;
import com.spicenet.core.renderer.OutputRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list element kinds, device model types, or renderers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * spicenet list elements
 * spicenet list models
 * spicenet list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available element kinds, model types, or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: elements, models, or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "elements", "element" -> listElements(out);
            case "models", "model" -> listModels(out);
            case "renderers", "renderer" -> listRenderers(out);
            default -> {
                log.error("Unknown type: {}. Use: elements, models, or renderers", type);
                spec.commandLine().getErr().println("Unknown type: " + type + ". Use: elements, models, or renderers");
                yield 1;
            }
        };
    }

    private int listElements(PrintWriter out) {
        out.println("Available Elements:");
        out.println();
        for (ElementKind kind : ElementKind.values()) {
            String nodes = kind.nodeCount() < 0 ? "any" : String.valueOf(kind.nodeCount());
            out.printf("  • %s (prefix: %s, nodes: %s)%n", kind.displayName(), kind.prefix(), nodes);
        }
        return 0;
    }

    private int listModels(PrintWriter out) {
        out.println("Available Model Types:");
        out.println();
        for (ModelType modelType : ModelType.values()) {
            out.printf("  • %s%n", modelType.name());
        }
        return 0;
    }

    private int listRenderers(PrintWriter out) {
        out.println("Available Renderers:");
        out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            out.printf("  • %s%n", renderer.getId());
        }
        if (!found) {
            out.println("  No renderers found.");
        }
        return 0;
    }
}
