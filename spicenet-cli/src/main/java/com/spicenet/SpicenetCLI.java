package com.spicenet;

import com.spicenet.cli.ListCommand;
import com.spicenet.cli.RenderCommand;
import com.spicenet.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

import java.io.PrintWriter;

/**
 * Main CLI entry point for Spicenet.
 *
 * <p>Spicenet assembles SPICE netlists from YAML circuit definitions.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Assemble a definition and write the netlist deck</li>
 *   <li>{@code validate} - Assemble a definition and check sub-circuit connectivity</li>
 *   <li>{@code list} - List element kinds, model types, or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Write ./build/netlists/rc-filter.cir
 * spicenet render rc-filter.yaml
 *
 * # Print the deck instead
 * spicenet render rc-filter.yaml --stdout
 *
 * # List element kinds
 * spicenet list elements
 * }</pre>
 */
@Command(
    name = "spicenet",
    mixinStandardHelpOptions = true,
    version = "Spicenet 1.0.0-SNAPSHOT",
    description = "SPICE netlist builder",
    subcommands = {
        RenderCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class SpicenetCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SpicenetCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println("Spicenet - SPICE netlist builder");
        out.println("Version: 1.0.0-SNAPSHOT");
        out.println();
        out.println("Use 'spicenet --help' to see available commands");
        out.println("Use 'spicenet <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        SpicenetCLI cli = new SpicenetCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
