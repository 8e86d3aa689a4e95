package com.spicenet.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.spicenet.core.definition.CircuitAssembler;
import com.spicenet.core.definition.DefinitionLoader;
import com.spicenet.core.error.NetlistException;
import com.spicenet.core.netlist.Circuit;
import com.spicenet.core.netlist.SubCircuit;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to check that a circuit definition assembles and that every sub-circuit interface
 * node is connected.
 */
@Command(
    name = "validate",
    description = "Validate a circuit definition",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Circuit definition (YAML)")
    private Path definitionPath;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        log.info("Validating circuit definition: {}", definitionPath);

        Circuit circuit;
        try {
            circuit = new CircuitAssembler().assemble(DefinitionLoader.load(definitionPath));
        } catch (Exception e) {
            log.error("Assembly failed", e);
            err.println("✗ " + e.getMessage());
            return 1;
        }

        int failures = 0;
        for (SubCircuit subcircuit : circuit.subcircuits()) {
            try {
                subcircuit.checkNodes();
                out.println("✓ Sub-circuit " + subcircuit.name());
            } catch (NetlistException e) {
                failures++;
                err.println("✗ " + e.getMessage());
            }
        }

        if (failures > 0) {
            return 1;
        }
        out.println("✓ " + definitionPath + " is valid (" + circuit.elements().size() + " elements)");
        return 0;
    }
}
