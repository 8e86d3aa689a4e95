package com.spicenet.core.definition;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.spicenet.core.error.DefinitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link CircuitDefinition}s from YAML.
 *
 * <p>Unlike configuration, a definition has no sensible default: a missing or malformed file
 * fails with {@link DefinitionException}.
 */
public class DefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(DefinitionLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private DefinitionLoader() {
    }

    /**
     * @param path YAML file
     * @return parsed definition
     * @throws DefinitionException if the file is missing, unreadable or invalid
     */
    public static CircuitDefinition load(Path path) {
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new DefinitionException("Circuit definition not found or not readable: " + path);
        }
        try {
            log.debug("Loading circuit definition from: {}", path);
            return requireContent(YAML_MAPPER.readValue(path.toFile(), CircuitDefinition.class), path.toString());
        } catch (IOException e) {
            throw new DefinitionException("Failed to parse circuit definition " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * @param yaml YAML text
     * @return parsed definition
     * @throws DefinitionException if the text is not a valid definition
     */
    public static CircuitDefinition parse(String yaml) {
        try {
            return requireContent(YAML_MAPPER.readValue(yaml, CircuitDefinition.class), "<string>");
        } catch (IOException e) {
            throw new DefinitionException("Failed to parse circuit definition: " + e.getMessage(), e);
        }
    }

    private static CircuitDefinition requireContent(CircuitDefinition definition, String source) {
        if (definition == null) {
            throw new DefinitionException("Circuit definition is empty: " + source);
        }
        return definition;
    }
}
