package com.spicenet.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads SpiceNet configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code spicenet.yaml} into {@link SpicenetConfig}.
 * If the file is missing or invalid, returns {@link SpicenetConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SpicenetConfig config = ConfigLoader.load(Paths.get("spicenet.yaml"));
 * Path outputDir = Paths.get(config.outputDirectory());
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link SpicenetConfig#defaults()}.
     *
     * @param configPath path to {@code spicenet.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static SpicenetConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return SpicenetConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return SpicenetConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            SpicenetConfig config = YAML_MAPPER.readValue(configPath.toFile(), SpicenetConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return SpicenetConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return SpicenetConfig.defaults();
        }
    }
}
