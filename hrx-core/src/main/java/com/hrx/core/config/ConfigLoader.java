package com.hrx.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Utility for loading HRX configuration from YAML.
 *
 * <p>Uses Jackson to deserialize {@code hrx.yaml} into an {@link HrxConfig} record.
 * If the file is missing or invalid, returns {@link HrxConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * HrxConfig config = ConfigLoader.load(Paths.get("hrx.yaml"));
 * HrxCodec codec = new HrxCodec(config);
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class - no instantiation
    }

    /**
     * Loads configuration from a YAML file, falling back to {@link HrxConfig#defaults()}
     * when the file is absent or cannot be read as configuration.
     *
     * @param configPath path to {@code hrx.yaml}
     * @return loaded configuration with defaults filled in
     */
    public static HrxConfig load(Path configPath) {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.isRegularFile(configPath)) {
            log.debug("No HRX configuration at {}, using defaults", configPath);
            return HrxConfig.defaults();
        }
        try {
            return fromYaml(Files.readString(configPath));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Ignoring HRX configuration {}: {}", configPath, e.getMessage());
            return HrxConfig.defaults();
        }
    }

    /**
     * Reads configuration from YAML text.
     *
     * @param yaml YAML document
     * @return parsed configuration with defaults filled in
     * @throws IllegalArgumentException if the YAML is invalid
     */
    public static HrxConfig fromYaml(String yaml) {
        if (yaml == null || yaml.isBlank()) {
            return HrxConfig.defaults();
        }
        try {
            HrxConfig config = YAML_MAPPER.readValue(yaml, HrxConfig.class);
            return config != null ? config.withDefaults() : HrxConfig.defaults();
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid HRX configuration: " + e.getMessage(), e);
        }
    }
}
