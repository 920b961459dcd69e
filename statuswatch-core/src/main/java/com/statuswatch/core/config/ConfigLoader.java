package com.statuswatch.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Reads {@code statuswatch.yaml} into a {@link HarnessConfig}.
 *
 * <p>{@link #load(Path)} never fails: a file that is absent, unreadable, empty or invalid
 * yields {@link HarnessConfig#defaults()} and a logged reason. {@link #parse(String)} is
 * the strict variant.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * HarnessConfig config = ConfigLoader.load(Path.of("statuswatch.yaml"));
 * ModelClient client = ModelClient.fromConfig(config);
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "statuswatch.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads configuration, falling back to defaults.
     *
     * @param configPath path to {@code statuswatch.yaml}
     * @return configuration from the file, or defaults
     */
    public static HarnessConfig load(Path configPath) {
        return read(configPath).orElseGet(HarnessConfig::defaults);
    }

    /**
     * Reads configuration if the file holds any.
     *
     * @return the configuration, or empty when the file is unusable
     */
    public static Optional<HarnessConfig> read(Path configPath) {
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("No readable configuration at {}. Using defaults.", configPath);
            return Optional.empty();
        }
        String text;
        try {
            text = Files.readString(configPath);
        } catch (IOException e) {
            log.error("Failed to read configuration {}: {}. Using defaults.", configPath, e.getMessage());
            return Optional.empty();
        }
        if (text.isBlank()) {
            log.warn("Configuration file is empty: {}. Using defaults.", configPath);
            return Optional.empty();
        }
        try {
            HarnessConfig config = parse(text);
            log.info("Loaded configuration from: {}", configPath);
            return Optional.of(config);
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration {}: {}. Using defaults.", configPath, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Parses configuration text, checking values that are only interpreted later.
     *
     * @param yaml configuration YAML
     * @return parsed configuration; missing sections are defaulted
     * @throws IllegalArgumentException if the YAML is malformed or the soft deadline is not an instant
     */
    public static HarnessConfig parse(String yaml) {
        HarnessConfig config;
        try {
            config = YAML_MAPPER.readValue(yaml, HarnessConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e.getOriginalMessage(), e);
        }
        if (config == null) {
            return HarnessConfig.defaults();
        }
        try {
            config.deadline().softDeadlineInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("softDeadline is not an ISO-8601 instant: "
                + config.deadline().softDeadline(), e);
        }
        return config;
    }
}
