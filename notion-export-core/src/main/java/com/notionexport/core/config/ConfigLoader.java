package com.notionexport.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ExportConfig} from {@code notion-export.yaml}.
 *
 * <p>A missing, unreadable or malformed file yields {@link ExportConfig#defaults()}.
 */
public final class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "notion-export.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to the YAML file
     * @return loaded configuration or defaults if unavailable
     */
    public static ExportConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return ExportConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ExportConfig.defaults();
        }

        try {
            ExportConfig config = YAML_MAPPER.readValue(configPath.toFile(), ExportConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ExportConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ExportConfig.defaults();
        }
    }
}
