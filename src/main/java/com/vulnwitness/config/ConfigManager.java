package com.vulnwitness.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class ConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/default_engine.yaml";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Config config;

    /**
     * Loads the configuration bundled with the library.
     */
    public Config loadDefault() {
        try (InputStream in = getClass().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                logger.warn("Could not find default configuration in resources: {}. Using built-in defaults.",
                        DEFAULT_CONFIG_RESOURCE);
                this.config = withDefaults(new Config());
                return config;
            }
            this.config = withDefaults(mapper.readValue(in, Config.class));
            logger.debug("Default configuration loaded: {}", config.getEngineConfig());
            return config;
        } catch (IOException e) {
            logger.error("Failed to parse default configuration", e);
            throw new ConfigException("Configuration load failed", e);
        }
    }

    /**
     * Loads a project specific configuration file.
     */
    public Config load(File configFile) {
        try {
            this.config = withDefaults(mapper.readValue(configFile, Config.class));
            logger.info("Loaded configuration: {}", configFile.getAbsolutePath());
            return config;
        } catch (IOException e) {
            logger.error("Failed to parse configuration file {}", configFile, e);
            throw new ConfigException("Configuration load failed: " + configFile, e);
        }
    }

    public Config getConfig() {
        if (config == null) {
            return loadDefault();
        }
        return config;
    }

    private static Config withDefaults(Config config) {
        if (config == null) {
            config = new Config();
        }
        if (config.getEngineConfig() == null) {
            config.setEngineConfig(new EngineConfig());
        }
        return config;
    }
}
