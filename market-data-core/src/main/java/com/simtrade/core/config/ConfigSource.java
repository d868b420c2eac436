package com.simtrade.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Key/value settings from environment variables with a properties file fallback.
 * Environment variables win, so deployments can override the bundled file.
 */
public final class ConfigSource {
    private static final Logger logger = LoggerFactory.getLogger(ConfigSource.class);

    public static final String DEFAULT_FILE = "simtrade.properties";

    private final Properties properties;
    private final Map<String, String> environment;

    public ConfigSource(Properties properties, Map<String, String> environment) {
        this.properties = properties;
        this.environment = Map.copyOf(environment);
    }

    public static ConfigSource of(Properties properties) {
        return new ConfigSource(properties, Map.of());
    }

    /**
     * Load from {@code simtrade.properties} in the working directory, then the
     * classpath, overlaid by the process environment.
     */
    public static ConfigSource load() {
        return load(Path.of(DEFAULT_FILE));
    }

    public static ConfigSource load(Path configPath) {
        var props = new Properties();

        if (Files.exists(configPath)) {
            try (InputStream is = Files.newInputStream(configPath)) {
                props.load(is);
                logger.info("Loaded config from: {}", configPath.toAbsolutePath());
                return new ConfigSource(props, System.getenv());
            } catch (IOException e) {
                logger.warn("Failed to load {} from filesystem: {}", configPath, e.getMessage());
            }
        }

        try (InputStream is = ConfigSource.class.getClassLoader().getResourceAsStream(configPath.getFileName().toString())) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded config from classpath");
            } else {
                logger.info("No {} found - using defaults and environment", configPath.getFileName());
            }
        } catch (IOException e) {
            logger.warn("Failed to load {} from classpath: {}", configPath.getFileName(), e.getMessage());
        }
        return new ConfigSource(props, System.getenv());
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(environment.get(key))
            .or(() -> Optional.ofNullable(properties.getProperty(key)))
            .map(String::trim)
            .filter(value -> !value.isEmpty());
    }

    public String getString(String key, String defaultValue) {
        return get(key).orElse(defaultValue);
    }

    public long getLong(String key, long defaultValue) {
        var value = get(key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.get());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value.get(), defaultValue);
            return defaultValue;
        }
    }

    public int getInt(String key, int defaultValue) {
        return (int) getLong(key, defaultValue);
    }

    public double getDouble(String key, double defaultValue) {
        var value = get(key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.get());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value.get(), defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return get(key).map(Boolean::parseBoolean).orElse(defaultValue);
    }

    /**
     * Comma-separated list, trimmed, empty entries dropped.
     */
    public List<String> getList(String key, List<String> defaultValue) {
        return get(key)
            .map(value -> Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .toList())
            .orElse(defaultValue);
    }
}
