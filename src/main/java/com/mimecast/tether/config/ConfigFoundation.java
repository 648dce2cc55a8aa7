package com.mimecast.tether.config;

import com.google.gson.Gson;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Holds a parsed JSON5 document as a map and provides type safe accessors with defaults.
 * <p>Numbers parsed by Gson come back as doubles so they are normalized here.
 */
@SuppressWarnings({"unchecked", "rawtypes"})
public class ConfigFoundation {
    protected static final Logger log = LogManager.getLogger(ConfigFoundation.class);

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new empty ConfigFoundation instance.
     */
    public ConfigFoundation() {
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        if (map != null) {
            this.map = map;
        }
    }

    /**
     * Constructs a new ConfigFoundation instance from a JSON5 file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ConfigFoundation(String path) throws IOException {
        Path file = Paths.get(path);
        String content = Files.readString(file, StandardCharsets.UTF_8);
        Map<String, Object> parsed = new Gson().fromJson(content, Map.class);
        if (parsed != null) {
            this.map = parsed;
        }
        log.debug("Loaded configuration file: {}", file.toAbsolutePath());
    }

    /**
     * Gets configuration map.
     *
     * @return Map.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Has property.
     *
     * @param key Property key.
     * @return Boolean.
     */
    public boolean hasProperty(String key) {
        return map.containsKey(key);
    }

    /**
     * Gets string property.
     *
     * @param key Property key.
     * @return String or null.
     */
    public String getStringProperty(String key) {
        return getStringProperty(key, null);
    }

    /**
     * Gets string property with default.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String key, String defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Double && (Double) value == Math.rint((Double) value)) {
            return String.valueOf(((Double) value).longValue());
        }
        return String.valueOf(value);
    }

    /**
     * Gets long property with default.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String key, Long defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                log.warn("Property {} is not a number: {}", key, value);
            }
        }
        return defaultValue;
    }

    /**
     * Gets boolean property.
     *
     * @param key Property key.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String key) {
        return getBooleanProperty(key, false);
    }

    /**
     * Gets boolean property with default.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    /**
     * Gets map property.
     *
     * @param key Property key.
     * @return Map, empty if absent.
     */
    public Map<String, Object> getMapProperty(String key) {
        Object value = map.get(key);
        return value instanceof Map ? (Map<String, Object>) value : new HashMap<>();
    }

    /**
     * Gets list property.
     *
     * @param key Property key.
     * @return List, empty if absent.
     */
    public List getListProperty(String key) {
        Object value = map.get(key);
        return value instanceof List ? (List) value : new ArrayList<>();
    }
}
