package com.mimecast.mailroom.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.StringReader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Holds a configuration map read from a JSON5 file and provides typed accessors.
 * <p>Property names may use dot notation to reach into nested maps (e.g. {@code retry.maxRetries}).
 */
@SuppressWarnings("unchecked")
public abstract class ConfigFoundation {
    protected static final Logger log = LogManager.getLogger(ConfigFoundation.class);

    private static final Gson GSON = new GsonBuilder()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .create();

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new empty instance.
     */
    protected ConfigFoundation() {
    }

    /**
     * Constructs a new instance with given map.
     *
     * @param map Configuration map.
     */
    protected ConfigFoundation(Map<String, Object> map) {
        this.map = map != null ? map : new HashMap<>();
    }

    /**
     * Constructs a new instance from a JSON5 file.
     *
     * @param path File path.
     * @throws IOException Unable to read or parse file.
     */
    protected ConfigFoundation(String path) throws IOException {
        this.map = readMap(Paths.get(path));
    }

    /**
     * Reads a JSON5 file into a map.
     *
     * @param path File path.
     * @return Map instance, never null.
     * @throws IOException Unable to read or parse file.
     */
    public static Map<String, Object> readMap(Path path) throws IOException {
        Object parsed = parse(Files.readString(path, StandardCharsets.UTF_8), MAP_TYPE, path.toString());
        return parsed != null ? (Map<String, Object>) parsed : new HashMap<>();
    }

    /**
     * Reads a JSON5 file into the given type.
     *
     * @param path  File path.
     * @param clazz Target type (e.g. Map.class, List.class).
     * @return Parsed object or null if the file is empty.
     * @throws IOException Unable to read or parse file.
     */
    public static Object readFile(Path path, Class<?> clazz) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8), clazz, path.toString());
    }

    private static Object parse(String content, Type type, String source) throws IOException {
        try {
            JsonReader reader = new JsonReader(new StringReader(content));
            reader.setLenient(true); // JSON5 style comments and unquoted keys.
            return GSON.fromJson(reader, type);
        } catch (JsonParseException e) {
            throw new IOException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Gets the backing map.
     *
     * @return Map instance.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Checks if property exists.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return getProperty(name) != null;
    }

    /**
     * Gets property value by name, resolving dot notation.
     *
     * @param name Property name.
     * @return Object or null.
     */
    protected Object getProperty(String name) {
        if (map.containsKey(name)) {
            return map.get(name);
        }

        Object current = map;
        for (String part : name.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(part);
        }
        return current;
    }

    /**
     * Gets string property.
     *
     * @param name Property name.
     * @return String or null.
     */
    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets string property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String name, String defaultValue) {
        Object value = getProperty(name);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    /**
     * Gets long property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long defaultValue) {
        Object value = getProperty(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Property {} is not a number: {}", name, value);
            }
        }
        return defaultValue;
    }

    /**
     * Gets double property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Double.
     */
    public Double getDoubleProperty(String name, Double defaultValue) {
        Object value = getProperty(name);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Property {} is not a number: {}", name, value);
            }
        }
        return defaultValue;
    }

    /**
     * Gets boolean property.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name) {
        return getBooleanProperty(name, false);
    }

    /**
     * Gets boolean property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean defaultValue) {
        Object value = getProperty(name);
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
     * @param name Property name.
     * @return Map, never null.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = getProperty(name);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return new HashMap<>();
    }

    /**
     * Gets list property.
     *
     * @param name Property name.
     * @return List, never null.
     */
    public List<Object> getListProperty(String name) {
        Object value = getProperty(name);
        if (value instanceof List) {
            return (List<Object>) value;
        }
        return Collections.emptyList();
    }

    /**
     * Gets list of strings property.
     *
     * @param name Property name.
     * @return List of strings, never null.
     */
    public List<String> getStringListProperty(String name) {
        List<String> list = new ArrayList<>();
        for (Object value : getListProperty(name)) {
            if (value != null) {
                list.add(String.valueOf(value));
            }
        }
        return list;
    }
}
