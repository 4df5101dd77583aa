package org.javai.gateway.mapping;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-call knobs for a mapper, such as a forecast horizon or a detection method. Each mapper
 * documents the keys it reads and the default it applies when a key is absent.
 */
public final class MappingOptions {

    private static final MappingOptions NONE = new MappingOptions(Map.of());

    private final Map<String, Object> values;

    private MappingOptions(Map<String, Object> values) {
        this.values = Map.copyOf(values);
    }

    public static MappingOptions none() {
        return NONE;
    }

    public static MappingOptions of(String key, Object value) {
        return none().with(key, value);
    }

    public MappingOptions with(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Map<String, Object> copy = new HashMap<>(values);
        copy.put(key, value);
        return new MappingOptions(copy);
    }

    public String text(String key, String defaultValue) {
        Object value = values.get(key);
        return value == null ? defaultValue : value.toString();
    }

    public int integer(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option '" + key + "' is not an integer: " + value, e);
        }
    }

    public boolean flag(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MappingOptions other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "MappingOptions" + values;
    }
}
