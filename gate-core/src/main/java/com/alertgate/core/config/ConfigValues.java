package com.alertgate.core.config;

import com.alertgate.core.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed accessors over loosely-typed configuration maps.
 *
 * <p>
 * Maps arrive decoded from JSON or YAML, so a whole number may show up as an
 * {@link Integer}, a {@link Long} or a {@link Double}; all of them are
 * accepted as long as the value has no fractional part.
 * </p>
 *
 * @since 1.0.0
 */
final class ConfigValues {

    private ConfigValues() {
        // utility class
    }

    static String requiredString(Map<String, ?> raw, String key) {
        String value = optionalString(raw, key, null);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(key + " is required");
        }
        return value;
    }

    static String optionalString(Map<String, ?> raw, String key, String defaultValue) {
        Object value = raw.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof String s)) {
            throw new ConfigurationException(key + " must be a string, got "
                    + value.getClass().getSimpleName());
        }
        return s;
    }

    static boolean optionalBoolean(Map<String, ?> raw, String key, boolean defaultValue) {
        Object value = raw.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Boolean b)) {
            throw new ConfigurationException(key + " must be a boolean, got "
                    + value.getClass().getSimpleName());
        }
        return b;
    }

    static int optionalInt(Map<String, ?> raw, String key, int defaultValue) {
        Object value = raw.get(key);
        if (value == null) {
            return defaultValue;
        }
        return wholeNumber(key, value);
    }

    /**
     * Read a list of whole numbers. A missing key yields an empty list.
     */
    static List<Integer> optionalIntList(Map<String, ?> raw, String key) {
        Object value = raw.get(key);
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException(key + " must be an array, got "
                    + value.getClass().getSimpleName());
        }
        List<Integer> result = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            result.add(wholeNumber(key + "[" + i + "]", list.get(i)));
        }
        return result;
    }

    static Map<String, Object> optionalMap(Map<String, ?> raw, String key) {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new ConfigurationException(key + " must be a map, got "
                    + value.getClass().getSimpleName());
        }
        return toStringKeys(map);
    }

    /**
     * Copy a decoded map, converting every key to its string form.
     */
    static Map<String, Object> toStringKeys(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    static int wholeNumber(String key, Object value) {
        if (value == null) {
            throw new ConfigurationException(key + " must not be null");
        }
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            long l = ((Number) value).longValue();
            if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
                throw new ConfigurationException(key + " is out of range: " + l);
            }
            return (int) l;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d)) {
                throw new ConfigurationException(key + " must be a whole number, got " + value);
            }
            if (d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
                throw new ConfigurationException(key + " is out of range: " + value);
            }
            return (int) d;
        }
        throw new ConfigurationException(key + " must be a number, got "
                + value.getClass().getSimpleName());
    }
}
