package com.radiusproxy.backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Typed, validating view over the opaque settings map of a backend config.
 */
public final class BackendSettings {

    private static final Pattern SQL_IDENTIFIER =
        Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?$");

    private final Map<String, String> values;

    public BackendSettings(Map<String, String> values) {
        this.values = values != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(values))
            : Collections.emptyMap();
    }

    public Map<String, String> asMap() {
        return values;
    }

    public boolean has(String key) {
        String value = values.get(key);
        return value != null && !value.trim().isEmpty();
    }

    /**
     * Gets a trimmed value, or null if absent or blank.
     */
    public String get(String key) {
        String value = values.get(key);
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    public String get(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Gets a raw (untrimmed) value. Passwords keep surrounding whitespace.
     */
    public String getRaw(String key) {
        return values.get(key);
    }

    public String require(String key) throws BackendConfigurationException {
        String value = get(key);
        if (value == null) {
            throw BackendConfigurationException.missing(key);
        }
        return value;
    }

    public int getInt(String key, int defaultValue, int min, int max) throws BackendConfigurationException {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < min || parsed > max) {
                throw new BackendConfigurationException(key,
                    String.format("must be between %d and %d, got: %d", min, max, parsed));
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new BackendConfigurationException(key, "not a number: " + value);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) throws BackendConfigurationException {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "1":
                return true;
            case "false":
            case "no":
            case "0":
                return false;
            default:
                throw new BackendConfigurationException(key, "not a boolean: " + value);
        }
    }

    /**
     * Gets a table or column name, which must be a plain SQL identifier,
     * optionally schema-qualified.
     */
    public String getSqlIdentifier(String key, String defaultValue) throws BackendConfigurationException {
        String value = get(key, defaultValue);
        if (value == null) {
            throw BackendConfigurationException.missing(key);
        }
        if (!SQL_IDENTIFIER.matcher(value).matches()) {
            throw new BackendConfigurationException(key, "not a valid SQL identifier: " + value);
        }
        return value;
    }

    public DigestScheme getDigestScheme(String key) throws BackendConfigurationException {
        String value = require(key);
        try {
            return DigestScheme.fromKey(value);
        } catch (IllegalArgumentException e) {
            throw new BackendConfigurationException(key, e.getMessage());
        }
    }

    /**
     * Parses a {@code name=value,name=value} list into an ordered map.
     */
    public Map<String, String> getMapping(String key, Map<String, String> defaultValue)
            throws BackendConfigurationException {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        Map<String, String> mapping = new LinkedHashMap<>();
        for (String pair : value.split(",")) {
            if (pair.trim().isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            if (eq <= 0 || eq == pair.length() - 1) {
                throw new BackendConfigurationException(key, "expected name=value pairs, got: " + pair.trim());
            }
            mapping.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
        }
        return Collections.unmodifiableMap(mapping);
    }
}
