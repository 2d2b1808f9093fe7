package com.radiusproxy.backend;

import java.util.Locale;

/**
 * Kinds of identity source an adapter can wrap.
 */
public enum BackendType {

    DIRECTORY("directory", "Directory (LDAP) bind"),
    RELATIONAL("relational", "Relational database lookup"),
    FILE("file", "Flat credential file");

    private final String key;
    private final String description;

    BackendType(String key, String description) {
        this.key = key;
        this.description = description;
    }

    public String getKey() {
        return key;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Resolves a configured type name. The legacy aliases {@code ldap} and
     * {@code sql} are accepted as well.
     *
     * @param value the configured type name
     * @return the matching backend type
     * @throws IllegalArgumentException if the name is unknown
     */
    public static BackendType fromKey(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Backend type cannot be null or empty");
        }

        String key = value.trim().toLowerCase(Locale.ROOT);
        switch (key) {
            case "directory":
            case "ldap":
                return DIRECTORY;
            case "relational":
            case "sql":
                return RELATIONAL;
            case "file":
                return FILE;
            default:
                throw new IllegalArgumentException("Unknown backend type: " + value
                    + ". Supported types: directory, relational, file");
        }
    }

    @Override
    public String toString() {
        return key;
    }
}
