package com.radiusproxy.backend;

import java.util.Map;

/**
 * Turns a backend type and its settings into a live adapter.
 */
@FunctionalInterface
public interface BackendFactory {

    /**
     * Creates an adapter. Construction validates settings but does not
     * contact the identity source.
     *
     * @throws BackendConfigurationException if the settings are malformed or incomplete
     */
    AuthenticationBackend create(BackendType type, String name, Map<String, String> settings)
        throws BackendConfigurationException;

    default AuthenticationBackend create(BackendConfig config) throws BackendConfigurationException {
        return create(config.getType(), config.getName(), config.getSettings());
    }

    /**
     * Validates settings by building and discarding an adapter.
     */
    default void validate(BackendType type, Map<String, String> settings) throws BackendConfigurationException {
        create(type, "validation", settings).close();
    }

    static BackendFactory standard() {
        return new StandardBackendFactory();
    }
}
