package com.radiusproxy.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Dispatches on {@link BackendType} to the three built-in adapters.
 */
public class StandardBackendFactory implements BackendFactory {

    private static final Logger logger = LoggerFactory.getLogger(StandardBackendFactory.class);

    @Override
    public AuthenticationBackend create(BackendType type, String name, Map<String, String> settings)
            throws BackendConfigurationException {
        if (type == null) {
            throw new BackendConfigurationException("Backend type cannot be null");
        }
        if (name == null || name.trim().isEmpty()) {
            throw new BackendConfigurationException("Backend name cannot be null or empty");
        }

        BackendSettings backendSettings = new BackendSettings(settings);

        switch (type) {
            case DIRECTORY:
                logger.debug("Creating directory backend '{}'", name);
                return new DirectoryBackend(name, backendSettings);

            case RELATIONAL:
                logger.debug("Creating relational backend '{}'", name);
                return new RelationalBackend(name, backendSettings);

            case FILE:
                logger.debug("Creating file backend '{}'", name);
                return new FileBackend(name, backendSettings);

            default:
                throw new BackendConfigurationException("Unsupported backend type: " + type);
        }
    }
}
