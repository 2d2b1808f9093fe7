package com.radiusproxy.backend;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, typed set of backend configurations.
 * <p>
 * Lists are returned in chain order (ascending priority, then ascending id).
 * The pair (type, name) is unique; priorities may tie.
 */
public interface BackendConfigStore {

    List<BackendConfig> list();

    List<BackendConfig> listEnabled();

    Optional<BackendConfig> get(long id);

    /**
     * Creates a configuration after validating its settings.
     *
     * @return the stored configuration with its assigned id
     * @throws BackendConfigurationException if settings are invalid or (type, name) already exists
     */
    BackendConfig create(BackendType type, String name, Map<String, String> settings,
                         boolean enabled, int priority) throws BackendConfigurationException;

    /**
     * Applies a partial update.
     *
     * @throws BackendConfigurationException if the id is unknown, the update is empty,
     *         the new settings are invalid or the new name collides
     */
    BackendConfig update(long id, BackendConfigUpdate update) throws BackendConfigurationException;

    boolean delete(long id);

    /**
     * Reassigns priorities in one step. Unknown ids are ignored.
     *
     * @return number of configurations changed
     */
    int updatePriorities(Map<Long, Integer> priorities);
}
