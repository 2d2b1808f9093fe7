package com.radiusproxy.router;

import com.radiusproxy.backend.BackendConfig;
import com.radiusproxy.backend.BackendConfigStore;
import com.radiusproxy.backend.BackendConfigUpdate;
import com.radiusproxy.backend.BackendConfigurationException;
import com.radiusproxy.backend.BackendType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Administrative entry point for backend configuration. Every successful
 * mutation reloads the router so the live chain follows the store.
 */
public class BackendAdministration {

    private final BackendConfigStore store;
    private final BackendRouter router;

    public BackendAdministration(BackendConfigStore store, BackendRouter router) {
        if (store == null || router == null) {
            throw new IllegalArgumentException("Store and router are required");
        }
        this.store = store;
        this.router = router;
    }

    public List<BackendConfig> list() {
        return store.list();
    }

    public Optional<BackendConfig> get(long id) {
        return store.get(id);
    }

    public BackendConfig create(BackendType type, String name, Map<String, String> settings,
                                boolean enabled, int priority) throws BackendConfigurationException {
        BackendConfig created = store.create(type, name, settings, enabled, priority);
        router.reload();
        return created;
    }

    public BackendConfig update(long id, BackendConfigUpdate update) throws BackendConfigurationException {
        BackendConfig updated = store.update(id, update);
        router.reload();
        return updated;
    }

    public boolean delete(long id) {
        boolean deleted = store.delete(id);
        if (deleted) {
            router.reload();
        }
        return deleted;
    }

    public int updatePriorities(Map<Long, Integer> priorities) {
        int changed = store.updatePriorities(priorities);
        if (changed > 0) {
            router.reload();
        }
        return changed;
    }
}
