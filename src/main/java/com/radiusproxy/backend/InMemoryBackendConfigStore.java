package com.radiusproxy.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Thread-safe in-process store. Settings are validated through the
 * {@link BackendFactory} before anything is written.
 */
public class InMemoryBackendConfigStore implements BackendConfigStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryBackendConfigStore.class);

    private final BackendFactory validator;
    private final Clock clock;
    private final Map<Long, BackendConfig> configs = new TreeMap<>();
    private long nextId = 1;

    public InMemoryBackendConfigStore(BackendFactory validator) {
        this(validator, Clock.systemUTC());
    }

    public InMemoryBackendConfigStore(BackendFactory validator, Clock clock) {
        if (validator == null) {
            throw new IllegalArgumentException("BackendFactory cannot be null");
        }
        this.validator = validator;
        this.clock = clock;
    }

    @Override
    public synchronized List<BackendConfig> list() {
        List<BackendConfig> result = new ArrayList<>(configs.values());
        result.sort(BackendConfig.CHAIN_ORDER);
        return result;
    }

    @Override
    public synchronized List<BackendConfig> listEnabled() {
        List<BackendConfig> result = new ArrayList<>();
        for (BackendConfig config : configs.values()) {
            if (config.isEnabled()) {
                result.add(config);
            }
        }
        result.sort(BackendConfig.CHAIN_ORDER);
        return result;
    }

    @Override
    public synchronized Optional<BackendConfig> get(long id) {
        return Optional.ofNullable(configs.get(id));
    }

    @Override
    public synchronized BackendConfig create(BackendType type, String name, Map<String, String> settings,
                                             boolean enabled, int priority) throws BackendConfigurationException {
        if (type == null) {
            throw new BackendConfigurationException("Backend type cannot be null");
        }
        if (name == null || name.trim().isEmpty()) {
            throw new BackendConfigurationException("Backend name cannot be null or empty");
        }
        ensureUniqueName(type, name.trim(), -1);
        validator.validate(type, settings);

        Instant now = clock.instant();
        BackendConfig config = new BackendConfig(nextId++, type, name, enabled, priority, settings, now, now);
        configs.put(config.getId(), config);

        logger.info("Created {} backend '{}' with id {}", type, config.getName(), config.getId());
        return config;
    }

    @Override
    public synchronized BackendConfig update(long id, BackendConfigUpdate update) throws BackendConfigurationException {
        BackendConfig current = configs.get(id);
        if (current == null) {
            throw new BackendConfigurationException("No backend with id " + id);
        }
        if (update == null || update.isEmpty()) {
            throw new BackendConfigurationException("No updates provided");
        }
        if (update.getName() != null) {
            if (update.getName().trim().isEmpty()) {
                throw new BackendConfigurationException("Backend name cannot be empty");
            }
            ensureUniqueName(current.getType(), update.getName().trim(), id);
        }
        if (update.getSettings() != null) {
            validator.validate(current.getType(), update.getSettings());
        }

        BackendConfig updated = current.applying(update, clock.instant());
        configs.put(id, updated);

        logger.info("Updated backend id {} ('{}')", id, updated.getName());
        return updated;
    }

    @Override
    public synchronized boolean delete(long id) {
        BackendConfig removed = configs.remove(id);
        if (removed != null) {
            logger.info("Deleted backend id {} ('{}')", id, removed.getName());
            return true;
        }
        return false;
    }

    @Override
    public synchronized int updatePriorities(Map<Long, Integer> priorities) {
        Instant now = clock.instant();
        int changed = 0;
        for (Map.Entry<Long, Integer> entry : priorities.entrySet()) {
            BackendConfig current = configs.get(entry.getKey());
            if (current == null || entry.getValue() == null) {
                continue;
            }
            configs.put(current.getId(), current.withPriority(entry.getValue(), now));
            changed++;
        }
        logger.info("Updated priorities for {} backends", changed);
        return changed;
    }

    private void ensureUniqueName(BackendType type, String name, long exceptId) throws BackendConfigurationException {
        for (BackendConfig existing : configs.values()) {
            if (existing.getId() != exceptId && existing.getType() == type && existing.getName().equals(name)) {
                throw new BackendConfigurationException(
                    "Backend '" + name + "' of type '" + type + "' already exists");
            }
        }
    }
}
