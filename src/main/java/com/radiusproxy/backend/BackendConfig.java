package com.radiusproxy.backend;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One configured identity source. Instances are immutable; the store hands out
 * new instances on every change.
 */
public final class BackendConfig {

    /**
     * Chain order: ascending priority, ties broken by ascending id.
     */
    public static final Comparator<BackendConfig> CHAIN_ORDER =
        Comparator.comparingInt(BackendConfig::getPriority).thenComparingLong(BackendConfig::getId);

    public static final int DEFAULT_PRIORITY = 100;

    private final long id;
    private final BackendType type;
    private final String name;
    private final boolean enabled;
    private final int priority;
    private final Map<String, String> settings;
    private final Instant createdAt;
    private final Instant updatedAt;

    public BackendConfig(long id, BackendType type, String name, boolean enabled, int priority,
                         Map<String, String> settings, Instant createdAt, Instant updatedAt) {
        if (type == null) {
            throw new IllegalArgumentException("Backend type cannot be null");
        }
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Backend name cannot be null or empty");
        }

        this.id = id;
        this.type = type;
        this.name = name.trim();
        this.enabled = enabled;
        this.priority = priority;
        this.settings = settings != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(settings))
            : Collections.emptyMap();
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public long getId() {
        return id;
    }

    public BackendType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getPriority() {
        return priority;
    }

    public Map<String, String> getSettings() {
        return settings;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    BackendConfig applying(BackendConfigUpdate update, Instant now) {
        return new BackendConfig(
            id,
            type,
            update.getName() != null ? update.getName() : name,
            update.getEnabled() != null ? update.getEnabled() : enabled,
            update.getPriority() != null ? update.getPriority() : priority,
            update.getSettings() != null ? update.getSettings() : settings,
            createdAt,
            now
        );
    }

    BackendConfig withPriority(int newPriority, Instant now) {
        return new BackendConfig(id, type, name, enabled, newPriority, settings, createdAt, now);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BackendConfig)) {
            return false;
        }
        BackendConfig other = (BackendConfig) o;
        return id == other.id
            && enabled == other.enabled
            && priority == other.priority
            && type == other.type
            && name.equals(other.name)
            && settings.equals(other.settings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, name, enabled, priority, settings);
    }

    // settings may hold credentials and are never printed
    @Override
    public String toString() {
        return String.format("BackendConfig{id=%d, type=%s, name='%s', enabled=%s, priority=%d}",
                             id, type, name, enabled, priority);
    }
}
