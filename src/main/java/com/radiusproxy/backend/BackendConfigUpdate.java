package com.radiusproxy.backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial update of a {@link BackendConfig}. Fields left {@code null} keep
 * their current value.
 */
public final class BackendConfigUpdate {

    private String name;
    private Boolean enabled;
    private Integer priority;
    private Map<String, String> settings;

    public static BackendConfigUpdate create() {
        return new BackendConfigUpdate();
    }

    public BackendConfigUpdate name(String name) {
        this.name = name;
        return this;
    }

    public BackendConfigUpdate enabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    public BackendConfigUpdate priority(int priority) {
        this.priority = priority;
        return this;
    }

    public BackendConfigUpdate settings(Map<String, String> settings) {
        this.settings = settings != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(settings))
            : null;
        return this;
    }

    public String getName() {
        return name;
    }

    public Boolean getEnabled() {
        return enabled;
    }

    public Integer getPriority() {
        return priority;
    }

    public Map<String, String> getSettings() {
        return settings;
    }

    public boolean isEmpty() {
        return name == null && enabled == null && priority == null && settings == null;
    }
}
