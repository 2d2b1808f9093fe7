package com.radiusproxy.router;

import java.util.Collections;
import java.util.List;

public final class RouterStats {

    private final List<String> activeBackends;
    private final AuthenticationCache.CacheStats cacheStats;

    RouterStats(List<String> activeBackends, AuthenticationCache.CacheStats cacheStats) {
        this.activeBackends = Collections.unmodifiableList(activeBackends);
        this.cacheStats = cacheStats;
    }

    /**
     * Gets the live chain in walk order, as "name (type)".
     */
    public List<String> getActiveBackends() {
        return activeBackends;
    }

    public int getBackendCount() {
        return activeBackends.size();
    }

    public AuthenticationCache.CacheStats getCacheStats() {
        return cacheStats;
    }

    @Override
    public String toString() {
        return "RouterStats{backends=" + activeBackends + ", cache=" + cacheStats + "}";
    }
}
