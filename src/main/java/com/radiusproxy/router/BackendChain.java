package com.radiusproxy.router;

import com.radiusproxy.backend.AuthenticationBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable, ordered snapshot of live adapters. The router swaps whole
 * snapshots; a snapshot is never edited in place.
 */
final class BackendChain {

    private static final Logger logger = LoggerFactory.getLogger(BackendChain.class);

    private final List<AuthenticationBackend> backends;

    BackendChain(List<AuthenticationBackend> backends) {
        this.backends = Collections.unmodifiableList(new ArrayList<>(backends));
    }

    static BackendChain empty() {
        return new BackendChain(Collections.emptyList());
    }

    List<AuthenticationBackend> getBackends() {
        return backends;
    }

    int size() {
        return backends.size();
    }

    boolean isEmpty() {
        return backends.isEmpty();
    }

    List<String> describe() {
        List<String> names = new ArrayList<>(backends.size());
        for (AuthenticationBackend backend : backends) {
            names.add(backend.getName() + " (" + backend.getType().getKey() + ")");
        }
        return names;
    }

    void close() {
        for (AuthenticationBackend backend : backends) {
            try {
                backend.close();
            } catch (RuntimeException e) {
                logger.warn("Error closing backend '{}': {}", backend.getName(), e.getMessage());
            }
        }
    }
}
