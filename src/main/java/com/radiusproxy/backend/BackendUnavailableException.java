package com.radiusproxy.backend;

/**
 * Thrown by an adapter when its identity source cannot be reached or used:
 * network failures, timeouts, unreadable files. A wrong credential is never
 * reported this way.
 */
public class BackendUnavailableException extends Exception {

    private final String backendName;

    public BackendUnavailableException(String backendName, String message) {
        super(message);
        this.backendName = backendName;
    }

    public BackendUnavailableException(String backendName, String message, Throwable cause) {
        super(message, cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
