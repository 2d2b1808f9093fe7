package com.radiusproxy.backend;

/**
 * Human-readable outcome of a connection test or a backend trial run.
 */
public final class DiagnosticResult {

    private final boolean ok;
    private final String message;

    private DiagnosticResult(boolean ok, String message) {
        this.ok = ok;
        this.message = message;
    }

    public static DiagnosticResult ok(String message) {
        return new DiagnosticResult(true, message);
    }

    public static DiagnosticResult failed(String message) {
        return new DiagnosticResult(false, message);
    }

    public boolean isOk() {
        return ok;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "DiagnosticResult{ok=" + ok + ", message='" + message + "'}";
    }
}
