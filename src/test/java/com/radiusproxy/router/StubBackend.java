package com.radiusproxy.router;

import com.radiusproxy.backend.AuthenticationBackend;
import com.radiusproxy.backend.BackendType;
import com.radiusproxy.backend.BackendUnavailableException;
import com.radiusproxy.backend.DiagnosticResult;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable adapter that records how it was called.
 */
class StubBackend implements AuthenticationBackend {

    enum Mode { GRANT, REJECT, UNAVAILABLE, SLOW, FAIL }

    private final String name;
    private volatile Mode mode = Mode.REJECT;
    private volatile String acceptedSecret;
    private volatile Map<String, String> attributes = Collections.emptyMap();
    private volatile boolean connectionOk = true;
    private volatile Runnable onCall;

    final AtomicInteger calls = new AtomicInteger();
    final AtomicInteger closes = new AtomicInteger();
    volatile String lastSecret;

    StubBackend(String name) {
        this.name = name;
    }

    StubBackend grants(String secret, Map<String, String> replyAttributes) {
        this.mode = Mode.GRANT;
        this.acceptedSecret = secret;
        this.attributes = replyAttributes;
        return this;
    }

    StubBackend mode(Mode newMode) {
        this.mode = newMode;
        return this;
    }

    StubBackend connectionOk(boolean ok) {
        this.connectionOk = ok;
        return this;
    }

    StubBackend onCall(Runnable action) {
        this.onCall = action;
        return this;
    }

    @Override
    public AuthResult authenticate(String identity, String secret) throws BackendUnavailableException {
        calls.incrementAndGet();
        lastSecret = secret;
        if (onCall != null) {
            onCall.run();
        }
        switch (mode) {
            case GRANT:
                return secret.equals(acceptedSecret) ? AuthResult.granted(attributes) : AuthResult.rejected("mismatch");
            case UNAVAILABLE:
                throw new BackendUnavailableException(name, "connection refused");
            case SLOW:
                try {
                    Thread.sleep(2000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return AuthResult.granted(attributes);
            case FAIL:
                throw new IllegalStateException("driver bug");
            case REJECT:
            default:
                return AuthResult.rejected("unknown user");
        }
    }

    @Override
    public DiagnosticResult testConnection() {
        return connectionOk ? DiagnosticResult.ok("stub reachable") : DiagnosticResult.failed("stub unreachable");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public BackendType getType() {
        return BackendType.FILE;
    }

    @Override
    public void close() {
        closes.incrementAndGet();
    }
}
