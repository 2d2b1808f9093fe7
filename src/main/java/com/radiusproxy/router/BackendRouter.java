package com.radiusproxy.router;

import com.radiusproxy.backend.AuthenticationBackend;
import com.radiusproxy.backend.AuthenticationBackend.AuthResult;
import com.radiusproxy.backend.BackendConfig;
import com.radiusproxy.backend.BackendConfigStore;
import com.radiusproxy.backend.BackendConfigurationException;
import com.radiusproxy.backend.BackendFactory;
import com.radiusproxy.backend.BackendType;
import com.radiusproxy.backend.BackendUnavailableException;
import com.radiusproxy.backend.DiagnosticResult;
import com.radiusproxy.mfa.MfaGate;
import com.radiusproxy.mfa.MfaResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decides access for an identity by walking an ordered chain of identity
 * sources until one grants, after the second factor (if enrolled) has been
 * verified and the cache consulted.
 *
 * <p>One instance per process, constructed and passed explicitly. Thread-safe:
 * {@link #authenticate} may run concurrently with {@link #reload}; each walk
 * uses the chain snapshot it started with.
 */
public class BackendRouter implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BackendRouter.class);

    public static final long DEFAULT_CALL_TIMEOUT_MILLIS = 5000;

    private final BackendConfigStore store;
    private final BackendFactory factory;
    private final MfaGate mfaGate;
    private final AuthenticationCache cache;
    private final long callTimeoutMillis;
    private final ExecutorService callExecutor;
    private final AtomicReference<BackendChain> chain = new AtomicReference<>(BackendChain.empty());

    public BackendRouter(BackendConfigStore store, BackendFactory factory, MfaGate mfaGate,
                         AuthenticationCache cache, long callTimeoutMillis) {
        if (store == null) {
            throw new IllegalArgumentException("BackendConfigStore cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("BackendFactory cannot be null");
        }
        if (mfaGate == null) {
            throw new IllegalArgumentException("MfaGate cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("AuthenticationCache cannot be null");
        }
        if (callTimeoutMillis <= 0) {
            throw new IllegalArgumentException("Backend call timeout must be positive");
        }
        this.store = store;
        this.factory = factory;
        this.mfaGate = mfaGate;
        this.cache = cache;
        this.callTimeoutMillis = callTimeoutMillis;

        AtomicInteger counter = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "BackendCall-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Authenticates an identity. Never throws; every failure mode collapses
     * to a rejection without detail.
     *
     * @param identity the user name
     * @param credential the secret as presented, with the one-time code
     *                   appended when the identity is MFA-enrolled
     */
    public AuthenticationOutcome authenticate(String identity, String credential) {
        if (identity == null || identity.isEmpty() || credential == null) {
            logger.debug("Rejecting request with missing identity or credential");
            return AuthenticationOutcome.rejected();
        }

        try {
            MfaResult mfa = mfaGate.check(identity, credential);
            if (!mfa.permitsBackendCall()) {
                logger.info("Authentication rejected for '{}': {}", identity, mfa.getStatus());
                return AuthenticationOutcome.rejected();
            }
            String secret = mfa.getBaseSecret();

            Optional<Map<String, String>> cached = cache.get(identity, secret);
            if (cached.isPresent()) {
                logger.debug("Cache hit for '{}'", identity);
                return AuthenticationOutcome.accepted(cached.get());
            }

            return walkChain(identity, secret);

        } catch (RuntimeException e) {
            logger.error("Unexpected error authenticating '{}'", identity, e);
            return AuthenticationOutcome.rejected();
        }
    }

    private AuthenticationOutcome walkChain(String identity, String secret) {
        // read before the snapshot: reload swaps the chain, then clears the cache
        long generation = cache.getGeneration();
        BackendChain snapshot = chain.get();
        if (snapshot.isEmpty()) {
            logger.warn("No enabled backends; rejecting '{}'", identity);
            return AuthenticationOutcome.rejected();
        }

        for (AuthenticationBackend backend : snapshot.getBackends()) {
            AuthResult result;
            try {
                result = call(backend, identity, secret);
            } catch (BackendUnavailableException e) {
                logger.warn("Backend '{}' unavailable for '{}': {}", backend.getName(), identity, e.getMessage());
                continue;
            }

            if (result.isGranted()) {
                logger.info("Authentication accepted for '{}' by backend '{}'", identity, backend.getName());
                if (!cache.setIfCurrent(identity, secret, result.getAttributes(), generation)) {
                    logger.debug("Cache cleared during walk; not caching result for '{}'", identity);
                }
                return AuthenticationOutcome.accepted(result.getAttributes());
            }
            logger.debug("Backend '{}' rejected '{}': {}", backend.getName(), identity, result.getRejectReason());
        }

        logger.info("Authentication rejected for '{}': no backend accepted", identity);
        return AuthenticationOutcome.rejected();
    }

    private AuthResult call(AuthenticationBackend backend, String identity, String secret)
            throws BackendUnavailableException {
        Future<AuthResult> future;
        try {
            future = callExecutor.submit(() -> backend.authenticate(identity, secret));
        } catch (RejectedExecutionException e) {
            throw new BackendUnavailableException(backend.getName(), "Router is shut down", e);
        }

        try {
            AuthResult result = future.get(callTimeoutMillis, TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new BackendUnavailableException(backend.getName(), "Backend returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new BackendUnavailableException(backend.getName(),
                "No response within " + callTimeoutMillis + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BackendUnavailableException) {
                throw (BackendUnavailableException) cause;
            }
            throw new BackendUnavailableException(backend.getName(), "Backend failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException(backend.getName(), "Interrupted while waiting", e);
        }
    }

    /**
     * Rebuilds the chain from the enabled configs in the store, swaps it in,
     * closes the replaced adapters and clears the cache. A config whose
     * adapter cannot be built is skipped.
     *
     * @return the number of adapters in the new chain
     */
    public synchronized int reload() {
        List<AuthenticationBackend> backends = new ArrayList<>();
        for (BackendConfig config : store.listEnabled()) {
            try {
                backends.add(factory.create(config));
            } catch (BackendConfigurationException e) {
                logger.error("Skipping backend '{}' (id {}): {}", config.getName(), config.getId(), e.getMessage());
            }
        }

        BackendChain previous = chain.getAndSet(new BackendChain(backends));
        cache.clear();
        previous.close();

        logger.info("Loaded {} backend(s): {}", backends.size(), chain.get().describe());
        return backends.size();
    }

    /**
     * Runs a throwaway adapter through a connection test and, when that
     * passes and test credentials are given, one authentication. The live
     * chain and the cache are not touched.
     */
    public DiagnosticResult testBackend(BackendType type, Map<String, String> settings,
                                        String testIdentity, String testSecret) {
        AuthenticationBackend backend;
        try {
            backend = factory.create(type, "test", settings);
        } catch (BackendConfigurationException e) {
            return DiagnosticResult.failed("Invalid configuration: " + e.getMessage());
        }

        try {
            DiagnosticResult connection = backend.testConnection();
            if (!connection.isOk() || isBlank(testIdentity) || isBlank(testSecret)) {
                return connection;
            }

            try {
                AuthResult result = call(backend, testIdentity, testSecret);
                if (result.isGranted()) {
                    return DiagnosticResult.ok(connection.getMessage()
                        + "; test authentication succeeded for '" + testIdentity + "'");
                }
                return DiagnosticResult.failed(connection.getMessage()
                    + "; test authentication rejected for '" + testIdentity + "': " + result.getRejectReason());
            } catch (BackendUnavailableException e) {
                return DiagnosticResult.failed(connection.getMessage()
                    + "; test authentication failed: " + e.getMessage());
            }
        } catch (RuntimeException e) {
            logger.warn("Backend test failed unexpectedly", e);
            return DiagnosticResult.failed("Unexpected error: " + e.getMessage());
        } finally {
            backend.close();
        }
    }

    public RouterStats getStats() {
        return new RouterStats(chain.get().describe(), cache.getStats());
    }

    public AuthenticationCache getCache() {
        return cache;
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
        chain.getAndSet(BackendChain.empty()).close();
        logger.info("Backend router closed");
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
