package com.radiusproxy;

import com.radiusproxy.backend.BackendConfig;
import com.radiusproxy.backend.BackendConfigStore;
import com.radiusproxy.backend.BackendConfigurationException;
import com.radiusproxy.backend.BackendFactory;
import com.radiusproxy.backend.BackendType;
import com.radiusproxy.backend.InMemoryBackendConfigStore;
import com.radiusproxy.mfa.InMemoryMfaEnrollmentStore;
import com.radiusproxy.mfa.MfaEnrollment;
import com.radiusproxy.mfa.MfaEnrollmentStore;
import com.radiusproxy.mfa.MfaGate;
import com.radiusproxy.mfa.TotpCodeVerifier;
import com.radiusproxy.router.AuthenticationCache;
import com.radiusproxy.router.BackendRouter;
import dev.samstevens.totp.time.SystemTimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Loads the proxy's properties file and builds the components it describes:
 * NAS clients, backend configurations, MFA enrollments and the router.
 */
public class ConfigurationManager {

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationManager.class);

    private static final String NAS_PREFIX = "nas.";
    private static final String BACKEND_PREFIX = "backend.";
    private static final String MFA_USER_PREFIX = "mfa.user.";
    private static final Pattern DIGEST = Pattern.compile("^[0-9a-f]{64}$");

    private final Properties config;

    public ConfigurationManager(String configFile) throws IOException {
        this.config = loadConfiguration(configFile);
    }

    public ConfigurationManager(Properties config) {
        this.config = new Properties();
        this.config.putAll(config);
    }

    private static Properties loadConfiguration(String configFile) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = new FileInputStream(configFile)) {
            properties.load(in);
        }
        logger.info("Configuration loaded from: {}", configFile);
        return properties;
    }

    public int getServerPort() {
        return getInt("radius.port", RadiusServer.DEFAULT_PORT, 0, 65535);
    }

    public int getThreadPoolSize() {
        return getInt("radius.thread.pool.size", RadiusServer.DEFAULT_THREAD_POOL_SIZE, 1, 1000);
    }

    public int getCacheTtlSeconds() {
        return getInt("cache.ttl.seconds", (int) AuthenticationCache.DEFAULT_TTL.getSeconds(), 1, 86400);
    }

    public int getCacheMaxSize() {
        return getInt("cache.max.size", AuthenticationCache.DEFAULT_MAX_SIZE, 1, 1_000_000);
    }

    public int getBackendCallTimeoutMillis() {
        return getInt("backend.call.timeout.ms", (int) BackendRouter.DEFAULT_CALL_TIMEOUT_MILLIS, 100, 300_000);
    }

    public int getTotpWindow() {
        return getInt("mfa.totp.window", TotpCodeVerifier.DEFAULT_WINDOW, 0, 10);
    }

    public int getTotpPeriodSeconds() {
        return getInt("mfa.totp.period.seconds", TotpCodeVerifier.DEFAULT_PERIOD_SECONDS, 1, 300);
    }

    public String getProperty(String key) {
        return config.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return config.getProperty(key, defaultValue);
    }

    /**
     * Registers every {@code nas.<name>.ip} / {@code nas.<name>.secret} pair.
     */
    public NasRegistry createNasRegistry() throws UnknownHostException {
        NasRegistry registry = new NasRegistry();

        for (String name : groupNames(NAS_PREFIX)) {
            String prefix = NAS_PREFIX + name;
            String ip = trimmed(prefix + ".ip");
            String secret = trimmed(prefix + ".secret");
            if (ip == null || secret == null) {
                throw new IllegalStateException("NAS client '" + name + "' needs both .ip and .secret");
            }
            String description = config.getProperty(prefix + ".description", "NAS Client");
            registry.registerClient(name, InetAddress.getByName(ip), secret, description);
            logger.info("Registered NAS client '{}': {} ({})", name, ip, description);
        }

        logger.info("NAS registry created with {} clients", registry.getClientCount());
        return registry;
    }

    /**
     * Builds a store holding every {@code backend.<n>} block, in ascending
     * order of {@code n}. Settings are validated through the factory.
     */
    public BackendConfigStore createBackendStore(BackendFactory factory) throws BackendConfigurationException {
        InMemoryBackendConfigStore store = new InMemoryBackendConfigStore(factory);

        Map<Integer, String> ordered = new TreeMap<>();
        for (String group : groupNames(BACKEND_PREFIX)) {
            try {
                ordered.put(Integer.parseInt(group), group);
            } catch (NumberFormatException e) {
                // backend.call.timeout.ms and similar scalar keys share the prefix
                logger.trace("Ignoring non-numeric backend key group '{}'", group);
            }
        }

        for (String group : ordered.values()) {
            String prefix = BACKEND_PREFIX + group;
            String typeKey = trimmed(prefix + ".type");
            if (typeKey == null) {
                throw new BackendConfigurationException(prefix + ".type", "backend type is required");
            }
            BackendType type;
            try {
                type = BackendType.fromKey(typeKey);
            } catch (IllegalArgumentException e) {
                throw new BackendConfigurationException(prefix + ".type", e.getMessage());
            }
            String name = config.getProperty(prefix + ".name", type.getKey() + "-" + group);
            boolean enabled = Boolean.parseBoolean(config.getProperty(prefix + ".enabled", "true").trim());
            int priority = getInt(prefix + ".priority", BackendConfig.DEFAULT_PRIORITY, Integer.MIN_VALUE, Integer.MAX_VALUE);

            Map<String, String> settings = new HashMap<>();
            String settingsPrefix = prefix + ".settings.";
            for (String key : config.stringPropertyNames()) {
                if (key.startsWith(settingsPrefix)) {
                    settings.put(key.substring(settingsPrefix.length()), config.getProperty(key));
                }
            }

            store.create(type, name, settings, enabled, priority);
        }

        logger.info("Loaded {} backend configuration(s)", store.list().size());
        return store;
    }

    /**
     * Builds the enrollment store from {@code mfa.user.<identity>.*} entries.
     * Backup codes are given as SHA-256 hex digests.
     */
    public MfaEnrollmentStore createMfaStore() {
        InMemoryMfaEnrollmentStore store = new InMemoryMfaEnrollmentStore();

        Map<String, Map<String, String>> byIdentity = new LinkedHashMap<>();
        for (String key : new TreeSet<>(config.stringPropertyNames())) {
            if (!key.startsWith(MFA_USER_PREFIX)) {
                continue;
            }
            String rest = key.substring(MFA_USER_PREFIX.length());
            int dot = rest.lastIndexOf('.');
            if (dot <= 0) {
                throw new IllegalStateException("Malformed MFA property: " + key);
            }
            byIdentity.computeIfAbsent(rest.substring(0, dot), k -> new HashMap<>())
                .put(rest.substring(dot + 1), config.getProperty(key).trim());
        }

        for (Map.Entry<String, Map<String, String>> entry : byIdentity.entrySet()) {
            String identity = entry.getKey();
            Map<String, String> fields = entry.getValue();

            String secret = fields.get("secret");
            if (secret != null && secret.isEmpty()) {
                secret = null;
            }
            List<String> digests = new ArrayList<>();
            String codes = fields.get("backup-codes");
            if (codes != null && !codes.isEmpty()) {
                for (String digest : codes.split(",")) {
                    String normalized = digest.trim().toLowerCase(Locale.ROOT);
                    if (!DIGEST.matcher(normalized).matches()) {
                        throw new IllegalStateException("Backup code for '" + identity + "' is not a SHA-256 hex digest");
                    }
                    digests.add(normalized);
                }
            }
            boolean enabled = Boolean.parseBoolean(fields.getOrDefault("enabled", "true"));

            store.save(new MfaEnrollment(identity, enabled, secret, digests, Instant.now(), null));
        }

        logger.info("Loaded {} MFA enrollment(s)", byIdentity.size());
        return store;
    }

    /**
     * Wires cache, MFA gate and router, and loads the initial chain.
     */
    public BackendRouter createRouter(BackendConfigStore backendStore, BackendFactory factory,
                                      MfaEnrollmentStore mfaStore) {
        AuthenticationCache cache = new AuthenticationCache(
            Duration.ofSeconds(getCacheTtlSeconds()), getCacheMaxSize());
        TotpCodeVerifier verifier = new TotpCodeVerifier(
            getTotpPeriodSeconds(), getTotpWindow(), new SystemTimeProvider());
        MfaGate gate = new MfaGate(mfaStore, verifier);

        BackendRouter router = new BackendRouter(backendStore, factory, gate, cache, getBackendCallTimeoutMillis());
        router.reload();
        return router;
    }

    /**
     * @throws IllegalStateException if a value is malformed or no NAS client is configured
     */
    public void validateConfiguration() {
        getServerPort();
        getThreadPoolSize();
        getCacheTtlSeconds();
        getCacheMaxSize();
        getBackendCallTimeoutMillis();
        getTotpWindow();
        getTotpPeriodSeconds();

        if (groupNames(NAS_PREFIX).isEmpty()) {
            throw new IllegalStateException("No NAS clients configured (nas.<name>.ip / nas.<name>.secret)");
        }

        logger.info("Configuration validation passed");
    }

    public void logConfigurationSummary() {
        logger.info("Configuration Summary:");
        logger.info("  - Port: {}", getServerPort());
        logger.info("  - Thread Pool Size: {}", getThreadPoolSize());
        logger.info("  - Cache: ttl={}s, max={}", getCacheTtlSeconds(), getCacheMaxSize());
        logger.info("  - Backend call timeout: {} ms", getBackendCallTimeoutMillis());
        logger.info("  - TOTP: period={}s, window={}", getTotpPeriodSeconds(), getTotpWindow());
        logger.info("  - Configured NAS Clients: {}", groupNames(NAS_PREFIX).size());
    }

    private TreeSet<String> groupNames(String prefix) {
        TreeSet<String> names = new TreeSet<>();
        for (String key : config.stringPropertyNames()) {
            if (key.startsWith(prefix)) {
                String rest = key.substring(prefix.length());
                int dot = rest.indexOf('.');
                if (dot > 0) {
                    names.add(rest.substring(0, dot));
                }
            }
        }
        return names;
    }

    private String trimmed(String key) {
        String value = config.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    private int getInt(String key, int defaultValue, int min, int max) {
        String value = trimmed(key);
        if (value == null) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid numeric configuration property " + key + ": " + value, e);
        }
        if (parsed < min || parsed > max) {
            throw new IllegalStateException("Property " + key + " must be between " + min + " and " + max + ": " + parsed);
        }
        return parsed;
    }
}
