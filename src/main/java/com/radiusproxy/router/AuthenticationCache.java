package com.radiusproxy.router;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Short-lived memory of successful authentications, keyed by identity.
 *
 * <p>Only a salted SHA-256 digest of the secret is kept. The salt is random
 * per cache instance, so digests are not comparable across restarts. All
 * access is serialized through a single lock.
 */
public class AuthenticationCache {

    private static final Logger logger = LoggerFactory.getLogger(AuthenticationCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);
    public static final int DEFAULT_MAX_SIZE = 1000;

    private static final int SALT_LENGTH = 16;

    private final Duration ttl;
    private final int maxSize;
    private final Clock clock;
    private final byte[] salt;

    private final Object lock = new Object();
    // insertion order is age order: set() removes before re-inserting
    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>();
    private long hits;
    private long misses;
    private long generation;

    public AuthenticationCache() {
        this(DEFAULT_TTL, DEFAULT_MAX_SIZE, Clock.systemUTC());
    }

    public AuthenticationCache(Duration ttl, int maxSize) {
        this(ttl, maxSize, Clock.systemUTC());
    }

    public AuthenticationCache(Duration ttl, int maxSize, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Cache size must be positive: " + maxSize);
        }
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        this.ttl = ttl;
        this.maxSize = maxSize;
        this.clock = clock;
        this.salt = new byte[SALT_LENGTH];
        new SecureRandom().nextBytes(salt);
    }

    /**
     * Looks up the attributes cached for an identity. A hit requires an
     * unexpired entry whose digest matches the given secret; an entry with a
     * different digest is evicted.
     */
    public Optional<Map<String, String>> get(String identity, String secret) {
        if (identity == null || secret == null) {
            return Optional.empty();
        }
        byte[] digest = digest(secret);
        synchronized (lock) {
            Entry entry = entries.get(identity);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (isExpired(entry)) {
                entries.remove(identity);
                misses++;
                return Optional.empty();
            }
            if (!MessageDigest.isEqual(entry.secretDigest, digest)) {
                entries.remove(identity);
                misses++;
                logger.debug("Evicted cache entry for '{}' after secret mismatch", identity);
                return Optional.empty();
            }
            hits++;
            return Optional.of(entry.attributes);
        }
    }

    public void set(String identity, String secret, Map<String, String> attributes) {
        if (identity == null || secret == null) {
            return;
        }
        Entry entry = newEntry(secret, attributes);
        synchronized (lock) {
            put(identity, entry);
        }
    }

    /**
     * Stores an entry only if the cache has not been cleared since
     * {@code expectedGeneration} was read from {@link #getGeneration()}.
     *
     * @return true if the entry was stored
     */
    public boolean setIfCurrent(String identity, String secret, Map<String, String> attributes,
                                long expectedGeneration) {
        if (identity == null || secret == null) {
            return false;
        }
        Entry entry = newEntry(secret, attributes);
        synchronized (lock) {
            if (generation != expectedGeneration) {
                return false;
            }
            put(identity, entry);
            return true;
        }
    }

    /**
     * Gets the clear count. Every {@link #clear()} advances it.
     */
    public long getGeneration() {
        synchronized (lock) {
            return generation;
        }
    }

    /**
     * Drops every entry and resets the hit/miss counters.
     */
    public void clear() {
        synchronized (lock) {
            entries.clear();
            hits = 0;
            misses = 0;
            generation++;
        }
        logger.debug("Authentication cache cleared");
    }

    public CacheStats getStats() {
        synchronized (lock) {
            return new CacheStats(entries.size(), maxSize, hits, misses, ttl);
        }
    }

    private Entry newEntry(String secret, Map<String, String> attributes) {
        Map<String, String> copy = attributes != null && !attributes.isEmpty()
            ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
            : Collections.emptyMap();
        return new Entry(digest(secret), copy, clock.instant());
    }

    private void put(String identity, Entry entry) {
        entries.remove(identity);
        while (entries.size() >= maxSize) {
            evictOldest();
        }
        entries.put(identity, entry);
    }

    private void evictOldest() {
        Iterator<String> it = entries.keySet().iterator();
        if (it.hasNext()) {
            String oldest = it.next();
            it.remove();
            logger.debug("Evicted oldest cache entry '{}'", oldest);
        }
    }

    private boolean isExpired(Entry entry) {
        Instant now = clock.instant();
        return !now.isBefore(entry.insertedAt.plus(ttl));
    }

    private byte[] digest(String secret) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            md.update(salt);
            return md.digest(secret.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static final class Entry {
        final byte[] secretDigest;
        final Map<String, String> attributes;
        final Instant insertedAt;

        Entry(byte[] secretDigest, Map<String, String> attributes, Instant insertedAt) {
            this.secretDigest = secretDigest;
            this.attributes = attributes;
            this.insertedAt = insertedAt;
        }
    }

    public static final class CacheStats {
        private final int size;
        private final int maxSize;
        private final long hits;
        private final long misses;
        private final Duration ttl;

        CacheStats(int size, int maxSize, long hits, long misses, Duration ttl) {
            this.size = size;
            this.maxSize = maxSize;
            this.hits = hits;
            this.misses = misses;
            this.ttl = ttl;
        }

        public int getSize() {
            return size;
        }

        public int getMaxSize() {
            return maxSize;
        }

        public long getHits() {
            return hits;
        }

        public long getMisses() {
            return misses;
        }

        public Duration getTtl() {
            return ttl;
        }

        public double getHitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }

        @Override
        public String toString() {
            return String.format("CacheStats{size=%d/%d, hits=%d, misses=%d, ttl=%ds}",
                size, maxSize, hits, misses, ttl.getSeconds());
        }
    }
}
