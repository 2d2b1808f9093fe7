package com.radiusproxy;

import java.net.InetAddress;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NAS clients allowed to send requests, keyed by source address, each with
 * its own shared secret.
 */
public class NasRegistry {

    private final ConcurrentMap<InetAddress, NasClient> clients = new ConcurrentHashMap<>();

    public void registerClient(String name, InetAddress address, String sharedSecret, String description) {
        if (address == null) {
            throw new IllegalArgumentException("Client address cannot be null");
        }
        if (sharedSecret == null || sharedSecret.trim().isEmpty()) {
            throw new IllegalArgumentException("Shared secret cannot be null or empty");
        }
        clients.put(address, new NasClient(name, address, sharedSecret.trim(), description));
    }

    public boolean unregisterClient(InetAddress address) {
        return clients.remove(address) != null;
    }

    public Optional<NasClient> findClient(InetAddress address) {
        if (address == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(clients.get(address));
    }

    public boolean isClientRegistered(InetAddress address) {
        return findClient(address).isPresent();
    }

    public List<NasClient> getClients() {
        return new ArrayList<>(clients.values());
    }

    public int getClientCount() {
        return clients.size();
    }

    public static class NasClient {
        private final String name;
        private final InetAddress address;
        private final String sharedSecret;
        private final String description;
        private final Instant registeredAt;
        private final AtomicLong requestCount = new AtomicLong();
        private volatile Instant lastRequestAt;

        NasClient(String name, InetAddress address, String sharedSecret, String description) {
            this.name = name;
            this.address = address;
            this.sharedSecret = sharedSecret;
            this.description = description != null ? description : "NAS Client";
            this.registeredAt = Instant.now();
        }

        public String getName() {
            return name;
        }

        public InetAddress getAddress() {
            return address;
        }

        public String getSharedSecret() {
            return sharedSecret;
        }

        public String getDescription() {
            return description;
        }

        public Instant getRegisteredAt() {
            return registeredAt;
        }

        public Instant getLastRequestAt() {
            return lastRequestAt;
        }

        public long getRequestCount() {
            return requestCount.get();
        }

        void recordRequest() {
            lastRequestAt = Instant.now();
            requestCount.incrementAndGet();
        }

        @Override
        public String toString() {
            return String.format("NasClient{name=%s, address=%s, description='%s', requests=%d}",
                name, address.getHostAddress(), description, requestCount.get());
        }
    }
}
