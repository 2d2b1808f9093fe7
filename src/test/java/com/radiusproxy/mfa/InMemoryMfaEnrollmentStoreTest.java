package com.radiusproxy.mfa;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMfaEnrollmentStoreTest {

    private InMemoryMfaEnrollmentStore store;
    private String digest;

    @BeforeEach
    void setUp() {
        store = new InMemoryMfaEnrollmentStore();
        digest = BackupCodes.digest("K7M2QX");
        store.save(MfaEnrollment.enabled("alice", "JBSWY3DPEHPK3PXP",
            Arrays.asList(digest, BackupCodes.digest("P9R4TW"))));
    }

    @Test
    void testBackupCodeIsConsumedOnce() {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");

        assertTrue(store.consumeBackupCode("alice", digest, now));
        assertFalse(store.consumeBackupCode("alice", digest, now));

        MfaEnrollment enrollment = store.find("alice").get();
        assertEquals(1, enrollment.getBackupCodeDigests().size());
        assertEquals(now, enrollment.getLastUsed());
    }

    @Test
    void testConsumeUnknownIdentityOrDigest() {
        assertFalse(store.consumeBackupCode("bob", digest, Instant.now()));
        assertFalse(store.consumeBackupCode("alice", BackupCodes.digest("NOPE00"), Instant.now()));
        assertEquals(2, store.find("alice").get().getBackupCodeDigests().size());
    }

    @Test
    void testConcurrentConsumersOnlyOneWins() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                attempts.add(() -> store.consumeBackupCode("alice", digest, Instant.now()));
            }
            int wins = 0;
            for (Future<Boolean> result : executor.invokeAll(attempts)) {
                if (result.get()) {
                    wins++;
                }
            }
            assertEquals(1, wins);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testMarkUsedDisableDelete() {
        Instant when = Instant.parse("2024-05-01T12:00:00Z");
        store.markUsed("alice", when);
        assertEquals(when, store.find("alice").get().getLastUsed());

        assertTrue(store.disable("alice"));
        assertFalse(store.find("alice").get().isEnabled());
        assertFalse(store.disable("bob"));

        assertTrue(store.delete("alice"));
        assertFalse(store.find("alice").isPresent());
        assertTrue(store.list().isEmpty());
    }

    @Test
    void testEnrollmentIsImmutable() {
        MfaEnrollment enrollment = store.find("alice").get();

        assertThrows(UnsupportedOperationException.class, () -> enrollment.getBackupCodeDigests().clear());
        assertThrows(IllegalArgumentException.class, () -> store.save(null));
    }
}
