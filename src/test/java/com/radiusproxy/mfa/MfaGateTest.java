package com.radiusproxy.mfa;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class MfaGateTest {

    private static final String SECRET = TotpCodeVerifierTest.SECRET;
    private static final long START = TotpCodeVerifierTest.START;

    private SettableTimeProvider time;
    private InMemoryMfaEnrollmentStore store;
    private MfaGate gate;

    @BeforeEach
    void setUp() {
        time = new SettableTimeProvider(START);
        store = new InMemoryMfaEnrollmentStore();
        store.save(MfaEnrollment.enabled("alice", SECRET,
            Arrays.asList(BackupCodes.digest("K7M2QX"), BackupCodes.digest("P9R4TW"))));
        gate = new MfaGate(store, new TotpCodeVerifier(30, 1, time));
    }

    @Test
    void testNotEnrolledPassesCredentialUnchanged() {
        MfaResult result = gate.check("bob", "builder123456");

        assertEquals(MfaResult.Status.NOT_REQUIRED, result.getStatus());
        assertEquals("builder123456", result.getBaseSecret());
        assertTrue(result.permitsBackendCall());
    }

    @Test
    void testDisabledEnrollmentIsNotRequired() {
        store.disable("alice");

        MfaResult result = gate.check("alice", "wonderland");

        assertEquals(MfaResult.Status.NOT_REQUIRED, result.getStatus());
        assertEquals("wonderland", result.getBaseSecret());
    }

    @Test
    void testSplitsTrailingTotpCode() throws Exception {
        MfaResult result = gate.check("alice", "wonderland" + TotpCodeVerifierTest.codeAt(START));

        assertEquals(MfaResult.Status.VERIFIED, result.getStatus());
        assertEquals("wonderland", result.getBaseSecret());
        assertNotNull(store.find("alice").get().getLastUsed());
    }

    @Test
    void testShortCredentialIsMissingCode() throws Exception {
        String code = TotpCodeVerifierTest.codeAt(START);

        assertEquals(MfaResult.Status.MISSING_CODE, gate.check("alice", code).getStatus());
        assertEquals(MfaResult.Status.MISSING_CODE, gate.check("alice", "abc").getStatus());
        assertEquals(MfaResult.Status.MISSING_CODE, gate.check("alice", "").getStatus());
        assertFalse(gate.check("alice", code).permitsBackendCall());
    }

    @Test
    void testWrongCodeIsInvalid() {
        MfaResult result = gate.check("alice", "wonderland000000");

        assertEquals(MfaResult.Status.INVALID_CODE, result.getStatus());
        assertNull(result.getBaseSecret());
    }

    @Test
    void testStaleCodeIsInvalid() throws Exception {
        String composite = "wonderland" + TotpCodeVerifierTest.codeAt(START);
        time.advanceSeconds(120);

        assertEquals(MfaResult.Status.INVALID_CODE, gate.check("alice", composite).getStatus());
    }

    @Test
    void testBackupCodeIsSingleUse() {
        MfaResult first = gate.check("alice", "wonderlandK7M2QX");
        MfaResult second = gate.check("alice", "wonderlandK7M2QX");

        assertEquals(MfaResult.Status.VERIFIED, first.getStatus());
        assertEquals("wonderland", first.getBaseSecret());
        assertEquals(MfaResult.Status.INVALID_CODE, second.getStatus());
        assertEquals(1, store.find("alice").get().getBackupCodeDigests().size());
    }

    @Test
    void testBackupCodeIsCaseInsensitive() {
        assertEquals(MfaResult.Status.VERIFIED, gate.check("alice", "wonderlandp9r4tw").getStatus());
    }

    @Test
    void testEnrollmentWithoutSecretUsesBackupCodesOnly() {
        store.save(new MfaEnrollment("carol", true, null,
            Collections.singletonList(BackupCodes.digest("ZX8Y7W")), null, null));

        assertEquals(MfaResult.Status.INVALID_CODE, gate.check("carol", "pass123456").getStatus());
        assertEquals(MfaResult.Status.VERIFIED, gate.check("carol", "passZX8Y7W").getStatus());
    }

    @Test
    void testConstructorValidation() {
        assertThrows(IllegalArgumentException.class, () -> new MfaGate(null, (s, c) -> true));
        assertThrows(IllegalArgumentException.class, () -> new MfaGate(store, null));
        assertThrows(IllegalArgumentException.class, () -> new MfaGate(store, (s, c) -> true, null));
    }
}
