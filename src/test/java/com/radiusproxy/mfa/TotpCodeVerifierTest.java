package com.radiusproxy.mfa;

import dev.samstevens.totp.code.DefaultCodeGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TotpCodeVerifierTest {

    static final String SECRET = "JBSWY3DPEHPK3PXP";
    static final long START = 1_700_000_010L;

    private SettableTimeProvider time;
    private TotpCodeVerifier verifier;

    @BeforeEach
    void setUp() {
        time = new SettableTimeProvider(START);
        verifier = new TotpCodeVerifier(30, 1, time);
    }

    static String codeAt(long epochSeconds) throws Exception {
        return new DefaultCodeGenerator().generate(SECRET, Math.floorDiv(epochSeconds, 30));
    }

    @Test
    void testAcceptsCurrentCode() throws Exception {
        assertTrue(verifier.verify(SECRET, codeAt(START)));
    }

    @Test
    void testToleratesOneStepEitherSide() throws Exception {
        assertTrue(verifier.verify(SECRET, codeAt(START - 30)));
        assertTrue(verifier.verify(SECRET, codeAt(START + 30)));
    }

    @Test
    void testRejectsCodesOutsideWindow() throws Exception {
        String code = codeAt(START);
        time.advanceSeconds(90);

        assertFalse(verifier.verify(SECRET, code));
    }

    @Test
    void testZeroWindowOnlyAcceptsCurrentStep() throws Exception {
        TotpCodeVerifier strict = new TotpCodeVerifier(30, 0, time);

        assertTrue(strict.verify(SECRET, codeAt(START)));
        assertFalse(strict.verify(SECRET, codeAt(START - 30)));
    }

    @Test
    void testRejectsMissingInputs() throws Exception {
        assertFalse(verifier.verify(null, codeAt(START)));
        assertFalse(verifier.verify("", codeAt(START)));
        assertFalse(verifier.verify(SECRET, null));
        assertFalse(verifier.verify(SECRET, "abcdef"));
    }

    @Test
    void testConstructorValidation() {
        assertThrows(IllegalArgumentException.class, () -> new TotpCodeVerifier(0, 1, time));
        assertThrows(IllegalArgumentException.class, () -> new TotpCodeVerifier(30, -1, time));
    }
}
