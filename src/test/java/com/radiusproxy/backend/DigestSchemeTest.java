package com.radiusproxy.backend;

import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCrypt;

import static org.junit.jupiter.api.Assertions.*;

class DigestSchemeTest {

    @Test
    void testFromKeyAcceptsAliases() {
        assertEquals(DigestScheme.SHA256, DigestScheme.fromKey("sha256"));
        assertEquals(DigestScheme.SHA256, DigestScheme.fromKey("SHA-256"));
        assertEquals(DigestScheme.SHA512, DigestScheme.fromKey(" sha-512 "));
        assertEquals(DigestScheme.BCRYPT, DigestScheme.fromKey("BCrypt"));
        assertEquals(DigestScheme.PLAIN, DigestScheme.fromKey("plain"));
    }

    @Test
    void testFromKeyRejectsUnknown() {
        assertThrows(IllegalArgumentException.class, () -> DigestScheme.fromKey("rot13"));
        assertThrows(IllegalArgumentException.class, () -> DigestScheme.fromKey(null));
    }

    @Test
    void testSha256KnownVector() {
        // sha256("password")
        String stored = "5e884898da28047151d0e56f8dc6292773603d0d6aabbdd62a11ef721d1542d8";

        assertTrue(DigestScheme.SHA256.matches("password", stored));
        assertTrue(DigestScheme.SHA256.matches("password", stored.toUpperCase()));
        assertFalse(DigestScheme.SHA256.matches("Password", stored));
    }

    @Test
    void testMd5KnownVector() {
        assertTrue(DigestScheme.MD5.matches("password", "5f4dcc3b5aa765d61d8327deb882cf99"));
    }

    @Test
    void testBcryptMatchesLibraryHash() {
        String stored = BCrypt.hashpw("s3cret", BCrypt.gensalt(4));

        assertTrue(DigestScheme.BCRYPT.matches("s3cret", stored));
        assertFalse(DigestScheme.BCRYPT.matches("wrong", stored));
    }

    @Test
    void testMalformedBcryptNeverMatches() {
        assertFalse(DigestScheme.BCRYPT.matches("s3cret", "not-a-bcrypt-hash"));
    }

    @Test
    void testPlainComparesExactly() {
        assertTrue(DigestScheme.PLAIN.matches("abc", "abc"));
        assertFalse(DigestScheme.PLAIN.matches("abc", "ABC"));
        assertFalse(DigestScheme.PLAIN.matches(null, "abc"));
        assertFalse(DigestScheme.PLAIN.matches("abc", null));
    }

    @Test
    void testEncodeProducesMatchingValue() {
        for (DigestScheme scheme : DigestScheme.values()) {
            String stored = scheme.encode("correct horse");
            assertTrue(scheme.matches("correct horse", stored), scheme.getKey());
            assertFalse(scheme.matches("battery staple", stored), scheme.getKey());
        }
    }
}
