package com.radiusproxy.backend;

import org.springframework.security.crypto.bcrypt.BCrypt;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * Stored-credential formats understood by the relational and file adapters.
 */
public enum DigestScheme {

    BCRYPT("bcrypt", null),
    SHA512("sha512", "SHA-512"),
    SHA256("sha256", "SHA-256"),
    SHA1("sha1", "SHA-1"),
    MD5("md5", "MD5"),
    PLAIN("plain", null);

    private final String key;
    private final String algorithm;

    DigestScheme(String key, String algorithm) {
        this.key = key;
        this.algorithm = algorithm;
    }

    public String getKey() {
        return key;
    }

    public static DigestScheme fromKey(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace("-", "");
            for (DigestScheme scheme : values()) {
                if (scheme.key.equals(normalized)) {
                    return scheme;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported digest scheme: " + value
            + ". Supported schemes: bcrypt, sha512, sha256, sha1, md5, plain");
    }

    /**
     * Checks a presented secret against a stored value. A malformed stored
     * value never matches.
     *
     * @param secret the presented secret
     * @param stored the stored hash or plaintext
     * @return true if the secret matches
     */
    public boolean matches(String secret, String stored) {
        if (secret == null || stored == null) {
            return false;
        }

        switch (this) {
            case BCRYPT:
                try {
                    return BCrypt.checkpw(secret, stored);
                } catch (IllegalArgumentException e) {
                    return false;
                }
            case PLAIN:
                return MessageDigest.isEqual(
                    secret.getBytes(StandardCharsets.UTF_8),
                    stored.getBytes(StandardCharsets.UTF_8));
            default:
                String computed = hexDigest(secret);
                return MessageDigest.isEqual(
                    computed.getBytes(StandardCharsets.US_ASCII),
                    stored.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII));
        }
    }

    /**
     * Produces a stored value for the given secret.
     */
    public String encode(String secret) {
        switch (this) {
            case BCRYPT:
                return BCrypt.hashpw(secret, BCrypt.gensalt());
            case PLAIN:
                return secret;
            default:
                return hexDigest(secret);
        }
    }

    private String hexDigest(String secret) {
        try {
            MessageDigest md = MessageDigest.getInstance(algorithm);
            byte[] digest = md.digest(secret.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " algorithm not available", e);
        }
    }

    @Override
    public String toString() {
        return key;
    }
}
