package com.radiusproxy.mfa;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Single-use recovery codes. Only digests are stored; a code is matched
 * case-insensitively.
 */
public final class BackupCodes {

    public static final int CODE_LENGTH = 6;
    public static final int DEFAULT_COUNT = 10;

    // no 0/O or 1/I
    private static final char[] ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();

    private BackupCodes() {
    }

    /**
     * Lowercase hex SHA-256 of the upper-cased code.
     */
    public static String digest(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Backup code cannot be null");
        }
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(code.trim().toUpperCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b & 0xFF));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static List<String> generate(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("Backup code count must be positive: " + count);
        }
        List<String> codes = new ArrayList<>(count);
        while (codes.size() < count) {
            char[] chars = new char[CODE_LENGTH];
            for (int i = 0; i < CODE_LENGTH; i++) {
                chars[i] = ALPHABET[RANDOM.nextInt(ALPHABET.length)];
            }
            String code = new String(chars);
            if (!codes.contains(code)) {
                codes.add(code);
            }
        }
        return codes;
    }

    public static List<String> digestAll(List<String> codes) {
        List<String> digests = new ArrayList<>(codes.size());
        for (String code : codes) {
            digests.add(digest(code));
        }
        return digests;
    }
}
