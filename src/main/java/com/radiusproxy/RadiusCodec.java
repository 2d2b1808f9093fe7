package com.radiusproxy;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * MD5-based primitives of RFC 2865: authenticators and User-Password hiding.
 */
public final class RadiusCodec {

    private static final SecureRandom RANDOM = new SecureRandom();

    private RadiusCodec() {
    }

    public static byte[] generateRequestAuthenticator() {
        byte[] authenticator = new byte[RadiusPacket.AUTHENTICATOR_LENGTH];
        RANDOM.nextBytes(authenticator);
        return authenticator;
    }

    /**
     * MD5(Code + Identifier + Length + RequestAuth + Attributes + Secret).
     */
    public static byte[] computeResponseAuthenticator(RadiusPacket responsePacket,
                                                      byte[] requestAuthenticator,
                                                      String sharedSecret) throws RadiusPacket.RadiusException {
        MessageDigest md = md5();

        byte[] packetBytes = responsePacket.encode();
        System.arraycopy(requestAuthenticator, 0, packetBytes, 4, RadiusPacket.AUTHENTICATOR_LENGTH);

        md.update(packetBytes);
        md.update(sharedSecret.getBytes(StandardCharsets.UTF_8));
        return md.digest();
    }

    public static boolean verifyResponseAuthenticator(RadiusPacket responsePacket,
                                                      byte[] requestAuthenticator,
                                                      String sharedSecret) throws RadiusPacket.RadiusException {
        byte[] expected = computeResponseAuthenticator(responsePacket, requestAuthenticator, sharedSecret);
        return MessageDigest.isEqual(expected, responsePacket.getAuthenticator());
    }

    public static byte[] decryptPassword(byte[] encryptedPassword,
                                         byte[] requestAuthenticator,
                                         String sharedSecret) throws RadiusPacket.RadiusException {
        if (encryptedPassword.length == 0 || encryptedPassword.length % 16 != 0) {
            throw new RadiusPacket.RadiusException("Invalid encrypted password length: " + encryptedPassword.length);
        }

        MessageDigest md = md5();
        byte[] secret = sharedSecret.getBytes(StandardCharsets.UTF_8);
        byte[] result = new byte[encryptedPassword.length];

        byte[] b = Arrays.copyOf(requestAuthenticator, 16);

        for (int i = 0; i < encryptedPassword.length; i += 16) {
            md.reset();
            md.update(secret);
            md.update(b);
            byte[] hash = md.digest();

            for (int j = 0; j < 16; j++) {
                result[i + j] = (byte) (encryptedPassword[i + j] ^ hash[j]);
                b[j] = encryptedPassword[i + j];
            }
        }

        // strip the NUL padding
        int actualLength = result.length;
        while (actualLength > 0 && result[actualLength - 1] == 0) {
            actualLength--;
        }
        return Arrays.copyOf(result, actualLength);
    }

    public static byte[] encryptPassword(String password,
                                         byte[] requestAuthenticator,
                                         String sharedSecret) throws RadiusPacket.RadiusException {
        byte[] passwordBytes = password.getBytes(StandardCharsets.UTF_8);
        if (passwordBytes.length > 128) {
            throw new RadiusPacket.RadiusException("Password longer than 128 bytes");
        }

        int paddedLength = Math.max(16, ((passwordBytes.length + 15) / 16) * 16);
        byte[] padded = Arrays.copyOf(passwordBytes, paddedLength);

        MessageDigest md = md5();
        byte[] secret = sharedSecret.getBytes(StandardCharsets.UTF_8);
        byte[] result = new byte[paddedLength];

        byte[] b = Arrays.copyOf(requestAuthenticator, 16);

        for (int i = 0; i < paddedLength; i += 16) {
            md.reset();
            md.update(secret);
            md.update(b);
            byte[] hash = md.digest();

            for (int j = 0; j < 16; j++) {
                result[i + j] = (byte) (padded[i + j] ^ hash[j]);
                b[j] = result[i + j];
            }
        }

        return result;
    }

    public static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    private static MessageDigest md5() throws RadiusPacket.RadiusException {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new RadiusPacket.RadiusException("MD5 algorithm not available", e);
        }
    }
}
