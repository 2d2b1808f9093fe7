package com.radiusproxy.mfa;

/**
 * Narrow seam to the time-based one-time code primitive.
 */
@FunctionalInterface
public interface OneTimeCodeVerifier {

    /**
     * @param secret the enrolled base32 shared secret
     * @param code the presented code
     * @return true if the code is valid for the current time window
     */
    boolean verify(String secret, String code);
}
