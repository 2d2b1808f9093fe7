package com.radiusproxy.mfa;

/**
 * Outcome of the second-factor check on a composite credential.
 */
public final class MfaResult {

    public enum Status {
        /** identity has no enabled enrollment; the whole credential is the secret */
        NOT_REQUIRED,
        VERIFIED,
        MISSING_CODE,
        INVALID_CODE
    }

    private final Status status;
    private final String baseSecret;

    private MfaResult(Status status, String baseSecret) {
        this.status = status;
        this.baseSecret = baseSecret;
    }

    public static MfaResult notRequired(String credential) {
        return new MfaResult(Status.NOT_REQUIRED, credential);
    }

    public static MfaResult verified(String baseSecret) {
        return new MfaResult(Status.VERIFIED, baseSecret);
    }

    public static MfaResult missingCode() {
        return new MfaResult(Status.MISSING_CODE, null);
    }

    public static MfaResult invalidCode() {
        return new MfaResult(Status.INVALID_CODE, null);
    }

    public Status getStatus() {
        return status;
    }

    /**
     * Gets the secret to forward to backends, or null when the check failed.
     */
    public String getBaseSecret() {
        return baseSecret;
    }

    public boolean permitsBackendCall() {
        return status == Status.NOT_REQUIRED || status == Status.VERIFIED;
    }

    @Override
    public String toString() {
        return "MfaResult{" + status + "}";
    }
}
