package com.radiusproxy.mfa;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Second-factor enrollment of one identity. Immutable; stores replace the
 * whole record on change.
 */
public final class MfaEnrollment {

    private final String identity;
    private final boolean enabled;
    private final String secret;
    private final Set<String> backupCodeDigests;
    private final Instant createdAt;
    private final Instant lastUsed;

    public MfaEnrollment(String identity, boolean enabled, String secret,
                         Collection<String> backupCodeDigests, Instant createdAt, Instant lastUsed) {
        if (identity == null || identity.isEmpty()) {
            throw new IllegalArgumentException("Identity cannot be null or empty");
        }
        this.identity = identity;
        this.enabled = enabled;
        this.secret = secret;
        this.backupCodeDigests = backupCodeDigests != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(backupCodeDigests))
            : Collections.emptySet();
        this.createdAt = createdAt;
        this.lastUsed = lastUsed;
    }

    public static MfaEnrollment enabled(String identity, String secret, Collection<String> backupCodeDigests) {
        return new MfaEnrollment(identity, true, secret, backupCodeDigests, Instant.now(), null);
    }

    public String getIdentity() {
        return identity;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Gets the base32 TOTP secret, or null if only backup codes are enrolled.
     */
    public String getSecret() {
        return secret;
    }

    public Set<String> getBackupCodeDigests() {
        return backupCodeDigests;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastUsed() {
        return lastUsed;
    }

    public MfaEnrollment withLastUsed(Instant when) {
        return new MfaEnrollment(identity, enabled, secret, backupCodeDigests, createdAt, when);
    }

    public MfaEnrollment withEnabled(boolean value) {
        return new MfaEnrollment(identity, value, secret, backupCodeDigests, createdAt, lastUsed);
    }

    public MfaEnrollment withSecret(String newSecret) {
        return new MfaEnrollment(identity, enabled, newSecret, backupCodeDigests, createdAt, lastUsed);
    }

    MfaEnrollment withoutBackupCode(String digest, Instant when) {
        Set<String> remaining = new LinkedHashSet<>(backupCodeDigests);
        remaining.remove(digest);
        return new MfaEnrollment(identity, enabled, secret, remaining, createdAt, when);
    }

    @Override
    public String toString() {
        return "MfaEnrollment{identity='" + identity + "', enabled=" + enabled
            + ", backupCodes=" + backupCodeDigests.size() + ", lastUsed=" + lastUsed + "}";
    }
}
