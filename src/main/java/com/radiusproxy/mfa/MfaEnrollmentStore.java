package com.radiusproxy.mfa;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Access to per-identity MFA enrollments. The authentication path only reads
 * enrollments, marks them used and consumes backup codes; everything else is
 * administrative.
 */
public interface MfaEnrollmentStore {

    Optional<MfaEnrollment> find(String identity);

    List<MfaEnrollment> list();

    /**
     * Creates or replaces the enrollment for its identity.
     */
    void save(MfaEnrollment enrollment);

    /**
     * Atomically removes a backup code digest. A digest can be consumed once.
     *
     * @return true if the digest was present and has now been removed
     */
    boolean consumeBackupCode(String identity, String digest, Instant when);

    void markUsed(String identity, Instant when);

    boolean disable(String identity);

    boolean delete(String identity);
}
