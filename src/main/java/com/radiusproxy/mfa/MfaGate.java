package com.radiusproxy.mfa;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Splits a composite credential into base secret and trailing code for
 * enrolled identities and verifies the code before any backend is asked.
 *
 * <p>The code is the last six characters. A TOTP code is tried first, then a
 * backup code, which is consumed on success.
 */
public class MfaGate {

    private static final Logger logger = LoggerFactory.getLogger(MfaGate.class);

    public static final int CODE_LENGTH = 6;

    private final MfaEnrollmentStore store;
    private final OneTimeCodeVerifier verifier;
    private final Clock clock;

    public MfaGate(MfaEnrollmentStore store, OneTimeCodeVerifier verifier) {
        this(store, verifier, Clock.systemUTC());
    }

    public MfaGate(MfaEnrollmentStore store, OneTimeCodeVerifier verifier, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("MfaEnrollmentStore cannot be null");
        }
        if (verifier == null) {
            throw new IllegalArgumentException("OneTimeCodeVerifier cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        this.store = store;
        this.verifier = verifier;
        this.clock = clock;
    }

    public MfaResult check(String identity, String credential) {
        Optional<MfaEnrollment> found = store.find(identity);
        if (!found.isPresent() || !found.get().isEnabled()) {
            return MfaResult.notRequired(credential);
        }
        MfaEnrollment enrollment = found.get();

        // a credential of exactly six characters leaves an empty base secret
        if (credential == null || credential.length() <= CODE_LENGTH) {
            logger.info("MFA code missing for '{}'", identity);
            return MfaResult.missingCode();
        }

        int split = credential.length() - CODE_LENGTH;
        String baseSecret = credential.substring(0, split);
        String code = credential.substring(split);

        if (enrollment.getSecret() != null && verifier.verify(enrollment.getSecret(), code)) {
            store.markUsed(identity, clock.instant());
            logger.debug("TOTP code accepted for '{}'", identity);
            return MfaResult.verified(baseSecret);
        }

        if (store.consumeBackupCode(identity, BackupCodes.digest(code), clock.instant())) {
            logger.info("Backup code consumed for '{}'", identity);
            return MfaResult.verified(baseSecret);
        }

        logger.info("Invalid MFA code for '{}'", identity);
        return MfaResult.invalidCode();
    }

    public MfaEnrollmentStore getStore() {
        return store;
    }
}
