package com.radiusproxy.mfa;

import dev.samstevens.totp.secret.DefaultSecretGenerator;
import dev.samstevens.totp.secret.SecretGenerator;

import java.util.Collections;
import java.util.List;

/**
 * Issues fresh enrollment material: a TOTP secret and a set of backup codes.
 * The plain codes are handed out once; only their digests are enrolled.
 */
public class MfaProvisioning {

    private final SecretGenerator secretGenerator;

    public MfaProvisioning() {
        this(new DefaultSecretGenerator());
    }

    public MfaProvisioning(SecretGenerator secretGenerator) {
        this.secretGenerator = secretGenerator;
    }

    public Provisioned provision(String identity, int backupCodeCount) {
        String secret = secretGenerator.generate();
        List<String> codes = BackupCodes.generate(backupCodeCount);
        MfaEnrollment enrollment = MfaEnrollment.enabled(identity, secret, BackupCodes.digestAll(codes));
        return new Provisioned(enrollment, codes);
    }

    public static final class Provisioned {
        private final MfaEnrollment enrollment;
        private final List<String> backupCodes;

        Provisioned(MfaEnrollment enrollment, List<String> backupCodes) {
            this.enrollment = enrollment;
            this.backupCodes = Collections.unmodifiableList(backupCodes);
        }

        public MfaEnrollment getEnrollment() {
            return enrollment;
        }

        public List<String> getBackupCodes() {
            return backupCodes;
        }

        /**
         * Renders the enrollment as configuration properties.
         */
        public String toProperties() {
            String prefix = "mfa.user." + enrollment.getIdentity();
            return prefix + ".enabled=true\n"
                + prefix + ".secret=" + enrollment.getSecret() + "\n"
                + prefix + ".backup-codes=" + String.join(",", enrollment.getBackupCodeDigests()) + "\n";
        }
    }
}
