package com.radiusproxy.mfa;

import dev.samstevens.totp.code.CodeVerifier;
import dev.samstevens.totp.code.DefaultCodeGenerator;
import dev.samstevens.totp.code.DefaultCodeVerifier;
import dev.samstevens.totp.time.SystemTimeProvider;
import dev.samstevens.totp.time.TimeProvider;

/**
 * RFC 6238 verifier: SHA-1, six digits, a configurable step and a symmetric
 * tolerance of whole steps around the current one.
 */
public class TotpCodeVerifier implements OneTimeCodeVerifier {

    public static final int DEFAULT_PERIOD_SECONDS = 30;
    public static final int DEFAULT_WINDOW = 1;

    private final CodeVerifier delegate;

    public TotpCodeVerifier() {
        this(DEFAULT_PERIOD_SECONDS, DEFAULT_WINDOW, new SystemTimeProvider());
    }

    public TotpCodeVerifier(int periodSeconds, int window, TimeProvider timeProvider) {
        if (periodSeconds <= 0) {
            throw new IllegalArgumentException("TOTP period must be positive: " + periodSeconds);
        }
        if (window < 0) {
            throw new IllegalArgumentException("TOTP window cannot be negative: " + window);
        }
        DefaultCodeVerifier verifier = new DefaultCodeVerifier(new DefaultCodeGenerator(), timeProvider);
        verifier.setTimePeriod(periodSeconds);
        verifier.setAllowedTimePeriodDiscrepancy(window);
        this.delegate = verifier;
    }

    @Override
    public boolean verify(String secret, String code) {
        if (secret == null || secret.isEmpty() || code == null) {
            return false;
        }
        return delegate.isValidCode(secret, code);
    }
}
