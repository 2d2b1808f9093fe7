package com.radiusproxy.mfa;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

public class InMemoryMfaEnrollmentStore implements MfaEnrollmentStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryMfaEnrollmentStore.class);

    private final ConcurrentMap<String, MfaEnrollment> enrollments = new ConcurrentHashMap<>();

    @Override
    public Optional<MfaEnrollment> find(String identity) {
        if (identity == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(enrollments.get(identity));
    }

    @Override
    public List<MfaEnrollment> list() {
        return new ArrayList<>(enrollments.values());
    }

    @Override
    public void save(MfaEnrollment enrollment) {
        if (enrollment == null) {
            throw new IllegalArgumentException("Enrollment cannot be null");
        }
        enrollments.put(enrollment.getIdentity(), enrollment);
        logger.debug("Saved MFA enrollment for '{}'", enrollment.getIdentity());
    }

    @Override
    public boolean consumeBackupCode(String identity, String digest, Instant when) {
        AtomicBoolean consumed = new AtomicBoolean(false);
        enrollments.computeIfPresent(identity, (key, current) -> {
            if (!current.getBackupCodeDigests().contains(digest)) {
                return current;
            }
            consumed.set(true);
            return current.withoutBackupCode(digest, when);
        });
        return consumed.get();
    }

    @Override
    public void markUsed(String identity, Instant when) {
        enrollments.computeIfPresent(identity, (key, current) -> current.withLastUsed(when));
    }

    @Override
    public boolean disable(String identity) {
        return enrollments.computeIfPresent(identity, (key, current) -> current.withEnabled(false)) != null;
    }

    @Override
    public boolean delete(String identity) {
        return enrollments.remove(identity) != null;
    }
}
