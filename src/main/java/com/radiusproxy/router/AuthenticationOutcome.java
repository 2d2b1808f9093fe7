package com.radiusproxy.router;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What callers of {@link BackendRouter#authenticate} see: a grant flag and
 * reply attributes. No reason is carried for a rejection.
 */
public final class AuthenticationOutcome {

    private static final AuthenticationOutcome REJECTED =
        new AuthenticationOutcome(false, Collections.emptyMap());

    private final boolean granted;
    private final Map<String, String> attributes;

    private AuthenticationOutcome(boolean granted, Map<String, String> attributes) {
        this.granted = granted;
        this.attributes = attributes;
    }

    public static AuthenticationOutcome accepted(Map<String, String> attributes) {
        Map<String, String> copy = attributes != null && !attributes.isEmpty()
            ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
            : Collections.emptyMap();
        return new AuthenticationOutcome(true, copy);
    }

    public static AuthenticationOutcome rejected() {
        return REJECTED;
    }

    public boolean isGranted() {
        return granted;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return "AuthenticationOutcome{granted=" + granted + ", attributes=" + attributes.keySet() + "}";
    }
}
