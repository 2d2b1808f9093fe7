package com.radiusproxy.backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Capability contract shared by every identity source adapter.
 */
public interface AuthenticationBackend extends AutoCloseable {

    /**
     * Verifies a credential.
     *
     * @param identity the user name presented by the client
     * @param secret the base secret (never a composite with an appended code)
     * @return granted with reply attributes, or rejected when the credential is wrong
     * @throws BackendUnavailableException if the identity source cannot be reached or used
     */
    AuthResult authenticate(String identity, String secret) throws BackendUnavailableException;

    /**
     * Checks connectivity and configuration. Used for administrative
     * diagnostics only, never during live authentication.
     */
    DiagnosticResult testConnection();

    String getName();

    BackendType getType();

    /**
     * Releases pooled resources. Calls already in flight run to completion.
     */
    @Override
    default void close() {
    }

    public static class AuthResult {
        private final boolean granted;
        private final Map<String, String> attributes;
        private final String rejectReason;

        private AuthResult(boolean granted, Map<String, String> attributes, String rejectReason) {
            this.granted = granted;
            this.attributes = attributes;
            this.rejectReason = rejectReason;
        }

        public static AuthResult granted() {
            return new AuthResult(true, Collections.emptyMap(), null);
        }

        public static AuthResult granted(Map<String, String> attributes) {
            Map<String, String> copy = attributes != null && !attributes.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Collections.emptyMap();
            return new AuthResult(true, copy, null);
        }

        public static AuthResult rejected(String reason) {
            return new AuthResult(false, Collections.emptyMap(), reason);
        }

        public boolean isGranted() {
            return granted;
        }

        public Map<String, String> getAttributes() {
            return attributes;
        }

        public String getRejectReason() {
            return rejectReason;
        }

        @Override
        public String toString() {
            if (granted) {
                return "AuthResult{granted=true, attributes=" + attributes.keySet() + "}";
            }
            return "AuthResult{granted=false, reason='" + rejectReason + "'}";
        }
    }
}
