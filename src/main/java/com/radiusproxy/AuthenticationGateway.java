package com.radiusproxy;

import com.radiusproxy.router.AuthenticationOutcome;
import com.radiusproxy.router.BackendRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Hook between the network access server and the router. Given the request
 * attribute bag, grants become accept decisions carrying the router's
 * attributes and everything else becomes a bare reject.
 */
public class AuthenticationGateway implements RadiusHandler {

    private static final Logger logger = LoggerFactory.getLogger(AuthenticationGateway.class);

    public static final String USER_NAME = "User-Name";
    public static final String USER_PASSWORD = "User-Password";

    private final BackendRouter router;
    private final AttributeDictionary dictionary;

    public AuthenticationGateway(BackendRouter router) {
        this(router, AttributeDictionary.standard());
    }

    public AuthenticationGateway(BackendRouter router, AttributeDictionary dictionary) {
        if (router == null) {
            throw new IllegalArgumentException("BackendRouter cannot be null");
        }
        if (dictionary == null) {
            throw new IllegalArgumentException("AttributeDictionary cannot be null");
        }
        this.router = router;
        this.dictionary = dictionary;
    }

    public AccessDecision decide(Map<String, String> requestAttributes) {
        if (requestAttributes == null) {
            return AccessDecision.reject();
        }
        String identity = requestAttributes.get(USER_NAME);
        String credential = requestAttributes.get(USER_PASSWORD);
        if (identity == null || identity.isEmpty() || credential == null || credential.isEmpty()) {
            logger.debug("Request without identity or credential rejected");
            return AccessDecision.reject();
        }

        try {
            AuthenticationOutcome outcome = router.authenticate(identity, credential);
            return outcome.isGranted()
                ? AccessDecision.accept(outcome.getAttributes())
                : AccessDecision.reject();
        } catch (RuntimeException e) {
            logger.error("Unexpected error deciding access for '{}'", identity, e);
            return AccessDecision.reject();
        }
    }

    @Override
    public AccessDecision handleAccessRequest(RadiusRequest request) {
        Map<String, String> attributes = dictionary.decodeAll(request.getPacket());
        try {
            attributes.put(USER_PASSWORD, request.decryptPassword());
        } catch (RadiusPacket.RadiusException e) {
            logger.warn("Cannot recover User-Password from {}: {}",
                request.getClientAddress().getHostAddress(), e.getMessage());
            return AccessDecision.reject();
        }
        return decide(attributes);
    }

    public AttributeDictionary getDictionary() {
        return dictionary;
    }
}
