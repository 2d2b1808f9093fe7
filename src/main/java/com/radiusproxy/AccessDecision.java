package com.radiusproxy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transport-neutral answer of the gateway: accept with reply attributes, or
 * reject with none.
 */
public final class AccessDecision {

    private static final AccessDecision REJECT = new AccessDecision(false, Collections.emptyMap());

    private final boolean accept;
    private final Map<String, String> replyAttributes;

    private AccessDecision(boolean accept, Map<String, String> replyAttributes) {
        this.accept = accept;
        this.replyAttributes = replyAttributes;
    }

    public static AccessDecision accept(Map<String, String> replyAttributes) {
        Map<String, String> copy = replyAttributes != null && !replyAttributes.isEmpty()
            ? Collections.unmodifiableMap(new LinkedHashMap<>(replyAttributes))
            : Collections.emptyMap();
        return new AccessDecision(true, copy);
    }

    public static AccessDecision reject() {
        return REJECT;
    }

    public boolean isAccept() {
        return accept;
    }

    public Map<String, String> getReplyAttributes() {
        return replyAttributes;
    }

    public int getPacketCode() {
        return accept ? RadiusPacket.ACCESS_ACCEPT : RadiusPacket.ACCESS_REJECT;
    }

    @Override
    public String toString() {
        return accept ? "AccessDecision{accept, attributes=" + replyAttributes.keySet() + "}" : "AccessDecision{reject}";
    }
}
