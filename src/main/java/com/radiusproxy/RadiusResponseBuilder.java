package com.radiusproxy;

import java.util.ArrayList;
import java.util.List;

public class RadiusResponseBuilder {

    private final int code;
    private final int identifier;
    private final List<RadiusPacket.RadiusAttribute> attributes = new ArrayList<>();

    private RadiusResponseBuilder(int code, int identifier) {
        this.code = code;
        this.identifier = identifier;
    }

    public static RadiusResponseBuilder createAccept(int identifier) {
        return new RadiusResponseBuilder(RadiusPacket.ACCESS_ACCEPT, identifier);
    }

    public static RadiusResponseBuilder createReject(int identifier) {
        return new RadiusResponseBuilder(RadiusPacket.ACCESS_REJECT, identifier);
    }

    public RadiusResponseBuilder addAttribute(RadiusPacket.RadiusAttribute attribute) {
        if (attribute != null) {
            attributes.add(attribute);
        }
        return this;
    }

    public RadiusResponseBuilder addAttributes(List<RadiusPacket.RadiusAttribute> list) {
        for (RadiusPacket.RadiusAttribute attribute : list) {
            addAttribute(attribute);
        }
        return this;
    }

    /**
     * Builds the packet and signs it with the Response Authenticator.
     */
    public RadiusPacket build(byte[] requestAuthenticator, String sharedSecret) throws RadiusPacket.RadiusException {
        RadiusPacket unsigned = new RadiusPacket(code, identifier,
            new byte[RadiusPacket.AUTHENTICATOR_LENGTH], attributes);
        if (unsigned.encode().length > RadiusPacket.MAX_PACKET_LENGTH) {
            throw new RadiusPacket.RadiusException("Response exceeds maximum packet length");
        }

        byte[] responseAuthenticator = RadiusCodec.computeResponseAuthenticator(
            unsigned, requestAuthenticator, sharedSecret);

        return new RadiusPacket(code, identifier, responseAuthenticator, attributes);
    }

    /**
     * Accept carries the encodable reply attributes; reject carries none.
     */
    public static RadiusPacket buildFromDecision(AccessDecision decision,
                                                 AttributeDictionary dictionary,
                                                 int identifier,
                                                 byte[] requestAuthenticator,
                                                 String sharedSecret) throws RadiusPacket.RadiusException {
        if (!decision.isAccept()) {
            return createReject(identifier).build(requestAuthenticator, sharedSecret);
        }
        return createAccept(identifier)
            .addAttributes(dictionary.encodeAll(decision.getReplyAttributes()))
            .build(requestAuthenticator, sharedSecret);
    }
}
