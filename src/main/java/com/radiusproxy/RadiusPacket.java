package com.radiusproxy;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RFC 2865 packet: 20-byte header followed by type-length-value attributes.
 */
public class RadiusPacket {

    public static final int ACCESS_REQUEST = 1;
    public static final int ACCESS_ACCEPT = 2;
    public static final int ACCESS_REJECT = 3;
    public static final int ACCOUNTING_REQUEST = 4;
    public static final int ACCOUNTING_RESPONSE = 5;
    public static final int ACCESS_CHALLENGE = 11;

    public static final int USER_NAME = 1;
    public static final int USER_PASSWORD = 2;
    public static final int CHAP_PASSWORD = 3;

    public static final int HEADER_LENGTH = 20;
    public static final int AUTHENTICATOR_LENGTH = 16;
    public static final int MAX_PACKET_LENGTH = 4096;
    public static final int MAX_ATTRIBUTE_VALUE_LENGTH = 253;

    private final int code;
    private final int identifier;
    private final byte[] authenticator;
    private final List<RadiusAttribute> attributes;

    public RadiusPacket(int code, int identifier, byte[] authenticator, List<RadiusAttribute> attributes) {
        if (authenticator == null || authenticator.length != AUTHENTICATOR_LENGTH) {
            throw new IllegalArgumentException("Authenticator must be " + AUTHENTICATOR_LENGTH + " bytes");
        }
        this.code = code;
        this.identifier = identifier;
        this.authenticator = authenticator.clone();
        this.attributes = new ArrayList<>(attributes);
    }

    public static RadiusPacket decode(byte[] data) throws RadiusException {
        if (data.length < HEADER_LENGTH) {
            throw new RadiusException("RADIUS packet too short: " + data.length);
        }
        if (data.length > MAX_PACKET_LENGTH) {
            throw new RadiusException("RADIUS packet too long: " + data.length);
        }

        ByteBuffer buffer = ByteBuffer.wrap(data);

        int code = buffer.get() & 0xFF;
        int identifier = buffer.get() & 0xFF;
        int length = buffer.getShort() & 0xFFFF;

        if (length != data.length) {
            throw new RadiusException("Length field mismatch: " + length + " vs " + data.length);
        }

        byte[] authenticator = new byte[AUTHENTICATOR_LENGTH];
        buffer.get(authenticator);

        List<RadiusAttribute> attributes = new ArrayList<>();

        while (buffer.hasRemaining()) {
            if (buffer.remaining() < 2) {
                throw new RadiusException("Malformed attribute: insufficient data");
            }

            int type = buffer.get() & 0xFF;
            int attrLength = buffer.get() & 0xFF;

            if (attrLength < 2) {
                throw new RadiusException("Invalid attribute length: " + attrLength);
            }
            if (buffer.remaining() < attrLength - 2) {
                throw new RadiusException("Attribute data truncated");
            }

            byte[] value = new byte[attrLength - 2];
            buffer.get(value);

            attributes.add(new RadiusAttribute(type, value));
        }

        return new RadiusPacket(code, identifier, authenticator, attributes);
    }

    public byte[] encode() {
        int totalLength = HEADER_LENGTH;
        for (RadiusAttribute attr : attributes) {
            totalLength += attr.getLength();
        }

        ByteBuffer buffer = ByteBuffer.allocate(totalLength);

        buffer.put((byte) code);
        buffer.put((byte) identifier);
        buffer.putShort((short) totalLength);
        buffer.put(authenticator);

        for (RadiusAttribute attr : attributes) {
            buffer.put((byte) attr.getType());
            buffer.put((byte) attr.getLength());
            buffer.put(attr.value);
        }

        return buffer.array();
    }

    public int getCode() {
        return code;
    }

    public int getIdentifier() {
        return identifier;
    }

    public byte[] getAuthenticator() {
        return authenticator.clone();
    }

    public List<RadiusAttribute> getAttributes() {
        return new ArrayList<>(attributes);
    }

    public RadiusAttribute getAttribute(int type) {
        for (RadiusAttribute attr : attributes) {
            if (attr.getType() == type) {
                return attr;
            }
        }
        return null;
    }

    public String getStringAttribute(int type) {
        RadiusAttribute attr = getAttribute(type);
        return attr != null ? attr.getStringValue() : null;
    }

    public byte[] getBinaryAttribute(int type) {
        RadiusAttribute attr = getAttribute(type);
        return attr != null ? attr.getValue() : null;
    }

    public static String codeName(int code) {
        switch (code) {
            case ACCESS_REQUEST:
                return "Access-Request";
            case ACCESS_ACCEPT:
                return "Access-Accept";
            case ACCESS_REJECT:
                return "Access-Reject";
            case ACCESS_CHALLENGE:
                return "Access-Challenge";
            case ACCOUNTING_REQUEST:
                return "Accounting-Request";
            case ACCOUNTING_RESPONSE:
                return "Accounting-Response";
            default:
                return "Unknown(" + code + ")";
        }
    }

    public static class RadiusAttribute {
        private final int type;
        private final byte[] value;

        public RadiusAttribute(int type, byte[] value) {
            if (type < 1 || type > 255) {
                throw new IllegalArgumentException("Attribute type out of range: " + type);
            }
            if (value.length > MAX_ATTRIBUTE_VALUE_LENGTH) {
                throw new IllegalArgumentException("Attribute " + type + " value too long: " + value.length);
            }
            this.type = type;
            this.value = value.clone();
        }

        public RadiusAttribute(int type, String value) {
            this(type, value.getBytes(StandardCharsets.UTF_8));
        }

        public int getType() {
            return type;
        }

        public byte[] getValue() {
            return value.clone();
        }

        public String getStringValue() {
            return new String(value, StandardCharsets.UTF_8);
        }

        public int getLength() {
            return value.length + 2;
        }
    }

    public static class RadiusException extends Exception {
        public RadiusException(String message) {
            super(message);
        }

        public RadiusException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
