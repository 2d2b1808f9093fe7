package com.radiusproxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps RFC 2865 attribute names to wire types and converts the string values
 * of the gateway attribute bag to and from their typed encodings.
 */
public class AttributeDictionary {

    private static final Logger logger = LoggerFactory.getLogger(AttributeDictionary.class);

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");

    public enum ValueType {
        STRING,
        INTEGER,
        IPADDR
    }

    private final Map<String, AttributeDefinition> byName = new LinkedHashMap<>();
    private final Map<Integer, AttributeDefinition> byType = new LinkedHashMap<>();

    public static AttributeDictionary standard() {
        AttributeDictionary dictionary = new AttributeDictionary();
        dictionary.define("User-Name", 1, ValueType.STRING);
        dictionary.define("User-Password", RadiusPacket.USER_PASSWORD, ValueType.STRING);
        dictionary.define("NAS-IP-Address", 4, ValueType.IPADDR);
        dictionary.define("NAS-Port", 5, ValueType.INTEGER);
        dictionary.define("Service-Type", 6, ValueType.INTEGER);
        dictionary.define("Framed-Protocol", 7, ValueType.INTEGER);
        dictionary.define("Framed-IP-Address", 8, ValueType.IPADDR);
        dictionary.define("Framed-IP-Netmask", 9, ValueType.IPADDR);
        dictionary.define("Filter-Id", 11, ValueType.STRING);
        dictionary.define("Framed-MTU", 12, ValueType.INTEGER);
        dictionary.define("Login-IP-Host", 14, ValueType.IPADDR);
        dictionary.define("Reply-Message", 18, ValueType.STRING);
        dictionary.define("Callback-Number", 19, ValueType.STRING);
        dictionary.define("Framed-Route", 22, ValueType.STRING);
        dictionary.define("State", 24, ValueType.STRING);
        dictionary.define("Class", 25, ValueType.STRING);
        dictionary.define("Session-Timeout", 27, ValueType.INTEGER);
        dictionary.define("Idle-Timeout", 28, ValueType.INTEGER);
        dictionary.define("Called-Station-Id", 30, ValueType.STRING);
        dictionary.define("Calling-Station-Id", 31, ValueType.STRING);
        dictionary.define("NAS-Identifier", 32, ValueType.STRING);
        dictionary.define("NAS-Port-Type", 61, ValueType.INTEGER);
        return dictionary;
    }

    public void define(String name, int type, ValueType valueType) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Attribute name cannot be null or empty");
        }
        if (type < 1 || type > 255) {
            throw new IllegalArgumentException("Attribute type out of range: " + type);
        }
        AttributeDefinition definition = new AttributeDefinition(name.trim(), type, valueType);
        byName.put(key(definition.getName()), definition);
        byType.put(type, definition);
    }

    public Optional<AttributeDefinition> byName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(key(name)));
    }

    public Optional<AttributeDefinition> byType(int type) {
        return Optional.ofNullable(byType.get(type));
    }

    /**
     * Encodes one named value.
     *
     * @throws IllegalArgumentException if the name is unknown or the value does not fit its type
     */
    public RadiusPacket.RadiusAttribute encode(String name, String value) {
        AttributeDefinition definition = byName(name)
            .orElseThrow(() -> new IllegalArgumentException("Unknown attribute: " + name));
        if (value == null) {
            throw new IllegalArgumentException("Attribute " + name + " has no value");
        }
        return new RadiusPacket.RadiusAttribute(definition.getType(), toBytes(definition, value.trim()));
    }

    /**
     * Encodes a reply attribute bag. Unknown names and values that do not
     * fit their type are skipped.
     */
    public List<RadiusPacket.RadiusAttribute> encodeAll(Map<String, String> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return Collections.emptyList();
        }
        List<RadiusPacket.RadiusAttribute> encoded = new ArrayList<>(attributes.size());
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            try {
                encoded.add(encode(entry.getKey(), entry.getValue()));
            } catch (IllegalArgumentException e) {
                logger.debug("Skipping reply attribute '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        return encoded;
    }

    /**
     * Decodes the known attributes of a request into a name/value bag. The
     * hidden User-Password is left out; its value needs the shared secret.
     */
    public Map<String, String> decodeAll(RadiusPacket packet) {
        Map<String, String> decoded = new LinkedHashMap<>();
        for (RadiusPacket.RadiusAttribute attribute : packet.getAttributes()) {
            if (attribute.getType() == RadiusPacket.USER_PASSWORD) {
                continue;
            }
            AttributeDefinition definition = byType.get(attribute.getType());
            if (definition == null) {
                continue;
            }
            String value = fromBytes(definition, attribute.getValue());
            if (value != null) {
                decoded.putIfAbsent(definition.getName(), value);
            }
        }
        return decoded;
    }

    private static byte[] toBytes(AttributeDefinition definition, String value) {
        switch (definition.getValueType()) {
            case INTEGER:
                long number;
                try {
                    number = Long.parseLong(value);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Not an integer: " + value, e);
                }
                if (number < 0 || number > 0xFFFFFFFFL) {
                    throw new IllegalArgumentException("Integer out of range: " + value);
                }
                return ByteBuffer.allocate(4).putInt((int) number).array();

            case IPADDR:
                return parseIpv4(value);

            case STRING:
            default:
                byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
                if (bytes.length == 0 || bytes.length > RadiusPacket.MAX_ATTRIBUTE_VALUE_LENGTH) {
                    throw new IllegalArgumentException("String length out of range: " + bytes.length);
                }
                return bytes;
        }
    }

    private static String fromBytes(AttributeDefinition definition, byte[] value) {
        switch (definition.getValueType()) {
            case INTEGER:
                if (value.length != 4) {
                    return null;
                }
                return Long.toString(ByteBuffer.wrap(value).getInt() & 0xFFFFFFFFL);

            case IPADDR:
                if (value.length != 4) {
                    return null;
                }
                return (value[0] & 0xFF) + "." + (value[1] & 0xFF) + "." + (value[2] & 0xFF) + "." + (value[3] & 0xFF);

            case STRING:
            default:
                return new String(value, StandardCharsets.UTF_8);
        }
    }

    private static byte[] parseIpv4(String value) {
        Matcher matcher = IPV4.matcher(value);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not an IPv4 address: " + value);
        }
        byte[] address = new byte[4];
        for (int i = 0; i < 4; i++) {
            int octet = Integer.parseInt(matcher.group(i + 1));
            if (octet > 255) {
                throw new IllegalArgumentException("Not an IPv4 address: " + value);
            }
            address[i] = (byte) octet;
        }
        return address;
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    public static final class AttributeDefinition {
        private final String name;
        private final int type;
        private final ValueType valueType;

        AttributeDefinition(String name, int type, ValueType valueType) {
            this.name = name;
            this.type = type;
            this.valueType = valueType;
        }

        public String getName() {
            return name;
        }

        public int getType() {
            return type;
        }

        public ValueType getValueType() {
            return valueType;
        }

        @Override
        public String toString() {
            return name + "(" + type + ", " + valueType + ")";
        }
    }
}
