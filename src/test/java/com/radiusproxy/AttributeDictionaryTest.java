package com.radiusproxy;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AttributeDictionaryTest {

    private final AttributeDictionary dictionary = AttributeDictionary.standard();

    @Test
    void testLookupIsCaseInsensitive() {
        AttributeDictionary.AttributeDefinition definition = dictionary.byName("filter-id").orElseThrow(AssertionError::new);

        assertEquals("Filter-Id", definition.getName());
        assertEquals(11, definition.getType());
        assertEquals(AttributeDictionary.ValueType.STRING, definition.getValueType());
        assertEquals("Session-Timeout", dictionary.byType(27).get().getName());
        assertFalse(dictionary.byName("No-Such-Attribute").isPresent());
        assertFalse(dictionary.byName(null).isPresent());
    }

    @Test
    void testEncodeTypedValues() {
        RadiusPacket.RadiusAttribute timeout = dictionary.encode("Session-Timeout", "3600");
        assertEquals(27, timeout.getType());
        assertArrayEquals(new byte[]{0, 0, 0x0E, 0x10}, timeout.getValue());

        RadiusPacket.RadiusAttribute address = dictionary.encode("Framed-IP-Address", "10.1.2.254");
        assertArrayEquals(new byte[]{10, 1, 2, (byte) 254}, address.getValue());

        assertEquals("staff", dictionary.encode("Filter-Id", " staff ").getStringValue());
    }

    @Test
    void testEncodeRejectsValuesThatDoNotFit() {
        assertThrows(IllegalArgumentException.class, () -> dictionary.encode("Session-Timeout", "soon"));
        assertThrows(IllegalArgumentException.class, () -> dictionary.encode("Session-Timeout", "-1"));
        assertThrows(IllegalArgumentException.class, () -> dictionary.encode("Session-Timeout", "4294967296"));
        assertThrows(IllegalArgumentException.class, () -> dictionary.encode("Framed-IP-Address", "10.0.0.256"));
        assertThrows(IllegalArgumentException.class, () -> dictionary.encode("Framed-IP-Address", "example.com"));
        assertThrows(IllegalArgumentException.class, () -> dictionary.encode("Filter-Id", ""));
        assertThrows(IllegalArgumentException.class, () -> dictionary.encode("memberOf", "x"));
    }

    @Test
    void testEncodeAllSkipsUnencodableEntries() {
        Map<String, String> reply = new LinkedHashMap<>();
        reply.put("Filter-Id", "staff");
        reply.put("Session-Timeout", "never");
        reply.put("department", "finance");
        reply.put("Idle-Timeout", "600");

        List<RadiusPacket.RadiusAttribute> encoded = dictionary.encodeAll(reply);

        assertEquals(2, encoded.size());
        assertEquals(11, encoded.get(0).getType());
        assertEquals(28, encoded.get(1).getType());
        assertTrue(dictionary.encodeAll(null).isEmpty());
    }

    @Test
    void testDecodeAllSkipsPasswordAndUnknownTypes() {
        RadiusPacket packet = new RadiusPacket(RadiusPacket.ACCESS_REQUEST, 1, new byte[16], Arrays.asList(
            new RadiusPacket.RadiusAttribute(RadiusPacket.USER_NAME, "alice"),
            new RadiusPacket.RadiusAttribute(RadiusPacket.USER_PASSWORD, new byte[16]),
            new RadiusPacket.RadiusAttribute(4, new byte[]{(byte) 192, (byte) 168, 1, 1}),
            new RadiusPacket.RadiusAttribute(5, new byte[]{0, 0, 0, 7}),
            new RadiusPacket.RadiusAttribute(26, new byte[]{0, 0, 0, 9, 1, 3, 'x'})));

        Map<String, String> decoded = dictionary.decodeAll(packet);

        assertEquals(3, decoded.size());
        assertEquals("alice", decoded.get("User-Name"));
        assertEquals("192.168.1.1", decoded.get("NAS-IP-Address"));
        assertEquals("7", decoded.get("NAS-Port"));
        assertFalse(decoded.containsKey("User-Password"));
    }

    @Test
    void testDecodeSkipsMalformedIntegers() {
        RadiusPacket packet = new RadiusPacket(RadiusPacket.ACCESS_REQUEST, 1, new byte[16], Arrays.asList(
            new RadiusPacket.RadiusAttribute(5, new byte[]{1, 2})));

        assertTrue(dictionary.decodeAll(packet).isEmpty());
    }

    @Test
    void testCustomDefinition() {
        dictionary.define("Acme-Group", 200, AttributeDictionary.ValueType.STRING);

        assertEquals(200, dictionary.encode("acme-group", "ops").getType());
        assertThrows(IllegalArgumentException.class,
            () -> dictionary.define("Bad", 0, AttributeDictionary.ValueType.STRING));
    }
}
