package com.radiusproxy.backend;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BackendSettingsTest {

    private static BackendSettings settings(String... pairs) {
        Map<String, String> map = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return new BackendSettings(map);
    }

    @Test
    void testGetTrimsAndTreatsBlankAsAbsent() {
        BackendSettings s = settings("a", "  value ", "blank", "   ");

        assertEquals("value", s.get("a"));
        assertNull(s.get("blank"));
        assertFalse(s.has("blank"));
        assertEquals("fallback", s.get("missing", "fallback"));
        assertEquals("  value ", s.getRaw("a"));
    }

    @Test
    void testRequireReportsSettingName() {
        BackendConfigurationException e = assertThrows(BackendConfigurationException.class,
            () -> settings().require("server"));

        assertEquals("server", e.getSettingName());
        assertTrue(e.getMessage().contains("server"));
    }

    @Test
    void testGetIntValidatesRange() throws Exception {
        assertEquals(5, settings().getInt("poolSize", 5, 1, 100));
        assertEquals(7, settings("poolSize", "7").getInt("poolSize", 5, 1, 100));

        assertThrows(BackendConfigurationException.class,
            () -> settings("poolSize", "0").getInt("poolSize", 5, 1, 100));
        assertThrows(BackendConfigurationException.class,
            () -> settings("poolSize", "many").getInt("poolSize", 5, 1, 100));
    }

    @Test
    void testGetBoolean() throws Exception {
        assertTrue(settings("startTls", "yes").getBoolean("startTls", false));
        assertFalse(settings("startTls", "0").getBoolean("startTls", true));
        assertTrue(settings().getBoolean("startTls", true));
        assertThrows(BackendConfigurationException.class,
            () -> settings("startTls", "maybe").getBoolean("startTls", false));
    }

    @Test
    void testSqlIdentifierRejectsInjection() throws Exception {
        assertEquals("users", settings("usersTable", "users").getSqlIdentifier("usersTable", null));
        assertEquals("auth.users", settings("usersTable", "auth.users").getSqlIdentifier("usersTable", null));
        assertEquals("username", settings().getSqlIdentifier("col", "username"));

        assertThrows(BackendConfigurationException.class,
            () -> settings("usersTable", "users; DROP TABLE users").getSqlIdentifier("usersTable", null));
        assertThrows(BackendConfigurationException.class,
            () -> settings().getSqlIdentifier("usersTable", null));
    }

    @Test
    void testGetMapping() throws Exception {
        Map<String, String> mapping = settings("attributeMap", "memberOf=Filter-Id, mail = Reply-Message")
            .getMapping("attributeMap", Collections.emptyMap());

        assertEquals(2, mapping.size());
        assertEquals("Filter-Id", mapping.get("memberOf"));
        assertEquals("Reply-Message", mapping.get("mail"));

        assertThrows(BackendConfigurationException.class,
            () -> settings("attributeMap", "memberOf").getMapping("attributeMap", null));
    }

    @Test
    void testGetDigestScheme() throws Exception {
        assertEquals(DigestScheme.BCRYPT, settings("digestScheme", "bcrypt").getDigestScheme("digestScheme"));
        assertThrows(BackendConfigurationException.class,
            () -> settings("digestScheme", "crc32").getDigestScheme("digestScheme"));
    }

    @Test
    void testKeywordsIgnoreDefaultLocale() throws Exception {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertTrue(settings("startTls", "TRUE").getBoolean("startTls", false));
            assertEquals(DigestScheme.PLAIN, settings("digestScheme", "PLAIN").getDigestScheme("digestScheme"));
            assertEquals(DigestScheme.SHA1, DigestScheme.fromKey("SHA1"));
            assertEquals(BackendType.FILE, BackendType.fromKey("FILE"));
            assertTrue(DigestScheme.SHA1.matches("password", "5BAA61E4C9B93F3F0682250B6CF8331B7EE68FD8"));
        } finally {
            Locale.setDefault(original);
        }
    }
}
