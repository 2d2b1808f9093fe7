package com.radiusproxy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class RadiusProxyLifecycleTest {

    @Test
    void testStartAndStop(@TempDir Path dir) throws Exception {
        Path users = dir.resolve("users");
        Files.write(users, "alice  wonderland\n".getBytes(StandardCharsets.UTF_8));

        Properties properties = new Properties();
        properties.setProperty("radius.port", "0");
        properties.setProperty("radius.thread.pool.size", "2");
        properties.setProperty("nas.local.ip", "127.0.0.1");
        properties.setProperty("nas.local.secret", "testing123");
        properties.setProperty("backend.1.type", "file");
        properties.setProperty("backend.1.settings.path", users.toString());
        properties.setProperty("backend.1.settings.digestScheme", "plain");
        Path file = dir.resolve("proxy.properties");
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            properties.store(writer, null);
        }

        RadiusProxyLifecycle lifecycle = new RadiusProxyLifecycle();
        try {
            lifecycle.startWithConfiguration(file.toString());

            assertTrue(lifecycle.isRunning());
            assertEquals(1, lifecycle.getRouter().getStats().getBackendCount());
            assertTrue(lifecycle.getRouter().authenticate("alice", "wonderland").isGranted());
        } finally {
            lifecycle.stop();
        }

        assertFalse(lifecycle.isRunning());
        assertNull(lifecycle.getRouter());
    }

    @Test
    void testMainLoopRequiresStartedServer() {
        assertThrows(IllegalStateException.class, () -> new RadiusProxyLifecycle().runMainLoop());
    }
}
