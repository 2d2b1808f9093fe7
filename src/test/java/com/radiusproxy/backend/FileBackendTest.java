package com.radiusproxy.backend;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileBackendTest {

    @TempDir
    Path tempDir;

    private Path usersFile;

    @BeforeEach
    void setUp() throws Exception {
        usersFile = tempDir.resolve("users");
        Files.write(usersFile, Arrays.asList(
            "# identity secret attributes",
            "",
            "alice " + DigestScheme.SHA256.encode("wonderland") + " Filter-Id=staff,Session-Timeout=3600",
            "bob " + DigestScheme.SHA256.encode("builder"),
            "broken-line-without-secret"
        ), StandardCharsets.UTF_8);
    }

    private FileBackend backend(String digestScheme) throws BackendConfigurationException {
        Map<String, String> settings = new HashMap<>();
        settings.put(FileBackend.PATH, usersFile.toString());
        settings.put(FileBackend.DIGEST_SCHEME, digestScheme);
        return new FileBackend("users-file", new BackendSettings(settings));
    }

    @Test
    void testGrantsWithAttributes() throws Exception {
        AuthenticationBackend.AuthResult result = backend("sha256").authenticate("alice", "wonderland");

        assertTrue(result.isGranted());
        assertEquals("staff", result.getAttributes().get("Filter-Id"));
        assertEquals("3600", result.getAttributes().get("Session-Timeout"));
    }

    @Test
    void testGrantsWithoutAttributes() throws Exception {
        AuthenticationBackend.AuthResult result = backend("sha256").authenticate("bob", "builder");

        assertTrue(result.isGranted());
        assertTrue(result.getAttributes().isEmpty());
    }

    @Test
    void testRejectsWrongSecretAndUnknownUser() throws Exception {
        FileBackend backend = backend("sha256");

        assertFalse(backend.authenticate("alice", "looking-glass").isGranted());
        assertFalse(backend.authenticate("carol", "anything").isGranted());
        assertFalse(backend.authenticate("alice", "").isGranted());
    }

    @Test
    void testPicksUpFileChanges() throws Exception {
        FileBackend backend = backend("sha256");
        assertFalse(backend.authenticate("carol", "singer").isGranted());

        Files.write(usersFile, Arrays.asList(
            "carol " + DigestScheme.SHA256.encode("singer")
        ), StandardCharsets.UTF_8);
        Files.setLastModifiedTime(usersFile, FileTime.fromMillis(System.currentTimeMillis() + 5000));

        assertTrue(backend.authenticate("carol", "singer").isGranted());
        assertFalse(backend.authenticate("alice", "wonderland").isGranted());
    }

    @Test
    void testSameSizeEditWithUnchangedTimestampIsPickedUp() throws Exception {
        FileBackend backend = backend("sha256");
        assertTrue(backend.authenticate("alice", "wonderland").isGranted());
        FileTime modified = Files.getLastModifiedTime(usersFile);
        long size = Files.size(usersFile);

        String oldHash = DigestScheme.SHA256.encode("wonderland");
        String newHash = DigestScheme.SHA256.encode("looking-glass");
        String content = new String(Files.readAllBytes(usersFile), StandardCharsets.UTF_8);
        Files.write(usersFile, content.replace(oldHash, newHash).getBytes(StandardCharsets.UTF_8));
        Files.setLastModifiedTime(usersFile, modified);
        assertEquals(size, Files.size(usersFile));

        assertFalse(backend.authenticate("alice", "wonderland").isGranted());
        assertTrue(backend.authenticate("alice", "looking-glass").isGranted());
    }

    @Test
    void testMissingFileIsUnavailable() throws Exception {
        Files.delete(usersFile);
        FileBackend backend = backend("sha256");

        BackendUnavailableException e = assertThrows(BackendUnavailableException.class,
            () -> backend.authenticate("alice", "wonderland"));
        assertEquals("users-file", e.getBackendName());
    }

    @Test
    void testConnection() throws Exception {
        DiagnosticResult ok = backend("sha256").testConnection();
        assertTrue(ok.isOk());
        assertTrue(ok.getMessage().contains("2 users"), ok.getMessage());

        Files.delete(usersFile);
        DiagnosticResult missing = backend("sha256").testConnection();
        assertFalse(missing.isOk());
        assertTrue(missing.getMessage().startsWith("Users file not found"));
    }

    @Test
    void testDirectoryIsNotAFile() throws Exception {
        Map<String, String> settings = new HashMap<>();
        settings.put(FileBackend.PATH, tempDir.toString());
        settings.put(FileBackend.DIGEST_SCHEME, "plain");

        DiagnosticResult result = new FileBackend("dir", new BackendSettings(settings)).testConnection();

        assertFalse(result.isOk());
        assertTrue(result.getMessage().startsWith("Path is not a file"));
    }

    @Test
    void testRequiresPathAndScheme() {
        Map<String, String> noPath = new HashMap<>();
        noPath.put(FileBackend.DIGEST_SCHEME, "plain");
        BackendConfigurationException e = assertThrows(BackendConfigurationException.class,
            () -> new FileBackend("f", new BackendSettings(noPath)));
        assertEquals(FileBackend.PATH, e.getSettingName());

        Map<String, String> noScheme = new HashMap<>();
        noScheme.put(FileBackend.PATH, usersFile.toString());
        assertThrows(BackendConfigurationException.class,
            () -> new FileBackend("f", new BackendSettings(noScheme)));
    }

    @Test
    void testParseSkipsCommentsAndMalformedLines() {
        Map<String, FileBackend.UserEntry> users = FileBackend.parse(Arrays.asList(
            "# comment",
            "   ",
            "dave  secret",
            "lonely"
        ));

        assertEquals(1, users.size());
        assertEquals("secret", users.get("dave").storedSecret);
    }
}
