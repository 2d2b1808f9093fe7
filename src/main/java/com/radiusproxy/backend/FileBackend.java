package com.radiusproxy.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Authenticates against a line-oriented credential file:
 * <pre>
 * # identity  secret  [attr=value,attr=value]
 * alice  $2a$10$...  Filter-Id=staff,Session-Timeout=3600
 * </pre>
 * The file is read on every call; the parsed table is reused while the
 * content digest is unchanged, so external edits apply to the next call.
 */
public class FileBackend implements AuthenticationBackend {

    private static final Logger logger = LoggerFactory.getLogger(FileBackend.class);

    public static final String PATH = "path";
    public static final String DIGEST_SCHEME = "digestScheme";

    private final String name;
    private final Path path;
    private final DigestScheme digestScheme;

    private volatile UserTable table;

    public FileBackend(String name, BackendSettings settings) throws BackendConfigurationException {
        this.name = name;
        this.path = Paths.get(settings.require(PATH));
        this.digestScheme = settings.getDigestScheme(DIGEST_SCHEME);
    }

    @Override
    public AuthResult authenticate(String identity, String secret) throws BackendUnavailableException {
        if (identity == null || identity.isEmpty() || secret == null || secret.isEmpty()) {
            return AuthResult.rejected("Empty identity or secret");
        }

        UserEntry entry = loadTable().users.get(identity);
        if (entry == null) {
            logger.debug("{}: user '{}' not found in {}", name, identity, path);
            return AuthResult.rejected("Unknown user");
        }

        if (!digestScheme.matches(secret, entry.storedSecret)) {
            logger.debug("{}: secret mismatch for user '{}'", name, identity);
            return AuthResult.rejected("Secret mismatch");
        }

        logger.debug("{}: user '{}' verified", name, identity);
        return AuthResult.granted(entry.attributes);
    }

    @Override
    public DiagnosticResult testConnection() {
        if (!Files.exists(path)) {
            return DiagnosticResult.failed("Users file not found: " + path);
        }
        if (!Files.isRegularFile(path)) {
            return DiagnosticResult.failed("Path is not a file: " + path);
        }
        try {
            UserTable loaded = loadTable();
            return DiagnosticResult.ok("Successfully read users file (" + loaded.users.size() + " users)");
        } catch (BackendUnavailableException e) {
            return DiagnosticResult.failed(e.getMessage());
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public BackendType getType() {
        return BackendType.FILE;
    }

    public Path getPath() {
        return path;
    }

    private UserTable loadTable() throws BackendUnavailableException {
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new BackendUnavailableException(name, "Users file not readable: " + path, e);
        }

        byte[] digest = contentDigest(content);
        UserTable current = table;
        if (current != null && MessageDigest.isEqual(current.digest, digest)) {
            return current;
        }

        String text = new String(content, StandardCharsets.UTF_8);
        UserTable parsed = new UserTable(parse(Arrays.asList(text.split("\\r?\\n"))), digest);
        table = parsed;
        logger.info("{}: loaded {} users from {}", name, parsed.users.size(), path);
        return parsed;
    }

    private static byte[] contentDigest(byte[] content) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(content);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static Map<String, UserEntry> parse(List<String> lines) {
        Map<String, UserEntry> users = new HashMap<>();
        int lineNumber = 0;

        for (String rawLine : lines) {
            lineNumber++;
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            String[] parts = line.split("\\s+", 3);
            if (parts.length < 2) {
                logger.warn("Ignoring malformed users file line {}: missing secret", lineNumber);
                continue;
            }

            Map<String, String> attributes = new LinkedHashMap<>();
            if (parts.length == 3) {
                for (String pair : parts[2].split(",")) {
                    int eq = pair.indexOf('=');
                    if (eq > 0) {
                        attributes.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
                    }
                }
            }

            users.put(parts[0], new UserEntry(parts[1], Collections.unmodifiableMap(attributes)));
        }

        return users;
    }

    static final class UserEntry {
        final String storedSecret;
        final Map<String, String> attributes;

        UserEntry(String storedSecret, Map<String, String> attributes) {
            this.storedSecret = storedSecret;
            this.attributes = attributes;
        }
    }

    private static final class UserTable {
        final Map<String, UserEntry> users;
        final byte[] digest;

        UserTable(Map<String, UserEntry> users, byte[] digest) {
            this.users = users;
            this.digest = digest;
        }
    }
}
