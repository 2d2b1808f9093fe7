package com.radiusproxy.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Verifies credentials stored in a relational table, optionally collecting
 * reply attributes from a second table keyed by user name.
 */
public class RelationalBackend implements AuthenticationBackend {

    private static final Logger logger = LoggerFactory.getLogger(RelationalBackend.class);

    public static final String CONNECTION_PARAMS = "connectionParams";
    public static final String DB_USER = "dbUser";
    public static final String DB_PASSWORD = "dbPassword";
    public static final String USERS_TABLE = "usersTable";
    public static final String USERNAME_COLUMN = "usernameColumn";
    public static final String PASSWORD_COLUMN = "passwordColumn";
    public static final String DIGEST_SCHEME = "digestScheme";
    public static final String ATTRIBUTES_TABLE = "attributesTable";
    public static final String ATTRIBUTES_USERNAME_COLUMN = "attributesUsernameColumn";
    public static final String ATTRIBUTE_NAME_COLUMN = "attributeNameColumn";
    public static final String ATTRIBUTE_VALUE_COLUMN = "attributeValueColumn";
    public static final String POOL_SIZE = "poolSize";
    public static final String MAX_LIFETIME_SECONDS = "maxLifetimeSeconds";
    public static final String TIMEOUT_MILLIS = "timeoutMillis";

    private final String name;
    private final String jdbcUrl;
    private final DigestScheme digestScheme;
    private final String passwordQuery;
    private final String attributesQuery;
    private final int queryTimeoutSeconds;
    private final ConnectionPool pool;

    public RelationalBackend(String name, BackendSettings settings) throws BackendConfigurationException {
        this(name, settings, null);
    }

    RelationalBackend(String name, BackendSettings settings, ConnectionPool.ConnectionFactory connectionFactory)
            throws BackendConfigurationException {
        this.name = name;
        this.jdbcUrl = settings.require(CONNECTION_PARAMS);
        if (!jdbcUrl.startsWith("jdbc:")) {
            throw new BackendConfigurationException(CONNECTION_PARAMS, "expected a jdbc: URL");
        }

        String usersTable = settings.getSqlIdentifier(USERS_TABLE, null);
        String usernameColumn = settings.getSqlIdentifier(USERNAME_COLUMN, null);
        String passwordColumn = settings.getSqlIdentifier(PASSWORD_COLUMN, null);
        this.digestScheme = settings.getDigestScheme(DIGEST_SCHEME);
        this.passwordQuery = "SELECT " + passwordColumn + " FROM " + usersTable
            + " WHERE " + usernameColumn + " = ?";

        if (settings.has(ATTRIBUTES_TABLE)) {
            String attributesTable = settings.getSqlIdentifier(ATTRIBUTES_TABLE, null);
            String keyColumn = settings.getSqlIdentifier(ATTRIBUTES_USERNAME_COLUMN, "username");
            String nameColumn = settings.getSqlIdentifier(ATTRIBUTE_NAME_COLUMN, "attribute");
            String valueColumn = settings.getSqlIdentifier(ATTRIBUTE_VALUE_COLUMN, "value");
            this.attributesQuery = "SELECT " + nameColumn + ", " + valueColumn + " FROM " + attributesTable
                + " WHERE " + keyColumn + " = ?";
        } else {
            this.attributesQuery = null;
        }

        int poolSize = settings.getInt(POOL_SIZE, 5, 1, 100);
        int maxLifetimeSeconds = settings.getInt(MAX_LIFETIME_SECONDS, 3600, 1, 86400);
        int timeoutMillis = settings.getInt(TIMEOUT_MILLIS, 5000, 100, 300000);
        this.queryTimeoutSeconds = Math.max(1, (timeoutMillis + 999) / 1000);

        ConnectionPool.ConnectionFactory factory = connectionFactory != null
            ? connectionFactory
            : driverManagerFactory(jdbcUrl, settings.get(DB_USER), settings.getRaw(DB_PASSWORD));
        this.pool = new ConnectionPool(name, factory, poolSize, maxLifetimeSeconds * 1000L, timeoutMillis);
    }

    @Override
    public AuthResult authenticate(String identity, String secret) throws BackendUnavailableException {
        if (identity == null || identity.isEmpty() || secret == null || secret.isEmpty()) {
            return AuthResult.rejected("Empty identity or secret");
        }

        ConnectionPool.Lease lease;
        try {
            lease = pool.borrow();
        } catch (SQLException e) {
            throw new BackendUnavailableException(name, "Cannot obtain database connection: " + e.getMessage(), e);
        }

        try {
            Connection connection = lease.getConnection();

            String stored = lookupStoredSecret(connection, identity);
            if (stored == null) {
                logger.debug("{}: user '{}' not found", name, identity);
                return AuthResult.rejected("Unknown user");
            }

            if (!digestScheme.matches(secret, stored)) {
                logger.debug("{}: secret mismatch for user '{}'", name, identity);
                return AuthResult.rejected("Secret mismatch");
            }

            Map<String, String> attributes = attributesQuery != null
                ? loadAttributes(connection, identity)
                : Map.of();

            logger.debug("{}: user '{}' verified with {} reply attributes", name, identity, attributes.size());
            return AuthResult.granted(attributes);

        } catch (SQLException e) {
            lease.markBroken();
            throw new BackendUnavailableException(name, "Database error: " + e.getMessage(), e);
        } finally {
            lease.close();
        }
    }

    @Override
    public DiagnosticResult testConnection() {
        try (ConnectionPool.Lease lease = pool.borrow();
             Statement statement = lease.getConnection().createStatement()) {
            statement.setQueryTimeout(queryTimeoutSeconds);
            try (ResultSet rs = statement.executeQuery("SELECT 1")) {
                if (rs.next()) {
                    return DiagnosticResult.ok("Successfully connected to database " + redact(jdbcUrl));
                }
                return DiagnosticResult.failed("Connection test query returned no rows");
            }
        } catch (SQLException e) {
            return DiagnosticResult.failed("Database connection failed: " + e.getMessage());
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public BackendType getType() {
        return BackendType.RELATIONAL;
    }

    @Override
    public void close() {
        pool.close();
    }

    String getPasswordQuery() {
        return passwordQuery;
    }

    String getAttributesQuery() {
        return attributesQuery;
    }

    private String lookupStoredSecret(Connection connection, String identity) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(passwordQuery)) {
            statement.setQueryTimeout(queryTimeoutSeconds);
            statement.setString(1, identity);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private Map<String, String> loadAttributes(Connection connection, String identity) throws SQLException {
        Map<String, String> attributes = new LinkedHashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(attributesQuery)) {
            statement.setQueryTimeout(queryTimeoutSeconds);
            statement.setString(1, identity);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    String attribute = rs.getString(1);
                    String value = rs.getString(2);
                    if (attribute != null && value != null) {
                        attributes.put(attribute, value);
                    }
                }
            }
        }
        return attributes;
    }

    private static ConnectionPool.ConnectionFactory driverManagerFactory(String url, String user, String password) {
        Properties properties = new Properties();
        if (user != null) {
            properties.setProperty("user", user);
        }
        if (password != null) {
            properties.setProperty("password", password);
        }
        return () -> DriverManager.getConnection(url, properties);
    }

    private static String redact(String url) {
        int query = url.indexOf('?');
        return query >= 0 ? url.substring(0, query) : url;
    }
}
