package com.radiusproxy.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.naming.AuthenticationException;
import javax.naming.Context;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.SearchControls;
import javax.naming.directory.SearchResult;
import javax.naming.ldap.InitialLdapContext;
import javax.naming.ldap.LdapContext;
import javax.naming.ldap.Rdn;
import javax.naming.ldap.StartTlsRequest;
import javax.naming.ldap.StartTlsResponse;
import java.io.IOException;
import java.util.Collections;
import java.util.Hashtable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds against an LDAP directory. Two strategies are supported:
 * <ul>
 *   <li>direct bind with a DN built from {@code bindDnFormat}
 *       ({@code %u} or {@code {}} stands for the user name);</li>
 *   <li>search-then-bind: a service account searches {@code searchBase} for
 *       the user's entry, then the user's DN is bound with the presented
 *       secret.</li>
 * </ul>
 * Directory attributes listed in {@code attributeMap} are copied onto the
 * reply attributes.
 */
public class DirectoryBackend implements AuthenticationBackend {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryBackend.class);

    public static final String SERVER = "server";
    public static final String BIND_DN_FORMAT = "bindDnFormat";
    public static final String SERVICE_BIND_DN = "serviceBindDn";
    public static final String SERVICE_BIND_PASSWORD = "serviceBindPassword";
    public static final String SEARCH_BASE = "searchBase";
    public static final String SEARCH_FILTER = "searchFilter";
    public static final String START_TLS = "startTls";
    public static final String ATTRIBUTE_MAP = "attributeMap";
    public static final String TIMEOUT_MILLIS = "timeoutMillis";

    static final String DEFAULT_SEARCH_FILTER = "(uid={})";
    static final Map<String, String> DEFAULT_ATTRIBUTE_MAP;

    static {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put("memberOf", "Filter-Id");
        defaults.put("telephoneNumber", "Calling-Station-Id");
        DEFAULT_ATTRIBUTE_MAP = Collections.unmodifiableMap(defaults);
    }

    /**
     * Opens an authenticated (or, with a null principal, anonymous)
     * directory context.
     */
    @FunctionalInterface
    interface DirectoryContextFactory {
        DirContext open(String principal, String credential) throws NamingException;
    }

    private final String name;
    private final String server;
    private final String bindDnFormat;
    private final String serviceBindDn;
    private final String serviceBindPassword;
    private final String searchBase;
    private final String searchFilter;
    private final Map<String, String> attributeMap;
    private final int timeoutMillis;
    private final DirectoryContextFactory contextFactory;

    public DirectoryBackend(String name, BackendSettings settings) throws BackendConfigurationException {
        this(name, settings, null);
    }

    DirectoryBackend(String name, BackendSettings settings, DirectoryContextFactory contextFactory)
            throws BackendConfigurationException {
        this.name = name;
        this.server = settings.require(SERVER);
        if (!server.startsWith("ldap://") && !server.startsWith("ldaps://")) {
            throw new BackendConfigurationException(SERVER, "expected an ldap:// or ldaps:// URL");
        }

        this.bindDnFormat = settings.get(BIND_DN_FORMAT);
        this.serviceBindDn = settings.get(SERVICE_BIND_DN);
        this.serviceBindPassword = settings.getRaw(SERVICE_BIND_PASSWORD);
        this.searchBase = settings.get(SEARCH_BASE);

        if (bindDnFormat != null) {
            if (!bindDnFormat.contains("%u") && !bindDnFormat.contains("{}")) {
                throw new BackendConfigurationException(BIND_DN_FORMAT, "must contain a %u or {} placeholder");
            }
        } else if (serviceBindDn == null || serviceBindPassword == null || searchBase == null) {
            throw new BackendConfigurationException(
                "Directory backend requires either " + BIND_DN_FORMAT + " or "
                + SERVICE_BIND_DN + " + " + SERVICE_BIND_PASSWORD + " + " + SEARCH_BASE);
        }

        this.searchFilter = toFilterExpression(settings.get(SEARCH_FILTER, DEFAULT_SEARCH_FILTER));
        this.attributeMap = settings.getMapping(ATTRIBUTE_MAP, DEFAULT_ATTRIBUTE_MAP);
        this.timeoutMillis = settings.getInt(TIMEOUT_MILLIS, 5000, 100, 300000);

        boolean startTls = settings.getBoolean(START_TLS, false);
        if (startTls && server.startsWith("ldaps://")) {
            throw new BackendConfigurationException(START_TLS, "cannot be combined with an ldaps:// URL");
        }

        this.contextFactory = contextFactory != null
            ? contextFactory
            : new JndiContextFactory(server, startTls, timeoutMillis);
    }

    @Override
    public AuthResult authenticate(String identity, String secret) throws BackendUnavailableException {
        // an empty secret is an unauthenticated bind in LDAP
        if (identity == null || identity.isEmpty() || secret == null || secret.isEmpty()) {
            return AuthResult.rejected("Empty identity or secret");
        }

        if (bindDnFormat != null) {
            return directBind(identity, secret);
        }
        return searchAndBind(identity, secret);
    }

    @Override
    public DiagnosticResult testConnection() {
        try {
            DirContext context = isSearchMode()
                ? contextFactory.open(serviceBindDn, serviceBindPassword)
                : contextFactory.open(null, null);
            closeQuietly(context);
            return DiagnosticResult.ok("Successfully connected to " + server);
        } catch (AuthenticationException e) {
            return DiagnosticResult.failed("Service account bind rejected by " + server);
        } catch (NamingException e) {
            return DiagnosticResult.failed("Cannot reach directory server " + server + ": " + describe(e));
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public BackendType getType() {
        return BackendType.DIRECTORY;
    }

    boolean isSearchMode() {
        return bindDnFormat == null;
    }

    String getSearchFilter() {
        return searchFilter;
    }

    String formatBindDn(String identity) {
        String escaped = Rdn.escapeValue(identity);
        return bindDnFormat.replace("{}", escaped).replace("%u", escaped);
    }

    private AuthResult directBind(String identity, String secret) throws BackendUnavailableException {
        String userDn = formatBindDn(identity);
        DirContext context;
        try {
            context = contextFactory.open(userDn, secret);
        } catch (AuthenticationException e) {
            logger.debug("{}: bind rejected for '{}'", name, userDn);
            return AuthResult.rejected("Bind rejected");
        } catch (NamingException e) {
            throw unavailable("bind", e);
        }

        try {
            Map<String, String> attributes = Collections.emptyMap();
            if (searchBase != null) {
                SearchResult entry = findEntry(context, identity);
                if (entry != null) {
                    attributes = mapAttributes(entry.getAttributes());
                } else {
                    logger.debug("{}: no entry for '{}' under {}", name, identity, searchBase);
                }
            }
            logger.debug("{}: user '{}' bound successfully", name, identity);
            return AuthResult.granted(attributes);
        } catch (NamingException e) {
            throw unavailable("attribute search", e);
        } finally {
            closeQuietly(context);
        }
    }

    private AuthResult searchAndBind(String identity, String secret) throws BackendUnavailableException {
        SearchResult entry;
        DirContext service;
        try {
            service = contextFactory.open(serviceBindDn, serviceBindPassword);
        } catch (AuthenticationException e) {
            throw new BackendUnavailableException(name, "Service account bind rejected", e);
        } catch (NamingException e) {
            throw unavailable("service bind", e);
        }

        try {
            entry = findEntry(service, identity);
        } catch (AmbiguousEntryException e) {
            logger.warn("{}: search for '{}' matched more than one entry", name, identity);
            return AuthResult.rejected("Ambiguous user entry");
        } catch (NamingException e) {
            throw unavailable("user search", e);
        } finally {
            closeQuietly(service);
        }

        if (entry == null) {
            logger.debug("{}: user '{}' not found under {}", name, identity, searchBase);
            return AuthResult.rejected("Unknown user");
        }

        String userDn = entry.getNameInNamespace();
        DirContext userContext;
        try {
            userContext = contextFactory.open(userDn, secret);
        } catch (AuthenticationException e) {
            logger.debug("{}: bind rejected for '{}'", name, userDn);
            return AuthResult.rejected("Bind rejected");
        } catch (NamingException e) {
            throw unavailable("user bind", e);
        }
        closeQuietly(userContext);

        try {
            Map<String, String> attributes = mapAttributes(entry.getAttributes());
            logger.debug("{}: user '{}' bound as {}", name, identity, userDn);
            return AuthResult.granted(attributes);
        } catch (NamingException e) {
            throw unavailable("attribute mapping", e);
        }
    }

    private SearchResult findEntry(DirContext context, String identity) throws NamingException {
        SearchControls controls = new SearchControls();
        controls.setSearchScope(SearchControls.SUBTREE_SCOPE);
        controls.setTimeLimit(timeoutMillis);
        controls.setReturningAttributes(attributeMap.keySet().toArray(new String[0]));

        NamingEnumeration<SearchResult> results =
            context.search(searchBase, searchFilter, new Object[] {identity}, controls);
        try {
            if (!results.hasMore()) {
                return null;
            }
            SearchResult first = results.next();
            if (results.hasMore()) {
                throw new AmbiguousEntryException();
            }
            return first;
        } finally {
            results.close();
        }
    }

    private Map<String, String> mapAttributes(Attributes attributes) throws NamingException {
        Map<String, String> mapped = new LinkedHashMap<>();
        if (attributes == null) {
            return mapped;
        }
        for (Map.Entry<String, String> mapping : attributeMap.entrySet()) {
            Attribute attribute = attributes.get(mapping.getKey());
            if (attribute == null || attribute.size() == 0) {
                continue;
            }
            Object value = attribute.get(0);
            if (value != null) {
                mapped.put(mapping.getValue(), value.toString());
            }
        }
        return mapped;
    }

    private BackendUnavailableException unavailable(String stage, NamingException e) {
        return new BackendUnavailableException(name, "Directory " + stage + " failed: " + describe(e), e);
    }

    private static String describe(NamingException e) {
        return e.getExplanation() != null ? e.getExplanation() : e.getClass().getSimpleName();
    }

    private void closeQuietly(DirContext context) {
        if (context == null) {
            return;
        }
        try {
            context.close();
        } catch (NamingException e) {
            logger.debug("{}: error closing directory context: {}", name, describe(e));
        }
    }

    /**
     * Rewrites the {@code {}} / {@code %u} placeholder into a JNDI filter
     * argument so the user name is escaped by the provider.
     */
    static String toFilterExpression(String filter) {
        return filter.replace("{}", "{0}").replace("%u", "{0}");
    }

    private static final class AmbiguousEntryException extends NamingException {
        AmbiguousEntryException() {
            super("More than one entry matched");
        }
    }

    /**
     * Opens contexts with the JDK LDAP provider, upgrading plain connections
     * with StartTLS before any credential is sent when requested.
     */
    static final class JndiContextFactory implements DirectoryContextFactory {
        private final String server;
        private final boolean startTls;
        private final int timeoutMillis;

        JndiContextFactory(String server, boolean startTls, int timeoutMillis) {
            this.server = server;
            this.startTls = startTls;
            this.timeoutMillis = timeoutMillis;
        }

        @Override
        public DirContext open(String principal, String credential) throws NamingException {
            Hashtable<String, Object> env = new Hashtable<>();
            env.put(Context.INITIAL_CONTEXT_FACTORY, "com.sun.jndi.ldap.LdapCtxFactory");
            env.put(Context.PROVIDER_URL, server);
            env.put(Context.REFERRAL, "ignore");
            env.put("com.sun.jndi.ldap.connect.timeout", String.valueOf(timeoutMillis));
            env.put("com.sun.jndi.ldap.read.timeout", String.valueOf(timeoutMillis));

            if (!startTls) {
                applyCredentials(env, principal, credential);
                return new InitialLdapContext(env, null);
            }

            env.put(Context.SECURITY_AUTHENTICATION, "none");
            LdapContext context = new InitialLdapContext(env, null);
            try {
                StartTlsResponse tls = (StartTlsResponse) context.extendedOperation(new StartTlsRequest());
                tls.negotiate();
            } catch (IOException e) {
                context.close();
                NamingException failure = new NamingException("StartTLS negotiation failed");
                failure.setRootCause(e);
                throw failure;
            } catch (NamingException e) {
                context.close();
                throw e;
            }

            if (principal != null) {
                context.addToEnvironment(Context.SECURITY_AUTHENTICATION, "simple");
                context.addToEnvironment(Context.SECURITY_PRINCIPAL, principal);
                context.addToEnvironment(Context.SECURITY_CREDENTIALS, credential);
                try {
                    // forces the bind on the protected connection
                    context.getAttributes("", new String[] {"1.1"});
                } catch (NamingException e) {
                    context.close();
                    throw e;
                }
            }
            return context;
        }

        private static void applyCredentials(Hashtable<String, Object> env, String principal, String credential) {
            if (principal == null) {
                env.put(Context.SECURITY_AUTHENTICATION, "none");
                return;
            }
            env.put(Context.SECURITY_AUTHENTICATION, "simple");
            env.put(Context.SECURITY_PRINCIPAL, principal);
            env.put(Context.SECURITY_CREDENTIALS, credential);
        }
    }
}
