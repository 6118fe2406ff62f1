package kubi.adapter.out.directory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Hashtable;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import javax.naming.AuthenticationException;
import javax.naming.CommunicationException;
import javax.naming.Context;
import javax.naming.InvalidNameException;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.DirContext;
import javax.naming.directory.InitialDirContext;
import javax.naming.directory.SearchControls;
import javax.naming.directory.SearchResult;
import javax.naming.ldap.InitialLdapContext;
import javax.naming.ldap.LdapContext;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.StartTlsRequest;
import javax.naming.ldap.StartTlsResponse;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import kubi.core.config.DirectoryConfig;
import kubi.core.model.auth.AuthFailure;
import kubi.core.model.auth.DirectoryIdentity;
import kubi.core.model.auth.KubiAuthenticationException;
import kubi.core.port.out.DirectoryAuthenticator;

/**
 * LDAP directory adapter.
 *
 * <p>Authentication follows the usual search-then-bind flow:
 * <ol>
 * <li>bind with the service account</li>
 * <li>search {@code user-base} for exactly one entry matching {@code user-filter}</li>
 * <li>bind as that entry with the user's password</li>
 * </ol>
 *
 * <p>Groups are the {@code cn} of entries under {@code group-base} matching
 * {@code group-filter}. A user is an administrator when their entry lies under
 * {@code admin-user-base}, or when a group under {@code admin-group-base}
 * lists them as a member.
 *
 * <p>Port 636 or {@code use-ssl} connects with {@code ldaps://}; otherwise
 * {@code start-tls} upgrades the plain connection before any bind.
 *
 * <p>A fresh connection is opened per call. A token request opens at most
 * {@value #MAX_CONNECTIONS_PER_LOOKUP} of them, each doing at most
 * {@value #MAX_STEPS_PER_CONNECTION} network steps (connect, StartTLS, bind,
 * search). {@code kubi.ldap.timeout} is divided over all of these steps
 * and every step gets that share as its connect or read timeout, so the
 * whole lookup stays within the configured timeout.
 */
@ApplicationScoped
public class LdapDirectoryAuthenticator implements DirectoryAuthenticator {

    private static final Logger LOG = Logger.getLogger(LdapDirectoryAuthenticator.class);

    private static final String LDAP_CONTEXT_FACTORY = "com.sun.jndi.ldap.LdapCtxFactory";
    private static final String CONNECT_TIMEOUT_PROPERTY = "com.sun.jndi.ldap.connect.timeout";
    private static final String READ_TIMEOUT_PROPERTY = "com.sun.jndi.ldap.read.timeout";
    private static final String SOCKET_FACTORY_PROPERTY = "java.naming.ldap.factory.socket";
    private static final String GROUP_NAME_ATTRIBUTE = "cn";
    private static final int LDAPS_PORT = 636;

    static final int MAX_CONNECTIONS_PER_LOOKUP = 4;
    static final int MAX_STEPS_PER_CONNECTION = 4;

    private final DirectoryConfig config;
    private final boolean useSsl;
    private final boolean startTls;
    private final String providerUrl;
    private final String timeoutMillis;

    @Inject
    public LdapDirectoryAuthenticator(DirectoryConfig config) {
        this.config = config;
        this.useSsl = usesSsl(config.port(), config.useSsl());
        if (useSsl && config.startTls()) {
            LOG.warnv("kubi.ldap.start-tls ignored, the connection to port {0} is already SSL", config.port());
        }
        this.startTls = config.startTls() && !useSsl;
        this.providerUrl = providerUrl(config.host(), config.port(), useSsl);
        this.timeoutMillis = Long.toString(stepTimeoutMillis(config.timeout()));
        if (config.skipTlsVerification() && (useSsl || startTls)) {
            LOG.warn("LDAP server certificate verification is disabled");
        }
        LOG.infov(
                "LDAP directory configured at {0} (StartTLS: {1}, {2} ms per network step)",
                providerUrl, startTls, timeoutMillis);
    }

    @Override
    public DirectoryIdentity authenticate(String username, String password) {
        // An empty password would turn the user bind into an anonymous bind
        if (password == null || password.isEmpty()) {
            LOG.infov("Rejected empty password for {0}", username);
            throw new KubiAuthenticationException(AuthFailure.AUTHENTICATION_FAILED);
        }

        final var userDn = withServiceContext(ctx -> findUserDn(ctx, username));
        if (userDn.isEmpty()) {
            LOG.infov("No unique directory entry for {0}", username);
            throw new KubiAuthenticationException(AuthFailure.AUTHENTICATION_FAILED);
        }

        DirContext userContext = null;
        try {
            userContext = connect(userDn.get(), password);
            LOG.debugv("Bound as {0}", userDn.get());
            return new DirectoryIdentity(username, userDn.get());
        } catch (AuthenticationException e) {
            LOG.infov("Directory rejected credentials for {0}", username);
            throw new KubiAuthenticationException(AuthFailure.AUTHENTICATION_FAILED, e);
        } catch (NamingException e) {
            LOG.warnv("Directory bind failed for {0}: {1}", username, e.getMessage());
            throw new KubiAuthenticationException(AuthFailure.DIRECTORY_UNAVAILABLE, e);
        } finally {
            close(userContext);
        }
    }

    @Override
    public List<String> resolveGroups(DirectoryIdentity identity) {
        return withServiceContext(ctx -> searchGroupNames(ctx, config.groupBase(), identity.distinguishedName()));
    }

    @Override
    public boolean isAdmin(DirectoryIdentity identity) {
        final var adminUserBase = config.adminUserBase().filter(base -> !base.isBlank());
        if (adminUserBase.isPresent() && isUnderBase(identity.distinguishedName(), adminUserBase.get())) {
            return true;
        }

        final var adminGroupBase = config.adminGroupBase().filter(base -> !base.isBlank());
        if (adminGroupBase.isEmpty()) {
            return false;
        }
        return withServiceContext(ctx -> !searchGroupNames(ctx, adminGroupBase.get(), identity.distinguishedName())
                .isEmpty());
    }

    private Optional<String> findUserDn(DirContext ctx, String username) throws NamingException {
        final var controls = new SearchControls();
        controls.setSearchScope(SearchControls.SUBTREE_SCOPE);
        controls.setReturningAttributes(new String[0]);
        controls.setCountLimit(2);

        final var results = ctx.search(config.userBase(), toJndiFilter(config.userFilter()), new Object[] {username},
                controls);
        try {
            if (!results.hasMore()) {
                return Optional.empty();
            }
            final var dn = results.next().getNameInNamespace();
            if (results.hasMore()) {
                LOG.warnv("Several directory entries match {0}, refusing to pick one", username);
                return Optional.empty();
            }
            return Optional.of(dn);
        } finally {
            results.close();
        }
    }

    private List<String> searchGroupNames(DirContext ctx, String base, String memberDn) throws NamingException {
        final var controls = new SearchControls();
        controls.setSearchScope(SearchControls.SUBTREE_SCOPE);
        controls.setReturningAttributes(new String[] {GROUP_NAME_ATTRIBUTE});

        final List<String> groups = new ArrayList<>();
        final NamingEnumeration<SearchResult> results =
                ctx.search(base, toJndiFilter(config.groupFilter()), new Object[] {memberDn}, controls);
        try {
            while (results.hasMore()) {
                final Attribute cn = results.next().getAttributes().get(GROUP_NAME_ATTRIBUTE);
                if (cn != null && cn.get() != null) {
                    groups.add(cn.get().toString());
                }
            }
        } finally {
            results.close();
        }
        return groups;
    }

    private <T> T withServiceContext(DirectoryCall<T> call) {
        DirContext ctx = null;
        try {
            ctx = connect(config.bindDn(), config.bindPassword());
            return call.apply(ctx);
        } catch (AuthenticationException e) {
            LOG.errorv("Directory rejected the service account {0}", config.bindDn());
            throw new KubiAuthenticationException(AuthFailure.DIRECTORY_UNAVAILABLE, e);
        } catch (NamingException e) {
            LOG.warnv("Directory call failed: {0}", e.getMessage());
            throw new KubiAuthenticationException(AuthFailure.DIRECTORY_UNAVAILABLE, e);
        } finally {
            close(ctx);
        }
    }

    private DirContext connect(String principal, String credentials) throws NamingException {
        final var env = baseEnvironment();
        if (!startTls) {
            putCredentials(env, principal, credentials);
            return new InitialDirContext(env);
        }

        final LdapContext ctx = new InitialLdapContext(env, null);
        try {
            final var tls = (StartTlsResponse) ctx.extendedOperation(new StartTlsRequest());
            if (config.skipTlsVerification()) {
                tls.setHostnameVerifier((host, session) -> true);
                tls.negotiate(TrustAllSocketFactory.sslSocketFactory());
            } else {
                tls.negotiate();
            }
            ctx.addToEnvironment(Context.SECURITY_AUTHENTICATION, "simple");
            ctx.addToEnvironment(Context.SECURITY_PRINCIPAL, principal);
            ctx.addToEnvironment(Context.SECURITY_CREDENTIALS, credentials);
            // The bind happens on the next operation over the upgraded connection
            ctx.getAttributes("", new String[0]);
            return ctx;
        } catch (IOException e) {
            close(ctx);
            final var failure = new CommunicationException("StartTLS negotiation failed: " + e.getMessage());
            failure.setRootCause(e);
            throw failure;
        } catch (NamingException e) {
            close(ctx);
            throw e;
        }
    }

    private Hashtable<String, String> baseEnvironment() {
        final var env = new Hashtable<String, String>();
        env.put(Context.INITIAL_CONTEXT_FACTORY, LDAP_CONTEXT_FACTORY);
        env.put(Context.PROVIDER_URL, providerUrl);
        env.put(CONNECT_TIMEOUT_PROPERTY, timeoutMillis);
        env.put(READ_TIMEOUT_PROPERTY, timeoutMillis);
        if (useSsl) {
            env.put(Context.SECURITY_PROTOCOL, "ssl");
            if (config.skipTlsVerification()) {
                env.put(SOCKET_FACTORY_PROPERTY, TrustAllSocketFactory.class.getName());
            }
        }
        return env;
    }

    private static void putCredentials(Hashtable<String, String> env, String principal, String credentials) {
        env.put(Context.SECURITY_AUTHENTICATION, "simple");
        env.put(Context.SECURITY_PRINCIPAL, principal);
        env.put(Context.SECURITY_CREDENTIALS, credentials);
    }

    private static void close(DirContext ctx) {
        if (ctx == null) {
            return;
        }
        try {
            ctx.close();
        } catch (NamingException e) {
            LOG.debugv("Failed to close directory connection: {0}", e.getMessage());
        }
    }

    /**
     * Whether to connect with {@code ldaps://}.
     */
    static boolean usesSsl(int port, boolean useSsl) {
        return useSsl || port == LDAPS_PORT;
    }

    /**
     * Connect or read timeout for one network step, given the budget of a whole lookup.
     */
    static long stepTimeoutMillis(Duration lookupTimeout) {
        return Math.max(1, lookupTimeout.toMillis() / (MAX_CONNECTIONS_PER_LOOKUP * MAX_STEPS_PER_CONNECTION));
    }

    /**
     * Build the JNDI provider URL.
     */
    static String providerUrl(String host, int port, boolean useSsl) {
        return (useSsl ? "ldaps://" : "ldap://") + host + ":" + port;
    }

    /**
     * Turn a {@code %s} filter into a JNDI filter expression so JNDI escapes the argument.
     */
    static String toJndiFilter(String filter) {
        return filter.replace("%s", "{0}");
    }

    /**
     * Whether {@code dn} equals {@code base} or lies below it, comparing RDNs case-insensitively.
     */
    static boolean isUnderBase(String dn, String base) {
        try {
            final var name = new LdapName(dn.toLowerCase(Locale.ROOT));
            final var baseName = new LdapName(base.toLowerCase(Locale.ROOT));
            return name.startsWith(baseName);
        } catch (InvalidNameException e) {
            LOG.warnv("Cannot compare {0} with admin base {1}: {2}", dn, base, e.getMessage());
            return false;
        }
    }

    @FunctionalInterface
    private interface DirectoryCall<T> {
        T apply(DirContext ctx) throws NamingException;
    }
}
