package kubi.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the LDAP directory used to authenticate users.
 *
 * <p>Configuration prefix: {@code kubi.ldap}
 */
@ConfigMapping(prefix = "kubi.ldap")
public interface DirectoryConfig {

    /**
     * Directory host name.
     */
    String host();

    /**
     * Directory port. Port 636 always connects with {@code ldaps://}.
     */
    @WithDefault("389")
    int port();

    /**
     * Connect with {@code ldaps://} instead of {@code ldap://}.
     */
    @WithName("use-ssl")
    @WithDefault("false")
    boolean useSsl();

    /**
     * Upgrade a plain {@code ldap://} connection with the StartTLS extended
     * operation before binding. Ignored when the connection is already SSL.
     */
    @WithName("start-tls")
    @WithDefault("false")
    boolean startTls();

    /**
     * Accept any server certificate and host name on SSL and StartTLS connections.
     */
    @WithName("skip-tls-verification")
    @WithDefault("false")
    boolean skipTlsVerification();

    /**
     * Base DN searched for user entries.
     */
    @WithName("user-base")
    String userBase();

    /**
     * Base DN searched for group entries.
     */
    @WithName("group-base")
    String groupBase();

    /**
     * Users whose entry lies under this DN are administrators.
     */
    @WithName("admin-user-base")
    Optional<String> adminUserBase();

    /**
     * Members of any group under this DN are administrators.
     */
    @WithName("admin-group-base")
    Optional<String> adminGroupBase();

    /**
     * DN of the service account used to look users up.
     */
    @WithName("bind-dn")
    String bindDn();

    @WithName("bind-password")
    String bindPassword();

    /**
     * Filter locating a user entry, {@code %s} is the escaped username.
     */
    @WithName("user-filter")
    @WithDefault("(cn=%s)")
    String userFilter();

    /**
     * Filter locating the groups of a user, {@code %s} is the escaped user DN.
     */
    @WithName("group-filter")
    @WithDefault("(member=%s)")
    String groupFilter();

    /**
     * Upper bound on a whole directory round trip (connect, binds and searches).
     *
     * <p>Split evenly over every network step of a lookup, so a stuck
     * directory releases the worker thread after roughly this long.
     */
    @WithDefault("PT10S")
    Duration timeout();
}
