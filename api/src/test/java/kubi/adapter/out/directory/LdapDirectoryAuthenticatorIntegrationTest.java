package kubi.adapter.out.directory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import javax.net.ssl.SSLServerSocketFactory;
import javax.net.ssl.SSLSocketFactory;

import com.unboundid.ldap.listener.InMemoryDirectoryServer;
import com.unboundid.ldap.listener.InMemoryDirectoryServerConfig;
import com.unboundid.ldap.listener.InMemoryListenerConfig;
import com.unboundid.ldap.listener.SelfSignedCertificateGenerator;
import com.unboundid.util.ssl.KeyStoreKeyManager;
import com.unboundid.util.ssl.SSLUtil;
import com.unboundid.util.ssl.TrustAllTrustManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import kubi.core.config.DirectoryConfig;
import kubi.core.model.auth.AuthFailure;
import kubi.core.model.auth.DirectoryIdentity;
import kubi.core.model.auth.KubiAuthenticationException;

/**
 * Runs the LDAP adapter against an in-memory UnboundID directory server.
 *
 * <p>The fixture holds regular users under {@code ou=people}, an administrator
 * under {@code ou=admins,ou=people}, two entries sharing the same {@code cn},
 * namespace groups under {@code ou=groups} and an admin group under
 * {@code ou=admin-groups}.
 */
@DisplayName("LdapDirectoryAuthenticator against an in-memory directory")
class LdapDirectoryAuthenticatorIntegrationTest {

    private static final String BASE_DN = "dc=example,dc=org";
    private static final String SERVICE_DN = "cn=admin,dc=example,dc=org";
    private static final String SERVICE_PASSWORD = "service-secret";
    private static final String ALICE_DN = "cn=alice,ou=people,dc=example,dc=org";
    private static final String BOB_DN = "cn=bob,ou=people,dc=example,dc=org";
    private static final String CAROL_DN = "cn=carol,ou=admins,ou=people,dc=example,dc=org";

    private InMemoryDirectoryServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.shutDown(true);
        }
    }

    private InMemoryDirectoryServer startServer(InMemoryListenerConfig listener) throws Exception {
        final var serverConfig = new InMemoryDirectoryServerConfig(BASE_DN);
        serverConfig.addAdditionalBindCredentials(SERVICE_DN, SERVICE_PASSWORD);
        serverConfig.setListenerConfigs(listener);

        final var directory = new InMemoryDirectoryServer(serverConfig);
        seed(directory);
        directory.startListening();
        return directory;
    }

    private static void seed(InMemoryDirectoryServer directory) throws Exception {
        directory.add("dn: " + BASE_DN, "objectClass: top", "objectClass: domain", "dc: example");
        directory.add("dn: ou=people," + BASE_DN, "objectClass: top", "objectClass: organizationalUnit", "ou: people");
        directory.add("dn: ou=admins,ou=people," + BASE_DN, "objectClass: top", "objectClass: organizationalUnit",
                "ou: admins");
        directory.add("dn: ou=contractors,ou=people," + BASE_DN, "objectClass: top",
                "objectClass: organizationalUnit", "ou: contractors");
        directory.add("dn: ou=groups," + BASE_DN, "objectClass: top", "objectClass: organizationalUnit", "ou: groups");
        directory.add("dn: ou=admin-groups," + BASE_DN, "objectClass: top", "objectClass: organizationalUnit",
                "ou: admin-groups");

        addUser(directory, ALICE_DN, "alice", "wonderland");
        addUser(directory, BOB_DN, "bob", "builder");
        addUser(directory, CAROL_DN, "carol", "singer");
        addUser(directory, "cn=dup,ou=people," + BASE_DN, "dup", "twin");
        addUser(directory, "cn=dup,ou=contractors,ou=people," + BASE_DN, "dup", "twin");

        addGroup(directory, "cn=DL_KUB_NS-DEV_WRITE,ou=groups," + BASE_DN, "DL_KUB_NS-DEV_WRITE", ALICE_DN);
        addGroup(directory, "cn=DL_KUB_NS-QA_READ,ou=groups," + BASE_DN, "DL_KUB_NS-QA_READ", ALICE_DN, BOB_DN);
        addGroup(directory, "cn=kube-admins,ou=admin-groups," + BASE_DN, "kube-admins", BOB_DN);
    }

    private static void addUser(InMemoryDirectoryServer directory, String dn, String cn, String password)
            throws Exception {
        directory.add("dn: " + dn, "objectClass: top", "objectClass: person", "objectClass: organizationalPerson",
                "objectClass: inetOrgPerson", "cn: " + cn, "sn: " + cn, "userPassword: " + password);
    }

    private static void addGroup(InMemoryDirectoryServer directory, String dn, String cn, String... members)
            throws Exception {
        final var lines = new String[4 + members.length];
        lines[0] = "dn: " + dn;
        lines[1] = "objectClass: top";
        lines[2] = "objectClass: groupOfNames";
        lines[3] = "cn: " + cn;
        for (int i = 0; i < members.length; i++) {
            lines[4 + i] = "member: " + members[i];
        }
        directory.add(lines);
    }

    private static DirectoryConfig config(int port) {
        final var config = mock(DirectoryConfig.class);
        when(config.host()).thenReturn("localhost");
        when(config.port()).thenReturn(port);
        when(config.useSsl()).thenReturn(false);
        when(config.startTls()).thenReturn(false);
        when(config.skipTlsVerification()).thenReturn(false);
        when(config.userBase()).thenReturn("ou=people," + BASE_DN);
        when(config.groupBase()).thenReturn("ou=groups," + BASE_DN);
        when(config.adminUserBase()).thenReturn(Optional.of("ou=admins,ou=people," + BASE_DN));
        when(config.adminGroupBase()).thenReturn(Optional.of("ou=admin-groups," + BASE_DN));
        when(config.bindDn()).thenReturn(SERVICE_DN);
        when(config.bindPassword()).thenReturn(SERVICE_PASSWORD);
        when(config.userFilter()).thenReturn("(cn=%s)");
        when(config.groupFilter()).thenReturn("(member=%s)");
        when(config.timeout()).thenReturn(Duration.ofSeconds(30));
        return config;
    }

    private static AuthFailure failureOf(LdapDirectoryAuthenticator authenticator, String username,
            String password) {
        return assertThrows(KubiAuthenticationException.class, () -> authenticator.authenticate(username, password))
                .reason();
    }

    @Nested
    @DisplayName("over plain LDAP")
    class PlainLdap {

        private DirectoryConfig config;
        private LdapDirectoryAuthenticator authenticator;

        @BeforeEach
        void setUp() throws Exception {
            server = startServer(InMemoryListenerConfig.createLDAPConfig("ldap", 0));
            config = config(server.getListenPort());
            authenticator = new LdapDirectoryAuthenticator(config);
        }

        @Test
        @DisplayName("should bind as the single matching entry")
        void shouldAuthenticateUniqueUser() {
            final var identity = authenticator.authenticate("alice", "wonderland");

            assertEquals("alice", identity.username());
            assertEquals(ALICE_DN, identity.distinguishedName());
        }

        @Test
        @DisplayName("should reject a wrong user password")
        void shouldRejectWrongPassword() {
            assertEquals(AuthFailure.AUTHENTICATION_FAILED, failureOf(authenticator, "alice", "looking-glass"));
        }

        @Test
        @DisplayName("should reject a user with no matching entry")
        void shouldRejectUnknownUser() {
            assertEquals(AuthFailure.AUTHENTICATION_FAILED, failureOf(authenticator, "mallory", "wonderland"));
        }

        @Test
        @DisplayName("should refuse to pick between two matching entries")
        void shouldRejectAmbiguousUser() {
            assertEquals(AuthFailure.AUTHENTICATION_FAILED, failureOf(authenticator, "dup", "twin"));
        }

        @Test
        @DisplayName("should escape filter metacharacters in the username")
        void shouldEscapeUsernameInFilter() {
            assertEquals(AuthFailure.AUTHENTICATION_FAILED, failureOf(authenticator, "*", "wonderland"));
            assertEquals(AuthFailure.AUTHENTICATION_FAILED, failureOf(authenticator, "al*", "wonderland"));
        }

        @Test
        @DisplayName("should resolve the cn of every group listing the user")
        void shouldResolveGroupNames() {
            final var alice = new DirectoryIdentity("alice", ALICE_DN);
            final var bob = new DirectoryIdentity("bob", BOB_DN);
            final var carol = new DirectoryIdentity("carol", CAROL_DN);

            assertEquals(Set.of("DL_KUB_NS-DEV_WRITE", "DL_KUB_NS-QA_READ"),
                    new HashSet<>(authenticator.resolveGroups(alice)));
            assertEquals(List.of("DL_KUB_NS-QA_READ"), authenticator.resolveGroups(bob));
            assertTrue(authenticator.resolveGroups(carol).isEmpty());
        }

        @Test
        @DisplayName("should grant admin through the admin group or the admin user base")
        void shouldResolveAdminMembership() {
            assertTrue(authenticator.isAdmin(new DirectoryIdentity("bob", BOB_DN)));
            assertTrue(authenticator.isAdmin(new DirectoryIdentity("carol", CAROL_DN)));
            assertFalse(authenticator.isAdmin(new DirectoryIdentity("alice", ALICE_DN)));
        }

        @Test
        @DisplayName("should report the directory unavailable when the service bind is rejected")
        void shouldFailOnRejectedServiceBind() {
            when(config.bindPassword()).thenReturn("not-the-secret");
            final var misconfigured = new LdapDirectoryAuthenticator(config);

            assertEquals(AuthFailure.DIRECTORY_UNAVAILABLE, failureOf(misconfigured, "alice", "wonderland"));
            assertThrows(KubiAuthenticationException.class,
                    () -> misconfigured.resolveGroups(new DirectoryIdentity("alice", ALICE_DN)));
        }

        @Test
        @DisplayName("should report the directory unavailable when the server is down")
        void shouldFailWhenServerIsDown() {
            server.shutDown(true);

            assertEquals(AuthFailure.DIRECTORY_UNAVAILABLE, failureOf(authenticator, "alice", "wonderland"));
        }
    }

    @Nested
    @DisplayName("over TLS")
    class Tls {

        private SSLUtil serverSsl;

        @BeforeEach
        void setUp() throws Exception {
            final var keyStore =
                    SelfSignedCertificateGenerator.generateTemporarySelfSignedCertificate("kubi-test", "JKS");
            serverSsl = new SSLUtil(
                    new KeyStoreKeyManager(keyStore.getFirst(), keyStore.getSecond(), "JKS", null),
                    new TrustAllTrustManager());
        }

        private DirectoryConfig startTlsConfig(boolean skipVerification) throws Exception {
            final SSLSocketFactory startTlsFactory = serverSsl.createSSLSocketFactory();
            server = startServer(InMemoryListenerConfig.createLDAPConfig("ldap", null, 0, startTlsFactory));
            final var config = config(server.getListenPort());
            when(config.startTls()).thenReturn(true);
            when(config.skipTlsVerification()).thenReturn(skipVerification);
            return config;
        }

        private DirectoryConfig ldapsConfig(boolean skipVerification) throws Exception {
            final SSLServerSocketFactory serverSocketFactory = serverSsl.createSSLServerSocketFactory();
            server = startServer(InMemoryListenerConfig.createLDAPSConfig("ldaps", null, 0, serverSocketFactory,
                    serverSsl.createSSLSocketFactory()));
            final var config = config(server.getListenPort());
            when(config.useSsl()).thenReturn(true);
            when(config.skipTlsVerification()).thenReturn(skipVerification);
            return config;
        }

        @Test
        @DisplayName("should upgrade with StartTLS before binding")
        void shouldAuthenticateAfterStartTls() throws Exception {
            final var authenticator = new LdapDirectoryAuthenticator(startTlsConfig(true));

            assertEquals(ALICE_DN, authenticator.authenticate("alice", "wonderland").distinguishedName());
            assertEquals(AuthFailure.AUTHENTICATION_FAILED, failureOf(authenticator, "alice", "looking-glass"));
        }

        @Test
        @DisplayName("should refuse an untrusted certificate during StartTLS")
        void shouldRejectUntrustedStartTlsCertificate() throws Exception {
            final var authenticator = new LdapDirectoryAuthenticator(startTlsConfig(false));

            assertEquals(AuthFailure.DIRECTORY_UNAVAILABLE, failureOf(authenticator, "alice", "wonderland"));
        }

        @Test
        @DisplayName("should authenticate over ldaps when verification is skipped")
        void shouldAuthenticateOverLdaps() throws Exception {
            final var authenticator = new LdapDirectoryAuthenticator(ldapsConfig(true));

            assertEquals(ALICE_DN, authenticator.authenticate("alice", "wonderland").distinguishedName());
            assertTrue(authenticator.isAdmin(new DirectoryIdentity("bob", BOB_DN)));
        }

        @Test
        @DisplayName("should refuse an untrusted certificate over ldaps")
        void shouldRejectUntrustedLdapsCertificate() throws Exception {
            final var authenticator = new LdapDirectoryAuthenticator(ldapsConfig(false));

            assertEquals(AuthFailure.DIRECTORY_UNAVAILABLE, failureOf(authenticator, "alice", "wonderland"));
        }
    }
}
