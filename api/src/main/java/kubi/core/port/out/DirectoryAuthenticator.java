package kubi.core.port.out;

import java.util.List;

import kubi.core.model.auth.DirectoryIdentity;

/**
 * Port for the directory service that owns user identities and groups.
 *
 * <p>Calls block on network I/O. Callers are expected to run them off the
 * event loop and bound them with a timeout. Implementations do not retry.
 *
 * <p>Failures are reported by throwing
 * {@link kubi.core.model.auth.KubiAuthenticationException} with
 * {@code AUTHENTICATION_FAILED} for rejected credentials and
 * {@code DIRECTORY_UNAVAILABLE} when the directory cannot be reached.
 */
public interface DirectoryAuthenticator {

    /**
     * Check a username/password pair against the directory.
     *
     * @param username the login name
     * @param password the cleartext password
     * @return a handle to the authenticated identity
     */
    DirectoryIdentity authenticate(String username, String password);

    /**
     * Resolve the groups the identity belongs to.
     *
     * @param identity a handle returned by {@link #authenticate(String, String)}
     * @return group names, possibly empty
     */
    List<String> resolveGroups(DirectoryIdentity identity);

    /**
     * Whether the identity has cluster administration access.
     *
     * @param identity a handle returned by {@link #authenticate(String, String)}
     * @return true for administrators
     */
    boolean isAdmin(DirectoryIdentity identity);
}
