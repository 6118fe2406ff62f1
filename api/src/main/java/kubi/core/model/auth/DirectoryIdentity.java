package kubi.core.model.auth;

/**
 * Handle to an identity the directory has authenticated.
 *
 * @param username          the login name the user presented
 * @param distinguishedName the directory entry of the user
 */
public record DirectoryIdentity(String username, String distinguishedName) {
    public DirectoryIdentity {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
        if (distinguishedName == null || distinguishedName.isBlank()) {
            throw new IllegalArgumentException("Distinguished name cannot be null or blank");
        }
    }
}
