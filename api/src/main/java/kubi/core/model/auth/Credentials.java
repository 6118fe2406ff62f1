package kubi.core.model.auth;

/**
 * Username and password decoded from an HTTP Basic header.
 *
 * <p>Transient: never stored, and {@link #toString()} masks the password.
 *
 * @param username the directory username
 * @param password the cleartext password
 */
public record Credentials(String username, String password) {
    public Credentials {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
        if (password == null) {
            password = "";
        }
    }

    @Override
    public String toString() {
        return "Credentials[username=" + username + ", password=****]";
    }
}
