package kubi.core.model.auth;

/**
 * A freshly signed token together with the claims it carries.
 *
 * @param token  the JWS compact serialization
 * @param claims the claims that were signed
 */
public record IssuedToken(String token, TokenClaims claims) {
    public IssuedToken {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Token cannot be null or blank");
        }
        if (claims == null) {
            throw new IllegalArgumentException("Claims cannot be null");
        }
    }
}
