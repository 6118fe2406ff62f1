package kubi.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;

import kubi.core.model.auth.AuthFailure;
import kubi.core.model.auth.AuthOutcome;

/**
 * Pulls a bearer token out of an Authorization header.
 */
@ApplicationScoped
public class BearerTokenExtractor {

    static final String BEARER_PREFIX = "Bearer ";

    /**
     * @param authorizationHeader the raw header value, may be null
     * @return the token, or a {@code MISSING_OR_MALFORMED_BEARER} failure
     */
    public AuthOutcome<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return AuthOutcome.failure(AuthFailure.MISSING_OR_MALFORMED_BEARER);
        }
        final var token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            return AuthOutcome.failure(AuthFailure.MISSING_OR_MALFORMED_BEARER);
        }
        return AuthOutcome.success(token);
    }
}
