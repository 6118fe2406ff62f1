package kubi.core.service.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import kubi.core.model.auth.AuthFailure;
import kubi.core.model.auth.AuthOutcome;
import kubi.core.model.auth.Credentials;

/**
 * Decodes HTTP Basic credentials from an Authorization header.
 *
 * <p>Every malformed header yields the same {@code INVALID_CREDENTIALS_FORMAT}
 * failure, whatever part of it was wrong.
 */
@ApplicationScoped
public class CredentialExtractor {

    private static final Logger LOG = Logger.getLogger(CredentialExtractor.class);

    static final String BASIC_PREFIX = "Basic ";

    /**
     * Extract the username/password pair.
     *
     * @param authorizationHeader the raw header value, may be null
     * @return the credentials, or an {@code INVALID_CREDENTIALS_FORMAT} failure
     */
    public AuthOutcome<Credentials> extract(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BASIC_PREFIX)) {
            LOG.debug("Authorization header missing or not Basic");
            return AuthOutcome.failure(AuthFailure.INVALID_CREDENTIALS_FORMAT);
        }

        final String decoded;
        try {
            final var raw = Base64.getDecoder().decode(authorizationHeader.substring(BASIC_PREFIX.length()));
            decoded = new String(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            LOG.debug("Basic credentials are not valid base64");
            return AuthOutcome.failure(AuthFailure.INVALID_CREDENTIALS_FORMAT);
        }

        // Passwords may contain colons, usernames may not
        final int separator = decoded.indexOf(':');
        if (separator <= 0) {
            LOG.debug("Basic credentials have no username:password separator");
            return AuthOutcome.failure(AuthFailure.INVALID_CREDENTIALS_FORMAT);
        }

        final var username = decoded.substring(0, separator);
        if (username.isBlank()) {
            LOG.debug("Basic credentials have a blank username");
            return AuthOutcome.failure(AuthFailure.INVALID_CREDENTIALS_FORMAT);
        }

        return AuthOutcome.success(new Credentials(username, decoded.substring(separator + 1)));
    }
}
