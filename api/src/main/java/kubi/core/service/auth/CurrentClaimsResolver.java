package kubi.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import kubi.core.model.auth.AuthOutcome;
import kubi.core.model.auth.TokenClaims;
import kubi.core.port.out.TokenVerifier;

/**
 * Resolves the claims of the caller of a protected endpoint from its bearer token.
 */
@ApplicationScoped
public class CurrentClaimsResolver {

    private static final Logger LOG = Logger.getLogger(CurrentClaimsResolver.class);

    private final BearerTokenExtractor bearerTokenExtractor;
    private final TokenVerifier tokenVerifier;

    @Inject
    public CurrentClaimsResolver(BearerTokenExtractor bearerTokenExtractor, TokenVerifier tokenVerifier) {
        this.bearerTokenExtractor = bearerTokenExtractor;
        this.tokenVerifier = tokenVerifier;
    }

    /**
     * Extract the bearer token from the header and verify it.
     *
     * @param authorizationHeader the raw Authorization header, may be null
     * @return the verified claims, or the first failure encountered
     */
    public AuthOutcome<TokenClaims> currentClaims(String authorizationHeader) {
        final var outcome = bearerTokenExtractor.extract(authorizationHeader).flatMap(tokenVerifier::verify);
        if (outcome instanceof AuthOutcome.Failure<TokenClaims> failure) {
            LOG.infov("Bearer authentication rejected: {0}", failure.reason());
        }
        return outcome;
    }
}
