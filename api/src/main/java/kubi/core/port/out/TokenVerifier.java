package kubi.core.port.out;

import kubi.core.model.auth.AuthOutcome;
import kubi.core.model.auth.TokenClaims;

/**
 * Port checking the integrity and expiry of a token.
 */
public interface TokenVerifier {

    /**
     * Verify a token.
     *
     * <p>Never throws for bad input: every rejection is an
     * {@link AuthOutcome.Failure} with {@code MALFORMED_TOKEN},
     * {@code INVALID_SIGNATURE} or {@code TOKEN_EXPIRED}.
     *
     * @param token the compact serialization
     * @return the embedded claims, unchanged, or the rejection reason
     */
    AuthOutcome<TokenClaims> verify(String token);
}
