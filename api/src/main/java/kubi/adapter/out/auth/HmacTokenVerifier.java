package kubi.adapter.out.auth;

import java.time.Clock;
import java.util.Base64;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;

import kubi.core.model.auth.AuthFailure;
import kubi.core.model.auth.AuthOutcome;
import kubi.core.model.auth.SigningKey;
import kubi.core.model.auth.TokenClaims;
import kubi.core.model.common.ServiceContext;
import kubi.core.port.out.TokenVerifier;

/**
 * Verifies HS512 tokens signed with the process-wide {@link SigningKey}.
 *
 * <p>The signature is checked before any claim. Only HS512 is accepted, and
 * the signature segment must be canonical base64url: jose4j ignores the
 * unused low bits of the last character, so a token differing only there is
 * rejected before jose4j sees it.
 *
 * <p>A token is expired once the injected clock is strictly past {@code exp}.
 * jose4j rejects at {@code exp} itself and works in whole seconds, so it is
 * given one second of skew and the exact comparison is made here.
 */
@ApplicationScoped
public class HmacTokenVerifier implements TokenVerifier {

    private static final Logger LOG = Logger.getLogger(HmacTokenVerifier.class);

    private static final int EXPIRY_SKEW_SECONDS = 1;

    private final HmacKey key;
    private final Clock clock;

    @Inject
    public HmacTokenVerifier(ServiceContext context, Clock clock) {
        this(context.signingKey(), clock);
    }

    HmacTokenVerifier(SigningKey signingKey, Clock clock) {
        this.key = new HmacKey(signingKey.bytes());
        this.clock = clock;
    }

    @Override
    public AuthOutcome<TokenClaims> verify(String token) {
        if (token == null || token.isBlank()) {
            return AuthOutcome.failure(AuthFailure.MALFORMED_TOKEN);
        }

        final var compact = token.trim();
        final var encodingProblem = checkSignatureEncoding(compact);
        if (encodingProblem.isPresent()) {
            LOG.debugv("Token rejected ({0}): signature segment is not canonical base64url", encodingProblem.get());
            return AuthOutcome.failure(encodingProblem.get());
        }

        try {
            final var claims = JwtClaimsMapper.fromJwtClaims(consumer().processToClaims(compact));
            if (clock.instant().isAfter(claims.expiresAt())) {
                LOG.debugv("Token rejected (TOKEN_EXPIRED): expired at {0}", claims.expiresAt());
                return AuthOutcome.failure(AuthFailure.TOKEN_EXPIRED);
            }
            return AuthOutcome.success(claims);
        } catch (InvalidJwtException e) {
            final var reason = classify(e);
            LOG.debugv("Token rejected ({0}): {1}", reason, e.getMessage());
            return AuthOutcome.failure(reason);
        } catch (MalformedClaimException e) {
            LOG.debugv("Token claims malformed: {0}", e.getMessage());
            return AuthOutcome.failure(AuthFailure.MALFORMED_TOKEN);
        } catch (RuntimeException e) {
            // jose4j can surface odd input as unchecked exceptions
            LOG.debugv("Token could not be parsed: {0}", e.toString());
            return AuthOutcome.failure(AuthFailure.MALFORMED_TOKEN);
        }
    }

    private JwtConsumer consumer() {
        return new JwtConsumerBuilder()
                .setVerificationKey(key)
                .setJwsAlgorithmConstraints(
                        AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA512)
                .setRequireExpirationTime()
                .setExpectedIssuer(TokenClaims.ISSUER)
                .setAllowedClockSkewInSeconds(EXPIRY_SKEW_SECONDS)
                .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()))
                .build();
    }

    /**
     * Check that the signature segment is the canonical base64url encoding of its bytes.
     *
     * <p>Tokens without exactly three segments pass through to jose4j, which
     * reports them as malformed.
     *
     * @return {@code MALFORMED_TOKEN} if the segment does not decode,
     *         {@code INVALID_SIGNATURE} if it decodes but re-encodes differently
     */
    static Optional<AuthFailure> checkSignatureEncoding(String compact) {
        final var parts = compact.split("\\.", -1);
        if (parts.length != 3) {
            return Optional.empty();
        }
        final byte[] signature;
        try {
            signature = Base64.getUrlDecoder().decode(parts[2]);
        } catch (IllegalArgumentException e) {
            return Optional.of(AuthFailure.MALFORMED_TOKEN);
        }
        if (!Base64.getUrlEncoder().withoutPadding().encodeToString(signature).equals(parts[2])) {
            return Optional.of(AuthFailure.INVALID_SIGNATURE);
        }
        return Optional.empty();
    }

    private static AuthFailure classify(InvalidJwtException e) {
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
            return AuthFailure.INVALID_SIGNATURE;
        }
        if (e.hasExpired()) {
            return AuthFailure.TOKEN_EXPIRED;
        }
        return AuthFailure.MALFORMED_TOKEN;
    }
}
