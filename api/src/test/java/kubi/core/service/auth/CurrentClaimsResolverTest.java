package kubi.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import kubi.core.model.auth.AuthFailure;
import kubi.core.model.auth.AuthOutcome;
import kubi.core.model.auth.TokenClaims;
import kubi.core.port.out.TokenVerifier;

@DisplayName("CurrentClaimsResolver")
class CurrentClaimsResolverTest {

    private TokenVerifier tokenVerifier;
    private CurrentClaimsResolver resolver;

    @BeforeEach
    void setUp() {
        tokenVerifier = mock(TokenVerifier.class);
        resolver = new CurrentClaimsResolver(new BearerTokenExtractor(), tokenVerifier);
    }

    @Test
    @DisplayName("should verify the bearer token and return its claims")
    void shouldReturnVerifiedClaims() {
        final var claims = TokenClaims.builder()
                .subject("alice")
                .issuedAt(Instant.parse("2026-01-15T10:00:00Z"))
                .expiresAt(Instant.parse("2026-01-15T14:00:00Z"))
                .build();
        when(tokenVerifier.verify("abc.def.ghi")).thenReturn(AuthOutcome.success(claims));

        final var outcome = resolver.currentClaims("Bearer abc.def.ghi");

        assertSame(claims, outcome.orElseThrow());
    }

    @Test
    @DisplayName("should reject a wrong scheme without calling the verifier")
    void shouldRejectWrongScheme() {
        final var outcome = resolver.currentClaims("Token abc");

        final var failure = assertInstanceOf(AuthOutcome.Failure.class, outcome);
        assertEquals(AuthFailure.MISSING_OR_MALFORMED_BEARER, failure.reason());
        verify(tokenVerifier, never()).verify(anyString());
    }

    @Test
    @DisplayName("should pass on the verifier's rejection reason")
    void shouldPassOnVerifierFailure() {
        when(tokenVerifier.verify("expired")).thenReturn(AuthOutcome.failure(AuthFailure.TOKEN_EXPIRED));

        final var outcome = resolver.currentClaims("Bearer expired");

        final var failure = assertInstanceOf(AuthOutcome.Failure.class, outcome);
        assertEquals(AuthFailure.TOKEN_EXPIRED, failure.reason());
    }
}
