package kubi.adapter.out.auth;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import kubi.core.model.auth.SigningKey;
import kubi.core.model.auth.SigningUnavailableException;
import kubi.core.model.auth.TokenClaims;
import kubi.mock.TestKeys;

@DisplayName("HmacTokenSigner")
class HmacTokenSignerTest {

    private static TokenClaims claimsExpiringAt(Instant expiresAt) {
        return TokenClaims.builder()
                .subject("bob")
                .issuedAt(expiresAt.minusSeconds(60))
                .expiresAt(expiresAt)
                .build();
    }

    @Test
    @DisplayName("should be available with a key")
    void shouldBeAvailableWithKey() {
        assertTrue(new HmacTokenSigner(TestKeys.randomKey()).isAvailable());
    }

    @Test
    @DisplayName("should refuse to sign without a key")
    void shouldRefuseToSignWithoutKey() {
        final var signer = new HmacTokenSigner((SigningKey) null);

        assertFalse(signer.isAvailable());
        assertThrows(
                SigningUnavailableException.class,
                () -> signer.sign(claimsExpiringAt(Instant.parse("2026-01-15T10:00:00Z"))));
    }

    @Test
    @DisplayName("should sign different expiries into different tokens")
    void shouldSignDifferentExpiriesDifferently() {
        final var signer = new HmacTokenSigner(TestKeys.randomKey());
        final var first = Instant.parse("2026-01-15T10:00:00Z");

        assertNotEquals(
                signer.sign(claimsExpiringAt(first)), signer.sign(claimsExpiringAt(first.plusSeconds(1))));
    }
}
