package kubi.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for token issuance.
 *
 * <p>Configuration prefix: {@code kubi.token}
 *
 * <p>Exactly one source of signing key material is needed. When both are
 * set, the inline key wins.
 */
@ConfigMapping(prefix = "kubi.token")
public interface TokenConfig {

    /**
     * Lifetime of issued tokens.
     *
     * <p>Accepts Go-style durations ({@code 4h}, {@code 1h30m}, {@code 2s}) or
     * ISO-8601 ({@code PT4H}). Parsed once at startup.
     */
    @WithDefault("4h")
    String lifetime();

    /**
     * Base64-encoded HMAC secret, at least 64 bytes once decoded.
     */
    @WithName("signing-key")
    Optional<String> signingKey();

    /**
     * Path of a file whose raw bytes are the HMAC secret.
     */
    @WithName("signing-key-file")
    Optional<String> signingKeyFile();
}
