package kubi.core.model.common;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

import kubi.core.model.auth.SigningKey;

/**
 * Everything the issuance and verification paths need, resolved once at startup.
 *
 * <p>Immutable and shared by every request. Components receive it by
 * injection and never re-read configuration themselves.
 *
 * @param signingKey      the process-wide HMAC secret
 * @param tokenLifetime   how long issued tokens stay valid
 * @param clusterName     name of the cluster entry in kubeconfigs
 * @param clusterEndpoint API server URL written into kubeconfigs
 * @param caData          base64-encoded PEM of the cluster CA
 */
public record ServiceContext(
        SigningKey signingKey, Duration tokenLifetime, String clusterName, String clusterEndpoint, String caData) {

    public ServiceContext {
        if (signingKey == null) {
            throw new IllegalArgumentException("Signing key cannot be null");
        }
        if (tokenLifetime == null || tokenLifetime.isZero() || tokenLifetime.isNegative()) {
            throw new IllegalArgumentException("Token lifetime must be positive");
        }
        if (clusterName == null || clusterName.isBlank()) {
            throw new IllegalArgumentException("Cluster name cannot be null or blank");
        }
        if (clusterEndpoint == null || clusterEndpoint.isBlank()) {
            throw new IllegalArgumentException("Cluster endpoint cannot be null or blank");
        }
        if (caData == null || caData.isBlank()) {
            throw new IllegalArgumentException("CA data cannot be null or blank");
        }
    }

    /**
     * The cluster CA as PEM text.
     */
    public String caPem() {
        return new String(Base64.getDecoder().decode(caData), StandardCharsets.UTF_8);
    }
}
