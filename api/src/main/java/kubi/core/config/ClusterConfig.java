package kubi.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration describing the Kubernetes cluster written into kubeconfigs.
 *
 * <p>Configuration prefix: {@code kubi.cluster}
 */
@ConfigMapping(prefix = "kubi.cluster")
public interface ClusterConfig {

    /**
     * Name of the cluster entry, also the prefix of the context name.
     */
    @WithDefault("kubernetes")
    String name();

    /**
     * API server URL, e.g. {@code https://10.0.0.1:6443}.
     */
    @WithName("api-server-url")
    String apiServerUrl();

    /**
     * Base64-encoded PEM of the cluster CA certificate.
     */
    @WithName("ca-data")
    Optional<String> caData();

    /**
     * Path of the PEM cluster CA certificate, used when {@link #caData()} is absent.
     */
    @WithName("ca-file")
    Optional<String> caFile();
}
