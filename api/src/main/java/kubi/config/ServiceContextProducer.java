package kubi.config;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import kubi.core.config.ClusterConfig;
import kubi.core.config.TokenConfig;
import kubi.core.model.auth.SigningKey;
import kubi.core.model.common.ConfigurationInvalidException;
import kubi.core.model.common.ServiceContext;
import kubi.core.model.common.TokenLifetime;

/**
 * Builds the single {@link ServiceContext} from configuration.
 *
 * <p>This is the only place configuration is turned into runtime values.
 * Anything missing or malformed raises {@link ConfigurationInvalidException},
 * which {@link StartupValidator} turns into a failed startup.
 */
@ApplicationScoped
public class ServiceContextProducer {

    private static final Logger LOG = Logger.getLogger(ServiceContextProducer.class);

    @Produces
    @Singleton
    ServiceContext serviceContext(TokenConfig tokenConfig, ClusterConfig clusterConfig) {
        return build(tokenConfig, clusterConfig);
    }

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }

    static ServiceContext build(TokenConfig tokenConfig, ClusterConfig clusterConfig) {
        final var signingKey = loadSigningKey(tokenConfig);
        final var lifetime = parseLifetime(tokenConfig.lifetime());
        final var endpoint = validateEndpoint(clusterConfig.apiServerUrl());
        final var caData = loadCaData(clusterConfig);

        final var context = new ServiceContext(signingKey, lifetime, clusterConfig.name(), endpoint, caData);
        LOG.infov("Service context ready: cluster {0} at {1}, token lifetime {2}", context.clusterName(), endpoint,
                lifetime);
        return context;
    }

    static SigningKey loadSigningKey(TokenConfig config) {
        final byte[] secret;
        if (config.signingKey().filter(k -> !k.isBlank()).isPresent()) {
            try {
                secret = Base64.getDecoder().decode(config.signingKey().get().trim());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationInvalidException("kubi.token.signing-key is not valid base64", e);
            }
        } else if (config.signingKeyFile().filter(f -> !f.isBlank()).isPresent()) {
            final var path = Path.of(config.signingKeyFile().get());
            try {
                secret = Files.readAllBytes(path);
            } catch (IOException e) {
                throw new ConfigurationInvalidException("Cannot read signing key file " + path, e);
            }
        } else {
            throw new ConfigurationInvalidException(
                    "No signing key configured: set kubi.token.signing-key or kubi.token.signing-key-file");
        }

        try {
            return SigningKey.of(secret);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationInvalidException(e.getMessage(), e);
        }
    }

    static Duration parseLifetime(String lifetime) {
        try {
            return TokenLifetime.parse(lifetime);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationInvalidException("kubi.token.lifetime: " + e.getMessage(), e);
        }
    }

    static String validateEndpoint(String apiServerUrl) {
        if (apiServerUrl == null || apiServerUrl.isBlank()) {
            throw new ConfigurationInvalidException("kubi.cluster.api-server-url is required");
        }
        try {
            final var uri = new URI(apiServerUrl.trim());
            if (!"https".equalsIgnoreCase(uri.getScheme()) && !"http".equalsIgnoreCase(uri.getScheme())) {
                throw new ConfigurationInvalidException("kubi.cluster.api-server-url must be an http(s) URL");
            }
            if (uri.getHost() == null) {
                throw new ConfigurationInvalidException("kubi.cluster.api-server-url has no host");
            }
            return uri.toString();
        } catch (URISyntaxException e) {
            throw new ConfigurationInvalidException("kubi.cluster.api-server-url is not a valid URL", e);
        }
    }

    static String loadCaData(ClusterConfig config) {
        final byte[] pem;
        if (config.caData().filter(d -> !d.isBlank()).isPresent()) {
            try {
                pem = Base64.getDecoder().decode(config.caData().get().trim());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationInvalidException("kubi.cluster.ca-data is not valid base64", e);
            }
        } else if (config.caFile().filter(f -> !f.isBlank()).isPresent()) {
            final var path = Path.of(config.caFile().get());
            try {
                pem = Files.readAllBytes(path);
            } catch (IOException e) {
                throw new ConfigurationInvalidException("Cannot read CA file " + path, e);
            }
        } else {
            throw new ConfigurationInvalidException("No cluster CA configured: set kubi.cluster.ca-data or ca-file");
        }

        try {
            CertificateFactory.getInstance("X.509").generateCertificate(new ByteArrayInputStream(pem));
        } catch (CertificateException e) {
            throw new ConfigurationInvalidException("Cluster CA is not an X.509 certificate", e);
        }
        return Base64.getEncoder().encodeToString(pem);
    }
}
