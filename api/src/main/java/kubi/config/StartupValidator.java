package kubi.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import kubi.core.model.auth.SigningUnavailableException;
import kubi.core.model.common.ServiceContext;
import kubi.core.port.out.TokenSigner;

/**
 * Resolves the service context and signer before the HTTP server accepts traffic.
 *
 * <p>Both are lazily created beans. Touching them here moves every
 * configuration error to startup, where it aborts the process.
 */
@ApplicationScoped
public class StartupValidator {

    private static final Logger LOG = Logger.getLogger(StartupValidator.class);

    private final Instance<ServiceContext> context;
    private final Instance<TokenSigner> signer;

    @Inject
    public StartupValidator(Instance<ServiceContext> context, Instance<TokenSigner> signer) {
        this.context = context;
        this.signer = signer;
    }

    void onStart(@Observes StartupEvent event) {
        try {
            final var resolved = context.get();
            if (!signer.get().isAvailable()) {
                throw new SigningUnavailableException("Token signer has no usable key");
            }
            LOG.infov("Startup configuration valid, issuing tokens for cluster {0}", resolved.clusterName());
        } catch (RuntimeException e) {
            LOG.errorv("Refusing to start: {0}", e.getMessage());
            throw e;
        }
    }
}
