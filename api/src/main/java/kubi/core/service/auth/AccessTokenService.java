package kubi.core.service.auth;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import kubi.core.config.DirectoryConfig;
import kubi.core.model.auth.AuthFailure;
import kubi.core.model.auth.Credentials;
import kubi.core.model.auth.DirectoryIdentity;
import kubi.core.model.auth.IssuedToken;
import kubi.core.model.auth.KubiAuthenticationException;
import kubi.core.port.out.DirectoryAuthenticator;

/**
 * Issues a token for a username/password pair.
 *
 * <p>Every call authenticates against the directory and resolves groups from
 * scratch; nothing is cached between requests. The directory round trip runs
 * on a worker thread and is bounded by {@code kubi.ldap.timeout}: a slow or
 * unreachable directory fails the request with {@code DIRECTORY_UNAVAILABLE}
 * instead of holding it.
 *
 * <p>Failing the {@link Uni} does not interrupt the blocking directory call.
 * The directory adapter keeps each of its network steps within a share of
 * the same timeout, which is what frees the worker thread.
 */
@ApplicationScoped
public class AccessTokenService {

    private static final Logger LOG = Logger.getLogger(AccessTokenService.class);

    private final DirectoryAuthenticator directory;
    private final TokenIssuer tokenIssuer;
    private final Duration directoryTimeout;
    private final Executor directoryExecutor;

    @Inject
    public AccessTokenService(DirectoryAuthenticator directory, TokenIssuer tokenIssuer, DirectoryConfig config) {
        this(directory, tokenIssuer, config.timeout(), Infrastructure.getDefaultWorkerPool());
    }

    AccessTokenService(
            DirectoryAuthenticator directory,
            TokenIssuer tokenIssuer,
            Duration directoryTimeout,
            Executor directoryExecutor) {
        this.directory = directory;
        this.tokenIssuer = tokenIssuer;
        this.directoryTimeout = directoryTimeout;
        this.directoryExecutor = directoryExecutor;
    }

    /**
     * Authenticate the credentials and issue a token.
     *
     * @param credentials the decoded Basic credentials
     * @return Uni with the issued token, failing with {@link KubiAuthenticationException}
     *         when the directory rejects the user or cannot be reached in time
     */
    public Uni<IssuedToken> issue(Credentials credentials) {
        return Uni.createFrom()
                .item(() -> lookup(credentials))
                .runSubscriptionOn(directoryExecutor)
                .ifNoItem()
                .after(directoryTimeout)
                .failWith(() -> {
                    LOG.warnv(
                            "Directory did not answer within {0} for {1}", directoryTimeout, credentials.username());
                    return new KubiAuthenticationException(AuthFailure.DIRECTORY_UNAVAILABLE);
                })
                .map(lookup -> tokenIssuer.issue(lookup.identity().username(), lookup.groups(), lookup.admin()));
    }

    private DirectoryLookup lookup(Credentials credentials) {
        final var identity = directory.authenticate(credentials.username(), credentials.password());
        final var groups = directory.resolveGroups(identity);
        final var admin = directory.isAdmin(identity);
        LOG.debugv("Directory resolved {0} groups for {1} (admin: {2})", groups.size(), identity.username(), admin);
        return new DirectoryLookup(identity, groups, admin);
    }

    private record DirectoryLookup(DirectoryIdentity identity, List<String> groups, boolean admin) {}
}
