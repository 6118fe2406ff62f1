package kubi.core.service.auth;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import kubi.core.model.auth.IssuedToken;
import kubi.core.model.auth.SigningUnavailableException;
import kubi.core.model.auth.TokenClaims;
import kubi.core.model.common.ServiceContext;
import kubi.core.port.out.AuthorizationMapper;
import kubi.core.port.out.TokenSigner;

/**
 * Builds and signs the claims of an authenticated user.
 *
 * <p>Stateless: issuing twice for the same user gives two valid tokens that
 * differ in their expiry.
 */
@ApplicationScoped
public class TokenIssuer {

    private static final Logger LOG = Logger.getLogger(TokenIssuer.class);

    private final AuthorizationMapper authorizationMapper;
    private final TokenSigner tokenSigner;
    private final ServiceContext context;
    private final Clock clock;

    @Inject
    public TokenIssuer(
            AuthorizationMapper authorizationMapper, TokenSigner tokenSigner, ServiceContext context, Clock clock) {
        this.authorizationMapper = authorizationMapper;
        this.tokenSigner = tokenSigner;
        this.context = context;
        this.clock = clock;
    }

    /**
     * Issue a token.
     *
     * @param username the authenticated username
     * @param groups   the user's directory groups
     * @param admin    whether the user is a cluster administrator
     * @return the signed token and its claims
     * @throws SigningUnavailableException if the signer holds no usable key
     */
    public IssuedToken issue(String username, List<String> groups, boolean admin) {
        if (!tokenSigner.isAvailable()) {
            throw new SigningUnavailableException("No signing key loaded");
        }

        final var grants = authorizationMapper.map(groups == null ? List.of() : groups);
        // Token timestamps have second precision
        final var issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        final var claims = TokenClaims.builder()
                .authorizations(grants)
                .subject(username)
                .admin(admin)
                .issuer(TokenClaims.ISSUER)
                .issuedAt(issuedAt)
                .expiresAt(issuedAt.plus(context.tokenLifetime()))
                .build();

        final var token = tokenSigner.sign(claims);
        LOG.infov(
                "Issued token for {0} with {1} namespace grants (admin: {2}), expires {3}",
                username, grants.size(), admin, claims.expiresAt());
        return new IssuedToken(token, claims);
    }
}
