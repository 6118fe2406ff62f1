package kubi.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import kubi.adapter.in.dto.TokenClaimsResponse;
import kubi.adapter.in.problem.GlobalExceptionMappers;
import kubi.core.model.auth.AuthOutcome;
import kubi.core.model.auth.TokenClaims;
import kubi.core.model.common.ServiceContext;
import kubi.core.port.out.TokenVerifier;
import kubi.core.service.auth.AccessTokenService;
import kubi.core.service.auth.CredentialExtractor;
import kubi.core.service.auth.CurrentClaimsResolver;
import kubi.core.service.config.AccessConfigRenderer;

/**
 * REST resource issuing and checking Kubi tokens.
 *
 * <ul>
 * <li>{@code GET /token}: Basic credentials in, raw token out</li>
 * <li>{@code GET /config}: Basic credentials in, kubeconfig out</li>
 * <li>{@code POST /verify}: token in the body, claims out or 401</li>
 * <li>{@code GET /whoami}: Bearer token in, claims out or 401</li>
 * <li>{@code GET /ca}: the cluster CA certificate</li>
 * </ul>
 */
@Path("/")
@ApplicationScoped
public class KubiResource {

    private static final Logger LOG = Logger.getLogger(KubiResource.class);

    static final String YAML = "text/x-yaml";

    private final CredentialExtractor credentialExtractor;
    private final AccessTokenService accessTokenService;
    private final AccessConfigRenderer accessConfigRenderer;
    private final TokenVerifier tokenVerifier;
    private final CurrentClaimsResolver currentClaimsResolver;
    private final ServiceContext context;

    @Inject
    public KubiResource(
            CredentialExtractor credentialExtractor,
            AccessTokenService accessTokenService,
            AccessConfigRenderer accessConfigRenderer,
            TokenVerifier tokenVerifier,
            CurrentClaimsResolver currentClaimsResolver,
            ServiceContext context) {
        this.credentialExtractor = credentialExtractor;
        this.accessTokenService = accessTokenService;
        this.accessConfigRenderer = accessConfigRenderer;
        this.tokenVerifier = tokenVerifier;
        this.currentClaimsResolver = currentClaimsResolver;
        this.context = context;
    }

    /**
     * Issue a raw token.
     *
     * @param authorization the {@code Basic} Authorization header
     * @return 200 with the compact token, 401 on bad credentials
     */
    @GET
    @Path("/token")
    @Produces(MediaType.TEXT_PLAIN)
    public Uni<Response> token(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        final var credentials = credentialExtractor.extract(authorization).orElseThrow();
        return accessTokenService
                .issue(credentials)
                .map(issued -> Response.ok(issued.token(), MediaType.TEXT_PLAIN).build());
    }

    /**
     * Issue a token wrapped in a kubeconfig usable by kubectl.
     *
     * @param authorization the {@code Basic} Authorization header
     * @return 201 with the YAML kubeconfig, 401 on bad credentials
     */
    @GET
    @Path("/config")
    @Produces(YAML)
    public Uni<Response> config(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        final var credentials = credentialExtractor.extract(authorization).orElseThrow();
        return accessTokenService.issue(credentials).map(issued -> {
            final var document = accessConfigRenderer.render(
                    credentials.username(), issued.token(), context.clusterEndpoint(), context.caData());
            return Response.status(Response.Status.CREATED)
                    .type(YAML)
                    .entity(accessConfigRenderer.toYaml(document))
                    .build();
        });
    }

    /**
     * Verify a token posted as the raw request body.
     *
     * @param token the compact token
     * @return 200 with the claims when valid, 401 otherwise
     */
    @POST
    @Path("/verify")
    @Consumes(MediaType.WILDCARD)
    @Produces(MediaType.APPLICATION_JSON)
    public Response verify(String token) {
        final var outcome = tokenVerifier.verify(token);
        if (outcome instanceof AuthOutcome.Success<TokenClaims> success) {
            final var claims = success.value();
            LOG.infov(
                    "Verified token of {0}: {1} grants, expires {2}",
                    claims.subject(), claims.authorizations().size(), claims.expiresAt());
            return Response.ok(TokenClaimsResponse.from(claims)).build();
        }
        final var reason = ((AuthOutcome.Failure<TokenClaims>) outcome).reason();
        LOG.infov("Token verification failed: {0}", reason);
        return GlobalExceptionMappers.unauthorized(reason);
    }

    /**
     * Describe the caller identified by its bearer token.
     *
     * @param authorization the {@code Bearer} Authorization header
     * @return 200 with the claims, 401 on any bearer failure
     */
    @GET
    @Path("/whoami")
    @Produces(MediaType.APPLICATION_JSON)
    public TokenClaimsResponse whoami(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        return TokenClaimsResponse.from(
                currentClaimsResolver.currentClaims(authorization).orElseThrow());
    }

    /**
     * Return the cluster CA certificate so clients can trust the API server.
     */
    @GET
    @Path("/ca")
    @Produces(MediaType.TEXT_PLAIN)
    public String ca() {
        return context.caPem();
    }
}
