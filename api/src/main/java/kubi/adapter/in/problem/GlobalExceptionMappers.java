package kubi.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import kubi.core.model.auth.AuthFailure;
import kubi.core.model.auth.KubiAuthenticationException;
import kubi.core.model.auth.SigningUnavailableException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 *
 * <p>Every per-request authentication failure becomes the same 401. The
 * precise reason only reaches the log.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapAuthenticationFailure(KubiAuthenticationException e) {
        LOG.infov("Request rejected: {0}", e.reason());
        return unauthorized(e.reason());
    }

    @ServerExceptionMapper
    public Response mapSigningUnavailable(SigningUnavailableException e) {
        LOG.errorv(e, "Token signing failed");
        return toResponse(KubiProblem.internalError("Token signing unavailable"));
    }

    @ServerExceptionMapper
    public Response mapIllegalStateException(IllegalStateException e) {
        LOG.errorv(e, "Unexpected state: {0}", e.getMessage());
        return toResponse(KubiProblem.internalError("Unexpected server error"));
    }

    /**
     * Build the 401 response for a failure reason.
     *
     * <p>Token failures get a Bearer challenge, credential failures a Basic one.
     */
    public static Response unauthorized(AuthFailure reason) {
        if (isTokenFailure(reason)) {
            return problemBuilder(KubiProblem.invalidToken())
                    .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer realm=\"kubi\"")
                    .build();
        }
        return problemBuilder(KubiProblem.invalidCredentials())
                .header(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"kubi\"")
                .build();
    }

    private static boolean isTokenFailure(AuthFailure reason) {
        return switch (reason) {
            case MALFORMED_TOKEN, INVALID_SIGNATURE, TOKEN_EXPIRED, MISSING_OR_MALFORMED_BEARER -> true;
            case INVALID_CREDENTIALS_FORMAT, AUTHENTICATION_FAILED, DIRECTORY_UNAVAILABLE -> false;
        };
    }

    private static Response toResponse(HttpProblem problem) {
        return problemBuilder(problem).build();
    }

    private static Response.ResponseBuilder problemBuilder(HttpProblem problem) {
        return Response.status(problem.getStatus()).type(PROBLEM_JSON).entity(problem);
    }
}
