package kubi.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for Kubi errors.
 *
 * <p>Authentication problems carry a fixed detail so a caller can never tell
 * which check rejected it.
 */
public final class KubiProblem {

    static final String INVALID_CREDENTIALS = "Basic Auth: Invalid credentials";
    static final String INVALID_TOKEN = "Bearer Auth: Invalid token";

    private KubiProblem() {
        // Utility class - prevent instantiation
    }

    public static HttpProblem invalidCredentials() {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(INVALID_CREDENTIALS)
                .build();
    }

    public static HttpProblem invalidToken() {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(INVALID_TOKEN)
                .build();
    }

    public static HttpProblem internalError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }
}
