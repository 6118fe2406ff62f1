package kubi.adapter.in.dto;

import java.util.List;

import kubi.core.model.auth.TokenClaims;

/**
 * JSON view of verified token claims.
 *
 * @param user        the token subject
 * @param adminAccess whether the user is a cluster administrator
 * @param auths       the namespace grants
 * @param issuer      the issuing service
 * @param issuedAt    ISO-8601 issue time, null if the token carries none
 * @param expiresAt   ISO-8601 expiry time
 */
public record TokenClaimsResponse(
        String user, boolean adminAccess, List<Grant> auths, String issuer, String issuedAt, String expiresAt) {

    public record Grant(String namespace, String role) {}

    public static TokenClaimsResponse from(TokenClaims claims) {
        return new TokenClaimsResponse(
                claims.subject(),
                claims.admin(),
                claims.authorizations().stream()
                        .map(g -> new Grant(g.namespace(), g.role().wireValue()))
                        .toList(),
                claims.issuer(),
                claims.issuedAt() == null ? null : claims.issuedAt().toString(),
                claims.expiresAt().toString());
    }
}
