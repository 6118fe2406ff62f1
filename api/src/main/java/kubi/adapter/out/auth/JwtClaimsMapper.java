package kubi.adapter.out.auth;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;

import kubi.core.model.auth.AuthorizationGrant;
import kubi.core.model.auth.NamespaceRole;
import kubi.core.model.auth.TokenClaims;

/**
 * Converts between {@link TokenClaims} and the JWT claim set.
 *
 * <p>Claim names:
 * <ul>
 * <li>{@code auths}: array of {@code {"namespace": ..., "role": ...}}</li>
 * <li>{@code user}: the username (also written to {@code sub})</li>
 * <li>{@code adminAccess}: the admin flag</li>
 * <li>{@code iss}, {@code iat}, {@code exp}: standard claims</li>
 * </ul>
 */
final class JwtClaimsMapper {

    static final String AUTHS_CLAIM = "auths";
    static final String USER_CLAIM = "user";
    static final String ADMIN_ACCESS_CLAIM = "adminAccess";
    static final String NAMESPACE_FIELD = "namespace";
    static final String ROLE_FIELD = "role";

    private JwtClaimsMapper() {}

    static JwtClaims toJwtClaims(TokenClaims claims) {
        final var jwtClaims = new JwtClaims();
        jwtClaims.setIssuer(claims.issuer());
        jwtClaims.setSubject(claims.subject());
        if (claims.issuedAt() != null) {
            jwtClaims.setIssuedAt(NumericDate.fromSeconds(claims.issuedAt().getEpochSecond()));
        }
        jwtClaims.setExpirationTime(NumericDate.fromSeconds(claims.expiresAt().getEpochSecond()));
        jwtClaims.setClaim(USER_CLAIM, claims.subject());
        jwtClaims.setClaim(ADMIN_ACCESS_CLAIM, claims.admin());

        final List<Map<String, Object>> auths = new ArrayList<>();
        for (AuthorizationGrant grant : claims.authorizations()) {
            final Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(NAMESPACE_FIELD, grant.namespace());
            entry.put(ROLE_FIELD, grant.role().wireValue());
            auths.add(entry);
        }
        jwtClaims.setClaim(AUTHS_CLAIM, auths);
        return jwtClaims;
    }

    /**
     * Read verified JWT claims back into {@link TokenClaims}.
     *
     * @throws MalformedClaimException if a claim is missing or has the wrong shape
     */
    static TokenClaims fromJwtClaims(JwtClaims jwtClaims) throws MalformedClaimException {
        final var user = jwtClaims.getStringClaimValue(USER_CLAIM);
        if (user == null || user.isBlank()) {
            throw new MalformedClaimException("Missing " + USER_CLAIM + " claim");
        }
        final var admin = jwtClaims.getClaimValue(ADMIN_ACCESS_CLAIM, Boolean.class);
        final var issuedAt = jwtClaims.getIssuedAt();

        return TokenClaims.builder()
                .authorizations(readGrants(jwtClaims))
                .subject(user)
                .admin(Boolean.TRUE.equals(admin))
                .issuer(jwtClaims.getIssuer())
                .issuedAt(issuedAt == null ? null : Instant.ofEpochSecond(issuedAt.getValue()))
                .expiresAt(Instant.ofEpochSecond(jwtClaims.getExpirationTime().getValue()))
                .build();
    }

    private static List<AuthorizationGrant> readGrants(JwtClaims jwtClaims) throws MalformedClaimException {
        final var raw = jwtClaims.getClaimValue(AUTHS_CLAIM);
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> entries)) {
            throw new MalformedClaimException("Claim " + AUTHS_CLAIM + " is not an array");
        }

        final List<AuthorizationGrant> grants = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?> fields)
                    || !(fields.get(NAMESPACE_FIELD) instanceof String namespace)
                    || !(fields.get(ROLE_FIELD) instanceof String roleName)) {
                throw new MalformedClaimException("Malformed entry in " + AUTHS_CLAIM + " claim");
            }
            final var role = NamespaceRole.fromWireValue(roleName)
                    .orElseThrow(() -> new MalformedClaimException("Unknown role in " + AUTHS_CLAIM + " claim"));
            if (namespace.isBlank()) {
                throw new MalformedClaimException("Blank namespace in " + AUTHS_CLAIM + " claim");
            }
            grants.add(new AuthorizationGrant(namespace, role));
        }
        return grants;
    }
}
