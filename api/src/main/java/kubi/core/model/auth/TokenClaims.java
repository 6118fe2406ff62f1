package kubi.core.model.auth;

import java.time.Instant;
import java.util.List;

/**
 * Claims carried by a Kubi token.
 *
 * <p>Built through {@link #builder()} so that issuer, expiry and the admin flag
 * are always set by name.
 *
 * @param authorizations namespace grants, in the order the mapper produced them
 * @param subject        the authenticated username
 * @param admin          whether the user has cluster administration access
 * @param issuer         the issuing service, always {@link #ISSUER} for tokens we sign
 * @param issuedAt       when the token was signed
 * @param expiresAt      when the token stops being accepted
 */
public record TokenClaims(
        List<AuthorizationGrant> authorizations,
        String subject,
        boolean admin,
        String issuer,
        Instant issuedAt,
        Instant expiresAt) {

    public static final String ISSUER = "Kubi Server";

    public TokenClaims {
        authorizations = authorizations == null ? List.of() : List.copyOf(authorizations);
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("Issuer cannot be null or blank");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("ExpiresAt cannot be null");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private List<AuthorizationGrant> authorizations = List.of();
        private String subject;
        private boolean admin;
        private String issuer = ISSUER;
        private Instant issuedAt;
        private Instant expiresAt;

        private Builder() {}

        public Builder authorizations(List<AuthorizationGrant> authorizations) {
            this.authorizations = authorizations;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder admin(boolean admin) {
            this.admin = admin;
            return this;
        }

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder issuedAt(Instant issuedAt) {
            this.issuedAt = issuedAt;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public TokenClaims build() {
            return new TokenClaims(authorizations, subject, admin, issuer, issuedAt, expiresAt);
        }
    }
}
